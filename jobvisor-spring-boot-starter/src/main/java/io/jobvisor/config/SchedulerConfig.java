package io.jobvisor.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobvisor.JobHandler;
import io.jobvisor.JobNotifier;
import io.jobvisor.Scheduler;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.ScheduleSource;
import io.jobvisor.core.StatusStore;
import io.jobvisor.internal.DefaultScheduler;
import io.jobvisor.internal.LoggingJobNotifier;
import io.jobvisor.internal.ScheduleLoader;
import io.jobvisor.internal.mongo.MongoStatusStore;
import io.jobvisor.internal.process.BuiltInHandlers;
import io.jobvisor.internal.store.InMemoryStatusStore;
import io.jobvisor.internal.store.JsonFileStatusStore;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Spring Boot auto-configuration entrypoint for jobvisor components.
 */
@AutoConfiguration
@ConditionalOnClass(Scheduler.class)
@EnableConfigurationProperties
@ConditionalOnProperty(prefix = "jobvisor", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulerConfig {

    @Bean
    @ConditionalOnMissingBean
    @ConfigurationProperties(prefix = "jobvisor")
    public SchedulerProperties schedulerProperties() {
        return new SchedulerProperties();
    }

    /**
     * Application {@link JobHandler} beans plus the built-in handlers they do not override by name.
     */
    @Bean
    @ConditionalOnMissingBean
    public JobHandlerRegistry jobHandlerRegistry(SchedulerProperties props, ObjectProvider<List<JobHandler>> handlersProvider) {
        List<JobHandler> handlers = new ArrayList<>(handlersProvider.getIfAvailable(List::of));
        Set<String> custom = handlers.stream().map(JobHandler::name).collect(Collectors.toSet());
        for (JobHandler builtIn : BuiltInHandlers.create(props.getLogDir())) {
            if (!custom.contains(builtIn.name())) {
                handlers.add(builtIn);
            }
        }
        return new JobHandlerRegistry(handlers);
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleSource scheduleSource(SchedulerProperties props, JobHandlerRegistry registry, ObjectProvider<ObjectMapper> objectMapper) {
        return new ScheduleLoader(props.getScheduleFile(), props.getDefaultZone(), registry,
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusStore statusStore(SchedulerProperties props, ObjectProvider<ObjectMapper> objectMapper) {
        return switch (props.getStatusStore()) {
            case MEMORY -> new InMemoryStatusStore();
            case FILE -> new JsonFileStatusStore(props.getStatusDir(), objectMapper.getIfAvailable(ObjectMapper::new));
            case MONGO -> throw new IllegalStateException(
                    "jobvisor.status-store=mongo requires jobvisor-mongo on the classpath and a MongoTemplate bean");
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobNotifier jobNotifier() {
        return new LoggingJobNotifier();
    }

    @Bean
    @ConditionalOnMissingBean
    public Scheduler scheduler(SchedulerProperties props,
                               ScheduleSource source,
                               StatusStore store,
                               JobHandlerRegistry registry,
                               JobNotifier notifier) {
        return new DefaultScheduler(props, source, store, registry, notifier);
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerLifecycle schedulerLifecycle(Scheduler scheduler) {
        return new SchedulerLifecycle(scheduler);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass({MongoTemplate.class, MongoStatusStore.class})
    @ConditionalOnProperty(prefix = "jobvisor", name = "status-store", havingValue = "mongo")
    static class MongoStatusStoreConfig {

        @Bean
        @ConditionalOnMissingBean(StatusStore.class)
        @ConditionalOnBean(MongoTemplate.class)
        public MongoStatusStore mongoStatusStore(MongoTemplate mongoTemplate) {
            return new MongoStatusStore(mongoTemplate);
        }

        @Bean
        @ConditionalOnMissingBean
        @ConditionalOnBean(MongoTemplate.class)
        public StatusMongoIndexConfig statusMongoIndexConfig(MongoTemplate mongoTemplate) {
            return new StatusMongoIndexConfig(mongoTemplate);
        }

        @Bean
        @ConditionalOnProperty(prefix = "jobvisor", name = "ensure-indexes-on-startup", havingValue = "true")
        public SmartInitializingSingleton statusIndexesInitializer(StatusMongoIndexConfig indexConfig) {
            return indexConfig::ensureIndexes;
        }
    }
}
