package io.jobvisor.internal.mongo;

import io.jobvisor.core.JobState;
import io.jobvisor.core.JobStatus;
import io.jobvisor.core.StatusStore;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB persistence layer for job statuses: one document per job, replaced whole on every write.
 */
public class MongoStatusStore implements StatusStore {

    private final MongoTemplate mongoTemplate;

    public MongoStatusStore(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    /**
     * Upsert by name. A single-document replace is atomic for concurrent readers.
     */
    @Override
    public void write(JobStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        mongoTemplate.save(StatusDocument.from(status));
    }

    @Override
    public Optional<JobStatus> read(String name) {
        return Optional.ofNullable(mongoTemplate.findById(name, StatusDocument.class))
                .map(StatusDocument::toStatus);
    }

    @Override
    public Map<String, JobStatus> readAll() {
        Map<String, JobStatus> statuses = new LinkedHashMap<>();
        for (StatusDocument doc : mongoTemplate.findAll(StatusDocument.class)) {
            statuses.put(doc.getName(), doc.toStatus());
        }
        return statuses;
    }

    @Override
    public void delete(String name) {
        mongoTemplate.remove(byName(name), StatusDocument.class);
    }

    /**
     * Jobs currently in {@code state}, most recently updated first.
     */
    public List<JobStatus> findByState(JobState state) {
        Objects.requireNonNull(state, "state must not be null");
        Query query = new Query(Criteria.where("state").is(state))
                .with(Sort.by(Sort.Direction.DESC, "updatedAt"));
        return mongoTemplate.find(query, StatusDocument.class).stream()
                .map(StatusDocument::toStatus)
                .toList();
    }

    private static Query byName(String name) {
        return new Query(Criteria.where("_id").is(name));
    }
}
