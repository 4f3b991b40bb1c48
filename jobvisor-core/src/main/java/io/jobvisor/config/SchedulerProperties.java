package io.jobvisor.config;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;

/**
 * Runtime configuration for scheduler behavior.
 */
public class SchedulerProperties {

    /**
     * Where job statuses are kept.
     */
    public enum StatusStoreType {
        FILE, MEMORY, MONGO
    }

    private boolean enabled = true;
    private Path scheduleFile = Path.of("schedule.json");
    private Path statusDir = Path.of("status");
    private Path logDir = Path.of("logs");
    private StatusStoreType statusStore = StatusStoreType.FILE;
    private Duration tickInterval = Duration.ofSeconds(1);
    private Duration probeTimeout = Duration.ofSeconds(10);
    private Duration stopGracePeriod = Duration.ofSeconds(10);
    private int workerThreads = 8; // task runs + probes
    private ZoneId defaultZone = ZoneId.systemDefault();
    private boolean stopProgramsOnShutdown = false;
    private boolean ensureIndexesOnStartup = false;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Path getScheduleFile() {
        return scheduleFile;
    }

    public void setScheduleFile(Path scheduleFile) {
        this.scheduleFile = scheduleFile;
    }

    public Path getStatusDir() {
        return statusDir;
    }

    public void setStatusDir(Path statusDir) {
        this.statusDir = statusDir;
    }

    public Path getLogDir() {
        return logDir;
    }

    public void setLogDir(Path logDir) {
        this.logDir = logDir;
    }

    public StatusStoreType getStatusStore() {
        return statusStore;
    }

    public void setStatusStore(StatusStoreType statusStore) {
        this.statusStore = statusStore;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public void setTickInterval(Duration tickInterval) {
        this.tickInterval = tickInterval;
    }

    public Duration getProbeTimeout() {
        return probeTimeout;
    }

    public void setProbeTimeout(Duration probeTimeout) {
        this.probeTimeout = probeTimeout;
    }

    public Duration getStopGracePeriod() {
        return stopGracePeriod;
    }

    public void setStopGracePeriod(Duration stopGracePeriod) {
        this.stopGracePeriod = stopGracePeriod;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public void setWorkerThreads(int workerThreads) {
        this.workerThreads = workerThreads;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    public void setDefaultZone(ZoneId defaultZone) {
        this.defaultZone = defaultZone;
    }

    public boolean isStopProgramsOnShutdown() {
        return stopProgramsOnShutdown;
    }

    public void setStopProgramsOnShutdown(boolean stopProgramsOnShutdown) {
        this.stopProgramsOnShutdown = stopProgramsOnShutdown;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }
}
