package io.jobvisor.internal.process;

import io.jobvisor.JobHandler;

import java.nio.file.Path;
import java.util.List;

public final class BuiltInHandlers {
    private BuiltInHandlers() {
    }

    /**
     * The {@code command} and {@code tcp-probe} handlers, logging children under {@code logDir}.
     */
    public static List<JobHandler> create(Path logDir) {
        return List.of(new CommandJobHandler(logDir), new TcpProbeJobHandler(logDir));
    }
}
