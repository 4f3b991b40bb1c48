package io.jobvisor.internal.process;

import io.jobvisor.JobProcess;
import io.jobvisor.core.JobSpec;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Launches like {@link CommandJobHandler}; a program is alive only while its process runs and
 * {@code options.host:options.port} accepts a TCP connection within {@code options.connectTimeoutMs}.
 */
public class TcpProbeJobHandler extends CommandJobHandler {

    public static final String NAME = "tcp-probe";
    static final String OPTION_HOST = "host";
    static final String OPTION_PORT = "port";
    static final String OPTION_CONNECT_TIMEOUT = "connectTimeoutMs";

    private static final int DEFAULT_CONNECT_TIMEOUT_MS = 2000;

    public TcpProbeJobHandler(Path logDir) {
        super(logDir);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean isAlive(JobSpec spec, JobProcess process) {
        if (!process.isAlive()) {
            return false;
        }
        String host = spec.options().getOrDefault(OPTION_HOST, "localhost").trim();
        int port = Integer.parseInt(spec.options().get(OPTION_PORT).trim());
        int timeout = Integer.parseInt(spec.options().getOrDefault(OPTION_CONNECT_TIMEOUT,
                String.valueOf(DEFAULT_CONNECT_TIMEOUT_MS)).trim());
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), timeout);
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    @Override
    public List<String> validate(JobSpec spec) {
        List<String> problems = new ArrayList<>(super.validate(spec));
        String port = spec.options().get(OPTION_PORT);
        if (port == null) {
            problems.add("job '" + spec.name() + "' uses tcp-probe without options.port");
        } else if (!isIntIn(port, 1, 65535)) {
            problems.add("job '" + spec.name() + "' has invalid options.port '" + port + "'");
        }
        String timeout = spec.options().get(OPTION_CONNECT_TIMEOUT);
        if (timeout != null && !isIntIn(timeout, 1, Integer.MAX_VALUE)) {
            problems.add("job '" + spec.name() + "' has invalid options.connectTimeoutMs '" + timeout + "'");
        }
        return problems;
    }

    private static boolean isIntIn(String value, int min, int max) {
        try {
            int n = Integer.parseInt(value.trim());
            return n >= min && n <= max;
        } catch (NumberFormatException e) {
            return false;
        }
    }
}
