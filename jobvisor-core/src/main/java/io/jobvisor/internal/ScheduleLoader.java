package io.jobvisor.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.jobvisor.JobHandler;
import io.jobvisor.core.ConfigException;
import io.jobvisor.core.JobHandlerRegistry;
import io.jobvisor.core.JobKind;
import io.jobvisor.core.JobSpec;
import io.jobvisor.core.ScheduleGraph;
import io.jobvisor.core.ScheduleSource;
import io.jobvisor.core.TimeOfDay;
import io.jobvisor.utils.IntervalParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Reads the JSON schedule file:
 * <pre>{@code
 * { "schedules": [
 *   { "type": "program", "name": "mongo", "command": ["mongod", "--dbpath", "/data"],
 *     "keep_alive": true, "check_alive_freq": "1 m", "max_retries": 3 },
 *   { "type": "task", "name": "update-prices", "main_path": "/opt/jobs/update.py",
 *     "interpreter": "python3", "start": "12:45 am pst", "freq": "1 h",
 *     "run_on_complete": ["update-fx-data"] }
 * ]}
 * }</pre>
 * Every problem in the file is collected and reported in a single {@link ConfigException}.
 */
public class ScheduleLoader implements ScheduleSource {
    private static final Logger log = LoggerFactory.getLogger(ScheduleLoader.class);

    private static final Pattern NAME = Pattern.compile("[A-Za-z0-9._-]+");

    private final Path scheduleFile;
    private final ZoneId defaultZone;
    private final JobHandlerRegistry handlers;
    private final ObjectMapper objectMapper;
    private final ObjectMapper canonicalMapper;

    public ScheduleLoader(Path scheduleFile, ZoneId defaultZone, JobHandlerRegistry handlers) {
        this(scheduleFile, defaultZone, handlers, new ObjectMapper());
    }

    public ScheduleLoader(Path scheduleFile, ZoneId defaultZone, JobHandlerRegistry handlers, ObjectMapper objectMapper) {
        this.scheduleFile = Objects.requireNonNull(scheduleFile, "scheduleFile must not be null");
        this.defaultZone = Objects.requireNonNull(defaultZone, "defaultZone must not be null");
        this.handlers = Objects.requireNonNull(handlers, "handlers must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.canonicalMapper = objectMapper.copy().enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);
    }

    @Override
    public ScheduleGraph load() {
        JsonNode root;
        try {
            root = objectMapper.readTree(scheduleFile.toFile());
        } catch (IOException e) {
            throw new ConfigException("cannot read schedule file " + scheduleFile + ": " + e.getMessage(), e);
        }
        ScheduleGraph graph = parse(root);
        log.debug("jobvisor schedule parsed file={} jobs={} digest={}", scheduleFile, graph.size(), graph.digest());
        return graph;
    }

    /**
     * Validate a parsed schedule document and build its graph.
     */
    public ScheduleGraph parse(JsonNode root) {
        if (root == null || !root.path("schedules").isArray()) {
            throw new ConfigException("schedule must be an object with a 'schedules' array");
        }
        JsonNode schedules = root.get("schedules");

        List<String> problems = new ArrayList<>();
        List<JobSpec> specs = new ArrayList<>();
        int index = 0;
        for (JsonNode node : schedules) {
            JobSpec spec = parseEntry(node, index++, problems);
            if (spec != null) {
                specs.add(spec);
            }
        }

        String digest = digest(schedules);
        try {
            ScheduleGraph graph = ScheduleGraph.of(specs, digest);
            if (problems.isEmpty()) {
                return graph;
            }
        } catch (ConfigException e) {
            problems.addAll(e.problems());
        }
        throw new ConfigException(problems);
    }

    private JobSpec parseEntry(JsonNode node, int index, List<String> problems) {
        if (!node.isObject()) {
            problems.add("schedules[" + index + "] is not an object");
            return null;
        }
        int before = problems.size();

        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            problems.add("schedules[" + index + "] has no name");
            return null;
        }
        if (!NAME.matcher(name).matches()) {
            problems.add("job '" + name + "' has an invalid name; use letters, digits, '.', '_' or '-'");
        }
        String where = "job '" + name + "'";

        JobKind kind;
        try {
            kind = JobKind.fromType(text(node, "type"));
        } catch (IllegalArgumentException e) {
            problems.add(where + ": " + e.getMessage());
            return null;
        }

        JobSpec.Builder b = kind == JobKind.PROGRAM ? JobSpec.program(name) : JobSpec.task(name);

        String handlerName = text(node, "handler");
        if (handlerName != null) {
            b.handler(handlerName);
        }
        b.command(command(node, where, problems));
        b.options(options(node, where, problems));

        String logPath = text(node, "log_path");
        if (logPath != null) {
            b.logFile(Path.of(logPath));
        }

        b.timeout(parse(node, where, problems, IntervalParser::parseFrequency, "timeout"));
        b.keepAlive(bool(node, where, problems, false, "keep_alive"));
        b.runOnStart(bool(node, where, problems, true, "run_on_start"));
        Duration checkInterval = parse(node, where, problems, IntervalParser::parseFrequency, "check_alive_freq", "check_interval");
        if (checkInterval != null) {
            b.checkInterval(checkInterval);
        }

        JsonNode retries = first(node, "max_retries");
        if (retries != null) {
            if (!retries.canConvertToInt() || retries.asInt() < 0) {
                problems.add(where + ": max_retries must be a non-negative integer");
            } else {
                b.maxRetries(retries.asInt());
            }
        }

        Function<String, TimeOfDay> time = s -> IntervalParser.parseTimeOfDay(s, defaultZone);
        TimeOfDay start = parse(node, where, problems, time, "start_time", "start");
        TimeOfDay stop = parse(node, where, problems, time, "end_time", "end", "stop");
        Duration frequency = parse(node, where, problems, IntervalParser::parseFrequency, "freq", "frequency");
        b.startTime(start).stopTime(stop).frequency(frequency);

        if (frequency != null && start == null) {
            problems.add(where + ": freq requires a start time");
        }
        if (kind == JobKind.TASK && start != null && stop != null && !stop.time().isAfter(start.time())) {
            problems.add(where + ": stop time must be after start time");
        }

        JsonNode days = first(node, "days");
        if (days != null) {
            try {
                b.days(IntervalParser.parseDays(strings(days)));
            } catch (IllegalArgumentException e) {
                problems.add(where + ": " + e.getMessage());
            }
        }

        JsonNode dependents = first(node, "run_on_complete");
        if (dependents != null) {
            b.runOnComplete(strings(dependents));
        }

        if (problems.size() > before) {
            return null;
        }
        JobSpec spec = b.build();

        if (!handlers.contains(spec.handler())) {
            problems.add(where + ": unknown handler '" + spec.handler() + "'; registered " + handlers.names());
            return null;
        }
        JobHandler handler = handlers.getRequired(spec.handler());
        List<String> handlerProblems = handler.validate(spec);
        if (!handlerProblems.isEmpty()) {
            problems.addAll(handlerProblems);
            return null;
        }
        return spec;
    }

    private List<String> command(JsonNode node, String where, List<String> problems) {
        JsonNode command = first(node, "command");
        if (command != null) {
            if (command.isArray()) {
                return strings(command);
            }
            if (command.isTextual()) {
                return Arrays.stream(command.asText().trim().split("\\s+"))
                        .filter(s -> !s.isEmpty())
                        .toList();
            }
            problems.add(where + ": command must be a string or an array of strings");
            return List.of();
        }
        String mainPath = text(node, "main_path");
        if (mainPath == null) {
            return List.of();
        }
        String interpreter = text(node, "interpreter");
        return interpreter == null ? List.of(mainPath) : List.of(interpreter, mainPath);
    }

    private static Map<String, String> options(JsonNode node, String where, List<String> problems) {
        JsonNode options = first(node, "options");
        Map<String, String> result = new LinkedHashMap<>();
        if (options == null) {
            return result;
        }
        if (!options.isObject()) {
            problems.add(where + ": options must be an object");
            return result;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = options.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getValue().isValueNode()) {
                problems.add(where + ": option '" + field.getKey() + "' must be a scalar");
                continue;
            }
            result.put(field.getKey(), field.getValue().asText());
        }
        return result;
    }

    private static <T> T parse(JsonNode node, String where, List<String> problems, Function<String, T> parser, String... keys) {
        String raw = text(node, keys);
        if (raw == null) {
            return null;
        }
        try {
            return parser.apply(raw);
        } catch (IllegalArgumentException e) {
            problems.add(where + ": " + e.getMessage());
            return null;
        }
    }

    private static boolean bool(JsonNode node, String where, List<String> problems, boolean fallback, String key) {
        JsonNode value = first(node, key);
        if (value == null) {
            return fallback;
        }
        if (!value.isBoolean()) {
            problems.add(where + ": " + key + " must be true or false");
            return fallback;
        }
        return value.asBoolean();
    }

    private static String text(JsonNode node, String... keys) {
        JsonNode value = first(node, keys);
        return value == null ? null : value.asText();
    }

    private static JsonNode first(JsonNode node, String... keys) {
        for (String key : keys) {
            JsonNode value = node.get(key);
            if (value != null && !value.isNull()) {
                return value;
            }
        }
        return null;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(v -> values.add(v.asText()));
        } else {
            values.add(node.asText());
        }
        return values;
    }

    private String digest(JsonNode schedules) {
        try {
            Object canonical = canonicalMapper.treeToValue(schedules, Object.class);
            byte[] bytes = canonicalMapper.writeValueAsBytes(canonical);
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(bytes));
        } catch (JsonProcessingException e) {
            throw new ConfigException("cannot serialize schedule: " + e.getMessage(), e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return "ScheduleLoader{" + scheduleFile + "}";
    }
}
