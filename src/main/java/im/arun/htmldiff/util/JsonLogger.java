package im.arun.htmldiff.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Session log that accumulates entries and rewrites them as one JSON array on every event.
 * Write failures are reported through SLF4J and otherwise ignored.
 */
public class JsonLogger {
    private static final Logger systemLogger = LoggerFactory.getLogger(JsonLogger.class);
    private final Path logPath;
    private final List<Map<String, Object>> logData = new ArrayList<>();
    private final ObjectMapper objectMapper;

    public JsonLogger(Path logDirectory, String sessionName) {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);

        String timestamp = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss"));
        String logFileName = String.format("%s_%s.json", sanitize(sessionName), timestamp);

        try {
            Files.createDirectories(logDirectory);
        } catch (IOException e) {
            systemLogger.error("Failed to create log directory {}", logDirectory, e);
        }

        this.logPath = logDirectory.resolve(logFileName);
    }

    private static String sanitize(String sessionName) {
        if (sessionName == null || sessionName.isBlank()) {
            return "session";
        }

        String name = sessionName;
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }

        return name.replaceAll("[^A-Za-z0-9_.-]", "-");
    }

    public void info(String message) {
        log("INFO", message, Map.of());
    }

    public void info(String message, Map<String, ?> details) {
        log("INFO", message, details);
    }

    public void warn(String message) {
        log("WARNING", message, Map.of());
    }

    public void error(String message, Map<String, ?> details) {
        log("ERROR", message, details);
    }

    private synchronized void log(String level, String message, Map<String, ?> details) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("level", level);
        entry.put("message", message);
        if (details != null && !details.isEmpty()) {
            entry.put("details", new LinkedHashMap<>(details));
        }
        logData.add(entry);

        writeToFile();
    }

    private void writeToFile() {
        try {
            objectMapper.writeValue(logPath.toFile(), logData);
        } catch (IOException e) {
            systemLogger.error("Failed to write log file: {}", logPath, e);
        }
    }

    public synchronized List<Map<String, Object>> getEntries() {
        return Collections.unmodifiableList(new ArrayList<>(logData));
    }

    public Path getLogPath() {
        return logPath;
    }
}
