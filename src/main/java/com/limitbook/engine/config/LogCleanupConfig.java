package com.limitbook.engine.config;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Keeps only the newest session log files written by logback-spring.xml.
 */
@Slf4j
@Configuration
public class LogCleanupConfig {

    static final String LOG_FILE_PREFIX = "engine_";
    static final String LOG_FILE_SUFFIX = ".log";

    private final Path logDir;
    private final int maxLogFiles;

    public LogCleanupConfig(@Value("${engine.logging.dir:logs}") String logDir,
                            @Value("${engine.logging.max-session-files:50}") int maxLogFiles) {
        this.logDir = Paths.get(logDir);
        this.maxLogFiles = maxLogFiles;
    }

    @PostConstruct
    public void cleanupOldLogs() {
        if (!Files.exists(logDir)) {
            log.debug("Logs directory does not exist yet: {}", logDir.toAbsolutePath());
            return;
        }

        try (Stream<Path> logFiles = Files.list(logDir)) {
            List<Path> sessionLogs = logFiles
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().startsWith(LOG_FILE_PREFIX))
                    .filter(p -> p.getFileName().toString().endsWith(LOG_FILE_SUFFIX))
                    .sorted(Comparator.comparing(this::getFileLastModified).reversed())
                    .toList();

            if (sessionLogs.size() <= maxLogFiles) {
                log.debug("Session log files count ({}) is within limit ({})", sessionLogs.size(), maxLogFiles);
                return;
            }

            log.info("Found {} session log files, removing {} oldest (keeping {})",
                    sessionLogs.size(), sessionLogs.size() - maxLogFiles, maxLogFiles);
            // Oldest files are at the end of the sorted list
            for (Path oldLog : sessionLogs.subList(maxLogFiles, sessionLogs.size())) {
                try {
                    Files.delete(oldLog);
                    log.debug("Deleted old log file: {}", oldLog.getFileName());
                } catch (IOException e) {
                    log.warn("Failed to delete old log file: {} - {}", oldLog.getFileName(), e.getMessage());
                }
            }
        } catch (IOException e) {
            log.warn("Failed to cleanup old log files in {}: {}", logDir, e.getMessage());
        }
    }

    private long getFileLastModified(Path path) {
        try {
            return Files.getLastModifiedTime(path).toMillis();
        } catch (IOException e) {
            return 0L;
        }
    }
}
