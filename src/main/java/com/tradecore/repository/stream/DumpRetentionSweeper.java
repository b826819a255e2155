package com.tradecore.repository.stream;

import com.tradecore.config.StorageProperties;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes batch files older than the configured retention. Works on files only; buffered
 * observations are never touched.
 */
@Component
public class DumpRetentionSweeper {

    private static final Logger log = LoggerFactory.getLogger(DumpRetentionSweeper.class);

    private final StorageProperties storageProperties;

    public DumpRetentionSweeper(StorageProperties storageProperties) {
        this.storageProperties = storageProperties;
    }

    /** Runs hourly; files are at most an hour past their retention when removed. */
    @Scheduled(fixedDelay = 3_600_000, initialDelay = 60_000)
    public void sweepExpired() {
        StorageProperties.Streaming streaming = storageProperties.getStreaming();
        Instant cutoff = Instant.now().minus(Duration.ofDays(streaming.getRetentionDays()));
        try {
            int deleted = sweep(Paths.get(streaming.getDumpDirectory()), cutoff);
            if (deleted > 0) {
                log.info("Retention sweep deleted {} batch files older than {} days", deleted, streaming.getRetentionDays());
            }
        } catch (IOException e) {
            log.error("Retention sweep of {} failed", streaming.getDumpDirectory(), e);
        }
    }

    /**
     * Deletes batch files under {@code root} last modified before {@code cutoff}.
     *
     * @return number of files deleted
     */
    public int sweep(Path root, Instant cutoff) throws IOException {
        if (!Files.isDirectory(root)) {
            return 0;
        }
        List<Path> candidates;
        try (Stream<Path> files = Files.walk(root)) {
            candidates = files.filter(Files::isRegularFile)
                    .filter(file -> file.getFileName().toString().endsWith(BatchFileFormat.FILE_EXTENSION))
                    .collect(Collectors.toList());
        }
        int deleted = 0;
        for (Path file : candidates) {
            try {
                if (Files.getLastModifiedTime(file).toInstant().isBefore(cutoff)) {
                    Files.deleteIfExists(file);
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete expired batch file {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }
}
