package com.tradecore.domain.model;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;

/** Result of one batch dump. {@code path} is null when the buffer was empty and nothing was written. */
@Value
@Builder
public class DumpResult {

    Path path;
    long recordCount;
    long durationMs;

    public static DumpResult empty() {
        return DumpResult.builder().recordCount(0).build();
    }

    public boolean isEmpty() {
        return path == null;
    }
}
