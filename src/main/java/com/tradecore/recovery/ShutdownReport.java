package com.tradecore.recovery;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.model.FlushOutcome;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of the shutdown sequence. A failed step is listed in {@code stepErrors}; later steps
 * still ran.
 */
@Data
@Builder
public class ShutdownReport {

    private long startedAt;
    private long durationMs;

    private boolean monitorStopped;
    private boolean ingestionStopped;

    /** False if write-through tasks were still in flight when the await timed out. */
    private boolean pendingSyncsDrained;

    @Builder.Default
    private Map<RepositoryKind, FlushOutcome> syncOutcomes = new EnumMap<>(RepositoryKind.class);

    @Builder.Default
    private Map<RepositoryKind, FlushOutcome> dumpOutcomes = new EnumMap<>(RepositoryKind.class);

    @Builder.Default
    private List<String> stepErrors = new ArrayList<>();

    public boolean isSuccess() {
        return stepErrors.isEmpty()
                && syncOutcomes.values().stream().allMatch(FlushOutcome::isSuccess)
                && dumpOutcomes.values().stream().allMatch(FlushOutcome::isSuccess);
    }
}
