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
 * Captures the outcome of the startup recovery sequence.
 */
@Data
@Builder
public class RecoveryResult {

    private boolean success;
    private long startedAt;
    private long durationMs;
    private String error;

    // Step 1: repositories loaded from their durable tier
    private int ordersLoaded;
    private int dealsLoaded;
    private int openOrders;

    /** Kinds running on the legacy backend although another was configured. */
    @Builder.Default
    private List<RepositoryKind> fallbackKinds = new ArrayList<>();

    /** Write-through kinds that started empty because their durable copy could not be read. */
    @Builder.Default
    private List<RepositoryKind> loadPendingKinds = new ArrayList<>();

    // Step 2: initial resync
    @Builder.Default
    private Map<RepositoryKind, FlushOutcome> syncOutcomes = new EnumMap<>(RepositoryKind.class);

    // Step 3: monitor
    private boolean monitorStarted;
}
