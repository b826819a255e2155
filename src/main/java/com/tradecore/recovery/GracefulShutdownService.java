package com.tradecore.recovery;

import com.tradecore.config.ShutdownConfig;
import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.model.FlushOutcome;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.event.SystemEventType;
import com.tradecore.oms.StaleOrderMonitor;
import com.tradecore.repository.ManagedRepository;
import com.tradecore.repository.OrdersRepository;
import com.tradecore.repository.StreamingRepository;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.factory.RepositoryFactory;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Service;

/**
 * Ensures orderly shutdown: stop producers, drain write-through, flush both tiers.
 *
 * <p>Implements {@link SmartLifecycle} with a high phase value so it runs BEFORE other
 * Spring components shut down. The shutdown sequence:
 * <ol>
 *   <li>Stop the stale order monitor</li>
 *   <li>Stop streaming repositories from accepting observations</li>
 *   <li>Wait for in-flight write-through tasks ({@code sync-await-timeout})</li>
 *   <li>Full resync of every write-through repository ({@code flush-timeout})</li>
 *   <li>Dump every streaming buffer to a batch file</li>
 *   <li>Log final per-repository statistics</li>
 * </ol>
 *
 * <p>Each step is guarded: a failure is logged, recorded in the {@link ShutdownReport} and the
 * next step still runs.
 */
@Service
public class GracefulShutdownService implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownService.class);

    private final RepositoryFactory repositoryFactory;
    private final StaleOrderMonitor staleOrderMonitor;
    private final ShutdownConfig shutdownConfig;
    private final EventPublisherHelper eventPublisherHelper;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile ShutdownReport lastReport;

    public GracefulShutdownService(
            RepositoryFactory repositoryFactory,
            StaleOrderMonitor staleOrderMonitor,
            ShutdownConfig shutdownConfig,
            EventPublisherHelper eventPublisherHelper) {
        this.repositoryFactory = repositoryFactory;
        this.staleOrderMonitor = staleOrderMonitor;
        this.shutdownConfig = shutdownConfig;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @Override
    public void start() {
        running.set(true);
        log.info("GracefulShutdownService started");
    }

    @Override
    public void stop() {
        try {
            shutdown();
        } finally {
            running.set(false);
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    @Override
    public int getPhase() {
        // Higher phase stops earlier
        return Integer.MAX_VALUE - 1;
    }

    @Override
    public boolean isAutoStartup() {
        return true;
    }

    /** Runs the shutdown sequence and returns what happened in each step. */
    public ShutdownReport shutdown() {
        log.info("Graceful shutdown initiated...");
        ShutdownReport report = ShutdownReport.builder().startedAt(System.currentTimeMillis()).build();

        // Step 1: Stop monitor ticks
        try {
            staleOrderMonitor.stop();
            report.setMonitorStopped(true);
        } catch (Exception e) {
            stepFailed(report, "stop monitor", e);
        }

        // Step 2: Stop streaming ingestion
        try {
            repositoryFactory.stopIngestion();
            report.setIngestionStopped(true);
        } catch (Exception e) {
            stepFailed(report, "stop ingestion", e);
        }

        // Step 3: Drain write-through tasks
        try {
            boolean drained = repositoryFactory.awaitPendingSyncs(shutdownConfig.getSyncAwaitTimeout());
            report.setPendingSyncsDrained(drained);
            if (!drained) {
                log.warn("Write-through tasks still pending after {}, final resync covers them",
                        shutdownConfig.getSyncAwaitTimeout());
            }
        } catch (Exception e) {
            stepFailed(report, "await pending syncs", e);
        }

        // Step 4: Final full resync
        try {
            report.setSyncOutcomes(forceSyncAll(shutdownConfig.getFlushTimeout()));
        } catch (Exception e) {
            stepFailed(report, "force sync", e);
        }

        // Step 5: Dump streaming buffers
        try {
            report.setDumpOutcomes(repositoryFactory.forceDumpAll());
        } catch (Exception e) {
            stepFailed(report, "force dump", e);
        }

        // Step 6: Final statistics
        try {
            logFinalStatistics();
        } catch (Exception e) {
            stepFailed(report, "final statistics", e);
        }

        report.setDurationMs(System.currentTimeMillis() - report.getStartedAt());
        lastReport = report;
        if (report.isSuccess()) {
            log.info("Graceful shutdown completed successfully in {}ms", report.getDurationMs());
        } else {
            log.warn("Graceful shutdown completed with errors in {}ms: steps={}, sync={}, dump={}",
                    report.getDurationMs(), report.getStepErrors(), report.getSyncOutcomes(), report.getDumpOutcomes());
        }
        try {
            eventPublisherHelper.publishSystemEvent(
                    this,
                    SystemEventType.SHUTDOWN_COMPLETED,
                    report.isSuccess() ? "Shutdown completed" : "Shutdown completed with errors",
                    Map.of("durationMs", report.getDurationMs(), "stepErrors", report.getStepErrors().size()));
        } catch (Exception e) {
            log.debug("Shutdown event not delivered: {}", e.getMessage());
        }
        return report;
    }

    private Map<RepositoryKind, FlushOutcome> forceSyncAll(Duration timeout) throws Exception {
        CompletableFuture<Map<RepositoryKind, FlushOutcome>> sync =
                CompletableFuture.supplyAsync(repositoryFactory::forceSyncAll);
        try {
            return sync.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new TimeoutException("Final resync did not finish within " + timeout);
        } catch (ExecutionException e) {
            throw e.getCause() instanceof Exception ? (Exception) e.getCause() : e;
        }
    }

    private void logFinalStatistics() {
        for (ManagedRepository repository : repositoryFactory.instantiated()) {
            if (repository instanceof WriteThroughRepository) {
                log.info("Final {} sync statistics: {}",
                        repository.kind(), ((WriteThroughRepository) repository).syncStatistics());
            }
            if (repository instanceof OrdersRepository) {
                log.info("Final {} statistics: {}", repository.kind(), ((OrdersRepository) repository).statistics());
            }
            if (repository instanceof StreamingRepository) {
                log.info("Final {} statistics: {}",
                        repository.kind(), ((StreamingRepository<?>) repository).statistics());
            }
        }
        log.info("Final monitor statistics: {}", staleOrderMonitor.statistics());
    }

    private void stepFailed(ShutdownReport report, String step, Exception e) {
        if (e instanceof InterruptedException) {
            Thread.currentThread().interrupt();
        }
        report.getStepErrors().add(step + ": " + e.getClass().getSimpleName() + ": " + e.getMessage());
        log.error("Shutdown step '{}' failed, continuing", step, e);
    }

    public ShutdownReport getLastReport() {
        return lastReport;
    }
}
