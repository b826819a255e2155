package com.tradecore.recovery;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.model.FlushOutcome;
import com.tradecore.domain.model.StorageInfo;
import com.tradecore.event.EventPublisherHelper;
import com.tradecore.event.SystemEventType;
import com.tradecore.oms.StaleOrderMonitor;
import com.tradecore.repository.DealsRepository;
import com.tradecore.repository.ManagedRepository;
import com.tradecore.repository.OrdersRepository;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.factory.RepositoryFactory;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Runs the startup recovery sequence after the application is ready.
 *
 * <ol>
 *   <li>Instantiate every repository through the factory; write-through repositories load
 *       their durable copy here</li>
 *   <li>Full resync so the durable copy matches memory</li>
 *   <li>Start the stale order monitor</li>
 * </ol>
 *
 * <p>On completion, publishes a SystemEvent with type APPLICATION_READY. Kinds that fell back
 * to the legacy backend, or whose durable copy could not be loaded, are announced with
 * STORAGE_DEGRADED.
 */
@Service
public class StartupRecoveryService {

    private static final Logger log = LoggerFactory.getLogger(StartupRecoveryService.class);

    private final RepositoryFactory repositoryFactory;
    private final StaleOrderMonitor staleOrderMonitor;
    private final EventPublisherHelper eventPublisherHelper;

    private volatile RecoveryResult lastResult;

    public StartupRecoveryService(
            RepositoryFactory repositoryFactory,
            StaleOrderMonitor staleOrderMonitor,
            EventPublisherHelper eventPublisherHelper) {
        this.repositoryFactory = repositoryFactory;
        this.staleOrderMonitor = staleOrderMonitor;
        this.eventPublisherHelper = eventPublisherHelper;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        recover();
    }

    public RecoveryResult recover() {
        log.info("Starting recovery sequence...");
        RecoveryResult result = RecoveryResult.builder().startedAt(System.currentTimeMillis()).build();

        try {
            // Step 1: Load repositories
            loadRepositories(result);

            // Step 2: Initial resync
            Map<RepositoryKind, FlushOutcome> outcomes = repositoryFactory.forceSyncAll();
            result.setSyncOutcomes(outcomes);
            outcomes.forEach((kind, outcome) -> {
                if (!outcome.isSuccess()) {
                    log.warn("Initial resync of {} failed, scheduled resync will retry: {}", kind, outcome.getError());
                }
            });

            // Step 3: Start monitor
            staleOrderMonitor.start();
            result.setMonitorStarted(staleOrderMonitor.isRunning());

            result.setSuccess(true);
            log.info("Recovery sequence completed: orders={}, open={}, deals={}, fallbacks={}",
                    result.getOrdersLoaded(), result.getOpenOrders(), result.getDealsLoaded(), result.getFallbackKinds());
        } catch (Exception e) {
            result.setSuccess(false);
            result.setError(e.getMessage());
            log.error("Recovery sequence failed", e);
        }

        result.setDurationMs(System.currentTimeMillis() - result.getStartedAt());
        lastResult = result;

        eventPublisherHelper.publishSystemEvent(
                this,
                SystemEventType.APPLICATION_READY,
                result.isSuccess() ? "Recovery completed" : "Recovery failed: " + result.getError(),
                Map.of("durationMs", result.getDurationMs(), "ordersLoaded", result.getOrdersLoaded()));
        return result;
    }

    private void loadRepositories(RecoveryResult result) {
        for (RepositoryKind kind : RepositoryKind.values()) {
            repositoryFactory.get(kind);
        }
        OrdersRepository orders = repositoryFactory.orders();
        DealsRepository deals = repositoryFactory.deals();
        result.setOrdersLoaded(orders.count());
        result.setOpenOrders(orders.findOpenOrders().size());
        result.setDealsLoaded(deals.count());

        for (StorageInfo info : repositoryFactory.storageInfo().values()) {
            if (info.getFallbackReason() != null) {
                result.getFallbackKinds().add(info.getKind());
                eventPublisherHelper.publishSystemEvent(
                        this,
                        SystemEventType.STORAGE_DEGRADED,
                        info.getKind() + " fell back to " + info.getActual(),
                        Map.of("kind", info.getKind().name(), "reason", info.getFallbackReason()));
            }
        }

        for (ManagedRepository repository : repositoryFactory.instantiated()) {
            if (repository instanceof WriteThroughRepository
                    && ((WriteThroughRepository) repository).syncStatistics().isLoadPending()) {
                String reason = ((WriteThroughRepository) repository).syncStatistics().getLastError();
                result.getLoadPendingKinds().add(repository.kind());
                eventPublisherHelper.publishSystemEvent(
                        this,
                        SystemEventType.STORAGE_DEGRADED,
                        repository.kind() + " started empty, durable copy not loaded",
                        Map.of("kind", repository.kind().name(), "reason", String.valueOf(reason)));
            }
        }
    }

    public RecoveryResult getLastResult() {
        return lastResult;
    }
}
