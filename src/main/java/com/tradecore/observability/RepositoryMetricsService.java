package com.tradecore.observability;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.model.MonitorStatistics;
import com.tradecore.domain.model.StreamStatistics;
import com.tradecore.domain.model.SyncStatistics;
import com.tradecore.event.OrderEvent;
import com.tradecore.event.OrderEventType;
import com.tradecore.oms.StaleOrderMonitor;
import com.tradecore.repository.EntityRepository;
import com.tradecore.repository.StreamingRepository;
import com.tradecore.repository.WriteThroughRepository;
import com.tradecore.repository.factory.RepositoryFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.ToDoubleFunction;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

/**
 * Registers Micrometer metrics over the repositories and the stale order monitor.
 *
 * <ul>
 *   <li><b>tradecore.repository.rows</b> (gauge, tag kind): rows or buffered records held in memory</li>
 *   <li><b>tradecore.sync.pending / dropped / failed</b> (gauges, tag kind): write-through counters</li>
 *   <li><b>tradecore.sync.dirty</b> (gauge 0/1, tag kind): a resync is owed</li>
 *   <li><b>tradecore.stream.memory.bytes / memory.percent</b> (gauges, tag kind)</li>
 *   <li><b>tradecore.stream.evicted / dumps</b> (gauges, tag kind)</li>
 *   <li><b>tradecore.monitor.*</b> (gauges): monitor statistics</li>
 *   <li><b>tradecore.monitor.events</b> (counter, tag type): order events published by the monitor</li>
 * </ul>
 *
 * <p>Gauges are evaluated at scrape time. A kind that has not been constructed yet reports 0;
 * scraping never constructs a repository.
 */
@Service
public class RepositoryMetricsService {

    private final RepositoryFactory repositoryFactory;
    private final Map<OrderEventType, Counter> orderEventCounters = new EnumMap<>(OrderEventType.class);

    public RepositoryMetricsService(
            MeterRegistry meterRegistry, RepositoryFactory repositoryFactory, StaleOrderMonitor staleOrderMonitor) {
        this.repositoryFactory = repositoryFactory;

        for (RepositoryKind kind : RepositoryKind.values()) {
            String tag = kind.name().toLowerCase();
            gauge(meterRegistry, "tradecore.repository.rows", tag, "Rows or buffered records in memory",
                    k -> rows(kind));
            if (kind.isStreaming()) {
                gauge(meterRegistry, "tradecore.stream.memory.bytes", tag, "Estimated buffered bytes",
                        k -> stream(kind, s -> s.getMemoryUsage().getEstimatedBytes()));
                gauge(meterRegistry, "tradecore.stream.memory.percent", tag, "Buffer usage against the hard limit",
                        k -> stream(kind, s -> s.getMemoryUsage().getPercentOfLimit()));
                gauge(meterRegistry, "tradecore.stream.evicted", tag, "Records evicted over the memory limit",
                        k -> stream(kind, StreamStatistics::getEvicted));
                gauge(meterRegistry, "tradecore.stream.dumps", tag, "Batch files written",
                        k -> stream(kind, StreamStatistics::getDumps));
            } else {
                gauge(meterRegistry, "tradecore.sync.pending", tag, "Write-through tasks in flight",
                        k -> sync(kind, SyncStatistics::getPending));
                gauge(meterRegistry, "tradecore.sync.dropped", tag, "Write-through tasks dropped by a full pool",
                        k -> sync(kind, SyncStatistics::getDropped));
                gauge(meterRegistry, "tradecore.sync.failed", tag, "Failed durable writes",
                        k -> sync(kind, SyncStatistics::getFailed));
                gauge(meterRegistry, "tradecore.sync.dirty", tag, "1 while a full resync is owed",
                        k -> repositoryFactory.existing(kind)
                                .filter(WriteThroughRepository.class::isInstance)
                                .map(r -> ((WriteThroughRepository) r).isDirty() ? 1.0 : 0.0)
                                .orElse(0.0));
            }
        }

        monitorGauge(meterRegistry, staleOrderMonitor, "tradecore.monitor.stale.found", MonitorStatistics::getStaleOrdersFound);
        monitorGauge(meterRegistry, staleOrderMonitor, "tradecore.monitor.recreated", MonitorStatistics::getOrdersRecreated);
        monitorGauge(meterRegistry, staleOrderMonitor, "tradecore.monitor.recreation.failures",
                MonitorStatistics::getRecreationFailures);
        monitorGauge(meterRegistry, staleOrderMonitor, "tradecore.monitor.ambiguous",
                MonitorStatistics::getAmbiguousOutcomes);

        for (OrderEventType type : OrderEventType.values()) {
            orderEventCounters.put(type, Counter.builder("tradecore.monitor.events")
                    .description("Order events published by the stale order monitor")
                    .tag("type", type.name().toLowerCase())
                    .register(meterRegistry));
        }
    }

    @Async("eventExecutor")
    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        orderEventCounters.get(event.getEventType()).increment();
    }

    private double rows(RepositoryKind kind) {
        return repositoryFactory.existing(kind)
                .map(r -> r instanceof EntityRepository
                        ? ((EntityRepository<?>) r).count()
                        : r instanceof StreamingRepository ? ((StreamingRepository<?>) r).count() : 0)
                .orElse(0)
                .doubleValue();
    }

    private double sync(RepositoryKind kind, ToDoubleFunction<SyncStatistics> metric) {
        return repositoryFactory.existing(kind)
                .filter(WriteThroughRepository.class::isInstance)
                .map(r -> metric.applyAsDouble(((WriteThroughRepository) r).syncStatistics()))
                .orElse(0.0);
    }

    private double stream(RepositoryKind kind, ToDoubleFunction<StreamStatistics> metric) {
        return repositoryFactory.existing(kind)
                .filter(StreamingRepository.class::isInstance)
                .map(r -> metric.applyAsDouble(((StreamingRepository<?>) r).statistics()))
                .orElse(0.0);
    }

    private void gauge(
            MeterRegistry registry, String name, String kindTag, String description, ToDoubleFunction<Object> value) {
        Gauge.builder(name, this, value::applyAsDouble)
                .description(description)
                .tag("kind", kindTag)
                .register(registry);
    }

    private void monitorGauge(
            MeterRegistry registry, StaleOrderMonitor monitor, String name, ToDoubleFunction<MonitorStatistics> value) {
        Gauge.builder(name, monitor, m -> value.applyAsDouble(m.statistics())).register(registry);
    }

}
