package com.tradecore.repository.stream;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.MemoryUsage;
import com.tradecore.domain.model.StreamObservation;
import com.tradecore.domain.model.StreamStatistics;
import com.tradecore.repository.StreamingRepository;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Legacy streaming repository: keeps the most recent {@code maxRecords} observations in memory
 * and nothing else. Older observations are dropped as new ones arrive; no files are written.
 */
public class RingBufferStreamRepository<T extends StreamObservation> implements StreamingRepository<T> {

    private final RepositoryKind kind;
    private final int maxRecords;
    private final int estimatedRecordBytes;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<T> buffer;
    private volatile boolean accepting = true;

    private final AtomicLong appended = new AtomicLong();
    private final AtomicLong rejectedAfterStop = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();

    public RingBufferStreamRepository(RepositoryKind kind, int maxRecords, int estimatedRecordBytes) {
        if (maxRecords <= 0) {
            throw new IllegalArgumentException("maxRecords must be positive: " + maxRecords);
        }
        this.kind = kind;
        this.maxRecords = maxRecords;
        this.estimatedRecordBytes = estimatedRecordBytes;
        this.buffer = new ArrayDeque<>(Math.min(maxRecords, 1024));
    }

    @Override
    public RepositoryKind kind() {
        return kind;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.PURE_MEMORY_LEGACY;
    }

    @Override
    public boolean append(T observation) {
        Objects.requireNonNull(observation, "observation");
        if (!accepting) {
            rejectedAfterStop.incrementAndGet();
            return false;
        }
        lock.lock();
        try {
            addBounded(observation);
        } finally {
            lock.unlock();
        }
        appended.incrementAndGet();
        return true;
    }

    @Override
    public int appendBatch(Collection<T> observations) {
        if (!accepting) {
            rejectedAfterStop.addAndGet(observations.size());
            return 0;
        }
        lock.lock();
        try {
            for (T observation : observations) {
                addBounded(Objects.requireNonNull(observation, "observation"));
            }
        } finally {
            lock.unlock();
        }
        appended.addAndGet(observations.size());
        return observations.size();
    }

    private void addBounded(T observation) {
        if (buffer.size() >= maxRecords) {
            buffer.pollFirst();
            evicted.incrementAndGet();
        }
        buffer.addLast(observation);
    }

    @Override
    public List<T> lastN(int n) {
        lock.lock();
        try {
            List<T> all = new ArrayList<>(buffer);
            return new ArrayList<>(all.subList(Math.max(0, all.size() - n), all.size()));
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<T> rangeBySymbolAndTime(String symbol, long from, long to) {
        List<T> result = new ArrayList<>();
        lock.lock();
        try {
            for (T observation : buffer) {
                if (observation.getSymbol().equals(symbol)
                        && observation.getTimestamp() >= from
                        && observation.getTimestamp() <= to) {
                    result.add(observation);
                }
            }
        } finally {
            lock.unlock();
        }
        return result;
    }

    @Override
    public Optional<T> latest(String symbol) {
        lock.lock();
        try {
            Iterator<T> it = buffer.descendingIterator();
            while (it.hasNext()) {
                T observation = it.next();
                if (observation.getSymbol().equals(symbol)) {
                    return Optional.of(observation);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int count() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public MemoryUsage memoryUsage() {
        int records = count();
        return MemoryUsage.builder()
                .recordCount(records)
                .estimatedBytes((long) records * estimatedRecordBytes)
                .percentOfLimit(records * 100.0 / maxRecords)
                .build();
    }

    @Override
    public void stopAccepting() {
        accepting = false;
    }

    @Override
    public boolean isAccepting() {
        return accepting;
    }

    @Override
    public StreamStatistics statistics() {
        return StreamStatistics.builder()
                .appended(appended.get())
                .rejectedAfterStop(rejectedAfterStop.get())
                .evicted(evicted.get())
                .memoryUsage(memoryUsage())
                .build();
    }
}
