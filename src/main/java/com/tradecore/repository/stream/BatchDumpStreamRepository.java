package com.tradecore.repository.stream;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.DumpResult;
import com.tradecore.domain.model.MemoryUsage;
import com.tradecore.domain.model.StreamObservation;
import com.tradecore.domain.model.StreamStatistics;
import com.tradecore.repository.BatchDumpingRepository;
import com.tradecore.repository.StreamingRepository;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ExecutorConfigurationSupport;

/**
 * Streaming repository that buffers observations in memory and dumps them to columnar batch
 * files.
 *
 * <p>When the buffer's estimated size reaches {@code dumpThresholdBytes}, the appending thread
 * swaps the buffer for an empty one and hands the old one to the dump executor; it never waits
 * for file I/O. Only one dump runs at a time. While a dump is in flight the new buffer keeps
 * growing; if it passes {@code memoryLimitBytes} the oldest observations are dropped and counted.
 *
 * <p>A failed dump puts its records back in front of the buffer so the next dump retries them.
 * Reads only see the current buffer: records handed to a dump are invisible to queries.
 */
public class BatchDumpStreamRepository<T extends StreamObservation>
        implements StreamingRepository<T>, BatchDumpingRepository {

    private static final Logger log = LoggerFactory.getLogger(BatchDumpStreamRepository.class);

    private final RepositoryKind kind;
    private final ObservationSchema<T> schema;
    private final Path dumpDirectory;
    private final long dumpThresholdBytes;
    private final long memoryLimitBytes;
    private final TaskExecutor dumpExecutor;

    private final ReentrantLock bufferLock = new ReentrantLock();
    private ArrayDeque<T> buffer = new ArrayDeque<>();

    /** Serialises file writes between async dumps and {@link #forceDump()}. */
    private final ReentrantLock dumpLock = new ReentrantLock();

    private final AtomicBoolean dumpInFlight = new AtomicBoolean(false);
    private volatile boolean accepting = true;

    private final AtomicLong dumpSequence = new AtomicLong();
    private final AtomicLong appended = new AtomicLong();
    private final AtomicLong rejectedAfterStop = new AtomicLong();
    private final AtomicLong evicted = new AtomicLong();
    private final AtomicLong dumps = new AtomicLong();
    private final AtomicLong dumpFailures = new AtomicLong();
    private final AtomicLong recordsDumped = new AtomicLong();

    public BatchDumpStreamRepository(
            RepositoryKind kind,
            ObservationSchema<T> schema,
            Path dumpRoot,
            long dumpThresholdBytes,
            long memoryLimitBytes,
            TaskExecutor dumpExecutor)
            throws IOException {
        this.kind = kind;
        this.schema = schema;
        this.dumpDirectory = dumpRoot.resolve(schema.getName());
        this.dumpThresholdBytes = dumpThresholdBytes;
        this.memoryLimitBytes = Math.max(memoryLimitBytes, dumpThresholdBytes);
        this.dumpExecutor = dumpExecutor;
        Files.createDirectories(dumpDirectory);
    }

    @Override
    public RepositoryKind kind() {
        return kind;
    }

    @Override
    public StorageBackend backend() {
        return StorageBackend.MEMORY_WITH_DURABLE_SYNC;
    }

    // ---- Writes ----

    @Override
    public boolean append(T observation) {
        Objects.requireNonNull(observation, "observation");
        if (!accepting) {
            rejectedAfterStop.incrementAndGet();
            return false;
        }
        List<T> toDump = null;
        bufferLock.lock();
        try {
            buffer.addLast(observation);
            appended.incrementAndGet();
            toDump = swapIfOverThreshold();
        } finally {
            bufferLock.unlock();
        }
        if (toDump != null) {
            submitDump(toDump);
        }
        return true;
    }

    @Override
    public int appendBatch(Collection<T> observations) {
        if (!accepting) {
            rejectedAfterStop.addAndGet(observations.size());
            return 0;
        }
        List<T> toDump = null;
        bufferLock.lock();
        try {
            for (T observation : observations) {
                buffer.addLast(Objects.requireNonNull(observation, "observation"));
            }
            appended.addAndGet(observations.size());
            toDump = swapIfOverThreshold();
        } finally {
            bufferLock.unlock();
        }
        if (toDump != null) {
            submitDump(toDump);
        }
        return observations.size();
    }

    /** Must hold bufferLock. Returns the swapped-out records, or null if no dump was started. */
    private List<T> swapIfOverThreshold() {
        if (estimatedBytes(buffer.size()) >= dumpThresholdBytes && dumpInFlight.compareAndSet(false, true)) {
            List<T> snapshot = new ArrayList<>(buffer);
            buffer = new ArrayDeque<>();
            return snapshot;
        }
        evictOverLimit();
        return null;
    }

    /** Must hold bufferLock. */
    private void evictOverLimit() {
        long dropped = 0;
        while (!buffer.isEmpty() && estimatedBytes(buffer.size()) > memoryLimitBytes) {
            buffer.pollFirst();
            dropped++;
        }
        if (dropped > 0) {
            evicted.addAndGet(dropped);
            log.warn("{} buffer over memory limit while a dump is in flight, evicted {} oldest records", kind, dropped);
        }
    }

    // ---- Dumps ----

    private void submitDump(List<T> snapshot) {
        try {
            dumpExecutor.execute(() -> {
                try {
                    writeDump(snapshot);
                } catch (IOException e) {
                    log.error("Background dump of {} {} records failed, records restored", snapshot.size(), kind, e);
                    restore(snapshot);
                } finally {
                    dumpInFlight.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            log.error("Dump executor rejected {} dump, {} records restored", kind, snapshot.size(), e);
            restore(snapshot);
            dumpInFlight.set(false);
        }
    }

    /**
     * Triggers a background dump of the current buffer unless it is empty or a dump is already
     * running. Used by the periodic dump schedule.
     *
     * @return true if a dump was started
     */
    public boolean dumpAsync() {
        List<T> snapshot = null;
        bufferLock.lock();
        try {
            if (!buffer.isEmpty() && dumpInFlight.compareAndSet(false, true)) {
                snapshot = new ArrayList<>(buffer);
                buffer = new ArrayDeque<>();
            }
        } finally {
            bufferLock.unlock();
        }
        if (snapshot == null) {
            return false;
        }
        submitDump(snapshot);
        return true;
    }

    @Override
    public DumpResult forceDump() throws IOException {
        dumpLock.lock();
        try {
            List<T> snapshot;
            bufferLock.lock();
            try {
                snapshot = new ArrayList<>(buffer);
                buffer = new ArrayDeque<>();
            } finally {
                bufferLock.unlock();
            }
            if (snapshot.isEmpty()) {
                return DumpResult.empty();
            }
            try {
                return writeDump(snapshot);
            } catch (IOException e) {
                restore(snapshot);
                throw e;
            }
        } finally {
            dumpLock.unlock();
        }
    }

    private DumpResult writeDump(List<T> snapshot) throws IOException {
        dumpLock.lock();
        try {
            long start = System.currentTimeMillis();
            Path target = dumpDirectory.resolve(
                    BatchFileFormat.fileName(schema.getName(), start, dumpSequence.incrementAndGet()));
            long bytes;
            try {
                bytes = BatchFileFormat.write(target, schema, snapshot);
            } catch (IOException e) {
                dumpFailures.incrementAndGet();
                throw e;
            }
            long duration = System.currentTimeMillis() - start;
            dumps.incrementAndGet();
            recordsDumped.addAndGet(snapshot.size());
            log.info("Dumped {} {} records to {} ({} bytes, {}ms)", snapshot.size(), kind, target, bytes, duration);
            return DumpResult.builder()
                    .path(target)
                    .recordCount(snapshot.size())
                    .durationMs(duration)
                    .build();
        } finally {
            dumpLock.unlock();
        }
    }

    /** Puts records from a failed dump back in front of the buffer. */
    private void restore(List<T> snapshot) {
        bufferLock.lock();
        try {
            ArrayDeque<T> restored = new ArrayDeque<>(snapshot.size() + buffer.size());
            restored.addAll(snapshot);
            restored.addAll(buffer);
            buffer = restored;
            evictOverLimit();
        } finally {
            bufferLock.unlock();
        }
    }

    /** True while a background dump is running. */
    public boolean isDumpInFlight() {
        return dumpInFlight.get();
    }

    public Path getDumpDirectory() {
        return dumpDirectory;
    }

    // ---- Reads ----

    @Override
    public List<T> lastN(int n) {
        bufferLock.lock();
        try {
            int skip = Math.max(0, buffer.size() - n);
            List<T> result = new ArrayList<>(Math.min(n, buffer.size()));
            Iterator<T> it = buffer.iterator();
            for (int i = 0; it.hasNext(); i++) {
                T next = it.next();
                if (i >= skip) {
                    result.add(next);
                }
            }
            return result;
        } finally {
            bufferLock.unlock();
        }
    }

    @Override
    public List<T> rangeBySymbolAndTime(String symbol, long from, long to) {
        List<T> result = new ArrayList<>();
        bufferLock.lock();
        try {
            for (T observation : buffer) {
                if (observation.getSymbol().equals(symbol)
                        && observation.getTimestamp() >= from
                        && observation.getTimestamp() <= to) {
                    result.add(observation);
                }
            }
        } finally {
            bufferLock.unlock();
        }
        return result;
    }

    @Override
    public Optional<T> latest(String symbol) {
        bufferLock.lock();
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
            bufferLock.unlock();
        }
    }

    @Override
    public int count() {
        bufferLock.lock();
        try {
            return buffer.size();
        } finally {
            bufferLock.unlock();
        }
    }

    @Override
    public MemoryUsage memoryUsage() {
        int records = count();
        long bytes = estimatedBytes(records);
        return MemoryUsage.builder()
                .recordCount(records)
                .estimatedBytes(bytes)
                .percentOfLimit(memoryLimitBytes > 0 ? bytes * 100.0 / memoryLimitBytes : 0.0)
                .build();
    }

    // ---- Lifecycle ----

    @Override
    public void stopAccepting() {
        accepting = false;
        log.info("{} stopped accepting observations, {} buffered", kind, count());
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
                .dumps(dumps.get())
                .dumpFailures(dumpFailures.get())
                .recordsDumped(recordsDumped.get())
                .memoryUsage(memoryUsage())
                .build();
    }

    @Override
    public void close() {
        if (dumpExecutor instanceof ExecutorConfigurationSupport) {
            ((ExecutorConfigurationSupport) dumpExecutor).shutdown();
        }
    }

    private long estimatedBytes(int records) {
        return (long) records * schema.getEstimatedRecordBytes();
    }
}
