package com.tradecore.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.model.DumpResult;
import com.tradecore.domain.model.Ticker;
import com.tradecore.repository.stream.BatchDumpStreamRepository;
import com.tradecore.repository.stream.BatchFileReader;
import com.tradecore.repository.stream.ObservationSchemas;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.task.TaskExecutor;

/**
 * Unit tests for the buffered streaming repository: threshold dumps, forced dumps,
 * memory-limit eviction and restore on failure.
 */
@DisplayName("BatchDumpStreamRepository")
class BatchDumpStreamRepositoryTest {

    private static final int RECORD_BYTES = ObservationSchemas.TICKERS.getEstimatedRecordBytes();

    @TempDir
    Path dumpRoot;

    private List<Runnable> dumpTasks;

    @BeforeEach
    void setUp() {
        dumpTasks = new ArrayList<>();
    }

    /** Threshold of 10 records, memory limit of 20 records. */
    private BatchDumpStreamRepository<Ticker> repository(TaskExecutor executor) throws IOException {
        return new BatchDumpStreamRepository<>(
                RepositoryKind.TICKERS,
                ObservationSchemas.TICKERS,
                dumpRoot,
                10L * RECORD_BYTES,
                20L * RECORD_BYTES,
                executor);
    }

    private static Ticker ticker(String symbol, long timestamp, String last) {
        return Ticker.builder()
                .symbol(symbol)
                .timestamp(timestamp)
                .last(new BigDecimal(last))
                .bid(new BigDecimal(last))
                .baseVolume(new BigDecimal("12.345"))
                .build();
    }

    private static List<Ticker> tickers(int count) {
        return IntStream.range(0, count)
                .mapToObj(i -> ticker("BTC/USDT", 1_000L + i, "30000." + i))
                .collect(Collectors.toList());
    }

    private List<Path> batchFiles(BatchDumpStreamRepository<?> repository) throws IOException {
        try (Stream<Path> files = Files.list(repository.getDumpDirectory())) {
            return files.filter(file -> file.toString().endsWith(".tcol")).collect(Collectors.toList());
        }
    }

    @Nested
    @DisplayName("Forced dump")
    class ForcedDump {

        @Test
        @DisplayName("forceDump writes the buffer to one file and empties it")
        void forceDumpWritesFile() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);
            repository.appendBatch(tickers(3));

            DumpResult result = repository.forceDump();

            assertThat(result.getRecordCount()).isEqualTo(3);
            assertThat(result.getPath()).exists();
            assertThat(repository.count()).isZero();
            assertThat(repository.lastN(10)).isEmpty();

            List<Ticker> read = BatchFileReader.read(result.getPath(), ObservationSchemas.TICKERS);
            assertThat(read).hasSize(3);
            assertThat(read.get(2).getSymbol()).isEqualTo("BTC/USDT");
            assertThat(read.get(2).getTimestamp()).isEqualTo(1_002L);
            assertThat(read.get(2).getLast()).isEqualByComparingTo("30000.2");
            assertThat(read.get(2).getAsk()).isNull();
        }

        @Test
        @DisplayName("forceDump of an empty buffer writes nothing")
        void emptyBuffer() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);

            DumpResult result = repository.forceDump();

            assertThat(result.isEmpty()).isTrue();
            assertThat(batchFiles(repository)).isEmpty();
        }

        @Test
        @DisplayName("a failed forceDump restores the records and rethrows")
        void failedDumpRestores() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);
            repository.appendBatch(tickers(3));
            // Replace the dump directory with a plain file so the write fails
            Files.delete(repository.getDumpDirectory());
            Files.createFile(repository.getDumpDirectory());

            assertThatThrownBy(repository::forceDump).isInstanceOf(IOException.class);

            assertThat(repository.count()).isEqualTo(3);
            assertThat(repository.statistics().getDumpFailures()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Threshold dumps")
    class ThresholdDumps {

        @Test
        @DisplayName("reaching the threshold hands the buffer to one background dump")
        void thresholdStartsOneDump() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);

            repository.appendBatch(tickers(10));

            assertThat(dumpTasks).hasSize(1);
            assertThat(repository.isDumpInFlight()).isTrue();
            assertThat(repository.count()).isZero();

            dumpTasks.get(0).run();

            assertThat(repository.isDumpInFlight()).isFalse();
            assertThat(batchFiles(repository)).hasSize(1);
            assertThat(repository.statistics().getRecordsDumped()).isEqualTo(10);
        }

        @Test
        @DisplayName("while a dump is in flight the buffer is capped at the memory limit, oldest first")
        void evictsOverLimitDuringDump() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);
            repository.appendBatch(tickers(10));

            for (int i = 0; i < 25; i++) {
                repository.append(ticker("BTC/USDT", 5_000L + i, "31000"));
            }

            assertThat(dumpTasks).hasSize(1);
            assertThat(repository.count()).isEqualTo(20);
            assertThat(repository.statistics().getEvicted()).isEqualTo(5);
            assertThat(repository.lastN(20).get(0).getTimestamp()).isEqualTo(5_005L);
            assertThat(repository.memoryUsage().getPercentOfLimit()).isEqualTo(100.0);
        }

        @Test
        @DisplayName("a rejected background dump puts the records back")
        void rejectedDumpRestores() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(task -> {
                throw new RejectedExecutionException("busy");
            });

            repository.appendBatch(tickers(10));

            assertThat(repository.count()).isEqualTo(10);
            assertThat(repository.isDumpInFlight()).isFalse();
        }

        @Test
        @DisplayName("dumpAsync dumps a non-empty buffer below threshold")
        void dumpAsync() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(Runnable::run);
            repository.appendBatch(tickers(4));

            assertThat(repository.dumpAsync()).isTrue();
            assertThat(repository.dumpAsync()).isFalse();
            assertThat(batchFiles(repository)).hasSize(1);
        }
    }

    @Nested
    @DisplayName("Reads and lifecycle")
    class ReadsAndLifecycle {

        @Test
        @DisplayName("range queries are inclusive on both ends")
        void rangeInclusive() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);
            repository.append(ticker("BTC/USDT", 100L, "1"));
            repository.append(ticker("ETH/USDT", 150L, "2"));
            repository.append(ticker("BTC/USDT", 200L, "3"));
            repository.append(ticker("BTC/USDT", 300L, "4"));

            assertThat(repository.rangeBySymbolAndTime("BTC/USDT", 100L, 200L))
                    .extracting(Ticker::getTimestamp)
                    .containsExactly(100L, 200L);
            assertThat(repository.latest("ETH/USDT")).map(Ticker::getTimestamp).contains(150L);
            assertThat(repository.history("BTC/USDT", 2, Ticker::getLast))
                    .extracting(BigDecimal::toPlainString)
                    .containsExactly("3", "4");
        }

        @Test
        @DisplayName("after stopAccepting appends are refused and counted")
        void stopAccepting() throws IOException {
            BatchDumpStreamRepository<Ticker> repository = repository(dumpTasks::add);

            repository.stopAccepting();

            assertThat(repository.append(ticker("BTC/USDT", 1L, "1"))).isFalse();
            assertThat(repository.appendBatch(tickers(3))).isZero();
            assertThat(repository.statistics().getRejectedAfterStop()).isEqualTo(4);
            assertThat(repository.count()).isZero();
        }
    }
}
