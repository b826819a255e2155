package com.tradecore.repository;

import com.tradecore.domain.model.MemoryUsage;
import com.tradecore.domain.model.StreamObservation;
import com.tradecore.domain.model.StreamStatistics;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Append-only store for time-ordered observations.
 *
 * <p>Reads only see observations still held in memory; anything already dumped to a batch file
 * or evicted is invisible to them.
 */
public interface StreamingRepository<T extends StreamObservation> extends ManagedRepository {

    /**
     * Appends one observation. Never blocks on file I/O.
     *
     * @return false if ingestion has been stopped and the observation was discarded
     */
    boolean append(T observation);

    /** @return number of observations accepted */
    int appendBatch(Collection<T> observations);

    /** The most recent {@code n} observations, oldest first. */
    List<T> lastN(int n);

    /** Observations of {@code symbol} with {@code from <= timestamp <= to}, oldest first. */
    List<T> rangeBySymbolAndTime(String symbol, long from, long to);

    Optional<T> latest(String symbol);

    /** Number of observations held in memory. */
    int count();

    MemoryUsage memoryUsage();

    /** Rejects further appends. Used during shutdown before the final dump. */
    void stopAccepting();

    boolean isAccepting();

    StreamStatistics statistics();

    /**
     * The last {@code limit} values of one field for {@code symbol}, oldest first, skipping nulls.
     * E.g. {@code tickers.history("BTC/USDT", 50, Ticker::getLast)} for a price series.
     */
    default <R> List<R> history(String symbol, int limit, Function<T, R> field) {
        List<R> values = rangeBySymbolAndTime(symbol, Long.MIN_VALUE, Long.MAX_VALUE).stream()
                .map(field)
                .filter(value -> value != null)
                .collect(Collectors.toList());
        return values.size() <= limit ? values : values.subList(values.size() - limit, values.size());
    }
}
