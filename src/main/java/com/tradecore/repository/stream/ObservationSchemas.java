package com.tradecore.repository.stream;

import com.tradecore.domain.model.IndicatorPoint;
import com.tradecore.domain.model.OrderBookSnapshot;
import com.tradecore.domain.model.Ticker;

/** Batch file layouts of the streaming observation types. */
public final class ObservationSchemas {

    public static final ObservationSchema<Ticker> TICKERS = ObservationSchema.<Ticker>builder("tickers", 400)
            .stringColumn("symbol", Ticker::getSymbol)
            .longColumn("timestamp", Ticker::getTimestamp)
            .decimalColumn("last", Ticker::getLast)
            .decimalColumn("bid", Ticker::getBid)
            .decimalColumn("ask", Ticker::getAsk)
            .decimalColumn("high", Ticker::getHigh)
            .decimalColumn("low", Ticker::getLow)
            .decimalColumn("open", Ticker::getOpen)
            .decimalColumn("close", Ticker::getClose)
            .decimalColumn("base_volume", Ticker::getBaseVolume)
            .decimalColumn("change_percent", Ticker::getChangePercent)
            .build(row -> Ticker.builder()
                    .symbol(row.getString("symbol"))
                    .timestamp(row.getLong("timestamp"))
                    .last(row.getDecimal("last"))
                    .bid(row.getDecimal("bid"))
                    .ask(row.getDecimal("ask"))
                    .high(row.getDecimal("high"))
                    .low(row.getDecimal("low"))
                    .open(row.getDecimal("open"))
                    .close(row.getDecimal("close"))
                    .baseVolume(row.getDecimal("base_volume"))
                    .changePercent(row.getDecimal("change_percent"))
                    .build());

    public static final ObservationSchema<OrderBookSnapshot> ORDER_BOOKS = ObservationSchema
            .<OrderBookSnapshot>builder("order_books", 320)
            .stringColumn("symbol", OrderBookSnapshot::getSymbol)
            .longColumn("timestamp", OrderBookSnapshot::getTimestamp)
            .decimalColumn("best_bid", OrderBookSnapshot::getBestBid)
            .decimalColumn("best_ask", OrderBookSnapshot::getBestAsk)
            .decimalColumn("bid_volume", OrderBookSnapshot::getBidVolume)
            .decimalColumn("ask_volume", OrderBookSnapshot::getAskVolume)
            .decimalColumn("spread", OrderBookSnapshot::getSpread)
            .intColumn("depth_levels", OrderBookSnapshot::getDepthLevels)
            .build(row -> OrderBookSnapshot.builder()
                    .symbol(row.getString("symbol"))
                    .timestamp(row.getLong("timestamp"))
                    .bestBid(row.getDecimal("best_bid"))
                    .bestAsk(row.getDecimal("best_ask"))
                    .bidVolume(row.getDecimal("bid_volume"))
                    .askVolume(row.getDecimal("ask_volume"))
                    .spread(row.getDecimal("spread"))
                    .depthLevels(row.getInt("depth_levels"))
                    .build());

    public static final ObservationSchema<IndicatorPoint> INDICATORS = ObservationSchema
            .<IndicatorPoint>builder("indicators", 200)
            .stringColumn("symbol", IndicatorPoint::getSymbol)
            .longColumn("timestamp", IndicatorPoint::getTimestamp)
            .stringColumn("indicator", IndicatorPoint::getIndicator)
            .stringColumn("timeframe", IndicatorPoint::getTimeframe)
            .decimalColumn("value", IndicatorPoint::getValue)
            .build(row -> IndicatorPoint.builder()
                    .symbol(row.getString("symbol"))
                    .timestamp(row.getLong("timestamp"))
                    .indicator(row.getString("indicator"))
                    .timeframe(row.getString("timeframe"))
                    .value(row.getDecimal("value"))
                    .build());

    private ObservationSchemas() {}
}
