package com.tradecore.unit.repository;

import static org.assertj.core.api.Assertions.assertThat;

import com.tradecore.domain.enums.RepositoryKind;
import com.tradecore.domain.enums.StorageBackend;
import com.tradecore.domain.model.IndicatorPoint;
import com.tradecore.repository.stream.RingBufferStreamRepository;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("RingBufferStreamRepository")
class RingBufferStreamRepositoryTest {

    private static IndicatorPoint point(long timestamp) {
        return IndicatorPoint.builder()
                .symbol("BTC/USDT")
                .timestamp(timestamp)
                .indicator("RSI")
                .timeframe("1m")
                .value(new BigDecimal("55.5"))
                .build();
    }

    @Test
    @DisplayName("keeps the newest maxRecords observations")
    void boundedByRecordCount() {
        RingBufferStreamRepository<IndicatorPoint> repository =
                new RingBufferStreamRepository<>(RepositoryKind.INDICATORS, 3, 200);

        for (long ts = 1; ts <= 5; ts++) {
            repository.append(point(ts));
        }

        assertThat(repository.count()).isEqualTo(3);
        assertThat(repository.lastN(10)).extracting(IndicatorPoint::getTimestamp).containsExactly(3L, 4L, 5L);
        assertThat(repository.statistics().getEvicted()).isEqualTo(2);
        assertThat(repository.memoryUsage().getPercentOfLimit()).isEqualTo(100.0);
        assertThat(repository.backend()).isEqualTo(StorageBackend.PURE_MEMORY_LEGACY);
    }

    @Test
    @DisplayName("latest returns the most recent observation of the symbol")
    void latest() {
        RingBufferStreamRepository<IndicatorPoint> repository =
                new RingBufferStreamRepository<>(RepositoryKind.INDICATORS, 10, 200);
        repository.append(point(1));
        repository.append(point(2));

        assertThat(repository.latest("BTC/USDT")).map(IndicatorPoint::getTimestamp).contains(2L);
        assertThat(repository.latest("ETH/USDT")).isEmpty();
    }
}
