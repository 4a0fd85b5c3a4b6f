package com.stockdiscussion.collector.collect.export;

import com.stockdiscussion.collector.collect.model.DateKey;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchNamerTest {

    @Test
    void joinsIdentifierAndDay() {
        assertThat(BatchNamer.name("005930", DateKey.parse("2025-11-15"))).isEqualTo("005930_2025-11-15");
        assertThat(BatchNamer.name("KR7005930003", "2025-01-02")).isEqualTo("KR7005930003_2025-01-02");
    }

    @Test
    void isStableAcrossCalls() {
        DateKey key = DateKey.parse("2025-11-15");
        assertThat(BatchNamer.name(" 005930 ", key)).isEqualTo(BatchNamer.name("005930", key));
    }

    @Test
    void rejectsBlankIdentifierAndMalformedDay() {
        assertThatThrownBy(() -> BatchNamer.name("  ", DateKey.parse("2025-11-15")))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> BatchNamer.name("005930", "2025/11/15"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
