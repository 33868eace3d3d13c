package com.pairguard.hft.execution.engine;

import com.pairguard.hft.events.NoopHftEventPublisher;
import com.pairguard.hft.execution.config.PriceGuardConfig;
import com.pairguard.hft.execution.guard.BookSnapshot;
import com.pairguard.hft.execution.guard.PriceGuard;
import com.pairguard.hft.execution.order.Quote;
import com.pairguard.hft.execution.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class QuoteLadderTest {

    private static final Instant NOW = Instant.parse("2024-01-15T10:00:00Z");

    private final PriceGuard guard = new PriceGuard(PriceGuardConfig.defaults(), new MutableClock(NOW),
            new NoopHftEventPublisher(), new SimpleMeterRegistry());

    @Test
    void laddersDownFromTheMakerPrice() {
        QuoteLadder ladder = new QuoteLadder(guard, 3, BigDecimal.TEN);

        List<Quote> quotes = ladder.build(book("0.40", "0.45"));

        assertThat(quotes).extracting(Quote::priceKey)
                .containsExactly(new BigDecimal("0.41"), new BigDecimal("0.4"), new BigDecimal("0.39"));
        assertThat(ladder.topPrice(quotes)).isEqualByComparingTo("0.41");
    }

    @Test
    void stopsBeforeNonPositivePrices() {
        QuoteLadder ladder = new QuoteLadder(guard, 5, BigDecimal.TEN);

        assertThat(ladder.build(book("0.01", "0.04"))).extracting(Quote::priceKey)
                .containsExactly(new BigDecimal("0.02"), new BigDecimal("0.01"));
    }

    @Test
    void noQuotesOnATightOrMissingBook() {
        QuoteLadder ladder = new QuoteLadder(guard, 2, BigDecimal.TEN);

        assertThat(ladder.build(book("0.44", "0.45"))).isEmpty();
        assertThat(ladder.build(BookSnapshot.of(null, new BigDecimal("0.45"), NOW))).isEmpty();
        assertThat(ladder.build(null)).isEmpty();
        assertThat(ladder.topPrice(List.of())).isNull();
        assertThat(new QuoteLadder(guard, 0, BigDecimal.TEN).build(book("0.40", "0.45"))).isEmpty();
        assertThatThrownBy(() -> new QuoteLadder(guard, -1, BigDecimal.TEN)).isInstanceOf(IllegalArgumentException.class);
    }

    private static BookSnapshot book(String bid, String ask) {
        return BookSnapshot.of(new BigDecimal(bid), new BigDecimal(ask), NOW);
    }
}
