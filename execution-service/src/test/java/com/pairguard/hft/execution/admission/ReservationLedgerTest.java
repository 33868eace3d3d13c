package com.pairguard.hft.execution.admission;

import com.pairguard.hft.domain.Outcome;
import com.pairguard.hft.execution.config.AdmissionConfig;
import com.pairguard.hft.execution.support.MutableClock;
import com.pairguard.hft.execution.venue.paper.PaperVenueClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ReservationLedgerTest {

    private static final String BTC = "btc-updown-15m-1705312800";
    private static final String ETH = "eth-updown-15m-1705312800";
    private static final String SOL = "sol-updown-15m-1705312800";

    private MutableClock clock;
    private PaperVenueClient venue;
    private ReservationLedger ledger;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-01-15T10:00:00Z"));
        venue = new PaperVenueClient(clock, BigDecimal.valueOf(1000));
        ledger = new ReservationLedger(AdmissionConfig.defaults(), venue, clock);
    }

    @Test
    void reservesWithinCapsAndTracksPerMarketTotals() {
        assertThat(ledger.reserve("o-1", BTC, bd("40"), Outcome.UP)).isTrue();
        assertThat(ledger.reserve("o-2", BTC, bd("35"), Outcome.DOWN)).isTrue();
        assertThat(ledger.reserve("o-3", ETH, bd("10"), Outcome.UP)).isTrue();

        assertThat(ledger.marketReserved(BTC)).isEqualByComparingTo("75");
        assertThat(ledger.totalReserved()).isEqualByComparingTo("85");

        FundsCheck check = ledger.canPlaceOrder(BTC, Outcome.UP, bd("10"));
        assertThat(check.canProceed()).isTrue();
        assertThat(check.freeBalance()).isEqualByComparingTo("905");
    }

    @Test
    void perMarketCapRefusesWithoutRecording() {
        ledger.reserve("o-1", BTC, bd("100"), Outcome.UP);

        assertThat(ledger.canPlaceOrder(BTC, Outcome.DOWN, bd("60")).reasonCode())
                .isEqualTo(FundsCheck.ReasonCode.MARKET_RESERVE_LIMIT);
        assertThat(ledger.reserve("o-2", BTC, bd("60"), Outcome.DOWN)).isFalse();
        assertThat(ledger.reservations()).hasSize(1);
        assertThat(ledger.reserve("o-3", BTC, bd("50"), Outcome.DOWN)).isTrue();
    }

    @Test
    void totalCapSpansMarkets() {
        ledger.reserve("o-1", BTC, bd("150"), Outcome.UP);
        ledger.reserve("o-2", ETH, bd("150"), Outcome.UP);

        assertThat(ledger.canPlaceOrder(SOL, Outcome.UP, bd("120")).reasonCode())
                .isEqualTo(FundsCheck.ReasonCode.TOTAL_RESERVE_LIMIT);
    }

    @Test
    void freeBalanceKeepsTheSafetyBuffer() {
        venue.setBalance(bd("100"));

        FundsCheck check = ledger.canPlaceOrder(BTC, Outcome.UP, bd("95"));

        assertThat(check.reasonCode()).isEqualTo(FundsCheck.ReasonCode.INSUFFICIENT_BALANCE);
        assertThat(check.freeBalance()).isEqualByComparingTo("90");
        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("90")).canProceed()).isTrue();
    }

    @Test
    void refusesEverythingBelowTheMinimumBalance() {
        venue.setBalance(bd("40"));

        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("1")).reasonCode())
                .isEqualTo(FundsCheck.ReasonCode.BELOW_MIN_BALANCE);
    }

    @Test
    void balanceIsCachedUntilStaleOrInvalidated() {
        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("1")).availableBalance()).isEqualByComparingTo("1000");
        venue.setBalance(bd("60"));

        clock.advanceSeconds(9);
        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("1")).availableBalance()).isEqualByComparingTo("1000");

        ledger.invalidateBalanceCache();
        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("1")).availableBalance()).isEqualByComparingTo("60");

        venue.setBalance(bd("70"));
        clock.advanceSeconds(10);
        assertThat(ledger.canPlaceOrder(BTC, Outcome.UP, bd("1")).availableBalance()).isEqualByComparingTo("70");
    }

    @Test
    void fillsAndReleasesFreeTheReservation() {
        ledger.reserve("o-1", BTC, bd("40"), Outcome.UP);
        ledger.reserve("o-2", BTC, bd("20"), Outcome.UP);

        ledger.onFill("o-1", bd("15"));
        assertThat(ledger.marketReserved(BTC)).isEqualByComparingTo("45");
        ledger.onFill("o-1", bd("25"));
        ledger.release("o-2");
        ledger.release("unknown");

        assertThat(ledger.reservations()).isEmpty();
        assertThat(ledger.totalReserved()).isEqualByComparingTo("0");
    }

    @Test
    void reconcileDropsReservationsOfOrdersNoLongerOpen() {
        ledger.reserve("o-1", BTC, bd("40"), Outcome.UP);
        ledger.reserve("o-2", ETH, bd("20"), Outcome.UP);

        assertThat(ledger.reconcile(Set.of("o-2"))).isEqualTo(1);
        assertThat(ledger.reservations()).extracting(ReservationLedger.Reservation::id).containsExactly("o-2");
    }

    @Test
    void concurrentReservationsNeverOverCommitTheFreeBalance() throws Exception {
        // free = 210 - 10 buffer = 200, room for exactly six reservations of 30
        venue.setBalance(bd("210"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Boolean>> results = new ArrayList<>();
        try {
            for (int i = 0; i < 20; i++) {
                String id = "o-" + i;
                String market = "market-" + i;
                results.add(pool.submit(() -> {
                    start.await();
                    return ledger.reserve(id, market, bd("30"), Outcome.UP);
                }));
            }
            start.countDown();
            int granted = 0;
            for (Future<Boolean> f : results) {
                if (f.get(5, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
            assertThat(granted).isEqualTo(6);
            assertThat(ledger.totalReserved()).isEqualByComparingTo("180");
        } finally {
            pool.shutdownNow();
        }
    }

    private static BigDecimal bd(String value) {
        return new BigDecimal(value);
    }
}
