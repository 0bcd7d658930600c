package com.tennis.edge.scheduler;

import com.tennis.edge.BaseIntegrationTest;
import com.tennis.edge.sharing.ProfitSharingLedger;
import com.tennis.edge.signal.MatchSignal;
import com.tennis.edge.signal.SignalCache;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.YearMonth;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Scheduler Tests")
class StatementSchedulerTest extends BaseIntegrationTest {

    @Autowired
    private StatementScheduler statementScheduler;

    @Autowired
    private SignalCacheScheduler signalCacheScheduler;

    @Autowired
    private ProfitSharingLedger sharing;

    @Autowired
    private SignalCache signalCache;

    @BeforeEach
    void setUp() {
        openLedger("10000.00");
    }

    @Test
    @DisplayName("Monthly job stores the previous month's statement")
    void previousMonthStatement() {
        YearMonth previous = YearMonth.now().minusMonths(1);

        statementScheduler.generatePreviousMonth();

        assertThat(sharing.getStatement(previous.getYear(), previous.getMonthValue()))
                .hasValueSatisfying(s -> {
                    assertThat(s.getPeriod()).isEqualTo(previous);
                    assertThat(s.getNetProfit()).isEqualByComparingTo("0");
                    assertThat(s.getStartingBalance()).isEqualByComparingTo("10000.00");
                });
    }

    @Test
    @DisplayName("Cache sweep keeps live entries")
    void sweepKeepsLiveEntries() {
        signalCache.remember(MatchSignal.builder()
                .matchId("SWEEP-1")
                .currentOddsA(new BigDecimal("1.60"))
                .currentOddsB(new BigDecimal("2.30"))
                .build());

        signalCacheScheduler.sweep();

        assertThat(signalCache.getOpening("SWEEP-1")).isPresent();
        signalCache.evict("SWEEP-1");
    }
}
