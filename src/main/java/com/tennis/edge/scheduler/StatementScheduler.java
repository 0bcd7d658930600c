package com.tennis.edge.scheduler;

import com.tennis.edge.sharing.MonthlyStatement;
import com.tennis.edge.sharing.ProfitSharingLedger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.YearMonth;

/**
 * Generates the previous month's profit-sharing statement.
 * Runs shortly after midnight on the 1st of each month.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StatementScheduler {

    private final ProfitSharingLedger profitSharingLedger;

    @Scheduled(cron = "${statement.scheduler.cron:0 5 0 1 * *}")
    public void generatePreviousMonth() {
        YearMonth previous = YearMonth.now().minusMonths(1);
        log.debug("Monthly statement triggered for {}", previous);

        try {
            MonthlyStatement statement = profitSharingLedger.generateStatement(
                    previous.getYear(), previous.getMonthValue());
            log.info("Monthly statement for {} ready: net profit {}", previous, statement.getNetProfit());
        } catch (Exception e) {
            log.error("Error generating statement for {}: {}", previous, e.getMessage(), e);
        }
    }
}
