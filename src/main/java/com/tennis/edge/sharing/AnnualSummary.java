package com.tennis.edge.sharing;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class AnnualSummary {

    int year;
    int monthsActive;
    BigDecimal totalNetProfit;
    BigDecimal totalPartnerShare;
    BigDecimal totalMyShare;
    int totalBets;
    int totalWinningBets;

    // Mean of monthly figures over months with activity
    BigDecimal averageWinRate;
    BigDecimal averageRoi;

    List<MonthlyStatement> statements;

    public static AnnualSummary empty(int year) {
        return AnnualSummary.builder()
                .year(year)
                .totalNetProfit(BigDecimal.ZERO.setScale(2))
                .totalPartnerShare(BigDecimal.ZERO.setScale(2))
                .totalMyShare(BigDecimal.ZERO.setScale(2))
                .averageWinRate(BigDecimal.ZERO.setScale(2))
                .averageRoi(BigDecimal.ZERO.setScale(2))
                .statements(List.of())
                .build();
    }
}
