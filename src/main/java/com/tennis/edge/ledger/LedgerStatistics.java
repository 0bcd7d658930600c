package com.tennis.edge.ledger;

import com.tennis.edge.persistence.BetEntity;
import com.tennis.edge.persistence.BetStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

@Value
@Builder
public class LedgerStatistics {

    int totalBets;
    int pendingBets;
    int wonBets;
    int lostBets;
    int voidBets;

    // won / (won + lost), percent
    BigDecimal winRate;

    // Over won and lost bets
    BigDecimal totalStaked;
    BigDecimal totalProfitLoss;
    BigDecimal roi;

    BigDecimal startingBalance;
    BigDecimal currentBalance;
    BigDecimal peakBalance;
    BigDecimal bankrollChange;
    BigDecimal bankrollChangePct;

    public static LedgerStatistics from(LedgerSnapshot snapshot) {
        List<BetEntity> bets = snapshot.bets();
        int won = count(bets, BetStatus.WON);
        int lost = count(bets, BetStatus.LOST);

        BigDecimal staked = BigDecimal.ZERO;
        BigDecimal profitLoss = BigDecimal.ZERO;
        for (BetEntity bet : bets) {
            if (bet.getStatus() == BetStatus.WON || bet.getStatus() == BetStatus.LOST) {
                staked = staked.add(bet.getStake());
                profitLoss = profitLoss.add(bet.getProfitLoss());
            }
        }

        BigDecimal change = snapshot.currentBalance().subtract(snapshot.startingBalance());

        return LedgerStatistics.builder()
                .totalBets(bets.size())
                .pendingBets(count(bets, BetStatus.PENDING))
                .wonBets(won)
                .lostBets(lost)
                .voidBets(count(bets, BetStatus.VOID))
                .winRate(percent(BigDecimal.valueOf(won), BigDecimal.valueOf(won + lost)))
                .totalStaked(staked.setScale(2, RoundingMode.HALF_UP))
                .totalProfitLoss(profitLoss.setScale(2, RoundingMode.HALF_UP))
                .roi(percent(profitLoss, staked))
                .startingBalance(snapshot.startingBalance())
                .currentBalance(snapshot.currentBalance())
                .peakBalance(snapshot.peakBalance())
                .bankrollChange(change.setScale(2, RoundingMode.HALF_UP))
                .bankrollChangePct(percent(change, snapshot.startingBalance()))
                .build();
    }

    private static int count(List<BetEntity> bets, BetStatus status) {
        return (int) bets.stream().filter(b -> b.getStatus() == status).count();
    }

    private static BigDecimal percent(BigDecimal numerator, BigDecimal denominator) {
        if (denominator.signum() == 0) {
            return BigDecimal.ZERO.setScale(2);
        }
        return numerator.multiply(BigDecimal.valueOf(100))
                .divide(denominator, 2, RoundingMode.HALF_UP);
    }
}
