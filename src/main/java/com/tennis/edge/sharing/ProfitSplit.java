package com.tennis.edge.sharing;

import java.math.BigDecimal;

public record ProfitSplit(BigDecimal partnerShare, BigDecimal myShare) {
}
