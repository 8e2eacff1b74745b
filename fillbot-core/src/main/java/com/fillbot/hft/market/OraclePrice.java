package com.fillbot.hft.market;

import java.math.BigDecimal;

public record OraclePrice(BigDecimal price, BigDecimal confidence, long slot) {
}
