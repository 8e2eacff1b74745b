package com.fillbot.hft.account;

import com.fillbot.hft.domain.Order;

public record MakerInfo(String maker, Order order, String makerStats) {
}
