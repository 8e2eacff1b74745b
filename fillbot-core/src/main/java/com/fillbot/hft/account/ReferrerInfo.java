package com.fillbot.hft.account;

public record ReferrerInfo(String referrer, String referrerStats) {
}
