package com.fillbot.hft.account;

/**
 * Per-authority stats account. {@code referrerInfo} is null when the user was not referred.
 */
public record UserStats(String statsAccount, ReferrerInfo referrerInfo) {
}
