package com.fillbot.hft.account;

/**
 * Everything the execution client needs besides the candidate itself to build a fill operation.
 * {@code makerInfo} is null for fills against the automated market maker, {@code referrerInfo} is null
 * when the taker has no referrer.
 */
public record FillMetadata(MakerInfo makerInfo, UserAccount taker, ReferrerInfo referrerInfo) {
}
