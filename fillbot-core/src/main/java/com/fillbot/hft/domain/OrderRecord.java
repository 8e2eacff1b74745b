package com.fillbot.hft.domain;

import lombok.NonNull;

/**
 * Ledger event announcing a newly placed order.
 */
public record OrderRecord(@NonNull String accountRef, @NonNull String authority, @NonNull Order order) {
}
