package com.fillbot.hft.account;

/**
 * An exchange user account and the wallet that owns it.
 */
public record UserAccount(String publicKey, String authority) {
}
