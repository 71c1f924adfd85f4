package com.libragraph.backup.types;

/**
 * Per-recipient delivery state of an outgoing message.
 */
public enum DeliveryStatus {
    PENDING,
    SENT,
    DELIVERED,
    READ,
    VIEWED,
    FAILED,
    SKIPPED
}
