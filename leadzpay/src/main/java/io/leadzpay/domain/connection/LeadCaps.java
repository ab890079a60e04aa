package io.leadzpay.domain.connection;

/**
 * Volume limits on a connection. A null limit is unlimited.
 *
 * Limits only block submissions when pauseWhenCapReached is set; otherwise they are
 * informational.
 */
public record LeadCaps(
    Integer weeklyLimit,
    Integer monthlyLimit,
    boolean pauseWhenCapReached
) {}
