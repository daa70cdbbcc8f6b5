package com.tradeadvisor.backend.trading.pipeline;

/**
 * Position of an instant relative to the exchange session. Minutes are negative outside the session.
 */
public record SessionClock(boolean open, long minutesSinceOpen, long minutesUntilClose) {}
