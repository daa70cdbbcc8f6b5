package com.tradeadvisor.backend.trading.pipeline;

import java.time.Instant;

/**
 * A headline with a sentiment score in [-1, 1] computed upstream.
 */
public record NewsItem(String title, double sentiment, Instant publishedAt) {}
