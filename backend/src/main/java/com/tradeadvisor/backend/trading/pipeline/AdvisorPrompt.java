package com.tradeadvisor.backend.trading.pipeline;

public record AdvisorPrompt(String systemPrompt, String userPrompt) {}
