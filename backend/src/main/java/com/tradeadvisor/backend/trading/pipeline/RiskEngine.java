package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.model.UserSettings;

public interface RiskEngine {
    ValidationResult validate(TradeProposal proposal, PortfolioSnapshot snapshot, UserSettings settings, SessionClock session);
}
