package com.tradeadvisor.backend.trading.pipeline;

import com.tradeadvisor.backend.config.RiskProperties;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.UserSettings;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;

/**
 * Checks a proposal against the user's hard limits. Stateless: every input arrives as an argument.
 * HOLD proposals pass unconditionally. Sizing and protective-level rules apply to BUY only,
 * since a SELL can only shrink exposure; a SELL is bounded by the shares actually held.
 */
@Service
@RequiredArgsConstructor
public class DefaultRiskEngine implements RiskEngine {

    private final RiskProperties riskProperties;

    @Override
    public ValidationResult validate(TradeProposal proposal, PortfolioSnapshot snapshot, UserSettings settings, SessionClock session) {
        if (proposal == null || proposal.isHold()) {
            return ValidationResult.accepted();
        }
        List<RiskViolation> violations = new ArrayList<>();
        BigDecimal price = proposal.price();
        if (price == null || price.signum() <= 0) {
            violations.add(new RiskViolation(RiskRule.POSITION_SIZE, "No valid price to size the trade"));
            return ValidationResult.of(violations);
        }

        if (proposal.action() == TradeAction.BUY) {
            checkPositionSize(proposal, snapshot, settings, violations);
            checkProtectiveLevels(proposal, settings, violations);
        } else if (proposal.action() == TradeAction.SELL) {
            int held = snapshot.sharesOf(proposal.ticker());
            if (proposal.quantity() > held) {
                violations.add(new RiskViolation(RiskRule.INVENTORY,
                        "Cannot sell " + proposal.quantity() + " shares, only " + held + " held"));
            }
        }

        checkSession(session, violations);
        checkDailyLimits(snapshot, settings, violations);
        return ValidationResult.of(violations);
    }

    private void checkPositionSize(TradeProposal proposal, PortfolioSnapshot snapshot, UserSettings settings,
                                   List<RiskViolation> violations) {
        BigDecimal notional = proposal.price().multiply(BigDecimal.valueOf(proposal.quantity()));
        BigDecimal limit = settings.getMaxPositionSizePct().multiply(snapshot.totalValue());
        if (notional.compareTo(limit) > 0) {
            violations.add(new RiskViolation(RiskRule.POSITION_SIZE,
                    "Position " + notional.stripTrailingZeros().toPlainString() + " exceeds "
                            + percent(settings.getMaxPositionSizePct()) + " of portfolio value ("
                            + limit.stripTrailingZeros().toPlainString() + ")"));
        }
    }

    private void checkProtectiveLevels(TradeProposal proposal, UserSettings settings, List<RiskViolation> violations) {
        BigDecimal price = proposal.price();
        BigDecimal stopLoss = proposal.stopLoss();
        BigDecimal takeProfit = proposal.takeProfit();

        BigDecimal maxStop = price.multiply(BigDecimal.ONE.subtract(settings.getStopLossPct()));
        if (stopLoss == null) {
            violations.add(new RiskViolation(RiskRule.STOP_LOSS, "Stop-loss is missing"));
        } else if (stopLoss.compareTo(maxStop) > 0) {
            violations.add(new RiskViolation(RiskRule.STOP_LOSS,
                    "Stop-loss " + plain(stopLoss) + " is tighter than " + percent(settings.getStopLossPct())
                            + " below price (" + plain(maxStop) + ")"));
        }

        BigDecimal minTake = price.multiply(BigDecimal.ONE.add(settings.getTakeProfitPct()));
        if (takeProfit == null) {
            violations.add(new RiskViolation(RiskRule.TAKE_PROFIT, "Take-profit is missing"));
        } else if (takeProfit.compareTo(minTake) < 0) {
            violations.add(new RiskViolation(RiskRule.TAKE_PROFIT,
                    "Take-profit " + plain(takeProfit) + " is below " + percent(settings.getTakeProfitPct())
                            + " above price (" + plain(minTake) + ")"));
        }

        if (stopLoss == null || takeProfit == null) {
            violations.add(new RiskViolation(RiskRule.RISK_REWARD, "Risk/reward needs both stop-loss and take-profit"));
            return;
        }
        BigDecimal risk = price.subtract(stopLoss);
        BigDecimal reward = takeProfit.subtract(price);
        if (risk.signum() <= 0) {
            violations.add(new RiskViolation(RiskRule.RISK_REWARD, "Stop-loss must be below price"));
            return;
        }
        // compare reward >= ratio * risk instead of dividing
        if (reward.compareTo(settings.getMinRiskRewardRatio().multiply(risk)) < 0) {
            violations.add(new RiskViolation(RiskRule.RISK_REWARD,
                    "Risk/reward " + ratio(reward, risk) + " is below minimum "
                            + plain(settings.getMinRiskRewardRatio())));
        }
    }

    private void checkSession(SessionClock session, List<RiskViolation> violations) {
        int blackout = riskProperties.getBlackoutMinutes();
        if (session == null || !session.open()) {
            violations.add(new RiskViolation(RiskRule.SESSION_BLACKOUT, "Exchange session is closed"));
        } else if (session.minutesSinceOpen() < blackout) {
            violations.add(new RiskViolation(RiskRule.SESSION_BLACKOUT,
                    "Within " + blackout + " minutes of the session open"));
        } else if (session.minutesUntilClose() < blackout) {
            violations.add(new RiskViolation(RiskRule.SESSION_BLACKOUT,
                    "Within " + blackout + " minutes of the session close"));
        }
    }

    private void checkDailyLimits(PortfolioSnapshot snapshot, UserSettings settings, List<RiskViolation> violations) {
        Integer maxTrades = settings.getMaxTradesPerDay();
        if (maxTrades != null && snapshot.tradesToday() >= maxTrades) {
            violations.add(new RiskViolation(RiskRule.DAILY_TRADE_LIMIT,
                    "Daily trade limit of " + maxTrades + " reached"));
        }
        BigDecimal realized = snapshot.realizedPnlToday();
        if (settings.getDailyLossLimitPct() != null && realized != null && realized.signum() < 0
                && snapshot.initialCapital() != null) {
            BigDecimal loss = realized.negate();
            BigDecimal limit = settings.getDailyLossLimitPct().multiply(snapshot.initialCapital());
            if (loss.compareTo(limit) >= 0) {
                violations.add(new RiskViolation(RiskRule.DAILY_LOSS_LIMIT,
                        "Realized loss today " + plain(loss) + " reached the daily limit " + plain(limit)));
            }
        }
    }

    private static String percent(BigDecimal fraction) {
        return plain(fraction.multiply(BigDecimal.valueOf(100))) + "%";
    }

    private static String ratio(BigDecimal reward, BigDecimal risk) {
        return plain(reward.divide(risk, 2, RoundingMode.HALF_UP));
    }

    private static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
