package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.ExecutionProperties;
import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.exception.TradeRejectedException;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.Transaction;
import com.tradeadvisor.backend.repository.RecommendationRepository;
import com.tradeadvisor.backend.util.MoneyUtils;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Executes a confirmed recommendation. Under the user's ledger lock and inside one database
 * transaction it claims the recommendation (PENDING to CONFIRMED), applies the trade to the ledger
 * and writes the transaction row. Any rejection rolls the claim back, leaving the recommendation PENDING.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class TradeExecutor {

    private final RecommendationRepository recommendationRepository;
    private final PortfolioLedger portfolioLedger;
    private final RecommendationLifecycleService lifecycleService;
    private final RecommendationCache recommendationCache;
    private final AuditEventService auditEventService;
    private final ExecutionProperties executionProperties;
    private final TransactionTemplate transactionTemplate;
    private final Retry tradePersistenceRetry;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ExecutionResult execute(Long recommendationId, Long userId) {
        Recommendation recommendation = recommendationRepository.findByIdAndUserId(recommendationId, userId)
                .orElseThrow(() -> new NotFoundException("Recommendation " + recommendationId + " not found"));
        if (recommendation.getAction() == TradeAction.HOLD || recommendation.getQuantity() == null
                || recommendation.getQuantity() <= 0) {
            return reject(recommendation, RejectionReason.NOT_EXECUTABLE, "HOLD recommendations have nothing to execute");
        }

        try {
            Transaction transaction = portfolioLedger.withExclusiveAccess(userId, () ->
                    Retry.decorateSupplier(tradePersistenceRetry, () ->
                            transactionTemplate.execute(status -> executeUnit(recommendation, userId))).get());
            recommendationCache.invalidate(new RecommendationCache.CacheKey(userId, recommendation.getTicker()));
            auditEventService.recordEvent(userId, AuditEventService.EXECUTION, "CONFIRMED",
                    "Executed " + transaction.getAction() + " " + transaction.getShares() + " " + transaction.getTicker(),
                    metadata(recommendation, transaction, null));
            meterRegistry.counter("trade_executions", "result", "EXECUTED").increment();
            log.info("Executed recommendation {} for user {}: {} {} x{} @ {} (commission {}, slippage {})",
                    recommendationId, userId, transaction.getAction(), transaction.getTicker(), transaction.getShares(),
                    transaction.getPrice(), transaction.getCommission(), transaction.getSlippage());
            return ExecutionResult.executed(recommendationId, transaction);
        } catch (TradeRejectedException e) {
            if (e.getReason() == RejectionReason.EXPIRED) {
                lifecycleService.expire(recommendationId);
            }
            return reject(recommendation, e.getReason(), e.getMessage());
        } catch (DataAccessException | TransactionException e) {
            log.error("Persisting execution of recommendation {} failed after {} attempts",
                    recommendationId, executionProperties.getPersistenceRetry().getMaxAttempts(), e);
            return reject(recommendation, RejectionReason.PERSISTENCE_FAILED, "Could not persist the trade, please retry");
        }
    }

    private Transaction executeUnit(Recommendation recommendation, Long userId) {
        Instant now = Instant.now(clock);
        int claimed = recommendationRepository.resolveIfPending(recommendation.getId(), userId,
                RecommendationStatus.PENDING, RecommendationStatus.CONFIRMED, now);
        if (claimed == 0) {
            throw classifyLostClaim(recommendation.getId(), userId, now);
        }

        BigDecimal notional = MoneyUtils.multiply(recommendation.getPrice(), recommendation.getQuantity());
        BigDecimal commission = MoneyUtils.applyRate(notional, executionProperties.getCommissionRate());
        BigDecimal slippage = MoneyUtils.applyRate(notional,
                executionProperties.getSlippageBps().divide(MoneyUtils.BASIS_POINTS));
        return portfolioLedger.apply(new TradeInstruction(
                userId,
                recommendation.getAction(),
                recommendation.getTicker(),
                recommendation.getQuantity(),
                recommendation.getPrice(),
                commission,
                slippage,
                recommendation.getId()));
    }

    private TradeRejectedException classifyLostClaim(Long recommendationId, Long userId, Instant now) {
        Recommendation current = recommendationRepository.findByIdAndUserId(recommendationId, userId)
                .orElseThrow(() -> new NotFoundException("Recommendation " + recommendationId + " not found"));
        if (current.getStatus() == RecommendationStatus.EXPIRED
                || (current.getStatus() == RecommendationStatus.PENDING && current.isExpired(now))) {
            return new TradeRejectedException(RejectionReason.EXPIRED, "Recommendation " + recommendationId + " has expired");
        }
        return new TradeRejectedException(RejectionReason.ALREADY_RESOLVED,
                "Recommendation " + recommendationId + " is already " + current.getStatus());
    }

    private ExecutionResult reject(Recommendation recommendation, RejectionReason reason, String message) {
        log.info("Execution of recommendation {} rejected: {} ({})", recommendation.getId(), reason, message);
        meterRegistry.counter("trade_executions", "result", reason.name()).increment();
        auditEventService.recordEvent(recommendation.getUserId(), AuditEventService.EXECUTION, "REJECTED_" + reason.name(),
                message, metadata(recommendation, null, reason));
        return ExecutionResult.rejected(recommendation.getId(), reason, message);
    }

    private Map<String, Object> metadata(Recommendation recommendation, Transaction transaction, RejectionReason reason) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("recommendationId", recommendation.getId());
        metadata.put("ticker", recommendation.getTicker());
        metadata.put("action", recommendation.getAction().name());
        metadata.put("quantity", recommendation.getQuantity());
        if (transaction != null) {
            metadata.put("transactionId", transaction.getId());
            metadata.put("price", transaction.getPrice());
        }
        if (reason != null) {
            metadata.put("reason", reason.name());
        }
        return metadata;
    }
}
