package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.exception.AdvisorResponseException;
import com.tradeadvisor.backend.exception.AdvisorUnavailableException;
import com.tradeadvisor.backend.exception.BadRequestException;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.repository.RecommendationRepository;
import com.tradeadvisor.backend.trading.pipeline.AdvisorClient;
import com.tradeadvisor.backend.trading.pipeline.AdvisorPrompt;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.RetryPolicy;
import com.tradeadvisor.backend.trading.pipeline.RiskEngine;
import com.tradeadvisor.backend.trading.pipeline.TradeProposal;
import com.tradeadvisor.backend.trading.pipeline.ValidationResult;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.regex.Pattern;

/**
 * Produces a persisted PENDING recommendation for (user, ticker). Order of preference: a live cached
 * advisor proposal, a fresh advisor call under the retry policy, the RSI heuristic, then a
 * conservative HOLD. Advisor and parse failures never escape; the final proposal is always run
 * through the risk engine, and any violation turns it into a HOLD.
 */
@Service
@Slf4j
public class RecommendationProvider {

    private static final Pattern TICKER = Pattern.compile("[A-Z0-9.]{1,16}");

    private final ContextBuilder contextBuilder;
    private final RecommendationCache recommendationCache;
    private final AdvisorClient advisorClient;
    private final PromptFormatter promptFormatter;
    private final ResponseValidator responseValidator;
    private final HeuristicAdvisor heuristicAdvisor;
    private final RiskEngine riskEngine;
    private final RecommendationRepository recommendationRepository;
    private final AuditEventService auditEventService;
    private final AdvisorProperties advisorProperties;
    private final RetryPolicy retryPolicy;
    private final AsyncTaskExecutor advisorExecutor;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public RecommendationProvider(ContextBuilder contextBuilder,
                                  RecommendationCache recommendationCache,
                                  AdvisorClient advisorClient,
                                  PromptFormatter promptFormatter,
                                  ResponseValidator responseValidator,
                                  HeuristicAdvisor heuristicAdvisor,
                                  RiskEngine riskEngine,
                                  RecommendationRepository recommendationRepository,
                                  AuditEventService auditEventService,
                                  AdvisorProperties advisorProperties,
                                  RetryPolicy retryPolicy,
                                  @Qualifier("advisorExecutor") AsyncTaskExecutor advisorExecutor,
                                  MeterRegistry meterRegistry,
                                  Clock clock) {
        this.contextBuilder = contextBuilder;
        this.recommendationCache = recommendationCache;
        this.advisorClient = advisorClient;
        this.promptFormatter = promptFormatter;
        this.responseValidator = responseValidator;
        this.heuristicAdvisor = heuristicAdvisor;
        this.riskEngine = riskEngine;
        this.recommendationRepository = recommendationRepository;
        this.auditEventService = auditEventService;
        this.advisorProperties = advisorProperties;
        this.retryPolicy = retryPolicy;
        this.advisorExecutor = advisorExecutor;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
    }

    public Recommendation getRecommendation(Long userId, String ticker) {
        if (userId == null) {
            throw new BadRequestException("User id is required");
        }
        String normalized = normalizeTicker(ticker);
        Instant deadline = Instant.now(clock).plus(advisorProperties.getDeadline());

        AnalysisContext context = contextBuilder.build(userId, normalized);
        TradeProposal proposal = resolveProposal(context, deadline);
        ValidationResult validation = riskEngine.validate(proposal, context.portfolio(), context.settings(), context.session());
        if (!validation.ok()) {
            log.info("Risk rules downgraded {} {} for user {}: {}", proposal.action(), normalized, userId, validation.ruleNames());
            proposal = downgrade(proposal, validation);
        }
        Recommendation saved = persist(userId, normalized, proposal, validation);
        meterRegistry.counter("advisor_recommendations", "source", proposal.source().name()).increment();
        log.info("Recommendation {} for user {}: {} {} x{} source={} confidence={}", saved.getId(), userId,
                saved.getAction(), normalized, saved.getQuantity(), saved.getSource(), saved.getConfidence());
        return saved;
    }

    private TradeProposal resolveProposal(AnalysisContext context, Instant deadline) {
        RecommendationCache.CacheKey key = new RecommendationCache.CacheKey(context.userId(), context.ticker());
        try {
            TradeProposal advised = recommendationCache.getOrCompute(key, advisorProperties.getCache().getTtl(),
                    () -> fetchFromAdvisor(context, deadline));
            return advised.toBuilder().ticker(context.ticker()).build();
        } catch (AdvisorUnavailableException | AdvisorResponseException e) {
            log.warn("Advisor stage failed for user {} {}: {}; falling back to heuristic",
                    context.userId(), context.ticker(), e.getMessage());
            recordFallback(context, "FALLBACK_HEURISTIC", e);
        } catch (RuntimeException e) {
            log.error("Unexpected advisor stage failure for user {} {}; falling back to heuristic",
                    context.userId(), context.ticker(), e);
            recordFallback(context, "FALLBACK_HEURISTIC", e);
        }

        return heuristicAdvisor.propose(context).orElseGet(() -> {
            log.warn("Heuristic unavailable for user {} {} (price={}, rsi={}); returning conservative default",
                    context.userId(), context.ticker(), context.market().currentPrice(), context.indicators().rsi14());
            recordFallback(context, "FALLBACK_DEFAULT", null);
            return TradeProposal.conservativeDefault(context.ticker(), context.market().currentPrice());
        });
    }

    private TradeProposal fetchFromAdvisor(AnalysisContext context, Instant deadline) {
        AdvisorPrompt prompt = promptFormatter.format(context);
        String raw = callWithRetry(prompt, deadline);
        return responseValidator.parse(raw);
    }

    /**
     * Runs the retry loop on the advisor executor and waits no longer than the deadline.
     * On timeout the worker is interrupted, which abandons any remaining attempts.
     */
    private String callWithRetry(AdvisorPrompt prompt, Instant deadline) {
        long remainingMs = Duration.between(Instant.now(clock), deadline).toMillis();
        if (remainingMs <= 0) {
            throw new AdvisorUnavailableException("Deadline passed before the advisor was called", false);
        }
        Retry retry = Retry.of("advisor", retryPolicy.toRetryConfig());
        retry.getEventPublisher().onRetry(event -> log.warn("Advisor attempt {} failed, retrying in {} ms: {}",
                event.getNumberOfRetryAttempts(), event.getWaitInterval().toMillis(),
                event.getLastThrowable() == null ? "" : event.getLastThrowable().getMessage()));

        Future<String> attempt;
        try {
            attempt = advisorExecutor.submit(() -> Retry.decorateSupplier(retry, () -> {
                if (Thread.currentThread().isInterrupted()) {
                    throw new AdvisorUnavailableException("Advisor call abandoned after deadline", false);
                }
                return advisorClient.requestRecommendation(prompt);
            }).get());
        } catch (TaskRejectedException e) {
            throw new AdvisorUnavailableException("Advisor executor saturated", false, e);
        }
        try {
            return attempt.get(remainingMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            attempt.cancel(true);
            throw new AdvisorUnavailableException("Advisor deadline of " + advisorProperties.getDeadlineMs() + " ms exceeded", false, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            attempt.cancel(true);
            throw new AdvisorUnavailableException("Interrupted while waiting for the advisor", false, e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AdvisorUnavailableException unavailable) {
                throw unavailable;
            }
            if (cause instanceof AdvisorResponseException invalid) {
                throw invalid;
            }
            throw new AdvisorUnavailableException("Advisor call failed: " + cause, false, cause);
        }
    }

    private TradeProposal downgrade(TradeProposal proposal, ValidationResult validation) {
        String original = proposal.reasoning() == null || proposal.reasoning().isBlank() ? "" : proposal.reasoning() + " | ";
        return proposal.toBuilder()
                .action(TradeAction.HOLD)
                .quantity(0)
                .riskLevel(RiskLevel.LOW)
                .reasoning(original + "Downgraded to HOLD by risk rules: " + validation.messages())
                .build();
    }

    private Recommendation persist(Long userId, String ticker, TradeProposal proposal, ValidationResult validation) {
        Instant now = Instant.now(clock);
        Recommendation recommendation = Recommendation.builder()
                .userId(userId)
                .ticker(ticker)
                .action(proposal.action())
                .quantity(proposal.quantity())
                .price(proposal.price())
                .stopLoss(proposal.stopLoss())
                .takeProfit(proposal.takeProfit())
                .reasoning(truncate(proposal.reasoning(), 4000))
                .riskLevel(proposal.riskLevel())
                .confidence(proposal.confidence())
                .status(RecommendationStatus.PENDING)
                .source(proposal.source())
                .timeHorizon(truncate(proposal.timeHorizon(), 64))
                .keyFactors(truncate(String.join("; ", proposal.keyFactors()), 2000))
                .riskViolations(validation.ok() ? null : validation.ruleNames())
                .createdAt(now)
                .expiresAt(now.plus(advisorProperties.getRecommendation().getTtl()))
                .build();
        return recommendationRepository.save(recommendation);
    }

    private void recordFallback(AnalysisContext context, String action, RuntimeException cause) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("ticker", context.ticker());
        if (cause != null) {
            metadata.put("error", cause.getClass().getSimpleName());
            metadata.put("reason", cause.getMessage());
            if (cause instanceof AdvisorResponseException invalid) {
                metadata.put("field", invalid.getField());
            }
        }
        auditEventService.recordEvent(context.userId(), AuditEventService.ADVISOR, action,
                "Recommendation fallback: " + action, metadata);
    }

    private static String normalizeTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new BadRequestException("Ticker is required");
        }
        String normalized = ticker.trim().toUpperCase(Locale.ROOT);
        if (!TICKER.matcher(normalized).matches()) {
            throw new BadRequestException("Invalid ticker: " + ticker);
        }
        return normalized;
    }

    private static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
