package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.RiskProperties;
import com.tradeadvisor.backend.dto.OpenAccountRequest;
import com.tradeadvisor.backend.dto.PerformanceMetricsDTO;
import com.tradeadvisor.backend.dto.PortfolioSummaryDTO;
import com.tradeadvisor.backend.dto.PositionDTO;
import com.tradeadvisor.backend.dto.RiskMetricsDTO;
import com.tradeadvisor.backend.dto.TransactionDTO;
import com.tradeadvisor.backend.exception.BadRequestException;
import com.tradeadvisor.backend.exception.ConflictException;
import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.model.Portfolio;
import com.tradeadvisor.backend.model.Position;
import com.tradeadvisor.backend.model.RiskLevel;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.Transaction;
import com.tradeadvisor.backend.model.User;
import com.tradeadvisor.backend.repository.PortfolioRepository;
import com.tradeadvisor.backend.repository.PositionRepository;
import com.tradeadvisor.backend.repository.TransactionRepository;
import com.tradeadvisor.backend.repository.UserRepository;
import com.tradeadvisor.backend.repository.UserSettingsRepository;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Account opening and read-side portfolio reports. Cash and positions are only ever written by
 * {@link PortfolioLedger}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioService {

    private static final BigDecimal DROP_SCENARIO = new BigDecimal("0.10");
    private static final BigDecimal HIGH_CONCENTRATION = new BigDecimal("70");
    private static final BigDecimal MEDIUM_CONCENTRATION = new BigDecimal("50");
    private static final BigDecimal HIGH_RISK_LIQUIDITY = new BigDecimal("10");
    private static final BigDecimal MEDIUM_RISK_LIQUIDITY = new BigDecimal("20");

    private final UserRepository userRepository;
    private final PortfolioRepository portfolioRepository;
    private final PositionRepository positionRepository;
    private final TransactionRepository transactionRepository;
    private final UserSettingsRepository userSettingsRepository;
    private final UserSettingsService userSettingsService;
    private final PortfolioLedger portfolioLedger;
    private final MarketDataProvider marketDataProvider;
    private final AuditEventService auditEventService;
    private final RiskProperties riskProperties;
    private final Clock clock;

    @Transactional
    public PortfolioSummaryDTO openAccount(Long userId, OpenAccountRequest request) {
        if (userId == null) {
            throw new BadRequestException("User id is required");
        }
        if (portfolioRepository.existsByUserId(userId)) {
            throw new ConflictException("Portfolio already exists for user " + userId);
        }
        BigDecimal initialCapital = request != null && request.getInitialCapital() != null
                ? MoneyUtils.scale(request.getInitialCapital())
                : MoneyUtils.scale(riskProperties.getInitialCapital());
        Instant now = Instant.now(clock);
        User user = userRepository.findById(userId).orElseGet(() -> User.builder().id(userId).createdAt(now).build());
        if (request != null && request.getUsername() != null) {
            user.setUsername(request.getUsername());
        }
        user.setLastActiveAt(now);
        userRepository.save(user);

        Portfolio portfolio = portfolioRepository.save(Portfolio.builder()
                .userId(userId)
                .initialCapital(initialCapital)
                .cash(initialCapital)
                .build());
        if (userSettingsRepository.findByUserId(userId).isEmpty()) {
            userSettingsRepository.save(userSettingsService.defaultsFor(userId));
        }
        auditEventService.recordEvent(userId, AuditEventService.ACCOUNT, "OPENED",
                "Portfolio opened", Map.of("initialCapital", initialCapital));
        log.info("Opened portfolio {} for user {} with capital {}", portfolio.getId(), userId, initialCapital);
        return toSummary(userId, portfolio, List.of(), Map.of());
    }

    @Transactional(readOnly = true)
    public PortfolioSummaryDTO summary(Long userId) {
        Portfolio portfolio = portfolio(userId);
        List<Position> positions = positionRepository.findByPortfolioIdOrderByTickerAsc(portfolio.getId());
        return toSummary(userId, portfolio, positions, prices(positions));
    }

    @Transactional(readOnly = true)
    public List<TransactionDTO> transactions(Long userId, int limit) {
        Portfolio portfolio = portfolio(userId);
        int size = Math.max(1, Math.min(limit, 500));
        return transactionRepository.findByPortfolioIdOrderByTimestampDescIdDesc(portfolio.getId(), PageRequest.of(0, size)).stream()
                .map(TransactionDTO::from)
                .toList();
    }

    @Transactional(readOnly = true)
    public RiskMetricsDTO riskMetrics(Long userId) {
        PortfolioSummaryDTO summary = summary(userId);
        BigDecimal totalValue = summary.getTotalValue();
        BigDecimal concentration = MoneyUtils.percent(summary.getSharesValue(), totalValue);
        BigDecimal liquidity = MoneyUtils.percent(summary.getCash(), totalValue);
        return RiskMetricsDTO.builder()
                .totalValue(totalValue)
                .positionsValue(summary.getSharesValue())
                .concentrationPct(concentration)
                .liquidityPct(liquidity)
                .potentialLossOnDrop(MoneyUtils.applyRate(summary.getSharesValue(), DROP_SCENARIO))
                .riskLevel(riskLevel(concentration, liquidity))
                .build();
    }

    @Transactional(readOnly = true)
    public PerformanceMetricsDTO performance(Long userId, int days) {
        if (days < 1) {
            throw new BadRequestException("days must be at least 1");
        }
        Portfolio portfolio = portfolio(userId);
        Instant since = Instant.now(clock).minus(Duration.ofDays(days));
        List<Transaction> trades = transactionRepository
                .findByPortfolioIdAndTimestampGreaterThanEqualOrderByTimestampAsc(portfolio.getId(), since);
        int buys = (int) trades.stream().filter(trade -> trade.getAction() == TradeAction.BUY).count();
        BigDecimal volume = trades.stream().map(Transaction::getTotalAmount).reduce(MoneyUtils.ZERO, MoneyUtils::add);
        BigDecimal realized = trades.stream().map(Transaction::getRealizedPnl).reduce(MoneyUtils.ZERO, MoneyUtils::add);

        List<Position> positions = positionRepository.findByPortfolioIdOrderByTickerAsc(portfolio.getId());
        BigDecimal currentValue = portfolioLedger.computeTotalValue(portfolio.getCash(), snapshots(positions), prices(positions));
        BigDecimal pnl = MoneyUtils.subtract(currentValue, portfolio.getInitialCapital());
        return PerformanceMetricsDTO.builder()
                .periodDays(days)
                .totalTrades(trades.size())
                .buyTrades(buys)
                .sellTrades(trades.size() - buys)
                .totalVolume(volume)
                .avgTradeSize(MoneyUtils.divide(volume, BigDecimal.valueOf(trades.size())))
                .realizedPnl(realized)
                .currentValue(currentValue)
                .pnl(pnl)
                .pnlPct(MoneyUtils.percent(pnl, portfolio.getInitialCapital()))
                .build();
    }

    static RiskLevel riskLevel(BigDecimal concentrationPct, BigDecimal liquidityPct) {
        if (concentrationPct.compareTo(HIGH_CONCENTRATION) > 0 || liquidityPct.compareTo(HIGH_RISK_LIQUIDITY) < 0) {
            return RiskLevel.HIGH;
        }
        if (concentrationPct.compareTo(MEDIUM_CONCENTRATION) > 0 || liquidityPct.compareTo(MEDIUM_RISK_LIQUIDITY) < 0) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private PortfolioSummaryDTO toSummary(Long userId, Portfolio portfolio, List<Position> positions, Map<String, BigDecimal> prices) {
        List<PositionDTO> views = new ArrayList<>();
        BigDecimal sharesValue = MoneyUtils.ZERO;
        BigDecimal unrealized = MoneyUtils.ZERO;
        for (Position position : positions) {
            PositionSnapshot snapshot = toSnapshot(position);
            BigDecimal quote = prices.get(position.getTicker());
            BigDecimal price = quote != null ? quote : position.getAvgPurchasePrice();
            BigDecimal marketValue = quote != null ? MoneyUtils.multiply(quote, position.getShares()) : position.getCostBasis();
            BigDecimal positionPnl = quote != null ? portfolioLedger.computeUnrealizedPnl(snapshot, quote) : MoneyUtils.ZERO;
            sharesValue = MoneyUtils.add(sharesValue, marketValue);
            unrealized = MoneyUtils.add(unrealized, positionPnl);
            views.add(PositionDTO.builder()
                    .ticker(position.getTicker())
                    .shares(position.getShares())
                    .avgPurchasePrice(position.getAvgPurchasePrice())
                    .currentPrice(price)
                    .marketValue(marketValue)
                    .unrealizedPnl(positionPnl)
                    .build());
        }
        BigDecimal totalValue = portfolioLedger.computeTotalValue(portfolio.getCash(), snapshots(positions), prices);
        BigDecimal pnl = MoneyUtils.subtract(totalValue, portfolio.getInitialCapital());
        return PortfolioSummaryDTO.builder()
                .userId(userId)
                .cash(portfolio.getCash())
                .initialCapital(portfolio.getInitialCapital())
                .sharesValue(sharesValue)
                .totalValue(totalValue)
                .pnl(pnl)
                .pnlPct(MoneyUtils.percent(pnl, portfolio.getInitialCapital()))
                .unrealizedPnl(unrealized)
                .positions(views)
                .build();
    }

    private Map<String, BigDecimal> prices(List<Position> positions) {
        Map<String, BigDecimal> prices = new HashMap<>();
        for (Position position : positions) {
            try {
                marketDataProvider.currentPrice(position.getTicker())
                        .ifPresent(price -> prices.put(position.getTicker(), price));
            } catch (RuntimeException e) {
                log.warn("No quote for {}, valuing at average price: {}", position.getTicker(), e.getMessage());
            }
        }
        return prices;
    }

    private List<PositionSnapshot> snapshots(List<Position> positions) {
        return positions.stream().map(PortfolioService::toSnapshot).toList();
    }

    private static PositionSnapshot toSnapshot(Position position) {
        return new PositionSnapshot(position.getTicker(), position.getShares(), position.getAvgPurchasePrice(),
                position.getCostBasis());
    }

    private Portfolio portfolio(Long userId) {
        return portfolioRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Portfolio not found for user " + userId));
    }
}
