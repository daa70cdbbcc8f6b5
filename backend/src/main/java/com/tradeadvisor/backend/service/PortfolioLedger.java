package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.BadRequestException;
import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.exception.TradeRejectedException;
import com.tradeadvisor.backend.model.Portfolio;
import com.tradeadvisor.backend.model.Position;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.Transaction;
import com.tradeadvisor.backend.repository.PortfolioRepository;
import com.tradeadvisor.backend.repository.PositionRepository;
import com.tradeadvisor.backend.repository.TransactionRepository;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import com.tradeadvisor.backend.util.MoneyUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Sole writer of cash and positions. Every mutation for a user runs while holding that user's lock,
 * and the lock is held across the whole database transaction; the portfolio {@code @Version}
 * catches any writer that bypasses the lock.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioLedger {

    private final PortfolioRepository portfolioRepository;
    private final PositionRepository positionRepository;
    private final TransactionRepository transactionRepository;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    static final int LOCK_STRIPES = 64;

    // fixed stripe: unbounded user ids share a bounded lock set
    private final ReentrantLock[] userLocks = newLockStripes();

    /**
     * Applies one trade in its own transaction under the user's lock.
     */
    public LedgerResult applyTrade(TradeInstruction instruction) {
        try {
            Transaction transaction = withExclusiveAccess(instruction.userId(),
                    () -> transactionTemplate.execute(status -> apply(instruction)));
            return LedgerResult.applied(transaction);
        } catch (TradeRejectedException e) {
            log.info("Ledger rejected {} {} x{} for user {}: {}", instruction.action(), instruction.ticker(),
                    instruction.shares(), instruction.userId(), e.getMessage());
            return LedgerResult.rejected(e.getReason(), e.getMessage());
        }
    }

    public <T> T withExclusiveAccess(Long userId, Supplier<T> work) {
        ReentrantLock lock = lockFor(userId);
        lock.lock();
        try {
            return work.get();
        } finally {
            lock.unlock();
        }
    }

    ReentrantLock lockFor(Long userId) {
        return userLocks[Math.floorMod(Long.hashCode(userId), LOCK_STRIPES)];
    }

    private static ReentrantLock[] newLockStripes() {
        ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];
        for (int i = 0; i < LOCK_STRIPES; i++) {
            locks[i] = new ReentrantLock();
        }
        return locks;
    }

    /**
     * Mutates cash and position and inserts the transaction row. The caller must hold the user's lock
     * and an open transaction; a {@link TradeRejectedException} leaves the caller to roll back.
     */
    public Transaction apply(TradeInstruction instruction) {
        validate(instruction);
        Portfolio portfolio = portfolioRepository.findByUserId(instruction.userId())
                .orElseThrow(() -> new NotFoundException("Portfolio not found for user " + instruction.userId()));
        Optional<Position> existing = positionRepository.findByPortfolioIdAndTicker(portfolio.getId(), instruction.ticker());

        BigDecimal price = MoneyUtils.scale(instruction.price());
        BigDecimal commission = MoneyUtils.scale(instruction.commission());
        BigDecimal slippage = MoneyUtils.scale(instruction.slippage());
        BigDecimal notional = MoneyUtils.multiply(price, instruction.shares());
        BigDecimal costs = MoneyUtils.add(commission, slippage);

        BigDecimal realizedPnl = instruction.action() == TradeAction.BUY
                ? buy(portfolio, existing, instruction, price, notional, costs)
                : sell(portfolio, existing, instruction, price, notional, costs);
        portfolioRepository.save(portfolio);

        Transaction transaction = transactionRepository.save(Transaction.builder()
                .portfolioId(portfolio.getId())
                .action(instruction.action())
                .ticker(instruction.ticker())
                .shares(instruction.shares())
                .price(price)
                .commission(commission)
                .slippage(slippage)
                .totalAmount(notional)
                .realizedPnl(realizedPnl)
                .recommendationId(instruction.recommendationId())
                .timestamp(Instant.now(clock))
                .build());
        log.info("Applied {} {} x{} @ {} for user {} (cash now {})", instruction.action(), instruction.ticker(),
                instruction.shares(), price, instruction.userId(), portfolio.getCash());
        return transaction;
    }

    private BigDecimal buy(Portfolio portfolio, Optional<Position> existing, TradeInstruction instruction,
                           BigDecimal price, BigDecimal notional, BigDecimal costs) {
        BigDecimal required = MoneyUtils.add(notional, costs);
        if (portfolio.getCash().compareTo(required) < 0) {
            throw new TradeRejectedException(RejectionReason.INSUFFICIENT_FUNDS,
                    "Insufficient funds: required " + required + ", available " + portfolio.getCash());
        }
        portfolio.setCash(MoneyUtils.subtract(portfolio.getCash(), required));

        Position position = existing.orElseGet(() -> Position.builder()
                .portfolioId(portfolio.getId())
                .ticker(instruction.ticker())
                .shares(0)
                .avgPurchasePrice(MoneyUtils.ZERO)
                .costBasis(MoneyUtils.ZERO)
                .build());
        int newShares = position.getShares() + instruction.shares();
        BigDecimal newCostBasis = MoneyUtils.add(position.getCostBasis(), notional);
        position.setShares(newShares);
        position.setCostBasis(newCostBasis);
        position.setAvgPurchasePrice(MoneyUtils.divide(newCostBasis, BigDecimal.valueOf(newShares)));
        positionRepository.save(position);
        return costs.negate();
    }

    private BigDecimal sell(Portfolio portfolio, Optional<Position> existing, TradeInstruction instruction,
                            BigDecimal price, BigDecimal notional, BigDecimal costs) {
        int held = existing.map(Position::getShares).orElse(0);
        if (instruction.shares() > held) {
            throw new TradeRejectedException(RejectionReason.INSUFFICIENT_SHARES,
                    "Insufficient shares: requested " + instruction.shares() + ", held " + held);
        }
        Position position = existing.get();
        int remaining = held - instruction.shares();
        // a full close realizes the whole remaining basis
        BigDecimal soldCost = remaining == 0
                ? position.getCostBasis()
                : MoneyUtils.scale(position.getCostBasis().multiply(BigDecimal.valueOf(instruction.shares()))
                        .divide(BigDecimal.valueOf(held), MoneyUtils.SCALE, RoundingMode.HALF_UP));
        BigDecimal gross = MoneyUtils.subtract(notional, soldCost);
        portfolio.setCash(MoneyUtils.add(portfolio.getCash(), MoneyUtils.subtract(notional, costs)));

        if (remaining == 0) {
            positionRepository.delete(position);
        } else {
            position.setShares(remaining);
            position.setCostBasis(MoneyUtils.subtract(position.getCostBasis(), soldCost));
            positionRepository.save(position);
        }
        return MoneyUtils.subtract(gross, costs);
    }

    private void validate(TradeInstruction instruction) {
        if (instruction.action() == null || instruction.action() == TradeAction.HOLD) {
            throw new BadRequestException("Only BUY and SELL can be applied to the ledger");
        }
        if (instruction.shares() <= 0) {
            throw new BadRequestException("Shares must be greater than zero");
        }
        if (!MoneyUtils.isPositive(instruction.price())) {
            throw new BadRequestException("Price must be greater than zero");
        }
        if (instruction.ticker() == null || instruction.ticker().isBlank()) {
            throw new BadRequestException("Ticker is required");
        }
        if (isNegative(instruction.commission()) || isNegative(instruction.slippage())) {
            throw new BadRequestException("Costs cannot be negative");
        }
    }

    private static boolean isNegative(BigDecimal value) {
        return value != null && value.signum() < 0;
    }

    public BigDecimal computeUnrealizedPnl(PositionSnapshot position, BigDecimal currentPrice) {
        if (currentPrice == null) {
            return MoneyUtils.ZERO;
        }
        return MoneyUtils.subtract(MoneyUtils.multiply(currentPrice, position.shares()), position.costBasis());
    }

    /**
     * {@code cash + sum(shares * price)}; a position without a quote is valued at its cost basis.
     */
    public BigDecimal computeTotalValue(BigDecimal cash, Collection<PositionSnapshot> positions, Map<String, BigDecimal> prices) {
        BigDecimal total = MoneyUtils.scale(cash);
        for (PositionSnapshot position : positions) {
            BigDecimal price = prices.get(position.ticker());
            total = MoneyUtils.add(total, price == null
                    ? position.costBasis()
                    : MoneyUtils.multiply(price, position.shares()));
        }
        return total;
    }

    @Transactional(readOnly = true)
    public PortfolioSnapshot snapshot(Long userId, Map<String, BigDecimal> prices, Instant dayStart) {
        Portfolio portfolio = portfolioRepository.findByUserId(userId)
                .orElseThrow(() -> new NotFoundException("Portfolio not found for user " + userId));
        List<PositionSnapshot> positions = positionRepository.findByPortfolioIdOrderByTickerAsc(portfolio.getId()).stream()
                .map(position -> new PositionSnapshot(position.getTicker(), position.getShares(),
                        position.getAvgPurchasePrice(), position.getCostBasis()))
                .toList();
        List<Transaction> today = transactionRepository
                .findByPortfolioIdAndTimestampGreaterThanEqualOrderByTimestampAsc(portfolio.getId(), dayStart);
        BigDecimal realizedToday = today.stream()
                .map(Transaction::getRealizedPnl)
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        return new PortfolioSnapshot(
                userId,
                portfolio.getCash(),
                portfolio.getInitialCapital(),
                positions,
                computeTotalValue(portfolio.getCash(), positions, prices),
                today.size(),
                realizedToday);
    }
}
