package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.model.Portfolio;
import com.tradeadvisor.backend.model.Position;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.repository.PortfolioRepository;
import com.tradeadvisor.backend.repository.PositionRepository;
import com.tradeadvisor.backend.repository.TransactionRepository;
import com.tradeadvisor.backend.repository.UserRepository;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.trading.pipeline.PortfolioSnapshot;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import com.tradeadvisor.backend.util.MoneyUtils;
import com.tradeadvisor.backend.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@SpringBootTest
class PortfolioLedgerTest {

    private static final Long USER_ID = 201L;

    @Autowired
    private PortfolioLedger portfolioLedger;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private PortfolioRepository portfolioRepository;

    @Autowired
    private PositionRepository positionRepository;

    @Autowired
    private TransactionRepository transactionRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private MarketDataProvider marketDataProvider;

    private Long portfolioId;

    @BeforeEach
    void setup() {
        TestFixtures.clearDatabase(jdbcTemplate);
        userRepository.save(TestFixtures.user(USER_ID));
        portfolioId = portfolioRepository.save(TestFixtures.portfolio(USER_ID, "100000")).getId();
    }

    @Test
    void buysAccumulateAtWeightedAveragePrice() {
        assertThat(portfolioLedger.applyTrade(trade(TradeAction.BUY, 100, "100", "0")).isApplied()).isTrue();
        assertThat(portfolioLedger.applyTrade(trade(TradeAction.BUY, 100, "110", "0")).isApplied()).isTrue();

        Position position = positionRepository.findByPortfolioIdAndTicker(portfolioId, "GAZP").orElseThrow();
        assertThat(position.getShares()).isEqualTo(200);
        assertThat(position.getAvgPurchasePrice()).isEqualByComparingTo("105");
        assertThat(cash()).isEqualByComparingTo("79000");
    }

    @Test
    void sellRealizesPnlNetOfCostsAndClosesPosition() {
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 10, "100", "0.5"));

        LedgerResult sell = portfolioLedger.applyTrade(trade(TradeAction.SELL, 10, "120", "0.5"));

        assertThat(sell.isApplied()).isTrue();
        assertThat(sell.transaction().getRealizedPnl()).isEqualByComparingTo("199.5");
        assertThat(positionRepository.findByPortfolioIdAndTicker(portfolioId, "GAZP")).isEmpty();
        assertThat(cash()).isEqualByComparingTo("100199");
    }

    @Test
    void sellingMoreThanHeldLeavesPortfolioUntouched() {
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 30, "170", "0"));
        BigDecimal cashBefore = cash();

        LedgerResult result = portfolioLedger.applyTrade(trade(TradeAction.SELL, 50, "170", "0"));

        assertThat(result.isApplied()).isFalse();
        assertThat(result.rejection()).isEqualTo(RejectionReason.INSUFFICIENT_SHARES);
        assertThat(cash()).isEqualByComparingTo(cashBefore);
        assertThat(positionRepository.findByPortfolioIdAndTicker(portfolioId, "GAZP").orElseThrow().getShares()).isEqualTo(30);
        assertThat(transactionRepository.findByPortfolioIdOrderByTimestampAsc(portfolioId)).hasSize(1);
    }

    @Test
    void buyingBeyondCashIsRejected() {
        LedgerResult result = portfolioLedger.applyTrade(trade(TradeAction.BUY, 500, "200", "1"));

        assertThat(result.rejection()).isEqualTo(RejectionReason.INSUFFICIENT_FUNDS);
        assertThat(cash()).isEqualByComparingTo("100000");
        assertThat(positionRepository.findByPortfolioIdOrderByTickerAsc(portfolioId)).isEmpty();
    }

    @Test
    void totalValueChangeEqualsRealizedPlusUnrealizedPnl() {
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 100, "170.10", "8.51"));
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 40, "165.35", "3.31"));
        portfolioLedger.applyTrade(trade(TradeAction.SELL, 70, "172.80", "6.05"));
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 15, "169.95", "1.27"));
        portfolioLedger.applyTrade(trade(TradeAction.SELL, 25, "174.40", "2.18"));

        BigDecimal currentPrice = MoneyUtils.bd("171.25");
        PortfolioSnapshot snapshot = portfolioLedger.snapshot(USER_ID, Map.of("GAZP", currentPrice), Instant.EPOCH);
        BigDecimal realized = transactionRepository.findByPortfolioIdOrderByTimestampAsc(portfolioId).stream()
                .map(transaction -> transaction.getRealizedPnl())
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        BigDecimal unrealized = snapshot.positions().stream()
                .map(position -> portfolioLedger.computeUnrealizedPnl(position, currentPrice))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);

        BigDecimal change = snapshot.totalValue().subtract(snapshot.initialCapital());
        assertThat(change.doubleValue()).isCloseTo(realized.add(unrealized).doubleValue(), within(0.01));
        assertThat(snapshot.tradesToday()).isEqualTo(5);
        assertThat(snapshot.sharesOf("GAZP")).isEqualTo(60);
    }

    @Test
    void pnlStaysExactForLargeLotsAtUnevenPrices() {
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 1, "100", "0.37"));
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 699, "101", "0.37"));
        portfolioLedger.applyTrade(trade(TradeAction.SELL, 517, "102.13", "0.37"));
        portfolioLedger.applyTrade(trade(TradeAction.BUY, 333, "100.37", "0.37"));
        portfolioLedger.applyTrade(trade(TradeAction.SELL, 101, "99.99", "0.37"));

        BigDecimal currentPrice = MoneyUtils.bd("101.07");
        PortfolioSnapshot snapshot = portfolioLedger.snapshot(USER_ID, Map.of("GAZP", currentPrice), Instant.EPOCH);
        BigDecimal realized = transactionRepository.findByPortfolioIdOrderByTimestampAsc(portfolioId).stream()
                .map(transaction -> transaction.getRealizedPnl())
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);
        BigDecimal unrealized = snapshot.positions().stream()
                .map(position -> portfolioLedger.computeUnrealizedPnl(position, currentPrice))
                .reduce(MoneyUtils.ZERO, MoneyUtils::add);

        assertThat(snapshot.sharesOf("GAZP")).isEqualTo(415);
        assertThat(snapshot.totalValue()).isEqualByComparingTo("100720.19");
        assertThat(realized.add(unrealized)).isEqualByComparingTo("720.19");
        assertThat(positionRepository.findByPortfolioIdAndTicker(portfolioId, "GAZP").orElseThrow().getCostBasis())
                .isEqualByComparingTo("41746.0633");
    }

    @Test
    void concurrentTradesForOneUserAreSerialized() throws Exception {
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(10);
        try {
            List<Future<LedgerResult>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return portfolioLedger.applyTrade(trade(TradeAction.BUY, 10, "100", "0"));
                }));
            }
            start.countDown();
            for (Future<LedgerResult> future : futures) {
                assertThat(future.get(30, TimeUnit.SECONDS).isApplied()).isTrue();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(positionRepository.findByPortfolioIdAndTicker(portfolioId, "GAZP").orElseThrow().getShares()).isEqualTo(100);
        assertThat(cash()).isEqualByComparingTo("90000");
        assertThat(transactionRepository.findByPortfolioIdOrderByTimestampAsc(portfolioId)).hasSize(10);
    }

    @Test
    void lockSetStaysBoundedAcrossManyUsers() {
        Set<ReentrantLock> locks = Collections.newSetFromMap(new IdentityHashMap<>());
        for (long userId = 1; userId <= 100_000; userId++) {
            locks.add(portfolioLedger.lockFor(userId));
        }

        assertThat(locks).hasSize(PortfolioLedger.LOCK_STRIPES);
        assertThat(portfolioLedger.lockFor(USER_ID)).isSameAs(portfolioLedger.lockFor(USER_ID));
        assertThat(portfolioLedger.withExclusiveAccess(USER_ID, () -> portfolioLedger.lockFor(USER_ID).isHeldByCurrentThread())).isTrue();
        assertThat(portfolioLedger.lockFor(USER_ID).isLocked()).isFalse();
    }

    @Test
    void unquotedPositionIsValuedAtAveragePrice() {
        BigDecimal total = portfolioLedger.computeTotalValue(MoneyUtils.bd("1000"),
                List.of(new PositionSnapshot("GAZP", 10, MoneyUtils.bd("50")), new PositionSnapshot("SBER", 2, MoneyUtils.bd("300"))),
                Map.of("SBER", MoneyUtils.bd("310")));

        assertThat(total).isEqualByComparingTo("2120");
    }

    private BigDecimal cash() {
        Portfolio portfolio = portfolioRepository.findByUserId(USER_ID).orElseThrow();
        return portfolio.getCash();
    }

    private static TradeInstruction trade(TradeAction action, int shares, String price, String commission) {
        return new TradeInstruction(USER_ID, action, "GAZP", shares, MoneyUtils.bd(price), MoneyUtils.bd(commission),
                MoneyUtils.ZERO, null);
    }
}
