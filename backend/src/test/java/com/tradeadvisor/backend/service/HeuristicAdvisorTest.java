package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.config.RiskProperties;
import com.tradeadvisor.backend.model.RecommendationSource;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.trading.pipeline.AnalysisContext;
import com.tradeadvisor.backend.trading.pipeline.DefaultRiskEngine;
import com.tradeadvisor.backend.trading.pipeline.PositionSnapshot;
import com.tradeadvisor.backend.trading.pipeline.TradeProposal;
import com.tradeadvisor.backend.util.MoneyUtils;
import com.tradeadvisor.backend.util.TestFixtures;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class HeuristicAdvisorTest {

    private final HeuristicAdvisor heuristicAdvisor = new HeuristicAdvisor(new AdvisorProperties());

    @Test
    void oversoldBuysWithinPositionLimitAndPassesRiskRules() {
        AnalysisContext context = context(25.0, "100", List.of());

        TradeProposal proposal = heuristicAdvisor.propose(context).orElseThrow();

        assertThat(proposal.action()).isEqualTo(TradeAction.BUY);
        assertThat(proposal.quantity()).isEqualTo(300);
        assertThat(proposal.stopLoss()).isEqualByComparingTo("95");
        assertThat(proposal.takeProfit()).isEqualByComparingTo("110");
        assertThat(proposal.confidence()).isEqualTo(60);
        assertThat(proposal.source()).isEqualTo(RecommendationSource.HEURISTIC);
        assertThat(new DefaultRiskEngine(new RiskProperties())
                .validate(proposal, context.portfolio(), context.settings(), context.session()).ok()).isTrue();
    }

    @Test
    void overboughtSellsTheHolding() {
        TradeProposal proposal = heuristicAdvisor.propose(
                context(78.0, "100", List.of(new PositionSnapshot("GAZP", 30, MoneyUtils.bd("90"))))).orElseThrow();

        assertThat(proposal.action()).isEqualTo(TradeAction.SELL);
        assertThat(proposal.quantity()).isEqualTo(30);
    }

    @Test
    void overboughtWithoutSharesHolds() {
        TradeProposal proposal = heuristicAdvisor.propose(context(78.0, "100", List.of())).orElseThrow();

        assertThat(proposal.isHold()).isTrue();
        assertThat(proposal.reasoning()).contains("no shares are held");
    }

    @Test
    void neutralRsiHolds() {
        assertThat(heuristicAdvisor.propose(context(50.0, "100", List.of())).orElseThrow().isHold()).isTrue();
    }

    @Test
    void emptyWithoutPriceOrRsi() {
        assertThat(heuristicAdvisor.propose(context(null, "100", List.of()))).isEqualTo(Optional.empty());
        assertThat(heuristicAdvisor.propose(context(25.0, null, List.of()))).isEmpty();
    }

    static AnalysisContext context(Double rsi, String price, List<PositionSnapshot> positions) {
        return TestFixtures.analysisContext(1L, rsi, price, positions);
    }
}
