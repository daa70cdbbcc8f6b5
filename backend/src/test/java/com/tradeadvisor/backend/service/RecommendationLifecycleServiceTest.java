package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.exception.TradeRejectedException;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.RecommendationStatus;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.repository.RecommendationRepository;
import com.tradeadvisor.backend.repository.UserRepository;
import com.tradeadvisor.backend.trading.pipeline.MarketDataProvider;
import com.tradeadvisor.backend.util.TestFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class RecommendationLifecycleServiceTest {

    private static final Long USER_ID = 401L;

    @Autowired
    private RecommendationLifecycleService lifecycleService;

    @Autowired
    private RecommendationExpirySweeper expirySweeper;

    @Autowired
    private RecommendationRepository recommendationRepository;

    @Autowired
    private UserRepository userRepository;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @MockBean
    private MarketDataProvider marketDataProvider;

    @BeforeEach
    void setup() {
        TestFixtures.clearDatabase(jdbcTemplate);
        userRepository.save(TestFixtures.user(USER_ID));
    }

    @Test
    void rejectResolvesPendingOnce() {
        Recommendation recommendation = fresh();

        Recommendation rejected = lifecycleService.reject(recommendation.getId(), USER_ID);

        assertThat(rejected.getStatus()).isEqualTo(RecommendationStatus.REJECTED);
        assertThat(rejected.getResolvedAt()).isNotNull();
        assertThatThrownBy(() -> lifecycleService.reject(recommendation.getId(), USER_ID))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectionReason.ALREADY_RESOLVED));
    }

    @Test
    void rejectingOverdueRecommendationExpiresIt() {
        Recommendation recommendation = overdue();

        assertThatThrownBy(() -> lifecycleService.reject(recommendation.getId(), USER_ID))
                .isInstanceOfSatisfying(TradeRejectedException.class,
                        ex -> assertThat(ex.getReason()).isEqualTo(RejectionReason.EXPIRED));
        assertThat(recommendationRepository.findById(recommendation.getId()).orElseThrow().getStatus())
                .isEqualTo(RecommendationStatus.EXPIRED);
    }

    @Test
    void readingOverdueRecommendationExpiresItLazily() {
        Recommendation recommendation = overdue();

        assertThat(lifecycleService.find(recommendation.getId(), USER_ID).getStatus()).isEqualTo(RecommendationStatus.EXPIRED);
        assertThat(lifecycleService.find(fresh().getId(), USER_ID).getStatus()).isEqualTo(RecommendationStatus.PENDING);
    }

    @Test
    void sweepExpiresOnlyOverduePending() {
        Recommendation stale = overdue();
        Recommendation live = fresh();

        expirySweeper.sweep();

        assertThat(recommendationRepository.findById(stale.getId()).orElseThrow().getStatus()).isEqualTo(RecommendationStatus.EXPIRED);
        assertThat(recommendationRepository.findById(live.getId()).orElseThrow().getStatus()).isEqualTo(RecommendationStatus.PENDING);
    }

    @Test
    void historyIsNewestFirstAndScopedToUser() {
        userRepository.save(TestFixtures.user(402L));
        Instant now = Instant.now();
        Recommendation older = recommendationRepository.save(TestFixtures.pending(USER_ID, TradeAction.BUY, 1, "100", now.minusSeconds(60)));
        Recommendation newer = recommendationRepository.save(TestFixtures.pending(USER_ID, TradeAction.HOLD, 0, "100", now));
        recommendationRepository.save(TestFixtures.pending(402L, TradeAction.BUY, 1, "100", now));

        List<Recommendation> history = lifecycleService.history(USER_ID, 20);

        assertThat(history).extracting(Recommendation::getId).containsExactly(newer.getId(), older.getId());
        assertThat(lifecycleService.history(USER_ID, 1)).hasSize(1);
        assertThatThrownBy(() -> lifecycleService.find(older.getId(), 402L)).isInstanceOf(NotFoundException.class);
    }

    private Recommendation fresh() {
        return recommendationRepository.save(TestFixtures.pending(USER_ID, TradeAction.BUY, 10, "170", Instant.now()));
    }

    private Recommendation overdue() {
        return recommendationRepository.save(TestFixtures.pending(USER_ID, TradeAction.BUY, 10, "170",
                Instant.now().minus(Duration.ofHours(1))));
    }
}
