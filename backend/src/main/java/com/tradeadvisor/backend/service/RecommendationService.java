package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.dto.ExecutionResponse;
import com.tradeadvisor.backend.dto.RecommendationDTO;
import com.tradeadvisor.backend.dto.RecommendationResponse;
import com.tradeadvisor.backend.model.Recommendation;
import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.UserSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for the API: requests a recommendation and executes it straight away when the
 * user has auto-confirm enabled.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecommendationService {

    private final RecommendationProvider recommendationProvider;
    private final RecommendationLifecycleService lifecycleService;
    private final TradeExecutor tradeExecutor;
    private final UserSettingsService userSettingsService;

    public RecommendationResponse request(Long userId, String ticker) {
        UserSettings settings = userSettingsService.getOrCreate(userId);
        Recommendation recommendation = recommendationProvider.getRecommendation(userId, ticker);
        ExecutionResponse execution = null;
        if (settings.isAutoConfirm() && recommendation.getAction() != TradeAction.HOLD) {
            log.info("Auto-confirming recommendation {} for user {}", recommendation.getId(), userId);
            execution = ExecutionResponse.from(tradeExecutor.execute(recommendation.getId(), userId));
            recommendation = lifecycleService.find(recommendation.getId(), userId);
        }
        return RecommendationResponse.builder()
                .recommendation(RecommendationDTO.from(recommendation))
                .execution(execution)
                .build();
    }

    public RecommendationDTO find(Long userId, Long recommendationId) {
        return RecommendationDTO.from(lifecycleService.find(recommendationId, userId));
    }

    public List<RecommendationDTO> history(Long userId, int limit) {
        return lifecycleService.history(userId, limit).stream().map(RecommendationDTO::from).toList();
    }

    public ExecutionResult confirm(Long userId, Long recommendationId) {
        return tradeExecutor.execute(recommendationId, userId);
    }

    public RecommendationDTO reject(Long userId, Long recommendationId) {
        return RecommendationDTO.from(lifecycleService.reject(recommendationId, userId));
    }
}
