package com.tradeadvisor.backend.service;

import com.tradeadvisor.backend.config.RiskProperties;
import com.tradeadvisor.backend.dto.SettingsDTO;
import com.tradeadvisor.backend.exception.BadRequestException;
import com.tradeadvisor.backend.exception.NotFoundException;
import com.tradeadvisor.backend.model.UserSettings;
import com.tradeadvisor.backend.repository.UserRepository;
import com.tradeadvisor.backend.repository.UserSettingsRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;

@Service
@Slf4j
@RequiredArgsConstructor
public class UserSettingsService {

    private final UserSettingsRepository userSettingsRepository;
    private final UserRepository userRepository;
    private final RiskProperties riskProperties;

    @Transactional
    public UserSettings getOrCreate(Long userId) {
        return userSettingsRepository.findByUserId(userId)
                .orElseGet(() -> {
                    if (!userRepository.existsById(userId)) {
                        throw new NotFoundException("User " + userId + " has no account");
                    }
                    return userSettingsRepository.save(defaultsFor(userId));
                });
    }

    @Transactional
    public UserSettings update(Long userId, SettingsDTO request) {
        UserSettings settings = getOrCreate(userId);
        if (request.getRiskProfile() != null) {
            settings.setRiskProfile(request.getRiskProfile());
        }
        if (request.getMaxPositionSizePct() != null) {
            settings.setMaxPositionSizePct(requireFraction("maxPositionSizePct", request.getMaxPositionSizePct()));
        }
        if (request.getStopLossPct() != null) {
            settings.setStopLossPct(requireFraction("stopLossPct", request.getStopLossPct()));
        }
        if (request.getTakeProfitPct() != null) {
            settings.setTakeProfitPct(requireFraction("takeProfitPct", request.getTakeProfitPct()));
        }
        if (request.getDailyLossLimitPct() != null) {
            settings.setDailyLossLimitPct(requireFraction("dailyLossLimitPct", request.getDailyLossLimitPct()));
        }
        if (request.getMinRiskRewardRatio() != null) {
            if (request.getMinRiskRewardRatio().signum() <= 0) {
                throw new BadRequestException("minRiskRewardRatio must be greater than zero");
            }
            settings.setMinRiskRewardRatio(request.getMinRiskRewardRatio());
        }
        if (request.getMaxTradesPerDay() != null) {
            if (request.getMaxTradesPerDay() < 1) {
                throw new BadRequestException("maxTradesPerDay must be at least 1");
            }
            settings.setMaxTradesPerDay(request.getMaxTradesPerDay());
        }
        if (request.getAutoConfirm() != null) {
            settings.setAutoConfirm(request.getAutoConfirm());
        }
        UserSettings saved = userSettingsRepository.save(settings);
        log.info("Updated settings for user {}: profile={} autoConfirm={}", userId, saved.getRiskProfile(), saved.isAutoConfirm());
        return saved;
    }

    public UserSettings defaultsFor(Long userId) {
        RiskProperties.Defaults defaults = riskProperties.getDefaults();
        return UserSettings.builder()
                .userId(userId)
                .riskProfile(defaults.getRiskProfile())
                .maxPositionSizePct(defaults.getMaxPositionSizePct())
                .stopLossPct(defaults.getStopLossPct())
                .takeProfitPct(defaults.getTakeProfitPct())
                .minRiskRewardRatio(defaults.getMinRiskRewardRatio())
                .maxTradesPerDay(defaults.getMaxTradesPerDay())
                .dailyLossLimitPct(defaults.getDailyLossLimitPct())
                .autoConfirm(defaults.isAutoConfirm())
                .build();
    }

    private BigDecimal requireFraction(String field, BigDecimal value) {
        if (value.signum() <= 0 || value.compareTo(BigDecimal.ONE) > 0) {
            throw new BadRequestException(field + " must be in (0, 1]");
        }
        return value;
    }
}
