package com.tradeadvisor.backend.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Entity
@Table(name = "user_settings")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UserSettings {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false, unique = true)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "risk_profile", nullable = false, length = 16)
    private RiskProfile riskProfile;

    @Column(name = "max_position_size_pct", nullable = false, precision = 9, scale = 4)
    private BigDecimal maxPositionSizePct;

    @Column(name = "stop_loss_pct", nullable = false, precision = 9, scale = 4)
    private BigDecimal stopLossPct;

    @Column(name = "take_profit_pct", nullable = false, precision = 9, scale = 4)
    private BigDecimal takeProfitPct;

    @Column(name = "min_risk_reward_ratio", nullable = false, precision = 9, scale = 4)
    private BigDecimal minRiskRewardRatio;

    @Column(name = "max_trades_per_day", nullable = false)
    private Integer maxTradesPerDay;

    @Column(name = "daily_loss_limit_pct", nullable = false, precision = 9, scale = 4)
    private BigDecimal dailyLossLimitPct;

    @Column(name = "auto_confirm", nullable = false)
    private boolean autoConfirm;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
