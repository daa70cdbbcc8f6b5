package com.tradeadvisor.backend.trading.pipeline;

import java.util.List;
import java.util.stream.Collectors;

public record ValidationResult(boolean ok, List<RiskViolation> violations) {

    public ValidationResult {
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static ValidationResult accepted() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult of(List<RiskViolation> violations) {
        return new ValidationResult(violations == null || violations.isEmpty(), violations);
    }

    public boolean violates(RiskRule rule) {
        return violations.stream().anyMatch(violation -> violation.rule() == rule);
    }

    public String ruleNames() {
        return violations.stream().map(violation -> violation.rule().name()).collect(Collectors.joining(","));
    }

    public String messages() {
        return violations.stream().map(RiskViolation::message).collect(Collectors.joining("; "));
    }
}
