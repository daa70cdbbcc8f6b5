package com.tradeadvisor.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A fresh recommendation and, when the user has auto-confirm on, the outcome of executing it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendationResponse {
    private RecommendationDTO recommendation;
    private ExecutionResponse execution;
}
