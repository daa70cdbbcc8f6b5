package com.tradeadvisor.backend.controller;

import com.tradeadvisor.backend.config.AdvisorProperties;
import com.tradeadvisor.backend.config.OpenApiConfig;
import com.tradeadvisor.backend.dto.ApiError;
import com.tradeadvisor.backend.dto.ExecutionResponse;
import com.tradeadvisor.backend.dto.RecommendationDTO;
import com.tradeadvisor.backend.dto.RecommendationResponse;
import com.tradeadvisor.backend.exception.GlobalExceptionHandler;
import com.tradeadvisor.backend.service.ExecutionResult;
import com.tradeadvisor.backend.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/recommendations")
@RequiredArgsConstructor
@Tag(name = "Recommendations")
public class RecommendationController {

    private final RecommendationService recommendationService;
    private final AdvisorProperties advisorProperties;

    @PostMapping
    @Operation(summary = "Ask the advisor for a risk-checked recommendation")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = RecommendationResponse.class)))
    public ResponseEntity<RecommendationResponse> requestRecommendation(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                                        @RequestParam(required = false) String ticker) {
        String resolved = StringUtils.hasText(ticker) ? ticker : advisorProperties.getDefaultTicker();
        return ResponseEntity.ok(recommendationService.request(userId, resolved));
    }

    @GetMapping
    @Operation(summary = "Recent recommendations, newest first; limit defaults to advisor.recommendation.history-limit")
    public ResponseEntity<List<RecommendationDTO>> getHistory(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                              @RequestParam(required = false) Integer limit) {
        int resolved = limit != null ? limit : advisorProperties.getRecommendation().getHistoryLimit();
        return ResponseEntity.ok(recommendationService.history(userId, resolved));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a recommendation; a pending one past its deadline reads as expired")
    public ResponseEntity<RecommendationDTO> getRecommendation(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                               @PathVariable Long id) {
        return ResponseEntity.ok(recommendationService.find(userId, id));
    }

    @PostMapping("/{id}/confirm")
    @Operation(summary = "Execute a pending recommendation against the simulated portfolio")
    @ApiResponse(responseCode = "200", content = @Content(schema = @Schema(implementation = ExecutionResponse.class)))
    @ApiResponse(responseCode = "409", description = "Expired or already resolved",
            content = @Content(schema = @Schema(implementation = ExecutionResponse.class)))
    @ApiResponse(responseCode = "422", description = "Insufficient cash or shares",
            content = @Content(schema = @Schema(implementation = ExecutionResponse.class)))
    @ApiResponse(responseCode = "404", content = @Content(schema = @Schema(implementation = ApiError.class)))
    public ResponseEntity<ExecutionResponse> confirm(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                     @PathVariable Long id) {
        ExecutionResult result = recommendationService.confirm(userId, id);
        if (result.isExecuted()) {
            return ResponseEntity.ok(ExecutionResponse.from(result));
        }
        return ResponseEntity.status(GlobalExceptionHandler.statusFor(result.rejection())).body(ExecutionResponse.from(result));
    }

    @PostMapping("/{id}/reject")
    @Operation(summary = "Decline a pending recommendation")
    public ResponseEntity<RecommendationDTO> reject(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                    @PathVariable Long id) {
        return ResponseEntity.ok(recommendationService.reject(userId, id));
    }
}
