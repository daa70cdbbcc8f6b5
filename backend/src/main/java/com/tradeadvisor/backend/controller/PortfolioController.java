package com.tradeadvisor.backend.controller;

import com.tradeadvisor.backend.config.OpenApiConfig;
import com.tradeadvisor.backend.dto.OpenAccountRequest;
import com.tradeadvisor.backend.dto.PerformanceMetricsDTO;
import com.tradeadvisor.backend.dto.PortfolioSummaryDTO;
import com.tradeadvisor.backend.dto.RiskMetricsDTO;
import com.tradeadvisor.backend.dto.TransactionDTO;
import com.tradeadvisor.backend.service.PortfolioService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/portfolio")
@RequiredArgsConstructor
@Tag(name = "Portfolio")
public class PortfolioController {

    private final PortfolioService portfolioService;

    @PostMapping
    @Operation(summary = "Open a simulated account with starting cash")
    @ApiResponse(responseCode = "201", content = @Content(schema = @Schema(implementation = PortfolioSummaryDTO.class)))
    public ResponseEntity<PortfolioSummaryDTO> openAccount(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                           @Valid @RequestBody(required = false) OpenAccountRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(portfolioService.openAccount(userId, request));
    }

    @GetMapping
    @Operation(summary = "Cash, positions and P&L at current prices")
    public ResponseEntity<PortfolioSummaryDTO> getPortfolio(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId) {
        return ResponseEntity.ok(portfolioService.summary(userId));
    }

    @GetMapping("/transactions")
    @Operation(summary = "Most recent executed trades, newest first")
    public ResponseEntity<List<TransactionDTO>> getTransactions(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                                @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(portfolioService.transactions(userId, limit));
    }

    @GetMapping("/risk")
    @Operation(summary = "Concentration, liquidity and drawdown exposure")
    public ResponseEntity<RiskMetricsDTO> getRiskMetrics(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId) {
        return ResponseEntity.ok(portfolioService.riskMetrics(userId));
    }

    @GetMapping("/performance")
    @Operation(summary = "Trading activity and P&L over the last N days")
    public ResponseEntity<PerformanceMetricsDTO> getPerformance(@RequestHeader(OpenApiConfig.USER_ID_HEADER) Long userId,
                                                                @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(portfolioService.performance(userId, days));
    }
}
