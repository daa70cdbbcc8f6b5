package com.tradeadvisor.backend.dto;

import com.tradeadvisor.backend.exception.RejectionReason;
import com.tradeadvisor.backend.service.ExecutionResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {
    private Long recommendationId;
    private boolean executed;
    private RejectionReason reason;
    private String message;
    private TransactionDTO transaction;

    public static ExecutionResponse from(ExecutionResult result) {
        return ExecutionResponse.builder()
                .recommendationId(result.recommendationId())
                .executed(result.isExecuted())
                .reason(result.rejection())
                .message(result.isExecuted() ? "Trade executed" : result.message())
                .transaction(result.isExecuted() ? TransactionDTO.from(result.transaction()) : null)
                .build();
    }
}
