package com.tradeadvisor.backend.dto;

import com.tradeadvisor.backend.model.TradeAction;
import com.tradeadvisor.backend.model.Transaction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionDTO {
    private Long id;
    private TradeAction action;
    private String ticker;
    private int shares;
    private BigDecimal price;
    private BigDecimal commission;
    private BigDecimal slippage;
    private BigDecimal totalAmount;
    private BigDecimal realizedPnl;
    private Long recommendationId;
    private Instant timestamp;

    public static TransactionDTO from(Transaction transaction) {
        return TransactionDTO.builder()
                .id(transaction.getId())
                .action(transaction.getAction())
                .ticker(transaction.getTicker())
                .shares(transaction.getShares())
                .price(transaction.getPrice())
                .commission(transaction.getCommission())
                .slippage(transaction.getSlippage())
                .totalAmount(transaction.getTotalAmount())
                .realizedPnl(transaction.getRealizedPnl())
                .recommendationId(transaction.getRecommendationId())
                .timestamp(transaction.getTimestamp())
                .build();
    }
}
