package com.tradeadvisor.backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * One daily OHLCV bar.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Candle {
    private LocalDate date;
    private double open;
    private double high;
    private double low;
    private double close;
    private long volume;
}
