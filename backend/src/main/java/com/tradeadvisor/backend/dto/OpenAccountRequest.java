package com.tradeadvisor.backend.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OpenAccountRequest {

    @Size(max = 255)
    private String username;

    @DecimalMin(value = "1.00", message = "initialCapital must be at least 1")
    private BigDecimal initialCapital;
}
