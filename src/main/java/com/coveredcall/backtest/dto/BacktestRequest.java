package com.coveredcall.backtest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a single backtest run over a supplied price series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BacktestRequest {

    /**
     * Daily bars in chronological order.
     */
    @NotEmpty(message = "Price series is required")
    private List<@Valid PriceBar> priceSeries;

    /**
     * Strategy configuration. Application defaults are used when omitted.
     */
    private StrategyConfig config;
}
