package com.coveredcall.backtest.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for a strike/expiration recommendation.
 * Either {@code volatility} or a {@code priceHistory} long enough to estimate it must be given.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class OptimizeRequest {

    @NotNull(message = "Spot price is required")
    @Positive(message = "Spot price must be positive")
    private Double spot;

    private Double volatility;

    private List<Double> priceHistory;

    /** Defaults to the configuration's strike candidates. */
    private List<Double> strikes;

    /** Defaults to the application's optimizer expirations. */
    private List<Integer> dtes;

    private StrategyConfig config;

    private Integer topN;
}
