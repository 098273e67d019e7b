package com.coveredcall.backtest.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Request DTO for running several configurations against the same series.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CompareRequest {

    @NotEmpty(message = "Price series is required")
    private List<@Valid PriceBar> priceSeries;

    @NotEmpty(message = "At least one configuration is required")
    private List<StrategyConfig> configs;

    private Boolean runSequentially; // default: false, parallel
}
