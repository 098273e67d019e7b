package com.coveredcall.backtest.dto;

import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;

/**
 * One trading day of the underlying. Open/high/low are optional; the engine
 * only reads the close.
 */
public record PriceBar(
        @NotNull LocalDate date,
        Double open,
        Double high,
        Double low,
        double close
) {

    public static PriceBar of(LocalDate date, double close) {
        return new PriceBar(date, null, null, null, close);
    }
}
