package com.coveredcall.backtest.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of one backtest run: equity curve, trade log and summary statistics.
 * A comparison sweep returns one per configuration, failed runs included.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class BacktestResult {

    /**
     * Assigned by the service layer; null for results produced directly by the engine.
     */
    private String backtestId;

    private BacktestStatus status;

    private StrategyConfig config;

    /**
     * One sample per processed price bar, in date order.
     */
    private List<EquityCurveSample> equityCurve;

    /**
     * Closed short-call trades in close order.
     */
    private List<TradeRecord> trades;

    private BacktestSummary summary;

    /**
     * Dated cash-floor advisories, one per alert-level change.
     */
    private List<String> cashFloorWarnings;

    /**
     * Short call still open after the last bar, or null.
     */
    private Position finalPosition;

    /**
     * Error code name if the run failed.
     */
    private String errorCode;

    private String errorMessage;

    private long executionDurationMs;

    public enum BacktestStatus {
        COMPLETED,
        FAILED
    }

    public boolean isCompleted() {
        return status == BacktestStatus.COMPLETED;
    }
}
