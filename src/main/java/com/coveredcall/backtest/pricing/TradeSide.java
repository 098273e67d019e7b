package com.coveredcall.backtest.pricing;

/**
 * Which side of the spread a fill lands on. Sellers receive below mid, buyers pay above it.
 */
public enum TradeSide {
    SELL,
    BUY
}
