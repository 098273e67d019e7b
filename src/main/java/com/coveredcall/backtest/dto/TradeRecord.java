package com.coveredcall.backtest.dto;

import java.time.LocalDate;

/**
 * One closed short-call trade. Premium is net of sale costs and is never
 * revised after close.
 *
 * @param closingCost buy-back cost for a roll, intrinsic value delivered for an
 *                    assignment, zero for an expiry
 * @param netPnl      premiumReceived minus closingCost
 */
public record TradeRecord(
        int tradeNumber,
        LocalDate openDate,
        LocalDate closeDate,
        OptionContract contract,
        int contracts,
        double premiumReceived,
        double closingCost,
        PositionStatus outcome,
        double spotAtClose,
        double netPnl
) {
}
