package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.PositionStatus;
import com.coveredcall.backtest.dto.TradeRecord;

import java.time.LocalDate;

/**
 * What {@link PositionEngine#evaluateDay} did on one day.
 *
 * @param outcome          terminal outcome of the position open at the start of the day, or null
 * @param closedTrade      trade record for that outcome, or null
 * @param opened           call sold this day (after a resolution or from flat), or null
 * @param premiumCollected net premium of the call sold this day
 * @param closingCost      buy-back cost paid this day (rolls only)
 * @param skipReason       why no call was sold when the book ended the day flat, or why a
 *                         due roll was deferred, or null
 */
public record DayEvaluation(
        LocalDate date,
        PositionStatus outcome,
        TradeRecord closedTrade,
        Position opened,
        double premiumCollected,
        double closingCost,
        String skipReason
) {
}
