package com.coveredcall.backtest.engine.lifecycle;

import com.coveredcall.backtest.dto.PositionStatus;
import lombok.Getter;

/**
 * Outcome of a {@link LifecycleRule} evaluation.
 * <p>
 * {@link #hold()} returns a shared instance; every other decision names exactly
 * one terminal {@link PositionStatus}, so a single decision can never both
 * expire and roll a position.
 */
@Getter
public final class LifecycleDecision {

    private static final LifecycleDecision HOLD = new LifecycleDecision(null, 0.0, null);

    /** Terminal status to move to, null for hold. */
    private final PositionStatus outcome;

    /** Cash cost of closing: buy-back cost for a roll, delivered intrinsic value for an assignment. */
    private final double closingCost;

    private final String reason;

    private LifecycleDecision(PositionStatus outcome, double closingCost, String reason) {
        this.outcome = outcome;
        this.closingCost = closingCost;
        this.reason = reason;
    }

    public static LifecycleDecision hold() {
        return HOLD;
    }

    public static LifecycleDecision expireWorthless(String reason) {
        return new LifecycleDecision(PositionStatus.EXPIRED_WORTHLESS, 0.0, reason);
    }

    public static LifecycleDecision calledAway(double intrinsicValue, String reason) {
        return new LifecycleDecision(PositionStatus.CALLED_AWAY, intrinsicValue, reason);
    }

    public static LifecycleDecision roll(double buybackCost, String reason) {
        return new LifecycleDecision(PositionStatus.ROLLED, buybackCost, reason);
    }

    public boolean requiresAction() {
        return outcome != null;
    }
}
