package com.coveredcall.backtest.engine.lifecycle;

import com.coveredcall.backtest.dto.Position;

/**
 * Resolves a contract on or after its expiration date: called away when the
 * close is at or above the strike, otherwise expired worthless.
 */
public class ExpirationRule implements LifecycleRule {

    /** Priority: 0 (resolution always wins over a discretionary roll) */
    private static final int PRIORITY = 0;

    private final int contractMultiplier;

    public ExpirationRule(int contractMultiplier) {
        this.contractMultiplier = contractMultiplier;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "Expiration";
    }

    @Override
    public LifecycleDecision evaluate(LifecycleContext ctx) {
        Position position = ctx.position();
        if (!position.contract().isExpiredOn(ctx.date())) {
            return LifecycleDecision.hold();
        }

        double strike = position.strike();
        if (ctx.spot() >= strike) {
            double intrinsic = (ctx.spot() - strike) * contractMultiplier * position.contracts();
            return LifecycleDecision.calledAway(intrinsic,
                    String.format("Called away at %.2f (spot %.2f)", strike, ctx.spot()));
        }
        return LifecycleDecision.expireWorthless(
                String.format("Expired worthless (strike %.2f, spot %.2f)", strike, ctx.spot()));
    }
}
