package com.coveredcall.backtest.engine.lifecycle;

import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.pricing.PricingModel;
import com.coveredcall.backtest.pricing.TradeSide;
import lombok.extern.slf4j.Slf4j;

/**
 * Rolls an unexpired call when either
 * <ul>
 *   <li>days remaining fall to the roll DTE threshold, or</li>
 *   <li>the current buy-back cost has fallen to {@code (1 - fraction)} of the
 *       premium received, i.e. the configured fraction of the premium is captured.</li>
 * </ul>
 * A capture fraction of 1 disables profit-capture rolls; the call is then only
 * rolled at the DTE threshold.
 * The buy-back cost is the theoretical price paid on the ask side plus commission,
 * and is carried in the decision so the engine books exactly what was tested.
 */
@Slf4j
public class RollRule implements LifecycleRule {

    /** Priority: 100 (only reached on days the contract did not resolve) */
    private static final int PRIORITY = 100;

    private final StrategyConfig config;
    private final PricingModel pricingModel;

    public RollRule(StrategyConfig config, PricingModel pricingModel) {
        this.config = config;
        this.pricingModel = pricingModel;
    }

    @Override
    public int getPriority() {
        return PRIORITY;
    }

    @Override
    public String getName() {
        return "Roll";
    }

    @Override
    public LifecycleDecision evaluate(LifecycleContext ctx) {
        if (ctx.daysRemaining() <= 0) {
            return LifecycleDecision.hold();
        }

        double buybackCost = buybackCost(ctx);

        if (ctx.daysRemaining() <= config.getRollDteThreshold()) {
            return LifecycleDecision.roll(buybackCost,
                    String.format("DTE %d <= roll threshold %d", ctx.daysRemaining(), config.getRollDteThreshold()));
        }

        Position position = ctx.position();
        double premium = position.premiumReceived();
        double fraction = config.getRollProfitCaptureFraction();
        if (premium > 0 && fraction < 1.0 && buybackCost <= (1.0 - fraction) * premium) {
            double captured = premium - buybackCost;
            return LifecycleDecision.roll(buybackCost,
                    String.format("Captured %.1f%% of premium (%.2f of %.2f)",
                            captured / premium * 100.0, captured, premium));
        }

        if (log.isTraceEnabled()) {
            log.trace("{}: hold {} strike={} dte={} buyback={}", getName(), ctx.date(),
                    position.strike(), ctx.daysRemaining(), buybackCost);
        }
        return LifecycleDecision.hold();
    }

    private double buybackCost(LifecycleContext ctx) {
        Position position = ctx.position();
        double t = ctx.daysRemaining() / PricingModel.DAYS_PER_YEAR;
        double mid = pricingModel.callPrice(ctx.spot(), position.strike(), t, ctx.volatility(),
                config.getRiskFreeRate());
        return pricingModel.applyCosts(mid, config.getBidAskSpreadPct(), config.getCommissionPerContract(),
                position.contracts(), TradeSide.BUY);
    }
}
