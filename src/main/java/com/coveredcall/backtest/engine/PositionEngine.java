package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.OptionContract;
import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.PositionStatus;
import com.coveredcall.backtest.dto.PriceBar;
import com.coveredcall.backtest.dto.StrategyConfig;
import com.coveredcall.backtest.dto.StrikeAnalysis;
import com.coveredcall.backtest.dto.TradeRecord;
import com.coveredcall.backtest.engine.lifecycle.ExpirationRule;
import com.coveredcall.backtest.engine.lifecycle.LifecycleContext;
import com.coveredcall.backtest.engine.lifecycle.LifecycleDecision;
import com.coveredcall.backtest.engine.lifecycle.LifecycleRule;
import com.coveredcall.backtest.engine.lifecycle.RollRule;
import com.coveredcall.backtest.optimizer.PremiumOptimizer;
import com.coveredcall.backtest.pricing.PricingModel;
import com.coveredcall.backtest.pricing.TradeSide;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Owns the lifecycle of the single short call written against the shares.
 * <p>
 * Daily evaluation order:
 * <ol>
 *   <li>If a call is open, walk the {@link LifecycleRule} table in priority order and
 *       apply the first decision requiring action (expiration before roll). At most one
 *       terminal outcome per day. A roll whose replacement cannot be sold is deferred
 *       and the call stays open.</li>
 *   <li>If the book is flat, either from the start of the day or after a resolution,
 *       select a strike and sell a call unless the net premium is at or below the floor.</li>
 * </ol>
 * A call opened today is never evaluated against the table until the next day.
 * <p>
 * The engine itself is stateless; all run state lives in the {@link PositionLedger}
 * passed in, so one engine can serve any number of isolated runs.
 */
@Slf4j
public class PositionEngine {

    private final StrategyConfig config;
    private final PricingModel pricingModel;
    private final PremiumOptimizer optimizer;
    private final List<LifecycleRule> rules;
    private final List<Double> strikes;

    public PositionEngine(StrategyConfig config, PricingModel pricingModel, PremiumOptimizer optimizer) {
        this(config, pricingModel, optimizer, List.of(
                new ExpirationRule(config.getContractMultiplier()),
                new RollRule(config, pricingModel)));
    }

    PositionEngine(StrategyConfig config, PricingModel pricingModel, PremiumOptimizer optimizer,
                   List<LifecycleRule> rules) {
        this.config = config;
        this.pricingModel = pricingModel;
        this.optimizer = optimizer;
        List<LifecycleRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(LifecycleRule::getPriority));
        this.rules = List.copyOf(sorted);
        this.strikes = config.getStrikeCandidates().stream().distinct().sorted().toList();
    }

    /**
     * Buys the configured share count at the bar's close.
     */
    public void openStockPosition(PositionLedger ledger, PriceBar bar) {
        ledger.buyShares(config.getShares(), bar.close());
        log.info("Bought {} shares of {} at {} on {}", config.getShares(), config.getSymbol(),
                bar.close(), bar.date());
    }

    /**
     * Runs one day of the state machine against {@code ledger}.
     * <p>
     * A roll is only taken when a replacement call can be sold the same day; otherwise
     * the open call is held and the roll is retried on the next bar.
     */
    public DayEvaluation evaluateDay(PositionLedger ledger, PriceBar bar, double volatility) {
        LocalDate date = bar.date();
        double spot = bar.close();

        PositionStatus outcome = null;
        TradeRecord closedTrade = null;
        double closingCost = 0.0;
        Quote replacement = null;

        if (ledger.hasOpenPosition()) {
            LifecycleContext ctx = LifecycleContext.of(ledger.getPosition(), date, spot, volatility);
            LifecycleDecision decision = decide(ctx);
            if (!decision.requiresAction()) {
                return new DayEvaluation(date, null, null, null, 0.0, 0.0, null);
            }
            if (decision.getOutcome() == PositionStatus.ROLLED) {
                replacement = quote(ledger.getSharesHeld(), spot, volatility);
                if (!replacement.sellable()) {
                    String reason = "Roll deferred: " + replacement.skipReason();
                    log.debug("{} on {} ({})", reason, date, decision.getReason());
                    return new DayEvaluation(date, null, null, null, 0.0, 0.0, reason);
                }
                closingCost = decision.getClosingCost();
            }
            closedTrade = close(ledger, ctx, decision);
            outcome = decision.getOutcome();
        }

        // Flat here: either no call was open or it was just resolved
        Quote quote = replacement != null ? replacement : quote(ledger.getSharesHeld(), spot, volatility);
        if (!quote.sellable()) {
            log.debug("Skip open on {}: {}", date, quote.skipReason());
            return new DayEvaluation(date, outcome, closedTrade, null, 0.0, closingCost, quote.skipReason());
        }
        Position opened = sell(ledger, date, spot, volatility, quote);
        return new DayEvaluation(date, outcome, closedTrade, opened, opened.premiumReceived(), closingCost, null);
    }

    // ==================== TRANSITIONS ====================

    private LifecycleDecision decide(LifecycleContext ctx) {
        for (LifecycleRule rule : rules) {
            LifecycleDecision decision = rule.evaluate(ctx);
            if (decision.requiresAction()) {
                log.debug("{} rule matched on {}: {}", rule.getName(), ctx.date(), decision.getReason());
                return decision;
            }
        }
        return LifecycleDecision.hold();
    }

    private TradeRecord close(PositionLedger ledger, LifecycleContext ctx, LifecycleDecision decision) {
        Position position = ctx.position();
        PositionStatus outcome = decision.getOutcome();
        double closingCost = decision.getClosingCost();

        TradeRecord record = new TradeRecord(
                ledger.getTrades().size() + 1,
                position.openDate(),
                ctx.date(),
                position.contract(),
                position.contracts(),
                position.premiumReceived(),
                closingCost,
                outcome,
                ctx.spot(),
                position.premiumReceived() - closingCost);

        switch (outcome) {
            case ROLLED -> {
                ledger.payBuyback(closingCost, config.getCommissionPerContract() * position.contracts());
                ledger.close(record);
            }
            case CALLED_AWAY -> {
                int delivered = position.contracts() * config.getContractMultiplier();
                ledger.close(record);
                ledger.deliverShares(delivered, position.strike());
                if (config.isReacquireSharesOnAssignment()) {
                    ledger.buyShares(delivered, ctx.spot());
                }
            }
            case EXPIRED_WORTHLESS -> ledger.close(record);
            default -> throw new IllegalStateException("Unexpected lifecycle outcome " + outcome);
        }

        log.info("Closed {} strike={} exp={} on {}: {} (premium={}, closingCost={})",
                outcome, position.strike(), position.expiration(), ctx.date(), decision.getReason(),
                String.format("%.2f", position.premiumReceived()), String.format("%.2f", closingCost));
        return record;
    }

    // ==================== OPEN ====================

    /**
     * Prices the call that would be sold against {@code sharesHeld} without touching the ledger.
     */
    private Quote quote(int sharesHeld, double spot, double volatility) {
        int contracts = sharesHeld / config.getContractMultiplier();
        if (contracts == 0) {
            return Quote.skipped("No shares to cover a call");
        }

        Optional<Selection> selection = select(spot, volatility);
        if (selection.isEmpty()) {
            return Quote.skipped(String.format("No strike at or above %.2f (min strike %.2f, spot %.2f)",
                    Math.max(config.getMinStrike(), spot * (1.0 + config.getMinOtmPct())),
                    config.getMinStrike(), spot));
        }

        Selection chosen = selection.get();
        double netPremium = pricingModel.applyCosts(chosen.mid(), config.getBidAskSpreadPct(),
                config.getCommissionPerContract(), contracts, TradeSide.SELL);
        if (netPremium <= config.getMinNetPremium()) {
            return Quote.skipped(String.format("Net premium %.4f at strike %.2f is at or below floor %.4f",
                    netPremium, chosen.strike(), config.getMinNetPremium()));
        }
        return new Quote(chosen, contracts, netPremium, null);
    }

    private Position sell(PositionLedger ledger, LocalDate date, double spot, double volatility, Quote quote) {
        Selection chosen = quote.selection();
        Position opened = new Position(
                OptionContract.call(chosen.strike(), date.plusDays(chosen.dte())),
                quote.contracts(), quote.netPremium(), date, spot, volatility, PositionStatus.OPEN);
        ledger.open(opened, config.getCommissionPerContract() * quote.contracts());

        log.info("Sold {}x {} call exp {} on {} for {} net (mid={}, iv={}, score={})",
                quote.contracts(), chosen.strike(), opened.expiration(), date,
                String.format("%.2f", quote.netPremium()), String.format("%.4f", chosen.mid()),
                String.format("%.2f", volatility), String.format("%.4f", chosen.score()));
        return opened;
    }

    /**
     * Picks the contract to sell. With several candidate expirations the optimizer ranks
     * strike and DTE together; otherwise strikes are scored at the target DTE by
     * annualized return on strike notional minus the delta penalty.
     */
    Optional<Selection> select(double spot, double volatility) {
        if (config.usesOptimizer()) {
            List<StrikeAnalysis> ranked = optimizer.optimize(spot, strikes, config.getCandidateDtes(), volatility);
            if (ranked.isEmpty()) {
                return Optional.empty();
            }
            StrikeAnalysis top = ranked.get(0);
            return Optional.of(new Selection(top.strike(), top.dte(), top.theoreticalPremium(), top.score()));
        }
        return selectByScore(spot, volatility, config.getTargetDte());
    }

    private Optional<Selection> selectByScore(double spot, double volatility, int dte) {
        double t = dte / PricingModel.DAYS_PER_YEAR;
        double r = config.getRiskFreeRate();
        double minEligible = Math.max(config.getMinStrike(), spot * (1.0 + config.getMinOtmPct()));

        Selection best = null;
        for (double strike : strikes) {
            if (strike < minEligible) {
                continue;
            }
            double mid = pricingModel.callPrice(spot, strike, t, volatility, r);
            double delta = pricingModel.delta(spot, strike, t, volatility, r);
            double netPerContract = pricingModel.applyCosts(mid, config.getBidAskSpreadPct(),
                    config.getCommissionPerContract(), 1, TradeSide.SELL);
            double capitalAtRisk = strike * config.getContractMultiplier();
            double annualizedReturn = netPerContract / capitalAtRisk * (PricingModel.DAYS_PER_YEAR / dte);
            double score = annualizedReturn - config.getDeltaPenaltyWeight() * delta;

            // Strict comparison keeps the lowest strike on ties
            if (best == null || score > best.score()) {
                best = new Selection(strike, dte, mid, score);
            }
        }
        return Optional.ofNullable(best);
    }

    record Selection(double strike, int dte, double mid, double score) {
    }

    private record Quote(Selection selection, int contracts, double netPremium, String skipReason) {

        static Quote skipped(String reason) {
            return new Quote(null, 0, 0.0, reason);
        }

        boolean sellable() {
            return selection != null;
        }
    }
}
