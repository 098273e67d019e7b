package com.coveredcall.backtest.report;

import com.coveredcall.backtest.dto.BacktestResult;
import com.coveredcall.backtest.dto.BacktestSummary;
import com.coveredcall.backtest.dto.StrikeAnalysis;
import com.coveredcall.backtest.dto.TradeRecord;
import lombok.experimental.UtilityClass;

import java.util.List;
import java.util.Locale;

/**
 * Plain-text renderings of backtest results and optimizer rankings.
 */
@UtilityClass
public class BacktestReportFormatter {

    private static final String RULE = "=".repeat(70);
    private static final String SECTION_RULE = "-".repeat(40);

    public static String format(BacktestResult result) {
        StringBuilder sb = new StringBuilder();
        String symbol = result.getConfig() != null ? result.getConfig().getSymbol() : "UNKNOWN";

        line(sb, RULE);
        line(sb, "  " + symbol + " COVERED CALL STRATEGY -- BACKTEST REPORT");
        line(sb, RULE);
        line(sb, "");

        if (!result.isCompleted()) {
            line(sb, "  Status:  " + result.getStatus());
            line(sb, "  Error:   [" + result.getErrorCode() + "] " + result.getErrorMessage());
            line(sb, "");
            sb.append(RULE);
            return sb.toString();
        }

        BacktestSummary s = result.getSummary();

        section(sb, "PERFORMANCE SUMMARY");
        line(sb, fmt("  Initial Equity:        $%,12.2f", s.getInitialEquity()));
        line(sb, fmt("  Final Equity:          $%,12.2f", s.getFinalEquity()));
        line(sb, fmt("  Total Return:          %8.2f%%", s.getTotalReturnPct()));
        line(sb, fmt("  Annualized Return:     %8.2f%%", s.getAnnualizedReturnPct()));
        line(sb, fmt("  Stock-Only Return:     %8.2f%%", s.getStockOnlyReturnPct()));
        line(sb, fmt("  Excess Return (alpha): %8.2f%%", s.getExcessReturnPct()));
        line(sb, "");

        section(sb, "PREMIUM INCOME");
        line(sb, fmt("  Total Premium:         $%10.2f", s.getTotalPremiumCollected()));
        line(sb, fmt("  Total Buy-Back Cost:   $%10.2f", s.getTotalBuybackCost()));
        line(sb, fmt("  Total Commissions:     $%10.2f", s.getTotalCommissions()));
        line(sb, fmt("  Net Premium:           $%10.2f", s.getNetPremium()));
        line(sb, fmt("  Premium Yield:         %8.2f%%", s.getPremiumYieldPct()));
        line(sb, "");

        section(sb, "RISK METRICS");
        line(sb, fmt("  Max Drawdown:          %8.2f%% ($%.2f)", s.getMaxDrawdownPct(), s.getMaxDrawdownAmount()));
        line(sb, fmt("  Sharpe Ratio:          %8.2f", s.getSharpeRatio()));
        line(sb, fmt("  Cash Floor Breach Days:%8d", s.getCashFloorBreachDays()));
        line(sb, "");

        section(sb, "ACTIVITY");
        line(sb, fmt("  Trading Days:          %8d", s.getTradingDays()));
        line(sb, fmt("  Calls Sold:            %8d", s.getCallsSold()));
        line(sb, fmt("  Total Trades:          %8d", s.getTradeCount()));
        line(sb, fmt("  Times Called Away:     %8d", s.getCalledAwayCount()));
        line(sb, fmt("  Expired Worthless:     %8d", s.getExpiredWorthlessCount()));
        line(sb, fmt("  Rolls:                 %8d", s.getRollCount()));
        line(sb, fmt("  Avg Days per Cycle:    %8.1f", s.getAvgDaysPerCycle()));
        line(sb, "");

        List<String> warnings = result.getCashFloorWarnings();
        if (warnings != null && !warnings.isEmpty()) {
            section(sb, "CASH FLOOR WARNINGS");
            warnings.forEach(w -> line(sb, "  " + w));
            line(sb, "");
        }

        section(sb, "TRADE LOG");
        for (TradeRecord t : result.getTrades()) {
            line(sb, fmt("  #%d [%s -> %s] %s %dx $%.2f call exp %s: premium $%.2f, closing $%.2f, net $%.2f",
                    t.tradeNumber(), t.openDate(), t.closeDate(), t.outcome(), t.contracts(),
                    t.contract().strike(), t.contract().expiration(), t.premiumReceived(),
                    t.closingCost(), t.netPnl()));
        }
        if (result.getFinalPosition() != null) {
            line(sb, fmt("  OPEN [%s] %dx $%.2f call exp %s: premium $%.2f",
                    result.getFinalPosition().openDate(), result.getFinalPosition().contracts(),
                    result.getFinalPosition().strike(), result.getFinalPosition().expiration(),
                    result.getFinalPosition().premiumReceived()));
        }

        line(sb, "");
        sb.append(RULE);
        return sb.toString();
    }

    /**
     * Table of the top {@code topN} optimizer combos.
     */
    public static String formatAnalysis(double spot, double volatility, List<StrikeAnalysis> ranked, int topN) {
        StringBuilder sb = new StringBuilder();
        line(sb, fmt("Premium Optimization for $%.2f (IV: %.1f%%)", spot, volatility * 100.0));
        line(sb, fmt("%8s %5s %9s %9s %7s %9s %8s %7s",
                "Strike", "DTE", "Premium", "Net", "Delta", "Ann.Ret", "Upside", "Score"));
        sb.append("-".repeat(72));

        ranked.stream().limit(Math.max(topN, 0)).forEach(r -> {
            sb.append('\n');
            sb.append(fmt("$%7.2f %5d $%8.4f $%8.4f %7.3f %8.1f%% %7.1f%% %7.3f",
                    r.strike(), r.dte(), r.theoreticalPremium(), r.netPremium(), r.delta(),
                    r.annualizedReturn() * 100.0, r.upsideToStrike() * 100.0, r.score()));
        });
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title) {
        line(sb, title);
        line(sb, SECTION_RULE);
    }

    private static void line(StringBuilder sb, String text) {
        sb.append(text).append('\n');
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.US, pattern, args);
    }
}
