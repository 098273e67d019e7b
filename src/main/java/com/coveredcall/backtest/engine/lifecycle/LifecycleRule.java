package com.coveredcall.backtest.engine.lifecycle;

/**
 * One row of the open-position transition table.
 * <p>
 * Rules are evaluated by {@link com.coveredcall.backtest.engine.PositionEngine} in
 * priority order (lower first) and the first decision that requires action is
 * applied; later rules are not consulted that day. Expiration therefore always
 * pre-empts a roll on the same day.
 *
 * <ul>
 *   <li>0-99: contract resolution (expiration, assignment)</li>
 *   <li>100-199: discretionary closes (rolls)</li>
 * </ul>
 *
 * Implementations are stateless; configuration is fixed at construction.
 */
public interface LifecycleRule {

    /**
     * @return evaluation priority (lower = evaluated first)
     */
    int getPriority();

    /**
     * @param ctx the open position and the day's market state
     * @return the transition to apply, or {@link LifecycleDecision#hold()}
     */
    LifecycleDecision evaluate(LifecycleContext ctx);

    /**
     * Name for logging.
     */
    String getName();
}
