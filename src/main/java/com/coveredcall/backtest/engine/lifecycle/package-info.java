/**
 * Transition table of the short-call position state machine.
 * <p>
 * While a call is open, {@link com.coveredcall.backtest.engine.PositionEngine}
 * evaluates these rules in priority order and applies the first decision that
 * requires action:
 * <ol>
 *   <li>{@link com.coveredcall.backtest.engine.lifecycle.ExpirationRule} (0) - at or past expiration:
 *       CALLED_AWAY if spot &gt;= strike, else EXPIRED_WORTHLESS</li>
 *   <li>{@link com.coveredcall.backtest.engine.lifecycle.RollRule} (100) - unexpired only:
 *       ROLLED on the DTE threshold or on profit capture</li>
 * </ol>
 * At most one terminal outcome is produced per position per day.
 */
package com.coveredcall.backtest.engine.lifecycle;
