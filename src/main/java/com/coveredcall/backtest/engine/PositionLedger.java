package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.Position;
import com.coveredcall.backtest.dto.PositionStatus;
import com.coveredcall.backtest.dto.TradeRecord;
import lombok.AccessLevel;
import lombok.Getter;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable state of one backtest run: shares, cash, the single open short call
 * and the trade log.
 * <p>
 * Owned by a single run and passed through {@link PositionEngine#evaluateDay}.
 * Readers get accessors only; every mutation is package-private and performed by
 * {@link PositionEngine}, which keeps the at-most-one-open-position invariant.
 * <p>
 * Thread safety: NOT thread-safe. Each run creates its own ledger.
 */
@Getter
public class PositionLedger {

    private Position position;

    private int sharesHeld;

    private double cash;

    // ==================== TOTALS ====================

    private double premiumCollected;
    private double buybackCosts;
    private double commissionsPaid;

    private int callsSold;
    private int calledAwayCount;
    private int expiredWorthlessCount;
    private int rollCount;

    // ==================== HISTORY ====================

    @Getter(AccessLevel.NONE)
    private final List<TradeRecord> trades = new ArrayList<>();

    @Getter(AccessLevel.NONE)
    private final List<LocalDate> saleDates = new ArrayList<>();

    public PositionLedger(double startingCash) {
        this.cash = startingCash;
    }

    public boolean hasOpenPosition() {
        return position != null;
    }

    public PositionStatus getStatus() {
        return position == null ? PositionStatus.NONE : position.status();
    }

    public List<TradeRecord> getTrades() {
        return Collections.unmodifiableList(trades);
    }

    public List<LocalDate> getSaleDates() {
        return Collections.unmodifiableList(saleDates);
    }

    // ==================== MUTATIONS (PositionEngine only) ====================

    void open(Position opened, double commission) {
        if (position != null) {
            throw new IllegalStateException("A call is already open: " + position.contract());
        }
        position = opened;
        cash += opened.premiumReceived();
        premiumCollected += opened.premiumReceived();
        commissionsPaid += commission;
        callsSold++;
        saleDates.add(opened.openDate());
    }

    void close(TradeRecord record) {
        if (position == null) {
            throw new IllegalStateException("No open call to close");
        }
        if (record.outcome() == null || !record.outcome().isTerminal()) {
            throw new IllegalArgumentException("Not a terminal outcome: " + record.outcome());
        }
        position = null;
        trades.add(record);
        switch (record.outcome()) {
            case CALLED_AWAY -> calledAwayCount++;
            case EXPIRED_WORTHLESS -> expiredWorthlessCount++;
            case ROLLED -> rollCount++;
            default -> {
            }
        }
    }

    void payBuyback(double cost, double commission) {
        cash -= cost;
        buybackCosts += cost;
        commissionsPaid += commission;
    }

    void buyShares(int shares, double price) {
        sharesHeld += shares;
        cash -= shares * price;
    }

    void deliverShares(int shares, double strike) {
        if (shares > sharesHeld) {
            throw new IllegalStateException("Cannot deliver " + shares + " shares, holding " + sharesHeld);
        }
        sharesHeld -= shares;
        cash += shares * strike;
    }
}
