package com.coveredcall.backtest.engine;

import com.coveredcall.backtest.dto.PriceBar;
import com.coveredcall.exception.DataIntegrityException;
import lombok.experimental.UtilityClass;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * Integrity checks on a daily price series.
 * <p>
 * Dates must be strictly increasing. Calendar gaps up to {@code maxCalendarGapDays}
 * are weekends and holidays and pass without interpolation; anything wider is
 * treated as missing data.
 */
@UtilityClass
public class PriceSeriesValidator {

    public static void validate(List<PriceBar> series, int maxCalendarGapDays) {
        if (series == null || series.isEmpty()) {
            throw new DataIntegrityException("Price series is empty");
        }

        LocalDate previous = null;
        for (int i = 0; i < series.size(); i++) {
            PriceBar bar = series.get(i);
            if (bar == null || bar.date() == null) {
                throw new DataIntegrityException("Bar " + i + " has no date");
            }
            if (!(bar.close() > 0) || Double.isInfinite(bar.close())) {
                throw new DataIntegrityException("Bar " + bar.date() + " has non-positive close " + bar.close());
            }
            if (previous != null) {
                long gap = ChronoUnit.DAYS.between(previous, bar.date());
                if (gap <= 0) {
                    throw new DataIntegrityException("Dates out of order: " + bar.date()
                            + " follows " + previous);
                }
                if (gap > maxCalendarGapDays) {
                    throw new DataIntegrityException("Missing data: " + gap + " calendar days between "
                            + previous + " and " + bar.date() + " (max " + maxCalendarGapDays + ")");
                }
            }
            previous = bar.date();
        }
    }
}
