/*
 * どこで: Perks ドメインモデル
 * 何を: リフレッシュ判定に使う暦月 (年, 月) を表す
 * なぜ: 評価タイミングに依存せず月境界でだけリフレッシュさせるため
 */
package com.example.perks.model;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;

public record PeriodKey(int year, int month) implements Comparable<PeriodKey> {

    public PeriodKey {
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12: " + month);
        }
    }

    public static PeriodKey of(Instant instant, ZoneId zone) {
        return from(YearMonth.from(instant.atZone(zone)));
    }

    public static PeriodKey now(Clock clock) {
        return of(clock.instant(), clock.getZone());
    }

    public static PeriodKey from(YearMonth yearMonth) {
        return new PeriodKey(yearMonth.getYear(), yearMonth.getMonthValue());
    }

    public static PeriodKey parse(String value) {
        try {
            return from(YearMonth.parse(value));
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("invalid period key: " + value, ex);
        }
    }

    public YearMonth toYearMonth() {
        return YearMonth.of(year, month);
    }

    public boolean isBefore(PeriodKey other) {
        return compareTo(other) < 0;
    }

    @Override
    public int compareTo(PeriodKey other) {
        if (year != other.year) {
            return Integer.compare(year, other.year);
        }
        return Integer.compare(month, other.month);
    }

    // YYYY-MM 形式。ログや payload にそのまま載せる
    @Override
    public String toString() {
        return toYearMonth().toString();
    }
}
