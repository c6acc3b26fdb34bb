/*
 * どこで: Perks ドメインモデル
 * 何を: 特典種別ごとの月次付与量と繰越上限を表す
 * なぜ: ティアごとの分岐を持たず、同一の計算でデータ駆動に扱うため
 */
package com.example.perks.model;

import java.util.OptionalInt;

public record PerkAllotment(int monthlyAllotment, int rolloverCap) {

    public static final int UNBOUNDED = -1;

    public PerkAllotment {
        if (monthlyAllotment < 0) {
            throw new IllegalArgumentException("monthly allotment must not be negative: " + monthlyAllotment);
        }
        if (rolloverCap < 0 && rolloverCap != UNBOUNDED) {
            throw new IllegalArgumentException("rollover cap must not be negative: " + rolloverCap);
        }
    }

    public static PerkAllotment capped(int monthlyAllotment, int rolloverCap) {
        return new PerkAllotment(monthlyAllotment, rolloverCap);
    }

    public static PerkAllotment unbounded(int monthlyAllotment) {
        return new PerkAllotment(monthlyAllotment, UNBOUNDED);
    }

    public boolean isRolloverUnbounded() {
        return rolloverCap == UNBOUNDED;
    }

    /**
     * 役割: 前月残高のうち繰り越せる量を返す。
     * 動作: 上限は繰越分だけに掛かり、新規付与分は含まない。
     */
    public int rolloverOf(int unusedBalance) {
        if (isRolloverUnbounded()) {
            return unusedBalance;
        }
        return Math.min(unusedBalance, rolloverCap);
    }

    // リフレッシュ直後の残高上限。上限なしの場合は empty
    public OptionalInt ceiling() {
        if (isRolloverUnbounded()) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(monthlyAllotment + rolloverCap);
    }
}
