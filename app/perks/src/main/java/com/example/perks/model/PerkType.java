/*
 * どこで: Perks ドメインモデル
 * 何を: 特典種別の識別子を表す
 * なぜ: 設定で宣言された種別を大小文字の揺れなく比較するため
 */
package com.example.perks.model;

import java.util.Locale;

public record PerkType(String value) implements Comparable<PerkType> {

    public PerkType {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("perk type is required");
        }
        value = value.trim().toLowerCase(Locale.ROOT);
    }

    public static PerkType of(String value) {
        return new PerkType(value);
    }

    @Override
    public int compareTo(PerkType other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
