/*
 * どこで: Perks ドメインモデル
 * 何を: ティアが付与する特典種別と付与ルールの組を表す
 * なぜ: 起動時に確定したティア定義を不変のまま共有するため
 */
package com.example.perks.model;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

public record TierDefinition(String tierId, Map<PerkType, PerkAllotment> perks) {

    public TierDefinition {
        if (tierId == null || tierId.isBlank()) {
            throw new IllegalArgumentException("tier id is required");
        }
        tierId = normalizeId(tierId);
        perks = perks == null
                ? Map.of()
                : Collections.unmodifiableMap(new TreeMap<>(perks));
    }

    public static String normalizeId(String tierId) {
        return tierId.trim().toLowerCase(Locale.ROOT);
    }

    public boolean grants(PerkType perkType) {
        return perks.containsKey(perkType);
    }
}
