/*
 * どこで: Perks サービス層
 * 何を: ティア ID から付与ルールを引く不変のテーブルを提供する
 * なぜ: ティアごとの条件分岐を持たず、同じリフレッシュ計算へデータとして渡すため
 */
package com.example.perks.service;

import com.example.perks.model.PerkAllotment;
import com.example.perks.model.PerkType;
import com.example.perks.model.TierDefinition;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 起動時に一度だけ構築されるティア設定。構築後は変更できない。
 */
public final class TierConfiguration {

    private final Set<PerkType> perkTypes;
    private final Map<String, TierDefinition> tiers;

    public TierConfiguration(Collection<PerkType> perkTypes, Collection<TierDefinition> tiers) {
        if (perkTypes.isEmpty()) {
            throw new IllegalStateException("at least one perk type must be declared");
        }
        if (tiers.isEmpty()) {
            throw new IllegalStateException("at least one tier must be configured");
        }
        this.perkTypes = Collections.unmodifiableSet(new LinkedHashSet<>(perkTypes));
        final Map<String, TierDefinition> byId = new LinkedHashMap<>();
        for (TierDefinition tier : tiers) {
            for (PerkType granted : tier.perks().keySet()) {
                if (!this.perkTypes.contains(granted)) {
                    throw new IllegalStateException(
                            "tier " + tier.tierId() + " references undeclared perk type: " + granted);
                }
            }
            if (byId.put(tier.tierId(), tier) != null) {
                throw new IllegalStateException("duplicate tier id: " + tier.tierId());
            }
        }
        this.tiers = Collections.unmodifiableMap(byId);
    }

    /**
     * 役割: ティアの付与ルールを返す。
     * 動作: ティア ID は大小文字を区別しない。未設定なら UnknownTierException を送出する。
     */
    public TierDefinition tier(String tierId) {
        if (tierId == null || tierId.isBlank()) {
            throw new UnknownTierException(tierId);
        }
        final TierDefinition tier = tiers.get(TierDefinition.normalizeId(tierId));
        if (tier == null) {
            throw new UnknownTierException(tierId);
        }
        return tier;
    }

    public Map<PerkType, PerkAllotment> perksFor(String tierId) {
        return tier(tierId).perks();
    }

    public boolean hasTier(String tierId) {
        return tierId != null && !tierId.isBlank()
                && tiers.containsKey(TierDefinition.normalizeId(tierId));
    }

    public Set<String> tierIds() {
        return tiers.keySet();
    }

    public Set<PerkType> perkTypes() {
        return perkTypes;
    }

    public boolean isDeclared(PerkType perkType) {
        return perkTypes.contains(perkType);
    }

    public PerkType requirePerkType(String value) {
        final PerkType perkType;
        try {
            perkType = PerkType.of(value);
        } catch (IllegalArgumentException ex) {
            throw new UnknownPerkException(value);
        }
        if (!isDeclared(perkType)) {
            throw new UnknownPerkException(value);
        }
        return perkType;
    }
}
