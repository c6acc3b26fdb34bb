/*
 * どこで: Perks ドメインモデル
 * 何を: 1回のリフレッシュ評価の結果 (種別/月キー/残高/警告) を表す
 * なぜ: 台帳の状態と副作用の成否をまとめて呼び出し側へ返すため
 */
package com.example.perks.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record RefreshResult(
        RefreshKind kind,
        String subscriberId,
        PeriodKey period,
        Map<PerkType, Integer> balances,
        List<RefreshWarning> warnings) {

    public RefreshResult {
        balances = Collections.unmodifiableMap(new LinkedHashMap<>(balances));
        warnings = List.copyOf(warnings);
    }

    public boolean refreshed() {
        return kind == RefreshKind.REFRESHED;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public int balanceOf(PerkType perkType) {
        return balances.getOrDefault(perkType, 0);
    }
}
