/*
 * どこで: Perks ドメインモデル
 * 何を: 購読者ごとの特典残高と最終リフレッシュ月を保持する
 * なぜ: 残高の不変条件 (非負・月キー単調増加) を一箇所で守るため
 */
package com.example.perks.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 購読者1人分の特典台帳。
 *
 * <p>スレッドセーフではない。1つの台帳を同時に評価しないことは呼び出し側が保証する。
 */
public final class EntitlementLedger {

    private final String subscriberId;
    private String tierId;
    private boolean active;
    private final Map<PerkType, Integer> balances = new LinkedHashMap<>();
    private PeriodKey lastRefreshed;
    private final List<LedgerAuditEntry> auditTrail = new ArrayList<>();

    private EntitlementLedger(String subscriberId, String tierId) {
        this.subscriberId = subscriberId;
        this.tierId = tierId;
        this.active = true;
    }

    /**
     * 役割: 購読開始時の台帳を作成する。
     * 動作: 残高はすべて 0、最終リフレッシュ月は未設定で返す。
     * 前提: tierId の存在確認は呼び出し側で行う。
     */
    public static EntitlementLedger open(String subscriberId, String tierId) {
        if (subscriberId == null || subscriberId.isBlank()) {
            throw new IllegalArgumentException("subscriberId is required");
        }
        if (tierId == null || tierId.isBlank()) {
            throw new IllegalArgumentException("tierId is required");
        }
        return new EntitlementLedger(subscriberId, tierId);
    }

    public String subscriberId() {
        return subscriberId;
    }

    public String tierId() {
        return tierId;
    }

    public boolean isActive() {
        return active;
    }

    public int balanceOf(PerkType perkType) {
        return balances.getOrDefault(perkType, 0);
    }

    public Map<PerkType, Integer> balances() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }

    public Optional<PeriodKey> lastRefreshed() {
        return Optional.ofNullable(lastRefreshed);
    }

    public List<LedgerAuditEntry> auditTrail() {
        return List.copyOf(auditTrail);
    }

    public void changeTier(String newTierId) {
        if (newTierId == null || newTierId.isBlank()) {
            throw new IllegalArgumentException("tierId is required");
        }
        this.tierId = newTierId;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    /**
     * 役割: リフレッシュ結果の残高と月キーを一括で反映する。
     * 動作: 検証に失敗した場合は何も変更せず例外を送出する。
     */
    public void applyRefresh(Map<PerkType, Integer> newBalances, PeriodKey period) {
        Objects.requireNonNull(newBalances, "newBalances");
        Objects.requireNonNull(period, "period");
        if (lastRefreshed != null && period.isBefore(lastRefreshed)) {
            throw new IllegalStateException(
                    "period must not move backwards: last=" + lastRefreshed + " next=" + period);
        }
        newBalances.forEach((perkType, balance) -> requireNonNegative(perkType, balance));
        balances.putAll(newBalances);
        lastRefreshed = period;
    }

    public void debit(PerkType perkType, int amount) {
        final int current = balanceOf(perkType);
        if (amount <= 0 || amount > current) {
            throw new IllegalStateException(
                    "invalid debit perkType=" + perkType + " amount=" + amount + " balance=" + current);
        }
        balances.put(perkType, current - amount);
    }

    public void recordAudit(LedgerAuditEntry entry) {
        auditTrail.add(Objects.requireNonNull(entry, "entry"));
    }

    private static void requireNonNegative(PerkType perkType, Integer balance) {
        if (balance == null || balance < 0) {
            throw new IllegalStateException("balance must not be negative perkType=" + perkType + " balance=" + balance);
        }
    }

    @Override
    public String toString() {
        return "EntitlementLedger{subscriberId=" + subscriberId
                + ", tierId=" + tierId
                + ", active=" + active
                + ", balances=" + balances
                + ", lastRefreshed=" + lastRefreshed + "}";
    }
}
