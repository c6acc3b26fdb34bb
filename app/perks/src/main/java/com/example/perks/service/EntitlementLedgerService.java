/*
 * どこで: Perks サービス層
 * 何を: 購読者ごとの台帳をメモリ上で保持し、評価/消費/ティア変更を仲介する
 * なぜ: 台帳ごとの直列化と、注入済みの設定/時刻でエンジンを呼ぶ窓口を一つにするため
 */
package com.example.perks.service;

import com.example.perks.model.EntitlementLedger;
import com.example.perks.model.LedgerAuditEntry;
import com.example.perks.model.PerkType;
import com.example.perks.model.RefreshResult;
import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * 台帳レジストリ。
 *
 * <p>同じ購読者への呼び出しは台帳単位で直列化し、異なる購読者は並行に処理できる。
 */
@Service
@RequiredArgsConstructor
public class EntitlementLedgerService {

    private static final Logger logger = LoggerFactory.getLogger(EntitlementLedgerService.class);
    private static final String MDC_SUBSCRIBER_ID = "subscriber_id";

    private final ConcurrentMap<String, EntitlementLedger> ledgers = new ConcurrentHashMap<>();
    private final RefreshEngine refreshEngine;
    private final PerkDebitService debitService;
    private final TierConfiguration tierConfiguration;
    private final PerksMetrics metrics;
    private final Clock clock;

    public EntitlementLedger open(String subscriberId, String tierId) {
        // 存在しないティアでは台帳を作らない
        tierConfiguration.tier(tierId);
        final EntitlementLedger ledger = EntitlementLedger.open(subscriberId, tierId);
        if (ledgers.putIfAbsent(subscriberId, ledger) != null) {
            throw new IllegalArgumentException("subscriber already registered: " + subscriberId);
        }
        metrics.updateLedgerActiveCurrent(ledgers.size());
        logger.info("ledger opened subscriberId={} tier={}", subscriberId, tierId);
        return ledger;
    }

    public Optional<EntitlementLedger> find(String subscriberId) {
        return Optional.ofNullable(ledgers.get(subscriberId));
    }

    public EntitlementLedger get(String subscriberId) {
        return find(subscriberId).orElseThrow(() -> new SubscriberNotFoundException(subscriberId));
    }

    public RefreshResult refresh(String subscriberId) {
        final EntitlementLedger ledger = get(subscriberId);
        return withLedger(ledger, () -> refreshEngine.evaluate(ledger, tierConfiguration, clock));
    }

    /**
     * 役割: 必要ならリフレッシュしてから特典を消費する。
     * 動作: 月が変わっていれば新しい月の残高に対して消費する。
     */
    public int consume(String subscriberId, String perkType, int amount) {
        final PerkType resolved = tierConfiguration.requirePerkType(perkType);
        final EntitlementLedger ledger = get(subscriberId);
        return withLedger(ledger, () -> {
            refreshEngine.evaluate(ledger, tierConfiguration, clock);
            return debitService.consume(ledger, resolved, amount);
        });
    }

    // 日割りはしない。次のリフレッシュから新しいティアのルールが適用される
    public EntitlementLedger changeTier(String subscriberId, String tierId) {
        final EntitlementLedger ledger = get(subscriberId);
        return withLedger(ledger, () -> {
            tierConfiguration.tier(tierId);
            final String oldTierId = ledger.tierId();
            ledger.changeTier(tierId);
            ledger.recordAudit(new LedgerAuditEntry(
                    clock.instant(),
                    LedgerAuditEntry.ACTION_TIER_CHANGED,
                    subscriberId,
                    tierId,
                    Map.of("old_tier", oldTierId, "new_tier", tierId)));
            logger.info("tier changed subscriberId={} oldTier={} newTier={}", subscriberId, oldTierId, tierId);
            return ledger;
        });
    }

    public EntitlementLedger setActive(String subscriberId, boolean active) {
        final EntitlementLedger ledger = get(subscriberId);
        return withLedger(ledger, () -> {
            ledger.setActive(active);
            ledger.recordAudit(new LedgerAuditEntry(
                    clock.instant(),
                    LedgerAuditEntry.ACTION_SET_ACTIVE,
                    subscriberId,
                    ledger.tierId(),
                    Map.of("is_active", active)));
            return ledger;
        });
    }

    public EntitlementLedger close(String subscriberId) {
        final EntitlementLedger removed = ledgers.remove(subscriberId);
        if (removed == null) {
            throw new SubscriberNotFoundException(subscriberId);
        }
        metrics.updateLedgerActiveCurrent(ledgers.size());
        logger.info("ledger closed subscriberId={}", subscriberId);
        return removed;
    }

    private <T> T withLedger(EntitlementLedger ledger, Supplier<T> action) {
        synchronized (ledger) {
            try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SUBSCRIBER_ID, ledger.subscriberId())) {
                return action.get();
            }
        }
    }
}
