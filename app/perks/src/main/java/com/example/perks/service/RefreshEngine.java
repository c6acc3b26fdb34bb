/*
 * どこで: Perks サービス層
 * 何を: 月境界に達した台帳へ月次付与と繰越を適用する
 * なぜ: 評価のタイミングに関係なく、月ごとに一度だけ決定的にリフレッシュするため
 */
package com.example.perks.service;

import com.example.perks.model.EntitlementLedger;
import com.example.perks.model.LedgerAuditEntry;
import com.example.perks.model.PerkAllotment;
import com.example.perks.model.PerkType;
import com.example.perks.model.PeriodKey;
import com.example.perks.model.RefreshKind;
import com.example.perks.model.RefreshResult;
import com.example.perks.model.RefreshWarning;
import com.example.perks.model.TierDefinition;
import com.example.perks.model.WarningCode;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class RefreshEngine {

    private static final Logger logger = LoggerFactory.getLogger(RefreshEngine.class);

    private final BillingSyncPort billingSyncPort;
    private final NotificationPort notificationPort;
    private final PerksMetrics metrics;

    /**
     * 役割: 台帳のリフレッシュ要否を判定し、必要なら新しい月の残高を確定する。
     * 動作: 経過月数に関係なく1回の呼び出しで1ステップだけ進める。
     *       ティア解決に失敗した場合は台帳を変更せずに UnknownTierException を送出する。
     * 前提: 呼び出し中に同じ台帳を別スレッドから触らない。
     */
    public RefreshResult evaluate(EntitlementLedger ledger, TierConfiguration config, Clock clock) {
        final PeriodKey current = PeriodKey.now(clock);
        final Optional<PeriodKey> lastRefreshed = ledger.lastRefreshed();
        if (lastRefreshed.isPresent() && lastRefreshed.get().equals(current)) {
            logger.debug("refresh not due subscriberId={} period={}", ledger.subscriberId(), current);
            metrics.recordRefresh(PerksMetrics.RESULT_NO_OP);
            return noOp(ledger, current, List.of());
        }
        if (lastRefreshed.isPresent() && current.isBefore(lastRefreshed.get())) {
            // 月キーの単調増加を守るため、時計が戻った場合は何も更新しない
            logger.warn(
                    "clock regression detected subscriberId={} lastRefreshed={} current={}",
                    ledger.subscriberId(),
                    lastRefreshed.get(),
                    current);
            metrics.recordRefresh(PerksMetrics.RESULT_NO_OP);
            return noOp(ledger, lastRefreshed.get(), List.of(new RefreshWarning(
                    WarningCode.CLOCK_REGRESSION,
                    "clock period " + current + " is before last refreshed period " + lastRefreshed.get())));
        }

        final TierDefinition tier;
        try {
            tier = config.tier(ledger.tierId());
        } catch (UnknownTierException ex) {
            metrics.recordRefresh(PerksMetrics.RESULT_UNKNOWN_TIER);
            throw ex;
        }
        final List<RefreshWarning> warnings = new ArrayList<>(staleBalanceWarnings(ledger, tier));
        final Map<PerkType, Integer> refreshed = computeBalances(ledger, tier);

        ledger.applyRefresh(refreshed, current);
        ledger.recordAudit(new LedgerAuditEntry(
                clock.instant(),
                LedgerAuditEntry.ACTION_REFRESHED,
                ledger.subscriberId(),
                tier.tierId(),
                Map.of("period", current.toString(), "balances", toDetail(refreshed))));
        logger.info(
                "perks refreshed subscriberId={} tier={} period={} balances={}",
                ledger.subscriberId(),
                tier.tierId(),
                current,
                refreshed);
        metrics.recordRefresh(PerksMetrics.RESULT_REFRESHED);

        // 台帳の確定後に呼ぶ。ポート側の失敗は警告に変換し、更新は巻き戻さない
        final Map<PerkType, Integer> balances = ledger.balances();
        invokeBillingSync(ledger.subscriberId(), current).ifPresent(warnings::add);
        invokeNotification(ledger.subscriberId(), balances).ifPresent(warnings::add);
        return new RefreshResult(RefreshKind.REFRESHED, ledger.subscriberId(), current, balances, warnings);
    }

    private Map<PerkType, Integer> computeBalances(EntitlementLedger ledger, TierDefinition tier) {
        final Map<PerkType, Integer> next = new LinkedHashMap<>();
        for (Map.Entry<PerkType, PerkAllotment> entry : tier.perks().entrySet()) {
            final PerkAllotment allotment = entry.getValue();
            final int rollover = allotment.rolloverOf(ledger.balanceOf(entry.getKey()));
            try {
                next.put(entry.getKey(), Math.addExact(rollover, allotment.monthlyAllotment()));
            } catch (ArithmeticException ex) {
                throw new IllegalStateException(
                        "balance overflow subscriberId=" + ledger.subscriberId() + " perkType=" + entry.getKey(), ex);
            }
        }
        return next;
    }

    private List<RefreshWarning> staleBalanceWarnings(EntitlementLedger ledger, TierDefinition tier) {
        final List<RefreshWarning> warnings = new ArrayList<>();
        ledger.balances().forEach((perkType, balance) -> {
            if (!tier.grants(perkType)) {
                logger.warn(
                        "balance retained for perk not granted by tier subscriberId={} tier={} perkType={} balance={}",
                        ledger.subscriberId(),
                        tier.tierId(),
                        perkType,
                        balance);
                warnings.add(RefreshWarning.unknownPerk(perkType, tier.tierId(), balance));
            }
        });
        return warnings;
    }

    private Optional<RefreshWarning> invokeBillingSync(String subscriberId, PeriodKey period) {
        try {
            billingSyncPort.onRefresh(subscriberId, period);
            return Optional.empty();
        } catch (RuntimeException ex) {
            logger.warn("billing sync failed after refresh subscriberId={} period={}", subscriberId, period, ex);
            metrics.recordPortFailure(PerksMetrics.PORT_BILLING);
            return Optional.of(RefreshWarning.portFailure(WarningCode.BILLING_SYNC_FAILED, ex));
        }
    }

    private Optional<RefreshWarning> invokeNotification(String subscriberId, Map<PerkType, Integer> balances) {
        try {
            notificationPort.onRefresh(subscriberId, balances);
            return Optional.empty();
        } catch (RuntimeException ex) {
            logger.warn("refresh notification failed subscriberId={}", subscriberId, ex);
            metrics.recordPortFailure(PerksMetrics.PORT_NOTIFICATION);
            return Optional.of(RefreshWarning.portFailure(WarningCode.NOTIFICATION_FAILED, ex));
        }
    }

    private RefreshResult noOp(EntitlementLedger ledger, PeriodKey period, List<RefreshWarning> warnings) {
        return new RefreshResult(RefreshKind.NO_OP, ledger.subscriberId(), period, ledger.balances(), warnings);
    }

    private Map<String, Integer> toDetail(Map<PerkType, Integer> balances) {
        final Map<String, Integer> detail = new LinkedHashMap<>();
        balances.forEach((perkType, balance) -> detail.put(perkType.value(), balance));
        return detail;
    }
}
