/*
 * どこで: Perks サービス層
 * 何を: 台帳から特典を消費 (引き落とし) する
 * なぜ: 残高不足や無効購読者の消費を、台帳を変えずに拒否するため
 */
package com.example.perks.service;

import com.example.perks.model.EntitlementLedger;
import com.example.perks.model.LedgerAuditEntry;
import com.example.perks.model.PerkType;
import java.time.Clock;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
@RequiredArgsConstructor
public class PerkDebitService {

    private static final Logger logger = LoggerFactory.getLogger(PerkDebitService.class);

    private final PerksMetrics metrics;
    private final Clock clock;

    /**
     * 役割: 指定量の特典を消費し、消費後の残高を返す。
     * 動作: 残高を超える要求は InsufficientBalanceException とし、部分消費はしない。
     * 前提: 呼び出し中に同じ台帳を別スレッドから触らない。
     */
    public int consume(EntitlementLedger ledger, PerkType perkType, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be positive: " + amount);
        }
        if (!ledger.isActive()) {
            audit(ledger, LedgerAuditEntry.ACTION_CONSUME_DENIED_INACTIVE, perkType, amount, ledger.balanceOf(perkType));
            metrics.recordConsume(PerksMetrics.RESULT_INACTIVE);
            throw new InactiveSubscriberException(ledger.subscriberId());
        }
        final int available = ledger.balanceOf(perkType);
        if (amount > available) {
            audit(ledger, LedgerAuditEntry.ACTION_CONSUME_DENIED_INSUFFICIENT, perkType, amount, available);
            metrics.recordConsume(PerksMetrics.RESULT_INSUFFICIENT);
            throw new InsufficientBalanceException(perkType, amount, available);
        }
        ledger.debit(perkType, amount);
        final int remaining = ledger.balanceOf(perkType);
        audit(ledger, LedgerAuditEntry.ACTION_PERK_CONSUMED, perkType, amount, remaining);
        metrics.recordConsume(PerksMetrics.RESULT_SUCCESS);
        logger.info(
                "perk consumed subscriberId={} perkType={} amount={} remaining={}",
                ledger.subscriberId(),
                perkType,
                amount,
                remaining);
        return remaining;
    }

    private void audit(EntitlementLedger ledger, String action, PerkType perkType, int amount, int balance) {
        ledger.recordAudit(new LedgerAuditEntry(
                clock.instant(),
                action,
                ledger.subscriberId(),
                ledger.tierId(),
                Map.of("perk_type", perkType.value(), "amount", amount, "balance", balance)));
    }
}
