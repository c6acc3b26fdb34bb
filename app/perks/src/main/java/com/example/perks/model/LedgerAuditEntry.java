/*
 * どこで: Perks ドメインモデル
 * 何を: 台帳の状態遷移1件分の監査記録を表す
 * なぜ: 付与/消費/拒否の根拠を後から確認できるようにするため
 */
package com.example.perks.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record LedgerAuditEntry(
    Instant occurredAt,
    String action,
    String subscriberId,
    String tierId,
    Map<String, Object> details) {

  public static final String ACTION_REFRESHED = "refreshed";
  public static final String ACTION_PERK_CONSUMED = "perk_consumed";
  public static final String ACTION_CONSUME_DENIED_INACTIVE = "consume_denied_inactive";
  public static final String ACTION_CONSUME_DENIED_INSUFFICIENT = "consume_denied_insufficient";
  public static final String ACTION_TIER_CHANGED = "tier_changed";
  public static final String ACTION_SET_ACTIVE = "set_active";

  public LedgerAuditEntry {
    details =
        details == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(details));
  }
}
