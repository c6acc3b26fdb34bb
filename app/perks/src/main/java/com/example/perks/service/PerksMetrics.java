/*
 * どこで: Perks サービス層
 * 何を: リフレッシュ/消費/ポート失敗のアプリ固有メトリクスを記録する
 * なぜ: 月次リフレッシュの実行状況と外部連携の失敗を運用で継続監視するため
 */
package com.example.perks.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
public class PerksMetrics {

  public static final String RESULT_REFRESHED = "refreshed";
  public static final String RESULT_NO_OP = "no_op";
  public static final String RESULT_UNKNOWN_TIER = "unknown_tier";
  public static final String RESULT_SUCCESS = "success";
  public static final String RESULT_INSUFFICIENT = "insufficient";
  public static final String RESULT_INACTIVE = "inactive";
  public static final String PORT_BILLING = "billing";
  public static final String PORT_NOTIFICATION = "notification";

  private static final String METRIC_REFRESH_TOTAL = "perks.refresh.total";
  private static final String METRIC_CONSUME_TOTAL = "perks.consume.total";
  private static final String METRIC_PORT_FAILURE_TOTAL = "perks.port.failure.total";
  private static final String METRIC_LEDGER_ACTIVE_CURRENT = "perks.ledger.active.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger ledgerActiveCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> counters = new ConcurrentHashMap<>();

  public PerksMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_LEDGER_ACTIVE_CURRENT, ledgerActiveCurrent, AtomicInteger::get)
        .description("Current number of ledgers held by the registry")
        .register(meterRegistry);
  }

  public void recordRefresh(String result) {
    increment(METRIC_REFRESH_TOTAL, "Refresh evaluations", "result", result);
  }

  public void recordConsume(String result) {
    increment(METRIC_CONSUME_TOTAL, "Perk consume attempts", "result", result);
  }

  public void recordPortFailure(String port) {
    increment(METRIC_PORT_FAILURE_TOTAL, "Outbound port invocation failures", "port", port);
  }

  public void updateLedgerActiveCurrent(int ledgerCount) {
    ledgerActiveCurrent.set(Math.max(ledgerCount, 0));
  }

  private void increment(String name, String description, String tagKey, String tagValue) {
    counters
        .computeIfAbsent(
            name + ":" + tagValue,
            ignored ->
                Counter.builder(name)
                    .description(description)
                    .tags(Tags.of(tagKey, tagValue))
                    .register(meterRegistry))
        .increment();
  }
}
