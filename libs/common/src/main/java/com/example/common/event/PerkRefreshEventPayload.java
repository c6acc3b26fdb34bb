/*
 * どこで: common のイベント payload 定義
 * 何を: 特典リフレッシュ通知の payload を共通レコードとして提供する
 * なぜ: 通知/課金連携の送信側と受信側で同一の JSON 形状を共有するため
 */
package com.example.common.event;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PerkRefreshEventPayload(
        String eventId,
        String eventType,
        String occurredAt,
        String subscriberId,
        String period,
        Map<String, Integer> balances) {

    public PerkRefreshEventPayload {
        // 出力順を呼び出し側の順序のまま保つ
        balances = balances == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(balances));
    }
}
