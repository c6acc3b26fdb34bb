/*
 * どこで: Perks サービス層
 * 何を: リフレッシュ通知の送信を模擬する実装
 * なぜ: 外部送信を伴わずに通知 payload の形を確認するため
 */
package com.example.perks.service;

import com.example.common.event.PerkRefreshEventPayload;
import com.example.perks.model.PeriodKey;
import com.example.perks.model.PerkType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class LocalNotificationPort implements NotificationPort {

    private static final Logger logger = LoggerFactory.getLogger(LocalNotificationPort.class);
    static final String EVENT_PERKS_REFRESHED = "PerksRefreshed";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public void onRefresh(String subscriberId, Map<PerkType, Integer> balances) {
        final String payloadJson = buildPayloadJson(subscriberId, balances);
        // 実送信は行わず、ログに残すだけとする
        logger.info("notification simulated send subscriberId={} payload={}", subscriberId, payloadJson);
    }

    @VisibleForTesting
    String buildPayloadJson(String subscriberId, Map<PerkType, Integer> balances) {
        final Map<String, Integer> byName = new LinkedHashMap<>();
        balances.forEach((perkType, balance) -> byName.put(perkType.value(), balance));
        final PerkRefreshEventPayload payload = new PerkRefreshEventPayload(
                UUID.randomUUID().toString(),
                EVENT_PERKS_REFRESHED,
                Instant.now(clock).toString(),
                subscriberId,
                PeriodKey.now(clock).toString(),
                byName);
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("failed to serialize notification payload", ex);
        }
    }
}
