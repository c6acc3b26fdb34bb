/*
 * どこで: Perks サービス層
 * 何を: 課金同期を模擬する実装
 * なぜ: 課金プロバイダなしでもリフレッシュ経路を動かせるようにするため
 */
package com.example.perks.service;

import com.example.perks.model.PeriodKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "perks.billing.enabled", havingValue = "false", matchIfMissing = true)
public class LocalBillingSyncPort implements BillingSyncPort {

    private static final Logger logger = LoggerFactory.getLogger(LocalBillingSyncPort.class);

    @Override
    public void onRefresh(String subscriberId, PeriodKey period) {
        // 実同期は行わず、ログに残すだけとする
        logger.info("billing sync simulated subscriberId={} period={}", subscriberId, period);
    }
}
