/*
 * どこで: Perks サービス層
 * 何を: リフレッシュ後の残高を購読者へ知らせる出力ポート
 * なぜ: 実送信/テスト差し替えをエンジンに触れずに行うため
 */
package com.example.perks.service;

import com.example.perks.model.PerkType;
import java.util.Map;

public interface NotificationPort {
    void onRefresh(String subscriberId, Map<PerkType, Integer> balances);
}
