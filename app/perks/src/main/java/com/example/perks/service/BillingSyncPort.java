/*
 * どこで: Perks サービス層
 * 何を: リフレッシュ発生を課金プロバイダへ伝える出力ポート
 * なぜ: 実送信/テスト差し替えをエンジンに触れずに行うため
 */
package com.example.perks.service;

import com.example.perks.model.PeriodKey;

public interface BillingSyncPort {
    void onRefresh(String subscriberId, PeriodKey period);
}
