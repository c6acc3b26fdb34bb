/*
 * どこで: Perks ドメインモデル
 * 何を: リフレッシュ結果に付く非致命的な警告の種別を定義する
 */
package com.example.perks.model;

public enum WarningCode {
    UNKNOWN_PERK,
    BILLING_SYNC_FAILED,
    NOTIFICATION_FAILED,
    CLOCK_REGRESSION
}
