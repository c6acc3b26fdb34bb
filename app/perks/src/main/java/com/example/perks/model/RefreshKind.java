/*
 * どこで: Perks ドメインモデル
 * 何を: リフレッシュ評価の結果種別を定義する
 * なぜ: 呼び出し側が永続化や通知の要否を判定できるようにするため
 */
package com.example.perks.model;

public enum RefreshKind {
    NO_OP,
    REFRESHED
}
