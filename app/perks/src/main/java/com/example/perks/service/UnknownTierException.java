/*
 * どこで: Perks サービス層
 * 何を: 設定に存在しないティアを参照したことを表す例外
 * なぜ: 台帳を変更する前に呼び出しを打ち切るため
 */
package com.example.perks.service;

public class UnknownTierException extends RuntimeException {

    private final String tierId;

    public UnknownTierException(String tierId) {
        super("unknown tier: " + tierId);
        this.tierId = tierId;
    }

    public String tierId() {
        return tierId;
    }
}
