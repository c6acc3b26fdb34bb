/*
 * どこで: Perks サービス層
 * 何を: 残高を超える消費要求を表す例外
 * なぜ: 部分的な引き落としをせずに要求全体を拒否するため
 */
package com.example.perks.service;

import com.example.perks.model.PerkType;

public class InsufficientBalanceException extends RuntimeException {

    private final PerkType perkType;
    private final int requested;
    private final int available;

    public InsufficientBalanceException(PerkType perkType, int requested, int available) {
        super("insufficient balance perkType=" + perkType + " requested=" + requested + " available=" + available);
        this.perkType = perkType;
        this.requested = requested;
        this.available = available;
    }

    public PerkType perkType() {
        return perkType;
    }

    public int requested() {
        return requested;
    }

    public int available() {
        return available;
    }
}
