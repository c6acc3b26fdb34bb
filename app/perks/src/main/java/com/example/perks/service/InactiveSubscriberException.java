/*
 * どこで: Perks サービス層
 * 何を: 無効化された購読者が特典を消費しようとしたことを表す例外
 */
package com.example.perks.service;

public class InactiveSubscriberException extends RuntimeException {

    public InactiveSubscriberException(String subscriberId) {
        super("subscriber is not active: " + subscriberId);
    }
}
