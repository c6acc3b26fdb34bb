/*
 * どこで: Perks サービス層
 * 何を: 台帳レジストリに登録のない購読者を表す例外
 */
package com.example.perks.service;

public class SubscriberNotFoundException extends RuntimeException {

    public SubscriberNotFoundException(String subscriberId) {
        super("subscriber not found: " + subscriberId);
    }
}
