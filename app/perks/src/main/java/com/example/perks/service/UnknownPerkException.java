/*
 * どこで: Perks サービス層
 * 何を: 宣言されていない特典種別を指定したことを表す例外
 */
package com.example.perks.service;

public class UnknownPerkException extends RuntimeException {

    public UnknownPerkException(String perkType) {
        super("unknown perk type: " + perkType);
    }
}
