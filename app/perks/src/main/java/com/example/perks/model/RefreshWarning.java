/*
 * どこで: Perks ドメインモデル
 * 何を: リフレッシュ時に検知した非致命的な問題を表す
 * なぜ: 台帳更新を巻き戻さずに、呼び出し側へ問題を伝えるため
 */
package com.example.perks.model;

public record RefreshWarning(WarningCode code, String message) {

    public static RefreshWarning unknownPerk(PerkType perkType, String tierId, int retainedBalance) {
        return new RefreshWarning(
                WarningCode.UNKNOWN_PERK,
                "perk " + perkType + " is not granted by tier " + tierId
                        + "; balance " + retainedBalance + " retained");
    }

    public static RefreshWarning portFailure(WarningCode code, RuntimeException ex) {
        final String detail = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
        return new RefreshWarning(code, detail);
    }
}
