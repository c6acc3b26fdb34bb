/*
 * どこで: Perks サービス層
 * 何を: 課金プロバイダへの同期失敗を理由付きで表現する
 * なぜ: リフレッシュ結果の警告へ失敗理由を一貫して載せるため
 */
package com.example.perks.service;

public class BillingSyncException extends RuntimeException {

  public enum Reason {
    NOT_FOUND,
    TIMEOUT,
    BAD_GATEWAY
  }

  private final Reason reason;

  public BillingSyncException(Reason reason, String message, Throwable cause) {
    super(message, cause);
    this.reason = reason;
  }

  public Reason reason() {
    return reason;
  }
}
