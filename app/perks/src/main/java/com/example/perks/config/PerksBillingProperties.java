/*
 * どこで: Perks アプリの設定バインド
 * 何を: 課金プロバイダへのリフレッシュ同期の接続先を保持する
 * なぜ: 環境ごとに同期先 URL とパスを外部化するため
 */
package com.example.perks.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "perks.billing")
public record PerksBillingProperties(boolean enabled, String baseUrl, String refreshPath) {

  public PerksBillingProperties {
    baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://billing:80" : baseUrl;
    refreshPath =
        refreshPath == null || refreshPath.isBlank()
            ? "/v1/subscribers/{subscriberId}/refreshes"
            : refreshPath;
  }
}
