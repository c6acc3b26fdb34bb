/*
 * どこで: Perks アプリの設定
 * 何を: 課金同期専用の RestClient を提供する
 * なぜ: 課金プロバイダの baseUrl 設定責務を同期アダプタから分離するため
 */
package com.example.perks.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestClient;

@Configuration
@ConditionalOnProperty(name = "perks.billing.enabled", havingValue = "true")
public class BillingClientConfig {

  @Bean
  RestClient billingRestClient(RestClient.Builder builder, PerksBillingProperties properties) {
    return builder.baseUrl(properties.baseUrl()).build();
  }
}
