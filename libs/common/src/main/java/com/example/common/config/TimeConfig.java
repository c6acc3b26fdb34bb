/*
 * どこで: Common 共通設定
 * 何を: 月次リフレッシュ判定に使う Clock を Bean として提供する
 * なぜ: 判定ロジックを実時間から切り離し、テストで月境界を再現できるようにするため
 */
package com.example.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  // 月キーは Clock のゾーンで算出するため UTC に固定する
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
