/*
 * どこで: Perks ドメインモデルのユニットテスト
 * 何を: 月キーの算出/順序/文字列表現を検証する
 * なぜ: リフレッシュ要否の判定根拠が揺れないようにするため
 */
package com.example.perks.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class PeriodKeyTest {

  @Test
  void nowUsesClockZone() {
    final Instant instant = Instant.parse("2024-01-31T20:00:00Z");

    assertThat(PeriodKey.now(Clock.fixed(instant, ZoneOffset.UTC))).isEqualTo(new PeriodKey(2024, 1));
    // 東京時間では既に2月
    assertThat(PeriodKey.now(Clock.fixed(instant, ZoneId.of("Asia/Tokyo"))))
        .isEqualTo(new PeriodKey(2024, 2));
  }

  @Test
  void ordersByYearThenMonth() {
    assertThat(new PeriodKey(2023, 12)).isLessThan(new PeriodKey(2024, 1));
    assertThat(new PeriodKey(2024, 2)).isGreaterThan(new PeriodKey(2024, 1));
    assertThat(new PeriodKey(2024, 1).isBefore(new PeriodKey(2024, 1))).isFalse();
    assertThat(new PeriodKey(2024, 1)).isEqualByComparingTo(new PeriodKey(2024, 1));
  }

  @Test
  void toStringAndParseUseYearMonthFormat() {
    assertThat(new PeriodKey(2024, 3)).hasToString("2024-03");
    assertThat(PeriodKey.parse("2025-11")).isEqualTo(new PeriodKey(2025, 11));
  }

  @Test
  void rejectsInvalidMonthAndMalformedText() {
    assertThatThrownBy(() -> new PeriodKey(2024, 13)).isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> PeriodKey.parse("2024/01"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("invalid period key");
  }
}
