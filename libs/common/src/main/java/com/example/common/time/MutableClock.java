/*
 * どこで: Common 時刻ユーティリティ
 * 何を: 外部から現在時刻を設定/前進できる Clock 実装
 * なぜ: 月境界をまたぐリフレッシュをテストや検証環境で決定的に再現するため
 */
package com.example.common.time;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

public final class MutableClock extends Clock {

  private final AtomicReference<Instant> current;
  private final ZoneId zone;

  public MutableClock(Instant initial, ZoneId zone) {
    this(new AtomicReference<>(Objects.requireNonNull(initial, "initial")), zone);
  }

  private MutableClock(AtomicReference<Instant> current, ZoneId zone) {
    this.current = current;
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  public static MutableClock startingAt(Instant initial) {
    return new MutableClock(initial, ZoneId.of("UTC"));
  }

  /**
   * 役割: 現在時刻を任意の値へ置き換える。
   * 動作: 過去方向への設定も許可する。
   * 前提: instant は null でない。
   */
  public void set(Instant instant) {
    current.set(Objects.requireNonNull(instant, "instant"));
  }

  /**
   * 役割: 現在時刻を指定時刻まで進める。
   * 動作: 現在より前の時刻は IllegalArgumentException とし、時刻は変更しない。
   */
  public void advanceTo(Instant instant) {
    Objects.requireNonNull(instant, "instant");
    current.updateAndGet(
        now -> {
          if (instant.isBefore(now)) {
            throw new IllegalArgumentException(
                "cannot move clock backwards from " + now + " to " + instant);
          }
          return instant;
        });
  }

  public void advance(Duration duration) {
    if (duration.isNegative()) {
      throw new IllegalArgumentException("duration must not be negative: " + duration);
    }
    current.updateAndGet(now -> now.plus(duration));
  }

  @Override
  public ZoneId getZone() {
    return zone;
  }

  // 同じ時刻セルを共有したままゾーンだけ差し替える
  @Override
  public Clock withZone(ZoneId zone) {
    if (this.zone.equals(zone)) {
      return this;
    }
    return new MutableClock(current, zone);
  }

  @Override
  public Instant instant() {
    return current.get();
  }

  @Override
  public String toString() {
    return "MutableClock[" + current.get() + "," + zone + "]";
  }
}
