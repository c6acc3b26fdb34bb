/*
 * どこで: Perks ドメインモデルのユニットテスト
 * 何を: 台帳の初期状態と不変条件の検証を確認する
 * なぜ: 不正な残高や月キーの巻き戻りが台帳に入らないことを保証するため
 */
package com.example.perks.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class EntitlementLedgerTest {

  private static final PerkType STORAGE = PerkType.of("storage");

  @Test
  void openStartsWithZeroBalancesAndNoPeriod() {
    final EntitlementLedger ledger = EntitlementLedger.open("sub-1", "gold");

    assertThat(ledger.balanceOf(STORAGE)).isZero();
    assertThat(ledger.lastRefreshed()).isEmpty();
    assertThat(ledger.isActive()).isTrue();
    assertThat(ledger.auditTrail()).isEmpty();
  }

  @Test
  void openRejectsBlankIdentifiers() {
    assertThatThrownBy(() -> EntitlementLedger.open(" ", "gold"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("subscriberId");
    assertThatThrownBy(() -> EntitlementLedger.open("sub-1", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("tierId");
  }

  @Test
  void applyRefreshRejectsBackwardPeriodWithoutChanges() {
    final EntitlementLedger ledger = EntitlementLedger.open("sub-1", "gold");
    ledger.applyRefresh(Map.of(STORAGE, 100), new PeriodKey(2024, 2));

    assertThatThrownBy(() -> ledger.applyRefresh(Map.of(STORAGE, 5), new PeriodKey(2024, 1)))
        .isInstanceOf(IllegalStateException.class);

    assertThat(ledger.balanceOf(STORAGE)).isEqualTo(100);
    assertThat(ledger.lastRefreshed()).contains(new PeriodKey(2024, 2));
  }

  @Test
  void applyRefreshRejectsNegativeBalanceWithoutChanges() {
    final EntitlementLedger ledger = EntitlementLedger.open("sub-1", "gold");

    assertThatThrownBy(() -> ledger.applyRefresh(Map.of(STORAGE, -1), new PeriodKey(2024, 1)))
        .isInstanceOf(IllegalStateException.class);

    assertThat(ledger.balances()).isEmpty();
    assertThat(ledger.lastRefreshed()).isEmpty();
  }

  @Test
  void debitRejectsOverdraw() {
    final EntitlementLedger ledger = EntitlementLedger.open("sub-1", "gold");
    ledger.applyRefresh(Map.of(STORAGE, 10), new PeriodKey(2024, 1));

    ledger.debit(STORAGE, 4);

    assertThat(ledger.balanceOf(STORAGE)).isEqualTo(6);
    assertThatThrownBy(() -> ledger.debit(STORAGE, 7)).isInstanceOf(IllegalStateException.class);
    assertThat(ledger.balanceOf(STORAGE)).isEqualTo(6);
  }

  @Test
  void balancesViewIsReadOnly() {
    final EntitlementLedger ledger = EntitlementLedger.open("sub-1", "gold");
    ledger.applyRefresh(Map.of(STORAGE, 10), new PeriodKey(2024, 1));

    assertThatThrownBy(() -> ledger.balances().put(STORAGE, 999))
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
