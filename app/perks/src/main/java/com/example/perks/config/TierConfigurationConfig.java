/*
 * どこで: Perks アプリの設定
 * 何を: バインド済みのティア設定から TierConfiguration を組み立てる
 * なぜ: 不正な設定を起動時に検出し、実行中は不変のまま共有するため
 */
package com.example.perks.config;

import com.example.perks.model.PerkAllotment;
import com.example.perks.model.PerkType;
import com.example.perks.model.TierDefinition;
import com.example.perks.service.TierConfiguration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TierConfigurationConfig {

  private static final Logger logger = LoggerFactory.getLogger(TierConfigurationConfig.class);

  @Bean
  TierConfiguration tierConfiguration(PerksTierProperties properties) {
    final TierConfiguration configuration = toTierConfiguration(properties);
    logger.info(
        "tier configuration loaded tiers={} perkTypes={}",
        configuration.tierIds(),
        configuration.perkTypes());
    return configuration;
  }

  static TierConfiguration toTierConfiguration(PerksTierProperties properties) {
    final Set<PerkType> perkTypes = new LinkedHashSet<>();
    for (String rawPerkType : properties.perkTypes()) {
      if (!perkTypes.add(PerkType.of(rawPerkType))) {
        throw new IllegalStateException("duplicate perk type: " + rawPerkType);
      }
    }
    final List<TierDefinition> tiers = new ArrayList<>();
    properties
        .tiers()
        .forEach((tierId, tier) -> tiers.add(toTierDefinition(tierId, tier, perkTypes)));
    return new TierConfiguration(perkTypes, tiers);
  }

  private static TierDefinition toTierDefinition(
      String tierId, PerksTierProperties.TierProperties tier, Set<PerkType> declared) {
    final Map<PerkType, PerkAllotment> perks = new LinkedHashMap<>();
    tier.perks()
        .forEach(
            (rawPerkType, perk) -> {
              final PerkType perkType = PerkType.of(rawPerkType);
              if (!declared.contains(perkType)) {
                throw new IllegalStateException(
                    "tier " + tierId + " references undeclared perk type: " + rawPerkType);
              }
              if (perks.put(perkType, toAllotment(perk)) != null) {
                throw new IllegalStateException(
                    "tier " + tierId + " declares perk type twice: " + rawPerkType);
              }
            });
    return new TierDefinition(tierId, perks);
  }

  private static PerkAllotment toAllotment(PerksTierProperties.PerkProperties perk) {
    if (PerksTierProperties.UNBOUNDED.equals(perk.rolloverCap())) {
      return PerkAllotment.unbounded(perk.allotment());
    }
    try {
      return PerkAllotment.capped(perk.allotment(), Integer.parseInt(perk.rolloverCap()));
    } catch (NumberFormatException ex) {
      throw new IllegalStateException("rollover-cap is out of range: " + perk.rolloverCap(), ex);
    }
  }
}
