package com.example.perks.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

class PerksBillingPropertiesBindingTest {

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner().withUserConfiguration(TestConfiguration.class);

  @Test
  void defaultsApplyWhenUnset() {
    contextRunner.run(
        context -> {
          final PerksBillingProperties properties = context.getBean(PerksBillingProperties.class);
          assertThat(properties.enabled()).isFalse();
          assertThat(properties.baseUrl()).isEqualTo("http://billing:80");
          assertThat(properties.refreshPath()).isEqualTo("/v1/subscribers/{subscriberId}/refreshes");
        });
  }

  @Test
  void bindsConfiguredValues() {
    contextRunner
        .withPropertyValues(
            "perks.billing.enabled=true",
            "perks.billing.base-url=http://billing.internal",
            "perks.billing.refresh-path=/sync/{subscriberId}")
        .run(
            context -> {
              final PerksBillingProperties properties =
                  context.getBean(PerksBillingProperties.class);
              assertThat(properties.enabled()).isTrue();
              assertThat(properties.baseUrl()).isEqualTo("http://billing.internal");
              assertThat(properties.refreshPath()).isEqualTo("/sync/{subscriberId}");
            });
  }

  @Configuration
  @EnableConfigurationProperties(PerksBillingProperties.class)
  static class TestConfiguration {
    // ApplicationContextRunner 用の最小構成
  }
}
