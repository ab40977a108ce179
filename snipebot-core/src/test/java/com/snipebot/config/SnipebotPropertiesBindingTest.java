package com.snipebot.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class SnipebotPropertiesBindingTest {

  private final ApplicationContextRunner runner = new ApplicationContextRunner()
      .withUserConfiguration(TestConfig.class);

  @Test
  void appliesDefaultsWhenNothingIsConfigured() {
    runner.run(context -> {
      SnipebotProperties properties = context.getBean(SnipebotProperties.class);

      assertThat(properties.feed().pollIntervalSeconds()).isEqualTo(5);
      assertThat(properties.feed().pagesPerEndpoint()).isEqualTo(3);
      assertThat(properties.feed().seenMaxSize()).isEqualTo(5000);
      assertThat(properties.feed().seenRetain()).isEqualTo(2000);
      assertThat(properties.sniper().autobuyEnabled()).isFalse();
      assertThat(properties.sniper().simulationMode()).isTrue();
      assertThat(properties.sniper().countdownSeconds()).isEqualTo(3);
      assertThat(properties.checkout().deliveryType()).isEqualTo(SnipebotProperties.DeliveryType.DROPOFF);
      assertThat(properties.checkout().verificationThreshold()).isEqualByComparingTo("100");
      assertThat(properties.checkout().latitude()).isEqualTo(51.5074);
      assertThat(properties.bridge().baseUrl()).isEqualTo("http://127.0.0.1:37421");
      assertThat(properties.bridge().retry().maxAttempts()).isEqualTo(3);
      assertThat(properties.searchEndpoints()).isEmpty();
      assertThat(properties.rules()).isEmpty();
    });
  }

  @Test
  void bindsNestedRecordsFromRelaxedProperties() {
    runner.withPropertyValues(
        "snipebot.feed.poll-interval-seconds=1",
        "snipebot.sniper.autobuy-enabled=true",
        "snipebot.checkout.delivery-type=home",
        "snipebot.proxies.legacy[0]=http://10.0.0.1:8000",
        "snipebot.proxies.checkout[0]=http://10.1.0.1:9000",
        "snipebot.search-endpoints[0].url=https://www.vinted.co.uk/catalog?search_text=wool",
        "snipebot.search-endpoints[1].url=https://www.vinted.co.uk/catalog?search_text=boots",
        "snipebot.search-endpoints[1].enabled=false",
        "snipebot.rules[0].id=1",
        "snipebot.rules[0].name=Wool",
        "snipebot.rules[0].price-max=30",
        "snipebot.rules[0].keywords=wool jumper",
        "snipebot.rules[0].budget-limit=50",
        "snipebot.rules[0].enabled=true"
    ).run(context -> {
      SnipebotProperties properties = context.getBean(SnipebotProperties.class);

      assertThat(properties.feed().effectivePollIntervalSeconds()).isEqualTo(3);
      assertThat(properties.sniper().autobuyEnabled()).isTrue();
      assertThat(properties.checkout().deliveryType()).isEqualTo(SnipebotProperties.DeliveryType.HOME);
      assertThat(properties.proxies().scraping()).isEmpty();
      assertThat(properties.proxies().effectiveScraping()).containsExactly("http://10.0.0.1:8000");
      assertThat(properties.proxies().checkout()).containsExactly("http://10.1.0.1:9000");
      assertThat(properties.searchEndpoints()).hasSize(2);
      assertThat(properties.searchEndpoints().get(0).enabled()).isTrue();
      assertThat(properties.searchEndpoints().get(1).enabled()).isFalse();

      SnipebotProperties.Rule rule = properties.rules().get(0);
      assertThat(rule.name()).isEqualTo("Wool");
      assertThat(rule.priceMax()).isEqualByComparingTo(new BigDecimal("30"));
      assertThat(rule.budgetLimit()).isEqualByComparingTo(new BigDecimal("50"));
      assertThat(rule.enabled()).isTrue();
    });
  }

  @Test
  void rejectsOutOfRangeCoordinates() {
    runner.withPropertyValues("snipebot.checkout.latitude=123.0")
        .run(context -> assertThat(context).hasFailed());
  }

  @Configuration(proxyBeanMethods=false)
  @EnableConfigurationProperties(SnipebotProperties.class)
  static class TestConfig {
  }
}
