package com.snipebot.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;

@Validated
@ConfigurationProperties(prefix="snipebot")
public record SnipebotProperties(
    @Valid Feed feed,
    @Valid Sniper sniper,
    @Valid Checkout checkout,
    @Valid Proxies proxies,
    @Valid Bridge bridge,
    @Valid Session session,
    List<@Valid SearchEndpoint> searchEndpoints,
    List<@Valid Rule> rules
) {

  public SnipebotProperties {
    if (feed == null) {
      feed = new Feed(null, null, null, null, null, null, null);
    }
    if (sniper == null) {
      sniper = new Sniper(null, null, null);
    }
    if (checkout == null) {
      checkout = new Checkout(null, null, null, null, null, null);
    }
    if (proxies == null) {
      proxies = new Proxies(null, null, null);
    }
    if (bridge == null) {
      bridge = new Bridge(null, null, null, null);
    }
    if (session == null) {
      session = new Session(null);
    }
    searchEndpoints = searchEndpoints == null ? List.of() : searchEndpoints.stream()
        .filter(Objects::nonNull)
        .filter(e -> e.url() != null && !e.url().isBlank())
        .toList();
    rules = rules == null ? List.of() : rules.stream().filter(Objects::nonNull).toList();
  }

  private static List<String> sanitizeStringList(List<String> values) {
    if (values == null || values.isEmpty()) {
      return List.of();
    }
    return values.stream()
        .filter(Objects::nonNull)
        .map(String::trim)
        .filter(s -> !s.isEmpty())
        .toList();
  }

  public enum DeliveryType {
    HOME,
    DROPOFF
  }

  public record Feed(
      /**
       * Base interval between poll cycles. Values below {@link #MIN_POLL_INTERVAL_SECONDS} are raised to it.
       */
      @NotNull @Min(1) Integer pollIntervalSeconds,
      /**
       * Uniform jitter applied to every interval, as a fraction of the base (0.30 = +/-30%).
       */
      @NotNull @DecimalMin("0.0") @DecimalMax("0.9") Double pollJitterFraction,
      @NotNull @Min(1) Integer pagesPerEndpoint,
      @NotNull @PositiveOrZero Long endpointPauseMinMillis,
      @NotNull @PositiveOrZero Long endpointPauseMaxMillis,
      /**
       * Once the recently-seen id set grows past this size it is trimmed back to {@link #seenRetain()}.
       */
      @NotNull @Min(1) Integer seenMaxSize,
      @NotNull @Min(1) Integer seenRetain
  ) {
    public static final int MIN_POLL_INTERVAL_SECONDS = 3;

    public Feed {
      if (pollIntervalSeconds == null) {
        pollIntervalSeconds = 5;
      }
      if (pollJitterFraction == null) {
        pollJitterFraction = 0.30;
      }
      if (pagesPerEndpoint == null) {
        pagesPerEndpoint = 3;
      }
      if (endpointPauseMinMillis == null) {
        endpointPauseMinMillis = 1_000L;
      }
      if (endpointPauseMaxMillis == null) {
        endpointPauseMaxMillis = 2_000L;
      }
      if (endpointPauseMaxMillis < endpointPauseMinMillis) {
        endpointPauseMaxMillis = endpointPauseMinMillis;
      }
      if (seenMaxSize == null) {
        seenMaxSize = 5_000;
      }
      if (seenRetain == null) {
        seenRetain = 2_000;
      }
      if (seenRetain > seenMaxSize) {
        seenRetain = seenMaxSize;
      }
    }

    public int effectivePollIntervalSeconds() {
      return Math.max(MIN_POLL_INTERVAL_SECONDS, pollIntervalSeconds);
    }
  }

  public record Sniper(
      @NotNull Boolean autobuyEnabled,
      /**
       * When enabled, expired countdowns only report what would have been bought.
       */
      @NotNull Boolean simulationMode,
      @NotNull @Min(1) Integer countdownSeconds
  ) {
    public Sniper {
      if (autobuyEnabled == null) {
        autobuyEnabled = false;
      }
      if (simulationMode == null) {
        simulationMode = true;
      }
      if (countdownSeconds == null) {
        countdownSeconds = 3;
      }
    }
  }

  public record Checkout(
      @NotNull Boolean verificationEnabled,
      @NotNull @PositiveOrZero BigDecimal verificationThreshold,
      @NotNull DeliveryType deliveryType,
      @NotNull @DecimalMin("-90.0") @DecimalMax("90.0") Double latitude,
      @NotNull @DecimalMin("-180.0") @DecimalMax("180.0") Double longitude,
      String countryCode
  ) {
    public Checkout {
      if (verificationEnabled == null) {
        verificationEnabled = false;
      }
      if (verificationThreshold == null) {
        verificationThreshold = BigDecimal.valueOf(100);
      }
      if (deliveryType == null) {
        deliveryType = DeliveryType.DROPOFF;
      }
      if (latitude == null) {
        latitude = 51.5074;
      }
      if (longitude == null) {
        longitude = -0.1278;
      }
      if (countryCode == null || countryCode.isBlank()) {
        countryCode = "GB";
      }
    }
  }

  public record Proxies(
      List<String> scraping,
      List<String> checkout,
      /**
       * Single shared list used before the pools were split. Only consulted when {@code scraping} is empty.
       */
      List<String> legacy
  ) {
    public Proxies {
      scraping = sanitizeStringList(scraping);
      checkout = sanitizeStringList(checkout);
      legacy = sanitizeStringList(legacy);
    }

    public List<String> effectiveScraping() {
      return scraping.isEmpty() ? legacy : scraping;
    }
  }

  public record Bridge(
      String baseUrl,
      String marketplaceBaseUrl,
      @NotNull @Min(1) Long requestTimeoutMillis,
      @Valid Retry retry
  ) {
    public Bridge {
      if (baseUrl == null || baseUrl.isBlank()) {
        baseUrl = "http://127.0.0.1:37421";
      }
      if (marketplaceBaseUrl == null || marketplaceBaseUrl.isBlank()) {
        marketplaceBaseUrl = "https://www.vinted.co.uk";
      }
      if (requestTimeoutMillis == null) {
        requestTimeoutMillis = 45_000L;
      }
      if (retry == null) {
        retry = new Retry(null, null, null);
      }
    }
  }

  public record Retry(
      @NotNull @Min(1) Integer maxAttempts,
      @NotNull @PositiveOrZero Long initialBackoffMillis,
      @NotNull @DecimalMin("1.0") Double multiplier
  ) {
    public Retry {
      if (maxAttempts == null) {
        maxAttempts = 3;
      }
      if (initialBackoffMillis == null) {
        initialBackoffMillis = 2_000L;
      }
      if (multiplier == null) {
        multiplier = 2.0;
      }
    }
  }

  public record Session(String cookie) {
  }

  public record SearchEndpoint(@NotNull String url, Boolean enabled) {
    public SearchEndpoint {
      if (url != null) {
        url = url.trim();
      }
      if (enabled == null) {
        enabled = true;
      }
    }
  }

  public record Rule(
      @NotNull Long id,
      @NotNull String name,
      @PositiveOrZero BigDecimal priceMax,
      String keywords,
      String condition,
      @PositiveOrZero BigDecimal budgetLimit,
      Boolean enabled
  ) {
    public Rule {
      if (budgetLimit == null) {
        budgetLimit = BigDecimal.ZERO;
      }
      if (enabled == null) {
        enabled = false;
      }
    }
  }
}
