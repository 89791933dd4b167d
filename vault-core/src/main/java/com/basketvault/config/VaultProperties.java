package com.basketvault.config;

import com.basketvault.engine.price.OracleSource;
import com.basketvault.engine.rebalance.RebalancePolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix="vault")
public record VaultProperties(
    @Valid Oracle oracle,
    @Valid Rebalance rebalance,
    @Valid Confidential confidential
) {

  public VaultProperties {
    if (oracle == null) {
      oracle = defaultOracle();
    }
    if (rebalance == null) {
      rebalance = defaultRebalance();
    }
    if (confidential == null) {
      confidential = defaultConfidential();
    }
  }

  private static Oracle defaultOracle() {
    return new Oracle(null, null, null, null);
  }

  private static Rebalance defaultRebalance() {
    return new Rebalance(null, null, null, null);
  }

  private static Confidential defaultConfidential() {
    return new Confidential(null, null);
  }

  /**
   * Quote acceptance limits. The source itself is chosen per vault by its composition.
   */
  public record Oracle(
      /**
       * Quotes at or beyond this age are rejected as stale.
       */
      Duration switchboardMaxQuoteAge,
      Duration pythMaxQuoteAge,
      Duration mockMaxQuoteAge,
      /**
       * Sanity ceiling for a normalized price; anything above is rejected as implausible.
       */
      @NotNull @Positive Long maxPriceUsdMicro
  ) {
    public Oracle {
      if (switchboardMaxQuoteAge == null) {
        switchboardMaxQuoteAge = OracleSource.SWITCHBOARD.getDefaultMaxQuoteAge();
      }
      if (pythMaxQuoteAge == null) {
        pythMaxQuoteAge = OracleSource.PYTH.getDefaultMaxQuoteAge();
      }
      if (mockMaxQuoteAge == null) {
        mockMaxQuoteAge = OracleSource.MOCK.getDefaultMaxQuoteAge();
      }
      if (maxPriceUsdMicro == null) {
        maxPriceUsdMicro = 10_000_000_000_000L;
      }
    }

    public Duration maxQuoteAge(OracleSource oracleSource) {
      return switch (oracleSource) {
        case SWITCHBOARD -> switchboardMaxQuoteAge;
        case PYTH -> pythMaxQuoteAge;
        case MOCK -> mockMaxQuoteAge;
      };
    }
  }

  public record Rebalance(
      @NotNull @Min(0) @Max(100) Integer thresholdPercent,
      /**
       * Slippage tolerance applied to every planned swap's expected output (100 = 1%).
       */
      @NotNull @Min(0) @Max(9_999) Integer slippageBps,
      @NotNull @Min(1) Integer maxSwaps,
      @NotNull @PositiveOrZero Long minSwapUsdMicro
  ) {
    public Rebalance {
      if (thresholdPercent == null) {
        thresholdPercent = RebalancePolicy.DEFAULT_THRESHOLD_PERCENT;
      }
      if (slippageBps == null) {
        slippageBps = RebalancePolicy.DEFAULT_SLIPPAGE_BPS;
      }
      if (maxSwaps == null) {
        maxSwaps = RebalancePolicy.DEFAULT_MAX_SWAPS;
      }
      if (minSwapUsdMicro == null) {
        minSwapUsdMicro = RebalancePolicy.DEFAULT_MIN_SWAP_USD_MICRO;
      }
    }

    public RebalancePolicy toPolicy() {
      return new RebalancePolicy(thresholdPercent, slippageBps, maxSwaps, minSwapUsdMicro);
    }
  }

  public record Confidential(
      @NotNull Boolean enabled,
      /**
       * Recompute in plaintext and reject the confidential result when they differ.
       */
      @NotNull Boolean crossCheck
  ) {
    public Confidential {
      if (enabled == null) {
        enabled = false;
      }
      if (crossCheck == null) {
        crossCheck = true;
      }
    }
  }
}
