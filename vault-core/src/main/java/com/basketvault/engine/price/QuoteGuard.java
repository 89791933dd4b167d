package com.basketvault.engine.price;

import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.VaultComposition;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Turns oracle quotes into normalized prices, rejecting stale or implausible ones.
 *
 * A quote whose age is at or beyond {@code maxQuoteAge}, or that is stamped
 * after the current instant, is STALE_QUOTE; a non-positive price or one above the sanity ceiling is INVALID_PRICE.
 */
@Slf4j
public class QuoteGuard {

    private final OracleProvider oracle;
    private final Duration maxQuoteAge;
    private final long maxPriceUsdMicro;
    private final Clock clock;

    public QuoteGuard(OracleProvider oracle, Duration maxQuoteAge, long maxPriceUsdMicro, Clock clock) {
        this.oracle = oracle;
        this.maxQuoteAge = maxQuoteAge;
        this.maxPriceUsdMicro = maxPriceUsdMicro;
        this.clock = clock;
    }

    /**
     * Fetch and validate the current price of one asset.
     */
    public NormalizedPrice price(String assetId) {
        OracleQuote quote = oracle.getQuote(assetId);
        if (quote == null) {
            throw new VaultException(VaultErrorCode.INVALID_PRICE, "no quote for " + assetId);
        }
        return verify(quote);
    }

    /**
     * Prices for every asset of a composition plus its base asset, keyed by asset id.
     */
    public Map<String, NormalizedPrice> prices(VaultComposition composition) {
        Map<String, NormalizedPrice> prices = new LinkedHashMap<>();
        for (AssetAllocation allocation : composition.allocations()) {
            prices.put(allocation.assetId(), price(allocation.assetId()));
        }
        prices.computeIfAbsent(composition.baseAssetId(), this::price);
        return prices;
    }

    /**
     * Validate an already-fetched quote.
     */
    public NormalizedPrice verify(OracleQuote quote) {
        Instant now = clock.instant();
        if (quote.observedAt() == null) {
            throw new VaultException(VaultErrorCode.STALE_QUOTE, "quote for " + quote.assetId() + " has no timestamp");
        }
        Duration age = Duration.between(quote.observedAt(), now);
        if (age.isNegative()) {
            log.warn("Rejecting quote for {} stamped {}s in the future", quote.assetId(), age.negated().toSeconds());
            throw new VaultException(VaultErrorCode.STALE_QUOTE,
                    quote.assetId() + " quote is timestamped after " + now);
        }
        if (age.compareTo(maxQuoteAge) >= 0) {
            log.warn("Rejecting stale quote for {}: age={}s max={}s",
                    quote.assetId(), age.toSeconds(), maxQuoteAge.toSeconds());
            throw new VaultException(VaultErrorCode.STALE_QUOTE,
                    quote.assetId() + " quote is " + age.toSeconds() + "s old");
        }

        NormalizedPrice price = NormalizedPrice.normalize(quote.rawPrice(), quote.rawExponent());
        if (price.usdMicro() > maxPriceUsdMicro) {
            log.warn("Rejecting implausible price for {}: {} micro-USD exceeds ceiling {}",
                    quote.assetId(), price.usdMicro(), maxPriceUsdMicro);
            throw new VaultException(VaultErrorCode.INVALID_PRICE,
                    quote.assetId() + " price " + price.usdMicro() + " exceeds ceiling");
        }
        log.debug("Price {}: raw={}e{} usdMicro={}", quote.assetId(), quote.rawPrice(), quote.rawExponent(), price.usdMicro());
        return price;
    }
}
