package com.basketvault.engine.price;

/**
 * Reads the latest quote for an asset from the selected oracle source.
 * Byte-level parsing of the oracle's account format lives behind this interface.
 */
public interface OracleProvider {

    OracleQuote getQuote(String assetId);
}
