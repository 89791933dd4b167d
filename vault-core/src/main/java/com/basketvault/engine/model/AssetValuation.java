package com.basketvault.engine.model;

/**
 * Value of one asset's holdings at a normalized price.
 */
public record AssetValuation(
        String assetId,
        long balance,
        long usdMicro
) {
}
