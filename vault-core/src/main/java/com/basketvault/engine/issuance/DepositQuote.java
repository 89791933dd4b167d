package com.basketvault.engine.issuance;

import java.util.List;

/**
 * Everything a deposit will do, computed before anything is executed.
 */
public record DepositQuote(
        long depositAmount,
        long depositUsdMicro,
        long sharePriceUsdMicro,
        long sharesToMint,
        List<DepositAllocation> allocations,
        long amountToDelegate,       // Asset units routed to the yield strategy
        long unallocatedBaseAmount,  // Truncation remainder left in the base asset
        long postDepositTvlUsdMicro,
        long postDepositTotalShares,
        long postDepositSharePriceUsdMicro
) {

    public DepositQuote {
        allocations = List.copyOf(allocations);
    }
}
