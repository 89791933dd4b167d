package com.basketvault.engine.rebalance;

import java.util.List;

/**
 * Ordered, all-or-nothing swap guidance for a single rebalance attempt.
 */
public record SwapPlan(List<SwapInstruction> swaps) {

    private static final SwapPlan EMPTY = new SwapPlan(List.of());

    public SwapPlan {
        swaps = List.copyOf(swaps);
    }

    public static SwapPlan empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return swaps.isEmpty();
    }

    public int size() {
        return swaps.size();
    }
}
