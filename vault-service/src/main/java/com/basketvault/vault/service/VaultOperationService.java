package com.basketvault.vault.service;

import com.basketvault.config.VaultProperties;
import com.basketvault.engine.error.VaultErrorCode;
import com.basketvault.engine.error.VaultException;
import com.basketvault.engine.issuance.AssetRelease;
import com.basketvault.engine.issuance.DepositAllocation;
import com.basketvault.engine.issuance.DepositQuote;
import com.basketvault.engine.issuance.IssuanceCalculator;
import com.basketvault.engine.issuance.RedemptionCalculator;
import com.basketvault.engine.issuance.RedemptionQuote;
import com.basketvault.engine.math.FixedPoint;
import com.basketvault.engine.model.AssetAllocation;
import com.basketvault.engine.model.ValuationSnapshot;
import com.basketvault.engine.model.VaultComposition;
import com.basketvault.engine.port.BalanceStore;
import com.basketvault.engine.port.SwapExecutor;
import com.basketvault.engine.price.NormalizedPrice;
import com.basketvault.engine.price.OracleProvider;
import com.basketvault.engine.price.OracleSource;
import com.basketvault.engine.price.QuoteGuard;
import com.basketvault.engine.price.SwapMath;
import com.basketvault.engine.rebalance.DriftRebalancer;
import com.basketvault.engine.rebalance.RebalanceInput;
import com.basketvault.engine.rebalance.RebalanceOutcome;
import com.basketvault.engine.rebalance.RebalancePolicy;
import com.basketvault.engine.rebalance.SwapInstruction;
import com.basketvault.engine.strategy.StrategyDelegation;
import com.basketvault.engine.strategy.StrategyDelegationLedger;
import com.basketvault.engine.strategy.UnwindResult;
import com.basketvault.engine.strategy.YieldStrategy;
import com.basketvault.engine.valuation.ValuationEngine;
import com.basketvault.vault.confidential.ConfidentialRebalancer;
import com.basketvault.vault.model.DepositReceipt;
import com.basketvault.vault.model.RebalanceResult;
import com.basketvault.vault.model.VaultState;
import com.basketvault.vault.model.WithdrawalReceipt;
import com.basketvault.vault.service.VaultRegistry.VaultHandle;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Deposit, withdraw, rebalance and delegation operations over registered vaults.
 *
 * Each operation runs under the vault's exclusive lock and follows the same shape:
 * 1. Read prices, balances and strategy value
 * 2. Compute and validate the full outcome with the engine
 * 3. Call the external collaborators: swaps first, then stake/unstake
 * 4. Commit the new vault state
 *
 * Any failure before step 4 leaves the vault's shares and delegation untouched. A strategy
 * call is never followed by a fallible swap, so an unstake is always committed.
 * Incoming deposit funds are expected to not yet be reflected in the BalanceStore.
 */
@Slf4j
public class VaultOperationService {

    private final VaultRegistry registry;
    private final BalanceStore balanceStore;
    private final SwapExecutor swapExecutor;
    private final ValuationEngine valuationEngine;
    private final IssuanceCalculator issuanceCalculator;
    private final RedemptionCalculator redemptionCalculator;
    private final DriftRebalancer rebalancer;
    private final StrategyDelegationLedger ledger;
    private final ConfidentialRebalancer confidentialRebalancer; // null when disabled
    private final RebalancePolicy policy;
    private final Map<OracleSource, QuoteGuard> quoteGuards = new EnumMap<>(OracleSource.class);
    private final MeterRegistry meterRegistry;

    public VaultOperationService(
            VaultRegistry registry,
            OracleProvider oracleProvider,
            BalanceStore balanceStore,
            SwapExecutor swapExecutor,
            ValuationEngine valuationEngine,
            IssuanceCalculator issuanceCalculator,
            RedemptionCalculator redemptionCalculator,
            DriftRebalancer rebalancer,
            StrategyDelegationLedger ledger,
            ConfidentialRebalancer confidentialRebalancer,
            VaultProperties properties,
            Clock clock,
            MeterRegistry meterRegistry
    ) {
        this.registry = registry;
        this.balanceStore = balanceStore;
        this.swapExecutor = swapExecutor;
        this.valuationEngine = valuationEngine;
        this.issuanceCalculator = issuanceCalculator;
        this.redemptionCalculator = redemptionCalculator;
        this.rebalancer = rebalancer;
        this.ledger = ledger;
        this.confidentialRebalancer = confidentialRebalancer;
        this.policy = properties.rebalance().toPolicy();
        this.meterRegistry = meterRegistry;

        VaultProperties.Oracle oracle = properties.oracle();
        for (OracleSource source : OracleSource.values()) {
            quoteGuards.put(source, new QuoteGuard(
                    oracleProvider, oracle.maxQuoteAge(source), oracle.maxPriceUsdMicro(), clock));
        }
    }

    /**
     * Current valuation of a vault, with the strategy position re-read.
     */
    public ValuationSnapshot valuation(String vaultName) {
        return registry.execute(vaultName, handle -> {
            VaultComposition composition = handle.composition();
            StrategyDelegation delegation = refreshedDelegation(handle);
            return valuationEngine.snapshot(composition, readBalances(composition), prices(composition),
                    delegation == null ? 0L : delegation.currentValue(), handle.state().totalShares());
        });
    }

    /**
     * Deposit {@code amount} base units on behalf of {@code holder}.
     */
    public DepositReceipt deposit(String vaultName, String holder, long amount) {
        return instrumented(vaultName, "deposit", "vault.deposits", () -> registry.execute(vaultName, handle -> {
            VaultComposition composition = handle.composition();
            VaultState state = handle.state();
            Map<String, NormalizedPrice> prices = prices(composition);
            StrategyDelegation delegation = refreshedDelegation(handle);

            ValuationSnapshot current = valuationEngine.snapshot(composition, readBalances(composition), prices,
                    delegation == null ? 0L : delegation.currentValue(), state.totalShares());
            DepositQuote quote = issuanceCalculator.quoteDeposit(composition, current, amount, prices,
                    policy.slippageBps());
            log.info("Deposit into {} by {}: {} base units = {} micro-USD at share price {} -> {} shares",
                    vaultName, holder, amount, quote.depositUsdMicro(), quote.sharePriceUsdMicro(), quote.sharesToMint());

            long toDelegate = 0L;
            for (DepositAllocation allocation : quote.allocations()) {
                long acquired = allocation.expectedAssetAmount();
                if (allocation.requiresSwap()) {
                    acquired = executeSwap(new SwapInstruction(composition.baseAssetId(), allocation.assetId(),
                            allocation.baseAmount(), allocation.minAssetAmount()));
                }
                if (allocation.routesToStrategy()) {
                    toDelegate = FixedPoint.add(toDelegate, acquired);
                }
            }

            StrategyDelegation nextDelegation = delegation;
            if (toDelegate > 0) {
                nextDelegation = ledger.delegate(delegation, vaultName, strategyOf(handle), toDelegate);
            }

            VaultState next = state.withMinted(holder, quote.sharesToMint()).withDelegation(nextDelegation);
            handle.commit(next);
            log.info("Deposit into {} settled: holder {} now has {} shares, supply={}, tvl={} sharePrice={}",
                    vaultName, holder, next.sharesOf(holder), next.totalShares(),
                    quote.postDepositTvlUsdMicro(), quote.postDepositSharePriceUsdMicro());
            return new DepositReceipt(vaultName, holder, quote, toDelegate, next.sharesOf(holder));
        }));
    }

    /**
     * Burn {@code shares} of {@code holder} and release the proportional slice of every asset,
     * settled in the base asset.
     */
    public WithdrawalReceipt withdraw(String vaultName, String holder, long shares) {
        return instrumented(vaultName, "withdraw", "vault.withdrawals", () -> registry.execute(vaultName, handle -> {
            VaultComposition composition = handle.composition();
            VaultState state = handle.state();
            Map<String, NormalizedPrice> prices = prices(composition);
            StrategyDelegation delegation = refreshedDelegation(handle);

            RedemptionQuote quote = redemptionCalculator.quoteRedemption(composition, readBalances(composition),
                    prices,
                    delegation == null ? 0L : delegation.currentValue(),
                    delegation == null ? 0L : delegation.principal(),
                    shares, state.totalShares(), state.sharesOf(holder));
            log.info("Withdrawal from {} by {}: {} shares = {}/{} of the vault",
                    vaultName, holder, shares, quote.withdrawalFraction(), FixedPoint.FRACTION_SCALE);

            long settled = 0L;
            for (AssetRelease release : quote.releases()) {
                if (release.requiresSwap()) {
                    settled = FixedPoint.add(settled, executeSwap(new SwapInstruction(release.assetId(),
                            composition.baseAssetId(), release.amount(),
                            SwapMath.minimumOutput(release.expectedSettlement(), policy.slippageBps()))));
                } else {
                    settled = FixedPoint.add(settled, release.expectedSettlement());
                }
            }

            // Unstaking cannot be undone, so it is the last collaborator call before the commit.
            StrategyDelegation nextDelegation = delegation;
            long strategyReceived = 0L;
            long yieldAmount = 0L;
            if (delegation != null && quote.unwindsStrategy()) {
                UnwindResult unwind = ledger.undelegate(delegation, vaultName, strategyOf(handle),
                        quote.withdrawalFraction());
                nextDelegation = unwind.delegation();
                strategyReceived = unwind.receivedAmount();
                yieldAmount = unwind.yieldAmount();
            }

            VaultState next = state.withBurned(holder, shares).withDelegation(nextDelegation);
            handle.commit(next);
            log.info("Withdrawal from {} settled: {} base units from assets, {} from strategy (yield {}), supply={}",
                    vaultName, settled, strategyReceived, yieldAmount, next.totalShares());
            return new WithdrawalReceipt(vaultName, holder, quote, settled, strategyReceived, yieldAmount,
                    next.sharesOf(holder));
        }));
    }

    /**
     * Evaluate drift and, when any asset is beyond the threshold, execute the swap plan.
     *
     * Drift is measured on effective holdings: the strategy asset includes the delegated
     * position. Swaps can only spend vault-held balances.
     */
    public RebalanceResult rebalance(String vaultName) {
        return instrumented(vaultName, "rebalance", "vault.rebalances", () -> registry.execute(vaultName, handle -> {
            VaultComposition composition = handle.composition();
            Map<String, NormalizedPrice> prices = prices(composition);
            Map<String, Long> liquid = readBalances(composition);
            StrategyDelegation delegation = refreshedDelegation(handle);

            Map<String, Long> effective = new HashMap<>(liquid);
            if (delegation != null && delegation.currentValue() > 0) {
                AssetAllocation strategyAsset = composition.strategyAllocation().orElseThrow(
                        () -> new VaultException(VaultErrorCode.ASSET_NOT_FOUND, "strategy asset of " + vaultName));
                effective.merge(strategyAsset.assetId(), delegation.currentValue(), FixedPoint::add);
            }

            RebalanceInput input = RebalanceInput.of(composition, effective, prices);
            boolean confidential = confidentialRebalancer != null;
            RebalanceOutcome outcome = confidential
                    ? confidentialRebalancer.rebalance(input, policy)
                    : rebalancer.rebalance(input, policy);

            if (!outcome.report().needsRebalance()) {
                log.info("Rebalance of {}: all assets within {}% of target", vaultName, policy.thresholdPercent());
                return new RebalanceResult(vaultName, outcome.report(), outcome.plan(), List.of(), confidential);
            }

            checkLiquidity(vaultName, outcome, liquid);
            meterRegistry.counter("vault.swaps.planned", "vault", vaultName).increment(outcome.plan().size());

            List<Long> realized = new ArrayList<>(outcome.plan().size());
            for (SwapInstruction swap : outcome.plan().swaps()) {
                realized.add(executeSwap(swap));
            }
            log.info("Rebalance of {} executed {} swaps (confidential={})", vaultName, realized.size(), confidential);
            return new RebalanceResult(vaultName, outcome.report(), outcome.plan(), realized, confidential);
        }));
    }

    /**
     * Delegate {@code amount} of the strategy asset held by the vault to its yield strategy.
     */
    public StrategyDelegation delegate(String vaultName, long amount) {
        return instrumented(vaultName, "delegate", "vault.delegations", () -> registry.execute(vaultName, handle -> {
            StrategyDelegation delegation = requireDelegation(handle);
            StrategyDelegation updated = ledger.delegate(delegation, vaultName, strategyOf(handle), amount);
            handle.commit(handle.state().withDelegation(updated));
            return updated;
        }));
    }

    /**
     * Unwind {@code fraction / FRACTION_SCALE} of the vault's delegated position.
     */
    public UnwindResult undelegate(String vaultName, long fraction) {
        return instrumented(vaultName, "undelegate", "vault.undelegations", () -> registry.execute(vaultName, handle -> {
            StrategyDelegation delegation = ledger.refresh(requireDelegation(handle), strategyOf(handle));
            UnwindResult result = ledger.undelegate(delegation, vaultName, strategyOf(handle), fraction);
            handle.commit(handle.state().withDelegation(result.delegation()));
            return result;
        }));
    }

    private void checkLiquidity(String vaultName, RebalanceOutcome outcome, Map<String, Long> liquid) {
        Map<String, Long> spent = new LinkedHashMap<>();
        for (SwapInstruction swap : outcome.plan().swaps()) {
            spent.merge(swap.fromAsset(), swap.amountIn(), FixedPoint::add);
        }
        for (Map.Entry<String, Long> entry : spent.entrySet()) {
            long available = liquid.getOrDefault(entry.getKey(), 0L);
            if (entry.getValue() > available) {
                log.warn("Rebalance of {} needs {} {} but only {} is held by the vault",
                        vaultName, entry.getValue(), entry.getKey(), available);
                throw new VaultException(VaultErrorCode.INSUFFICIENT_BALANCE,
                        entry.getKey() + " needs " + entry.getValue() + ", vault holds " + available);
            }
        }
    }

    private long executeSwap(SwapInstruction swap) {
        long realized;
        try {
            realized = swapExecutor.execute(swap);
        } catch (VaultException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Swap {} -> {} of {} failed: {}", swap.fromAsset(), swap.toAsset(), swap.amountIn(), e.getMessage());
            throw new VaultException(VaultErrorCode.SWAP_FAILED,
                    swap.amountIn() + " " + swap.fromAsset() + " -> " + swap.toAsset(), e);
        }
        if (realized < swap.minAmountOut()) {
            throw new VaultException(VaultErrorCode.SWAP_FAILED,
                    "realized " + realized + " " + swap.toAsset() + " below minimum " + swap.minAmountOut());
        }
        return realized;
    }

    private Map<String, NormalizedPrice> prices(VaultComposition composition) {
        return quoteGuards.get(composition.oracleSource()).prices(composition);
    }

    private Map<String, Long> readBalances(VaultComposition composition) {
        Map<String, Long> balances = new LinkedHashMap<>();
        for (AssetAllocation asset : composition.allocations()) {
            balances.put(asset.assetId(), balanceStore.getBalance(asset.balanceHandle()));
        }
        return balances;
    }

    private StrategyDelegation refreshedDelegation(VaultHandle handle) {
        StrategyDelegation delegation = handle.state().delegation();
        if (delegation == null) {
            return null;
        }
        return ledger.refresh(delegation, strategyOf(handle));
    }

    private StrategyDelegation requireDelegation(VaultHandle handle) {
        StrategyDelegation delegation = handle.state().delegation();
        if (delegation == null) {
            throw new VaultException(VaultErrorCode.ASSET_NOT_FOUND,
                    "vault " + handle.composition().name() + " has no yield strategy");
        }
        return delegation;
    }

    private static YieldStrategy strategyOf(VaultHandle handle) {
        return handle.strategy().orElseThrow(() -> new VaultException(VaultErrorCode.ASSET_NOT_FOUND,
                "vault " + handle.composition().name() + " has no yield strategy"));
    }

    private <T> T instrumented(String vaultName, String operation, String successCounter, Supplier<T> body) {
        try {
            T result = body.get();
            meterRegistry.counter(successCounter, "vault", vaultName).increment();
            return result;
        } catch (RuntimeException e) {
            meterRegistry.counter("vault.operations.failed", "vault", vaultName, "operation", operation).increment();
            throw e;
        }
    }
}
