package com.finopsguard.simulation;

import com.finopsguard.domain.model.CanonicalResource;
import com.finopsguard.domain.model.CanonicalResourceModel;
import com.finopsguard.domain.model.PricingConfidence;
import com.finopsguard.pricing.PriceQuote;
import com.finopsguard.pricing.PriceSourceType;
import com.finopsguard.pricing.PricingResolver;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Estimates the monthly and first-week cost of a canonical resource model.
 *
 * COST MODEL:
 * - monthly = hourly unit price x count x 730 hours
 * - first week = monthly / 30 x 7
 * - aggregate confidence is the worst confidence of any priced resource
 *
 * CONCURRENCY:
 * Price lookups run on the bounded pricing executor. The whole model shares
 * one timeout; resources still unpriced when it expires contribute zero and
 * the result is flagged {@code analysis_timeout}. Lookups that have not started
 * by then are skipped.
 */
@Service
@Slf4j
public class CostSimulationService {

    static final double HOURS_PER_MONTH = 730;
    static final double DAYS_PER_MONTH = 30;
    static final double DAYS_PER_WEEK = 7;

    static final String NOTE_TIMED_OUT = "pricing timed out";
    static final String NOTE_USAGE_BASED = "usage-based charges not estimated";
    static final String NOTE_DEFAULT_PRICE = "no list price found, default estimate used";

    private final PricingResolver pricingResolver;
    private final PricingSkuMapper skuMapper;
    private final Executor pricingExecutor;
    private final SimulationProperties properties;

    public CostSimulationService(
            PricingResolver pricingResolver,
            PricingSkuMapper skuMapper,
            @Qualifier("pricingExecutor") Executor pricingExecutor,
            SimulationProperties properties
    ) {
        this.pricingResolver = pricingResolver;
        this.skuMapper = skuMapper;
        this.pricingExecutor = pricingExecutor;
        this.properties = properties;
    }

    public SimulationResult simulate(CanonicalResourceModel model) {
        return simulate(model, null);
    }

    /**
     * Simulate the model's cost, flagging {@code over_budget} when the monthly
     * estimate exceeds the given budget.
     *
     * @param monthlyBudget monthly budget in USD, or null for no budget check
     * @throws AnalysisTimeoutException if the timeout expired before any resource was priced
     */
    public SimulationResult simulate(CanonicalResourceModel model, Double monthlyBudget) {
        long started = System.nanoTime();
        if (model.isEmpty()) {
            return SimulationResult.empty(elapsedMs(started));
        }

        List<CanonicalResource> resources = model.getResources();
        List<CompletableFuture<PriceQuote>> quotes = new ArrayList<>(resources.size());
        AtomicBoolean cancelled = new AtomicBoolean();
        for (CanonicalResource resource : resources) {
            String sku = skuMapper.toSku(resource);
            quotes.add(CompletableFuture.supplyAsync(() -> {
                if (cancelled.get()) {
                    throw new CancellationException("Simulation timed out before pricing " + resource.getId());
                }
                return pricingResolver.resolve(resource.getCloud(), sku, resource.getRegion());
            }, pricingExecutor));
        }

        boolean timedOut = awaitAll(quotes, properties.getTimeout());
        if (timedOut) {
            // lookups still queued on the executor must not reach the pricing APIs
            cancelled.set(true);
        }

        List<CostBreakdownEntry> breakdown = new ArrayList<>(resources.size());
        int priced = 0;
        for (int i = 0; i < resources.size(); i++) {
            CanonicalResource resource = resources.get(i);
            CompletableFuture<PriceQuote> quote = quotes.get(i);
            if (quote.isDone() && !quote.isCompletedExceptionally()) {
                breakdown.add(priceEntry(resource, quote.join()));
                priced++;
            } else {
                quote.cancel(true);
                breakdown.add(timedOutEntry(resource));
            }
        }

        if (timedOut && priced == 0) {
            throw new AnalysisTimeoutException(properties.getTimeout(), resources.size());
        }

        double monthly = breakdown.stream().mapToDouble(CostBreakdownEntry::monthlyCost).sum();
        double firstWeek = monthly / DAYS_PER_MONTH * DAYS_PER_WEEK;
        PricingConfidence confidence = PricingConfidence.worstOf(
                breakdown.stream().map(CostBreakdownEntry::confidence).toList());

        List<String> riskFlags = new ArrayList<>();
        if (monthlyBudget != null && monthly > monthlyBudget) {
            riskFlags.add(SimulationResult.OVER_BUDGET);
        }
        if (timedOut) {
            riskFlags.add(SimulationResult.ANALYSIS_TIMEOUT);
            log.warn("Cost simulation timed out, {} of {} resources priced", priced, resources.size());
        }

        long duration = elapsedMs(started);
        log.info("Simulated {} resources: ${}/month, confidence {} in {} ms",
                resources.size(), String.format("%.2f", monthly), confidence.getValue(), duration);
        return new SimulationResult(monthly, firstWeek, breakdown, riskFlags, confidence, duration);
    }

    /**
     * @return true if the timeout expired before every lookup completed
     */
    private boolean awaitAll(List<CompletableFuture<PriceQuote>> quotes, Duration timeout) {
        try {
            CompletableFuture.allOf(quotes.toArray(new CompletableFuture[0]))
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return false;
        } catch (TimeoutException e) {
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new IllegalStateException("Price lookup failed", e.getCause());
        }
    }

    private CostBreakdownEntry priceEntry(CanonicalResource resource, PriceQuote quote) {
        double monthly = quote.hourlyPrice() * resource.getCount() * HOURS_PER_MONTH;
        List<String> notes = new ArrayList<>();
        if (quote.source() == PriceSourceType.DEFAULT) {
            notes.add(NOTE_DEFAULT_PRICE);
        } else if (quote.hourlyPrice() == 0) {
            notes.add(NOTE_USAGE_BASED);
        }
        log.debug("Priced {} ({} x{}) at {}/h from {}",
                resource.getId(), quote.sku(), resource.getCount(), quote.hourlyPrice(), quote.source().getValue());
        return new CostBreakdownEntry(
                resource.getId(),
                resource.getType(),
                resource.getName(),
                resource.getSize(),
                resource.getRegion(),
                resource.getCount(),
                quote.sku(),
                quote.hourlyPrice(),
                monthly,
                quote.confidence(),
                quote.source(),
                notes
        );
    }

    private CostBreakdownEntry timedOutEntry(CanonicalResource resource) {
        return new CostBreakdownEntry(
                resource.getId(),
                resource.getType(),
                resource.getName(),
                resource.getSize(),
                resource.getRegion(),
                resource.getCount(),
                skuMapper.toSku(resource),
                0,
                0,
                PricingConfidence.LOW,
                PriceSourceType.DEFAULT,
                List.of(NOTE_TIMED_OUT)
        );
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
