package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.model.QualityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;

/**
 * One round of tier quotes. Tiers resolve independently; a cancelled batch never publishes
 * the results of calls still in flight.
 */
public class QuoteBatch {

    private static final Logger log = LoggerFactory.getLogger(QuoteBatch.class);

    static final String CANCELLED_MESSAGE = "Superseded by a newer quote request";

    private final long generation;
    private final List<QualityTier> tiers;
    private final Function<QualityTier, CompletableFuture<TierResult>> launcher;
    private final Map<QualityTier, CompletableFuture<TierResult>> futures = new ConcurrentHashMap<>();
    private volatile boolean cancelled;

    QuoteBatch(long generation, List<QualityTier> tiers, Function<QualityTier, CompletableFuture<TierResult>> launcher) {
        this.generation = generation;
        this.tiers = List.copyOf(tiers);
        this.launcher = launcher;
    }

    synchronized void start() {
        for (QualityTier tier : tiers) {
            futures.put(tier, launcher.apply(tier));
        }
    }

    public long getGeneration() {
        return generation;
    }

    public List<QualityTier> getTiers() {
        return tiers;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Current state of every tier without waiting.
     */
    public Map<QualityTier, TierResult> snapshot() {
        Map<QualityTier, TierResult> results = new EnumMap<>(QualityTier.class);
        for (QualityTier tier : tiers) {
            results.put(tier, resultOf(tier));
        }
        return results;
    }

    public TierResult get(QualityTier tier) {
        if (!futures.containsKey(tier)) {
            throw new IllegalArgumentException("Tier " + tier + " is not part of this batch");
        }
        return resultOf(tier);
    }

    public boolean isDone() {
        return futures.values().stream().allMatch(CompletableFuture::isDone);
    }

    /**
     * Waits until every tier has resolved or the timeout passes, then returns the snapshot.
     * Tiers still running at the timeout are reported as loading.
     */
    public Map<QualityTier, TierResult> await(Duration timeout) throws InterruptedException {
        CompletableFuture<?>[] pending = futures.values().toArray(new CompletableFuture<?>[0]);
        try {
            CompletableFuture.allOf(pending).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug("Quote batch {} still has tiers loading after {}", generation, timeout);
        } catch (ExecutionException | CancellationException e) {
            log.debug("Quote batch {} ended early: {}", generation, e.toString());
        }
        return snapshot();
    }

    /**
     * Requests the tier again, replacing whatever result it had. Holds the batch lock so a
     * concurrent {@link #cancel()} either sees the new call or prevents it.
     */
    public synchronized void retry(QualityTier tier) {
        if (cancelled) {
            throw new IllegalStateException("Quote batch " + generation + " was cancelled");
        }
        CompletableFuture<TierResult> previous = futures.get(tier);
        if (previous == null) {
            throw new IllegalArgumentException("Tier " + tier + " is not part of this batch");
        }
        log.debug("Retrying tier {} in quote batch {}", tier, generation);
        previous.cancel(false);
        futures.put(tier, launcher.apply(tier));
    }

    public synchronized void cancel() {
        if (cancelled) return;
        cancelled = true;
        for (CompletableFuture<TierResult> future : futures.values()) {
            future.cancel(false);
        }
        log.debug("Quote batch {} cancelled", generation);
    }

    private TierResult resultOf(QualityTier tier) {
        CompletableFuture<TierResult> future = futures.get(tier);
        if (future == null || !future.isDone()) {
            return new TierResult.Loading(tier);
        }
        if (future.isCancelled()) {
            return new TierResult.Failed(tier, CANCELLED_MESSAGE);
        }
        return future.join();
    }
}
