package nl.bytesoflife.heaterrisk.quote;

import nl.bytesoflife.heaterrisk.issue.InfrastructureIssue;
import nl.bytesoflife.heaterrisk.issue.IssueDetector;
import nl.bytesoflife.heaterrisk.model.CostRange;
import nl.bytesoflife.heaterrisk.model.InspectionRecord;
import nl.bytesoflife.heaterrisk.model.QualityTier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Prices a replacement at every quality tier at once. Each tier asks the provider for a quote at
 * that tier's warranty and adds the infrastructure fixes the tier includes. One tier failing
 * never blocks or fails the others.
 * <p>
 * Starting a new bundle cancels the previous one, so results of an outdated request are never
 * published.
 *
 * <pre>
 * try (TieredQuoteBundler bundler = new TieredQuoteBundler().withContractorId("acme-plumbing")) {
 *     QuoteBatch batch = bundler.bundle(record, issues, provider);
 *     Map&lt;QualityTier, TierResult&gt; results = batch.await(Duration.ofSeconds(10));
 * }
 * </pre>
 */
public class TieredQuoteBundler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TieredQuoteBundler.class);

    static final int DEFAULT_THREADS = 4;
    static final String DEFAULT_CONTRACTOR = "default";

    private final AtomicLong generations = new AtomicLong();
    private ExecutorService executor;
    private boolean ownsExecutor;
    private boolean closed;
    private String contractorId = DEFAULT_CONTRACTOR;
    private InstallComplexity complexity = InstallComplexity.STANDARD;
    private List<QualityTier> tiers = List.of(QualityTier.values());
    private QuoteBatch current;

    /**
     * Runs quote calls on the given executor. The bundler does not shut it down.
     */
    public TieredQuoteBundler withExecutor(ExecutorService executor) {
        this.executor = executor;
        this.ownsExecutor = false;
        return this;
    }

    public TieredQuoteBundler withContractorId(String contractorId) {
        if (contractorId == null || contractorId.isBlank()) {
            throw new IllegalArgumentException("Contractor id must not be blank");
        }
        this.contractorId = contractorId;
        return this;
    }

    public TieredQuoteBundler withComplexity(InstallComplexity complexity) {
        this.complexity = complexity;
        return this;
    }

    public TieredQuoteBundler withTiers(List<QualityTier> tiers) {
        if (tiers.isEmpty()) {
            throw new IllegalArgumentException("At least one tier must be quoted");
        }
        this.tiers = List.copyOf(EnumSet.copyOf(tiers));
        return this;
    }

    /**
     * Starts quoting every configured tier and cancels the previous batch.
     *
     * @param record   the unit being replaced
     * @param issues   infrastructure issues found on the unit
     * @param provider source of unit and installation prices
     * @return the new batch, with every tier initially loading
     */
    public synchronized QuoteBatch bundle(InspectionRecord record, List<InfrastructureIssue> issues,
                                          QuoteProvider provider) {
        if (closed) {
            throw new IllegalStateException("Quote bundler is closed");
        }
        if (current != null) {
            current.cancel();
        }

        ExecutorService pool = executor();
        List<InfrastructureIssue> found = List.copyOf(issues);
        TierLadder ladder = BuiltinTierLadders.forFamily(record.getUnitFamily());
        long generation = generations.incrementAndGet();

        QuoteBatch batch = new QuoteBatch(generation, tiers, tier -> CompletableFuture.supplyAsync(
                () -> priceTier(generation, tier, ladder, record, found, provider), pool));
        current = batch;
        log.debug("Starting quote batch {} for {} tiers of {}", generation, tiers.size(), record.getUnitType());
        batch.start();
        return batch;
    }

    /**
     * Prices one tier. Any failure is caught and reported for that tier alone.
     */
    TierResult priceTier(long generation, QualityTier tier, TierLadder ladder, InspectionRecord record,
                         List<InfrastructureIssue> issues, QuoteProvider provider) {
        try {
            TierProfile profile = ladder.getTier(tier);
            TotalQuote quote = provider.generateQuote(
                    record.withWarrantyYears(profile.warrantyYears()), contractorId, complexity);

            List<InfrastructureIssue> included = IssueDetector.forTier(issues, tier);
            CostRange issuesCost = IssueDetector.totalCost(included);
            PriceRange base = quote.range();
            log.debug("Tier {} in batch {} priced at {} with {} bundled issues",
                    tier.label(), generation, base, included.size());

            return new TierResult.Priced(new TierQuote(tier, profile.label(), profile.warrantyYears(),
                    base, included, issuesCost, base.plus(issuesCost)));
        } catch (Exception e) {
            log.warn("Quote for tier {} in batch {} failed: {}", tier.label(), generation, e.getMessage());
            log.debug("Quote failure detail", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return new TierResult.Failed(tier, message);
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        if (current != null) {
            current.cancel();
        }
        if (ownsExecutor && executor != null) {
            executor.shutdownNow();
        }
    }

    private ExecutorService executor() {
        if (executor == null) {
            AtomicInteger counter = new AtomicInteger();
            executor = Executors.newFixedThreadPool(DEFAULT_THREADS, r -> {
                Thread thread = new Thread(r, "tier-quote-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
            ownsExecutor = true;
        }
        return executor;
    }
}
