package eu.virtualparadox.knowledgebank.context.budget;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Step-function {@link BudgetAllocationPolicy}: the first tier (by ascending
 * {@code maxDocuments}) that admits the document count wins; counts above every tier
 * use the last one.
 *
 * <p>Stock tiers:</p>
 * <pre>
 *   deep      ≤ 2 docs   catalog .02  summaries .15  chapters .33  raw .50
 *   balanced  ≤ 5 docs   catalog .05  summaries .25  chapters .35  raw .35
 *   broad     &gt; 5 docs   catalog .08  summaries .35  chapters .35  raw .22
 * </pre>
 */
public class TieredBudgetAllocationPolicy implements BudgetAllocationPolicy {

    private final List<BudgetTier> tiers;

    /**
     * @param tiers at least one tier
     * @throws IllegalArgumentException if {@code tiers} is empty
     */
    public TieredBudgetAllocationPolicy(final List<BudgetTier> tiers) {
        if (tiers == null || tiers.isEmpty()) {
            throw new IllegalArgumentException("at least one budget tier is required");
        }
        final List<BudgetTier> sorted = new ArrayList<>(tiers);
        sorted.sort(Comparator.comparingInt(BudgetTier::maxDocuments));
        this.tiers = List.copyOf(sorted);
    }

    public static TieredBudgetAllocationPolicy withDefaults() {
        return new TieredBudgetAllocationPolicy(defaultTiers());
    }

    public static List<BudgetTier> defaultTiers() {
        return List.of(
                new BudgetTier("deep", 2, new LevelShares(0.02, 0.15, 0.33, 0.50)),
                new BudgetTier("balanced", 5, new LevelShares(0.05, 0.25, 0.35, 0.35)),
                new BudgetTier("broad", Integer.MAX_VALUE, new LevelShares(0.08, 0.35, 0.35, 0.22)));
    }

    @Override
    public BudgetTier tierFor(final int documentCount) {
        for (final BudgetTier tier : tiers) {
            if (documentCount <= tier.maxDocuments()) {
                return tier;
            }
        }
        return tiers.get(tiers.size() - 1);
    }
}
