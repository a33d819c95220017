package eu.virtualparadox.knowledgebank.context;

import eu.virtualparadox.knowledgebank.context.budget.BudgetAllocationPolicy;
import eu.virtualparadox.knowledgebank.context.budget.BudgetTier;
import eu.virtualparadox.knowledgebank.context.budget.ContextBudgeter;
import eu.virtualparadox.knowledgebank.context.budget.EGenerationType;
import eu.virtualparadox.knowledgebank.context.budget.LevelShares;
import eu.virtualparadox.knowledgebank.context.level.ContextLevelRenderer;
import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGroup;
import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGrouper;
import eu.virtualparadox.knowledgebank.entry.grouping.GroupedEntries;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import eu.virtualparadox.knowledgebank.rag.rank.service.DocumentRankService;
import eu.virtualparadox.knowledgebank.rag.rank.service.EntryRankService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Assembles the knowledge context injected into an LLM prompt.
 *
 * <h2>Pipeline</h2>
 * <ol>
 *   <li>Pinned entries are kept in input order; unpinned entries are ranked against the query.</li>
 *   <li>The ordered entries are split into standalone entries and document groups.</li>
 *   <li>Standalone entries are rendered first as {@code [Knowledge: title]} blocks, preferring the summary.</li>
 *   <li>Document groups are ranked (pinned groups first) and whatever budget is left is split
 *       across catalog, document summaries, chapter summaries and raw content according to the
 *       {@link BudgetAllocationPolicy} tier for the number of groups.</li>
 *   <li>The result is framed by {@link ContextMarkers#WRAPPER_START} and {@link ContextMarkers#WRAPPER_END}.</li>
 * </ol>
 *
 * <h2>Guarantees</h2>
 * <ul>
 *   <li>Blocks are never truncated; the first block that does not fit ends its section.</li>
 *   <li>The body never exceeds the character budget of the generation type, so the output is at most
 *       the budget plus the two markers and their line breaks.</li>
 *   <li>An empty body yields an empty string, never bare markers.</li>
 *   <li>The builder holds no state between calls and does not throw on missing fields.</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class HierarchicalContextBuilder {

    private final ContextBudgeter budgeter;
    private final BudgetAllocationPolicy allocationPolicy;
    private final DocumentGrouper documentGrouper;
    private final EntryRankService entryRankService;
    private final DocumentRankService documentRankService;
    private final ContextLevelRenderer levelRenderer;

    /**
     * Builds the context with the default budget.
     *
     * @param entries enabled entries of a workspace
     * @param query   current user prompt, may be {@code null}
     * @return wrapped context or empty string
     */
    public String build(final List<KnowledgeEntry> entries, final String query) {
        return build(entries, query, null);
    }

    /**
     * Builds the context.
     *
     * @param entries        enabled entries of a workspace, may be {@code null}
     * @param query          current user prompt, may be {@code null} or blank
     * @param generationType selects the budget, {@code null} for the default
     * @return wrapped context or empty string
     */
    public String build(final List<KnowledgeEntry> entries,
                        final String query,
                        final EGenerationType generationType) {
        if (entries == null || entries.isEmpty()) {
            return "";
        }

        final int budget = budgeter.resolveBudget(generationType);
        final GroupedEntries grouped = documentGrouper.groupEntriesByDocument(orderForContext(entries, query));
        final List<KnowledgeEntry> standalone = pinnedFirst(grouped.standalone(), KnowledgeEntry::isPinned);
        final List<DocumentGroup> documents = pinnedFirst(
                documentRankService.rankDocumentGroups(grouped.documents(), query),
                group -> group.parent().isPinned());

        log.debug("Building knowledge context: {} standalone, {} documents, budget {} chars ({})",
                standalone.size(), documents.size(), budget, generationType);

        final BudgetedTextBuilder body = new BudgetedTextBuilder(budget, ContextMarkers.BLOCK_SEPARATOR);
        final int flatBlocks = appendFlat(body, standalone);
        if (!documents.isEmpty()) {
            appendDocumentLevels(body, documents);
        }

        log.debug("Knowledge context: {} flat blocks, {} of {} chars used", flatBlocks, body.length(), budget);
        return ContextMarkers.wrap(body.build());
    }

    private List<KnowledgeEntry> orderForContext(final List<KnowledgeEntry> entries, final String query) {
        final List<KnowledgeEntry> pinned = new ArrayList<>();
        final List<KnowledgeEntry> unpinned = new ArrayList<>();
        for (final KnowledgeEntry entry : entries) {
            if (entry == null) {
                continue;
            }
            if (entry.isPinned()) {
                pinned.add(entry);
            } else {
                unpinned.add(entry);
            }
        }
        final List<KnowledgeEntry> ordered = new ArrayList<>(pinned);
        ordered.addAll(entryRankService.rankEntries(unpinned, query));
        return ordered;
    }

    private int appendFlat(final BudgetedTextBuilder body, final List<KnowledgeEntry> standalone) {
        int appended = 0;
        for (final KnowledgeEntry entry : standalone) {
            if (!body.tryAppend(ContextMarkers.knowledgeBlock(entry.getTitle(), entry.contextText()))) {
                break;
            }
            appended++;
        }
        return appended;
    }

    private void appendDocumentLevels(final BudgetedTextBuilder body, final List<DocumentGroup> documents) {
        final BudgetTier tier = allocationPolicy.tierFor(documents.size());
        final LevelShares shares = tier.shares();
        final int available = body.remaining();
        log.debug("Document budget {} chars, tier '{}'", available, tier.name());

        appendLevel(body, documents, available, shares.catalog(), levelRenderer::buildCatalog);
        appendLevel(body, documents, available, shares.docSummaries(), levelRenderer::buildDocSummaries);
        appendLevel(body, documents, available, shares.chapterSummaries(), levelRenderer::buildChapterSummaries);
        appendLevel(body, documents, available, shares.rawContent(), levelRenderer::buildRawContent);
    }

    private static void appendLevel(final BudgetedTextBuilder body,
                                    final List<DocumentGroup> documents,
                                    final int available,
                                    final double share,
                                    final BiFunction<List<DocumentGroup>, Integer, String> renderer) {
        // the separator in front of the section is paid from the section's own share
        final int sectionBudget = (int) Math.floor(available * share) - body.separatorCost();
        if (sectionBudget <= 0) {
            return;
        }
        final String section = renderer.apply(documents, sectionBudget);
        if (!section.isEmpty()) {
            body.tryAppend(section);
        }
    }

    private static <T> List<T> pinnedFirst(final List<T> items, final Predicate<T> isPinned) {
        final List<T> result = new ArrayList<>(items.size());
        for (final T item : items) {
            if (isPinned.test(item)) {
                result.add(item);
            }
        }
        for (final T item : items) {
            if (!isPinned.test(item)) {
                result.add(item);
            }
        }
        return result;
    }
}
