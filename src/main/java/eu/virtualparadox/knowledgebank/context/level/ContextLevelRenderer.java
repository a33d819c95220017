package eu.virtualparadox.knowledgebank.context.level;

import eu.virtualparadox.knowledgebank.context.BudgetedTextBuilder;
import eu.virtualparadox.knowledgebank.context.ContextMarkers;
import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGroup;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the four detail levels of the document part of the knowledge context.
 *
 * <h2>Levels</h2>
 * <ol>
 *   <li><b>Catalog</b>: one line per document, {@code - Title (N sections)}.</li>
 *   <li><b>Document summaries</b>: the parent's summary, unless it is missing or still pending.</li>
 *   <li><b>Chapter summaries</b>: summaries of the child chunks.</li>
 *   <li><b>Raw content</b>: full chunk text, parent first.</li>
 * </ol>
 *
 * <h2>Budget</h2>
 * Every method receives the budget of its whole section, header included, and returns
 * either an empty string or a section no longer than that budget. Blocks are taken
 * in the order of the given groups; the first block that does not fit ends the section.
 */
@Component
public class ContextLevelRenderer {

    private final int catalogMinDocuments;

    /**
     * @param catalogMinDocuments minimum number of document groups for the catalog to be rendered
     * @throws IllegalArgumentException if the minimum is below 1
     */
    public ContextLevelRenderer(@Value("${knowledgebank.context.catalog-min-documents:1}") final int catalogMinDocuments) {
        if (catalogMinDocuments < 1) {
            throw new IllegalArgumentException("catalogMinDocuments must be at least 1");
        }
        this.catalogMinDocuments = catalogMinDocuments;
    }

    public String buildCatalog(final List<DocumentGroup> groups, final int budget) {
        if (groups.size() < catalogMinDocuments) {
            return "";
        }
        final List<String> lines = new ArrayList<>(groups.size());
        for (final DocumentGroup group : groups) {
            lines.add("- " + group.displayTitle() + " (" + group.totalParts() + " sections)");
        }
        return section(ContextMarkers.CATALOG_HEADER, lines, ContextMarkers.LINE_SEPARATOR, budget);
    }

    public String buildDocSummaries(final List<DocumentGroup> groups, final int budget) {
        final List<String> blocks = new ArrayList<>();
        for (final DocumentGroup group : groups) {
            final KnowledgeEntry parent = group.parent();
            if (parent.isDocumentSummaryPending()) {
                continue;
            }
            parent.summaryIfPresent()
                    .ifPresent(summary -> blocks.add(ContextMarkers.titledBlock(group.displayTitle(), summary)));
        }
        return section(ContextMarkers.DOC_SUMMARIES_HEADER, blocks, ContextMarkers.BLOCK_SEPARATOR, budget);
    }

    public String buildChapterSummaries(final List<DocumentGroup> groups, final int budget) {
        final List<String> blocks = new ArrayList<>();
        for (final DocumentGroup group : groups) {
            for (final KnowledgeEntry child : group.children()) {
                child.summaryIfPresent()
                        .ifPresent(summary -> blocks.add(ContextMarkers.titledBlock(child.getTitle(), summary)));
            }
        }
        return section(ContextMarkers.CHAPTER_SUMMARIES_HEADER, blocks, ContextMarkers.BLOCK_SEPARATOR, budget);
    }

    public String buildRawContent(final List<DocumentGroup> groups, final int budget) {
        final List<String> blocks = new ArrayList<>();
        for (final DocumentGroup group : groups) {
            for (final KnowledgeEntry part : group.parts()) {
                if (StringUtils.isNotBlank(part.getContent())) {
                    blocks.add(ContextMarkers.titledBlock(part.getTitle(), part.getContent()));
                }
            }
        }
        return section(ContextMarkers.RAW_CONTENT_HEADER, blocks, ContextMarkers.BLOCK_SEPARATOR, budget);
    }

    private static String section(final String header,
                                  final List<String> blocks,
                                  final String separator,
                                  final int budget) {
        final int bodyBudget = budget - header.length() - 1;
        if (bodyBudget <= 0 || blocks.isEmpty()) {
            return "";
        }
        final BudgetedTextBuilder body = new BudgetedTextBuilder(bodyBudget, separator);
        for (final String block : blocks) {
            if (!body.tryAppend(block)) {
                break;
            }
        }
        return body.isEmpty() ? "" : header + "\n" + body.build();
    }
}
