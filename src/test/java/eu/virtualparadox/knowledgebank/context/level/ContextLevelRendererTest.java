package eu.virtualparadox.knowledgebank.context.level;

import eu.virtualparadox.knowledgebank.context.ContextMarkers;
import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.child;
import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.parent;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ContextLevelRenderer}.
 */
class ContextLevelRendererTest {

    private static final int LARGE = 10_000;

    private final ContextLevelRenderer renderer = new ContextLevelRenderer(1);

    private static DocumentGroup security() {
        return DocumentGroup.of(
                parent("p1", "Security - Part 1", "parent content about security",
                        "Comprehensive security document covering all protocols"),
                List.of(child("c1", "p1", 1, "Security - Part 2", "physical security measures", "Covers physical security"),
                        child("c2", "p1", 2, "Security - Part 3", "digital security measures", "Covers digital security")));
    }

    private static DocumentGroup pending() {
        return DocumentGroup.of(
                parent("p2", "Onboarding", "welcome text", null),
                List.of(child("c3", "p2", 1, "Onboarding - Part 2", "first week", null)));
    }

    @Test
    @DisplayName("Catalog lists display titles with section counts")
    void catalog() {
        String catalog = renderer.buildCatalog(List.of(security(), pending()), LARGE);

        assertThat(catalog).isEqualTo(ContextMarkers.CATALOG_HEADER + "\n"
                + "- Security (3 sections)\n"
                + "- Onboarding (2 sections)");
    }

    @Test
    @DisplayName("Catalog is omitted below the configured minimum number of documents")
    void catalogMinimum() {
        ContextLevelRenderer strict = new ContextLevelRenderer(2);

        assertThat(strict.buildCatalog(List.of(security()), LARGE)).isEmpty();
        assertThat(strict.buildCatalog(List.of(security(), pending()), LARGE)).contains("DOCUMENT CATALOG");
        assertThatThrownBy(() -> new ContextLevelRenderer(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Document summaries skip pending and missing summaries")
    void docSummaries() {
        String summaries = renderer.buildDocSummaries(List.of(pending(), security()), LARGE);

        assertThat(summaries).isEqualTo(ContextMarkers.DOC_SUMMARIES_HEADER + "\n"
                + "[Security]\nComprehensive security document covering all protocols");
        assertThat(renderer.buildDocSummaries(List.of(pending()), LARGE)).isEmpty();
    }

    @Test
    @DisplayName("Chapter summaries come from child chunks")
    void chapterSummaries() {
        String chapters = renderer.buildChapterSummaries(List.of(security()), LARGE);

        assertThat(chapters)
                .startsWith(ContextMarkers.CHAPTER_SUMMARIES_HEADER)
                .contains("[Security - Part 2]\nCovers physical security\n\n[Security - Part 3]\nCovers digital security")
                .doesNotContain("Comprehensive");
    }

    @Test
    @DisplayName("Raw content holds parent and children in order")
    void rawContent() {
        String raw = renderer.buildRawContent(List.of(security()), LARGE);

        assertThat(raw).startsWith(ContextMarkers.RAW_CONTENT_HEADER + "\n[Security - Part 1]\nparent content about security");
        assertThat(raw.indexOf("physical security measures")).isLessThan(raw.indexOf("digital security measures"));
    }

    @Test
    @DisplayName("Rendering stops at the first block that does not fit")
    void stopsAtFirstMiss() {
        DocumentGroup group = DocumentGroup.of(
                parent("p", "A", "x".repeat(10), null),
                List.of(child("c1", "p", 1, "B", "y".repeat(30), null),
                        child("c2", "p", 2, "C", "z", null)));
        int header = ContextMarkers.RAW_CONTENT_HEADER.length() + 1;
        // room for the first block and the small third one, not for the second
        int budget = header + 14 + 2 + 5;

        String raw = renderer.buildRawContent(List.of(group), budget);

        assertThat(raw).isEqualTo(ContextMarkers.RAW_CONTENT_HEADER + "\n[A]\n" + "x".repeat(10));
    }

    @Test
    @DisplayName("Sections never exceed their budget and are empty when nothing fits")
    void budgetRespected() {
        List<DocumentGroup> groups = List.of(security(), pending());
        for (int budget = 0; budget < 400; budget += 7) {
            assertThat(renderer.buildCatalog(groups, budget).length()).isLessThanOrEqualTo(budget);
            assertThat(renderer.buildDocSummaries(groups, budget).length()).isLessThanOrEqualTo(budget);
            assertThat(renderer.buildChapterSummaries(groups, budget).length()).isLessThanOrEqualTo(budget);
            assertThat(renderer.buildRawContent(groups, budget).length()).isLessThanOrEqualTo(budget);
        }
        assertThat(renderer.buildCatalog(groups, ContextMarkers.CATALOG_HEADER.length() + 1)).isEmpty();
    }
}
