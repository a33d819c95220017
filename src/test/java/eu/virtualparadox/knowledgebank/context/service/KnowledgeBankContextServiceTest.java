package eu.virtualparadox.knowledgebank.context.service;

import eu.virtualparadox.knowledgebank.KnowledgeBankFixtures;
import eu.virtualparadox.knowledgebank.context.budget.EGenerationType;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.child;
import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.entry;
import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.parent;
import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

class KnowledgeBankContextServiceTest {

    private final KnowledgeBankContextService service =
            new KnowledgeBankContextService(KnowledgeBankFixtures.contextBuilder());

    @Test
    @DisplayName("Disabled entries are left out")
    void disabledFiltered() {
        List<KnowledgeEntry> entries = List.of(
                text("1", "Visible", "shown"),
                entry("2", "Hidden", "not shown").enabled(false).build());

        String result = service.assembleContext(entries, null, (EGenerationType) null);

        assertThat(result).contains("[Knowledge: Visible]").doesNotContain("Hidden");
    }

    @Test
    @DisplayName("Only disabled entries yield an empty string")
    void allDisabled() {
        List<KnowledgeEntry> entries = List.of(entry("1", "Hidden", "x").enabled(false).build());

        assertThat(service.assembleContext(entries, "x", "single")).isEmpty();
        assertThat(service.assembleContext(null, null, (String) null)).isEmpty();
    }

    @Test
    @DisplayName("Generation type strings select the budget; unknown values use the default")
    void generationTypeString() {
        List<KnowledgeEntry> entries = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            entries.add(text("e" + i, "Entry " + i, "x".repeat(5_000)));
        }

        int single = service.assembleContext(entries, null, "single").length();
        int transform = service.assembleContext(entries, null, "Transform").length();
        int unknown = service.assembleContext(entries, null, "bogus").length();
        int chain = service.assembleContext(entries, null, EGenerationType.CHAIN).length();

        assertThat(single).isGreaterThan(unknown);
        assertThat(unknown).isGreaterThan(chain);
        assertThat(chain).isGreaterThan(transform);
    }

    @Test
    @DisplayName("Documents are counted without their child chunks")
    void countDocuments() {
        List<KnowledgeEntry> entries = Arrays.asList(
                text("s", "Solo", "solo"),
                parent("p1", "Doc", "parent", null),
                child("c1", "p1", 1, "Doc - Part 2", "one", null),
                child("c2", "p1", 2, "Doc - Part 3", "two", null),
                null);

        assertThat(service.countDocuments(entries)).isEqualTo(2);
        assertThat(service.countDocuments(null)).isZero();
    }
}
