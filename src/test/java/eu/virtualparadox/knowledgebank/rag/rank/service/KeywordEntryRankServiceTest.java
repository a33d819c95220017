package eu.virtualparadox.knowledgebank.rag.rank.service;

import eu.virtualparadox.knowledgebank.KnowledgeBankFixtures;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.entry;
import static eu.virtualparadox.knowledgebank.KnowledgeBankFixtures.text;
import static org.assertj.core.api.Assertions.assertThat;

class KeywordEntryRankServiceTest {

    private final KeywordEntryRankService rankService = KnowledgeBankFixtures.entryRankService();

    @Test
    @DisplayName("Null and empty input yield an empty list")
    void emptyInput() {
        assertThat(rankService.rankEntries(null, "query")).isEmpty();
        assertThat(rankService.rankEntries(List.of(), "query")).isEmpty();
    }

    @Test
    @DisplayName("Without meaningful keywords the input order is kept")
    void noKeywords() {
        List<KnowledgeEntry> entries = List.of(text("a", "Alpha", "x"), text("b", "Beta", "y"), text("c", "Gamma", "z"));

        assertThat(rankService.rankEntries(entries, null)).containsExactlyElementsOf(entries);
        assertThat(rankService.rankEntries(entries, "  ")).containsExactlyElementsOf(entries);
        assertThat(rankService.rankEntries(entries, "an AI is ok")).containsExactlyElementsOf(entries);
    }

    @Test
    @DisplayName("Relevant entry is ranked first")
    void relevantFirst() {
        KnowledgeEntry cooking = text("1", "Cooking Recipes", "Bake bread at 220 degrees.");
        KnowledgeEntry ml = text("2", "Machine Learning", "Neural networks learn classification boundaries.");

        List<KnowledgeEntry> ranked = rankService.rankEntries(List.of(cooking, ml), "neural network classification");

        assertThat(ranked).containsExactly(ml, cooking);
    }

    @Test
    @DisplayName("Compound query terms match the same compound in an entry")
    void compoundTerms() {
        KnowledgeEntry generic = text("1", "Roadmap", "Quarterly roadmap for the sales team.");
        KnowledgeEntry aiml = text("2", "Platform Plans", "Our AI/ML platform investments.");

        assertThat(rankService.rankEntries(List.of(generic, aiml), "AI/ML")).containsExactly(aiml, generic);
    }

    @Test
    @DisplayName("Title match outweighs a content match")
    void titleOutweighsContent() {
        KnowledgeEntry inContent = text("1", "Notes", "security guidelines");
        KnowledgeEntry inTitle = text("2", "Security", "guidelines");

        assertThat(rankService.rankEntries(List.of(inContent, inTitle), "security")).containsExactly(inTitle, inContent);
    }

    @Test
    @DisplayName("Tags count towards relevance")
    void tags() {
        KnowledgeEntry untagged = text("1", "Notes", "general text");
        KnowledgeEntry tagged = entry("2", "Other", "general text").tag("compliance").build();

        assertThat(rankService.rankEntries(List.of(untagged, tagged), "compliance")).first().isSameAs(tagged);
    }

    @Test
    @DisplayName("Equal scores keep the input order")
    void stableTies() {
        KnowledgeEntry a = text("1", "Alpha", "nothing relevant");
        KnowledgeEntry b = text("2", "Beta", "nothing relevant");
        KnowledgeEntry c = text("3", "Gamma", "nothing relevant");

        assertThat(rankService.rankEntries(List.of(a, b, c), "security")).containsExactly(a, b, c);
    }

    @Test
    @DisplayName("Input list is not modified")
    void inputUntouched() {
        List<KnowledgeEntry> entries = new ArrayList<>(List.of(text("1", "Cooking", "food"), text("2", "Security", "audit")));
        List<KnowledgeEntry> copy = List.copyOf(entries);

        rankService.rankEntries(entries, "security");

        assertThat(entries).containsExactlyElementsOf(copy);
    }
}
