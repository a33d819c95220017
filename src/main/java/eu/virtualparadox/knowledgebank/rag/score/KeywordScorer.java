package eu.virtualparadox.knowledgebank.rag.score;

import eu.virtualparadox.knowledgebank.rag.analysis.KeywordTokenizer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Field-weighted keyword match score.
 * <p>
 * Each keyword contributes once per field it occurs in as a whole word:
 * title {@value #TITLE_WEIGHT}, tags {@value #TAG_WEIGHT}, content and summary
 * {@value #BODY_WEIGHT} each.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class KeywordScorer {

    static final int TITLE_WEIGHT = 3;
    static final int TAG_WEIGHT = 2;
    static final int BODY_WEIGHT = 1;

    private final KeywordTokenizer tokenizer;

    /**
     * Scores a candidate against keywords.
     *
     * @param candidate fields to match
     * @param keywords  distinct query keywords
     * @return weighted match count, {@code 0} when {@code keywords} is empty
     */
    public double score(final ScoringCandidate candidate, final Collection<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }

        final Set<String> titleTokens = tokens(candidate.title());
        final Set<String> contentTokens = tokens(candidate.content());
        final Set<String> summaryTokens = tokens(candidate.summary());
        final Set<String> tagTokens = candidate.tags().isEmpty()
                ? Set.of()
                : tokens(String.join(" ", candidate.tags()));

        double score = 0;
        for (final String keyword : keywords) {
            if (titleTokens.contains(keyword)) score += TITLE_WEIGHT;
            if (tagTokens.contains(keyword)) score += TAG_WEIGHT;
            if (contentTokens.contains(keyword)) score += BODY_WEIGHT;
            if (summaryTokens.contains(keyword)) score += BODY_WEIGHT;
        }
        return score;
    }

    /**
     * Number of keywords present in {@code text}, unweighted.
     */
    public int countMatches(final String text, final Collection<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }
        final Set<String> textTokens = tokens(text);
        int matches = 0;
        for (final String keyword : keywords) {
            if (textTokens.contains(keyword)) {
                matches++;
            }
        }
        return matches;
    }

    private Set<String> tokens(final String text) {
        return new HashSet<>(tokenizer.tokenizeRaw(text));
    }
}
