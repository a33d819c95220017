package eu.virtualparadox.knowledgebank.rag.score;

import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Term frequency / inverse document frequency arithmetic over tokenized texts.
 * <p>
 * Used to boost entries that match rare query terms: a keyword present in every entry
 * of the working set has an IDF of zero and adds nothing.
 * </p>
 */
@Component
public class TfIdfScorer {

    /**
     * @param tokens document tokens, duplicates preserved
     * @param term   term to count
     * @return occurrences of {@code term} divided by the number of tokens, {@code 0} for no tokens
     */
    public double computeTf(final List<String> tokens, final String term) {
        if (tokens.isEmpty()) {
            return 0;
        }
        int count = 0;
        for (final String token : tokens) {
            if (token.equals(term)) {
                count++;
            }
        }
        return (double) count / tokens.size();
    }

    /**
     * @param totalDocs    corpus size
     * @param docsWithTerm number of documents containing the term
     * @return {@code ln(totalDocs / docsWithTerm)}, or {@code 0} when either count is zero
     */
    public double computeIdf(final int totalDocs, final int docsWithTerm) {
        if (totalDocs == 0 || docsWithTerm == 0) {
            return 0;
        }
        return Math.log((double) totalDocs / docsWithTerm);
    }

    /**
     * Computes the IDF of every term present in the corpus.
     *
     * @param corpus one token list per document
     * @return term to IDF; empty for an empty corpus
     */
    public Map<String, Double> buildCorpusIdf(final List<List<String>> corpus) {
        final Map<String, Integer> documentFrequency = new HashMap<>();
        for (final List<String> document : corpus) {
            for (final String term : new HashSet<>(document)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        final Map<String, Double> idf = new HashMap<>(documentFrequency.size());
        documentFrequency.forEach((term, df) -> idf.put(term, computeIdf(corpus.size(), df)));
        return idf;
    }

    /**
     * Sums {@code tf * idf} of every query term for one document.
     *
     * @param documentTokens tokens of the document, duplicates preserved
     * @param queryTokens    distinct query keywords
     * @param idf            corpus IDF map
     * @return non-negative score, {@code 0} when nothing matches
     */
    public double tfidfScore(final List<String> documentTokens,
                             final Collection<String> queryTokens,
                             final Map<String, Double> idf) {
        if (documentTokens.isEmpty() || queryTokens.isEmpty()) {
            return 0;
        }
        double score = 0;
        for (final String term : queryTokens) {
            final double termIdf = idf.getOrDefault(term, 0.0);
            if (termIdf > 0) {
                score += computeTf(documentTokens, term) * termIdf;
            }
        }
        return score;
    }
}
