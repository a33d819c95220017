package eu.virtualparadox.knowledgebank.rag.rank.service;

import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import eu.virtualparadox.knowledgebank.rag.analysis.KeywordTokenizer;
import eu.virtualparadox.knowledgebank.rag.rank.model.RankedCandidate;
import eu.virtualparadox.knowledgebank.rag.score.KeywordScorer;
import eu.virtualparadox.knowledgebank.rag.score.ScoringCandidate;
import eu.virtualparadox.knowledgebank.rag.score.TfIdfScorer;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Lexical entry ranker: field-weighted keyword score plus a TF-IDF rare-term boost.
 * <p>
 * Steps:
 * <ol>
 *   <li>Extract distinct keywords from the query.</li>
 *   <li>Tokenize every entry (title, content, summary, tags) into a corpus and compute IDF.</li>
 *   <li>Score each entry with {@link KeywordScorer} plus {@link TfIdfScorer#tfidfScore}.</li>
 *   <li>Stable sort by descending score.</li>
 * </ol>
 */
@Service
@RequiredArgsConstructor
public class KeywordEntryRankService implements EntryRankService {

    private final KeywordTokenizer tokenizer;
    private final KeywordScorer keywordScorer;
    private final TfIdfScorer tfIdfScorer;

    @Override
    public List<KnowledgeEntry> rankEntries(final List<KnowledgeEntry> entries, final String query) {
        if (entries == null || entries.isEmpty()) {
            return new ArrayList<>();
        }

        final List<String> keywords = tokenizer.tokenize(query);
        if (keywords.isEmpty()) {
            return new ArrayList<>(entries);
        }

        final List<ScoringCandidate> candidates = entries.stream().map(ScoringCandidate::from).toList();
        final List<List<String>> corpus = candidates.stream()
                .map(c -> tokenizer.tokenizeRaw(c.fullText()))
                .toList();
        final Map<String, Double> idf = tfIdfScorer.buildCorpusIdf(corpus);

        final List<RankedCandidate<KnowledgeEntry>> ranked = new ArrayList<>(entries.size());
        for (int i = 0; i < entries.size(); i++) {
            final double score = keywordScorer.score(candidates.get(i), keywords)
                    + tfIdfScorer.tfidfScore(corpus.get(i), keywords, idf);
            ranked.add(new RankedCandidate<>(entries.get(i), i, score));
        }

        ranked.sort(RankedCandidate.byScoreDescending());
        final List<KnowledgeEntry> result = new ArrayList<>(ranked.size());
        for (final RankedCandidate<KnowledgeEntry> candidate : ranked) {
            result.add(candidate.item());
        }
        return result;
    }
}
