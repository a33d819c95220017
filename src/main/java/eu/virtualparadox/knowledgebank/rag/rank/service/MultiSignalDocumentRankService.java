package eu.virtualparadox.knowledgebank.rag.rank.service;

import eu.virtualparadox.knowledgebank.entry.grouping.DocumentGroup;
import eu.virtualparadox.knowledgebank.entry.model.KnowledgeEntry;
import eu.virtualparadox.knowledgebank.rag.analysis.KeywordTokenizer;
import eu.virtualparadox.knowledgebank.rag.rank.model.RankedCandidate;
import eu.virtualparadox.knowledgebank.rag.score.KeywordScorer;
import eu.virtualparadox.knowledgebank.rag.score.ScoringCandidate;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Document-level ranker blending four signals:
 * <pre>
 *   score = title * 3 + documentSummary * 2 + bestChunk * 1 + averageOfTop3Chunks * 0.5
 * </pre>
 * <ul>
 *   <li><strong>title</strong>: keywords present in the parent's display title.</li>
 *   <li><strong>documentSummary</strong>: keywords present in the parent's summary (0 when absent).</li>
 *   <li><strong>bestChunk</strong>: highest {@link KeywordScorer} score among parent and children.</li>
 *   <li><strong>averageOfTop3Chunks</strong>: mean of the (up to) three best chunk scores.</li>
 * </ul>
 * A matching title usually wins, yet one highly relevant chunk keeps a generically titled
 * document discoverable.
 */
@Service
@RequiredArgsConstructor
public class MultiSignalDocumentRankService implements DocumentRankService {

    static final double TITLE_WEIGHT = 3;
    static final double SUMMARY_WEIGHT = 2;
    static final double BEST_CHUNK_WEIGHT = 1;
    static final double TOP_CHUNKS_WEIGHT = 0.5;
    static final int TOP_CHUNKS = 3;

    private final KeywordTokenizer tokenizer;
    private final KeywordScorer keywordScorer;

    @Override
    public double scoreDocumentGroup(final DocumentGroup group, final Collection<String> keywords) {
        if (keywords.isEmpty()) {
            return 0;
        }

        final KnowledgeEntry parent = group.parent();
        final double titleScore = keywordScorer.countMatches(group.displayTitle(), keywords);
        final double summaryScore = parent.summaryIfPresent()
                .map(summary -> (double) keywordScorer.countMatches(summary, keywords))
                .orElse(0.0);

        final List<Double> chunkScores = new ArrayList<>(group.totalParts());
        for (final KnowledgeEntry part : group.parts()) {
            chunkScores.add(keywordScorer.score(ScoringCandidate.from(part), keywords));
        }
        chunkScores.sort(Comparator.reverseOrder());

        final double bestChunk = chunkScores.get(0);
        final List<Double> top = chunkScores.subList(0, Math.min(TOP_CHUNKS, chunkScores.size()));
        final double topAverage = top.stream().mapToDouble(Double::doubleValue).average().orElse(0);

        return titleScore * TITLE_WEIGHT
                + summaryScore * SUMMARY_WEIGHT
                + bestChunk * BEST_CHUNK_WEIGHT
                + topAverage * TOP_CHUNKS_WEIGHT;
    }

    @Override
    public List<DocumentGroup> rankDocumentGroups(final List<DocumentGroup> groups, final String query) {
        if (groups == null || groups.isEmpty()) {
            return new ArrayList<>();
        }

        final List<String> keywords = tokenizer.tokenize(query);
        if (keywords.isEmpty()) {
            return new ArrayList<>(groups);
        }

        final List<RankedCandidate<DocumentGroup>> ranked = new ArrayList<>(groups.size());
        for (int i = 0; i < groups.size(); i++) {
            ranked.add(new RankedCandidate<>(groups.get(i), i, scoreDocumentGroup(groups.get(i), keywords)));
        }
        ranked.sort(RankedCandidate.byScoreDescending());

        final List<DocumentGroup> result = new ArrayList<>(ranked.size());
        for (final RankedCandidate<DocumentGroup> candidate : ranked) {
            result.add(candidate.item());
        }
        return result;
    }
}
