package eu.virtualparadox.knowledgebank.rag.analysis;

import lombok.RequiredArgsConstructor;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.CharArraySet;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Turns free text into lower-case keyword tokens.
 * <p>
 * Steps:
 * <ol>
 *   <li>Remove punctuation from the whole text so that compound words stay whole
 *       ({@code "e-commerce"} becomes {@code "ecommerce"}, {@code "AI/ML"} becomes {@code "AIML"}).</li>
 *   <li>Run the text through the Lucene {@link Analyzer} (word boundaries, lower-casing,
 *       {@link #STOP_WORDS} removal).</li>
 *   <li>Drop tokens shorter than {@link #MIN_TOKEN_LENGTH}.</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class KeywordTokenizer {

    /** Minimum keyword length kept after analysis. */
    public static final int MIN_TOKEN_LENGTH = 3;

    /** Common English words that carry no relevance signal. */
    public static final CharArraySet STOP_WORDS = CharArraySet.unmodifiableSet(new CharArraySet(List.of(
            "the", "a", "an", "and", "or", "but", "in", "on", "at", "to", "for",
            "of", "with", "by", "from", "is", "it", "as", "be", "was", "are",
            "been", "has", "had", "do", "did", "not", "no", "can", "will", "just",
            "so", "than", "too", "very", "that", "this", "its", "if", "then",
            "into", "also", "about", "up", "out", "what", "which", "who", "how",
            "when", "where", "why", "all", "each", "every", "both", "few", "more",
            "most", "other", "some", "such", "only", "own", "same", "my", "your",
            "his", "her", "our", "they", "them", "their", "me", "him", "she", "he",
            "we", "you"), false));

    private static final String FIELD = "text";
    private static final Pattern PUNCTUATION = Pattern.compile("[^\\p{L}\\p{N}\\s]");

    private final Analyzer analyzer;

    /**
     * Creates the analyzer this tokenizer is designed for.
     * The caller owns it and must close it.
     */
    public static Analyzer newKeywordAnalyzer() {
        return new StandardAnalyzer(STOP_WORDS);
    }

    /**
     * Tokenizes {@code text} keeping duplicates, in order of appearance.
     * Term frequency based scoring relies on the duplicates.
     *
     * @param text any text, may be {@code null}
     * @return keyword tokens (never {@code null})
     */
    public List<String> tokenizeRaw(final String text) {
        if (text == null || text.isBlank()) {
            return Collections.emptyList();
        }

        final List<String> tokens = new ArrayList<>();
        final String cleaned = PUNCTUATION.matcher(text).replaceAll("");
        try (final TokenStream stream = analyzer.tokenStream(FIELD, cleaned)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (stream.incrementToken()) {
                final String token = term.toString();
                if (token.length() >= MIN_TOKEN_LENGTH && !STOP_WORDS.contains(token)) {
                    tokens.add(token);
                }
            }
            stream.end();
        } catch (IOException e) {
            throw new IllegalStateException("Unable to tokenize text", e);
        }
        return tokens;
    }

    /**
     * Tokenizes {@code text} into de-duplicated keywords, first occurrence wins.
     *
     * @param text any text, may be {@code null}
     * @return distinct keyword tokens; empty for a blank text
     */
    public List<String> tokenize(final String text) {
        return List.copyOf(new LinkedHashSet<>(tokenizeRaw(text)));
    }
}
