package eu.virtualparadox.knowledgebank.application.config;

import eu.virtualparadox.knowledgebank.rag.analysis.KeywordTokenizer;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates and manages the Lucene {@link Analyzer} used for keyword extraction.
 * <p>The analyzer is thread-safe and shared; it is closed on shutdown.</p>
 */
@Configuration
@Slf4j
public class AnalyzerConfig {

    private Analyzer analyzer;

    /**
     * Provides the keyword analyzer (standard tokenization, lower-casing, stop words).
     *
     * @return shared analyzer instance
     */
    @Bean
    public Analyzer keywordAnalyzer() {
        this.analyzer = KeywordTokenizer.newKeywordAnalyzer();
        return this.analyzer;
    }

    /**
     * Ensures the analyzer is closed cleanly on shutdown.
     */
    @PreDestroy
    public void close() {
        try { if (analyzer != null) analyzer.close(); } catch (Exception e) {
            log.error("Unable to close Analyzer", e);
        }
    }
}
