package eu.virtualparadox.knowledgebank.context.budget;

import java.util.Locale;
import java.util.Optional;

/**
 * Caller hint selecting how much knowledge context an LLM call can afford.
 * An absent type means the default budget.
 */
public enum EGenerationType {
    /** One-shot generation, no parent chain in the prompt. */
    SINGLE,
    /** Multi-step chain; context is paid for at every step. */
    CHAIN,
    /** Transformation of existing content; needs minimal reference. */
    TRANSFORM;

    /**
     * Parses the wire value ({@code "single"}, {@code "chain"}, {@code "transform"}), ignoring case.
     *
     * @param value raw value, may be {@code null}
     * @return the type, or empty for a blank or unknown value
     */
    public static Optional<EGenerationType> fromValue(final String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
