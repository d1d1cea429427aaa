package dk.trustworks.templatefiller.utils.word;

import java.util.Optional;

/**
 * Placeholders whose value is a small mini-language expanded into several paragraphs.
 * The enum constant names are the placeholder names.
 */
public enum StructuredToken {
    SPONSOR_BACKGROUND,
    RISKS_AND_MITIGANTS;

    public static Optional<StructuredToken> fromName(String name) {
        for (StructuredToken token : values()) {
            if (token.name().equals(name)) {
                return Optional.of(token);
            }
        }
        return Optional.empty();
    }
}
