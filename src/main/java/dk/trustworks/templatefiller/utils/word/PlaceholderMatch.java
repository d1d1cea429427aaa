package dk.trustworks.templatefiller.utils.word;

/**
 * One {{NAME}} occurrence in a paragraph's logical text.
 *
 * @param name  placeholder name without braces
 * @param start offset of the first '{' (inclusive)
 * @param end   offset after the last '}' (exclusive)
 * @param kind  how the occurrence resolves against the supplied maps
 */
public record PlaceholderMatch(String name, int start, int end, PlaceholderKind kind) {
}
