package dk.trustworks.templatefiller.utils.word;

/**
 * Classification of a sponsor block line.
 */
public enum LineKind {
    HEADER,
    BODY,
    BLANK
}
