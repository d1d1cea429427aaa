package dk.trustworks.templatefiller.utils.word;

/**
 * How a {{NAME}} occurrence is filled.
 */
public enum PlaceholderKind {
    /** Replaced inline by a string from the value map. */
    VALUE,
    /** Replaced by a picture from the image map. */
    IMAGE,
    /** Expanded into several paragraphs by {@link StructuredSectionExpander}. */
    STRUCTURED,
    /** No value supplied: left verbatim so a later fill can complete it. */
    UNRESOLVED
}
