package dk.trustworks.templatefiller.utils.word;

/**
 * A filled document and what happened while filling it.
 */
public record FillResult(byte[] document, FillReport report) {
}
