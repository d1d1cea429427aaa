package dk.trustworks.templatefiller.utils.word;

/**
 * An image placeholder that could not be filled.
 *
 * @param token  the image placeholder name
 * @param reason why the insertion was aborted
 */
public record ImageFailure(String token, String reason) {
}
