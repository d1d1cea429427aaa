package dk.trustworks.templatefiller.utils.word;

/**
 * Image bytes ready to be embedded.
 *
 * @param bytes       raw image data
 * @param pictureType one of the {@code org.apache.poi.xwpf.usermodel.Document.PICTURE_TYPE_*} constants
 * @param fileName    name given to the embedded part, e.g. {@code IMAGE_SITE_PLAN.png}
 */
public record DecodedImage(byte[] bytes, int pictureType, String fileName) {
}
