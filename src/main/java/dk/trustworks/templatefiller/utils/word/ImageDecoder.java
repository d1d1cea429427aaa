package dk.trustworks.templatefiller.utils.word;

import dk.trustworks.templatefiller.exceptions.ImageDecodeException;
import org.apache.poi.xwpf.usermodel.Document;
import org.apache.tika.Tika;

import java.util.Base64;
import java.util.Map;

/**
 * Turns a base64 image value into embeddable bytes. The picture type is detected from
 * the content with Apache Tika, not trusted from the caller.
 */
public class ImageDecoder {

    private static final Map<String, PictureFormat> FORMATS = Map.of(
            "image/png", new PictureFormat(Document.PICTURE_TYPE_PNG, "png"),
            "image/jpeg", new PictureFormat(Document.PICTURE_TYPE_JPEG, "jpeg"),
            "image/gif", new PictureFormat(Document.PICTURE_TYPE_GIF, "gif"),
            "image/bmp", new PictureFormat(Document.PICTURE_TYPE_BMP, "bmp"),
            "image/x-ms-bmp", new PictureFormat(Document.PICTURE_TYPE_BMP, "bmp"),
            "image/tiff", new PictureFormat(Document.PICTURE_TYPE_TIFF, "tiff"),
            "image/emf", new PictureFormat(Document.PICTURE_TYPE_EMF, "emf"),
            "image/wmf", new PictureFormat(Document.PICTURE_TYPE_WMF, "wmf"));

    private final Tika tika = new Tika();

    /**
     * @throws ImageDecodeException if the value is not valid base64 or not a supported image type
     */
    public DecodedImage decode(String token, String base64Value) {
        if (base64Value == null || base64Value.isBlank()) {
            throw new ImageDecodeException(token, "image data is empty");
        }
        byte[] bytes;
        try {
            bytes = Base64.getMimeDecoder().decode(stripDataUriPrefix(base64Value.strip()));
        } catch (IllegalArgumentException e) {
            throw new ImageDecodeException(token, "invalid base64 content: " + e.getMessage(), e);
        }
        if (bytes.length == 0) {
            throw new ImageDecodeException(token, "image data is empty");
        }

        String mediaType = tika.detect(bytes);
        PictureFormat format = FORMATS.get(mediaType);
        if (format == null) {
            throw new ImageDecodeException(token, "unsupported image type " + mediaType);
        }
        return new DecodedImage(bytes, format.pictureType(), token + "." + format.extension());
    }

    static String stripDataUriPrefix(String value) {
        if (value.startsWith("data:")) {
            int comma = value.indexOf(',');
            if (comma > 0) {
                return value.substring(comma + 1);
            }
        }
        return value;
    }

    private record PictureFormat(int pictureType, String extension) {
    }
}
