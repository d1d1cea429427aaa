package dk.trustworks.templatefiller.documentservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Request DTO for filling a template and returning the document.
 *
 * @param placeholders   placeholder name to replacement text
 * @param images         {@code IMAGE_*} placeholder name to base64 image data
 * @param templateKey    storage key of the template, the configured default when absent
 * @param outputFilename filename of the returned attachment, the configured default when absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FillRequest(
    Map<String, String> placeholders,
    Map<String, String> images,
    @JsonProperty("template_key") String templateKey,
    @JsonProperty("output_filename") String outputFilename
) {}
