package dk.trustworks.templatefiller.documentservice.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Request DTO for filling a template and storing the result.
 *
 * @param placeholders placeholder name to replacement text
 * @param images       {@code IMAGE_*} placeholder name to base64 image data
 * @param templateKey  storage key of the template, the configured default when absent
 * @param outputKey    requested storage key of the result; a free variant is used if taken
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FillAndUploadRequest(
    Map<String, String> placeholders,
    Map<String, String> images,
    @JsonProperty("template_key") String templateKey,
    @NotBlank @JsonProperty("output_key") String outputKey
) {}
