package dk.trustworks.templatefiller.documentservice.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response DTO for a stored document.
 *
 * @param success   always true; failures are reported through error responses
 * @param outputKey storage key actually written
 * @param outputUrl public URL of the stored document
 */
public record FillAndUploadResponse(
    boolean success,
    @JsonProperty("output_key") String outputKey,
    @JsonProperty("output_url") String outputUrl
) {}
