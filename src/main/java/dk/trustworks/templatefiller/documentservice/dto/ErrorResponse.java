package dk.trustworks.templatefiller.documentservice.dto;

import java.util.List;

public record ErrorResponse(
    String error,
    String message,
    List<String> tokens
) {}
