package dk.trustworks.templatefiller.documentservice.dto;

import dk.trustworks.templatefiller.utils.word.FillReport;

/**
 * A filled document ready to be returned as an attachment.
 *
 * @param content  the .docx bytes
 * @param filename attachment filename
 * @param report   what the fill replaced
 */
public record FilledDocument(
    byte[] content,
    String filename,
    FillReport report
) {}
