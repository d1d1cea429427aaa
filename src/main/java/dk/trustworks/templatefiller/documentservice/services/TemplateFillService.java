package dk.trustworks.templatefiller.documentservice.services;

import dk.trustworks.templatefiller.documentservice.dto.FillAndUploadRequest;
import dk.trustworks.templatefiller.documentservice.dto.FillAndUploadResponse;
import dk.trustworks.templatefiller.documentservice.dto.FillRequest;
import dk.trustworks.templatefiller.documentservice.dto.FilledDocument;
import dk.trustworks.templatefiller.exceptions.ImageDecodeException;
import dk.trustworks.templatefiller.fileservice.services.BlobStore;
import dk.trustworks.templatefiller.fileservice.services.OutputKeyResolver;
import dk.trustworks.templatefiller.utils.services.WordPlaceholderExtractor;
import dk.trustworks.templatefiller.utils.services.WordTemplateFiller;
import dk.trustworks.templatefiller.utils.word.FillReport;
import dk.trustworks.templatefiller.utils.word.FillResult;
import dk.trustworks.templatefiller.utils.word.TemplateFillerConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.util.Map;
import java.util.Set;

/**
 * Fetches a template, fills it and hands back or stores the result.
 *
 * <p>Processing flow:
 * <ol>
 *   <li>Template fetched from storage by key</li>
 *   <li>Template filled in memory by {@link WordTemplateFiller}</li>
 *   <li>Image failures collected during the fill are raised as one {@link ImageDecodeException}</li>
 *   <li>For uploads, a free output key is resolved and the document stored under it</li>
 * </ol>
 */
@JBossLog
@ApplicationScoped
public class TemplateFillService {

    @Inject
    BlobStore blobStore;

    @Inject
    OutputKeyResolver outputKeyResolver;

    @Inject
    WordTemplateFiller templateFiller;

    @Inject
    WordPlaceholderExtractor placeholderExtractor;

    @Inject
    TemplateFillerConfig config;

    public FilledDocument fill(FillRequest request) {
        String templateKey = orDefault(request.templateKey(), config.defaultTemplateKey());
        String filename = orDefault(request.outputFilename(), config.defaultOutputFilename());

        FillResult result = fillTemplate(templateKey, request.placeholders(), request.images());
        return new FilledDocument(result.document(), filename, result.report());
    }

    public FillAndUploadResponse fillAndUpload(FillAndUploadRequest request) {
        String templateKey = orDefault(request.templateKey(), config.defaultTemplateKey());

        FillResult result = fillTemplate(templateKey, request.placeholders(), request.images());

        String outputKey = outputKeyResolver.resolve(request.outputKey());
        String url = blobStore.store(result.document(), outputKey);
        log.infof("Stored filled template %s as %s", templateKey, outputKey);
        return new FillAndUploadResponse(true, outputKey, url);
    }

    public Set<String> extractPlaceholders(String templateKey) {
        String key = orDefault(templateKey, config.defaultTemplateKey());
        return placeholderExtractor.extractPlaceholders(blobStore.fetch(key));
    }

    private FillResult fillTemplate(String templateKey, Map<String, String> values, Map<String, String> images) {
        warnAboutInvalidNames(values);
        warnAboutInvalidNames(images);

        byte[] template = blobStore.fetch(templateKey);
        log.infof("Filling template %s (%d bytes) with %d values and %d images", templateKey, template.length,
                values != null ? values.size() : 0, images != null ? images.size() : 0);

        FillResult result = templateFiller.fillDocument(template, values, images);
        FillReport report = result.report();
        if (report.hasImageFailures()) {
            throw new ImageDecodeException(report.imageFailures());
        }
        if (!report.unresolved().isEmpty()) {
            log.infof("Template %s has %d placeholders without a value: %s",
                    templateKey, report.unresolved().size(), report.unresolved());
        }
        return result;
    }

    private void warnAboutInvalidNames(Map<String, String> entries) {
        if (entries == null) {
            return;
        }
        for (String name : entries.keySet()) {
            if (!placeholderExtractor.isValidPlaceholderName(name)) {
                log.warnf("Key %s is not a valid placeholder name and will never match", name);
            }
        }
    }

    private static String orDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
