package dk.trustworks.templatefiller.fileservice.services;

import dk.trustworks.templatefiller.utils.word.TemplateFillerConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Picks an output key that does not overwrite an existing object.
 *
 * <p>{@code reports/IDS.docx} is used as is when free, otherwise {@code reports/IDS_2.docx},
 * {@code reports/IDS_3.docx} and so on up to the configured number of attempts. After that a
 * timestamp suffix is used: {@code reports/IDS_20250114_093000.docx}.
 */
@JBossLog
@ApplicationScoped
public class OutputKeyResolver {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final BlobStore blobStore;
    private final int maxAttempts;
    private final Clock clock;

    @Inject
    public OutputKeyResolver(BlobStore blobStore, TemplateFillerConfig config) {
        this(blobStore, config.outputKey().maxAttempts(), Clock.systemDefaultZone());
    }

    OutputKeyResolver(BlobStore blobStore, int maxAttempts, Clock clock) {
        this.blobStore = blobStore;
        this.maxAttempts = maxAttempts;
        this.clock = clock;
    }

    public String resolve(String requestedKey) {
        if (!blobStore.exists(requestedKey)) {
            return requestedKey;
        }
        for (int n = 2; n <= maxAttempts; n++) {
            String candidate = withSuffix(requestedKey, "_" + n);
            if (!blobStore.exists(candidate)) {
                log.infof("Output key %s is taken, using %s", requestedKey, candidate);
                return candidate;
            }
        }
        String candidate = withSuffix(requestedKey, "_" + LocalDateTime.now(clock).format(TIMESTAMP));
        log.warnf("No free numbered key for %s after %d attempts, using %s", requestedKey, maxAttempts, candidate);
        return candidate;
    }

    /**
     * Inserts the suffix before the final extension of the last path segment.
     */
    static String withSuffix(String key, String suffix) {
        int slash = key.lastIndexOf('/');
        int dot = key.lastIndexOf('.');
        if (dot <= slash + 1) {
            return key + suffix;
        }
        return key.substring(0, dot) + suffix + key.substring(dot);
    }
}
