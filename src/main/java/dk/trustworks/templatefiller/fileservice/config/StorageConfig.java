package dk.trustworks.templatefiller.fileservice.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

import java.util.Optional;

/**
 * S3-compatible object storage holding templates and generated documents.
 *
 * <p>Example configuration in application.properties:
 * <pre>
 * storage.endpoint=https://nyc3.digitaloceanspaces.com
 * storage.bucket=fam.workspace
 * storage.region=nyc3
 * storage.access-key=${S3_ACCESS_KEY:}
 * storage.secret-key=${S3_SECRET_KEY:}
 * </pre>
 */
@ConfigMapping(prefix = "storage")
public interface StorageConfig {

    /**
     * Endpoint URL of the storage service. Also the base of returned document URLs.
     */
    String endpoint();

    String bucket();

    @WithDefault("nyc3")
    String region();

    /**
     * Static credentials. When either is missing the AWS default credentials chain is used.
     */
    Optional<String> accessKey();

    Optional<String> secretKey();

    /**
     * Path-style addressing ({@code endpoint/bucket/key}).
     * Default: true
     */
    @WithDefault("true")
    boolean pathStyleAccess();

    /**
     * Content type stored with generated documents.
     */
    @WithDefault("application/vnd.openxmlformats-officedocument.wordprocessingml.document")
    String contentType();
}
