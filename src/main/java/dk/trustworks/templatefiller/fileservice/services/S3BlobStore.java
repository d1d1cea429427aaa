package dk.trustworks.templatefiller.fileservice.services;

import dk.trustworks.templatefiller.exceptions.StoreFailureException;
import dk.trustworks.templatefiller.exceptions.TemplateNotFoundException;
import dk.trustworks.templatefiller.fileservice.config.StorageConfig;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.jbosslog.JBossLog;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.AwsCredentialsProvider;
import software.amazon.awssdk.auth.credentials.DefaultCredentialsProvider;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.core.sync.ResponseTransformer;
import software.amazon.awssdk.http.apache.ApacheHttpClient;
import software.amazon.awssdk.http.apache.ProxyConfiguration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.GetObjectRequest;
import software.amazon.awssdk.services.s3.model.HeadObjectRequest;
import software.amazon.awssdk.services.s3.model.NoSuchKeyException;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Exception;

import java.io.ByteArrayOutputStream;
import java.net.URI;

@JBossLog
@ApplicationScoped
public class S3BlobStore implements BlobStore {

    private final StorageConfig config;
    private final S3Client s3;

    @Inject
    public S3BlobStore(StorageConfig config) {
        this(config, buildClient(config));
    }

    S3BlobStore(StorageConfig config, S3Client s3) {
        this.config = config;
        this.s3 = s3;
    }

    private static S3Client buildClient(StorageConfig config) {
        ProxyConfiguration.Builder proxyConfig = ProxyConfiguration.builder();
        ApacheHttpClient.Builder httpClientBuilder = ApacheHttpClient.builder()
                .proxyConfiguration(proxyConfig.build());

        return S3Client.builder()
                .endpointOverride(URI.create(config.endpoint()))
                .region(Region.of(config.region()))
                .forcePathStyle(config.pathStyleAccess())
                .credentialsProvider(credentials(config))
                .httpClientBuilder(httpClientBuilder)
                .build();
    }

    private static AwsCredentialsProvider credentials(StorageConfig config) {
        if (config.accessKey().isPresent() && config.secretKey().isPresent()) {
            return StaticCredentialsProvider.create(
                    AwsBasicCredentials.create(config.accessKey().get(), config.secretKey().get()));
        }
        log.warn("No static storage credentials configured, using the default credentials chain");
        return DefaultCredentialsProvider.create();
    }

    @Override
    public byte[] fetch(String key) {
        log.debugf("Downloading from storage: %s", key);
        try {
            ByteArrayOutputStream baos = new ByteArrayOutputStream();
            s3.getObject(
                    GetObjectRequest.builder()
                            .bucket(config.bucket())
                            .key(key)
                            .build(),
                    ResponseTransformer.toOutputStream(baos));
            byte[] bytes = baos.toByteArray();
            log.debugf("Downloaded from storage: %s (%d bytes)", key, bytes.length);
            return bytes;
        } catch (SdkException e) {
            log.errorf("Failed to download %s from storage: %s", key, e.getMessage());
            throw new TemplateNotFoundException(key, e);
        }
    }

    @Override
    public String store(byte[] bytes, String key) {
        log.infof("Uploading to storage: %s (%d bytes)", key, bytes.length);
        try {
            s3.putObject(
                    PutObjectRequest.builder()
                            .bucket(config.bucket())
                            .key(key)
                            .contentType(config.contentType())
                            .build(),
                    RequestBody.fromBytes(bytes));
        } catch (SdkException e) {
            log.errorf(e, "Failed to upload %s to storage", key);
            throw new StoreFailureException("Failed to store document: " + key, e);
        }
        String url = urlOf(key);
        log.infof("Uploaded to storage: %s", url);
        return url;
    }

    @Override
    public boolean exists(String key) {
        try {
            s3.headObject(HeadObjectRequest.builder()
                    .bucket(config.bucket())
                    .key(key)
                    .build());
            return true;
        } catch (NoSuchKeyException e) {
            return false;
        } catch (S3Exception e) {
            if (e.statusCode() == 404) {
                return false;
            }
            log.errorf(e, "Failed to probe %s in storage", key);
            throw new StoreFailureException("Failed to check whether " + key + " exists", e);
        } catch (SdkException e) {
            log.errorf(e, "Failed to probe %s in storage", key);
            throw new StoreFailureException("Failed to check whether " + key + " exists", e);
        }
    }

    String urlOf(String key) {
        String endpoint = config.endpoint();
        while (endpoint.endsWith("/")) {
            endpoint = endpoint.substring(0, endpoint.length() - 1);
        }
        return endpoint + "/" + config.bucket() + "/" + key;
    }
}
