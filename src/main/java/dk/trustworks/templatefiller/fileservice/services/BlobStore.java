package dk.trustworks.templatefiller.fileservice.services;

import dk.trustworks.templatefiller.exceptions.StoreFailureException;
import dk.trustworks.templatefiller.exceptions.TemplateNotFoundException;

/**
 * Key-addressed binary storage for templates and generated documents.
 */
public interface BlobStore {

    /**
     * @throws TemplateNotFoundException if the object cannot be read
     */
    byte[] fetch(String key);

    /**
     * Writes the bytes under the key, replacing any existing object.
     *
     * @return public URL of the stored object
     * @throws StoreFailureException if the write fails
     */
    String store(byte[] bytes, String key);

    /**
     * @throws StoreFailureException if the storage cannot be probed
     */
    boolean exists(String key);
}
