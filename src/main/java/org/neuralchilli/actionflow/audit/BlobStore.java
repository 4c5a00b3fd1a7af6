package org.neuralchilli.actionflow.audit;

/**
 * Destination for response bodies too large to return inline.
 */
public interface BlobStore {

    /**
     * Store a blob under a file name.
     *
     * @return a reference the caller can later resolve
     * @throws BlobStoreException if the blob could not be stored
     */
    String store(String name, byte[] content);
}
