package org.neuralchilli.actionflow.audit;

public class BlobStoreException extends RuntimeException {

    public BlobStoreException(String message) {
        super(message);
    }
}
