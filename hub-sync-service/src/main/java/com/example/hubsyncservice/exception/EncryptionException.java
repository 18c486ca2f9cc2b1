package com.example.hubsyncservice.exception;

/**
 * Secret could not be encrypted or decrypted.
 */
public class EncryptionException extends RuntimeException {

    public EncryptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
