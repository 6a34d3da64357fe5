package com.example.phoneshop.lisa.generation;

/** The reply could not be generated, even after retries. */
public class GenerationFailedException extends RuntimeException {

    public GenerationFailedException(String message, Throwable cause) {
        super(message, cause);
    }
}
