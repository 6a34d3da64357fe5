package com.example.phoneshop.lisa.service;

public class CorpusLoadException extends RuntimeException {

    public CorpusLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
