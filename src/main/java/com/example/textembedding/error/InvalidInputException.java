package com.example.textembedding.error;

public class InvalidInputException extends TextEmbeddingException {

    public InvalidInputException(String message) {
        super(ErrorKind.INVALID_INPUT, message);
    }
}
