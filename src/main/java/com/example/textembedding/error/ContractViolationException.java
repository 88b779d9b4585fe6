package com.example.textembedding.error;

/**
 * An external capability returned data that breaks an assumed invariant,
 * e.g. a vector of the wrong dimensionality. Never coerced.
 */
public class ContractViolationException extends TextEmbeddingException {

    public ContractViolationException(String message) {
        super(ErrorKind.CONTRACT_VIOLATION, message);
    }
}
