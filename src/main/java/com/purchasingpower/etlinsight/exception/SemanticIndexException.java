package com.purchasingpower.etlinsight.exception;

/**
 * The semantic index could not be built or queried.
 *
 * @since 1.0.0
 */
public class SemanticIndexException extends RuntimeException {

    public SemanticIndexException(String message) {
        super(message);
    }

    public SemanticIndexException(String message, Throwable cause) {
        super(message, cause);
    }
}
