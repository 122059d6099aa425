package com.dfdscan.core;

/**
 * Документ DFD не удалось прочитать или разобрать
 */
public class DfdParseException extends RuntimeException {

    public DfdParseException(String message) {
        super(message);
    }

    public DfdParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
