package com.dfdscan.core;

/**
 * Нарушение предусловия генератора угроз: DFD не прошла структурную валидацию.
 * Это ошибка вызывающего кода, а не проблема пользовательских данных.
 */
public class ThreatModelPreconditionException extends IllegalStateException {

    public ThreatModelPreconditionException(String message) {
        super(message);
    }

    public ThreatModelPreconditionException(String message, Throwable cause) {
        super(message, cause);
    }
}
