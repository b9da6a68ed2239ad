package com.vuong.genericcrud.exception;

import com.vuong.genericcrud.dto.ErrorCode;
import lombok.Getter;

/**
 * Failure of a generic CRUD operation. Used as is for storage failures, which keep
 * the original exception as cause; subclasses mark the outcomes callers branch on.
 */
@Getter
public class CrudException extends RuntimeException {

    private final ErrorCode errorCode;

    public CrudException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public CrudException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    /**
     * Wraps a storage failure with the operation it happened in.
     */
    public static CrudException executionError(String operation, Throwable cause) {
        return new CrudException(ErrorCode.EXECUTION_ERROR,
                ErrorCode.EXECUTION_ERROR.getDefaultMessage() + ": " + operation + ": " + cause.getMessage(), cause);
    }
}
