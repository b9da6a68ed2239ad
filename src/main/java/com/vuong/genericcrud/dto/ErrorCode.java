package com.vuong.genericcrud.dto;

public enum ErrorCode {
    // Singleton resolution
    NOT_FOUND("Record not found"),
    MULTIPLE_RESULTS("Multiple results found"),

    // Storage errors
    EXECUTION_ERROR("db error");

    private final String defaultMessage;

    ErrorCode(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
