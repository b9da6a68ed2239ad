package com.vuong.genericcrud.exception;

import com.vuong.genericcrud.dto.ErrorCode;

/**
 * No record matched a lookup that expects exactly one.
 */
public class DataNotFoundException extends CrudException {

    public DataNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }
}
