package com.vuong.genericcrud.exception;

import com.vuong.genericcrud.dto.ErrorCode;

/**
 * More than one record matched a lookup that expects exactly one. The filter is
 * ambiguous; the caller has to narrow it.
 */
public class MultipleResultsException extends CrudException {

    public MultipleResultsException(String message) {
        super(ErrorCode.MULTIPLE_RESULTS, message);
    }
}
