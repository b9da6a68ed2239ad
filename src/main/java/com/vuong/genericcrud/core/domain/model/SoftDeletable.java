package com.vuong.genericcrud.core.domain.model;

import java.time.Instant;

/**
 * Records carrying a deletion marker. Rows with a marker are hidden from reads
 * unless the query explicitly includes deleted records.
 */
public interface SoftDeletable {

    String DELETED_AT_ATTRIBUTE = "deletedAt";

    Instant getDeletedAt();
}
