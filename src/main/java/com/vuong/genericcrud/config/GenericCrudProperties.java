package com.vuong.genericcrud.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the generic CRUD module.
 */
@ConfigurationProperties(prefix = "app.crud")
@Getter
@Setter
public class GenericCrudProperties {

    /**
     * Log every translated query at INFO instead of DEBUG.
     */
    private boolean debug = false;

    /**
     * Hide records with a deletion marker from reads and mark records instead of
     * removing them on delete. When false, delete always removes the row.
     */
    private boolean softDelete = true;
}
