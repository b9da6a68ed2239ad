package com.vuong.genericcrud.core.domain.model;

import com.vuong.genericcrud.core.domain.query.Attribute;
import jakarta.persistence.Column;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * Base type for persistent records: generated primary key, creation and update
 * timestamps, and a soft-deletion marker.
 *
 * <pre>
 * &#64;Entity
 * public class User extends BaseModel {
 *     public static final Attribute&lt;User, String&gt; NAME = Attribute.of("name", String.class);
 *     private String name;
 * }
 * </pre>
 */
@MappedSuperclass
@Getter
@Setter
public abstract class BaseModel implements Identifiable<Long>, SoftDeletable {

    public static final Attribute<BaseModel, Long> ID = Attribute.of("id", Long.class);
    public static final Attribute<BaseModel, Instant> CREATED_AT = Attribute.of("createdAt", Instant.class);
    public static final Attribute<BaseModel, Instant> UPDATED_AT = Attribute.of("updatedAt", Instant.class);
    public static final Attribute<BaseModel, Instant> DELETED_AT = Attribute.of(DELETED_AT_ATTRIBUTE, Instant.class);

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @CreationTimestamp
    @Column(updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    private Instant updatedAt;

    private Instant deletedAt;

    @Override
    public Long getPrimaryKey() {
        return id;
    }
}
