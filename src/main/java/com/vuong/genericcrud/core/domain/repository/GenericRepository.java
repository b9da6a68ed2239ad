package com.vuong.genericcrud.core.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.repository.NoRepositoryBean;

import java.time.Instant;
import java.util.Map;

/**
 * Base repository interface for all record repositories handled by the generic CRUD service.
 * Extends JpaRepository and JpaSpecificationExecutor for CRUD and specification support.
 * Enable it with {@code @EnableJpaRepositories(repositoryBaseClass = GenericRepositoryImpl.class)}.
 * @param <T> the entity type
 * @param <Id> the ID type
 */
@NoRepositoryBean
public interface GenericRepository<T, Id> extends JpaRepository<T, Id>, JpaSpecificationExecutor<T> {
    /**
     * Returns the entity class managed by this repository.
     * @return the entity class
     */
    Class<T> getEntityClass();

    /**
     * Returns the name of the primary key attribute.
     * @return the id attribute name
     */
    String getIdAttributeName();

    /**
     * Writes the given attribute values to the row with the given primary key in a single
     * UPDATE statement. Pending changes are flushed first and the persistence context is
     * cleared afterwards, so managed instances loaded before the call are detached.
     * @param id the primary key
     * @param values attribute name to new value, written in iteration order
     * @return the number of rows updated
     */
    int updateById(Id id, Map<String, Object> values);

    /**
     * Sets the deletion marker of a live row.
     * @param id the primary key
     * @param deletedAt the marker value
     * @return the number of rows marked, 0 when absent or already deleted
     */
    int softDeleteById(Id id, Instant deletedAt);

    /**
     * Removes the row with the given primary key in a single DELETE statement, whether or
     * not it carries a deletion marker.
     * @param id the primary key
     * @return the number of rows removed
     */
    int hardDeleteById(Id id);

    /**
     * Detaches a managed instance from the persistence context, so later changes to it
     * are never flushed.
     * @param entity the instance to detach
     */
    void detach(T entity);
}
