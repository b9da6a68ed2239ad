package com.vuong.genericcrud.core.domain.repository;

import com.vuong.genericcrud.core.domain.model.SoftDeletable;
import jakarta.persistence.EntityManager;
import jakarta.persistence.Query;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaDelete;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Root;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.jpa.repository.support.JpaEntityInformation;
import org.springframework.data.jpa.repository.support.SimpleJpaRepository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Map;

/**
 * Repository base class backing {@link GenericRepository}. Adds criteria bulk updates
 * and deletes keyed by primary key on top of {@link SimpleJpaRepository}.
 * @param <T> the entity type
 * @param <Id> the ID type
 */
public class GenericRepositoryImpl<T, Id> extends SimpleJpaRepository<T, Id> implements GenericRepository<T, Id> {

    private static final Logger logger = LoggerFactory.getLogger(GenericRepositoryImpl.class);

    private final JpaEntityInformation<T, ?> entityInformation;
    private final EntityManager entityManager;

    public GenericRepositoryImpl(JpaEntityInformation<T, ?> entityInformation, EntityManager entityManager) {
        super(entityInformation, entityManager);
        this.entityInformation = entityInformation;
        this.entityManager = entityManager;
    }

    @Override
    public Class<T> getEntityClass() {
        return getDomainClass();
    }

    @Override
    public String getIdAttributeName() {
        return entityInformation.getIdAttribute().getName();
    }

    @Override
    @Transactional
    public int updateById(Id id, Map<String, Object> values) {
        if (values.isEmpty()) {
            logger.debug("Nothing to update for {} with ID: {}", getDomainClass().getSimpleName(), id);
            return 0;
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<T> update = cb.createCriteriaUpdate(getDomainClass());
        Root<T> root = update.from(getDomainClass());

        values.forEach((attribute, value) -> {
            Path<Object> path = root.get(attribute);
            if (value == null) {
                update.<Object>set(path, cb.nullLiteral(path.getJavaType()));
            } else {
                update.set(path, value);
            }
        });
        update.where(cb.equal(root.get(getIdAttributeName()), id));

        return execute(entityManager.createQuery(update));
    }

    @Override
    @Transactional
    public int softDeleteById(Id id, Instant deletedAt) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<T> update = cb.createCriteriaUpdate(getDomainClass());
        Root<T> root = update.from(getDomainClass());

        update.set(root.get(SoftDeletable.DELETED_AT_ATTRIBUTE), deletedAt);
        update.where(
                cb.equal(root.get(getIdAttributeName()), id),
                cb.isNull(root.get(SoftDeletable.DELETED_AT_ATTRIBUTE)));

        return execute(entityManager.createQuery(update));
    }

    @Override
    @Transactional
    public int hardDeleteById(Id id) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaDelete<T> delete = cb.createCriteriaDelete(getDomainClass());
        Root<T> root = delete.from(getDomainClass());
        delete.where(cb.equal(root.get(getIdAttributeName()), id));

        return execute(entityManager.createQuery(delete));
    }

    @Override
    public void detach(T entity) {
        if (entityManager.contains(entity)) {
            entityManager.detach(entity);
        }
    }

    private int execute(Query statement) {
        entityManager.flush();
        int rows = statement.executeUpdate();
        entityManager.clear();
        return rows;
    }
}
