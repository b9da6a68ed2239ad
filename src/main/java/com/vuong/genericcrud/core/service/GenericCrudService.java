package com.vuong.genericcrud.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.genericcrud.config.GenericCrudProperties;
import com.vuong.genericcrud.core.domain.model.Identifiable;
import com.vuong.genericcrud.core.domain.model.SoftDeletable;
import com.vuong.genericcrud.core.domain.query.Attribute;
import com.vuong.genericcrud.core.domain.query.StructuredQuery;
import com.vuong.genericcrud.core.domain.repository.GenericRepository;
import com.vuong.genericcrud.core.domain.specification.Condition;
import com.vuong.genericcrud.core.domain.specification.PredicateSet;
import com.vuong.genericcrud.core.domain.specification.QueryTranslator;
import com.vuong.genericcrud.core.domain.specification.SpecificationBuilder;
import com.vuong.genericcrud.exception.CrudException;
import com.vuong.genericcrud.exception.DataNotFoundException;
import com.vuong.genericcrud.exception.MultipleResultsException;
import com.vuong.genericcrud.util.FieldIntrospector;
import com.vuong.genericcrud.util.ZeroValues;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.jpa.domain.Specification;

import java.lang.reflect.Field;
import java.time.Clock;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * CRUD operations for one record type, driven by example records or structured queries.
 * <p>
 * By-example operations filter on the non-zero attributes of the given record. Omit lists
 * given to an operation are added to the default omit list of the service, never replace it.
 * Reads hide soft-deleted records. Storage failures surface as {@link CrudException};
 * single-record lookups additionally fail with {@link DataNotFoundException} or
 * {@link MultipleResultsException}.
 * <p>
 * Instances are stateless and safe to share between threads; obtain them from
 * {@link GenericCrudFactory}.
 *
 * @param <T>  the record type
 * @param <ID> the primary key type
 */
public class GenericCrudService<T extends Identifiable<ID>, ID> {

    private static final Logger logger = LoggerFactory.getLogger(GenericCrudService.class);

    private final GenericRepository<T, ID> repository;
    private final Class<T> entityClass;
    private final Set<String> defaultOmit;
    private final GenericCrudProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    GenericCrudService(GenericRepository<T, ID> repository, Set<String> defaultOmit,
                       GenericCrudProperties properties, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.entityClass = repository.getEntityClass();
        this.defaultOmit = Collections.unmodifiableSet(new LinkedHashSet<>(defaultOmit));
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    /**
     * Attribute names every write leaves out.
     */
    public Set<String> getDefaultOmit() {
        return defaultOmit;
    }

    /**
     * Inserts a record. Omitted attributes are reset to their zero value before the insert,
     * so the database or the persistence provider supplies them.
     *
     * @param record the record to insert
     * @param omit   attributes to leave out, on top of the default omit list
     * @return the saved record with its generated primary key
     * @throws IllegalArgumentException if the record already carries a primary key
     */
    @SafeVarargs
    public final T create(T record, Attribute<? super T, ?>... omit) {
        requireRecord(record);
        if (record.hasPrimaryKey()) {
            throw new IllegalArgumentException("Cannot create " + entityClass.getSimpleName()
                    + " with existing primary key " + record.getPrimaryKey() + ", use update instead");
        }
        Set<String> omitted = mergeOmit(omit);
        clearAttributes(record, omitted);

        T saved = execute("create " + entityClass.getSimpleName(), () -> repository.save(record));
        logger.info("Successfully created entity of type: {} with ID: {}", entityClass.getSimpleName(), saved.getPrimaryKey());
        return saved;
    }

    /**
     * Returns the single record matching the non-zero attributes of {@code record}, creating
     * it when none matches. Fails with {@link MultipleResultsException} when the example
     * is ambiguous.
     */
    @SafeVarargs
    public final T getOrCreate(T record, Attribute<? super T, ?>... omit) {
        try {
            return queryOne(record, omit);
        } catch (DataNotFoundException e) {
            logger.debug("No {} matched, creating it", entityClass.getSimpleName());
            return create(record, omit);
        }
    }

    /**
     * Loads a record by the primary key of {@code record}.
     *
     * @throws IllegalArgumentException if the primary key is zero
     * @throws DataNotFoundException    if no live record has that key
     */
    public T getById(T record) {
        requireRecord(record);
        return getById(record.getPrimaryKey());
    }

    /**
     * Loads a record by primary key.
     *
     * @throws IllegalArgumentException if the primary key is zero
     * @throws DataNotFoundException    if no live record has that key
     */
    public T getById(ID id) {
        requirePrimaryKey(id);
        PredicateSet<T> predicateSet = PredicateSet.<T>builder()
                .recordType(entityClass)
                .condition(Condition.equal(repository.getIdAttributeName(), id))
                .build();
        logQuery("getById", predicateSet);

        Specification<T> spec = SpecificationBuilder.build(predicateSet, properties.isSoftDelete());
        return execute("get " + entityClass.getSimpleName() + " by id", () -> repository.findOne(spec))
                .orElseThrow(() -> new DataNotFoundException("Not found entity with id: " + id));
    }

    /**
     * Lists the records matching the non-zero attributes of {@code example}. An empty
     * example lists every live record.
     *
     * @return the matches, possibly empty
     */
    @SafeVarargs
    public final List<T> query(T example, Attribute<? super T, ?>... omit) {
        return findAll("query", byExample(example, omit));
    }

    /**
     * Lists the records matching a structured query, ordered and with the requested
     * relations loaded. Attributes omitted by the query come back at their zero value.
     *
     * @return the matches, possibly empty
     */
    public List<T> query(StructuredQuery<T> query) {
        PredicateSet<T> predicateSet = QueryTranslator.translateStructured(entityClass, query);
        List<T> records = findAll("query", predicateSet);
        records.forEach(record -> stripOmitted(record, predicateSet));
        return records;
    }

    /**
     * Returns the one record matching the non-zero attributes of {@code example}.
     *
     * @throws DataNotFoundException    if nothing matches
     * @throws MultipleResultsException if more than one record matches
     */
    @SafeVarargs
    public final T queryOne(T example, Attribute<? super T, ?>... omit) {
        return resolveSingleton(byExample(example, omit));
    }

    /**
     * Returns the one record matching a structured query. Attributes omitted by the query
     * come back at their zero value.
     *
     * @throws DataNotFoundException    if nothing matches
     * @throws MultipleResultsException if more than one record matches
     */
    public T queryOne(StructuredQuery<T> query) {
        PredicateSet<T> predicateSet = QueryTranslator.translateStructured(entityClass, query);
        T record = resolveSingleton(predicateSet);
        stripOmitted(record, predicateSet);
        return record;
    }

    /**
     * Runs a query expected to match at most one record. Fetches at most two rows, which
     * is enough to tell "one" from "many".
     *
     * @param predicateSet the translated filter
     * @return the single matching record
     * @throws DataNotFoundException    if nothing matches
     * @throws MultipleResultsException if more than one record matches
     */
    public T resolveSingleton(PredicateSet<T> predicateSet) {
        logQuery("queryOne", predicateSet);
        Specification<T> spec = SpecificationBuilder.build(predicateSet, properties.isSoftDelete());
        PageRequest firstTwo = PageRequest.of(0, 2, SpecificationBuilder.buildSort(predicateSet));

        List<T> matches = execute("query one " + entityClass.getSimpleName(),
                () -> repository.findAll(spec, firstTwo).getContent());

        if (matches.isEmpty()) {
            throw new DataNotFoundException("record not found: " + predicateSet.describe());
        }
        if (matches.size() > 1) {
            throw new MultipleResultsException("multiple results found: " + predicateSet.describe());
        }
        return matches.get(0);
    }

    /**
     * Writes one attribute of the record identified by the primary key of {@code record}.
     *
     * @return the number of rows updated, 0 when the record does not exist
     */
    public <V> int updateField(T record, Attribute<? super T, V> attribute, V value) {
        requireRecord(record);
        requirePrimaryKey(record.getPrimaryKey());
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(attribute.getName(), value);

        int rows = execute("update " + entityClass.getSimpleName() + "." + attribute.getName(),
                () -> repository.updateById(record.getPrimaryKey(), values));
        logger.info("Updated {} of {} with ID: {} ({} rows)", attribute.getName(), entityClass.getSimpleName(),
                record.getPrimaryKey(), rows);
        return rows;
    }

    /**
     * Writes the non-zero attributes of {@code record} to the row with its primary key.
     * The primary key, the default omit list and {@code omit} are never written.
     *
     * @return the number of rows updated, 0 when the record does not exist
     */
    @SafeVarargs
    public final int update(T record, Attribute<? super T, ?>... omit) {
        requireRecord(record);
        requirePrimaryKey(record.getPrimaryKey());
        Set<String> omitted = mergeOmit(omit);
        omitted.add(repository.getIdAttributeName());

        Map<String, Object> values = new LinkedHashMap<>();
        for (Condition condition : QueryTranslator.translateByExample(entityClass, record, omitted).getConditions()) {
            values.put(condition.getAttribute(), condition.getValue());
        }

        int rows = execute("update " + entityClass.getSimpleName(), () -> repository.updateById(record.getPrimaryKey(), values));
        logger.info("Successfully updated entity of type: {} with ID: {} ({} attributes, {} rows)",
                entityClass.getSimpleName(), record.getPrimaryKey(), values.size(), rows);
        return rows;
    }

    /**
     * Writes explicit attribute values, including zero values, to the row with the primary
     * key of {@code record}. Values are converted to the declared attribute type when
     * needed, e.g. an ISO string to {@code Instant}. Unknown attribute names are not
     * checked here and fail in the persistence provider.
     *
     * @return the number of rows updated, 0 when the record does not exist
     */
    public int updateMap(T record, Map<String, Object> values) {
        requireRecord(record);
        requirePrimaryKey(record.getPrimaryKey());

        Map<String, Object> coerced = new LinkedHashMap<>();
        values.forEach((attribute, value) -> coerced.put(attribute, coerce(attribute, value)));

        int rows = execute("update " + entityClass.getSimpleName(), () -> repository.updateById(record.getPrimaryKey(), coerced));
        logger.info("Successfully updated entity of type: {} with ID: {} ({} rows)",
                entityClass.getSimpleName(), record.getPrimaryKey(), rows);
        return rows;
    }

    /**
     * Deletes the record with the primary key of {@code record}: marks it when the type is
     * {@link SoftDeletable} and soft deletion is enabled, removes it otherwise.
     *
     * @return true when a live record was deleted
     */
    public boolean delete(T record) {
        requireRecord(record);
        ID id = record.getPrimaryKey();
        requirePrimaryKey(id);

        if (!properties.isSoftDelete() || !SoftDeletable.class.isAssignableFrom(entityClass)) {
            return hardDelete(record);
        }
        logger.debug("Soft deleting entity of type: {} with ID: {}", entityClass.getSimpleName(), id);
        int rows = execute("delete " + entityClass.getSimpleName(), () -> repository.softDeleteById(id, clock.instant()));
        logger.info("Successfully deleted entity of type: {} with ID: {} ({} rows)", entityClass.getSimpleName(), id, rows);
        return rows > 0;
    }

    /**
     * Removes the row with the primary key of {@code record}, whether or not it carries a
     * deletion marker.
     *
     * @return true when a row was removed
     */
    public boolean hardDelete(T record) {
        requireRecord(record);
        ID id = record.getPrimaryKey();
        requirePrimaryKey(id);
        logger.debug("Deleting entity of type: {} with ID: {}", entityClass.getSimpleName(), id);

        int rows = execute("delete " + entityClass.getSimpleName(), () -> repository.hardDeleteById(id));
        logger.info("Successfully deleted entity of type: {} with ID: {} ({} rows)", entityClass.getSimpleName(), id, rows);
        return rows > 0;
    }

    private List<T> findAll(String operation, PredicateSet<T> predicateSet) {
        logQuery(operation, predicateSet);
        Specification<T> spec = SpecificationBuilder.build(predicateSet, properties.isSoftDelete());
        return execute(operation + " " + entityClass.getSimpleName(),
                () -> repository.findAll(spec, SpecificationBuilder.buildSort(predicateSet)));
    }

    private void stripOmitted(T record, PredicateSet<T> predicateSet) {
        if (predicateSet.getOmitted().isEmpty()) {
            return;
        }
        // Detached first so the cleared values never reach the database.
        repository.detach(record);
        clearAttributes(record, predicateSet.getOmitted());
    }

    private PredicateSet<T> byExample(T example, Attribute<? super T, ?>[] omit) {
        return QueryTranslator.translateByExample(entityClass, example, mergeOmit(omit));
    }

    private Set<String> mergeOmit(Attribute<? super T, ?>[] omit) {
        Set<String> omitted = new LinkedHashSet<>(defaultOmit);
        for (Attribute<? super T, ?> attribute : omit) {
            omitted.add(attribute.getName());
        }
        return omitted;
    }

    private void clearAttributes(T record, Set<String> attributes) {
        for (String attribute : attributes) {
            Field field = FieldIntrospector.findField(record.getClass(), attribute);
            if (field == null) {
                throw new IllegalArgumentException("Unknown attribute " + attribute + " for " + entityClass.getSimpleName());
            }
            FieldIntrospector.write(field, record, ZeroValues.zeroValueOf(field.getType()));
        }
    }

    private Object coerce(String attribute, Object value) {
        Field field = FieldIntrospector.findField(entityClass, attribute);
        if (field == null || value == null || wrap(field.getType()).isInstance(value)) {
            return value;
        }
        try {
            return objectMapper.convertValue(value, field.getType());
        } catch (IllegalArgumentException e) {
            throw CrudException.executionError("convert " + attribute + " to " + field.getType().getSimpleName(), e);
        }
    }

    private static Class<?> wrap(Class<?> type) {
        if (!type.isPrimitive()) {
            return type;
        }
        return ZeroValues.zeroValueOf(type).getClass();
    }

    private <R> R execute(String operation, Supplier<R> action) {
        try {
            return action.get();
        } catch (DataAccessException | PersistenceException | IllegalArgumentException e) {
            logger.error("Failed to {}: {}", operation, e.getMessage());
            throw CrudException.executionError(operation, e);
        }
    }

    private void logQuery(String operation, PredicateSet<T> predicateSet) {
        if (properties.isDebug()) {
            logger.info("{}: {}", operation, predicateSet.describe());
        } else {
            logger.debug("{}: {}", operation, predicateSet.describe());
        }
    }

    private void requireRecord(T record) {
        if (record == null) {
            throw new IllegalArgumentException("Record cannot be null");
        }
    }

    private void requirePrimaryKey(ID id) {
        if (ZeroValues.isZero(id)) {
            throw new IllegalArgumentException("Primary key of " + entityClass.getSimpleName() + " is required");
        }
    }
}
