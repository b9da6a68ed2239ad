package com.vuong.genericcrud.core.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.genericcrud.config.GenericCrudProperties;
import com.vuong.genericcrud.core.domain.model.BaseModel;
import com.vuong.genericcrud.core.domain.model.Identifiable;
import com.vuong.genericcrud.core.domain.query.Attribute;
import com.vuong.genericcrud.core.domain.repository.GenericRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Builds {@link GenericCrudService} instances for repositories.
 *
 * <pre>
 * &#64;Bean
 * GenericCrudService&lt;User, Long&gt; userCrud(GenericCrudFactory factory, UserRepository repository) {
 *     return factory.create(repository);
 * }
 * </pre>
 */
@Component
public class GenericCrudFactory {

    private static final Logger logger = LoggerFactory.getLogger(GenericCrudFactory.class);

    private final GenericCrudProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public GenericCrudFactory(GenericCrudProperties properties, ObjectMapper objectMapper, ObjectProvider<Clock> clock) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock.getIfAvailable(Clock::systemUTC);
    }

    /**
     * Creates a service for the repository's record type.
     *
     * @param repository  the repository of the record type
     * @param defaultOmit attributes no write of this service ever includes; when empty,
     *                    {@link BaseModel} records omit their creation and update timestamps
     * @param <T>         the record type
     * @param <ID>        the primary key type
     * @return the service
     */
    @SafeVarargs
    public final <T extends Identifiable<ID>, ID> GenericCrudService<T, ID> create(GenericRepository<T, ID> repository,
                                                                                    Attribute<? super T, ?>... defaultOmit) {
        Set<String> omit = new LinkedHashSet<>();
        for (Attribute<? super T, ?> attribute : defaultOmit) {
            omit.add(attribute.getName());
        }
        if (omit.isEmpty() && BaseModel.class.isAssignableFrom(repository.getEntityClass())) {
            omit.add(BaseModel.CREATED_AT.getName());
            omit.add(BaseModel.UPDATED_AT.getName());
        }

        logger.info("Registered generic CRUD for entity: {}. Default omit: {}", repository.getEntityClass().getName(), omit);
        return new GenericCrudService<>(repository, omit, properties, objectMapper, clock);
    }
}
