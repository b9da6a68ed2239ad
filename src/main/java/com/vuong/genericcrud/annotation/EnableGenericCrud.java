package com.vuong.genericcrud.annotation;

import com.vuong.genericcrud.config.AutoConfig;
import org.springframework.context.annotation.Import;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to enable the generic CRUD module in a Spring Boot application.
 * This imports the {@link com.vuong.genericcrud.config.AutoConfig} class. Repositories
 * extending {@link com.vuong.genericcrud.core.domain.repository.GenericRepository} also need
 * {@code @EnableJpaRepositories(repositoryBaseClass = GenericRepositoryImpl.class)}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({AutoConfig.class})
public @interface EnableGenericCrud {
}
