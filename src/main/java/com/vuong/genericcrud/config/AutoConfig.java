package com.vuong.genericcrud.config;

import com.vuong.genericcrud.core.service.GenericCrudFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;

/**
 * Configuration class for the generic CRUD module.
 * Binds {@link GenericCrudProperties} and registers the Jackson setup and the
 * {@link GenericCrudFactory}.
 */
@Configuration
@EnableConfigurationProperties(GenericCrudProperties.class)
@Import({JacksonConfig.class, GenericCrudFactory.class})
public class AutoConfig {
}
