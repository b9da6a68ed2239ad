package com.vuong.genericcrud.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vuong.genericcrud.annotation.EnableGenericCrud;
import com.vuong.genericcrud.core.service.GenericCrudFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AutoConfig Tests")
class AutoConfigTest {

    @Configuration
    @EnableGenericCrud
    static class EnabledConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner();

    @Test
    @DisplayName("Should register the factory, properties and ObjectMapper")
    void shouldRegisterBeans() {
        runner.withUserConfiguration(EnabledConfig.class).run(context -> {
            assertThat(context).hasSingleBean(GenericCrudFactory.class);
            assertThat(context).hasSingleBean(GenericCrudProperties.class);
            assertThat(context).hasSingleBean(ObjectMapper.class);
        });
    }

    @Test
    @DisplayName("Should bind properties under app.crud")
    void shouldBindProperties() {
        runner.withUserConfiguration(EnabledConfig.class)
                .withPropertyValues("app.crud.debug=true", "app.crud.soft-delete=false")
                .run(context -> {
                    GenericCrudProperties properties = context.getBean(GenericCrudProperties.class);
                    assertThat(properties.isDebug()).isTrue();
                    assertThat(properties.isSoftDelete()).isFalse();
                });
    }
}
