package com.codeannotation.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.cfg.CoercionAction;
import com.fasterxml.jackson.databind.cfg.CoercionInputShape;
import com.fasterxml.jackson.databind.type.LogicalType;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class JacksonConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper om = new ObjectMapper();
        // Optional.empty() is written as null
        om.registerModule(new Jdk8Module());
        om.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        // {"name":"a"} garbage is malformed, not {"name":"a"}
        om.enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        // "name": 42 is a type error, not "42"
        om.coercionConfigFor(LogicalType.Textual)
                .setCoercion(CoercionInputShape.Integer, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Float, CoercionAction.Fail)
                .setCoercion(CoercionInputShape.Boolean, CoercionAction.Fail);
        return om;
    }
}
