package com.taskforge.resource;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import org.springframework.util.StringUtils;

@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceRef(String name, String namespace) {

    public static final String DEFAULT_NAMESPACE = "default";

    public String namespaceOrDefault() {
        return StringUtils.hasText(namespace) ? namespace : DEFAULT_NAMESPACE;
    }
}
