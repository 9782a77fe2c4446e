package com.taskforge.resource;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@Setter
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public class ModelSpec extends ResourceSpec {

    public static final String PRIVATE_MODEL_KEY = "private_model";

    private Map<String, Object> modelConfig = new LinkedHashMap<>();

    /**
     * Name of the shared model this config points at, when the config declares one.
     */
    public @Nullable String privateModelName() {
        if (modelConfig == null) {
            return null;
        }
        Object value = modelConfig.get(PRIVATE_MODEL_KEY);
        if (value instanceof String name && !name.isBlank()) {
            return name.trim();
        }
        return null;
    }
}
