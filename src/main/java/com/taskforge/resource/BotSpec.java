package com.taskforge.resource;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public class BotSpec extends ResourceSpec {

    private ResourceRef ghostRef;
    private ResourceRef shellRef;
    private ResourceRef modelRef;
}
