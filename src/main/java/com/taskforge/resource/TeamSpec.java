package com.taskforge.resource;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@NoArgsConstructor
@JsonNaming(PropertyNamingStrategies.LowerCamelCaseStrategy.class)
public class TeamSpec extends ResourceSpec {

    private List<TeamMember> members = new ArrayList<>();
    private String collaborationModel;

    public WorkflowMode workflowMode() {
        return WorkflowMode.from(collaborationModel);
    }
}
