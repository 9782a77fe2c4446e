package com.taskforge.entity;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-domain git credentials of a user, stored as JSON on {@link AppUser}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonIgnoreProperties(ignoreUnknown = true)
public class GitIdentity {

    @JsonProperty("git_domain")
    private String gitDomain;

    @JsonProperty("git_token")
    private String gitToken;

    @JsonProperty("git_id")
    private String gitId;

    @JsonProperty("git_login")
    private String gitLogin;

    @JsonProperty("git_email")
    private String gitEmail;
}
