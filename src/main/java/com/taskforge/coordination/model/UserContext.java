package com.taskforge.coordination.model;

public record UserContext(
        Long id,
        String name,
        String gitDomain,
        String gitToken,
        String gitId,
        String gitLogin,
        String gitEmail
) {
}
