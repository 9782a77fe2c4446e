package com.taskforge.resource;

import com.taskforge.entity.ResourceDocument;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Access to the generic store of named, namespaced, typed JSON documents (teams, bots, ghosts,
 * shells and models). The coordinator only reads these documents; write operations exist for
 * administration and fixtures.
 */
public interface ResourceStore {

    /**
     * Finds an active document by id.
     *
     * @param kind The expected kind of the document.
     * @param id The document id.
     * @return The document, or empty when it does not exist, is of another kind, or was soft-deleted.
     */
    Optional<ResourceDocument> getById(ResourceKind kind, Long id);

    /**
     * Finds an active document owned by a user by its name and namespace.
     *
     * @param kind The document kind.
     * @param userId The owning user.
     * @param ref The name/namespace reference; a missing namespace means {@code default}.
     * @return The document, or empty if not found.
     */
    Optional<ResourceDocument> find(ResourceKind kind, Long userId, ResourceRef ref);

    /**
     * Finds an active document shared across users (for example a public model) by name.
     */
    Optional<ResourceDocument> findShared(ResourceKind kind, String name);

    /**
     * Lists every active document of a kind owned by a user.
     */
    List<ResourceDocument> query(ResourceKind kind, Long userId);

    /**
     * Creates the document or replaces the JSON of the existing one with the same kind, owner, name and namespace.
     *
     * @return The persisted document.
     */
    ResourceDocument upsert(ResourceKind kind, Long userId, String name, String namespace, Map<String, Object> json);

    /**
     * Marks a document inactive.
     *
     * @return {@code true} if an active document was deactivated.
     */
    boolean softDelete(Long id);

    /**
     * Reads the {@code spec} object of a document as a typed view.
     *
     * @throws ResourceFormatException when the {@code spec} object does not match the view.
     */
    <T extends ResourceSpec> T readSpec(ResourceDocument document, Class<T> specType);
}
