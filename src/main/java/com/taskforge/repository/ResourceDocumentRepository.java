package com.taskforge.repository;

import com.taskforge.entity.ResourceDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for managing {@link ResourceDocument} entities.
 * Only active (not soft-deleted) documents are returned by the finder methods.
 */
@Repository
public interface ResourceDocumentRepository extends JpaRepository<ResourceDocument, Long> {

    Optional<ResourceDocument> findByIdAndKindAndActiveTrue(Long id, String kind);

    Optional<ResourceDocument> findFirstByKindAndUserIdAndNameAndNamespaceAndActiveTrue(String kind,
                                                                                       Long userId,
                                                                                       String name,
                                                                                       String namespace);

    Optional<ResourceDocument> findFirstByKindAndNameAndActiveTrue(String kind, String name);

    List<ResourceDocument> findByKindAndUserIdAndActiveTrue(String kind, Long userId);
}
