package com.taskforge.resource;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.taskforge.entity.ResourceDocument;
import com.taskforge.repository.ResourceDocumentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaResourceStore implements ResourceStore {

    private static final String SPEC_KEY = "spec";

    private final ResourceDocumentRepository repository;
    private final ObjectMapper objectMapper;

    @Override
    public Optional<ResourceDocument> getById(ResourceKind kind, Long id) {
        if (id == null) {
            return Optional.empty();
        }
        return repository.findByIdAndKindAndActiveTrue(id, kind.kindName());
    }

    @Override
    public Optional<ResourceDocument> find(ResourceKind kind, Long userId, ResourceRef ref) {
        if (ref == null || ref.name() == null) {
            return Optional.empty();
        }
        return repository.findFirstByKindAndUserIdAndNameAndNamespaceAndActiveTrue(
                kind.kindName(), userId, ref.name(), ref.namespaceOrDefault());
    }

    @Override
    public Optional<ResourceDocument> findShared(ResourceKind kind, String name) {
        return repository.findFirstByKindAndNameAndActiveTrue(kind.kindName(), name);
    }

    @Override
    public List<ResourceDocument> query(ResourceKind kind, Long userId) {
        return repository.findByKindAndUserIdAndActiveTrue(kind.kindName(), userId);
    }

    @Override
    @Transactional
    public ResourceDocument upsert(ResourceKind kind, Long userId, String name, String namespace,
                                   Map<String, Object> json) {
        ResourceRef ref = new ResourceRef(name, namespace);
        ResourceDocument document = repository
                .findFirstByKindAndUserIdAndNameAndNamespaceAndActiveTrue(kind.kindName(), userId, name,
                        ref.namespaceOrDefault())
                .orElseGet(() -> ResourceDocument.builder()
                        .kind(kind.kindName())
                        .userId(userId)
                        .name(name)
                        .namespace(ref.namespaceOrDefault())
                        .build());
        document.setJson(json);
        return repository.save(document);
    }

    @Override
    @Transactional
    public boolean softDelete(Long id) {
        return repository.findById(id)
                .filter(ResourceDocument::isActive)
                .map(document -> {
                    document.setActive(false);
                    repository.save(document);
                    log.info("Soft-deleted {} {}/{} (id={}).", document.getKind(), document.getNamespace(),
                            document.getName(), id);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public <T extends ResourceSpec> T readSpec(ResourceDocument document, Class<T> specType) {
        Map<String, Object> json = document.getJson();
        Object spec = json != null ? json.get(SPEC_KEY) : null;
        try {
            return objectMapper.convertValue(spec != null ? spec : Map.of(), specType);
        } catch (IllegalArgumentException ex) {
            throw new ResourceFormatException("Malformed spec for %s %s/%s".formatted(document.getKind(),
                    document.getNamespace(), document.getName()), ex);
        }
    }
}
