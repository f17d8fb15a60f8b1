package com.vuong.quickrepo.core.service;

import com.vuong.quickrepo.core.domain.repository.EntityRepository;
import jakarta.persistence.EntityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Looks up entity repositories by entity class or by kebab-case entity name
 * ({@code BookReview} is registered as {@code book-review}).
 */
public class EntityRepositoryRegistry {

    private static final Logger logger = LoggerFactory.getLogger(EntityRepositoryRegistry.class);

    private final Map<String, EntityRepository<?, ?, ?>> repositoryMap = new LinkedHashMap<>();
    private final Map<Class<?>, EntityRepository<?, ?, ?>> repositoryClassMap = new LinkedHashMap<>();
    private final Map<String, String> kebabCaseCache = new ConcurrentHashMap<>();

    /**
     * Registers the given repositories.
     * @param repositories the repositories, at most one per entity class
     * @throws IllegalStateException if two repositories manage the same entity class or entity name
     */
    public EntityRepositoryRegistry(Collection<? extends EntityRepository<?, ?, ?>> repositories) {
        for (EntityRepository<?, ?, ?> repository : repositories) {
            Class<?> entityClass = repository.getEntityClass();
            EntityRepository<?, ?, ?> existing = repositoryClassMap.putIfAbsent(entityClass, repository);
            if (existing != null) {
                throw new IllegalStateException("Duplicate repositories for entity " + entityClass.getName() + ": "
                        + existing.getClass().getName() + " and " + repository.getClass().getName());
            }
            String entityName = toKebabCase(entityClass.getSimpleName());
            EntityRepository<?, ?, ?> named = repositoryMap.putIfAbsent(entityName, repository);
            if (named != null) {
                throw new IllegalStateException("Entity name " + entityName + " is used by both "
                        + named.getEntityClass().getName() + " and " + entityClass.getName());
            }

            logger.info("Registered repository for entity: {} -> {}. Entity class: {}", entityName,
                    repository.getClass().getSimpleName(), entityClass.getName());
        }
    }

    /**
     * Retrieves the repository for the specified entity class.
     * @throws IllegalArgumentException if no repository is registered for the class
     */
    @SuppressWarnings("unchecked")
    public <C extends EntityManager, T, K> EntityRepository<C, T, K> getRepository(Class<T> entityClass) {
        EntityRepository<?, ?, ?> repository = repositoryClassMap.get(entityClass);
        if (repository == null) {
            throw new IllegalArgumentException("No repository found for entity: " + entityClass.getName());
        }
        return (EntityRepository<C, T, K>) repository;
    }

    /**
     * Retrieves the repository for the specified entity name.
     * @param entityName the entity name in kebab-case
     * @throws IllegalArgumentException if no repository is registered under the name
     */
    public EntityRepository<?, ?, ?> getRepository(String entityName) {
        EntityRepository<?, ?, ?> repository = repositoryMap.get(entityName);
        if (repository == null) {
            throw new IllegalArgumentException("No repository found for entity: " + entityName);
        }
        return repository;
    }

    public boolean hasRepository(Class<?> entityClass) {
        return repositoryClassMap.containsKey(entityClass);
    }

    public Set<String> getEntityNames() {
        return Collections.unmodifiableSet(repositoryMap.keySet());
    }

    String toKebabCase(String name) {
        return kebabCaseCache.computeIfAbsent(name,
                k -> k.replaceAll("([a-z0-9])([A-Z])", "$1-$2").toLowerCase());
    }
}
