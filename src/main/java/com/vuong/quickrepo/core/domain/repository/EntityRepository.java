package com.vuong.quickrepo.core.domain.repository;

import com.vuong.quickrepo.core.context.ContextFactory;
import com.vuong.quickrepo.core.domain.query.EntityQuery;
import jakarta.persistence.EntityManager;

import java.util.List;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.UnaryOperator;

/**
 * CRUD operations for one entity type.
 * Every operation comes in two forms: one runs against a caller-supplied context and leaves committing
 * and closing to the caller, the other creates its own context, commits mutations and closes it before returning.
 * @param <C> the persistence context type
 * @param <T> the entity type
 * @param <K> the key type
 */
public interface EntityRepository<C extends EntityManager, T, K> extends ContextFactory<C> {

    /**
     * Returns the entity class managed by this repository.
     * @return the entity class
     */
    Class<T> getEntityClass();

    /**
     * Finds the entity with the given key.
     * @param key the entity key
     * @param context the context to read from
     * @return the entity, or {@code null} if none matches
     */
    T get(K key, C context);

    /**
     * Finds the entity with the given key in a new context.
     * @param key the entity key
     * @return the entity, or {@code null} if none matches
     */
    T get(K key);

    Optional<T> find(K key, C context);

    Optional<T> find(K key);

    /**
     * Returns a lazy view over all entities of this type. The view is bound to the given context
     * and runs nothing until one of its terminal operations is called.
     * @param context the context the view reads from
     * @return the view
     */
    EntityQuery<T> getAll(C context);

    /**
     * Loads all entities of this type in a new context.
     * @return every stored entity
     */
    List<T> getAll();

    /**
     * Loads the entities selected by the filter in a new context.
     * @param filter narrows or orders the view; {@code null} means no filter
     * @return the filtered entities in the order the filter defines
     */
    List<T> getAll(UnaryOperator<EntityQuery<T>> filter);

    /**
     * Loads the entities selected by a filter that takes an extra parameter.
     * @param filter narrows or orders the view; {@code null} means no filter
     * @param param passed to the filter
     * @param <P> the parameter type
     * @return the filtered entities in the order the filter defines
     */
    <P> List<T> getAll(BiFunction<EntityQuery<T>, ? super P, EntityQuery<T>> filter, P param);

    long count(C context);

    long count();

    /**
     * Marks the entity as added in the given context.
     * @param entity the new entity
     * @param context the context tracking the entity
     * @return the tracked entity
     */
    T add(T entity, C context);

    /**
     * Adds the entity and commits in a new context.
     * @param entity the new entity
     * @return the stored entity
     */
    T add(T entity);

    /**
     * Marks the entity as modified in the given context.
     * @param entity the entity carrying the new state
     * @param context the context tracking the entity
     * @return the tracked entity
     * @throws jakarta.persistence.EntityNotFoundException if no stored entity has the same key
     */
    T update(T entity, C context);

    /**
     * Updates the entity and commits in a new context.
     * @param entity the entity carrying the new state
     * @return the stored entity
     * @throws jakarta.persistence.EntityNotFoundException if no stored entity has the same key
     */
    T update(T entity);

    /**
     * Marks the entity as deleted in the given context.
     * @param entity the entity to delete
     * @param context the context tracking the entity
     * @throws jakarta.persistence.EntityNotFoundException if no stored entity has the same key
     */
    void delete(T entity, C context);

    /**
     * Deletes the entity and commits in a new context.
     * @param entity the entity to delete
     * @throws jakarta.persistence.EntityNotFoundException if no stored entity has the same key
     */
    void delete(T entity);
}
