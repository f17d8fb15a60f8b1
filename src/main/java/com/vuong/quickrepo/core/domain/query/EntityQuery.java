package com.vuong.quickrepo.core.domain.query;

import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.query.QueryUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Lazy, immutable view over the stored entities of one type, bound to a persistence context.
 * Operators return a new view; the database is only queried by {@link #toList()}, {@link #stream()},
 * {@link #first()} and {@link #count()}, which must run while the context is open.
 * @param <T> the entity type
 */
public final class EntityQuery<T> {

    private final EntityManager entityManager;
    private final Class<T> entityClass;
    private final Specification<T> specification;
    private final Sort sort;
    private final int offset;
    private final Integer maxResults;

    private EntityQuery(EntityManager entityManager, Class<T> entityClass, Specification<T> specification,
                        Sort sort, int offset, Integer maxResults) {
        this.entityManager = entityManager;
        this.entityClass = entityClass;
        this.specification = specification;
        this.sort = sort;
        this.offset = offset;
        this.maxResults = maxResults;
    }

    /**
     * Creates an unfiltered, unordered view over all entities of the given type.
     * @param entityManager the context the view reads from
     * @param entityClass the entity class
     * @param <T> the entity type
     * @return the view
     */
    public static <T> EntityQuery<T> of(EntityManager entityManager, Class<T> entityClass) {
        Objects.requireNonNull(entityManager, "Entity manager cannot be null");
        Objects.requireNonNull(entityClass, "Entity class cannot be null");
        return new EntityQuery<>(entityManager, entityClass, null, Sort.unsorted(), 0, null);
    }

    public Class<T> getEntityClass() {
        return entityClass;
    }

    /**
     * Narrows the view. Conditions from repeated calls are combined with AND.
     * @param condition the condition, ignored when {@code null}
     * @return the narrowed view
     * @throws IllegalStateException if the view is already paged with skip or limit
     */
    public EntityQuery<T> where(Specification<T> condition) {
        if (condition == null) {
            return this;
        }
        requireUnpaged("where");
        Specification<T> combined = specification == null ? condition : specification.and(condition);
        return new EntityQuery<>(entityManager, entityClass, combined, sort, offset, maxResults);
    }

    /**
     * Orders the view. Orders from repeated calls are appended to the existing ones.
     * @param order the order to apply
     * @return the ordered view
     * @throws IllegalStateException if the view is already paged with skip or limit
     */
    public EntityQuery<T> orderBy(Sort order) {
        Objects.requireNonNull(order, "Sort cannot be null");
        requireUnpaged("orderBy");
        return new EntityQuery<>(entityManager, entityClass, specification, sort.and(order), offset, maxResults);
    }

    public EntityQuery<T> orderBy(Sort.Direction direction, String... properties) {
        return orderBy(Sort.by(direction, properties));
    }

    /**
     * Skips the first {@code count} entities of the view. A skip after a limit skips within the limited
     * entities, so {@code limit(5).skip(2)} returns at most three.
     * @param count number of entities to skip
     * @return the view without the skipped entities
     * @throws IllegalArgumentException if count is negative
     */
    public EntityQuery<T> skip(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Skip count cannot be negative: " + count);
        }
        Integer remaining = maxResults == null ? null : Math.max(0, maxResults - count);
        return new EntityQuery<>(entityManager, entityClass, specification, sort, offset + count, remaining);
    }

    /**
     * Caps the number of entities the view returns.
     * @param count maximum number of entities
     * @return the capped view
     * @throws IllegalArgumentException if count is negative
     */
    public EntityQuery<T> limit(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("Limit cannot be negative: " + count);
        }
        int capped = maxResults == null ? count : Math.min(maxResults, count);
        return new EntityQuery<>(entityManager, entityClass, specification, sort, offset, capped);
    }

    public List<T> toList() {
        if (isEmptyPage()) {
            return new ArrayList<>();
        }
        return createQuery().getResultList();
    }

    /**
     * Streams the entities of the view. The stream holds database resources until it is closed.
     * @return the entities of the view
     */
    public Stream<T> stream() {
        if (isEmptyPage()) {
            return Stream.empty();
        }
        return createQuery().getResultStream();
    }

    public Optional<T> first() {
        return limit(1).toList().stream().findFirst();
    }

    /**
     * Counts the entities the view would return, taking skip and limit into account.
     * Entities matched through several joined rows are counted once, as {@link #toList()} returns them once.
     * @return the number of entities
     */
    public long count() {
        if (isEmptyPage()) {
            return 0;
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<T> root = query.from(entityClass);
        applyCondition(root, query, cb);
        query.select(query.isDistinct() ? cb.countDistinct(root) : cb.count(root));
        query.distinct(false);
        long total = entityManager.createQuery(query).getSingleResult();

        long remaining = Math.max(0, total - offset);
        return maxResults == null ? remaining : Math.min(remaining, maxResults);
    }

    private boolean isEmptyPage() {
        return maxResults != null && maxResults == 0;
    }

    private void requireUnpaged(String operator) {
        if (offset > 0 || maxResults != null) {
            throw new IllegalStateException("Cannot apply " + operator + " after skip or limit");
        }
    }

    private TypedQuery<T> createQuery() {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<T> query = cb.createQuery(entityClass);
        Root<T> root = query.from(entityClass);
        query.select(root);
        applyCondition(root, query, cb);
        if (sort.isSorted()) {
            query.orderBy(QueryUtils.toOrders(sort, root, cb));
        }

        TypedQuery<T> typedQuery = entityManager.createQuery(query);
        if (offset > 0) {
            typedQuery.setFirstResult(offset);
        }
        if (maxResults != null) {
            typedQuery.setMaxResults(maxResults);
        }
        return typedQuery;
    }

    private void applyCondition(Root<T> root, CriteriaQuery<?> query, CriteriaBuilder cb) {
        if (specification == null) {
            return;
        }
        Predicate predicate = specification.toPredicate(root, query, cb);
        if (predicate != null) {
            query.where(predicate);
        }
    }
}
