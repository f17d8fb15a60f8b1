package com.vuong.quickrepo.core.domain.repository;

import com.vuong.quickrepo.config.QuickRepoProperties;
import com.vuong.quickrepo.core.context.BaseRepository;
import com.vuong.quickrepo.core.domain.query.EntityQuery;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityNotFoundException;
import jakarta.persistence.PersistenceUnitUtil;
import jakarta.persistence.metamodel.Attribute;
import jakarta.persistence.metamodel.EntityType;
import org.hibernate.Hibernate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.ReflectionUtils;

import java.lang.reflect.Field;
import java.lang.reflect.Member;
import java.lang.reflect.Method;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Base repository for one entity type with a key.
 * Subclasses usually only pass the entity class and a context supplier to a constructor:
 * <pre>
 * public class BookRepository extends BaseEntityRepository&lt;EntityManager, Book, Long&gt; {
 *     public BookRepository(EntityManagerFactory factory) {
 *         super(Book.class, factory::createEntityManager);
 *     }
 * }
 * </pre>
 * Self-managed operations open one context per call. Mutations attach exactly one pending operation and
 * commit once before the context is closed; the context is closed on every path, including failed commits.
 * Persistence exceptions reach the caller unchanged.
 * @param <C> the persistence context type
 * @param <T> the entity type
 * @param <K> the key type
 */
public abstract class BaseEntityRepository<C extends EntityManager, T, K> extends BaseRepository<C>
        implements EntityRepository<C, T, K> {

    private static final Logger logger = LoggerFactory.getLogger(BaseEntityRepository.class);

    private final Class<T> entityClass;

    protected BaseEntityRepository(Class<T> entityClass, Supplier<? extends C> contextSupplier) {
        this(entityClass, contextSupplier, false, false);
    }

    protected BaseEntityRepository(Class<T> entityClass, Supplier<? extends C> contextSupplier,
                                   QuickRepoProperties properties) {
        this(entityClass, contextSupplier, properties.isAutoDetectChanges(), properties.isLazyLoading());
    }

    /**
     * Constructs a repository.
     * @param entityClass the entity class managed by this repository
     * @param contextSupplier supplies new, unconfigured contexts
     * @param autoDetectChanges whether pending changes are detected and flushed before queries run
     * @param lazyLoading whether related objects of entities read in a self-managed context are loaded
     *                    before the context is closed
     */
    protected BaseEntityRepository(Class<T> entityClass, Supplier<? extends C> contextSupplier,
                                   boolean autoDetectChanges, boolean lazyLoading) {
        super(contextSupplier, autoDetectChanges, lazyLoading);
        this.entityClass = Objects.requireNonNull(entityClass, "Entity class cannot be null");
    }

    @Override
    public Class<T> getEntityClass() {
        return entityClass;
    }

    @Override
    public T get(K key, C context) {
        logger.debug("Finding entity of type: {} with key: {}", entityClass.getSimpleName(), key);
        return context.find(entityClass, key);
    }

    @Override
    public T get(K key) {
        return read(context -> loadAssociations(get(key, context), context));
    }

    @Override
    public Optional<T> find(K key, C context) {
        return Optional.ofNullable(get(key, context));
    }

    @Override
    public Optional<T> find(K key) {
        return Optional.ofNullable(get(key));
    }

    @Override
    public EntityQuery<T> getAll(C context) {
        return EntityQuery.of(context, entityClass);
    }

    @Override
    public List<T> getAll() {
        return getAll((UnaryOperator<EntityQuery<T>>) null);
    }

    @Override
    public List<T> getAll(UnaryOperator<EntityQuery<T>> filter) {
        return read(context -> {
            EntityQuery<T> result = getAll(context);
            if (filter != null) {
                result = filter.apply(result);
            }
            return materialize(result, context);
        });
    }

    @Override
    public <P> List<T> getAll(BiFunction<EntityQuery<T>, ? super P, EntityQuery<T>> filter, P param) {
        return read(context -> {
            EntityQuery<T> result = getAll(context);
            if (filter != null) {
                result = filter.apply(result, param);
            }
            return materialize(result, context);
        });
    }

    @Override
    public long count(C context) {
        return getAll(context).count();
    }

    @Override
    public long count() {
        return read(this::count);
    }

    @Override
    public T add(T entity, C context) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        logger.debug("Adding entity of type: {}", entityClass.getSimpleName());
        context.persist(entity);
        return entity;
    }

    @Override
    public T add(T entity) {
        T added = execute(context -> add(entity, context));
        logger.debug("Committed new entity of type: {}", entityClass.getSimpleName());
        return added;
    }

    @Override
    public T update(T entity, C context) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        logger.debug("Updating entity of type: {}", entityClass.getSimpleName());
        requireStored(entity, context);
        return context.merge(entity);
    }

    @Override
    public T update(T entity) {
        return execute(context -> update(entity, context));
    }

    @Override
    public void delete(T entity, C context) {
        Objects.requireNonNull(entity, "Entity cannot be null");
        logger.debug("Deleting entity of type: {}", entityClass.getSimpleName());
        context.remove(requireStored(entity, context));
    }

    @Override
    public void delete(T entity) {
        executeWithoutResult(context -> delete(entity, context));
    }

    /**
     * Returns the managed instance stored for the entity's key.
     * @throws EntityNotFoundException if no row is stored under that key
     */
    private T requireStored(T entity, C context) {
        if (context.contains(entity)) {
            return entity;
        }
        Object key = getPersistenceUnitUtil(context).getIdentifier(entity);
        T stored = key == null ? null : context.find(entityClass, key);
        if (stored == null) {
            throw new EntityNotFoundException("Not found entity of type " + entityClass.getSimpleName()
                    + " with key: " + key);
        }
        return stored;
    }

    private List<T> materialize(EntityQuery<T> query, C context) {
        List<T> entities = query.toList();
        entities.forEach(entity -> loadAssociations(entity, context));
        return entities;
    }

    /**
     * Loads the associations of an entity read through a self-managed context, when lazy loading is enabled.
     * Once that context closes, unloaded associations can no longer be navigated.
     */
    private T loadAssociations(T entity, C context) {
        if (entity == null || !isLazyLoadingEnabled()) {
            return entity;
        }
        EntityType<T> entityType = context.getMetamodel().entity(entityClass);
        PersistenceUnitUtil persistenceUnitUtil = getPersistenceUnitUtil(context);
        for (Attribute<? super T, ?> attribute : entityType.getAttributes()) {
            if (!attribute.isAssociation() && !attribute.isCollection()) {
                continue;
            }
            Object related = readAttribute(entity, attribute.getJavaMember());
            if (related != null && !persistenceUnitUtil.isLoaded(related)) {
                Hibernate.initialize(related);
            }
        }
        return entity;
    }

    private static Object readAttribute(Object entity, Member member) {
        if (member instanceof Field) {
            Field field = (Field) member;
            ReflectionUtils.makeAccessible(field);
            return ReflectionUtils.getField(field, entity);
        }
        if (member instanceof Method) {
            Method getter = (Method) member;
            ReflectionUtils.makeAccessible(getter);
            return ReflectionUtils.invokeMethod(getter, entity);
        }
        return null;
    }

    private static PersistenceUnitUtil getPersistenceUnitUtil(EntityManager context) {
        return context.getEntityManagerFactory().getPersistenceUnitUtil();
    }
}
