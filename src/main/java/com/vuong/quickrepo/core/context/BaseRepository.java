package com.vuong.quickrepo.core.context;

import com.vuong.quickrepo.config.QuickRepoProperties;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.FlushModeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Repository base that is not bound to an entity type. It wraps a persistence context
 * supplier and applies the change detection and lazy loading settings to every context it creates.
 * @param <C> the persistence context type
 */
public abstract class BaseRepository<C extends EntityManager> implements ContextFactory<C> {

    /** Context property recording whether changes are detected automatically before queries. */
    public static final String AUTO_DETECT_CHANGES_PROPERTY = "quickrepo.auto-detect-changes";
    /** Context property recording whether lazy related-object loading is enabled. */
    public static final String LAZY_LOADING_PROPERTY = "quickrepo.lazy-loading";

    private static final Logger logger = LoggerFactory.getLogger(BaseRepository.class);

    private final Supplier<? extends C> contextSupplier;
    private final boolean autoDetectChangesEnabled;
    private final boolean lazyLoadingEnabled;

    /**
     * Constructs a repository with change detection and lazy loading disabled.
     * @param contextSupplier supplies new, unconfigured contexts
     */
    protected BaseRepository(Supplier<? extends C> contextSupplier) {
        this(contextSupplier, false, false);
    }

    /**
     * Constructs a repository taking its settings from bound configuration properties.
     * @param contextSupplier supplies new, unconfigured contexts
     * @param properties the quickrepo configuration properties
     */
    protected BaseRepository(Supplier<? extends C> contextSupplier, QuickRepoProperties properties) {
        this(contextSupplier, properties.isAutoDetectChanges(), properties.isLazyLoading());
    }

    /**
     * Constructs a repository.
     * @param contextSupplier supplies new, unconfigured contexts
     * @param autoDetectChanges whether pending changes are detected and flushed before queries run
     * @param lazyLoading whether related objects of entities read in a self-managed context are loaded
     */
    protected BaseRepository(Supplier<? extends C> contextSupplier, boolean autoDetectChanges, boolean lazyLoading) {
        this.contextSupplier = Objects.requireNonNull(contextSupplier, "Context supplier cannot be null");
        this.autoDetectChangesEnabled = autoDetectChanges;
        this.lazyLoadingEnabled = lazyLoading;
    }

    protected boolean isAutoDetectChangesEnabled() {
        return autoDetectChangesEnabled;
    }

    protected boolean isLazyLoadingEnabled() {
        return lazyLoadingEnabled;
    }

    @Override
    public C createContext() {
        C context = Objects.requireNonNull(contextSupplier.get(), "Context supplier returned null");
        context.setFlushMode(autoDetectChangesEnabled ? FlushModeType.AUTO : FlushModeType.COMMIT);
        context.setProperty(AUTO_DETECT_CHANGES_PROPERTY, autoDetectChangesEnabled);
        context.setProperty(LAZY_LOADING_PROPERTY, lazyLoadingEnabled);
        logger.debug("Created persistence context {} (autoDetectChanges={}, lazyLoading={})",
                context.getClass().getSimpleName(), autoDetectChangesEnabled, lazyLoadingEnabled);
        return context;
    }

    /**
     * Runs a unit of work in a new context and transaction. The transaction is committed when the
     * work returns normally and rolled back when it throws. The context is closed in both cases.
     * @param work the operations to run against the context
     * @param <R> the result type
     * @return whatever the work returned
     */
    public <R> R execute(Function<? super C, ? extends R> work) {
        try (C context = createContext()) {
            EntityTransaction transaction = context.getTransaction();
            transaction.begin();
            try {
                R result = work.apply(context);
                transaction.commit();
                return result;
            } catch (RuntimeException e) {
                rollbackIfActive(transaction, e);
                throw e;
            }
        }
    }

    /**
     * Runs a unit of work that produces no result.
     * @param work the operations to run against the context
     * @see #execute(Function)
     */
    public void executeWithoutResult(Consumer<? super C> work) {
        execute(context -> {
            work.accept(context);
            return null;
        });
    }

    /**
     * Runs read-only work in a new context without a transaction, closing the context afterwards.
     */
    protected <R> R read(Function<? super C, ? extends R> work) {
        try (C context = createContext()) {
            return work.apply(context);
        }
    }

    private static void rollbackIfActive(EntityTransaction transaction, RuntimeException cause) {
        if (!transaction.isActive()) {
            return;
        }
        logger.warn("Rolling back unit of work after failure: {}", cause.getMessage());
        try {
            transaction.rollback();
        } catch (RuntimeException rollbackFailure) {
            cause.addSuppressed(rollbackFailure);
        }
    }
}
