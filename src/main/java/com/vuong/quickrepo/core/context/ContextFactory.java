package com.vuong.quickrepo.core.context;

import jakarta.persistence.EntityManager;

/**
 * Creates configured persistence contexts.
 * @param <C> the persistence context type
 */
public interface ContextFactory<C extends EntityManager> {

    /**
     * Creates a new persistence context using the configured settings.
     * The caller owns the returned context and must close it, preferably with try-with-resources.
     * @return a newly opened context
     */
    C createContext();
}
