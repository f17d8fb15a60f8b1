package com.vuong.quickrepo.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for QuickRepo repositories.
 */
@ConfigurationProperties(prefix = "quickrepo")
@Getter
@Setter
public class QuickRepoProperties {

    /**
     * Detect and flush pending changes automatically before queries run.
     * When false, changes are only detected when the unit of work commits.
     */
    private boolean autoDetectChanges = false;

    /**
     * Load the related objects of entities read through a self-managed context
     * before that context is closed.
     */
    private boolean lazyLoading = false;
}
