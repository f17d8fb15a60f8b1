package com.vuong.quickrepo.annotation;

import com.vuong.quickrepo.config.QuickRepoAutoConfiguration;
import org.springframework.context.annotation.Import;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation to enable QuickRepo in a Spring application that does not rely on auto-configuration.
 * This imports {@link QuickRepoAutoConfiguration}, which binds the {@code quickrepo.*} properties
 * and registers the {@link com.vuong.quickrepo.core.service.EntityRepositoryRegistry}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Import({QuickRepoAutoConfiguration.class})
public @interface EnableQuickRepo {
}
