package com.vuong.quickrepo.config;

import com.vuong.quickrepo.core.domain.repository.EntityRepository;
import com.vuong.quickrepo.core.service.EntityRepositoryRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.stream.Collectors;

/**
 * Auto-configuration class for QuickRepo.
 * Binds {@link QuickRepoProperties} and collects the application's entity repositories into a registry.
 */
@Configuration
@EnableConfigurationProperties(QuickRepoProperties.class)
public class QuickRepoAutoConfiguration {

    /**
     * Creates the registry of all {@link EntityRepository} beans in the context.
     * @param repositories the repository beans, in bean order
     * @return the registry
     */
    @Bean
    @ConditionalOnMissingBean(EntityRepositoryRegistry.class)
    public EntityRepositoryRegistry entityRepositoryRegistry(ObjectProvider<EntityRepository<?, ?, ?>> repositories) {
        return new EntityRepositoryRegistry(repositories.orderedStream().collect(Collectors.toList()));
    }
}
