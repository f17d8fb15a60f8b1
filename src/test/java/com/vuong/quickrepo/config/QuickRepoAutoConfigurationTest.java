package com.vuong.quickrepo.config;

import com.vuong.quickrepo.core.service.EntityRepositoryRegistry;
import com.vuong.quickrepo.support.Book;
import com.vuong.quickrepo.support.BookRepository;
import org.hibernate.SessionFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("QuickRepoAutoConfiguration Tests")
class QuickRepoAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(QuickRepoAutoConfiguration.class));

    @Test
    @DisplayName("Should bind properties with both settings disabled by default")
    void shouldBindDefaultProperties() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(QuickRepoProperties.class);
            QuickRepoProperties properties = context.getBean(QuickRepoProperties.class);
            assertThat(properties.isAutoDetectChanges()).isFalse();
            assertThat(properties.isLazyLoading()).isFalse();
        });
    }

    @Test
    @DisplayName("Should bind quickrepo properties")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues("quickrepo.auto-detect-changes=true", "quickrepo.lazy-loading=true")
                .run(context -> {
                    QuickRepoProperties properties = context.getBean(QuickRepoProperties.class);
                    assertThat(properties.isAutoDetectChanges()).isTrue();
                    assertThat(properties.isLazyLoading()).isTrue();
                });
    }

    @Test
    @DisplayName("Should register repository beans in the registry")
    void shouldRegisterRepositoryBeans() {
        SessionFactory sessionFactory = mock(SessionFactory.class);
        contextRunner
                .withBean(BookRepository.class, () -> new BookRepository(sessionFactory::openSession))
                .run(context -> {
                    assertThat(context).hasSingleBean(EntityRepositoryRegistry.class);
                    EntityRepositoryRegistry registry = context.getBean(EntityRepositoryRegistry.class);
                    assertThat(registry.getRepository(Book.class)).isSameAs(context.getBean(BookRepository.class));
                    assertThat(registry.getEntityNames()).containsExactly("book");
                });
    }

    @Test
    @DisplayName("Should back off when an application registry is defined")
    void shouldBackOffForCustomRegistry() {
        EntityRepositoryRegistry custom = new EntityRepositoryRegistry(java.util.List.of());
        contextRunner
                .withBean(EntityRepositoryRegistry.class, () -> custom)
                .run(context -> assertThat(context.getBean(EntityRepositoryRegistry.class)).isSameAs(custom));
    }
}
