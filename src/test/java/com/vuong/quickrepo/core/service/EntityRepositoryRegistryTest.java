package com.vuong.quickrepo.core.service;

import com.vuong.quickrepo.core.domain.repository.EntityRepository;
import com.vuong.quickrepo.support.Author;
import com.vuong.quickrepo.support.AuthorRepository;
import com.vuong.quickrepo.support.Book;
import com.vuong.quickrepo.support.BookRepository;
import org.hibernate.Session;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

@DisplayName("EntityRepositoryRegistry Tests")
class EntityRepositoryRegistryTest {

    private BookRepository bookRepository;
    private AuthorRepository authorRepository;
    private EntityRepositoryRegistry registry;

    @BeforeEach
    void setUp() {
        Supplier<Session> sessions = () -> mock(Session.class);
        bookRepository = new BookRepository(sessions);
        authorRepository = new AuthorRepository(sessions);
        registry = new EntityRepositoryRegistry(List.of(bookRepository, authorRepository));
    }

    @Test
    @DisplayName("Should find repository by entity class")
    void shouldFindByEntityClass() {
        // When
        EntityRepository<Session, Book, Long> found = registry.getRepository(Book.class);

        // Then
        assertThat(found).isSameAs(bookRepository);
        assertThat(registry.hasRepository(Author.class)).isTrue();
        assertThat(registry.hasRepository(String.class)).isFalse();
    }

    @Test
    @DisplayName("Should find repository by kebab-case entity name")
    void shouldFindByEntityName() {
        assertThat(registry.getRepository("book")).isSameAs(bookRepository);
        assertThat(registry.getRepository("author")).isSameAs(authorRepository);
        assertThat(registry.getEntityNames()).containsExactly("book", "author");
    }

    @Test
    @DisplayName("Should reject unknown entities")
    void shouldRejectUnknownEntity() {
        assertThatThrownBy(() -> registry.getRepository(String.class))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No repository found for entity: java.lang.String");
        assertThatThrownBy(() -> registry.getRepository("publisher"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("No repository found for entity: publisher");
    }

    @Test
    @DisplayName("Should reject two repositories for the same entity")
    void shouldRejectDuplicateRepositories() {
        // Given
        BookRepository another = new BookRepository(() -> mock(Session.class));

        // When / Then
        assertThatThrownBy(() -> new EntityRepositoryRegistry(List.of(bookRepository, another)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining(Book.class.getName());
    }

    @Test
    @DisplayName("Should reject two entities sharing a simple class name")
    void shouldRejectDuplicateEntityNames() {
        // Given
        EntityRepository<?, ?, ?> utilDates = mock(EntityRepository.class);
        EntityRepository<?, ?, ?> sqlDates = mock(EntityRepository.class);
        doReturn(java.util.Date.class).when(utilDates).getEntityClass();
        doReturn(java.sql.Date.class).when(sqlDates).getEntityClass();

        // When / Then
        assertThatThrownBy(() -> new EntityRepositoryRegistry(List.of(utilDates, sqlDates)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Entity name date is used by both java.util.Date and java.sql.Date");
    }

    @Test
    @DisplayName("Should convert class names to kebab-case")
    void shouldConvertToKebabCase() {
        assertThat(registry.toKebabCase("BookReview")).isEqualTo("book-review");
        assertThat(registry.toKebabCase("Isbn13Code")).isEqualTo("isbn13-code");
        assertThat(registry.toKebabCase("Book")).isEqualTo("book");
    }
}
