package io.github.cyfko.filterable.jpa.utils;

import io.github.cyfko.filterable.core.exception.FilterDefinitionException;
import io.github.cyfko.filterable.jpa.entities.Book;
import jakarta.persistence.criteria.From;
import jakarta.persistence.criteria.Join;
import jakarta.persistence.criteria.JoinType;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.metamodel.Attribute;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("PathResolverUtils Test")
@SuppressWarnings({"rawtypes", "unchecked"})
class PathResolverUtilsTest {

    @Test
    @DisplayName("Should resolve an existing attribute")
    void shouldResolveAttribute() {
        From from = mock(From.class);
        Path title = mock(Path.class);
        doReturn(title).when(from).get("title");

        assertSame(title, PathResolverUtils.resolveAttribute(from, "title"));
    }

    @Test
    @DisplayName("Should report an unknown attribute as a definition error")
    void shouldReportUnknownAttribute() {
        From from = mock(From.class);
        doThrow(new IllegalArgumentException("no attribute")).when(from).get("isbn");
        doReturn(Book.class).when(from).getJavaType();

        FilterDefinitionException ex = assertThrows(FilterDefinitionException.class,
                () -> PathResolverUtils.resolveAttribute(from, "isbn"));
        assertEquals("Attribute 'isbn' not found in Book", ex.getMessage());
        assertInstanceOf(IllegalArgumentException.class, ex.getCause());
    }

    @Test
    @DisplayName("Should inner join every segment of a relation path")
    void shouldJoinEverySegment() {
        From root = mock(From.class);
        Join author = mock(Join.class);
        Join profile = mock(Join.class);
        doReturn(Set.of()).when(root).getJoins();
        doReturn(Set.of()).when(author).getJoins();
        doReturn(author).when(root).join("author", JoinType.INNER);
        doReturn(profile).when(author).join("profile", JoinType.INNER);

        assertSame(profile, PathResolverUtils.joinPath(root, "author.profile"));
        verify(root).join("author", JoinType.INNER);
        verify(author).join("profile", JoinType.INNER);
    }

    @Test
    @DisplayName("Should reuse an existing join")
    void shouldReuseExistingJoin() {
        From root = mock(From.class);
        Join author = mock(Join.class);
        Attribute attribute = mock(Attribute.class);
        doReturn("author").when(attribute).getName();
        doReturn(attribute).when(author).getAttribute();
        doReturn(Set.of(author)).when(root).getJoins();

        assertSame(author, PathResolverUtils.joinPath(root, "author"));
        verify(root, never()).join(anyString(), any(JoinType.class));
    }

    @Test
    @DisplayName("Should reject a blank relation path")
    void shouldRejectBlankPath() {
        From root = mock(From.class);

        assertThrows(IllegalArgumentException.class, () -> PathResolverUtils.joinPath(root, " "));
    }
}
