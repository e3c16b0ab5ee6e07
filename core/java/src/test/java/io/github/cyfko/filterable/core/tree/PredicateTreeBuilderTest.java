package io.github.cyfko.filterable.core.tree;

import io.github.cyfko.filterable.core.api.Connector;
import io.github.cyfko.filterable.core.api.Op;
import io.github.cyfko.filterable.core.spi.QueryBuilder;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("PredicateTreeBuilder Tests")
class PredicateTreeBuilderTest {

    private static GroupNode sample() {
        PredicateTreeBuilder builder = new PredicateTreeBuilder(Connector.AND);
        builder.compare("age", Op.GTE, "18");
        builder.group(Connector.OR, group -> {
            group.membership("status", Op.IN, List.of("a", "b"));
            group.nullCheck("deleted_at", Op.IS_NULL);
        });
        builder.range("price", Op.RANGE, 1, 5);
        builder.relation("author", scoped -> scoped.pattern("country", Op.MATCHES, "%US%"));
        return builder.build();
    }

    @Test
    @DisplayName("Should record calls as nodes in order")
    void shouldRecordCalls() {
        assertEquals("AND(age >= '18', OR(status IN ['a', 'b'], deleted_at IS NULL), "
                + "price BETWEEN 1 AND 5, EXISTS author AND(country LIKE '%US%'))", sample().toString());
    }

    @Test
    @DisplayName("Should allow null items in membership values")
    void shouldAllowNullMembers() {
        MembershipNode node = new MembershipNode("status", Op.NOT_IN, Arrays.asList("a", null));

        assertEquals("status NOT IN ['a', null]", node.toString());
        assertThrows(UnsupportedOperationException.class, () -> node.values().add("b"));
    }

    @Test
    @DisplayName("Should reject a relation scope that is not an AND group")
    void shouldRejectOrScope() {
        assertThrows(IllegalArgumentException.class,
                () -> new RelationNode("author", new GroupNode(Connector.OR, List.of())));
    }

    @Test
    @DisplayName("Should replay a tree into another builder")
    @SuppressWarnings("unchecked")
    void shouldReplayTree() {
        QueryBuilder target = mock(QueryBuilder.class);
        doAnswer(invocation -> {
            ((Consumer<QueryBuilder>) invocation.getArgument(1)).accept(target);
            return null;
        }).when(target).group(any(), any());
        doAnswer(invocation -> {
            ((Consumer<QueryBuilder>) invocation.getArgument(1)).accept(target);
            return null;
        }).when(target).relation(any(), any());

        sample().applyTo(target);

        InOrder inOrder = inOrder(target);
        inOrder.verify(target).group(eq(Connector.AND), any());
        inOrder.verify(target).compare("age", Op.GTE, "18");
        inOrder.verify(target).group(eq(Connector.OR), any());
        inOrder.verify(target).membership("status", Op.IN, List.of("a", "b"));
        inOrder.verify(target).nullCheck("deleted_at", Op.IS_NULL);
        inOrder.verify(target).range("price", Op.RANGE, 1, 5);
        inOrder.verify(target).relation(eq("author"), any());
        inOrder.verify(target).pattern("country", Op.MATCHES, "%US%");
    }

    @Test
    @DisplayName("Should record into a fresh tree equal to the original")
    void shouldRoundTripThroughReplay() {
        GroupNode original = sample();
        PredicateTreeBuilder copy = new PredicateTreeBuilder(Connector.AND);

        original.children().forEach(child -> child.applyTo(copy));

        assertEquals(original, copy.build());
    }
}
