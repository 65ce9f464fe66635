package com.eventorder.filter.service.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.TreeSet;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SortableEventTest {

    @Test
    @DisplayName("Identity is aggregate id and version, the type tag is ignored")
    void equalityIgnoresType() {
        SortableEvent a = SortableEvent.of(new TypedEvent("agg-1", 3, "A"));
        SortableEvent b = SortableEvent.of(new TypedEvent("agg-1", 3, "B"));
        SortableEvent other = SortableEvent.of(new TypedEvent("agg-2", 3, "A"));

        assertThat(a).isEqualTo(b).hasSameHashCodeAs(b);
        assertThat(a).isNotEqualTo(other);
    }

    @Test
    @DisplayName("Orders by aggregate id, then version")
    void ordering() {
        TreeSet<SortableEvent> set = new TreeSet<>(List.of(
                SortableEvent.of(new TypedEvent("b", 1, "X")),
                SortableEvent.of(new TypedEvent("a", 10, "X")),
                SortableEvent.of(new TypedEvent("a", 2, "X"))
        ));

        assertThat(set).extracting(SortableEvent::toString)
                .containsExactly("a@2[X]", "a@10[X]", "b@1[X]");
    }

    @Test
    void unwrapsOriginalEvent() {
        TypedEvent event = new TypedEvent("agg-1", 7, "A");

        SortableEvent sortable = SortableEvent.of(event);

        assertThat(sortable.value()).isSameAs(event);
        assertThat(sortable.aggregateId()).isEqualTo("agg-1");
        assertThat(sortable.version()).isEqualTo(7);
    }

    @Test
    void versionsStartAtOne() {
        assertThatThrownBy(() -> new TypedEvent("agg-1", 0, "A"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
