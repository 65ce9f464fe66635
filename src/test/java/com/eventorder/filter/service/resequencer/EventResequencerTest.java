package com.eventorder.filter.service.resequencer;

import com.eventorder.filter.service.filter.BloomFilter;
import com.eventorder.filter.service.model.AggregateEvent;
import com.eventorder.filter.service.model.SortableEvent;
import com.eventorder.filter.service.model.TypedEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.LongStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EventResequencerTest {

    private static final String AGGREGATE = "order-42";

    private EventResequencer resequencer;
    private List<Long> accepted;

    @BeforeEach
    void setUp() {
        resequencer = new EventResequencer(
                AGGREGATE,
                BloomFilter.create(SortableEvent.class, 1024, ResequencerFactory::hashSortable),
                ResequencerListener.NONE,
                0);
        accepted = new ArrayList<>();
    }

    private BookKeepingChange insert(long version) {
        return resequencer.insert(new TypedEvent(AGGREGATE, version, "A"), e -> accepted.add(e.version()));
    }

    @Nested
    @DisplayName("Classification")
    class Classification {

        @Test
        void firstEventIsNext() {
            assertThat(insert(1)).isEqualTo(BookKeepingChange.NEXT);
            assertThat(accepted).containsExactly(1L);
            assertThat(resequencer.state().maxAcceptedItem()).isEqualTo(1);
        }

        @Test
        @DisplayName("Replayed versions are dropped and counted")
        void duplicates() {
            insert(1);
            insert(2);

            assertThat(insert(1)).isEqualTo(BookKeepingChange.DUPLICATE);
            assertThat(insert(2)).isEqualTo(BookKeepingChange.DUPLICATE);

            ResequencerState state = resequencer.state();
            assertThat(state.duplicates()).isEqualTo(2);
            assertThat(state.maxAcceptedItem()).isEqualTo(2);
            assertThat(accepted).containsExactly(1L, 2L);
        }

        @Test
        @DisplayName("Events ahead of a gap are buffered, not emitted")
        void futureIsBuffered() {
            insert(1);
            assertThat(insert(4)).isEqualTo(BookKeepingChange.FUTURE);
            assertThat(insert(5)).isEqualTo(BookKeepingChange.FUTURE);
            assertThat(insert(6)).isEqualTo(BookKeepingChange.FUTURE);

            ResequencerState state = resequencer.state();
            assertThat(state.maxAcceptedItem()).isEqualTo(1);
            assertThat(state.minPendingItem()).hasValue(4);
            assertThat(state.pendingCount()).isEqualTo(3);
            assertThat(accepted).containsExactly(1L);
        }

        @Test
        @DisplayName("The version that fills the last gap releases the buffer")
        void gapClosed() {
            insert(1);
            insert(3);

            assertThat(insert(2)).isEqualTo(BookKeepingChange.GAP_CLOSED);
            assertThat(accepted).containsExactly(1L, 2L, 3L);
            assertThat(resequencer.state().hasPending()).isFalse();
        }
    }

    @Nested
    @DisplayName("Gap filling")
    class GapFilling {

        @Test
        @DisplayName("1,4,5 then 2,3 releases 4 and 5 after 3")
        void fillInOrder() {
            insert(1);
            insert(4);
            insert(5);

            assertThat(insert(2)).isEqualTo(BookKeepingChange.NEXT);
            assertThat(resequencer.state().minPendingItem()).hasValue(4);

            assertThat(insert(3)).isEqualTo(BookKeepingChange.GAP_CLOSED);
            assertThat(accepted).containsExactly(1L, 2L, 3L, 4L, 5L);

            ResequencerState state = resequencer.state();
            assertThat(state.maxAcceptedItem()).isEqualTo(5);
            assertThat(state.minPendingItem()).isEmpty();
            assertThat(state.duplicates()).isZero();
        }

        @Test
        @DisplayName("1,4,5 then 3,2 releases everything on 2")
        void fillInReverse() {
            insert(1);
            insert(4);
            insert(5);

            assertThat(insert(3)).isEqualTo(BookKeepingChange.FUTURE);
            assertThat(resequencer.state().minPendingItem()).hasValue(3);

            assertThat(insert(2)).isEqualTo(BookKeepingChange.GAP_CLOSED);
            assertThat(accepted).containsExactly(1L, 2L, 3L, 4L, 5L);
            assertThat(resequencer.state().minPendingItem()).isEmpty();
        }

        @Test
        @DisplayName("Draining stops at the next gap")
        void drainStopsAtNextGap() {
            insert(1);
            insert(3);
            insert(4);
            insert(7);

            insert(2);

            ResequencerState state = resequencer.state();
            assertThat(accepted).containsExactly(1L, 2L, 3L, 4L);
            assertThat(state.maxAcceptedItem()).isEqualTo(4);
            assertThat(state.minPendingItem()).hasValue(7);
            assertThat(state.pendingCount()).isEqualTo(1);
        }

        @Test
        @DisplayName("The largest representable version is reported as pending")
        void maxVersionFuture() {
            insert(1);

            assertThat(insert(Long.MAX_VALUE)).isEqualTo(BookKeepingChange.FUTURE);

            ResequencerState state = resequencer.state();
            assertThat(state.pendingCount()).isEqualTo(1);
            assertThat(state.minPendingItem()).hasValue(Long.MAX_VALUE);

            assertThat(insert(3)).isEqualTo(BookKeepingChange.FUTURE);
            assertThat(resequencer.state().minPendingItem()).hasValue(3);

            insert(2);
            assertThat(accepted).containsExactly(1L, 2L, 3L);
            assertThat(resequencer.state().minPendingItem()).hasValue(Long.MAX_VALUE);
        }

        @Test
        @DisplayName("Buffering the same future twice keeps one copy")
        void idempotentFutures() {
            insert(1);
            insert(3);
            insert(3);

            assertThat(resequencer.state().pendingCount()).isEqualTo(1);
            assertThat(resequencer.state().duplicates()).isZero();

            insert(2);
            assertThat(accepted).containsExactly(1L, 2L, 3L);
        }
    }

    @ParameterizedTest(name = "seed {0}")
    @ValueSource(longs = {1L, 7L, 42L, 1234L, 98765L})
    @DisplayName("Any arrival order yields 1..n exactly once, in order")
    void anyPermutationIsResequenced(long seed) {
        List<Long> versions = new ArrayList<>(LongStream.rangeClosed(1, 200).boxed().toList());
        Collections.shuffle(versions, new Random(seed));
        // sprinkle replays
        versions.addAll(new ArrayList<>(versions.subList(0, 20)));
        Collections.shuffle(versions, new Random(seed + 1));

        versions.forEach(EventResequencerTest.this::insert);

        assertThat(accepted).containsExactlyElementsOf(LongStream.rangeClosed(1, 200).boxed().toList());
        ResequencerState state = resequencer.state();
        assertThat(state.maxAcceptedItem()).isEqualTo(200);
        assertThat(state.minPendingItem()).isEmpty();
        assertThat(state.pendingCount()).isZero();
        assertThat(state.duplicates()).isBetween(0L, 20L);
    }

    @Test
    void onlyNextAndGapClosedAreAcceptances() {
        assertThat(BookKeepingChange.NEXT.isAccepted()).isTrue();
        assertThat(BookKeepingChange.GAP_CLOSED.isAccepted()).isTrue();
        assertThat(BookKeepingChange.DUPLICATE.isAccepted()).isFalse();
        assertThat(BookKeepingChange.FUTURE.isAccepted()).isFalse();
    }

    @Test
    @DisplayName("Works without a membership filter")
    void withoutFilter() {
        EventResequencer plain = new EventResequencer(AGGREGATE);
        List<AggregateEvent> out = new ArrayList<>();

        plain.insert(new TypedEvent(AGGREGATE, 2, "A"), out::add);
        plain.insert(new TypedEvent(AGGREGATE, 2, "A"), out::add);
        plain.insert(new TypedEvent(AGGREGATE, 1, "B"), out::add);

        assertThat(out).extracting(AggregateEvent::version).containsExactly(1L, 2L);
        assertThat(out).extracting(AggregateEvent::type).containsExactly("B", "A");
        assertThat(plain.state().filterTruthiness()).isZero();
    }

    @Test
    void rejectsOtherAggregates() {
        assertThatThrownBy(() -> resequencer.insert(new TypedEvent("other", 1, "A"), e -> { }))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("other");
    }

    @Test
    @DisplayName("Listener hears duplicates, futures and the pending threshold once")
    void listenerCallbacks() {
        AtomicInteger duplicates = new AtomicInteger();
        AtomicInteger futures = new AtomicInteger();
        AtomicInteger thresholds = new AtomicInteger();
        EventResequencer watched = new EventResequencer(AGGREGATE, null, new ResequencerListener() {
            @Override
            public void onDuplicate(String aggregateId, long version) {
                duplicates.incrementAndGet();
            }

            @Override
            public void onFuture(String aggregateId, long version) {
                futures.incrementAndGet();
            }

            @Override
            public void onPendingThresholdExceeded(String aggregateId, int pendingCount) {
                thresholds.incrementAndGet();
            }
        }, 3);

        watched.insert(new TypedEvent(AGGREGATE, 1, "A"), e -> { });
        watched.insert(new TypedEvent(AGGREGATE, 1, "A"), e -> { });
        for (long v = 3; v <= 8; v++) {
            watched.insert(new TypedEvent(AGGREGATE, v, "A"), e -> { });
        }

        assertThat(duplicates).hasValue(1);
        assertThat(futures).hasValue(6);
        assertThat(thresholds).hasValue(1);
        assertThat(watched.pendingCount()).isEqualTo(6);
    }
}
