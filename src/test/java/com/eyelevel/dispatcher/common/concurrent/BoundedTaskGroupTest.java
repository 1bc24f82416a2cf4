package com.eyelevel.dispatcher.common.concurrent;

import com.eyelevel.dispatcher.exception.TaskGroupException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedTaskGroupTest {

    @Test
    void awaitAll_neverRunsMoreUnitsThanWorkers() {
        AtomicInteger running = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();

        try (BoundedTaskGroup group = new BoundedTaskGroup("bounded", 2)) {
            for (int i = 0; i < 8; i++) {
                group.submit("item-" + i, () -> {
                    int now = running.incrementAndGet();
                    peak.accumulateAndGet(now, Math::max);
                    Thread.sleep(20);
                    running.decrementAndGet();
                    return null;
                });
            }
            BoundedTaskGroup.Outcome outcome = group.awaitAll();

            assertThat(outcome.succeeded()).hasSize(8);
            assertThat(outcome.failures()).isEmpty();
        }
        assertThat(peak.get()).isLessThanOrEqualTo(2);
    }

    @Test
    void awaitAll_isolatesFailingUnits() {
        AtomicInteger completed = new AtomicInteger();

        try (BoundedTaskGroup group = new BoundedTaskGroup("isolated", 3)) {
            group.submit("ok-1", completed::incrementAndGet);
            group.submit("bad", () -> {
                throw new IllegalStateException("boom");
            });
            group.submit("ok-2", completed::incrementAndGet);
            BoundedTaskGroup.Outcome outcome = group.awaitAll();

            assertThat(completed.get()).isEqualTo(2);
            assertThat(outcome.succeeded()).containsExactly("ok-1", "ok-2");
            assertThat(outcome.failures()).containsOnlyKeys("bad");
            assertThat(outcome.failures().get("bad")).hasMessage("boom");
        }
    }

    @Test
    void awaitAllOrThrow_raisesFirstFailureAfterSiblingsFinish() throws InterruptedException {
        CountDownLatch slowDone = new CountDownLatch(1);

        try (BoundedTaskGroup group = new BoundedTaskGroup("fatal", 2)) {
            group.submit("first-bad", () -> {
                throw new IllegalArgumentException("first");
            });
            group.submit("slow", () -> {
                Thread.sleep(50);
                slowDone.countDown();
                return null;
            });
            group.submit("second-bad", () -> {
                throw new IllegalArgumentException("second");
            });

            assertThatThrownBy(group::awaitAllOrThrow).isInstanceOf(TaskGroupException.class)
                                                      .hasMessageContaining("2 unit(s) failed")
                                                      .hasMessageContaining("first-bad")
                                                      .hasRootCauseMessage("first");
        }
        assertThat(slowDone.await(1, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void submit_runsUnitsOnThreadsNamedAfterTheGroup() {
        AtomicReference<String> threadName = new AtomicReference<>();

        try (BoundedTaskGroup group = new BoundedTaskGroup("archive-copy", 1)) {
            group.submit("only", () -> threadName.set(Thread.currentThread().getName()));
            group.awaitAllOrThrow();
        }
        assertThat(threadName.get()).startsWith("archive-copy-");
    }

    @Test
    void constructor_rejectsNonPositiveWorkers() {
        assertThatThrownBy(() -> new BoundedTaskGroup("none", 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
