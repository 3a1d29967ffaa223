package com.iimsoft.timeline.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class DebouncerTest {

    private final Debouncer debouncer = new Debouncer(50);

    @AfterEach
    void close() {
        debouncer.close();
    }

    @Test
    void onlyLastCallOfBurstRuns() throws InterruptedException {
        List<Integer> runs = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 5; i++) {
            int n = i;
            debouncer.call(() -> {
                runs.add(n);
                done.countDown();
            });
        }

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        Thread.sleep(150);
        assertThat(runs).containsExactly(4);
    }

    @Test
    void cancelDropsPendingCall() throws InterruptedException {
        List<Integer> runs = new CopyOnWriteArrayList<>();

        debouncer.call(() -> runs.add(1));
        debouncer.cancel();
        Thread.sleep(150);

        assertThat(runs).isEmpty();
    }

    @Test
    void failingActionDoesNotStopLaterCalls() throws InterruptedException {
        CountDownLatch done = new CountDownLatch(1);

        debouncer.call(() -> {
            throw new IllegalStateException("boom");
        });
        Thread.sleep(150);
        debouncer.call(done::countDown);

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void callsAfterCloseAreDropped() throws InterruptedException {
        List<Integer> runs = new CopyOnWriteArrayList<>();

        debouncer.close();
        debouncer.call(() -> runs.add(1));
        Thread.sleep(150);

        assertThat(debouncer.isClosed()).isTrue();
        assertThat(runs).isEmpty();
    }
}
