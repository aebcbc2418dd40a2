package com.questrail.wsclient.internal.exec;

import com.questrail.wsclient.internal.loop.Cancellable;
import com.questrail.wsclient.internal.loop.IoLoop;
import com.questrail.wsclient.loop.DeterministicIoLoop;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SingleShotTimerTest {

    private DeterministicIoLoop loop;
    private SingleShotTimer timer;
    private List<String> fired;

    @BeforeEach
    void setUp() {
        loop = new DeterministicIoLoop();
        loop.start();
        timer = new SingleShotTimer(loop, Duration.ofSeconds(1));
        fired = new ArrayList<>();
    }

    @Test
    void firesOnceAfterDelay() {
        timer.arm(() -> fired.add("a"));
        assertTrue(timer.isArmed());

        loop.advance(Duration.ofMillis(999));
        assertTrue(fired.isEmpty());

        loop.advance(Duration.ofMillis(1));
        assertEquals(List.of("a"), fired);
        assertFalse(timer.isArmed());

        loop.advance(Duration.ofSeconds(5));
        assertEquals(List.of("a"), fired);
    }

    @Test
    void rearmingReplacesPendingAction() {
        timer.arm(() -> fired.add("first"));
        loop.advance(Duration.ofMillis(500));
        timer.arm(() -> fired.add("second"));

        loop.advance(Duration.ofMillis(500));
        assertTrue(fired.isEmpty(), "re-arming restarts the delay");

        loop.advance(Duration.ofMillis(500));
        assertEquals(List.of("second"), fired);
    }

    @Test
    void cancelPreventsExecution() {
        timer.arm(() -> fired.add("a"));
        timer.cancel();

        loop.advance(Duration.ofSeconds(2));

        assertTrue(fired.isEmpty());
        assertFalse(timer.isArmed());
    }

    @Test
    void cancelAfterLoopPickedUpTaskStillSuppressesAction() {
        // A loop whose handles cannot cancel: the fire task always reaches the timer.
        List<Runnable> picked = new ArrayList<>();
        IoLoop uncancellable = new IoLoop() {
            @Override public void start() { }
            @Override public void stop() { }
            @Override public boolean isRunning() { return true; }
            @Override public boolean inLoop() { return false; }
            @Override public void execute(Runnable task) { picked.add(task); }

            @Override
            public Cancellable schedule(Duration delay, Runnable task) {
                picked.add(task);
                return () -> false;
            }
        };
        SingleShotTimer racing = new SingleShotTimer(uncancellable, Duration.ofSeconds(1));

        racing.arm(() -> fired.add("stale"));
        racing.arm(() -> fired.add("current"));
        racing.cancel();
        picked.forEach(Runnable::run);

        assertTrue(fired.isEmpty());

        picked.clear();
        racing.arm(() -> fired.add("current"));
        picked.forEach(Runnable::run);
        assertEquals(List.of("current"), fired);
    }

    @Test
    void armingOnStoppedLoopNeverFires() {
        loop.stop();
        timer.arm(() -> fired.add("a"));

        assertFalse(timer.isArmed());

        loop.start();
        loop.advance(Duration.ofSeconds(2));

        assertTrue(fired.isEmpty());
    }
}
