package com.example.covenant;

import com.example.covenant.combat.ActionCollector;
import com.example.covenant.model.GameAction;
import com.example.covenant.util.AbilityCheck;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for concurrent action collection with a deadline.
 */
public class ActionCollectorTest {

    private static ActionCollector collector(String... actors) {
        Set<String> expected = new LinkedHashSet<>(Arrays.asList(actors));
        return new ActionCollector(1, expected, action -> "forbidden".equals(action.getAbilityId())
                ? AbilityCheck.CheckResult.failure("Not allowed.")
                : AbilityCheck.CheckResult.success());
    }

    @Test
    @DisplayName("Submissions from many threads all arrive and release the wait early")
    void testConcurrentSubmissions() throws Exception {
        String[] actors = new String[8];
        for (int i = 0; i < actors.length; i++) actors[i] = "p" + i;
        ActionCollector c = collector(actors);
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch go = new CountDownLatch(1);
        try {
            for (String actor : actors) {
                pool.submit(() -> {
                    go.await();
                    return c.submit(new GameAction(actor, "slash", "p0"));
                });
            }
            go.countDown();
            ActionCollector.Batch batch = c.awaitActions(5, TimeUnit.SECONDS);

            assertEquals(8, batch.getActions().size());
            assertTrue(batch.getMissing().isEmpty());
            assertFalse(batch.isTimedOut());
            assertEquals(ActionCollector.Phase.CLOSED, c.getPhase());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testDeadlineLeavesMissingActors() throws Exception {
        ActionCollector c = collector("a", "b", "c");
        assertTrue(c.submit(new GameAction("a", "slash", "b")).isSuccess());

        ActionCollector.Batch batch = c.awaitActions(50, TimeUnit.MILLISECONDS);

        assertTrue(batch.isTimedOut());
        assertEquals(new LinkedHashSet<>(Arrays.asList("b", "c")), batch.getMissing());
        assertEquals(1, batch.getActions().size());
    }

    @Test
    void testDuplicateAndUnexpectedRejected() {
        ActionCollector c = collector("a", "b");
        assertTrue(c.submit(new GameAction("a", "slash", "b")).isSuccess());

        AbilityCheck.CheckResult dup = c.submit(new GameAction("a", "heal", "b"));
        AbilityCheck.CheckResult stranger = c.submit(new GameAction("z", "slash", "a"));
        AbilityCheck.CheckResult invalid = c.submit(new GameAction("b", "forbidden", "a"));

        assertTrue(dup.isFailure());
        assertTrue(stranger.isFailure());
        assertEquals("Not allowed.", invalid.getFailureMessage());

        ActionCollector.Batch batch = c.close();
        assertEquals(Collections.singletonList(new GameAction("a", "slash", "b")), batch.getActions());
        assertEquals(3, batch.getRejections().size());
        assertEquals(Collections.singleton("b"), batch.getMissing());
    }

    @Test
    void testSubmitAfterClose() {
        ActionCollector c = collector("a", "b");
        c.close();
        assertTrue(c.submit(new GameAction("b", "slash", "a")).isFailure());
        assertSame(c.close(), c.close());
    }

    @Test
    @DisplayName("Aborting wakes the waiter with a cancellation")
    void testAbort() throws Exception {
        ActionCollector c = collector("a", "b");
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<ActionCollector.Batch> waiting = pool.submit(() -> c.awaitActions(10, TimeUnit.SECONDS));
            assertTrue(c.abort());

            Exception e = assertThrows(Exception.class, () -> waiting.get(5, TimeUnit.SECONDS));
            assertTrue(e.getCause() instanceof CancellationException, String.valueOf(e.getCause()));
            assertEquals(ActionCollector.Phase.ABORTED, c.getPhase());
            assertTrue(c.submit(new GameAction("a", "slash", "b")).isFailure());
            assertThrows(CancellationException.class, c::close);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void testAbortAfterCloseHasNoEffect() {
        ActionCollector c = collector("a");
        c.submit(new GameAction("a", "slash", "b"));
        ActionCollector.Batch batch = c.close();

        assertFalse(c.abort());
        assertEquals(ActionCollector.Phase.CLOSED, c.getPhase());
        assertSame(batch, c.close());
    }

    @Test
    void testEmptyRound() throws Exception {
        ActionCollector.Batch batch = collector().awaitActions(1, TimeUnit.SECONDS);
        List<GameAction> actions = batch.getActions();
        assertTrue(actions.isEmpty());
        assertFalse(batch.isTimedOut());
    }
}
