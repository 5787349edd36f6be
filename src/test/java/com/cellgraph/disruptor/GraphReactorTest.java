package com.cellgraph.disruptor;

import com.cellgraph.api.AsyncAtom;
import com.cellgraph.api.AsyncValue;
import com.cellgraph.api.Atoms;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.StateAtom;
import com.cellgraph.engine.ContainerConfig;
import com.cellgraph.engine.GraphContainer;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.Assert.*;

public class GraphReactorTest {

    private GraphReactor reactor;

    @Before
    public void setUp() {
        reactor = new GraphReactor(64);
    }

    @After
    public void tearDown() {
        reactor.close();
    }

    @Test
    public void testSubmitRunsOnGraphThread() throws Exception {
        assertFalse(reactor.isGraphThread());
        assertTrue(reactor.submit(reactor::isGraphThread).get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testTasksRunInPublishOrder() throws Exception {
        List<Integer> order = new ArrayList<>();
        for (int i = 0; i < 500; i++) {
            int n = i;
            reactor.execute(() -> order.add(n));
        }
        int size = reactor.submit(order::size).get(5, TimeUnit.SECONDS);
        assertEquals(500, size);
        for (int i = 0; i < 500; i++)
            assertEquals(Integer.valueOf(i), order.get(i));
    }

    @Test
    public void testNestedExecuteRunsInline() throws Exception {
        List<String> steps = new ArrayList<>();
        reactor.submit(() -> {
            steps.add("outer");
            reactor.execute(() -> steps.add("inner"));
            steps.add("after");
            return null;
        }).get(5, TimeUnit.SECONDS);
        assertEquals(List.of("outer", "inner", "after"), steps);
    }

    @Test
    public void testSubmitPropagatesError() throws Exception {
        CompletableFuture<Integer> future = reactor.submit(() -> {
            throw new IllegalArgumentException("bad input");
        });
        try {
            future.get(5, TimeUnit.SECONDS);
            fail("Expected ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalArgumentException);
        }
    }

    @Test
    public void testFailingTaskDoesNotStopGraphThread() throws Exception {
        reactor.execute(() -> {
            throw new IllegalStateException("task bug");
        });
        assertEquals("alive", reactor.submit(() -> "alive").get(5, TimeUnit.SECONDS));
    }

    @Test
    public void testScheduleRunsOnGraphThread() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        AtomicBoolean onGraphThread = new AtomicBoolean();
        reactor.schedule(() -> {
            onGraphThread.set(reactor.isGraphThread());
            fired.countDown();
        }, Duration.ofMillis(10));
        assertTrue(fired.await(5, TimeUnit.SECONDS));
        assertTrue(onGraphThread.get());
    }

    @Test
    public void testCancelledScheduleNeverRuns() throws Exception {
        AtomicBoolean ran = new AtomicBoolean();
        reactor.schedule(() -> ran.set(true), Duration.ofMillis(200)).cancel();
        Thread.sleep(300);
        reactor.submit(() -> null).get(5, TimeUnit.SECONDS);
        assertFalse(ran.get());
    }

    @Test
    public void testClosedReactorRejectsSubmit() throws Exception {
        reactor.close();
        CompletableFuture<String> future = reactor.submit(() -> "late");
        try {
            future.get(5, TimeUnit.SECONDS);
            fail("Expected ExecutionException");
        } catch (ExecutionException e) {
            assertTrue(e.getCause() instanceof IllegalStateException);
        }
    }

    @Test
    public void testAsyncCompletionMarshalledToGraphThread() throws Exception {
        CompletableFuture<String> request = new CompletableFuture<>();
        StateAtom<Integer> id = Atoms.state("id", 7, DisposePolicy.KEEP_ALIVE);
        AsyncAtom<String> user = Atoms.async("user", w -> {
            w.get(id);
            return request;
        });
        GraphContainer container = GraphContainer.create(ContainerConfig.builder().scheduler(reactor).build());

        CountDownLatch loaded = new CountDownLatch(1);
        AtomicBoolean listenerOnGraphThread = new AtomicBoolean();
        AsyncValue<String> initial = reactor.submit(() -> {
            container.subscribe(user, () -> {
                listenerOnGraphThread.set(reactor.isGraphThread());
                loaded.countDown();
            });
            return container.read(user);
        }).get(5, TimeUnit.SECONDS);
        assertTrue(initial.isLoading());

        // completed from the test thread
        request.complete("alice");
        assertTrue(loaded.await(5, TimeUnit.SECONDS));
        assertTrue(listenerOnGraphThread.get());
        assertEquals(AsyncValue.data("alice"), reactor.submit(() -> container.read(user)).get(5, TimeUnit.SECONDS));
    }
}
