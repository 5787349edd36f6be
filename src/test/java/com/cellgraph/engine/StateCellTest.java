package com.cellgraph.engine;

import com.cellgraph.api.Atom;
import com.cellgraph.api.Atoms;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.GraphListener;
import com.cellgraph.api.StateAtom;
import com.cellgraph.api.Subscription;
import com.cellgraph.util.Cutoffs;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class StateCellTest {

    private List<String> changes;
    private GraphContainer container;

    @Before
    public void setUp() {
        changes = new ArrayList<>();
        GraphListener recorder = new GraphListener() {
            @Override
            public void onStateChange(Atom<?> atom, Object oldValue, Object newValue) {
                changes.add(atom.name() + ":" + oldValue + "->" + newValue);
            }
        };
        container = GraphContainer.create(ContainerConfig.builder().listener(recorder).build());
    }

    @Test
    public void testInitialValue() {
        StateAtom<String> name = Atoms.state("guest");
        assertEquals("guest", container.read(name));
        assertTrue(container.hasNode(name));
    }

    @Test
    public void testWriteAndRead() {
        StateAtom<Integer> count = Atoms.state("count", 0, DisposePolicy.KEEP_ALIVE);
        container.write(count, 3);
        assertEquals(Integer.valueOf(3), container.read(count));
        assertEquals(List.of("count:0->3"), changes);
    }

    @Test
    public void testWriteBeforeReadCreatesNode() {
        StateAtom<Integer> count = Atoms.state(0);
        container.write(count, 9);
        assertEquals(Integer.valueOf(9), container.read(count));
    }

    @Test
    public void testUpdateAppliesFunction() {
        StateAtom<Integer> count = Atoms.state("count", 10, DisposePolicy.KEEP_ALIVE);
        container.update(count, c -> c + 5);
        container.update(count, c -> c * 2);
        assertEquals(Integer.valueOf(30), container.read(count));
    }

    @Test
    public void testEqualWriteDoesNotNotify() {
        StateAtom<String> name = Atoms.state("name", "a", DisposePolicy.KEEP_ALIVE);
        AtomicInteger notified = new AtomicInteger();
        container.subscribe(name, notified::incrementAndGet);

        container.write(name, "a");
        assertEquals(0, notified.get());
        assertTrue(changes.isEmpty());

        container.write(name, "b");
        assertEquals(1, notified.get());
    }

    @Test
    public void testAlwaysCutoffNotifiesOnSameValue() {
        StateAtom<Integer> tick = Atoms.state("tick", 1, DisposePolicy.KEEP_ALIVE, Cutoffs.always());
        AtomicInteger notified = new AtomicInteger();
        container.subscribe(tick, notified::incrementAndGet);

        container.write(tick, 1);
        container.write(tick, 1);
        assertEquals(2, notified.get());
    }

    @Test
    public void testCustomCutoffStoresValueSilently() {
        StateAtom<Double> price = Atoms.state("price", 100.0, DisposePolicy.KEEP_ALIVE,
                Cutoffs.<Double>by((a, b) -> Math.abs(a - b) < 1.0));
        List<Double> seen = new ArrayList<>();
        container.listen(price, seen::add);

        container.write(price, 100.5);
        assertEquals(Double.valueOf(100.5), container.read(price));
        assertTrue(seen.isEmpty());

        container.write(price, 102.0);
        assertEquals(List.of(102.0), seen);
    }

    @Test
    public void testListenerReceivesNewValue() {
        StateAtom<String> name = Atoms.state("name", "a", DisposePolicy.KEEP_ALIVE);
        List<String> seen = new ArrayList<>();
        Subscription sub = container.listen(name, seen::add);
        container.write(name, "b");
        container.write(name, "c");
        sub.cancel();
        container.write(name, "d");
        assertEquals(List.of("b", "c"), seen);
    }

    @Test
    public void testSubscribeDoesNotFireImmediately() {
        StateAtom<String> name = Atoms.state("x");
        AtomicInteger notified = new AtomicInteger();
        container.subscribe(name, notified::incrementAndGet);
        assertEquals(0, notified.get());
    }

    @Test
    public void testNullValuesAllowed() {
        StateAtom<String> maybe = Atoms.state("maybe", null, DisposePolicy.KEEP_ALIVE);
        assertNull(container.read(maybe));
        container.write(maybe, "set");
        container.write(maybe, null);
        assertNull(container.read(maybe));
        assertEquals(List.of("maybe:null->set", "maybe:set->null"), changes);
    }

    @Test
    public void testDisposedContainerRejectsOperations() {
        StateAtom<Integer> count = Atoms.state(0);
        container.close();
        container.close();
        assertTrue(container.isDisposed());
        assertThrows(IllegalStateException.class, () -> container.read(count));
        assertThrows(IllegalStateException.class, () -> container.write(count, 1));
        assertThrows(IllegalStateException.class, () -> container.subscribe(count, () -> {
        }));
    }
}
