package com.cellgraph.util;

import com.cellgraph.api.Atom;
import com.cellgraph.api.Atoms;
import com.cellgraph.api.ComputedAtom;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.GraphListener;
import com.cellgraph.api.StateAtom;
import com.cellgraph.engine.ContainerConfig;
import com.cellgraph.engine.GraphContainer;
import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class RecomputeStatsListenerTest {

    private RecomputeStatsListener stats;
    private List<String> disposed;
    private GraphContainer container;

    @Before
    public void setUp() {
        stats = new RecomputeStatsListener();
        disposed = new ArrayList<>();
        GraphListener disposals = new GraphListener() {
            @Override
            public void onNodeDisposed(Atom<?> atom) {
                disposed.add(atom.name());
            }
        };
        CompositeGraphListener composite = new CompositeGraphListener(stats).add(disposals);
        assertEquals(2, composite.size());
        container = GraphContainer.create(ContainerConfig.builder().listener(composite).build());
    }

    @Test
    public void testCountsRecomputesPerAtom() {
        StateAtom<Integer> a = Atoms.state("a", 1, DisposePolicy.KEEP_ALIVE);
        ComputedAtom<Integer> parity = Atoms.eager("parity", w -> w.get(a) % 2);

        container.read(parity);
        container.write(a, 2);
        container.write(a, 4);

        assertEquals(3, stats.recomputeCount(parity));
        assertEquals(3, stats.totalRecomputes());
        // first value counts as a change, the write of 4 leaves parity at 0
        assertEquals(2, stats.changedRecomputes());
        assertEquals(2, stats.stateChanges());
        assertTrue(stats.maxLatencyNanos() >= stats.minLatencyNanos());
        assertTrue(stats.dump().contains("parity"));
    }

    @Test
    public void testCountsErrors() {
        StateAtom<Integer> a = Atoms.state("a", 0, DisposePolicy.KEEP_ALIVE);
        ComputedAtom<Integer> inverse = Atoms.computed("inverse", w -> 10 / w.get(a));

        assertThrows(ArithmeticException.class, () -> container.read(inverse));
        assertEquals(1, stats.errors());

        container.write(a, 5);
        assertEquals(Integer.valueOf(2), container.read(inverse));
    }

    @Test
    public void testReset() {
        StateAtom<Integer> a = Atoms.state(1);
        container.read(Atoms.computed(w -> w.get(a) + 1));
        assertEquals(1, stats.totalRecomputes());

        stats.reset();
        assertEquals(0, stats.totalRecomputes());
        assertEquals(0, stats.minLatencyNanos());
        assertEquals(0.0, stats.avgLatencyNanos(), 0.0);
    }

    @Test
    public void testCompositeForwardsDisposals() {
        StateAtom<Integer> a = Atoms.state("temp", 1, DisposePolicy.AUTO_DISPOSE);
        container.subscribe(a, () -> {
        }).cancel();
        assertEquals(List.of("temp"), disposed);
    }
}
