package com.cellgraph.util;

import com.cellgraph.api.Atoms;
import com.cellgraph.api.ComputedAtom;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.StateAtom;
import com.cellgraph.engine.GraphContainer;
import org.junit.Before;
import org.junit.Test;

import java.util.concurrent.CompletableFuture;

import static org.junit.Assert.*;

public class GraphExplainTest {

    private StateAtom<Integer> qty;
    private StateAtom<Double> price;
    private ComputedAtom<Double> notional;
    private GraphContainer container;
    private GraphExplain explain;

    @Before
    public void setUp() {
        qty = Atoms.state("qty", 10, DisposePolicy.KEEP_ALIVE);
        price = Atoms.state("price", 2.5, DisposePolicy.KEEP_ALIVE);
        notional = Atoms.computed("notional", w -> w.get(qty) * w.get(price));
        container = GraphContainer.create();
        explain = new GraphExplain(container);
    }

    @Test
    public void testExplainNode() {
        container.read(notional);
        String text = explain.explainNode(notional);
        assertTrue(text.contains("Node: notional"));
        assertTrue(text.contains("Kind: COMPUTE"));
        assertTrue(text.contains("Value: 25.0"));
        assertTrue(text.contains("Dirty: false"));
        assertTrue(text.contains("Dependencies (2): qty, price"));

        String source = explain.explainNode(qty);
        assertTrue(source.contains("Kind: STATE"));
        assertTrue(source.contains("Observers (1): notional"));
    }

    @Test
    public void testExplainUnknownNode() {
        assertThrows(IllegalArgumentException.class, () -> explain.explainNode(notional));
    }

    @Test
    public void testDumpTopology() {
        EffectAtom<String> toast = Atoms.effect("toast");
        container.read(notional);
        container.on(toast, t -> {
        });

        String dump = explain.dumpTopology();
        assertTrue(dump.startsWith("Graph (3 nodes, 1 effects)"));
        assertTrue(dump.contains("qty (SRC) -> notional"));
        assertTrue(dump.contains("(effect) toast DROP, listeners=1"));
    }

    @Test
    public void testMermaid() {
        container.read(notional);
        String mermaid = explain.toMermaid();
        assertTrue(mermaid.startsWith("graph TD;"));
        assertTrue(mermaid.contains("[(\"qty"));
        // notional registers before the cells it reads
        assertTrue(mermaid.contains("n0[\"notional"));
        assertTrue(mermaid.contains("n1 --> n0;"));
        assertTrue(mermaid.contains("n2 --> n0;"));
    }

    @Test
    public void testKinds() {
        container.read(qty);
        container.read(Atoms.eager("e", w -> w.get(qty)));
        container.read(Atoms.safe("s", w -> w.get(qty)));
        container.read(Atoms.async("a", w -> CompletableFuture.completedFuture(w.get(qty))));

        String kinds = container.localNodes().stream().map(GraphExplain::kindOf)
                .reduce("", (x, y) -> x + y + ",");
        assertEquals("STATE,EAGER_COMPUTE,SAFE_COMPUTE,ASYNC_COMPUTE,", kinds);
    }

    @Test
    public void testExplainNeverComputes() {
        ComputedAtom<Integer> lazy = Atoms.computed("lazy", w -> w.get(qty) + 1);
        assertEquals(Integer.valueOf(11), container.read(lazy));

        container.write(qty, 20);
        String text = explain.explainNode(lazy);
        assertTrue(text.contains("Value: 11"));
        assertTrue(text.contains("Dirty: true"));
        assertEquals(Integer.valueOf(21), container.read(lazy));
    }
}
