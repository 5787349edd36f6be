package com.cellgraph;

import com.cellgraph.api.AsyncAtom;
import com.cellgraph.api.AsyncValue;
import com.cellgraph.api.Atoms;
import com.cellgraph.api.ComputedAtom;
import com.cellgraph.api.DisposePolicy;
import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.StateAtom;
import com.cellgraph.disruptor.GraphReactor;
import com.cellgraph.engine.ContainerConfig;
import com.cellgraph.engine.GraphContainer;
import com.cellgraph.io.SettingsLoader;
import com.cellgraph.io.SnapshotSerializer;
import com.cellgraph.util.CompositeGraphListener;
import com.cellgraph.util.GraphExplain;
import com.cellgraph.util.RecomputeStatsListener;
import lombok.extern.log4j.Log4j2;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Demonstrates a small order-ticket graph driven by a {@link GraphReactor}.
 */
@Log4j2
public class CellGraphDemo {

    public static void main(String[] args) throws Exception {
        log.info("Starting CellGraph Demo...");

        // 1. Atoms
        StateAtom<Integer> quantity = Atoms.state("quantity", 100, DisposePolicy.KEEP_ALIVE);
        StateAtom<String> symbol = Atoms.state("symbol", "EURUSD", DisposePolicy.KEEP_ALIVE);
        AsyncAtom<Double> price = Atoms.async("price", w -> quote(w.get(symbol)));
        ComputedAtom<Double> notional = Atoms.computed("notional", w -> {
            Double px = w.get(price).valueOrNull();
            return px == null ? 0.0 : px * w.get(quantity);
        });
        EffectAtom<String> fills = Atoms.bufferedEffect("fills", 16);

        RecomputeStatsListener stats = new RecomputeStatsListener();

        try (GraphReactor reactor = new GraphReactor()) {
            // 2. Container on the graph thread, configured from the class path
            ContainerConfig base = ContainerConfig.fromSettings(SettingsLoader.fromClasspath("cellgraph.json"));
            ContainerConfig config = base.toBuilder()
                    .scheduler(reactor)
                    .listener(new CompositeGraphListener(base.getListener(), stats))
                    .build();
            GraphContainer root = reactor.submit(() -> GraphContainer.create(config)).get();

            // 3. Subscriptions
            reactor.submit(() -> {
                root.listen(notional, n -> log.info("Notional: {}", n));
                root.on(fills, f -> log.info("Fill: {}", f));
                return null;
            }).get();

            // 4. Drive the graph
            reactor.submit(() -> {
                root.batch(() -> {
                    root.write(quantity, 250);
                    root.write(symbol, "USDJPY");
                });
                root.emit(fills, "BUY 250 USDJPY");
                return null;
            }).get();
            TimeUnit.MILLISECONDS.sleep(100);

            // 5. A desk scope trading a fixed size
            reactor.submit(() -> {
                GraphContainer desk = GraphContainer.scoped(root, quantity.overrideWith(1_000));
                log.info("Desk quantity {} vs root {}", desk.read(quantity), root.read(quantity));
                desk.dispose();
                return null;
            }).get();

            // 6. Diagnostics
            String report = reactor.submit(() -> new GraphExplain(root).dumpTopology()
                    + new SnapshotSerializer(true).toJson(root)).get();
            log.info("\n{}", report);
            AsyncValue<Double> last = reactor.submit(() -> root.read(price)).get();
            log.info("Last price {}", last);
            log.info("\n{}", stats.dump());

            reactor.submit(() -> {
                root.dispose();
                return null;
            }).get();
        }
    }

    private static CompletableFuture<Double> quote(String symbol) {
        return CompletableFuture.supplyAsync(() -> "USDJPY".equals(symbol) ? 151.2 : 1.08);
    }
}
