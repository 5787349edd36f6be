package com.cellgraph.engine;

import com.cellgraph.api.Atoms;
import com.cellgraph.api.EffectAtom;
import com.cellgraph.api.Subscription;
import com.cellgraph.testing.MutableClock;
import org.junit.Before;
import org.junit.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class EffectChannelTest {

    private MutableClock clock;
    private GraphContainer container;

    @Before
    public void setUp() {
        clock = new MutableClock();
        container = GraphContainer.create(ContainerConfig.builder().clock(clock).build());
    }

    @Test
    public void testBufferReplaysLastPayloads() {
        EffectAtom<Integer> events = Atoms.bufferedEffect("events", 3);
        for (int i = 1; i <= 5; i++)
            container.emit(events, i);

        List<Integer> received = new ArrayList<>();
        container.on(events, received::add);
        assertEquals(List.of(3, 4, 5), received);

        container.emit(events, 6);
        assertEquals(List.of(3, 4, 5, 6), received);
    }

    @Test
    public void testDropLosesPayloadsWithoutListener() {
        EffectAtom<String> toast = Atoms.effect("toast");
        container.emit(toast, "lost");

        List<String> received = new ArrayList<>();
        container.on(toast, received::add);
        assertTrue(received.isEmpty());

        container.emit(toast, "seen");
        assertEquals(List.of("seen"), received);
    }

    @Test
    public void testTtlReplaysOnlyFreshPayloads() {
        EffectAtom<String> alerts = Atoms.ttlEffect("alerts", Duration.ofMillis(100));
        container.emit(alerts, "old");
        clock.advance(Duration.ofMillis(150));
        container.emit(alerts, "fresh");
        clock.advance(Duration.ofMillis(10));

        List<String> received = new ArrayList<>();
        container.on(alerts, received::add);
        assertEquals(List.of("fresh"), received);
    }

    @Test
    public void testTtlEvictsOnListen() {
        EffectAtom<String> alerts = Atoms.ttlEffect(Duration.ofMillis(100));
        container.emit(alerts, "a");
        clock.advance(Duration.ofMillis(50));

        List<String> early = new ArrayList<>();
        container.on(alerts, early::add);
        assertEquals(List.of("a"), early);

        clock.advance(Duration.ofMillis(60));
        List<String> late = new ArrayList<>();
        container.on(alerts, late::add);
        assertTrue(late.isEmpty());
    }

    @Test
    public void testBroadcastToAllListeners() {
        EffectAtom<Integer> ticks = Atoms.effect();
        List<Integer> first = new ArrayList<>();
        List<Integer> second = new ArrayList<>();
        container.on(ticks, first::add);
        container.on(ticks, second::add);

        container.emit(ticks, 1);
        assertEquals(List.of(1), first);
        assertEquals(List.of(1), second);
    }

    @Test
    public void testFailingListenerDoesNotStopDelivery() {
        EffectAtom<Integer> ticks = Atoms.effect();
        List<Integer> received = new ArrayList<>();
        container.on(ticks, v -> {
            throw new IllegalStateException("listener bug");
        });
        container.on(ticks, received::add);

        container.emit(ticks, 1);
        container.emit(ticks, 2);
        assertEquals(List.of(1, 2), received);
    }

    @Test
    public void testCancelStopsDelivery() {
        EffectAtom<Integer> ticks = Atoms.effect();
        List<Integer> received = new ArrayList<>();
        Subscription sub = container.on(ticks, received::add);
        container.emit(ticks, 1);
        sub.cancel();
        sub.cancel();
        container.emit(ticks, 2);
        assertEquals(List.of(1), received);
    }

    @Test
    public void testEffectHasNoValue() {
        EffectAtom<Integer> ticks = Atoms.effect();
        assertThrows(IllegalArgumentException.class, () -> container.read(ticks));
        assertThrows(IllegalArgumentException.class, () -> container.subscribe(ticks, () -> {
        }));
    }

    @Test
    public void testInvalidBufferSize() {
        assertThrows(IllegalArgumentException.class, () -> Atoms.bufferedEffect(0));
        assertThrows(IllegalArgumentException.class, () -> Atoms.ttlEffect(Duration.ZERO));
    }

    @Test
    public void testDisposedContainerRejectsEmit() {
        EffectAtom<Integer> ticks = Atoms.bufferedEffect(2);
        container.emit(ticks, 1);
        container.dispose();
        assertThrows(IllegalStateException.class, () -> container.emit(ticks, 2));
    }
}
