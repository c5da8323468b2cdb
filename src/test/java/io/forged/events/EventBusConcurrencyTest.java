package io.forged.events;

import io.forged.config.EventBusConfig;
import io.forged.model.Event;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class EventBusConcurrencyTest {

    @Test
    void concurrentProducersGetGapFreeIdsAndOrderedDelivery() throws Exception {
        EventBus bus = new EventBus(EventBusConfig.defaults().withEventChannelBuffer(1_000));
        Subscription subscription = bus.subscribe(SubscribeRequest.live());
        int producers = 8;
        int perProducer = 100;
        ExecutorService pool = Executors.newFixedThreadPool(producers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int p = 0; p < producers; p++) {
                String agentId = "agent-" + p;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perProducer; i++) {
                        bus.publishAgentStateChanged(agentId, "ws1", 0, 1, "tick");
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        int total = producers * perProducer;
        List<StoredEvent> stored = bus.storedEvents();
        Assertions.assertEquals(total, stored.size());
        for (int i = 0; i < total; i++) {
            Assertions.assertEquals(i, stored.get(i).id());
        }

        List<Event> live = new ArrayList<>();
        subscription.receiver().drainTo(live);
        Assertions.assertEquals(total, live.size());
        for (int i = 0; i < total; i++) {
            Assertions.assertEquals(Integer.toString(i), live.get(i).id());
        }
    }

    @Test
    void subscribeDuringPublishingLosesNothingBetweenReplayAndLive() throws Exception {
        EventBus bus = new EventBus(EventBusConfig.defaults().withEventChannelBuffer(1_000));
        int total = 600;
        long cursor = 50L;
        CountDownLatch warmedUp = new CountDownLatch(1);
        Thread publisher = new Thread(() -> {
            for (int i = 0; i < total; i++) {
                bus.publishPaneContentChanged("a1", "ws1", "h" + i, 1);
                if (i == 100) {
                    warmedUp.countDown();
                }
            }
        }, "publisher");
        publisher.start();
        Assertions.assertTrue(warmedUp.await(10, TimeUnit.SECONDS));

        Subscription subscription = bus.subscribe(SubscribeRequest.fromCursor(Long.toString(cursor)));
        publisher.join(TimeUnit.SECONDS.toMillis(30));
        Assertions.assertFalse(publisher.isAlive());

        List<Event> seen = new ArrayList<>(subscription.replay());
        subscription.receiver().drainTo(seen);
        Assertions.assertEquals(total - cursor, seen.size());
        for (int i = 0; i < seen.size(); i++) {
            Assertions.assertEquals(Long.toString(cursor + i), seen.get(i).id());
        }
        subscription.receiver().close();
    }

    @Test
    void churningSubscribersLeaveRegistryEmpty() throws Exception {
        EventBus bus = new EventBus();
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            futures.add(pool.submit(() -> {
                for (int i = 0; i < 2_000; i++) {
                    bus.publishError("a" + (i % 5), "ws1", "E", "boom", false);
                }
                return null;
            }));
            for (int c = 0; c < 3; c++) {
                futures.add(pool.submit(() -> {
                    for (int i = 0; i < 200; i++) {
                        Subscription subscription = bus.subscribe(SubscribeRequest.fromCursor("1").withAgentIds("a1"));
                        if (i % 2 == 0) {
                            bus.unsubscribe(subscription.subscriberId());
                        } else {
                            subscription.receiver().close();
                        }
                    }
                    return null;
                }));
            }
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        Assertions.assertEquals(0, bus.subscriberCount());
        Assertions.assertEquals(EventBusConfig.MAX_STORED_EVENTS, bus.storedCount());
    }
}
