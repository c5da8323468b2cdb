package io.forged.events;

import io.forged.model.Event;

import java.time.Duration;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Receive side of a subscription. Closing it deregisters the subscriber, so a transport
 * that drops the stream without calling {@link EventBus#unsubscribe(String)} does not
 * leave a registry entry behind.
 *
 * <p>Events already queued stay readable after close.
 */
public final class EventReceiver implements AutoCloseable {
    private final Subscriber subscriber;
    private final BlockingQueue<Event> channel;
    private final Consumer<String> onClose;

    EventReceiver(Subscriber subscriber, Consumer<String> onClose) {
        this.subscriber = subscriber;
        this.channel = subscriber.channel();
        this.onClose = onClose;
    }

    public Optional<Event> tryReceive() {
        return Optional.ofNullable(channel.poll());
    }

    public Optional<Event> receive(Duration timeout) throws InterruptedException {
        return Optional.ofNullable(channel.poll(Math.max(0L, timeout.toNanos()), TimeUnit.NANOSECONDS));
    }

    public int drainTo(Collection<? super Event> sink) {
        return channel.drainTo(sink);
    }

    public int pending() {
        return channel.size();
    }

    public long droppedCount() {
        return subscriber.droppedCount();
    }

    public boolean isClosed() {
        return subscriber.isClosed();
    }

    @Override
    public void close() {
        if (subscriber.markClosed() && onClose != null) {
            onClose.accept(subscriber.id());
        }
    }
}
