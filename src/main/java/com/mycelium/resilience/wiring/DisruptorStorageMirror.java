package com.mycelium.resilience.wiring;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.EventHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.mycelium.resilience.api.EdgeAttributes;
import com.mycelium.resilience.api.EdgeKey;
import com.mycelium.resilience.api.GraphStore;
import com.mycelium.resilience.api.NodeAttributes;
import com.mycelium.resilience.util.ErrorRateLimiter;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.LockSupport;

import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Fire-and-forget bridge between the engine and an external {@link GraphStore}.
 *
 * The engine thread publishes each mutation into an LMAX Disruptor ring buffer
 * and returns immediately; a single daemon consumer applies the events to the
 * delegate store in publication order.
 *
 * Back-pressure:
 * Publishing never blocks. When the ring buffer is full the event is dropped,
 * counted, and a throttled warning is logged. Durability belongs to the store,
 * not to the engine.
 *
 * Failures:
 * An exception thrown by the delegate is logged (throttled) and counted; the
 * consumer keeps going.
 *
 * {@link #close()} drains every published event before returning.
 */
public final class DisruptorStorageMirror implements GraphStore, AutoCloseable {
    private static final Logger log = LogManager.getLogger(DisruptorStorageMirror.class);
    private static final long DRAIN_TIMEOUT_NANOS = TimeUnit.SECONDS.toNanos(10);

    private final GraphStore delegate;
    private final Disruptor<StorageEvent> disruptor;
    private final RingBuffer<StorageEvent> ringBuffer;
    private final ErrorRateLimiter dropLimiter = new ErrorRateLimiter(log, Level.WARN, 1000);
    private final ErrorRateLimiter failureLimiter = new ErrorRateLimiter(log, 1000);

    private final AtomicLong applied = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    /**
     * @param delegate   The store receiving the mutations.
     * @param bufferSize Ring buffer size, a power of two.
     */
    public DisruptorStorageMirror(GraphStore delegate, int bufferSize) {
        this.delegate = delegate;
        this.disruptor = new Disruptor<>(
                StorageEvent::new,
                bufferSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        disruptor.handleEventsWith(new StoreWriter());
        this.ringBuffer = disruptor.start();
        log.info("Storage mirror started (buffer {}) -> {}", bufferSize, delegate.getClass().getSimpleName());
    }

    @Override
    public void upsertNode(String id, NodeAttributes attributes) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setNodeUpsert(id, attributes, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void upsertEdge(EdgeKey key, EdgeAttributes attributes) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setEdgeUpsert(key, attributes, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void deleteNode(String id) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setNodeDelete(id, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    @Override
    public void deleteEdge(EdgeKey key) {
        long seq = claim();
        if (seq < 0)
            return;
        try {
            ringBuffer.get(seq).setEdgeDelete(key, seq);
        } finally {
            ringBuffer.publish(seq);
        }
    }

    /** @return A claimed sequence, or -1 if the event had to be dropped. */
    private long claim() {
        if (closed) {
            dropped.incrementAndGet();
            dropLimiter.log("Storage mirror closed, dropping event", null);
            return -1;
        }
        try {
            return ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            dropped.incrementAndGet();
            dropLimiter.log("Storage ring buffer full, dropping event", null);
            return -1;
        }
    }

    public long appliedCount() {
        return applied.get();
    }

    public long failedCount() {
        return failed.get();
    }

    public long droppedCount() {
        return dropped.get();
    }

    /** Events published but not yet consumed. */
    public long backlog() {
        return ringBuffer.getBufferSize() - ringBuffer.remainingCapacity();
    }

    /**
     * Stops accepting events, waits until the consumer has applied the backlog, and stops it.
     *
     * The wait tracks the consumer's gating sequence rather than relying on
     * {@link Disruptor#shutdown()} alone, which only sees a backlog once the
     * consumer thread is running.
     */
    @Override
    public void close() {
        if (closed)
            return;
        closed = true;
        awaitDrained();
        disruptor.shutdown();
        log.info("Storage mirror closed: applied={} failed={} dropped={}", applied.get(), failed.get(), dropped.get());
    }

    private void awaitDrained() {
        long deadline = System.nanoTime() + DRAIN_TIMEOUT_NANOS;
        while (ringBuffer.getMinimumGatingSequence() < ringBuffer.getCursor()) {
            if (System.nanoTime() - deadline > 0) {
                log.warn("Storage mirror did not drain within {} ms, {} events unapplied",
                        TimeUnit.NANOSECONDS.toMillis(DRAIN_TIMEOUT_NANOS),
                        ringBuffer.getCursor() - ringBuffer.getMinimumGatingSequence());
                return;
            }
            LockSupport.parkNanos(TimeUnit.MICROSECONDS.toNanos(100));
        }
    }

    /** Applies events to the delegate on the consumer thread. */
    private final class StoreWriter implements EventHandler<StorageEvent> {

        @Override
        public void onEvent(StorageEvent event, long sequence, boolean endOfBatch) {
            try {
                switch (event.kind()) {
                    case UPSERT_NODE -> delegate.upsertNode(event.nodeId(), event.nodeAttributes());
                    case UPSERT_EDGE -> delegate.upsertEdge(event.edgeKey(), event.edgeAttributes());
                    case DELETE_NODE -> delegate.deleteNode(event.nodeId());
                    case DELETE_EDGE -> delegate.deleteEdge(event.edgeKey());
                }
                applied.incrementAndGet();
            } catch (RuntimeException e) {
                failed.incrementAndGet();
                failureLimiter.log("Storage write failed for event " + event.sequenceId() + " (" + event.kind() + ")", e);
            } finally {
                event.clear();
            }
        }
    }
}
