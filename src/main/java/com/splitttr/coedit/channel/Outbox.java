package com.splitttr.coedit.channel;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * FIFO send path for one channel. Payloads are offered in session order (under the
 * session lock) and drained later by whichever thread gets there first, so a
 * recipient never sees two notifications out of order even when several threads
 * broadcast at once.
 *
 * <p>The first failed send kills the outbox: pending payloads are dropped and every
 * later offer is refused.
 */
public final class Outbox {

    private final ParticipantChannel channel;
    private final Queue<String> pending = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean();
    private volatile DeliveryResult failure;

    public Outbox(ParticipantChannel channel) {
        this.channel = channel;
    }

    public ParticipantChannel channel() {
        return channel;
    }

    public boolean offer(String payload) {
        if (failure != null) return false;
        pending.add(payload);
        return true;
    }

    /**
     * Sends everything queued so far. Returns {@link DeliveryResult#ok()} when another
     * thread currently owns the drain; that thread delivers (or reports) our payloads.
     */
    public DeliveryResult drain() {
        while (failure == null) {
            if (!draining.compareAndSet(false, true)) {
                return DeliveryResult.ok();
            }
            try {
                String next;
                while ((next = pending.poll()) != null) {
                    DeliveryResult result = channel.send(next);
                    if (!result.delivered()) {
                        failure = result;
                        pending.clear();
                        return result;
                    }
                }
            } finally {
                draining.set(false);
            }
            // re-check: an offer may have landed after our last poll but before the flag was cleared
            if (pending.isEmpty()) {
                return DeliveryResult.ok();
            }
        }
        return failure;
    }

    public boolean isDead() {
        return failure != null;
    }

    public int pendingCount() {
        return pending.size();
    }
}
