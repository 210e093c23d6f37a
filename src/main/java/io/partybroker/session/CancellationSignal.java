package io.partybroker.session;

import io.partybroker.error.BrokerException;
import io.partybroker.error.ErrorCode;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cancellation context of one session, threaded through to the engine call. Listeners registered
 * with {@link #onCancel(Runnable)} fire once; a listener added after cancellation fires at once.
 */
public final class CancellationSignal {
    private final AtomicBoolean canceled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();
    private final long deadlineMs;

    public CancellationSignal() {
        this(0L);
    }

    // deadlineMs <= 0 means no deadline.
    public CancellationSignal(long deadlineMs) {
        this.deadlineMs = deadlineMs;
    }

    public void cancel() {
        if (canceled.compareAndSet(false, true)) {
            for (Runnable listener : listeners) {
                if (listeners.remove(listener)) {
                    listener.run();
                }
            }
        }
    }

    public boolean isCanceled() {
        return canceled.get() || deadlineExceeded(System.currentTimeMillis());
    }

    public boolean deadlineExceeded(long nowMs) {
        return deadlineMs > 0L && nowMs >= deadlineMs;
    }

    public long deadlineMs() {
        return deadlineMs;
    }

    public void onCancel(Runnable listener) {
        listeners.add(listener);
        if (canceled.get() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void throwIfCanceled(String step) {
        if (isCanceled()) {
            throw new BrokerException(ErrorCode.CANCELED, "session canceled before " + step);
        }
    }
}
