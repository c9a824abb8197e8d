package com.toycon.graph.util;

import com.toycon.graph.api.TickListener;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Dispatches tick callbacks to every registered listener in registration
 * order.
 *
 * A listener that throws is reported (rate limited) and skipped for that
 * callback only; it never aborts the tick or starves the listeners after it.
 * Registration copies the listener array, so dispatch itself does not
 * allocate.
 */
public class CompositeTickListener implements TickListener {
    private static final Logger log = LogManager.getLogger(CompositeTickListener.class);
    private static final TickListener[] NONE = new TickListener[0];

    private final ErrorRateLimiter faults = new ErrorRateLimiter(log, 1000);
    private volatile TickListener[] listeners = NONE;
    private long faultCount;

    public synchronized void add(TickListener listener) {
        Objects.requireNonNull(listener, "listener");
        List<TickListener> next = new ArrayList<>(List.of(listeners));
        next.add(listener);
        listeners = next.toArray(NONE);
    }

    /** @return true if the listener was registered. */
    public synchronized boolean remove(TickListener listener) {
        List<TickListener> next = new ArrayList<>(List.of(listeners));
        boolean removed = next.remove(listener);
        listeners = next.toArray(NONE);
        return removed;
    }

    public int size() {
        return listeners.length;
    }

    /** Number of callbacks that threw and were skipped. */
    public long faultCount() {
        return faultCount;
    }

    @Override
    public void onTickStart(long epoch) {
        for (TickListener l : listeners) {
            try {
                l.onTickStart(epoch);
            } catch (RuntimeException e) {
                fault(l, "onTickStart", epoch, e);
            }
        }
    }

    @Override
    public void onNodeEvaluated(long epoch, int index, String nodeName, long durationNanos) {
        for (TickListener l : listeners) {
            try {
                l.onNodeEvaluated(epoch, index, nodeName, durationNanos);
            } catch (RuntimeException e) {
                fault(l, "onNodeEvaluated", epoch, e);
            }
        }
    }

    @Override
    public void onNodeError(long epoch, int index, String nodeName, Throwable error) {
        for (TickListener l : listeners) {
            try {
                l.onNodeError(epoch, index, nodeName, error);
            } catch (RuntimeException e) {
                fault(l, "onNodeError", epoch, e);
            }
        }
    }

    @Override
    public void onTickEnd(long epoch, int nodesEvaluated) {
        for (TickListener l : listeners) {
            try {
                l.onTickEnd(epoch, nodesEvaluated);
            } catch (RuntimeException e) {
                fault(l, "onTickEnd", epoch, e);
            }
        }
    }

    private void fault(TickListener l, String callback, long epoch, RuntimeException e) {
        faultCount++;
        faults.log("Listener " + l.getClass().getSimpleName() + "." + callback + " failed in tick " + epoch, e);
    }
}
