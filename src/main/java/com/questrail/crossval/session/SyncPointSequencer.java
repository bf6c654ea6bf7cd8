package com.questrail.crossval.session;

/**
 * Assigns session-unique sync point sequence numbers.
 *
 * <p>Every instance calls {@code validate} in the same order, so the n-th call
 * on each instance gets the same sequence number, and a sync point location
 * reached repeatedly (inside a loop) still yields a distinct barrier key per
 * visit. The first number issued is 1.</p>
 */
final class SyncPointSequencer
{
    private int last;

    int next() {
        if (last == Integer.MAX_VALUE) {
            throw new IllegalStateException("sync point sequence exhausted");
        }
        return ++last;
    }

    int current() {
        return last;
    }

    /**
     * Restarts numbering; every instance resets together on resume.
     */
    void reset() {
        last = 0;
    }
}
