package com.workqueue.engine;

/**
 * What one dispatcher tick did.
 */
public final class TickSummary {
    private final int admitted;
    private final int launched;
    private final boolean moreCandidates;

    public TickSummary(int admitted, int launched, boolean moreCandidates) {
        this.admitted = admitted;
        this.launched = launched;
        this.moreCandidates = moreCandidates;
    }

    /** Jobs moved PENDING → ENQUEUED during admission. */
    public int getAdmitted() {
        return admitted;
    }

    /** Jobs claimed (ENQUEUED → RUNNING) and handed to the worker pool. */
    public int getLaunched() {
        return launched;
    }

    /**
     * Whether a PENDING job was still admissible after the tick. When false the
     * loop waits the extra hold delay before the next tick.
     */
    public boolean hasMoreCandidates() {
        return moreCandidates;
    }

    @Override
    public String toString() {
        return "TickSummary{admitted=" + admitted + ", launched=" + launched
                + ", moreCandidates=" + moreCandidates + "}";
    }
}
