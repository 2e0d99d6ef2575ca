package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.ResolutionResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Per-sash bookkeeping owned by {@link ResolutionClient}: the pending debounce timer,
 * the in-flight call and a generation counter. A scheduled or in-flight resolution
 * only acts while the generation it captured is still current and the sash has not
 * been released. Guarded by this object's own monitor, never by a lock shared
 * between sashes.
 */
final class SashResolutionState {

    private final String sashId;
    private final ResultCache cache;

    private ScheduledFuture<?> timer;
    private CompletableFuture<ResolutionResult> inFlight;
    private long generation;
    private boolean released;

    SashResolutionState(String sashId, ResultCache cache) {
        this.sashId = sashId;
        this.cache = cache;
    }

    String getSashId() {
        return sashId;
    }

    ResultCache getCache() {
        return cache;
    }

    /**
     * Cancels whatever is pending or in flight and starts a new generation.
     *
     * @return the new generation
     */
    long supersede() {
        cancel();
        return generation;
    }

    void cancel() {
        if (timer != null) {
            timer.cancel(false);
            timer = null;
        }
        if (inFlight != null) {
            inFlight.cancel(true);
            inFlight = null;
        }
        generation++;
    }

    /**
     * Cancels pending work for good; a released state never becomes live again.
     */
    void release() {
        cancel();
        released = true;
    }

    boolean isReleased() {
        return released;
    }

    boolean isLive(long expectedGeneration) {
        return !released && generation == expectedGeneration;
    }

    void timerStarted(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void timerFired() {
        this.timer = null;
    }

    void callStarted(CompletableFuture<ResolutionResult> call) {
        this.inFlight = call;
    }

    void callFinished() {
        this.inFlight = null;
    }

    boolean hasTimer() {
        return timer != null;
    }

    boolean hasInFlight() {
        return inFlight != null;
    }
}
