package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.CoefficientException;
import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Coordinates coefficient lookups for the sashes of an order being edited.
 * Each sash id has at most one live resolution: a new request for the same sash
 * cancels the pending debounce timer and any in-flight call, and a cancelled call
 * never reaches its callbacks. Completed results are memoized in a {@link ResultCache}
 * shared by all sashes.
 *
 * <p>Timers and transport completions run on a single event-loop thread. Every sash is
 * guarded by its own lock; callbacks run while holding only that sash's lock, so a slow
 * or blocking callback never stalls requests for other sashes. Cache hits are answered
 * synchronously on the calling thread. Once {@link #releaseSash(String)} or
 * {@link #resetAll()} returns, no callback fires for the released sashes; a release
 * issued while that sash's callback is running waits for the callback to return.
 *
 * <pre>
 * try (ResolutionClient client = new ResolutionClient(new HttpCoefficientTransport(uri))) {
 *     client.requestResolution("sash-1", request, result -> apply(result), error -> show(error));
 * }
 * </pre>
 */
public class ResolutionClient implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResolutionClient.class);

    public static final long DEFAULT_DEBOUNCE_MS = 500;

    private final CoefficientTransport transport;
    private final ResultCache cache;
    private final ScheduledExecutorService eventLoop;
    private final boolean ownsEventLoop;
    private final ConcurrentMap<String, SashResolutionState> states = new ConcurrentHashMap<>();

    public ResolutionClient(CoefficientTransport transport) {
        this(transport, new ResultCache(), newEventLoop(), true);
    }

    public ResolutionClient(CoefficientTransport transport, ResultCache cache) {
        this(transport, cache, newEventLoop(), true);
    }

    /**
     * Uses a caller-supplied event loop, which should be single-threaded and is not shut
     * down by {@link #close()}.
     */
    public ResolutionClient(CoefficientTransport transport, ResultCache cache, ScheduledExecutorService eventLoop) {
        this(transport, cache, eventLoop, false);
    }

    private ResolutionClient(CoefficientTransport transport, ResultCache cache,
                             ScheduledExecutorService eventLoop, boolean ownsEventLoop) {
        if (transport == null || cache == null || eventLoop == null) {
            throw new IllegalArgumentException("Transport, cache and event loop must not be null");
        }
        this.transport = transport;
        this.cache = cache;
        this.eventLoop = eventLoop;
        this.ownsEventLoop = ownsEventLoop;
    }

    private static ScheduledExecutorService newEventLoop() {
        return Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "coefficient-client");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void requestResolution(String sashId, ResolutionRequest request,
                                  Consumer<ResolutionResult> onSuccess, Consumer<Throwable> onError) {
        requestResolution(sashId, request, onSuccess, onError, DEFAULT_DEBOUNCE_MS);
    }

    /**
     * Schedules a resolution for one sash, superseding anything still pending for it.
     *
     * @param sashId     identity of the order line item
     * @param request    what to resolve
     * @param onSuccess  receives the result; invoked at most once
     * @param onError    receives a {@link CoefficientException} for failed, non-cancelled calls
     * @param debounceMs quiet period before the request is sent
     */
    public void requestResolution(String sashId, ResolutionRequest request,
                                  Consumer<ResolutionResult> onSuccess,
                                  Consumer<Throwable> onError,
                                  long debounceMs) {
        if (sashId == null || request == null || onSuccess == null || onError == null) {
            throw new IllegalArgumentException("Sash id, request and callbacks must not be null");
        }
        if (debounceMs < 0) {
            throw new IllegalArgumentException("Debounce must be >= 0 ms, got " + debounceMs);
        }

        while (true) {
            SashResolutionState state = states.computeIfAbsent(sashId, id -> new SashResolutionState(id, cache));
            synchronized (state) {
                // released between lookup and lock; a fresh state takes its place
                if (state.isReleased()) continue;

                long generation = state.supersede();
                Optional<ResolutionResult> cached = cache.get(request);
                if (cached.isPresent()) {
                    log.debug("Cache hit for sash {}: {}", sashId, request.fingerprint());
                    deliver(sashId, () -> onSuccess.accept(cached.get()));
                    return;
                }

                state.timerStarted(eventLoop.schedule(
                        () -> fire(state, generation, request, onSuccess, onError),
                        debounceMs, TimeUnit.MILLISECONDS));
                log.debug("Scheduled resolution for sash {} in {}ms: {}", sashId, debounceMs, request.fingerprint());
                return;
            }
        }
    }

    private void fire(SashResolutionState state, long generation, ResolutionRequest request,
                      Consumer<ResolutionResult> onSuccess, Consumer<Throwable> onError) {
        CompletableFuture<ResolutionResult> call;
        synchronized (state) {
            if (!state.isLive(generation)) return;
            state.timerFired();

            try {
                call = transport.resolve(request);
            } catch (RuntimeException e) {
                log.warn("Transport rejected request for sash {}: {}", state.getSashId(), e.getMessage());
                deliver(state.getSashId(), () -> onError.accept(toFailure(e)));
                return;
            }
            state.callStarted(call);
        }
        log.debug("Sent resolution for sash {}: {}", state.getSashId(), request.fingerprint());

        call.whenCompleteAsync((result, error) -> complete(state, generation, request, result, error,
                onSuccess, onError), eventLoop);
    }

    private void complete(SashResolutionState state, long generation, ResolutionRequest request,
                          ResolutionResult result, Throwable error,
                          Consumer<ResolutionResult> onSuccess, Consumer<Throwable> onError) {
        synchronized (state) {
            if (!state.isLive(generation)) {
                log.debug("Discarding superseded result for sash {}: {}", state.getSashId(), request.fingerprint());
                return;
            }
            state.callFinished();

            if (error == null) {
                if (result == null) {
                    deliver(state.getSashId(), () -> onError.accept(
                            new TransportFailureException("Transport completed without a result")));
                    return;
                }
                ResolutionResult stored = state.getCache().put(request, result);
                deliver(state.getSashId(), () -> onSuccess.accept(stored));
                return;
            }

            Throwable cause = unwrap(error);
            if (cause instanceof CancellationException) {
                log.debug("Resolution for sash {} was cancelled", state.getSashId());
                return;
            }
            log.warn("Resolution for sash {} failed: {}", state.getSashId(), cause.getMessage());
            deliver(state.getSashId(), () -> onError.accept(toFailure(cause)));
        }
    }

    private static void deliver(String sashId, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.error("Callback for sash {} threw", sashId, e);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static CoefficientException toFailure(Throwable cause) {
        if (cause instanceof CoefficientException coefficientException) {
            return coefficientException;
        }
        return new TransportFailureException("Coefficient request failed: " + cause.getMessage(), cause);
    }

    /**
     * Cancels any pending or in-flight resolution for the sash and forgets it.
     * Call when the line item is removed from the order. If a callback for this sash is
     * running on another thread, waits for it to return.
     */
    public void releaseSash(String sashId) {
        SashResolutionState state = states.remove(sashId);
        if (state != null) {
            release(state);
            log.debug("Released sash {}", sashId);
        }
    }

    /**
     * Releases every tracked sash and clears the result cache, e.g. when switching orders.
     */
    public void resetAll() {
        List<SashResolutionState> released = new ArrayList<>();
        for (String sashId : new ArrayList<>(states.keySet())) {
            SashResolutionState state = states.remove(sashId);
            if (state != null) {
                released.add(state);
            }
        }
        for (SashResolutionState state : released) {
            release(state);
        }
        cache.clear();
        log.debug("Reset resolution client: released {} sashes", released.size());
    }

    private static void release(SashResolutionState state) {
        synchronized (state) {
            state.release();
        }
    }

    public int trackedSashCount() {
        return states.size();
    }

    /**
     * True while the sash has a debounce timer running or a call in flight.
     */
    public boolean isPending(String sashId) {
        SashResolutionState state = states.get(sashId);
        if (state == null) return false;
        synchronized (state) {
            return state.hasTimer() || state.hasInFlight();
        }
    }

    public ResultCache cache() {
        return cache;
    }

    @Override
    public void close() {
        resetAll();
        if (ownsEventLoop) {
            eventLoop.shutdownNow();
        }
    }
}
