package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Session-wide memo of completed resolutions keyed by {@link ResolutionRequest#fingerprint()}.
 * Entries are never evicted; {@link #clear()} is the only way to drop them.
 */
public class ResultCache {

    private final ConcurrentMap<String, ResolutionResult> results = new ConcurrentHashMap<>();

    public Optional<ResolutionResult> get(ResolutionRequest request) {
        return Optional.ofNullable(results.get(request.fingerprint()));
    }

    /**
     * Stores the result unless one is already cached for the same fingerprint.
     *
     * @return the cached instance, which callers should hand out
     */
    public ResolutionResult put(ResolutionRequest request, ResolutionResult result) {
        ResolutionResult existing = results.putIfAbsent(request.fingerprint(), result);
        return existing != null ? existing : result;
    }

    public int size() {
        return results.size();
    }

    public void clear() {
        results.clear();
    }
}
