package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Carries a resolution request to wherever the resolver runs.
 * Cancelling a returned future aborts the exchange; an aborted exchange never
 * completes the future normally.
 */
public interface CoefficientTransport {

    /**
     * Failures complete the future exceptionally with a
     * {@link nl.bytesoflife.coefficients.CoefficientException} subclass.
     */
    CompletableFuture<ResolutionResult> resolve(ResolutionRequest request);

    /**
     * Known system keys, exactly as the remote table reports them.
     */
    CompletableFuture<Set<String>> systems();
}
