package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.CoefficientResolver;
import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;

/**
 * Runs the resolver in-process on an executor. Useful when the table is bundled with
 * the application and no HTTP hop is wanted.
 */
public class LocalCoefficientTransport implements CoefficientTransport {

    private final CoefficientResolver resolver;
    private final Executor executor;

    public LocalCoefficientTransport(CoefficientResolver resolver) {
        this(resolver, ForkJoinPool.commonPool());
    }

    public LocalCoefficientTransport(CoefficientResolver resolver, Executor executor) {
        if (resolver == null || executor == null) {
            throw new IllegalArgumentException("Resolver and executor must not be null");
        }
        this.resolver = resolver;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<ResolutionResult> resolve(ResolutionRequest request) {
        return CompletableFuture.supplyAsync(() -> resolver.resolve(request), executor);
    }

    @Override
    public CompletableFuture<Set<String>> systems() {
        return CompletableFuture.completedFuture(resolver.getTable().systems());
    }
}
