package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;

import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Transport whose calls stay pending until the test completes them.
 */
class FakeTransport implements CoefficientTransport {

    final List<ResolutionRequest> requests = new CopyOnWriteArrayList<>();
    final List<CompletableFuture<ResolutionResult>> calls = new CopyOnWriteArrayList<>();
    private final Semaphore sent = new Semaphore(0);
    volatile RuntimeException rejectWith;

    @Override
    public CompletableFuture<ResolutionResult> resolve(ResolutionRequest request) {
        requests.add(request);
        sent.release();
        if (rejectWith != null) {
            throw rejectWith;
        }
        CompletableFuture<ResolutionResult> call = new CompletableFuture<>();
        calls.add(call);
        return call;
    }

    @Override
    public CompletableFuture<Set<String>> systems() {
        return CompletableFuture.completedFuture(Set.of("roller"));
    }

    void awaitCalls(int count) throws InterruptedException {
        assertTrue(sent.tryAcquire(count, 2, TimeUnit.SECONDS), "expected " + count + " transport call(s)");
    }

    CompletableFuture<ResolutionResult> call(int index) {
        return calls.get(index);
    }
}
