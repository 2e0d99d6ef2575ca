package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.resolve.CoefficientResolver;
import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;
import nl.bytesoflife.coefficients.resolve.UnknownSystemException;
import nl.bytesoflife.coefficients.table.CoefficientTables;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class LocalCoefficientTransportTest {

    private final LocalCoefficientTransport transport =
            new LocalCoefficientTransport(new CoefficientResolver(CoefficientTables.bundled()));

    @Test
    void resolvesAsynchronously() throws Exception {
        ResolutionResult result = transport.resolve(new ResolutionRequest("uni1_zebra", "E", 1.5, 2.0))
                .get(2, TimeUnit.SECONDS);
        assertEquals(2.27, result.coefficient());
    }

    @Test
    void resolverErrorsFailTheFuture() {
        ExecutionException e = assertThrows(ExecutionException.class,
                () -> transport.resolve(new ResolutionRequest("nope", "E", 1, 1)).get(2, TimeUnit.SECONDS));
        assertInstanceOf(UnknownSystemException.class, e.getCause());
    }

    @Test
    void listsSystemsInDocumentOrder() throws Exception {
        assertEquals(List.of("uni1_zebra", "uni1_roll", "mini_zebra", "mini_roll"),
                List.copyOf(transport.systems().get(2, TimeUnit.SECONDS)));
    }

    @Test
    void drivesResolutionClient() throws Exception {
        BlockingQueue<Object> delivered = new LinkedBlockingQueue<>();
        try (ResolutionClient client = new ResolutionClient(transport)) {
            client.requestResolution("sash-1", new ResolutionRequest("mini_roll", "XYZ", 0.45, 1.1),
                    delivered::add, delivered::add, 10);
            client.requestResolution("sash-2", new ResolutionRequest("unknown", "E", 1, 1),
                    delivered::add, delivered::add, 10);

            Object first = delivered.poll(2, TimeUnit.SECONDS);
            Object second = delivered.poll(2, TimeUnit.SECONDS);
            assertNotNull(first);
            assertNotNull(second);
            List<Object> both = List.of(first, second);

            ResolutionResult result = both.stream()
                    .filter(ResolutionResult.class::isInstance)
                    .map(ResolutionResult.class::cast)
                    .findFirst().orElseThrow();
            assertTrue(result.isFallbackCategory());
            assertEquals("1", result.category());
            assertTrue(both.stream().anyMatch(UnknownSystemException.class::isInstance));
            assertEquals(1, client.cache().size());
        }
    }
}
