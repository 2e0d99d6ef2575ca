package nl.bytesoflife.coefficients.client;

import nl.bytesoflife.coefficients.CoefficientException;
import nl.bytesoflife.coefficients.parser.JsonParser;
import nl.bytesoflife.coefficients.parser.JsonWriter;
import nl.bytesoflife.coefficients.resolve.InvalidDimensionsException;
import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;
import nl.bytesoflife.coefficients.resolve.UnknownSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Talks to a {@code CoefficientServer} over HTTP with JSON bodies.
 * Cancelling a returned future also cancels the underlying exchange.
 */
public class HttpCoefficientTransport implements CoefficientTransport {

    private static final Logger log = LoggerFactory.getLogger(HttpCoefficientTransport.class);

    public static final String CALCULATE_PATH = "/api/coefficients/calculate";
    public static final String SYSTEMS_PATH = "/api/coefficients/systems";

    private final URI baseUri;
    private final JsonParser jsonParser = new JsonParser();
    private Duration timeout = Duration.ofSeconds(10);
    private final Map<String, String> headers = new LinkedHashMap<>();
    private HttpClient client;

    public HttpCoefficientTransport(URI baseUri) {
        if (baseUri == null) {
            throw new IllegalArgumentException("Base URI must not be null");
        }
        this.baseUri = baseUri;
    }

    public HttpCoefficientTransport withTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive");
        }
        this.timeout = timeout;
        this.client = null;
        return this;
    }

    public HttpCoefficientTransport withHeader(String name, String value) {
        headers.put(name, value);
        return this;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    @Override
    public CompletableFuture<ResolutionResult> resolve(ResolutionRequest request) {
        // JSON has no representation for NaN or infinity
        if (!Double.isFinite(request.width()) || !Double.isFinite(request.height())) {
            return CompletableFuture.failedFuture(new InvalidDimensionsException(
                    "Sash dimensions must be finite, got " + request.width() + " x " + request.height()));
        }
        String body = new JsonWriter()
                .field("systemKey", request.systemKey())
                .field("category", request.category())
                .field("width", request.width())
                .field("height", request.height())
                .toJson();
        HttpRequest httpRequest = newRequest(CALCULATE_PATH)
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();
        return exchange(httpRequest, json -> toResult(json, request), request.systemKey());
    }

    @Override
    public CompletableFuture<Set<String>> systems() {
        HttpRequest httpRequest = newRequest(SYSTEMS_PATH).GET().build();
        return exchange(httpRequest, this::toSystems, null);
    }

    private HttpRequest.Builder newRequest(String path) {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(baseUri.resolve(path))
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");
        for (Map.Entry<String, String> header : headers.entrySet()) {
            builder.header(header.getKey(), header.getValue());
        }
        return builder;
    }

    private <T> CompletableFuture<T> exchange(HttpRequest httpRequest, Function<Map<String, Object>, T> decoder,
                                              String systemKey) {
        CompletableFuture<HttpResponse<String>> exchange =
                httpClient().sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        CompletableFuture<T> result = exchange.thenApply(response -> decode(response, decoder, systemKey));
        result.whenComplete((value, error) -> {
            if (result.isCancelled()) {
                exchange.cancel(true);
            }
        });
        return result;
    }

    private <T> T decode(HttpResponse<String> response, Function<Map<String, Object>, T> decoder, String systemKey) {
        int status = response.statusCode();
        Map<String, Object> json;
        try {
            json = jsonParser.parseObject(response.body());
        } catch (JsonParser.ParseException e) {
            throw new TransportFailureException("HTTP " + status + " with unreadable body from "
                    + response.uri() + ": " + e.getMessage(), e);
        }
        if (status >= 200 && status < 300) {
            return decoder.apply(json);
        }
        throw toError(status, json, systemKey);
    }

    private static CoefficientException toError(int status, Map<String, Object> json, String systemKey) {
        String message = json.get("error") instanceof String s ? s : "HTTP " + status;
        String code = json.get("code") instanceof String s ? s : "";
        log.debug("Coefficient server answered {} {}: {}", status, code, message);
        return switch (code) {
            case UnknownSystemException.CODE -> new UnknownSystemException(systemKey, message);
            case InvalidDimensionsException.CODE -> new InvalidDimensionsException(message);
            default -> new TransportFailureException("HTTP " + status + ": " + message);
        };
    }

    private ResolutionResult toResult(Map<String, Object> json, ResolutionRequest request) {
        if (!(json.get("coefficient") instanceof Number coefficient)) {
            throw new TransportFailureException("Response has no numeric coefficient: " + json);
        }
        boolean fallback = json.get("isFallbackCategory") instanceof Boolean b && b;
        String warning = json.get("warning") instanceof String s ? s : null;
        String systemKey = json.get("systemKey") instanceof String s ? s : request.systemKey();
        String category = json.get("category") instanceof String s ? s : request.category();
        return new ResolutionResult(coefficient.doubleValue(), fallback, warning, systemKey, category);
    }

    private Set<String> toSystems(Map<String, Object> json) {
        if (!(json.get("systems") instanceof List<?> list)) {
            throw new TransportFailureException("Response has no systems array: " + json);
        }
        Set<String> systems = new LinkedHashSet<>();
        for (Object item : list) {
            systems.add(String.valueOf(item));
        }
        return Collections.unmodifiableSet(systems);
    }

    private synchronized HttpClient httpClient() {
        if (client == null) {
            client = HttpClient.newBuilder()
                    .connectTimeout(timeout)
                    .build();
        }
        return client;
    }
}
