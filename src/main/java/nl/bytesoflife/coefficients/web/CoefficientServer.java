package nl.bytesoflife.coefficients.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import nl.bytesoflife.coefficients.parser.JsonParser;
import nl.bytesoflife.coefficients.parser.JsonWriter;
import nl.bytesoflife.coefficients.resolve.CoefficientResolver;
import nl.bytesoflife.coefficients.resolve.InvalidDimensionsException;
import nl.bytesoflife.coefficients.resolve.LookupMode;
import nl.bytesoflife.coefficients.resolve.ResolutionRequest;
import nl.bytesoflife.coefficients.resolve.ResolutionResult;
import nl.bytesoflife.coefficients.resolve.UnknownSystemException;
import nl.bytesoflife.coefficients.table.CoefficientTable;
import nl.bytesoflife.coefficients.table.CoefficientTables;
import nl.bytesoflife.coefficients.table.GridRanges;
import nl.bytesoflife.coefficients.table.SystemEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end for the coefficient resolver.
 * <ul>
 *   <li>{@code POST /api/coefficients/calculate} resolves one sash</li>
 *   <li>{@code GET /api/coefficients/systems} lists the system keys of the loaded table</li>
 *   <li>{@code GET /api/coefficients/categories?systemKey=K} lists a system's categories</li>
 *   <li>{@code GET /api/coefficients/ranges?systemKey=K&category=C} reports a grid's measured range</li>
 * </ul>
 * Errors are answered as {@code {"error": message, "code": CODE}}.
 */
public class CoefficientServer {

    private static final Logger log = LoggerFactory.getLogger(CoefficientServer.class);

    static final String MALFORMED_REQUEST = "MALFORMED_REQUEST";
    static final String NOT_FOUND = "NOT_FOUND";
    static final String METHOD_NOT_ALLOWED = "METHOD_NOT_ALLOWED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    private final int port;
    private final CoefficientResolver resolver;
    private int workerThreads = 4;
    private HttpServer server;
    private ExecutorService executor;

    /**
     * @param port     TCP port, or 0 to pick a free one
     * @param resolver resolver over the table to serve
     */
    public CoefficientServer(int port, CoefficientResolver resolver) {
        if (resolver == null) {
            throw new IllegalArgumentException("Resolver must not be null");
        }
        this.port = port;
        this.resolver = resolver;
    }

    public CoefficientServer withWorkerThreads(int workerThreads) {
        if (workerThreads < 1) {
            throw new IllegalArgumentException("Worker threads must be >= 1");
        }
        this.workerThreads = workerThreads;
        return this;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        CoefficientTable table = resolver.getTable();
        server.createContext("/api/coefficients/calculate", new CalculateHandler(resolver));
        server.createContext("/api/coefficients/systems", new SystemsHandler(table));
        server.createContext("/api/coefficients/categories", new CategoriesHandler(table));
        server.createContext("/api/coefficients/ranges", new RangesHandler(table));
        executor = Executors.newFixedThreadPool(workerThreads, runnable -> {
            Thread thread = new Thread(runnable, "coefficient-server");
            thread.setDaemon(true);
            return thread;
        });
        server.setExecutor(executor);
        server.start();
        log.info("Coefficient server started at http://localhost:{} serving {} systems",
                getPort(), table.size());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
    }

    /**
     * The bound port; differs from the configured one when that was 0.
     */
    public int getPort() {
        if (server == null) {
            throw new IllegalStateException("Server is not running");
        }
        return server.getAddress().getPort();
    }

    /**
     * Resolves one sash's coefficient from a JSON request body.
     */
    static class CalculateHandler implements HttpHandler {
        private static final Logger log = LoggerFactory.getLogger(CalculateHandler.class);

        private final CoefficientResolver resolver;
        private final JsonParser jsonParser = new JsonParser();

        CalculateHandler(CoefficientResolver resolver) {
            this.resolver = resolver;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, METHOD_NOT_ALLOWED, "Method Not Allowed");
                return;
            }

            try {
                String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
                ResolutionRequest request = parseRequest(body);
                if (request == null) {
                    sendError(exchange, 400, MALFORMED_REQUEST,
                            "Expected {systemKey: string, category: string, width: number, height: number}");
                    return;
                }

                ResolutionResult result = resolver.resolve(request);
                if (result.hasWarning()) {
                    log.warn("Resolved {}/{} {}x{} with warning: {}", request.systemKey(), request.category(),
                            request.width(), request.height(), result.warning());
                } else {
                    log.debug("Resolved {}/{} {}x{} -> {}", request.systemKey(), request.category(),
                            request.width(), request.height(), result.coefficient());
                }

                String json = new JsonWriter()
                        .field("coefficient", result.coefficient())
                        .field("isFallbackCategory", result.isFallbackCategory())
                        .optionalField("warning", result.warning())
                        .field("systemKey", result.systemKey())
                        .field("category", result.category())
                        .toJson();
                sendResponse(exchange, 200, json);
            } catch (UnknownSystemException e) {
                log.warn("Coefficient request for unknown system \"{}\"", e.getSystemKey());
                sendError(exchange, 404, e.getCode(), e.getMessage());
            } catch (InvalidDimensionsException e) {
                sendError(exchange, 400, e.getCode(), e.getMessage());
            } catch (JsonParser.ParseException e) {
                sendError(exchange, 400, MALFORMED_REQUEST, "Request body is not valid JSON: " + e.getMessage());
            } catch (Exception e) {
                log.error("Error resolving coefficient", e);
                sendError(exchange, 500, INTERNAL_ERROR, String.valueOf(e.getMessage()));
            }
        }

        private ResolutionRequest parseRequest(String body) {
            Map<String, Object> json = jsonParser.parseObject(body);
            Object systemKey = json.get("systemKey");
            Object category = json.get("category");
            Double width = toDouble(json.get("width"));
            Double height = toDouble(json.get("height"));
            if (!(systemKey instanceof String) || (category != null && !(category instanceof String))
                    || width == null || height == null) {
                return null;
            }
            return new ResolutionRequest((String) systemKey, (String) category, width, height);
        }

        private static Double toDouble(Object value) {
            if (value instanceof Number n) return n.doubleValue();
            if (value instanceof String s) {
                try {
                    return Double.parseDouble(s.trim());
                } catch (NumberFormatException e) {
                    return null;
                }
            }
            return null;
        }
    }

    /**
     * Lists every system key of the loaded table.
     */
    static class SystemsHandler implements HttpHandler {
        private final CoefficientTable table;

        SystemsHandler(CoefficientTable table) {
            this.table = table;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, METHOD_NOT_ALLOWED, "Method Not Allowed");
                return;
            }
            sendResponse(exchange, 200, new JsonWriter().field("systems", table.systems()).toJson());
        }
    }

    static class CategoriesHandler implements HttpHandler {
        private final CoefficientTable table;

        CategoriesHandler(CoefficientTable table) {
            this.table = table;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, METHOD_NOT_ALLOWED, "Method Not Allowed");
                return;
            }
            String systemKey = queryParams(exchange).get("systemKey");
            if (systemKey == null) {
                sendError(exchange, 400, MALFORMED_REQUEST, "Missing query parameter systemKey");
                return;
            }
            Optional<SystemEntry> system = table.findSystemIgnoreCase(systemKey);
            if (system.isEmpty()) {
                sendError(exchange, 404, UnknownSystemException.CODE, new UnknownSystemException(systemKey).getMessage());
                return;
            }
            String json = new JsonWriter()
                    .field("systemKey", system.get().getSystemKey())
                    .field("categories", system.get().categories())
                    .toJson();
            sendResponse(exchange, 200, json);
        }
    }

    static class RangesHandler implements HttpHandler {
        private final CoefficientTable table;

        RangesHandler(CoefficientTable table) {
            this.table = table;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendError(exchange, 405, METHOD_NOT_ALLOWED, "Method Not Allowed");
                return;
            }
            Map<String, String> params = queryParams(exchange);
            String systemKey = params.get("systemKey");
            String category = params.get("category");
            if (systemKey == null || category == null) {
                sendError(exchange, 400, MALFORMED_REQUEST, "Missing query parameter systemKey or category");
                return;
            }
            Optional<SystemEntry> system = table.findSystemIgnoreCase(systemKey);
            if (system.isEmpty()) {
                sendError(exchange, 404, UnknownSystemException.CODE, new UnknownSystemException(systemKey).getMessage());
                return;
            }
            Optional<String> matched = system.get().findCategoryIgnoreCase(category);
            if (matched.isEmpty()) {
                sendError(exchange, 404, NOT_FOUND,
                        "Category \"" + category + "\" is not configured for system \""
                                + system.get().getSystemKey() + "\"");
                return;
            }
            GridRanges r = system.get().grid(matched.get()).orElseThrow().ranges();
            String json = new JsonWriter()
                    .field("systemKey", system.get().getSystemKey())
                    .field("category", matched.get())
                    .field("widthMin", r.widthMin())
                    .field("widthMax", r.widthMax())
                    .field("heightMin", r.heightMin())
                    .field("heightMax", r.heightMax())
                    .field("widthPoints", r.widthPoints())
                    .field("heightPoints", r.heightPoints())
                    .toJson();
            sendResponse(exchange, 200, json);
        }
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        Map<String, String> params = new LinkedHashMap<>();
        String query = exchange.getRequestURI().getRawQuery();
        if (query == null) return params;
        for (String param : query.split("&")) {
            String[] kv = param.split("=", 2);
            if (kv.length == 2) {
                params.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    private static void sendError(HttpExchange exchange, int status, String code, String message)
            throws IOException {
        sendResponse(exchange, status, new JsonWriter().field("error", message).field("code", code).toJson());
    }

    private static void sendResponse(HttpExchange exchange, int status, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    public static void main(String[] args) throws IOException {
        int port = 8080;
        if (args.length > 0) {
            port = Integer.parseInt(args[0]);
        }
        CoefficientTable table = args.length > 1
                ? CoefficientTables.load(Path.of(args[1]))
                : CoefficientTables.bundled();
        LookupMode mode = args.length > 2 ? LookupMode.fromName(args[2]) : LookupMode.CEILING;

        CoefficientResolver resolver = new CoefficientResolver(table).withLookupMode(mode);
        CoefficientServer server = new CoefficientServer(port, resolver);
        server.start();
        log.info("Lookup mode: {}", mode);

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
