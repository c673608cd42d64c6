package io.seatwatch.web.server;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.prometheusmetrics.PrometheusMeterRegistry;
import io.seatwatch.api.pool.BorrowRecord;
import io.seatwatch.api.pool.BorrowResult;
import io.seatwatch.api.pool.CapacityExceededException;
import io.seatwatch.api.pool.PoolConfigurationException;
import io.seatwatch.api.pool.PoolDefinition;
import io.seatwatch.api.pool.PoolLedger;
import io.seatwatch.api.pool.PoolStatus;
import io.seatwatch.api.pool.UnknownBorrowException;
import io.seatwatch.api.pool.UnknownPoolException;
import io.seatwatch.api.stream.SnapshotMessage;
import io.seatwatch.api.stream.SnapshotWriter;
import io.seatwatch.api.stream.StreamingSession;
import io.seatwatch.core.environment.LedgerEnvironment;
import io.seatwatch.core.stream.SnapshotCodec;
import jakarta.servlet.AsyncContext;
import jakarta.servlet.AsyncEvent;
import jakarta.servlet.AsyncListener;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.apache.catalina.Context;
import org.apache.catalina.LifecycleException;
import org.apache.catalina.startup.Tomcat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.util.Optional;

/**
 * Embedded Tomcat server that provides:
 * - REST endpoints for borrowing, returning and inspecting license pools
 * - budget and pool administration
 * - an SSE endpoint streaming ledger snapshots on every publisher tick
 * - a Prometheus scrape endpoint when a {@link PrometheusMeterRegistry} is given
 * <p>
 * Handlers only translate requests into ledger calls; all accounting happens in the core.
 */
public class SeatwatchWebServer {

    private static final Logger log = LoggerFactory.getLogger(SeatwatchWebServer.class);

    static final String STREAM_PATH = "/realtime/stream";
    static final String PROMETHEUS_CONTENT_TYPE = "text/plain; version=0.0.4; charset=utf-8";

    private final LedgerEnvironment environment;
    private final PrometheusMeterRegistry scrapeRegistry;
    private final int port;
    private final ObjectMapper objectMapper;
    private Tomcat tomcat;

    /**
     * @param scrapeRegistry served at {@code /metrics}; null leaves the endpoint out
     */
    public SeatwatchWebServer(LedgerEnvironment environment, PrometheusMeterRegistry scrapeRegistry, int port) {
        this.environment = environment;
        this.scrapeRegistry = scrapeRegistry;
        this.port = port;
        this.objectMapper = SnapshotCodec.newObjectMapper();
    }

    public void start() {
        try {
            tomcat = new Tomcat();
            tomcat.setBaseDir(Files.createTempDirectory("seatwatch-tomcat").toString());
            tomcat.setPort(port);
            tomcat.getConnector(); // trigger connector creation

            Context ctx = tomcat.addContext("", null);

            Tomcat.addServlet(ctx, "borrow", new BorrowServlet());
            ctx.addServletMappingDecoded("/licenses/borrow", "borrow");

            Tomcat.addServlet(ctx, "return", new ReturnServlet());
            ctx.addServletMappingDecoded("/licenses/return", "return");

            Tomcat.addServlet(ctx, "statusAll", new StatusAllServlet());
            ctx.addServletMappingDecoded("/licenses/status", "statusAll");

            // /licenses/{tool}/status
            Tomcat.addServlet(ctx, "poolStatus", new PoolStatusServlet());
            ctx.addServletMappingDecoded("/licenses/*", "poolStatus");

            Tomcat.addServlet(ctx, "borrows", new BorrowsServlet());
            ctx.addServletMappingDecoded("/borrows", "borrows");

            Tomcat.addServlet(ctx, "charges", new OverageChargesServlet());
            ctx.addServletMappingDecoded("/overage-charges", "charges");

            Tomcat.addServlet(ctx, "budget", new BudgetServlet());
            ctx.addServletMappingDecoded("/config/budget", "budget");

            Tomcat.addServlet(ctx, "pools", new PoolsServlet());
            ctx.addServletMappingDecoded("/config/pools", "pools");

            Tomcat.addServlet(ctx, "sse", new SseServlet()).setAsyncSupported(true);
            ctx.addServletMappingDecoded(STREAM_PATH, "sse");

            Tomcat.addServlet(ctx, "snapshot", new SnapshotServlet());
            ctx.addServletMappingDecoded("/realtime/snapshot", "snapshot");

            Tomcat.addServlet(ctx, "version", new VersionServlet());
            ctx.addServletMappingDecoded("/version", "version");

            if (scrapeRegistry != null) {
                Tomcat.addServlet(ctx, "metrics", new MetricsServlet());
                ctx.addServletMappingDecoded("/metrics", "metrics");
            }

            tomcat.start();
            log.info("Seatwatch web server started on port {}", port());

        } catch (IOException | LifecycleException e) {
            throw new IllegalStateException("Failed to start web server", e);
        }
    }

    public void stop() {
        if (tomcat == null) {
            return;
        }
        try {
            tomcat.stop();
            tomcat.destroy();
            log.info("Web server stopped");
        } catch (LifecycleException e) {
            log.error("Error stopping web server", e);
        } finally {
            tomcat = null;
        }
    }

    /**
     * @return the bound port, which differs from the configured one when that was 0
     */
    public int port() {
        if (tomcat == null) {
            return port;
        }
        return tomcat.getConnector().getLocalPort();
    }

    private PoolLedger ledger() {
        return environment.ledger();
    }

    // --- Servlets ---

    /**
     * Writes JSON responses and maps ledger exceptions to status codes.
     */
    private abstract class JsonServlet extends HttpServlet {

        @Override
        protected void service(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
            resp.setContentType("application/json");
            resp.setCharacterEncoding("UTF-8");
            resp.setHeader("Access-Control-Allow-Origin", "*");
            try {
                super.service(req, resp);
            } catch (CapacityExceededException e) {
                writeJson(resp, HttpServletResponse.SC_CONFLICT,
                        new ErrorResponse("unavailable", e.reason().name().toLowerCase(), e.getMessage()));
            } catch (UnknownPoolException e) {
                writeJson(resp, HttpServletResponse.SC_NOT_FOUND,
                        new ErrorResponse("unknown_pool", null, e.getMessage()));
            } catch (UnknownBorrowException e) {
                writeJson(resp, HttpServletResponse.SC_NOT_FOUND,
                        new ErrorResponse("not_found", null, e.getMessage()));
            } catch (PoolConfigurationException | IllegalArgumentException e) {
                writeJson(resp, HttpServletResponse.SC_BAD_REQUEST,
                        new ErrorResponse("invalid", null, e.getMessage()));
            } catch (JsonProcessingException e) {
                writeJson(resp, HttpServletResponse.SC_BAD_REQUEST,
                        new ErrorResponse("invalid", null, "Malformed request body"));
            } catch (RuntimeException e) {
                log.error("Request {} {} failed", req.getMethod(), req.getRequestURI(), e);
                writeJson(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
                        new ErrorResponse("internal", null, e.getMessage()));
            }
        }

        <T> T readBody(HttpServletRequest req, Class<T> type) throws IOException {
            T body = objectMapper.readValue(req.getInputStream(), type);
            if (body == null) {
                throw new IllegalArgumentException("Request body is required");
            }
            return body;
        }

        void writeJson(HttpServletResponse resp, int status, Object body) throws IOException {
            resp.setStatus(status);
            resp.getWriter().write(objectMapper.writeValueAsString(body));
        }

        void writeJson(HttpServletResponse resp, Object body) throws IOException {
            writeJson(resp, HttpServletResponse.SC_OK, body);
        }
    }

    private class BorrowServlet extends JsonServlet {
        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            BorrowRequest body = readBody(req, BorrowRequest.class);
            if (body.tool() == null || body.tool().isBlank()) {
                throw new IllegalArgumentException("tool is required");
            }
            BorrowResult result = ledger().borrow(body.tool(), body.user());
            writeJson(resp, result);
        }
    }

    private class ReturnServlet extends JsonServlet {
        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            ReturnRequest body = readBody(req, ReturnRequest.class);
            BorrowRecord returned = ledger().returnBorrow(body.id());
            writeJson(resp, returned);
        }
    }

    private class StatusAllServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            writeJson(resp, ledger().statusAll());
        }
    }

    private class PoolStatusServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String path = req.getPathInfo();
            if (path == null || !path.endsWith("/status") || path.length() <= "/status".length() + 1) {
                writeJson(resp, HttpServletResponse.SC_NOT_FOUND, new ErrorResponse("not_found", null, req.getRequestURI()));
                return;
            }
            String tool = path.substring(1, path.length() - "/status".length());
            writeJson(resp, ledger().status(tool));
        }
    }

    private class BorrowsServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            writeJson(resp, ledger().outstanding(Optional.ofNullable(req.getParameter("user"))));
        }
    }

    private class OverageChargesServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            writeJson(resp, ledger().overageCharges(Optional.ofNullable(req.getParameter("tool"))));
        }
    }

    private class BudgetServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            writeJson(resp, ledger().statusAll());
        }

        @Override
        protected void doPut(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            PoolRequest body = readBody(req, PoolRequest.class);
            PoolStatus current = ledger().status(body.requireTool());
            writeJson(resp, ledger().reconfigure(body.toDefinition(current)));
        }
    }

    private class PoolsServlet extends JsonServlet {
        @Override
        protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            PoolRequest body = readBody(req, PoolRequest.class);
            if (ledger().poolNames().contains(body.requireTool())) {
                writeJson(resp, HttpServletResponse.SC_CONFLICT,
                        new ErrorResponse("exists", null, "Pool already exists: " + body.tool()));
                return;
            }
            writeJson(resp, HttpServletResponse.SC_CREATED, ledger().provision(body.toDefinition(null)));
        }
    }

    private class SnapshotServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            var snapshot = environment.publisher().latest()
                    .orElseGet(() -> environment.publisher().compose());
            writeJson(resp, snapshot);
        }
    }

    private class VersionServlet extends JsonServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            String version = SeatwatchWebServer.class.getPackage().getImplementationVersion();
            writeJson(resp, new VersionResponse("seatwatch", version == null ? "dev" : version));
        }
    }

    private class MetricsServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setContentType(PROMETHEUS_CONTENT_TYPE);
            resp.getWriter().write(scrapeRegistry.scrape());
        }
    }

    private class SseServlet extends HttpServlet {
        @Override
        protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
            resp.setContentType("text/event-stream");
            resp.setCharacterEncoding("UTF-8");
            resp.setHeader("Cache-Control", "no-cache");
            resp.setHeader("Connection", "keep-alive");
            resp.setHeader("Access-Control-Allow-Origin", "*");

            AsyncContext asyncContext = req.startAsync();
            asyncContext.setTimeout(0);

            StreamingSession session = environment.subscribe();
            asyncContext.addListener(new SessionCleanup(session));

            resp.getWriter().write(": connected " + session.id() + "\n\n");
            resp.getWriter().flush();

            environment.sessionManager().open(session, new SseSnapshotWriter(asyncContext));
        }
    }

    /**
     * Writes snapshots as SSE {@code data:} frames onto a held-open async response.
     */
    private static final class SseSnapshotWriter implements SnapshotWriter {

        private final AsyncContext asyncContext;

        SseSnapshotWriter(AsyncContext asyncContext) {
            this.asyncContext = asyncContext;
        }

        @Override
        public synchronized void write(SnapshotMessage message) throws IOException {
            PrintWriter writer;
            try {
                writer = asyncContext.getResponse().getWriter();
            } catch (IllegalStateException e) {
                throw new IOException("Response already completed", e);
            }
            writer.write("id: " + message.sequence() + "\n");
            writer.write("data: " + message.payload() + "\n\n");
            writer.flush();
            if (writer.checkError()) {
                throw new IOException("Client disconnected");
            }
        }

        @Override
        public synchronized void closed() {
            try {
                asyncContext.complete();
            } catch (IllegalStateException e) {
                log.debug("SSE response already completed: {}", e.getMessage());
            }
        }
    }

    private final class SessionCleanup implements AsyncListener {

        private final StreamingSession session;

        SessionCleanup(StreamingSession session) {
            this.session = session;
        }

        @Override
        public void onComplete(AsyncEvent event) {
            environment.sessionManager().unsubscribe(session);
        }

        @Override
        public void onTimeout(AsyncEvent event) {
            environment.sessionManager().unsubscribe(session);
        }

        @Override
        public void onError(AsyncEvent event) {
            log.debug("SSE session {} errored", session.id(), event.getThrowable());
            environment.sessionManager().unsubscribe(session);
        }

        @Override
        public void onStartAsync(AsyncEvent event) {
        }
    }

    // DTOs
    record BorrowRequest(@JsonProperty("tool") String tool, @JsonProperty("user") String user) {}

    record ReturnRequest(@JsonProperty("id") String id) {}

    record PoolRequest(@JsonProperty("tool") String tool,
                       @JsonProperty("total") Integer total,
                       @JsonProperty("commit") Integer commit,
                       @JsonProperty("max_overage") Integer maxOverage,
                       @JsonProperty("commit_price") BigDecimal commitPrice,
                       @JsonProperty("overage_price_per_license") BigDecimal overagePricePerLicense) {

        String requireTool() {
            if (tool == null || tool.isBlank()) {
                throw new IllegalArgumentException("tool is required");
            }
            return tool;
        }

        /**
         * Fields missing from the request keep their current values, if there are any.
         */
        PoolDefinition toDefinition(PoolStatus current) {
            if (total == null || commit == null) {
                throw new IllegalArgumentException("total and commit are required");
            }
            PoolDefinition definition = PoolDefinition.named(requireTool())
                    .totalCapacity(total)
                    .commitQuantity(commit);
            if (maxOverage != null) {
                definition.maxOverage(maxOverage);
            }
            BigDecimal fee = commitPrice != null ? commitPrice : current != null ? current.commitPrice() : null;
            if (fee != null) {
                definition.commitFee(fee);
            }
            BigDecimal unit = overagePricePerLicense != null ? overagePricePerLicense
                    : current != null ? current.overagePricePerLicense() : null;
            if (unit != null) {
                definition.overageUnitPrice(unit);
            }
            return definition.validate();
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    record ErrorResponse(String error, String reason, String message) {}

    record VersionResponse(String name, String version) {}
}
