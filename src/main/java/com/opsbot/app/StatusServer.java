package com.opsbot.app;

import com.opsbot.core.Job;
import com.opsbot.core.Suppression;
import com.opsbot.db.JobStore;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.json.JSONArray;
import org.json.JSONObject;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Level;
import java.util.logging.Logger;

// Read-only JSON view of queued jobs and suppression windows
public class StatusServer {
    private static final Logger logger = Logger.getLogger(StatusServer.class.getName());

    private final JobStore store;
    private final int port;
    private HttpServer server;
    private ExecutorService executor;

    // Port 0 binds an ephemeral port, see getPort()
    public StatusServer(JobStore store, int port) {
        this.store = store;
        this.port = port;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/jobs", new JsonHandler() {
            @Override
            Object body() throws SQLException {
                JSONArray jobs = new JSONArray();
                for (Job job : store.allJobs()) {
                    jobs.put(toJson(job));
                }
                return jobs;
            }
        });
        server.createContext("/suppressions", new JsonHandler() {
            @Override
            Object body() throws SQLException {
                JSONArray suppressions = new JSONArray();
                for (Suppression s : store.listSuppressions()) {
                    suppressions.put(new JSONObject()
                            .put("id", s.getId())
                            .put("job_type", s.getJobType())
                            .put("start_at", s.getStartAt().toString())
                            .put("end_at", s.getEndAt().toString()));
                }
                return suppressions;
            }
        });

        executor = Executors.newFixedThreadPool(2);
        server.setExecutor(executor);
        server.start();
        logger.info("Status server listening on port " + getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(1);
            executor.shutdown();
            logger.info("Status server stopped");
        }
    }

    public int getPort() {
        return server == null ? port : server.getAddress().getPort();
    }

    private static JSONObject toJson(Job job) {
        return new JSONObject()
                .put("id", job.getId())
                .put("type", job.getType())
                .put("args", new JSONObject(job.getArgs()))
                .put("channel", job.getChannel())
                .put("thread_ts", job.getThreadTs() == null ? JSONObject.NULL : job.getThreadTs())
                .put("is_im", job.isIm())
                .put("status", job.getStatus().name().toLowerCase(Locale.ROOT))
                .put("scheduled_at", format(job.getScheduledAt()))
                .put("reserved_at", format(job.getReservedAt()));
    }

    private static Object format(LocalDateTime time) {
        return time == null ? JSONObject.NULL : time.toString();
    }

    private abstract static class JsonHandler implements HttpHandler {
        abstract Object body() throws SQLException;

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                send(exchange, 405, new JSONObject().put("error", "Method Not Allowed").toString());
                return;
            }
            try {
                send(exchange, 200, body().toString());
            } catch (SQLException e) {
                logger.log(Level.SEVERE, "Failed to read store for " + exchange.getRequestURI(), e);
                send(exchange, 500, new JSONObject().put("error", e.getMessage()).toString());
            }
        }

        private void send(HttpExchange exchange, int status, String json) throws IOException {
            byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().set("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }
}
