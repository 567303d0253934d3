package com.opsbot.test;

import com.opsbot.app.StatusServer;
import com.opsbot.db.Database;
import com.opsbot.db.JobStore;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class StatusServerTest {

    private static final LocalDateTime START = LocalDateTime.of(2024, 2, 2, 10, 0, 0);

    private Database database;
    private JobStore store;
    private StatusServer server;
    private final HttpClient http = HttpClient.newHttpClient();

    @BeforeEach
    public void setUp() throws SQLException, IOException {
        database = new Database("jdbc:h2:mem:status-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        database.initialize();
        store = new JobStore(database, new MutableClock(START));
        server = new StatusServer(store, 0);
        server.start();
    }

    @AfterEach
    public void tearDown() {
        server.stop();
        database.close();
    }

    private HttpResponse<String> send(String method, String path) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.getPort() + path))
                .method(method, HttpRequest.BodyPublishers.noBody())
                .build();
        return http.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    public void testJobsEndpoint() throws Exception {
        store.enqueueJob("proj_deploy", Map.of("branch", "main"), "C1", null, 30, false);

        HttpResponse<String> response = send("GET", "/jobs");

        assertEquals(200, response.statusCode());
        assertEquals("application/json", response.headers().firstValue("Content-Type").orElse(""));
        JSONArray jobs = new JSONArray(response.body());
        assertEquals(1, jobs.length());
        JSONObject job = jobs.getJSONObject(0);
        assertEquals("proj_deploy", job.getString("type"));
        assertEquals("main", job.getJSONObject("args").getString("branch"));
        assertEquals("pending", job.getString("status"));
        assertEquals(START.plusSeconds(30).toString(), job.getString("scheduled_at"));
    }

    @Test
    public void testSuppressionsEndpoint() throws Exception {
        store.addSuppression("proj_deploy", START, START.plusHours(1));

        HttpResponse<String> response = send("GET", "/suppressions");

        assertEquals(200, response.statusCode());
        JSONArray suppressions = new JSONArray(response.body());
        assertEquals(1, suppressions.length());
        assertEquals("proj_deploy", suppressions.getJSONObject(0).getString("job_type"));
    }

    @Test
    public void testOnlyGetIsAllowed() throws Exception {
        assertEquals(405, send("POST", "/jobs").statusCode());
        assertEquals(405, send("DELETE", "/suppressions").statusCode());
    }
}
