package com.venturegate.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exercises the notifier against a local HTTP stub standing in for the orchestrator.
 */
class HttpOrchestratorNotifierTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final AtomicReference<String> body = new AtomicReference<>();
    private final AtomicReference<String> authorization = new AtomicReference<>();
    private final AtomicReference<String> contentType = new AtomicReference<>();
    private final AtomicInteger calls = new AtomicInteger();

    private HttpServer server;
    private volatile int responseStatus = 200;

    @BeforeEach
    void startStub() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/resume", exchange -> {
            calls.incrementAndGet();
            body.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            authorization.set(exchange.getRequestHeaders().getFirst("Authorization"));
            contentType.set(exchange.getRequestHeaders().getFirst("Content-Type"));
            byte[] reply = "{\"ok\":true}".getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(responseStatus, reply.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(reply);
            }
        });
        server.start();
    }

    @AfterEach
    void stopStub() {
        server.stop(0);
    }

    @Test
    void postsSnakeCaseBodyWithBearerToken() throws Exception {
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(resumeUrl(), "secret-token"),
            objectMapper);

        notifier.notifyResume(new ResumeNotification("exec-1", "task-1", "approved", "ship it", "founder-1"));

        assertEquals(1, calls.get());
        assertEquals("Bearer secret-token", authorization.get());
        assertEquals("application/json", contentType.get());
        JsonNode json = objectMapper.readTree(body.get());
        assertEquals("exec-1", json.get("run_id").asText());
        assertEquals("task-1", json.get("checkpoint").asText());
        assertEquals("approved", json.get("decision").asText());
        assertEquals("ship it", json.get("feedback").asText());
        assertEquals("founder-1", json.get("decided_by").asText());
    }

    @Test
    void omitsAuthorizationWithoutToken() {
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(resumeUrl(), ""), objectMapper);

        notifier.notifyResume(new ResumeNotification("exec-2", null, "rejected", null, "founder-1"));

        assertEquals(1, calls.get());
        assertNull(authorization.get());
    }

    @Test
    void errorStatusRaises() {
        responseStatus = 500;
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(resumeUrl(), null), objectMapper);

        OrchestratorNotificationException ex = assertThrows(OrchestratorNotificationException.class,
            () -> notifier.notifyResume(new ResumeNotification("exec-3", "t", "approved", null, "a")));

        assertTrue(ex.getMessage().contains("500"));
    }

    @Test
    void redirectIsNotTreatedAsResumed() {
        responseStatus = 307;
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(resumeUrl(), null), objectMapper);

        OrchestratorNotificationException ex = assertThrows(OrchestratorNotificationException.class,
            () -> notifier.notifyResume(new ResumeNotification("exec-6", "t", "approved", null, "a")));

        assertTrue(ex.getMessage().contains("307"));
        assertEquals(1, calls.get());
    }

    @Test
    void unreachableOrchestratorRaises() throws IOException {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        String url = "http://127.0.0.1:" + closedPort + "/resume";
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(url, null), objectMapper);

        assertThrows(OrchestratorNotificationException.class,
            () -> notifier.notifyResume(new ResumeNotification("exec-4", "t", "approved", null, "a")));
    }

    @Test
    void blankUrlSkipsTheCall() {
        HttpOrchestratorNotifier notifier = new HttpOrchestratorNotifier(properties(" ", "token"), objectMapper);

        assertDoesNotThrow(() -> notifier.notifyResume(new ResumeNotification("exec-5", "t", "approved", null, "a")));
        assertEquals(0, calls.get());
    }

    private String resumeUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort() + "/resume";
    }

    private static OrchestratorProperties properties(String url, String token) {
        OrchestratorProperties properties = new OrchestratorProperties();
        properties.setResumeUrl(url);
        properties.setAuthToken(token);
        properties.setTimeout(Duration.ofSeconds(2));
        return properties;
    }
}
