package org.eventstatus.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.MissingNode;
import org.eventstatus.client.dto.CompletionSummary;
import org.eventstatus.client.dto.Event;
import org.eventstatus.config.XmlConfiguration;
import org.eventstatus.utils.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link EventBackendClient} over {@code java.net.http}. One instance is shared by
 * every job; it owns the superadmin token for the lifetime of the process.
 */
public class HttpEventBackendClient implements EventBackendClient {
    private static final Logger logger = LoggerFactory.getLogger(HttpEventBackendClient.class);

    private static final String EVENTS_STATUS_PATH = "/events/api/events-status/";
    private static final String EVENTS_PATH = "/events/api/events/";
    private static final String COMPLETION_PATH = "/analysis/process-event-completion/";
    private static final String LOGIN_PATH = "/auth/login/";
    private static final String REFRESH_PATH = "/auth/refresh-token/";

    private final String baseUrl;
    private final Duration timeout;
    private final Duration completionTimeout;
    private final SuperadminCredentials credentials;
    private final HttpClient client;
    private final ObjectMapper mapper = JsonUtil.mapper();

    // Unguarded: concurrent refreshes both end with a usable token, last writer wins.
    private volatile String token;

    public HttpEventBackendClient(XmlConfiguration.Backend cfg, SuperadminCredentials credentials) {
        this(cfg, credentials, HttpClient.newBuilder()
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(Duration.ofSeconds(cfg.httpTimeoutSeconds))
                .build());
    }

    public HttpEventBackendClient(XmlConfiguration.Backend cfg, SuperadminCredentials credentials, HttpClient client) {
        this.baseUrl = stripTrailingSlash(cfg.baseUrl);
        this.timeout = Duration.ofSeconds(cfg.httpTimeoutSeconds);
        this.completionTimeout = Duration.ofSeconds(cfg.completionTimeoutSeconds);
        this.credentials = credentials;
        this.client = client;
        this.token = credentials.token();
    }

    @Override
    public List<Event> fetchDueToStart() {
        return fetchEvents("fetch pending-start events", EVENTS_STATUS_PATH + "pending-start/");
    }

    @Override
    public List<Event> fetchDueToFinish() {
        return fetchEvents("fetch pending-finish events", EVENTS_STATUS_PATH + "pending-finish/");
    }

    @Override
    public List<Event> fetchExpired() {
        return fetchEvents("fetch expired events", EVENTS_STATUS_PATH + "expired/");
    }

    @Override
    public boolean start(long eventId) {
        return transition("start event " + eventId, eventId, "start");
    }

    @Override
    public boolean finish(long eventId) {
        return transition("finish event " + eventId, eventId, "finish");
    }

    @Override
    public boolean triggerCompletionProcessing(long eventId) {
        String operation = "completion processing for event " + eventId;
        return call(operation, false, () -> {
            Map<String, Object> payload = Map.of("event_id", eventId);
            JsonNode body = send(operation, "POST", COMPLETION_PATH, payload, completionTimeout, true);
            if (!body.has("message")) {
                logger.warn("[{}] Response did not acknowledge the request: {}", operation, body);
                return false;
            }

            CompletionSummary summary = CompletionSummary.fromJson(body);
            logger.info("[{}] {} (participants={}, successful={}, failed={})", operation,
                    summary.message(), summary.totalParticipants(), summary.successful(), summary.failed());
            if (summary.failed() > 0) {
                for (CompletionSummary.ParticipantResult failure : summary.failures()) {
                    logger.warn("[{}] Participant '{}' failed: {}", operation,
                            failure.participantName(), failure.error());
                }
            }
            return true;
        });
    }

    @Override
    public boolean delete(long eventId) {
        String operation = "delete event " + eventId;
        return call(operation, false, () -> {
            JsonNode body = send(operation, "DELETE", EVENTS_PATH + eventId, null, timeout, true);
            JsonNode success = body.path("success");
            if (success.isMissingNode() || success.isNull()) {
                return true;
            }
            if (!success.asBoolean(true)) {
                logger.warn("[{}] Backend refused deletion: {}", operation, errorDetail(body));
                return false;
            }
            return true;
        });
    }

    @Override
    public boolean ensureToken() {
        String current = token;
        if (current == null || current.isBlank()) {
            logger.info("No superadmin token held, logging in");
            return login();
        }

        String refreshed = refresh(current);
        if (refreshed != null) {
            token = refreshed;
            logger.info("Superadmin token refreshed");
            return true;
        }

        logger.warn("Superadmin token refresh failed, falling back to login");
        return login();
    }

    private String refresh(String current) {
        String operation = "refresh token";
        return call(operation, null, () -> {
            JsonNode body = send(operation, "POST", REFRESH_PATH, Map.of("token", current), timeout, true);
            String refreshed = textOrNull(body.path("token"));
            if (refreshed == null) {
                logger.warn("[{}] Response did not contain a token", operation);
            }
            return refreshed;
        });
    }

    private boolean login() {
        if (!credentials.canLogin()) {
            logger.error("Superadmin email/password are not configured, cannot log in");
            return false;
        }
        String operation = "login";
        return call(operation, false, () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("email", credentials.email());
            payload.put("password", credentials.password());

            JsonNode body = send(operation, "POST", LOGIN_PATH, payload, timeout, false);
            String obtained = textOrNull(body.path("token"));
            if (obtained == null) {
                logger.error("[{}] Response did not contain a token", operation);
                return false;
            }
            token = obtained;
            logger.info("Superadmin login succeeded for {}", credentials.email());
            return true;
        });
    }

    private List<Event> fetchEvents(String operation, String path) {
        return call(operation, List.of(), () -> {
            JsonNode body = send(operation, "GET", path, null, timeout, true);
            JsonNode results = body.path("results");
            if (!results.isArray()) {
                logger.warn("[{}] Response has no 'results' array", operation);
                return List.of();
            }
            List<Event> events = new ArrayList<>(results.size());
            for (JsonNode node : results) {
                events.add(Event.fromJson(node));
            }
            logger.debug("[{}] {} event(s) returned", operation, events.size());
            return events;
        });
    }

    private boolean transition(String operation, long eventId, String action) {
        return call(operation, false, () -> {
            JsonNode body = send(operation, "POST", EVENTS_STATUS_PATH + eventId + "/" + action + "/",
                    null, timeout, true);
            JsonNode success = body.path("success");
            if (success.isBoolean() && success.booleanValue()) {
                logger.info("[{}] Accepted, new status: {}", operation, body.path("status").asText("unknown"));
                return true;
            }
            logger.warn("[{}] Backend did not accept the transition: {}", operation, errorDetail(body));
            return false;
        });
    }

    /**
     * Single choke point for the error taxonomy: every failure is logged with the
     * operation name and replaced by {@code fallback}.
     */
    private <T> T call(String operation, T fallback, BackendCall<T> body) {
        try {
            return body.run();
        } catch (BackendApiException e) {
            logger.error("[{}] Backend error: HTTP {} - {}", operation, e.getStatusCode(), e.getDetail());
        } catch (HttpTimeoutException e) {
            logger.error("[{}] Request timed out: {}", operation, e.getMessage());
        } catch (IOException e) {
            logger.error("[{}] Transport error: {}", operation, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("[{}] Interrupted while waiting for the backend", operation);
        } catch (Exception e) {
            logger.error("[{}] Unexpected error: {}", operation, e.getMessage(), e);
        }
        return fallback;
    }

    private JsonNode send(String operation, String method, String path, Object payload,
                          Duration requestTimeout, boolean authorized) throws IOException, InterruptedException {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + path))
                .timeout(requestTimeout)
                .header("Content-Type", "application/json")
                .header("Accept", "application/json");

        String bearer = token;
        if (authorized && bearer != null && !bearer.isBlank()) {
            builder.header("Authorization", "Bearer " + bearer);
        }

        HttpRequest.BodyPublisher publisher = payload == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(payload));
        builder.method(method, publisher);

        logger.debug("[{}] {} {}", operation, method, path);
        HttpResponse<String> response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        int status = response.statusCode();

        if (status < 200 || status >= 300) {
            JsonNode errorBody = parseQuietly(response.body());
            throw new BackendApiException(operation, status,
                    errorBody.isMissingNode() ? abbreviate(response.body()) : errorDetail(errorBody));
        }
        return parse(response.body());
    }

    private JsonNode parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return MissingNode.getInstance();
        }
        try {
            return mapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Malformed JSON response: " + e.getOriginalMessage(), e);
        }
    }

    private JsonNode parseQuietly(String raw) {
        try {
            return parse(raw);
        } catch (IllegalStateException e) {
            return MissingNode.getInstance();
        }
    }

    private static String errorDetail(JsonNode body) {
        JsonNode error = body.path("error");
        if (error.isMissingNode() || error.isNull()) {
            error = body.path("detail");
        }
        if (error.isMissingNode() || error.isNull()) {
            return "no details";
        }
        return error.isValueNode() ? error.asText() : error.toString();
    }

    private static String textOrNull(JsonNode node) {
        if (!node.isValueNode() || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }

    private static String abbreviate(String raw) {
        if (raw == null || raw.isBlank()) return "no details";
        return raw.length() > 200 ? raw.substring(0, 200) + "..." : raw;
    }

    private static String stripTrailingSlash(String url) {
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

    @FunctionalInterface
    private interface BackendCall<T> {
        T run() throws IOException, InterruptedException;
    }
}
