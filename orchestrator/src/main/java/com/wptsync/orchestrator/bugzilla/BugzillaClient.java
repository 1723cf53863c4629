package com.wptsync.orchestrator.bugzilla;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/**
 * HTTP client for the Bugzilla REST API.
 *
 * POST /rest/bug               : file a bug
 * POST /rest/bug/{id}/comment  : add a comment
 * PUT  /rest/bug/{id}          : change product/component
 *
 * Authenticates with the X-BUGZILLA-API-KEY header. Blocking I/O: callers
 * are the request threads that run a sync.
 */
@Component
public class BugzillaClient implements BugTracker {

    private static final Logger log = LoggerFactory.getLogger(BugzillaClient.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       baseUrl;
    private final String       apiKey;

    public BugzillaClient(
            @Value("${bugzilla.base-url}") String baseUrl,
            @Value("${bugzilla.api-key:}") String apiKey,
            ObjectMapper objectMapper) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.apiKey  = apiKey;
        this.json    = objectMapper;
        this.http    = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public long create(String summary, String body, String product, String component) {
        log.info("Filing bug in {} :: {}: {}", product, component, summary);
        String payload = toJson(Map.of(
                "product",     product,
                "component",   component,
                "summary",     summary,
                "description", body == null ? "" : body,
                "version",     "unspecified"));
        String respBody = send("POST", "/rest/bug", payload, "create bug");
        try {
            JsonNode id = json.readTree(respBody).get("id");
            if (id == null || !id.canConvertToLong()) {
                throw new BugzillaException("create bug: no id in response: " + respBody);
            }
            log.info("Filed bug {}", id.asLong());
            return id.asLong();
        } catch (JsonProcessingException e) {
            throw new BugzillaException("Failed to parse create bug response", e);
        }
    }

    @Override
    public void comment(long bugId, String text) {
        log.info("Commenting on bug {}", bugId);
        send("POST", "/rest/bug/" + bugId + "/comment",
                toJson(Map.of("comment", text)), "comment on bug " + bugId);
    }

    @Override
    public void setComponent(long bugId, String product, String component) {
        log.info("Moving bug {} to {} :: {}", bugId, product, component);
        send("PUT", "/rest/bug/" + bugId,
                toJson(Map.of("product", product, "component", component)),
                "set component of bug " + bugId);
    }

    // ------------------------------------------------------------------
    // Private helpers
    // ------------------------------------------------------------------

    private String send(String method, String path, String jsonBody, String opName) {
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .timeout(REQUEST_TIMEOUT)
                    .header("Content-Type",       "application/json")
                    .header("Accept",             "application/json")
                    .header("X-BUGZILLA-API-KEY", apiKey)
                    .method(method, HttpRequest.BodyPublishers.ofString(jsonBody))
                    .build();
            HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
            if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
                throw new BugzillaException(
                        opName + " failed: HTTP " + resp.statusCode() + ": " + resp.body());
            }
            return resp.body();
        } catch (BugzillaException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BugzillaException(opName + " interrupted", e);
        } catch (Exception e) {
            throw new BugzillaException(opName + " failed", e);
        }
    }

    private String toJson(Object obj) {
        try {
            return json.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            throw new BugzillaException("JSON serialization failed", e);
        }
    }
}
