package net.cronhook.integration.spring.notify;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import net.cronhook.core.model.HttpMethod;
import net.cronhook.core.spi.Clock;
import net.cronhook.core.spi.TriggerAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 잡 발화 시 웹훅 호출.
 *
 * <p>GET 외 메서드는 아래 JSON 본문을 싣는다.
 * <pre>{"message": "yyyy-MM-dd HH:mm:ss - (body | cron triggered)", "timestamp": ISO-8601, "cronJob": true}</pre>
 * 실패는 종류별로 로그만 남기고 호출자에게 던지지 않는다.
 */
public final class HttpTriggerAction implements TriggerAction {
    private static final Logger log = LoggerFactory.getLogger(HttpTriggerAction.class);

    static final String DEFAULT_MESSAGE = "cron triggered";
    private static final DateTimeFormatter STAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    private final HttpClient client;
    private final ObjectMapper mapper;
    private final Duration timeout;
    private final String userAgent;
    private final Clock clock;

    public HttpTriggerAction(HttpClient client, ObjectMapper mapper, Duration timeout, String userAgent, Clock clock) {
        this.client = client;
        this.mapper = mapper;
        this.timeout = timeout;
        this.userAgent = userAgent;
        this.clock = clock;
    }

    public static HttpTriggerAction create(Duration timeout, String userAgent, Clock clock) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        return new HttpTriggerAction(client, new ObjectMapper(), timeout, userAgent, clock);
    }

    @Override
    public void notify(String uri, HttpMethod method, String body) {
        Instant now = clock.now();
        String message = STAMP.format(now) + " - " + (body != null && !body.isEmpty() ? body : DEFAULT_MESSAGE);

        HttpRequest request;
        try {
            request = buildRequest(uri, method, message, now);
        } catch (RuntimeException | JsonProcessingException e) {
            log.error("Request setup error for {}: {}", uri, e.getMessage());
            return;
        }

        try {
            log.info("Sending {} request to {}", method, uri);
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString());
            int status = response.statusCode();
            if (status >= 400) {
                log.error("HTTP {} from {}", status, uri);
                if (response.body() != null && !response.body().isEmpty()) {
                    log.error("Error response: {}", response.body());
                }
                return;
            }
            log.info("Notification sent to {}: {} (status: {})", uri, message, status);
            if (response.body() != null && !response.body().isEmpty()) {
                log.info("Response: {}", response.body());
            }
        } catch (HttpTimeoutException e) {
            log.error("Timeout connecting to {} after {}", uri, timeout);
        } catch (ConnectException e) {
            log.error("Connection refused to {} - service may not be running", uri);
        } catch (IOException e) {
            log.error("No response from {} (method {}, timeout {}): {}", uri, method, timeout, e.toString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Request to {} interrupted", uri);
        } catch (RuntimeException e) {
            log.error("Request setup error for {}: {}", uri, e.getMessage());
        }
    }

    private HttpRequest buildRequest(String uri, HttpMethod method, String message, Instant now)
            throws JsonProcessingException {
        HttpRequest.Builder b = HttpRequest.newBuilder(URI.create(uri))
                .timeout(timeout)
                .header("content-type", "application/json")
                .header("user-agent", userAgent);

        if (!method.carriesBody()) {
            return b.GET().build();
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        payload.put("timestamp", now.toString());
        payload.put("cronJob", true);
        String json = mapper.writeValueAsString(payload);
        return b.method(method.name(), HttpRequest.BodyPublishers.ofString(json)).build();
    }
}
