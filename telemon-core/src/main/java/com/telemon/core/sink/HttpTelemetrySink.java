package com.telemon.core.sink;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.telemon.api.exception.ConfigurationException;
import com.telemon.api.sink.SendResult;
import com.telemon.api.sink.TelemetryBatch;
import com.telemon.api.sink.TelemetrySink;
import com.telemon.core.codec.TelemetryWireCodec;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * HTTP 远端落点
 * <p>
 * 将批次编码为 JSON 数组，POST 到 {@code {endpoint}/logs}。状态码映射：
 * <ul>
 * <li>2xx：成功；207：部分成功（响应体可带 rejected 计数或 errors 数组）</li>
 * <li>408 / 429 / 5xx 与 I/O 错误：瞬时失败，可重试</li>
 * <li>其余 4xx：永久失败（如鉴权），不重试</li>
 * </ul>
 */
@Slf4j
public class HttpTelemetrySink implements TelemetrySink {

    public static final String PROJECT_HEADER = "X-Telemon-Project";

    private final URI logsUri;
    private final String apiKey;
    private final String projectId;
    private final Duration timeout;
    private final TelemetryWireCodec codec;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public HttpTelemetrySink(String endpoint, String apiKey, String projectId, Duration timeout) {
        this(endpoint, apiKey, projectId, timeout, new TelemetryWireCodec(),
                HttpClient.newBuilder().connectTimeout(timeout).build());
    }

    public HttpTelemetrySink(String endpoint, String apiKey, String projectId, Duration timeout,
                             TelemetryWireCodec codec, HttpClient httpClient) {
        if (endpoint == null || endpoint.isBlank()) {
            throw new ConfigurationException("endpoint", endpoint, "must not be blank");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException("apiKey", "<blank>", "remote sink requires an api key");
        }
        String base = endpoint.endsWith("/") ? endpoint.substring(0, endpoint.length() - 1) : endpoint;
        try {
            this.logsUri = URI.create(base + "/logs");
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("endpoint", endpoint, "not a valid URI");
        }
        this.apiKey = apiKey;
        this.projectId = projectId;
        this.timeout = timeout;
        this.codec = codec;
        this.httpClient = httpClient;
    }

    @Override
    public SendResult send(TelemetryBatch batch) {
        byte[] payload = codec.encodeBatch(batch);

        HttpRequest.Builder builder = HttpRequest.newBuilder(logsUri)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofByteArray(payload));
        if (projectId != null && !projectId.isBlank()) {
            builder.header(PROJECT_HEADER, projectId);
        }

        try {
            HttpResponse<String> response = httpClient.send(builder.build(),
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return classify(response.statusCode(), response.body(), batch);
        } catch (HttpTimeoutException e) {
            log.debug("[Sink:http] Request timed out for batch {}", batch.getBatchId());
            return SendResult.transientFailure("timeout: " + e.getMessage());
        } catch (IOException e) {
            log.debug("[Sink:http] I/O error for batch {}: {}", batch.getBatchId(), e.getMessage());
            return SendResult.transientFailure("io: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.transientFailure("interrupted");
        }
    }

    SendResult classify(int status, String body, TelemetryBatch batch) {
        if (status == 207) {
            int rejected = rejectedCount(body, batch.size());
            return SendResult.partial(rejected, "partial acceptance (" + rejected + " of " + batch.size() + " rejected)");
        }
        if (status >= 200 && status < 300) {
            return SendResult.success(status);
        }
        if (status == 408 || status == 429 || status >= 500) {
            return SendResult.transientFailure(status, "HTTP " + status);
        }
        return SendResult.permanentFailure(status, "HTTP " + status + abbreviate(body));
    }

    private int rejectedCount(String body, int batchSize) {
        if (body == null || body.isBlank()) {
            return 0;
        }
        try {
            JsonNode node = mapper.readTree(body);
            if (node.hasNonNull("rejected")) {
                return Math.min(batchSize, Math.max(0, node.get("rejected").asInt()));
            }
            JsonNode errors = node.get("errors");
            if (errors != null && errors.isArray()) {
                return Math.min(batchSize, errors.size());
            }
        } catch (IOException e) {
            log.debug("[Sink:http] Unparseable 207 body: {}", e.getMessage());
        }
        return 0;
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return ": " + (body.length() > 200 ? body.substring(0, 200) + "..." : body);
    }

    public URI getLogsUri() {
        return logsUri;
    }

    @Override
    public String getName() {
        return "http";
    }
}
