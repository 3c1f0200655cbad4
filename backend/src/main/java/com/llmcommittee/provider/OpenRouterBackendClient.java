package com.llmcommittee.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.llmcommittee.config.BackendProviderProperties;
import com.llmcommittee.model.ChatMessage;
import com.llmcommittee.model.TokenDeltaEvent;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Live client for OpenAI-compatible chat completion APIs (OpenRouter by default).
 */
@Component
@ConditionalOnProperty(prefix = "committee", name = "mock-provider", havingValue = "false")
public class OpenRouterBackendClient implements BackendClient {

    private static final Logger log = LoggerFactory.getLogger(OpenRouterBackendClient.class);
    private static final MediaType JSON = MediaType.get("application/json");
    private static final String DONE_SENTINEL = "[DONE]";
    private static final int READ_BUFFER_SIZE = 8192;
    private static final int MAX_ERROR_BODY_LENGTH = 512;

    private final OkHttpClient httpClient;
    private final BackendProviderProperties backendProviderProperties;
    private final ObjectMapper objectMapper;

    public OpenRouterBackendClient(
            OkHttpClient backendHttpClient,
            BackendProviderProperties backendProviderProperties,
            ObjectMapper objectMapper
    ) {
        this.httpClient = backendHttpClient;
        this.backendProviderProperties = backendProviderProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void stream(
            String backendId,
            List<ChatMessage> messages,
            CancellationToken cancellation,
            Consumer<TokenDeltaEvent> sink
    ) {
        if (cancellation.isCancelled()) {
            sink.accept(TokenDeltaEvent.failed(backendId, CANCELLED_MESSAGE));
            return;
        }
        if (!StringUtils.hasText(backendProviderProperties.getApiKey())) {
            sink.accept(TokenDeltaEvent.failed(backendId, "Backend API key not configured"));
            return;
        }

        Call call = httpClient.newCall(buildRequest(backendId, messages, true));
        cancellation.onCancel(call::cancel);

        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                sink.accept(TokenDeltaEvent.failed(backendId, describeHttpError(response)));
                return;
            }
            ResponseBody body = response.body();
            if (body == null) {
                sink.accept(TokenDeltaEvent.failed(backendId, "No response body"));
                return;
            }

            SseDataDecoder decoder = new SseDataDecoder();
            try (Reader reader = new InputStreamReader(body.byteStream(), StandardCharsets.UTF_8)) {
                char[] buffer = new char[READ_BUFFER_SIZE];
                int read;
                while ((read = reader.read(buffer)) != -1) {
                    if (forwardPayloads(backendId, decoder.feed(buffer, 0, read), sink)) {
                        return;
                    }
                }
                if (forwardPayloads(backendId, decoder.finish(), sink)) {
                    return;
                }
            }
            sink.accept(TokenDeltaEvent.completed(backendId));
        } catch (IOException ex) {
            String message = cancellation.isCancelled() ? CANCELLED_MESSAGE : describeTransportError(ex);
            log.warn("Streaming dispatch to backend {} failed: {}", backendId, message);
            sink.accept(TokenDeltaEvent.failed(backendId, message));
        }
    }

    @Override
    public BackendCompletion complete(
            String backendId,
            List<ChatMessage> messages,
            Duration timeout,
            CancellationToken cancellation
    ) {
        long startedAt = System.nanoTime();
        if (cancellation.isCancelled()) {
            return BackendCompletion.failure(backendId, CANCELLED_MESSAGE, elapsedMillis(startedAt));
        }
        if (!StringUtils.hasText(backendProviderProperties.getApiKey())) {
            return BackendCompletion.failure(backendId, "Backend API key not configured", elapsedMillis(startedAt));
        }

        Call call = httpClient.newCall(buildRequest(backendId, messages, false));
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }
        cancellation.onCancel(call::cancel);

        try (Response response = call.execute()) {
            if (!response.isSuccessful()) {
                return BackendCompletion.failure(backendId, describeHttpError(response), elapsedMillis(startedAt));
            }
            ResponseBody body = response.body();
            String bodyText = body == null ? "" : body.string();
            if (bodyText.isBlank()) {
                return BackendCompletion.failure(backendId, "Empty response body", elapsedMillis(startedAt));
            }

            JsonNode root = objectMapper.readTree(bodyText);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            if (content.isBlank()) {
                return BackendCompletion.failure(backendId, "No response from model", elapsedMillis(startedAt));
            }
            return BackendCompletion.success(backendId, content, elapsedMillis(startedAt));
        } catch (JsonProcessingException ex) {
            return BackendCompletion.failure(backendId, "Unparseable response body", elapsedMillis(startedAt));
        } catch (IOException ex) {
            String message = cancellation.isCancelled() ? CANCELLED_MESSAGE : describeTransportError(ex);
            log.warn("Completion dispatch to backend {} failed: {}", backendId, message);
            return BackendCompletion.failure(backendId, message, elapsedMillis(startedAt));
        }
    }

    /**
     * Returns true once the stream has produced its terminal event.
     */
    private boolean forwardPayloads(String backendId, List<String> payloads, Consumer<TokenDeltaEvent> sink) {
        for (String payload : payloads) {
            if (DONE_SENTINEL.equals(payload)) {
                sink.accept(TokenDeltaEvent.completed(backendId));
                return true;
            }
            JsonNode chunk;
            try {
                chunk = objectMapper.readTree(payload);
            } catch (JsonProcessingException ex) {
                log.debug("Skipping malformed stream chunk from backend {}", backendId);
                continue;
            }
            JsonNode error = chunk.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                String message = error.path("message").asText(error.asText("Backend stream error"));
                sink.accept(TokenDeltaEvent.failed(backendId, message));
                return true;
            }
            String content = chunk.path("choices").path(0).path("delta").path("content").asText("");
            if (!content.isEmpty()) {
                sink.accept(TokenDeltaEvent.fragment(backendId, content));
            }
        }
        return false;
    }

    private Request buildRequest(String backendId, List<ChatMessage> messages, boolean streaming) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("model", backendId);
        ArrayNode messageNodes = payload.putArray("messages");
        for (ChatMessage message : messages) {
            messageNodes.addObject()
                    .put("role", message.role())
                    .put("content", message.content());
        }
        if (streaming) {
            payload.put("stream", true);
        } else {
            payload.putObject("response_format").put("type", "json_object");
        }

        return new Request.Builder()
                .url(completionsUrl())
                .header("Authorization", "Bearer " + backendProviderProperties.getApiKey().trim())
                .header("HTTP-Referer", backendProviderProperties.getAppUrl())
                .header("X-Title", backendProviderProperties.getAppTitle())
                .post(RequestBody.create(payload.toString(), JSON))
                .build();
    }

    private String completionsUrl() {
        String baseUrl = backendProviderProperties.getBaseUrl().trim();
        if (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        return baseUrl + "/chat/completions";
    }

    private static String describeHttpError(Response response) throws IOException {
        ResponseBody body = response.body();
        String errorText = body == null ? "" : body.string();
        if (errorText.length() > MAX_ERROR_BODY_LENGTH) {
            errorText = errorText.substring(0, MAX_ERROR_BODY_LENGTH);
        }
        return "API error: " + response.code() + " - " + errorText;
    }

    private static String describeTransportError(IOException ex) {
        String message = ex.getMessage();
        return message == null || message.isBlank() ? ex.getClass().getSimpleName() : message;
    }

    private static long elapsedMillis(long startedAtNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAtNanos);
    }
}
