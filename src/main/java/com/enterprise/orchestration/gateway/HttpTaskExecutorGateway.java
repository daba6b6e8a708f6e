package com.enterprise.orchestration.gateway;

import com.enterprise.orchestration.core.TaskResult;
import com.enterprise.orchestration.core.TaskType;
import com.enterprise.orchestration.exception.ExecutionFailedException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Calls the task executor service over HTTP.
 * Request body: {@code {"tool": <operation>, "arguments": {...}}}.
 */
public class HttpTaskExecutorGateway implements TaskExecutorGateway {

    private static final Logger logger = LoggerFactory.getLogger(HttpTaskExecutorGateway.class);
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final URI callUri;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpTaskExecutorGateway(String baseUrl, String callPath, Duration requestTimeout, Duration connectTimeout) {
        this.callUri = URI.create(stripTrailingSlash(baseUrl) + callPath);
        this.requestTimeout = requestTimeout;
        this.objectMapper = new ObjectMapper();
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .build();

        logger.info("HttpTaskExecutorGateway targeting {} (timeout {}ms)", callUri, requestTimeout.toMillis());
    }

    @Override
    public TaskResult execute(TaskType taskType, Map<String, Object> arguments) throws ExecutionFailedException {
        String operation = taskType.getOperationName();
        long startTime = System.currentTimeMillis();

        String body;
        try {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("tool", operation);
            request.put("arguments", arguments);
            body = objectMapper.writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailedException(operation, "Cannot serialize arguments for " + operation, e);
        }

        HttpRequest request = HttpRequest.newBuilder()
            .uri(callUri)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExecutionFailedException(operation, "Call to " + operation + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionFailedException(operation, "Call to " + operation + " was interrupted", e);
        }

        long executionTime = System.currentTimeMillis() - startTime;
        logger.debug("{} returned HTTP {} in {}ms", operation, response.statusCode(), executionTime);

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return TaskResult.failure(operation, "HTTP " + response.statusCode(), null, executionTime);
        }

        return interpret(operation, response.body(), executionTime);
    }

    @SuppressWarnings("unchecked")
    private TaskResult interpret(String operation, String responseBody, long executionTime)
            throws ExecutionFailedException {
        if (responseBody == null || responseBody.isBlank()) {
            return TaskResult.success(operation, Map.of(), executionTime);
        }

        Map<String, Object> payload;
        try {
            payload = objectMapper.readValue(responseBody, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new ExecutionFailedException(operation, "Unreadable response from " + operation, e);
        }

        Object error = payload.get("error");
        if (Boolean.FALSE.equals(payload.get("success")) || error != null) {
            String message = error != null ? error.toString() : operation + " reported failure";
            return TaskResult.failure(operation, message, null, executionTime);
        }

        Object result = payload.get("result");
        if (result instanceof Map) {
            return TaskResult.success(operation, (Map<String, Object>) result, executionTime);
        }
        return TaskResult.success(operation, payload, executionTime);
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
