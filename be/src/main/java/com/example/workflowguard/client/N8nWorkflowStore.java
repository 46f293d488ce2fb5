package com.example.workflowguard.client;

import com.example.workflowguard.api.WorkflowNotFoundException;
import com.example.workflowguard.domain.Workflow;

import lombok.extern.slf4j.Slf4j;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.json.JsonMapper;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.net.URI;
import java.nio.charset.StandardCharsets;

/**
 * {@link WorkflowStore} backed by the n8n public REST API ({@code /api/v1/workflows}).
 * API url and key are read from config/env only; startup fails if either is missing.
 */
@Component
@Slf4j
public class N8nWorkflowStore implements WorkflowStore {

    static final String API_KEY_HEADER = "X-N8N-API-KEY";
    private static final String WORKFLOWS = "/api/v1/workflows";

    private final RestClient restClient;
    private final JsonMapper jsonMapper;
    private final WorkflowRequestPreparer requestPreparer;

    @Autowired
    public N8nWorkflowStore(
            @Value("${n8n.api-url:}") String apiUrl,
            @Value("${n8n.api-key:}") String apiKey,
            JsonMapper jsonMapper) {
        this(RestClient.builder(), apiUrl, apiKey, jsonMapper);
    }

    N8nWorkflowStore(RestClient.Builder builder, String apiUrl, String apiKey, JsonMapper jsonMapper) {
        String url = apiUrl != null ? apiUrl.trim() : "";
        String key = apiKey != null ? apiKey.trim() : "";
        if (url.isEmpty()) {
            throw new IllegalStateException(
                    "n8n API url is required. Set N8N_API_URL in the environment or n8n.api-url in configuration.");
        }
        if (key.isEmpty()) {
            throw new IllegalStateException(
                    "n8n API key is required. Set N8N_API_KEY in the environment or n8n.api-key in configuration.");
        }
        this.restClient = builder
                .baseUrl(url.endsWith("/") ? url.substring(0, url.length() - 1) : url)
                .defaultHeader(API_KEY_HEADER, key)
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.jsonMapper = jsonMapper;
        this.requestPreparer = new WorkflowRequestPreparer(jsonMapper);
    }

    @Override
    public WorkflowPage list(Boolean active, Integer limit, String cursor) {
        String body = restClient.get()
                .uri(uri -> listUri(uri, active, limit, cursor))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(null, response);
                })
                .body(String.class);
        return read(body, WorkflowPage.class);
    }

    private static URI listUri(UriBuilder uri, Boolean active, Integer limit, String cursor) {
        uri.path(WORKFLOWS);
        if (active != null) {
            uri.queryParam("active", active);
        }
        if (limit != null) {
            uri.queryParam("limit", limit);
        }
        if (cursor != null && !cursor.isBlank()) {
            uri.queryParam("cursor", cursor);
        }
        return uri.build();
    }

    @Override
    public Workflow get(String id) {
        log.debug("Fetching workflow id={}", id);
        String body = restClient.get()
                .uri(WORKFLOWS + "/{id}", id)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(id, response);
                })
                .body(String.class);
        return read(body, Workflow.class);
    }

    @Override
    public Workflow create(Workflow workflow) {
        log.debug("Creating workflow name={} nodes={}", workflow.getName(), workflow.getNodes().size());
        String body = restClient.post()
                .uri(WORKFLOWS)
                .contentType(MediaType.APPLICATION_JSON)
                .body(write(requestPreparer.prepare(workflow)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(null, response);
                })
                .body(String.class);
        return read(body, Workflow.class);
    }

    @Override
    public Workflow update(String id, Workflow workflow) {
        log.debug("Updating workflow id={} nodes={}", id, workflow.getNodes().size());
        String body = restClient.put()
                .uri(WORKFLOWS + "/{id}", id)
                .contentType(MediaType.APPLICATION_JSON)
                .body(write(requestPreparer.prepare(workflow)))
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(id, response);
                })
                .body(String.class);
        return read(body, Workflow.class);
    }

    @Override
    public void delete(String id) {
        log.debug("Deleting workflow id={}", id);
        restClient.delete()
                .uri(WORKFLOWS + "/{id}", id)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(id, response);
                })
                .toBodilessEntity();
    }

    @Override
    public Workflow activate(String id) {
        return post(id, "/activate");
    }

    @Override
    public Workflow deactivate(String id) {
        return post(id, "/deactivate");
    }

    private Workflow post(String id, String action) {
        log.debug("Workflow id={} {}", id, action.substring(1));
        String body = restClient.post()
                .uri(WORKFLOWS + "/{id}" + action, id)
                .retrieve()
                .onStatus(HttpStatusCode::isError, (request, response) -> {
                    throw failure(id, response);
                })
                .body(String.class);
        return read(body, Workflow.class);
    }

    private static RuntimeException failure(String id, ClientHttpResponse response) throws IOException {
        HttpStatusCode status = response.getStatusCode();
        if (id != null && status.value() == HttpStatus.NOT_FOUND.value()) {
            return new WorkflowNotFoundException(id);
        }
        String text = new String(response.getBody().readAllBytes(), StandardCharsets.UTF_8);
        return new WorkflowStoreException(status.value(), text);
    }

    private String write(Object body) {
        try {
            return jsonMapper.writeValueAsString(body);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize workflow request", e);
        }
    }

    private <T> T read(String body, Class<T> type) {
        if (body == null || body.isBlank()) {
            throw new WorkflowStoreException("Empty response from n8n API", null);
        }
        try {
            return jsonMapper.readValue(body, type);
        } catch (JacksonException e) {
            throw new WorkflowStoreException("Unreadable response from n8n API: " + e.getOriginalMessage(), e);
        }
    }
}
