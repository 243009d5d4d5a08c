package com.jay.underwriter.layer1_data;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.jay.underwriter.config.UnderwriterConfig;
import com.jay.underwriter.model.BoardItem;
import com.jay.underwriter.model.ColumnWrite;
import com.jay.underwriter.model.FieldValue;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Layer 1 — monday.com GraphQL client.
 * Reads board items with their column values and writes computed metrics back,
 * directly via OkHttp (no SDK dependency).
 *
 * API: POST https://api.monday.com/v2 with {"query": ..., "variables": ...}
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MondayClient implements RecordStore {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private static final String ITEM_FIELDS = "{ cursor items { id name column_values { id text value } } }";

    private static final String ITEMS_QUERY =
        "query ($board: [ID!], $limit: Int!) { boards(ids: $board) { items_page(limit: $limit) "
        + ITEM_FIELDS + " } }";

    private static final String NEXT_PAGE_QUERY =
        "query ($cursor: String!, $limit: Int!) { next_items_page(cursor: $cursor, limit: $limit) "
        + ITEM_FIELDS + " }";

    private static final String UPDATE_MUTATION =
        "mutation ($board: ID!, $item: ID!, $values: JSON!) { change_multiple_column_values("
        + "board_id: $board, item_id: $item, column_values: $values) { id } }";

    private final UnderwriterConfig config;
    private final ObjectMapper objectMapper = new ObjectMapper();

    private OkHttpClient http;

    @PostConstruct
    public void init() {
        UnderwriterConfig.Monday monday = config.monday();
        this.http = new OkHttpClient.Builder()
            .connectTimeout(monday.getConnectTimeoutSeconds(), TimeUnit.SECONDS)
            .readTimeout(monday.getReadTimeoutSeconds(), TimeUnit.SECONDS)
            .build();
    }

    // ── Read ───────────────────────────────────────────────────────────────────

    @Override
    public List<BoardItem> fetchItems() {
        UnderwriterConfig.Monday monday = config.monday();
        requireCredentials(monday);

        ObjectNode variables = objectMapper.createObjectNode();
        variables.putArray("board").add(monday.getBoardId());
        variables.put("limit", monday.getPageLimit());

        JsonNode root = execute(ITEMS_QUERY, variables);
        JsonNode boards = root.path("data").path("boards");
        if (!boards.isArray() || boards.isEmpty()) {
            log.info("Board {} returned no boards in the response", monday.getBoardId());
            return List.of();
        }
        JsonNode page = boards.get(0).path("items_page");
        if (!page.path("items").isArray()) {
            log.info("Board {} response has no items_page/items", monday.getBoardId());
            return List.of();
        }

        List<BoardItem> result = new ArrayList<>();
        int pages = 1;
        String cursor = readPage(page, result);
        while (cursor != null) {
            ObjectNode next = objectMapper.createObjectNode();
            next.put("cursor", cursor);
            next.put("limit", monday.getPageLimit());
            cursor = readPage(execute(NEXT_PAGE_QUERY, next).path("data").path("next_items_page"), result);
            pages++;
        }
        log.info("Fetched {} items from board {} ({} page(s))", result.size(), monday.getBoardId(), pages);
        return result;
    }

    /** Appends the page's items to {@code into}; returns the next cursor, or null on the last page. */
    private String readPage(JsonNode page, List<BoardItem> into) {
        for (JsonNode item : page.path("items")) {
            Map<String, FieldValue> fields = new LinkedHashMap<>();
            for (JsonNode column : item.path("column_values")) {
                String columnId = column.path("id").asText();
                fields.put(columnId, FieldValue.builder()
                    .columnId(columnId)
                    .text(textOrNull(column.get("text")))
                    .value(textOrNull(column.get("value")))
                    .build());
            }
            into.add(BoardItem.builder()
                .id(item.path("id").asText())
                .name(item.path("name").asText(""))
                .fields(fields)
                .build());
        }
        String cursor = textOrNull(page.get("cursor"));
        return cursor == null || cursor.isBlank() ? null : cursor;
    }

    // ── Write ──────────────────────────────────────────────────────────────────

    @Override
    public void writeColumns(String itemId, List<ColumnWrite> writes) {
        UnderwriterConfig.Monday monday = config.monday();
        requireCredentials(monday);

        ObjectNode variables = objectMapper.createObjectNode();
        variables.put("board", monday.getBoardId());
        variables.put("item", itemId);
        try {
            // column_values is a JSON-encoded string, not a nested object
            variables.put("values", objectMapper.writeValueAsString(encodeColumnValues(writes)));
        } catch (JsonProcessingException e) {
            throw new RecordStoreException("Could not encode column values for item " + itemId, e, false);
        }

        JsonNode root = execute(UPDATE_MUTATION, variables);
        JsonNode updated = root.path("data").path("change_multiple_column_values").path("id");
        if (updated.isMissingNode() || updated.isNull()) {
            throw new RecordStoreException("Update of item " + itemId + " returned no item id", false);
        }
        log.debug("Item {} updated ({} columns)", itemId, writes.size());
    }

    /**
     * Builds the column_values object. Clears are explicit: "" for plain columns,
     * {} for wrapped numbers, so stale values do not survive a metric becoming absent.
     */
    ObjectNode encodeColumnValues(List<ColumnWrite> writes) {
        ObjectNode values = objectMapper.createObjectNode();
        for (ColumnWrite write : writes) {
            switch (write.type()) {
                case TEXT, NUMBERS -> values.put(write.columnId(), write.isClear() ? "" : write.value().get());
                case WRAPPED_NUMBER -> {
                    ObjectNode wrapped = values.putObject(write.columnId());
                    if (!write.isClear()) wrapped.put("number", write.value().get());
                }
            }
        }
        return values;
    }

    // ── HTTP Helpers ───────────────────────────────────────────────────────────

    private JsonNode execute(String query, ObjectNode variables) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("query", query);
        payload.set("variables", variables);

        UnderwriterConfig.Monday monday = config.monday();
        Request request = new Request.Builder()
            .url(monday.getApiUrl())
            .post(RequestBody.create(payload.toString(), JSON))
            .addHeader("Authorization", monday.getApiKey())
            .addHeader("API-Version", monday.getApiVersion())
            .addHeader("Accept", "application/json")
            .build();

        try (Response response = http.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                int code = response.code();
                boolean retryable = code == 429 || code >= 500;
                throw new RecordStoreException("HTTP " + code + " from monday.com", retryable);
            }
            JsonNode root = objectMapper.readTree(body);
            String error = extractErrors(root);
            if (error != null) {
                throw new RecordStoreException("monday.com returned errors: " + error, false);
            }
            return root;
        } catch (IOException e) {
            throw new RecordStoreException("Request to monday.com failed: " + e.getMessage(), e, true);
        }
    }

    private String extractErrors(JsonNode root) {
        JsonNode errors = root.path("errors");
        if (errors.isArray() && !errors.isEmpty()) {
            List<String> messages = new ArrayList<>();
            for (JsonNode err : errors) messages.add(err.path("message").asText(err.toString()));
            return String.join("; ", messages);
        }
        if (root.hasNonNull("error_message")) {
            return root.path("error_message").asText();
        }
        return null;
    }

    private void requireCredentials(UnderwriterConfig.Monday monday) {
        if (monday.getApiKey() == null || monday.getApiKey().isBlank()) {
            throw new RecordStoreException("MONDAY_API_KEY is not set", false);
        }
        if (monday.getBoardId() == null || monday.getBoardId().isBlank()) {
            throw new RecordStoreException("MONDAY_BOARD_ID is not set", false);
        }
    }

    private static String textOrNull(JsonNode node) {
        return node == null || node.isNull() ? null : node.asText();
    }
}
