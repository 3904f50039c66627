package org.netpreserve.evidence.archive;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jetbrains.annotations.Nullable;
import org.netpreserve.evidence.config.ArchiveConfig;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Client for the Wayback Machine's CDX search API. Each call is a single request: retries and pacing are applied
 * by the caller.
 */
public class CdxClient {
    static final String FIELDS = "original,timestamp,digest,mimetype,statuscode";
    private static final ObjectMapper mapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final ArchiveConfig config;

    public CdxClient(HttpClient httpClient, ArchiveConfig config) {
        this.httpClient = httpClient;
        this.config = config;
    }

    /**
     * Finds all captures matching a URL or URL prefix query such as {@code twitter.com/someone/status/*}.
     */
    public CompletableFuture<List<CdxRecord>> search(String query) {
        URI uri = searchUri(query);
        var request = HttpRequest.newBuilder(uri)
                .timeout(config.requestTimeout())
                .header("User-Agent", config.userAgent())
                .GET()
                .build();
        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofByteArray())
                .<List<CdxRecord>>thenCompose(response -> {
                    if (response.statusCode() != 200) {
                        return CompletableFuture.failedFuture(new HttpStatusException(response.statusCode(), uri));
                    }
                    try {
                        return CompletableFuture.completedFuture(parse(response.body()));
                    } catch (MalformedResponseException e) {
                        return CompletableFuture.failedFuture(e);
                    }
                });
    }

    URI searchUri(String query) {
        return URI.create(config.cdxUrl() + "?url=" + URLEncoder.encode(query, StandardCharsets.UTF_8)
                          + "&output=json&fl=" + FIELDS);
    }

    /**
     * Parses the JSON output format: an array of string arrays where the first row names the columns. An empty
     * body or empty array means no captures.
     */
    public static List<CdxRecord> parse(byte[] body) throws MalformedResponseException {
        if (body.length == 0) return List.of();
        JsonNode root;
        try {
            root = mapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Invalid CDX JSON: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedResponseException("Unreadable CDX response", e);
        }
        if (root == null || root.isMissingNode()) return List.of();
        if (!root.isArray()) throw new MalformedResponseException("CDX response is not an array");
        if (root.isEmpty()) return List.of();

        Map<String, Integer> columns = new HashMap<>();
        JsonNode header = root.get(0);
        if (!header.isArray()) throw new MalformedResponseException("CDX header row is not an array");
        for (int i = 0; i < header.size(); i++) {
            columns.put(header.get(i).asText(), i);
        }
        Integer urlColumn = columns.get("original");
        Integer timestampColumn = columns.get("timestamp");
        if (urlColumn == null || timestampColumn == null) {
            throw new MalformedResponseException("CDX header lacks original or timestamp: " + header);
        }

        var records = new ArrayList<CdxRecord>(root.size() - 1);
        for (int i = 1; i < root.size(); i++) {
            JsonNode row = root.get(i);
            if (!row.isArray() || row.size() != header.size()) {
                throw new MalformedResponseException("Invalid CDX row " + i + ": " + row);
            }
            records.add(new CdxRecord(
                    row.get(urlColumn).asText(),
                    WaybackTimestamp.parse(row.get(timestampColumn).asText()),
                    field(row, columns.get("digest")),
                    field(row, columns.get("mimetype")),
                    status(field(row, columns.get("statuscode")))));
        }
        return records;
    }

    private static @Nullable String field(JsonNode row, @Nullable Integer column) {
        if (column == null) return null;
        String value = row.get(column).asText();
        return value.isEmpty() || value.equals("-") ? null : value;
    }

    private static @Nullable Integer status(@Nullable String value) throws MalformedResponseException {
        if (value == null) return null;
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new MalformedResponseException("Unexpected status: " + value);
        }
    }
}
