package com.aerarisk.job;

import com.aerarisk.core.pipeline.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Minimal PostgREST client for the Supabase tables used by the job.
 *
 * <h3>Requests</h3>
 * <ul>
 * <li>select: {@code GET /rest/v1/{table}?select=...&col=eq.value}</li>
 * <li>upsert: {@code POST /rest/v1/{table}?on_conflict=...} with
 * {@code Prefer: resolution=merge-duplicates}</li>
 * <li>insert: {@code POST /rest/v1/{table}}</li>
 * </ul>
 *
 * <p>
 * Every request carries the service key as both {@code apikey} and bearer
 * token. Calls are synchronous and never retried; any transport error,
 * non-2xx status or unreadable body raises {@link UpstreamException}.
 * Writes of an empty row list are skipped.
 * </p>
 *
 * @since 1.0.0
 */
public class SupabaseClient {

    private static final Logger LOG = LoggerFactory.getLogger(SupabaseClient.class);

    static final MediaType JSON = MediaType.get("application/json");
    static final String PREFER_REPRESENTATION = "return=representation";
    static final String PREFER_UPSERT = "resolution=merge-duplicates,return=representation";

    private static final int MAX_ERROR_BODY = 500;

    private final String restUrl;
    private final String serviceKey;
    private final OkHttpClient readClient;
    private final OkHttpClient writeClient;
    private final ObjectMapper mapper;

    public SupabaseClient(JobConfig config) {
        this(config, new OkHttpClient());
    }

    SupabaseClient(JobConfig config, OkHttpClient baseClient) {
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(baseClient, "baseClient must not be null");
        this.restUrl = config.getSupabaseUrl() + "/rest/v1/";
        this.serviceKey = config.getServiceKey();
        this.readClient = baseClient.newBuilder()
                .callTimeout(config.getReadTimeout())
                .readTimeout(config.getReadTimeout())
                .build();
        this.writeClient = baseClient.newBuilder()
                .callTimeout(config.getWriteTimeout())
                .readTimeout(config.getWriteTimeout())
                .writeTimeout(config.getWriteTimeout())
                .build();
        this.mapper = objectMapper();
    }

    /**
     * JSON mapper for store payloads: ISO-8601 dates, unknown columns ignored.
     */
    static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }

    // ---------------------------------------------------------------
    // Public API
    // ---------------------------------------------------------------

    /**
     * Read rows from a table.
     *
     * @param table   table name
     * @param columns comma-separated column list
     * @param filters column to PostgREST filter expression, e.g.
     *                {@code snapshot_date -> eq.2026-03-01}
     * @param type    row type
     * @return the rows, possibly empty
     * @throws UpstreamException on transport failure, non-2xx status or an
     *                           unreadable body
     */
    public <T> List<T> select(String table, String columns, Map<String, String> filters, Class<T> type) {
        HttpUrl.Builder url = tableUrl(table).newBuilder().addQueryParameter("select", columns);
        filters.forEach(url::addQueryParameter);

        Request request = authorised(new Request.Builder().url(url.build()).get())
                .header("Prefer", PREFER_REPRESENTATION)
                .build();

        String body = execute(readClient, request, "select " + table);
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, type);
        try {
            List<T> rows = mapper.readValue(body, listType);
            LOG.debug("Selected {} row(s) from {}", rows.size(), table);
            return rows;
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Unreadable response from select " + table + ": "
                    + e.getOriginalMessage(), e);
        }
    }

    /**
     * Insert or merge rows on the given conflict columns.
     *
     * @throws UpstreamException if the write is rejected
     */
    public void upsert(String table, List<?> rows, String onConflict) {
        if (rows.isEmpty()) {
            LOG.debug("Skipping upsert of 0 rows into {}", table);
            return;
        }
        HttpUrl url = tableUrl(table).newBuilder().addQueryParameter("on_conflict", onConflict).build();
        write(url, rows, PREFER_UPSERT, "upsert " + table);
    }

    /**
     * Append rows.
     *
     * @throws UpstreamException if the write is rejected
     */
    public void insert(String table, List<?> rows) {
        if (rows.isEmpty()) {
            LOG.debug("Skipping insert of 0 rows into {}", table);
            return;
        }
        write(tableUrl(table), rows, PREFER_REPRESENTATION, "insert " + table);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void write(HttpUrl url, List<?> rows, String prefer, String operation) {
        byte[] payload;
        try {
            payload = mapper.writeValueAsBytes(rows);
        } catch (JsonProcessingException e) {
            throw new UpstreamException("Failed to serialize rows for " + operation, e);
        }

        Request request = authorised(new Request.Builder().url(url).post(RequestBody.create(payload, JSON)))
                .header("Prefer", prefer)
                .build();
        execute(writeClient, request, operation);
        LOG.debug("{}: {} row(s) written", operation, rows.size());
    }

    private Request.Builder authorised(Request.Builder builder) {
        return builder
                .header("apikey", serviceKey)
                .header("Authorization", "Bearer " + serviceKey)
                .header("Content-Type", JSON.toString());
    }

    private String execute(OkHttpClient client, Request request, String operation) {
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new UpstreamException(operation + " failed: HTTP " + response.code() + " "
                        + abbreviate(body));
            }
            return body;
        } catch (IOException e) {
            throw new UpstreamException(operation + " failed: " + e.getMessage(), e);
        }
    }

    private HttpUrl tableUrl(String table) {
        Objects.requireNonNull(table, "table must not be null");
        HttpUrl url = HttpUrl.parse(restUrl + table);
        if (url == null) {
            throw new UpstreamException("Invalid store URL: " + restUrl + table);
        }
        return url;
    }

    private static String abbreviate(String body) {
        return body.length() <= MAX_ERROR_BODY ? body : body.substring(0, MAX_ERROR_BODY) + "...";
    }
}
