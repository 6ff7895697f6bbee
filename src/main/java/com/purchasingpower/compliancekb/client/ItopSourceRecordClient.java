package com.purchasingpower.compliancekb.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.HttpRetryProperties;
import com.purchasingpower.compliancekb.configuration.ItopProperties;
import com.purchasingpower.compliancekb.exception.SourceFetchException;
import com.purchasingpower.compliancekb.model.CallContext;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.RecordAttributes;
import com.purchasingpower.compliancekb.model.RecordLogEntry;
import com.purchasingpower.compliancekb.model.ServiceType;
import com.purchasingpower.compliancekb.model.SourceQuery;
import com.purchasingpower.compliancekb.model.SourceRecord;
import com.purchasingpower.compliancekb.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * iTop REST client ({@code core/get} on {@code webservices/rest.php}).
 *
 * <p>Records are selected with OQL, e.g. {@code SELECT Incident WHERE last_update > '2024-05-01 10:00:00'},
 * and paged with iTop's native {@code limit}/{@code page} parameters. The total count is read
 * from the {@code "Found: N"} message of a one-row query.
 */
@Slf4j
@Component
public class ItopSourceRecordClient implements SourceRecordClient {

    static final DateTimeFormatter ITOP_TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final Pattern FOUND = Pattern.compile("Found:\\s*(\\d+)");

    private final ItopProperties props;
    private final ObjectMapper objectMapper;
    private final ZoneId zone;
    private final WebClient webClient;

    public ItopSourceRecordClient(AppProperties appProperties,
                                  ObjectMapper objectMapper,
                                  WebClient.Builder webClientBuilder) {
        this.props = appProperties.getItop();
        this.objectMapper = objectMapper;
        this.zone = ZoneId.of(props.getTimeZone());

        WebClient.Builder builder = webClientBuilder.clone()
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(64 * 1024 * 1024))
                        .build());
        if (props.isConfigured()) {
            builder.baseUrl(props.getBaseUrl());
        }
        if (props.getUsername() != null && !props.getUsername().isBlank()) {
            builder.defaultHeaders(headers -> headers.setBasicAuth(props.getUsername(),
                    props.getPassword() != null ? props.getPassword() : ""));
        }
        this.webClient = builder.build();
    }

    @Override
    public boolean supports(KnowledgeCollection collection) {
        return collection.isTicket();
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public int count(SourceQuery query) {
        JsonNode response = call("count " + query.collection().getSourceClass(),
                coreGet(query, "id", 1, 1));
        Matcher matcher = FOUND.matcher(response.path("message").asText(""));
        if (matcher.find()) {
            return Integer.parseInt(matcher.group(1));
        }
        JsonNode objects = response.path("objects");
        return objects.isObject() ? objects.size() : 0;
    }

    @Override
    public List<SourceRecord> fetchPage(SourceQuery query, int page, int pageSize) {
        Preconditions.checkArgument(page >= 1, "page is 1-based");
        Preconditions.checkArgument(pageSize > 0, "pageSize must be positive");

        JsonNode response = call("page " + page + " of " + query.collection().getSourceClass(),
                coreGet(query, "*", pageSize, page));

        List<SourceRecord> records = new ArrayList<>();
        JsonNode objects = response.path("objects");
        if (!objects.isObject()) {
            return records;
        }
        Iterator<JsonNode> it = objects.elements();
        while (it.hasNext()) {
            JsonNode object = it.next();
            records.add(toRecord(query.collection(), object.path("key").asText(), object.path("fields")));
        }
        return records;
    }

    String buildOql(SourceQuery query) {
        String oql = "SELECT " + query.collection().getSourceClass();
        if (query.isIncremental()) {
            oql += " WHERE last_update > '" + ITOP_TIMESTAMP.format(query.modifiedAfter().atZone(zone)) + "'";
        }
        return oql;
    }

    private ObjectNode coreGet(SourceQuery query, String outputFields, int limit, int page) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("operation", "core/get");
        request.put("class", query.collection().getSourceClass());
        request.put("key", buildOql(query));
        request.put("output_fields", outputFields);
        request.put("limit", limit);
        request.put("page", page);
        return request;
    }

    private JsonNode call(String operation, ObjectNode request) {
        if (!props.isConfigured()) {
            throw new SourceFetchException(operation, "iTop base URL is not configured");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.ITOP, operation, log);
        ctx.logRequest(request.path("key").asText(), "limit", request.path("limit"), "page", request.path("page"));

        String body;
        try {
            body = webClient.post()
                    .uri(uriBuilder -> uriBuilder
                            .path("/webservices/rest.php")
                            .queryParam("version", props.getApiVersion())
                            .build())
                    .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                    .body(BodyInserters.fromFormData("json_data", objectMapper.writeValueAsString(request)))
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (JsonProcessingException e) {
            throw new SourceFetchException(operation, "cannot serialize request", e);
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new SourceFetchException(operation, e.getMessage(), e);
        }

        JsonNode response;
        try {
            response = objectMapper.readTree(body == null ? "" : body);
        } catch (JsonProcessingException e) {
            ctx.logError("Response is not JSON", e);
            throw new SourceFetchException(operation, "response is not JSON", e);
        }
        if (response == null || response.isMissingNode() || response.path("code").asInt(-1) != 0) {
            String message = response == null ? "empty response" : response.path("message").asText("empty response");
            ctx.logError(message, null);
            throw new SourceFetchException(operation, message);
        }

        ctx.logResponse(response.path("message").asText(), "objects", response.path("objects").size());
        return response;
    }

    private Retry buildRetrySpec() {
        HttpRetryProperties retry = props.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable)
                .doBeforeRetry(signal -> log.warn("iTop call failed, retry #{}: {}",
                        signal.totalRetries() + 1, signal.failure().getMessage()))
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = props.getRetry().getRetryableStatusCodes();
        if (codes == null) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }

    private SourceRecord toRecord(KnowledgeCollection collection, String key, JsonNode fields) {
        boolean change = collection == KnowledgeCollection.CHANGE;

        RecordAttributes attributes = RecordAttributes.builder()
                .status(text(fields, "status"))
                .category(change ? text(fields, "finalclass") : text(fields, "severity"))
                .priority(text(fields, "priority"))
                .impact(text(fields, "impact"))
                .urgency(text(fields, "urgency"))
                .team(text(fields, "team_id_friendlyname"))
                .agent(text(fields, "agent_id_friendlyname"))
                .service(text(fields, "service_name"))
                .origin(text(fields, "origin"))
                .caller(text(fields, "caller_id_friendlyname"))
                .supervisor(text(fields, "supervisor_id_friendlyname"))
                .outage(text(fields, "outage"))
                .startDate(text(fields, "start_date"))
                .build();

        return SourceRecord.builder()
                .collection(collection)
                .externalId(key)
                .ref(text(fields, "ref"))
                .title(text(fields, "title"))
                .description(text(fields, "description"))
                .fallbackPlan(change ? text(fields, "fallback") : null)
                .lastModified(parseTimestamp(text(fields, "last_update")))
                .attributes(attributes)
                .logEntries(logEntries(fields.path(change ? "private_log" : "public_log")))
                .build();
    }

    private List<RecordLogEntry> logEntries(JsonNode caseLog) {
        List<RecordLogEntry> entries = new ArrayList<>();
        for (JsonNode entry : caseLog.path("entries")) {
            entries.add(new RecordLogEntry(
                    text(entry, "date"),
                    text(entry, "user_login"),
                    text(entry, "message"),
                    text(entry, "message_html")));
        }
        return entries;
    }

    Instant parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return LocalDateTime.parse(value.trim(), ITOP_TIMESTAMP).atZone(zone).toInstant();
        } catch (DateTimeParseException e) {
            log.warn("Unparseable iTop timestamp '{}'", value);
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }
}
