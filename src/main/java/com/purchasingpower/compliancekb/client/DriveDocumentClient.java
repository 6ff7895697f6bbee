package com.purchasingpower.compliancekb.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.DriveProperties;
import com.purchasingpower.compliancekb.configuration.HttpRetryProperties;
import com.purchasingpower.compliancekb.exception.SourceFetchException;
import com.purchasingpower.compliancekb.model.CallContext;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.RecordAttributes;
import com.purchasingpower.compliancekb.model.ServiceType;
import com.purchasingpower.compliancekb.model.SourceQuery;
import com.purchasingpower.compliancekb.model.SourceRecord;
import com.purchasingpower.compliancekb.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Google Drive v3 client for the policy documents of the configured folders.
 *
 * <p>Files are listed with {@code files.list}, e.g.
 * {@code ('f1' in parents) and trashed = false and (mimeType = 'application/pdf' or ...)}, ordered by
 * creation time. Drive pages with opaque tokens, so the tokens seen during a run are kept per
 * query and a page number is mapped to its token; a resumed run walks the listing forward to reach
 * its start page. Bodies are read per file: PDFs through PDFBox, Google Docs exported as plain
 * text, text files as UTF-8. A file that cannot be read is returned with a content error instead
 * of failing the page.
 */
@Slf4j
@Component
public class DriveDocumentClient implements SourceRecordClient {

    static final String PDF = "application/pdf";
    static final String GOOGLE_DOC = "application/vnd.google-apps.document";
    static final String DRIVE_SCOPE = "https://www.googleapis.com/auth/drive.readonly";

    private static final String FILES_PATH = "/drive/v3/files";
    private static final String PAGE_FIELDS = "nextPageToken, files(id, name, mimeType, size, modifiedTime, webViewLink, parents)";
    private static final String COUNT_FIELDS = "nextPageToken, files(id)";
    private static final String TOKEN_FIELDS = "nextPageToken";
    private static final int COUNT_PAGE_SIZE = 1000;

    private final DriveProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final Supplier<String> accessToken;

    /**
     * Page tokens per listing: entry {@code i} requests page {@code i + 2}.
     */
    private final Map<String, List<String>> pageTokens = new ConcurrentHashMap<>();

    @Autowired
    public DriveDocumentClient(AppProperties appProperties,
                               ObjectMapper objectMapper,
                               WebClient.Builder webClientBuilder) {
        this(appProperties, objectMapper, webClientBuilder,
                new ServiceAccountToken(appProperties.getDrive().getServiceAccountKeyPath()));
    }

    DriveDocumentClient(AppProperties appProperties,
                        ObjectMapper objectMapper,
                        WebClient.Builder webClientBuilder,
                        Supplier<String> accessToken) {
        this.props = appProperties.getDrive();
        this.objectMapper = objectMapper;
        this.accessToken = accessToken;
        this.webClient = webClientBuilder.clone()
                .baseUrl(props.getBaseUrl())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs()
                                .maxInMemorySize((int) Math.min(Integer.MAX_VALUE, props.getMaxFileBytes() + 1024)))
                        .build())
                .build();
    }

    @Override
    public boolean supports(KnowledgeCollection collection) {
        return collection == KnowledgeCollection.DOCUMENT;
    }

    @Override
    public boolean isConfigured() {
        return props.isConfigured();
    }

    @Override
    public int count(SourceQuery query) {
        String q = buildQuery(query);
        // a new run starts here; tokens of earlier runs may point into a changed listing
        pageTokens.keySet().removeIf(key -> key.startsWith(q + "|"));

        int count = 0;
        String token = null;
        do {
            JsonNode listing = list(q, token, COUNT_PAGE_SIZE, COUNT_FIELDS, "count documents");
            count += listing.path("files").size();
            token = text(listing, "nextPageToken");
        } while (token != null);
        return count;
    }

    @Override
    public List<SourceRecord> fetchPage(SourceQuery query, int page, int pageSize) {
        Preconditions.checkArgument(page >= 1, "page is 1-based");
        Preconditions.checkArgument(pageSize > 0, "pageSize must be positive");

        String q = buildQuery(query);
        List<String> tokens = pageTokens.computeIfAbsent(q + "|" + pageSize, key -> new ArrayList<>());
        List<SourceRecord> records = new ArrayList<>();

        JsonNode listing;
        synchronized (tokens) {
            String token = null;
            if (page > 1) {
                token = tokenFor(q, tokens, page, pageSize);
                if (token == null) {
                    return records;
                }
            }
            listing = list(q, token, pageSize, PAGE_FIELDS, "page " + page + " of documents");
            String next = text(listing, "nextPageToken");
            if (next != null && tokens.size() == page - 1) {
                tokens.add(next);
            }
        }

        for (JsonNode file : listing.path("files")) {
            records.add(toRecord(file));
        }
        return records;
    }

    String buildQuery(SourceQuery query) {
        String parents = props.activeFolderIds().stream()
                .map(id -> "'" + escape(id) + "' in parents")
                .collect(Collectors.joining(" or "));
        StringBuilder q = new StringBuilder("(").append(parents).append(") and trashed = false")
                .append(" and (mimeType = '").append(PDF).append("' or mimeType = '").append(GOOGLE_DOC)
                .append("' or mimeType contains 'text/')");
        if (query.isIncremental()) {
            q.append(" and modifiedTime > '")
                    .append(DateTimeFormatter.ISO_INSTANT.format(query.modifiedAfter().truncatedTo(ChronoUnit.SECONDS)))
                    .append("'");
        }
        return q.toString();
    }

    /**
     * Token of the given page (page > 1), listing forward from the last known token as needed.
     * Null when the listing ends before that page.
     */
    private String tokenFor(String q, List<String> tokens, int page, int pageSize) {
        while (tokens.size() < page - 1) {
            String previous = tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
            JsonNode listing = list(q, previous, pageSize, TOKEN_FIELDS, "skip to page " + (tokens.size() + 2));
            String next = text(listing, "nextPageToken");
            if (next == null) {
                return null;
            }
            tokens.add(next);
        }
        return tokens.get(page - 2);
    }

    private JsonNode list(String q, String pageToken, int pageSize, String fields, String operation) {
        if (!props.isConfigured()) {
            throw new SourceFetchException(operation, "Google Drive folders or service account are not configured");
        }

        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GOOGLE_DRIVE, operation, log);
        ctx.logRequest(q, "pageSize", pageSize, "pageToken", pageToken != null);

        String body;
        try {
            body = webClient.get()
                    .uri(uriBuilder -> {
                        uriBuilder.path(FILES_PATH)
                                .queryParam("q", "{q}")
                                .queryParam("fields", "{fields}")
                                .queryParam("pageSize", pageSize)
                                .queryParam("orderBy", "createdTime")
                                .queryParam("supportsAllDrives", true)
                                .queryParam("includeItemsFromAllDrives", true);
                        if (pageToken != null) {
                            uriBuilder.queryParam("pageToken", "{pageToken}");
                            return uriBuilder.build(q, fields, pageToken);
                        }
                        return uriBuilder.build(q, fields);
                    })
                    .headers(headers -> headers.setBearerAuth(accessToken.get()))
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (SourceFetchException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
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
        if (response == null || response.isMissingNode()) {
            ctx.logError("empty response", null);
            throw new SourceFetchException(operation, "empty response");
        }

        ctx.logResponse("listed", "files", response.path("files").size(),
                "more", response.hasNonNull("nextPageToken"));
        return response;
    }

    private SourceRecord toRecord(JsonNode file) {
        String id = text(file, "id");
        String name = text(file, "name");
        String mimeType = text(file, "mimeType");

        String body = null;
        String contentError = null;
        long size = file.path("size").asLong(0);
        if (size > props.getMaxFileBytes()) {
            contentError = "file has " + size + " bytes, limit is " + props.getMaxFileBytes();
        } else {
            try {
                body = readText(id, name, mimeType);
            } catch (SourceFetchException e) {
                log.warn("Cannot read document {} ({}): {}", name, id, e.getMessage());
                contentError = e.getMessage();
            }
        }

        return SourceRecord.builder()
                .collection(KnowledgeCollection.DOCUMENT)
                .externalId(id)
                .ref(name)
                .description(body)
                .lastModified(parseTimestamp(text(file, "modifiedTime")))
                .contentError(contentError)
                .attributes(RecordAttributes.builder()
                        .folderId(folderOf(file))
                        .mimeType(mimeType)
                        .link(text(file, "webViewLink"))
                        .build())
                .build();
    }

    String readText(String fileId, String name, String mimeType) {
        if (GOOGLE_DOC.equals(mimeType)) {
            byte[] exported = download("export " + name, FILES_PATH + "/{id}/export?mimeType=text/plain", fileId);
            return new String(exported, StandardCharsets.UTF_8);
        }
        byte[] content = download("download " + name, FILES_PATH + "/{id}?alt=media&supportsAllDrives=true", fileId);
        if (PDF.equals(mimeType)) {
            return extractPdfText(name, content);
        }
        return new String(content, StandardCharsets.UTF_8);
    }

    private byte[] download(String operation, String uriTemplate, String fileId) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.GOOGLE_DRIVE, operation, log);
        ctx.logRequest(fileId);
        byte[] content;
        try {
            content = webClient.get()
                    .uri(uriTemplate, fileId)
                    .headers(headers -> headers.setBearerAuth(accessToken.get()))
                    .retrieve()
                    .bodyToMono(byte[].class)
                    .retryWhen(buildRetrySpec())
                    .block(Duration.ofSeconds(props.getTimeoutSeconds()));
        } catch (SourceFetchException e) {
            ctx.logError(e.getMessage(), e);
            throw e;
        } catch (RuntimeException e) {
            ctx.logError(e.getMessage(), e);
            throw new SourceFetchException(operation, e.getMessage(), e);
        }
        ctx.logResponse("downloaded", "bytes", content != null ? content.length : 0);
        return content != null ? content : new byte[0];
    }

    static String extractPdfText(String name, byte[] content) {
        try (PDDocument document = Loader.loadPDF(content)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            // blank lines between paragraphs and pages keep the chunker's split points
            stripper.setParagraphEnd("\n");
            stripper.setPageEnd("\n\n");
            return stripper.getText(document);
        } catch (IOException e) {
            throw new SourceFetchException("extract " + name, "unreadable PDF: " + e.getMessage(), e);
        }
    }

    private String folderOf(JsonNode file) {
        List<String> folders = props.activeFolderIds();
        String first = null;
        for (JsonNode parent : file.path("parents")) {
            String id = parent.asText();
            if (folders.contains(id)) {
                return id;
            }
            if (first == null) {
                first = id;
            }
        }
        return first;
    }

    private Retry buildRetrySpec() {
        HttpRetryProperties retry = props.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable)
                .doBeforeRetry(signal -> log.warn("Google Drive call failed, retry #{}: {}",
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

    private static Instant parseTimestamp(String value) {
        if (value == null) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Unparseable Drive timestamp '{}'", value);
            return null;
        }
    }

    private static String escape(String value) {
        return value.replace("\\", "\\\\").replace("'", "\\'");
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    /**
     * Access tokens of the service account, refreshed when they expire.
     */
    static final class ServiceAccountToken implements Supplier<String> {

        private final String keyPath;
        private GoogleCredentials credentials;

        ServiceAccountToken(String keyPath) {
            this.keyPath = keyPath;
        }

        @Override
        public synchronized String get() {
            try {
                if (credentials == null) {
                    try (InputStream in = Files.newInputStream(Path.of(keyPath))) {
                        credentials = GoogleCredentials.fromStream(in).createScoped(List.of(DRIVE_SCOPE));
                    }
                }
                credentials.refreshIfExpired();
                return credentials.getAccessToken().getTokenValue();
            } catch (IOException e) {
                throw new SourceFetchException("authenticate", "cannot obtain a Google access token: " + e.getMessage(), e);
            }
        }
    }
}
