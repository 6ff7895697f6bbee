package com.purchasingpower.compliancekb.client;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.exception.SourceFetchException;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SourceQuery;
import com.purchasingpower.compliancekb.model.SourceRecord;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Google Drive Document Client Tests")
class DriveDocumentClientTest {

    private static final String FILES = "/drive/v3/files";

    private final List<ClientRequest> requests = new ArrayList<>();
    /**
     * Listing responses keyed by the page token they answer ("" for the first page).
     */
    private final Map<String, String> listings = new HashMap<>();
    private final Map<String, byte[]> contents = new HashMap<>();
    private AppProperties props;

    @BeforeEach
    void setUp() {
        props = new AppProperties();
        props.getDrive().setBaseUrl("http://drive.local");
        props.getDrive().setServiceAccountKeyPath("/etc/keys/drive.json");
        props.getDrive().setFolderIds(List.of("folder-isms", "folder-hr"));
        props.getDrive().getRetry().setMaxAttempts(0);
    }

    @Test
    @DisplayName("Listing query covers the folders, skips trash and filters on modification time")
    void testBuildQuery_ShouldSelectFoldersAndWatermark() {
        DriveDocumentClient client = client();

        assertThat(client.buildQuery(SourceQuery.all(KnowledgeCollection.DOCUMENT)))
                .isEqualTo("('folder-isms' in parents or 'folder-hr' in parents) and trashed = false"
                        + " and (mimeType = 'application/pdf' or mimeType = 'application/vnd.google-apps.document'"
                        + " or mimeType contains 'text/')");
        assertThat(client.buildQuery(SourceQuery.modifiedAfter(KnowledgeCollection.DOCUMENT,
                Instant.parse("2024-05-01T10:15:30.250Z"))))
                .endsWith(" and modifiedTime > '2024-05-01T10:15:30Z'");
    }

    @Test
    @DisplayName("Count follows page tokens across the whole listing")
    void testCount_ShouldSumAllListingPages() {
        // Given
        listings.put("", """
                {"nextPageToken": "t2", "files": [{"id": "a"}, {"id": "b"}]}
                """);
        listings.put("t2", """
                {"files": [{"id": "c"}]}
                """);

        // When
        int count = client().count(SourceQuery.all(KnowledgeCollection.DOCUMENT));

        // Then
        assertThat(count).isEqualTo(3);
        assertThat(requests).hasSize(2);
        Map<String, String> first = query(requests.get(0));
        assertThat(first.get("q")).startsWith("('folder-isms' in parents");
        assertThat(first.get("fields")).isEqualTo("nextPageToken, files(id)");
        assertThat(first.get("pageSize")).isEqualTo("1000");
        assertThat(requests.get(0).headers().getFirst(HttpHeaders.AUTHORIZATION)).isEqualTo("Bearer test-token");
    }

    @Test
    @DisplayName("Pages map files to documents with folder, link and extracted body")
    void testFetchPage_ShouldMapFilesAndReadBodies() throws IOException {
        // Given
        listings.put("", """
                {"files": [
                  {"id": "p1", "name": "Access Control Policy.pdf", "mimeType": "application/pdf", "size": "2048",
                   "modifiedTime": "2024-05-01T10:15:30.000Z", "webViewLink": "https://drive.google.com/file/d/p1/view",
                   "parents": ["other", "folder-isms"]},
                  {"id": "g1", "name": "Incident Response Plan", "mimeType": "application/vnd.google-apps.document",
                   "modifiedTime": "2024-05-02T08:00:00Z", "parents": ["folder-hr"]},
                  {"id": "t1", "name": "notes.txt", "mimeType": "text/plain", "size": "15",
                   "modifiedTime": "2024-05-03T08:00:00Z", "parents": ["folder-hr"]}
                ]}
                """);
        contents.put(FILES + "/p1", pdf("Access is reviewed every quarter."));
        contents.put(FILES + "/g1/export", "Call the ISMS officer first.".getBytes(StandardCharsets.UTF_8));
        contents.put(FILES + "/t1", "Plain text notes".getBytes(StandardCharsets.UTF_8));

        // When
        List<SourceRecord> records = client().fetchPage(SourceQuery.all(KnowledgeCollection.DOCUMENT), 1, 500);

        // Then
        assertThat(records).hasSize(3);
        SourceRecord policy = records.get(0);
        assertThat(policy.getCollection()).isEqualTo(KnowledgeCollection.DOCUMENT);
        assertThat(policy.getExternalId()).isEqualTo("p1");
        assertThat(policy.getRef()).isEqualTo("Access Control Policy.pdf");
        assertThat(policy.getTitle()).isNull();
        assertThat(policy.getLastModified()).isEqualTo(Instant.parse("2024-05-01T10:15:30Z"));
        assertThat(policy.getDescription()).contains("Access is reviewed every quarter.");
        assertThat(policy.getContentError()).isNull();
        assertThat(policy.getAttributes().getFolderId()).isEqualTo("folder-isms");
        assertThat(policy.getAttributes().getMimeType()).isEqualTo("application/pdf");
        assertThat(policy.getAttributes().getLink()).isEqualTo("https://drive.google.com/file/d/p1/view");

        assertThat(records.get(1).getDescription()).isEqualTo("Call the ISMS officer first.");
        assertThat(records.get(1).getAttributes().getFolderId()).isEqualTo("folder-hr");
        assertThat(records.get(2).getDescription()).isEqualTo("Plain text notes");

        ClientRequest export = requests.stream()
                .filter(r -> r.url().getPath().equals(FILES + "/g1/export"))
                .findFirst()
                .orElseThrow();
        assertThat(query(export).get("mimeType")).isEqualTo("text/plain");
        ClientRequest download = requests.stream()
                .filter(r -> r.url().getPath().equals(FILES + "/p1"))
                .findFirst()
                .orElseThrow();
        assertThat(query(download).get("alt")).isEqualTo("media");
    }

    @Test
    @DisplayName("An unreadable file is returned with a content error and does not fail the page")
    void testFetchPage_UnreadableFile_ShouldCarryContentError() {
        // Given
        listings.put("", """
                {"files": [
                  {"id": "bad", "name": "broken.pdf", "mimeType": "application/pdf", "size": "10", "parents": ["folder-isms"]},
                  {"id": "huge", "name": "huge.pdf", "mimeType": "application/pdf", "size": "999999999", "parents": ["folder-isms"]}
                ]}
                """);
        contents.put(FILES + "/bad", "not a pdf".getBytes(StandardCharsets.UTF_8));

        // When
        List<SourceRecord> records = client().fetchPage(SourceQuery.all(KnowledgeCollection.DOCUMENT), 1, 500);

        // Then
        assertThat(records).hasSize(2);
        assertThat(records.get(0).getContentError()).contains("unreadable PDF");
        assertThat(records.get(0).getDescription()).isNull();
        assertThat(records.get(1).getContentError()).contains("limit is");
        assertThat(requests).noneMatch(r -> r.url().getPath().equals(FILES + "/huge"));
    }

    @Test
    @DisplayName("A later page is reached by walking the page tokens, and a page past the end is empty")
    void testFetchPage_ShouldMapPageNumbersToTokens() {
        // Given
        listings.put("", """
                {"nextPageToken": "t2", "files": [{"id": "a", "name": "a.txt", "mimeType": "text/plain"}]}
                """);
        listings.put("t2", """
                {"nextPageToken": "t3", "files": [{"id": "b", "name": "b.txt", "mimeType": "text/plain"}]}
                """);
        listings.put("t3", """
                {"files": [{"id": "c", "name": "c.txt", "mimeType": "text/plain"}]}
                """);
        contents.put(FILES + "/c", "third".getBytes(StandardCharsets.UTF_8));
        DriveDocumentClient client = client();
        SourceQuery query = SourceQuery.all(KnowledgeCollection.DOCUMENT);

        // When
        List<SourceRecord> third = client.fetchPage(query, 3, 1);

        // Then
        assertThat(third).extracting(SourceRecord::getExternalId).containsExactly("c");
        assertThat(requests.stream().filter(r -> r.url().getPath().equals(FILES)).map(r -> query(r).get("fields")))
                .containsExactly("nextPageToken", "nextPageToken",
                        "nextPageToken, files(id, name, mimeType, size, modifiedTime, webViewLink, parents)");
        assertThat(client.fetchPage(query, 4, 1)).isEmpty();
    }

    @Test
    @DisplayName("Listing errors are fetch failures")
    void testListingError_ShouldThrow() {
        // no listing stubbed: the stub answers 404
        assertThatThrownBy(() -> client().count(SourceQuery.all(KnowledgeCollection.DOCUMENT)))
                .isInstanceOf(SourceFetchException.class)
                .hasMessageStartingWith("count documents failed");
    }

    @Test
    @DisplayName("Without folders or a service account key the client is unconfigured and sends nothing")
    void testNotConfigured_ShouldThrow() {
        props.getDrive().setFolderIds(List.of(" "));
        DriveDocumentClient client = client();

        assertThat(client.isConfigured()).isFalse();
        assertThat(client.supports(KnowledgeCollection.DOCUMENT)).isTrue();
        assertThat(client.supports(KnowledgeCollection.INCIDENT)).isFalse();
        assertThatThrownBy(() -> client.fetchPage(SourceQuery.all(KnowledgeCollection.DOCUMENT), 1, 10))
                .isInstanceOf(SourceFetchException.class);
        assertThat(requests).isEmpty();
    }

    private DriveDocumentClient client() {
        WebClient.Builder builder = WebClient.builder().exchangeFunction(request -> {
            requests.add(request);
            String path = request.url().getPath();
            if (path.equals(FILES)) {
                String token = query(request).getOrDefault("pageToken", "");
                String body = listings.get(token);
                if (body == null) {
                    return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
                }
                return Mono.just(ClientResponse.create(HttpStatus.OK)
                        .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                        .body(body)
                        .build());
            }
            byte[] content = contents.get(path);
            if (content == null) {
                return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND).build());
            }
            return Mono.just(ClientResponse.create(HttpStatus.OK)
                    .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_OCTET_STREAM_VALUE)
                    .body(Flux.just(DefaultDataBufferFactory.sharedInstance.wrap(content)))
                    .build());
        });
        return new DriveDocumentClient(props, new ObjectMapper(), builder, () -> "test-token");
    }

    private static Map<String, String> query(ClientRequest request) {
        Map<String, String> params = new HashMap<>();
        UriComponentsBuilder.fromUri(request.url()).build(true).getQueryParams()
                .forEach((key, values) -> params.put(key, URLDecoder.decode(values.get(0), StandardCharsets.UTF_8)));
        return params;
    }

    private static byte[] pdf(String text) throws IOException {
        try (PDDocument document = new PDDocument()) {
            PDPage page = new PDPage();
            document.addPage(page);
            try (PDPageContentStream stream = new PDPageContentStream(document, page)) {
                stream.beginText();
                stream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 12);
                stream.newLineAtOffset(72, 700);
                stream.showText(text);
                stream.endText();
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            return out.toByteArray();
        }
    }
}
