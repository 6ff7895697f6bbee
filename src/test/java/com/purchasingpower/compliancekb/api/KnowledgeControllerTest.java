package com.purchasingpower.compliancekb.api;

import com.purchasingpower.compliancekb.exception.EmbeddingException;
import com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException;
import com.purchasingpower.compliancekb.exception.SyncCooldownException;
import com.purchasingpower.compliancekb.model.AnswerSource;
import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.KnowledgeAnswer;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;
import com.purchasingpower.compliancekb.model.sync.SyncJobEntity;
import com.purchasingpower.compliancekb.model.sync.SyncJobStatus;
import com.purchasingpower.compliancekb.model.sync.SyncMode;
import com.purchasingpower.compliancekb.model.sync.SyncStartResult;
import com.purchasingpower.compliancekb.service.AnswerComposer;
import com.purchasingpower.compliancekb.service.KnowledgeRetriever;
import com.purchasingpower.compliancekb.service.SyncJobManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("Knowledge Controller Tests")
class KnowledgeControllerTest {

    private static final UUID JOB_ID = UUID.fromString("7f1c0d1e-5a0b-4c59-9d0e-2b7d6c1a9e11");

    private SyncJobManager syncJobManager;
    private KnowledgeRetriever retriever;
    private AnswerComposer answerComposer;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        syncJobManager = mock(SyncJobManager.class);
        retriever = mock(KnowledgeRetriever.class);
        answerComposer = mock(AnswerComposer.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new KnowledgeController(syncJobManager, retriever, answerComposer))
                .build();
    }

    @Test
    @DisplayName("A new sync is accepted with its job id")
    void testStartSync_ShouldReturnAccepted() throws Exception {
        // Given
        when(syncJobManager.startSync("org-1", KnowledgeCollection.INCIDENT, SyncMode.INCREMENTAL))
                .thenReturn(new SyncStartResult(JOB_ID, false, new CompletableFuture<>()));

        // When / Then
        mockMvc.perform(post("/api/v1/knowledge/incidents/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.jobId").value(JOB_ID.toString()))
                .andExpect(jsonPath("$.data.reused").value(false));
    }

    @Test
    @DisplayName("A reused sync answers 200 and honours the requested mode")
    void testStartSync_Reused_ShouldReturnOk() throws Exception {
        when(syncJobManager.startSync("org-1", KnowledgeCollection.CHANGE, SyncMode.FULL))
                .thenReturn(new SyncStartResult(JOB_ID, true, new CompletableFuture<>()));

        mockMvc.perform(post("/api/v1/knowledge/changes/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\", \"mode\": \"FULL\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.reused").value(true));
    }

    @Test
    @DisplayName("A sync without organization is rejected")
    void testStartSync_MissingOrganization_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/knowledge/incidents/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("organizationId is required"));
        verify(syncJobManager, never()).startSync(anyString(), any(), any());
    }

    @Test
    @DisplayName("Unknown collections are rejected")
    void testStartSync_UnknownCollection_ShouldReturnBadRequest() throws Exception {
        mockMvc.perform(post("/api/v1/knowledge/problems/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    @DisplayName("Cooldown rejections carry the remaining seconds")
    void testStartSync_Cooldown_ShouldReturnTooManyRequests() throws Exception {
        when(syncJobManager.startSync(anyString(), any(), any())).thenThrow(new SyncCooldownException(20));

        mockMvc.perform(post("/api/v1/knowledge/incidents/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\"}"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "20"))
                .andExpect(jsonPath("$.retryAfterSeconds").value(20))
                .andExpect(jsonPath("$.error").value("Please wait 20 seconds before starting another sync"));
    }

    @Test
    @DisplayName("Missing credentials are reported as unavailable")
    void testStartSync_NotConfigured_ShouldReturnServiceUnavailable() throws Exception {
        when(syncJobManager.startSync(anyString(), any(), any()))
                .thenThrow(new KnowledgeConfigurationException("OpenAI API key is not configured (OPENAI_API_KEY)"));

        mockMvc.perform(post("/api/v1/knowledge/incidents/sync")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.error").value("OpenAI API key is not configured (OPENAI_API_KEY)"));
    }

    @Test
    @DisplayName("Job status is returned without the lock column")
    void testGetSyncJob_ShouldReturnJob() throws Exception {
        SyncJobEntity job = SyncJobEntity.builder()
                .id(JOB_ID)
                .organizationId("org-1")
                .type(KnowledgeCollection.INCIDENT.getJobType())
                .mode(SyncMode.FULL)
                .status(SyncJobStatus.RUNNING)
                .total(3000)
                .progress(1200)
                .activeLock("org-1:incident_embedding")
                .startedAt(Instant.parse("2024-06-01T12:00:00Z"))
                .updatedAt(Instant.parse("2024-06-01T12:05:00Z"))
                .build();
        when(syncJobManager.getJob(JOB_ID)).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/v1/knowledge/sync/{jobId}", JOB_ID))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("RUNNING"))
                .andExpect(jsonPath("$.data.progress").value(1200))
                .andExpect(jsonPath("$.data.total").value(3000))
                .andExpect(jsonPath("$.data.activeLock").doesNotExist());
    }

    @Test
    @DisplayName("Unknown jobs answer 404")
    void testGetSyncJob_Unknown_ShouldReturnNotFound() throws Exception {
        when(syncJobManager.getJob(any())).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/knowledge/sync/{jobId}", UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("Search passes status and team filters through")
    void testSearch_ShouldApplyFilters() throws Exception {
        // Given
        ChunkMatch match = ChunkMatch.builder()
                .chunkId(UUID.randomUUID())
                .collection(KnowledgeCollection.INCIDENT)
                .sourceRecordId("42")
                .ref("I-000042")
                .title("Phishing wave")
                .content("Mails with fake invoices")
                .similarity(0.91)
                .build();
        when(retriever.search(eq("phishing"), any(SearchFilter.class), eq(5))).thenReturn(List.of(match));

        // When
        mockMvc.perform(get("/api/v1/knowledge/incidents/search")
                        .param("organizationId", "org-1")
                        .param("q", "phishing")
                        .param("limit", "5")
                        .param("status", "resolved")
                        .param("team", ""))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[0].ref").value("I-000042"))
                .andExpect(jsonPath("$.data[0].similarity").value(0.91));

        // Then
        ArgumentCaptor<SearchFilter> filter = ArgumentCaptor.forClass(SearchFilter.class);
        verify(retriever).search(eq("phishing"), filter.capture(), eq(5));
        assertThat(filter.getValue().getCollection()).isEqualTo(KnowledgeCollection.INCIDENT);
        assertThat(filter.getValue().getStatus()).isEqualTo("resolved");
        assertThat(filter.getValue().getTeam()).isNull();
        assertThat(filter.getValue().getFolderId()).isNull();
    }

    @Test
    @DisplayName("Document search is narrowed to one Drive folder")
    void testDocumentSearch_ShouldApplyFolderFilter() throws Exception {
        // Given
        when(retriever.search(eq("password rotation"), any(SearchFilter.class), eq(null))).thenReturn(List.of());

        // When
        mockMvc.perform(get("/api/v1/knowledge/documents/search")
                        .param("organizationId", "org-1")
                        .param("q", "password rotation")
                        .param("folderId", "folder-isms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));

        // Then
        ArgumentCaptor<SearchFilter> filter = ArgumentCaptor.forClass(SearchFilter.class);
        verify(retriever).search(eq("password rotation"), filter.capture(), eq(null));
        assertThat(filter.getValue().getCollection()).isEqualTo(KnowledgeCollection.DOCUMENT);
        assertThat(filter.getValue().getFolderId()).isEqualTo("folder-isms");
        assertThat(filter.getValue().getStatus()).isNull();
    }

    @Test
    @DisplayName("Answers are wrapped in the envelope; provider failures are bad gateway")
    void testAsk() throws Exception {
        when(answerComposer.ask("org-1", KnowledgeCollection.CHANGE, "Which changes caused outages?"))
                .thenReturn(new KnowledgeAnswer("Two [Source 1].",
                        List.of(new AnswerSource("C-000007", "Rotate TLS certificates", 0.8, "Rotate...", null))));

        mockMvc.perform(post("/api/v1/knowledge/changes/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\", \"question\": \"Which changes caused outages?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.answer").value("Two [Source 1]."))
                .andExpect(jsonPath("$.data.sources[0].ref").value("C-000007"));

        when(answerComposer.ask(anyString(), any(), anyString())).thenThrow(new EmbeddingException("provider down"));

        mockMvc.perform(post("/api/v1/knowledge/changes/ask")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"organizationId\": \"org-1\", \"question\": \"again?\"}"))
                .andExpect(status().isBadGateway());
    }

    @Test
    @DisplayName("Similar records are served per collection")
    void testFindSimilar() throws Exception {
        when(retriever.findSimilar("org-1", KnowledgeCollection.INCIDENT, "42", null)).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/knowledge/incidents/records/{recordId}/similar", "42")
                        .param("organizationId", "org-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").isEmpty());
    }
}
