package com.purchasingpower.compliancekb.api;

import com.purchasingpower.compliancekb.exception.ChatCompletionException;
import com.purchasingpower.compliancekb.exception.EmbeddingException;
import com.purchasingpower.compliancekb.exception.KnowledgeConfigurationException;
import com.purchasingpower.compliancekb.exception.ResourceNotFoundException;
import com.purchasingpower.compliancekb.exception.SourceFetchException;
import com.purchasingpower.compliancekb.exception.SyncCooldownException;
import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.KnowledgeAnswer;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;
import com.purchasingpower.compliancekb.model.sync.KnowledgeBaseStatus;
import com.purchasingpower.compliancekb.model.sync.SyncMode;
import com.purchasingpower.compliancekb.model.sync.SyncStartResult;
import com.purchasingpower.compliancekb.service.AnswerComposer;
import com.purchasingpower.compliancekb.service.KnowledgeRetriever;
import com.purchasingpower.compliancekb.service.SyncJobManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

/**
 * Knowledge base API: triggers syncs, reports their state and serves search and answers.
 *
 * <p>{@code collection} is {@code incidents} or {@code changes}.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/knowledge")
@RequiredArgsConstructor
public class KnowledgeController {

    private final SyncJobManager syncJobManager;
    private final KnowledgeRetriever retriever;
    private final AnswerComposer answerComposer;

    /**
     * POST /api/v1/knowledge/{collection}/sync
     */
    @PostMapping("/{collection}/sync")
    public ResponseEntity<ApiResponse<SyncStartResponse>> startSync(@PathVariable String collection,
                                                                    @RequestBody SyncRequest request) {
        try {
            if (isBlank(request.getOrganizationId())) {
                return ResponseEntity.badRequest().body(ApiResponse.error("organizationId is required"));
            }
            SyncMode mode = request.getMode() != null ? request.getMode() : SyncMode.INCREMENTAL;

            SyncStartResult result = syncJobManager.startSync(
                    request.getOrganizationId(), KnowledgeCollection.fromPath(collection), mode);

            HttpStatus status = result.reused() ? HttpStatus.OK : HttpStatus.ACCEPTED;
            return ResponseEntity.status(status)
                    .body(ApiResponse.success(new SyncStartResponse(result.jobId(), result.reused())));
        } catch (Exception e) {
            return failure("Sync start", e);
        }
    }

    /**
     * GET /api/v1/knowledge/sync/{jobId}
     */
    @GetMapping("/sync/{jobId}")
    public ResponseEntity<ApiResponse<SyncJobResponse>> getSyncJob(@PathVariable UUID jobId) {
        try {
            return syncJobManager.getJob(jobId)
                    .map(job -> ResponseEntity.ok(ApiResponse.success(SyncJobResponse.from(job))))
                    .orElseThrow(() -> new ResourceNotFoundException("Sync job not found: " + jobId));
        } catch (Exception e) {
            return failure("Sync status", e);
        }
    }

    /**
     * GET /api/v1/knowledge/{collection}/status?organizationId=
     */
    @GetMapping("/{collection}/status")
    public ResponseEntity<ApiResponse<KnowledgeBaseStatus>> getStatus(@PathVariable String collection,
                                                                      @RequestParam String organizationId) {
        try {
            KnowledgeBaseStatus status = syncJobManager.getKnowledgeBaseStatus(
                    organizationId, KnowledgeCollection.fromPath(collection));
            return ResponseEntity.ok(ApiResponse.success(status));
        } catch (Exception e) {
            return failure("Knowledge base status", e);
        }
    }

    /**
     * GET /api/v1/knowledge/{collection}/search?organizationId=&q=&limit=&status=&team=&folderId=
     */
    @GetMapping("/{collection}/search")
    public ResponseEntity<ApiResponse<List<ChunkMatch>>> search(@PathVariable String collection,
                                                                @RequestParam String organizationId,
                                                                @RequestParam("q") String query,
                                                                @RequestParam(required = false) Integer limit,
                                                                @RequestParam(required = false) String status,
                                                                @RequestParam(required = false) String team,
                                                                @RequestParam(required = false) String folderId) {
        try {
            SearchFilter filter = SearchFilter.builder()
                    .organizationId(organizationId)
                    .collection(KnowledgeCollection.fromPath(collection))
                    .status(emptyToNull(status))
                    .team(emptyToNull(team))
                    .folderId(emptyToNull(folderId))
                    .build();
            return ResponseEntity.ok(ApiResponse.success(retriever.search(query, filter, limit)));
        } catch (Exception e) {
            return failure("Search", e);
        }
    }

    /**
     * POST /api/v1/knowledge/{collection}/ask
     */
    @PostMapping("/{collection}/ask")
    public ResponseEntity<ApiResponse<KnowledgeAnswer>> ask(@PathVariable String collection,
                                                            @RequestBody AskRequest request) {
        try {
            if (isBlank(request.getOrganizationId())) {
                return ResponseEntity.badRequest().body(ApiResponse.error("organizationId is required"));
            }
            KnowledgeAnswer answer = answerComposer.ask(
                    request.getOrganizationId(), KnowledgeCollection.fromPath(collection), request.getQuestion());
            return ResponseEntity.ok(ApiResponse.success(answer));
        } catch (Exception e) {
            return failure("Ask", e);
        }
    }

    /**
     * GET /api/v1/knowledge/{collection}/records/{recordId}/similar?organizationId=&limit=
     */
    @GetMapping("/{collection}/records/{recordId}/similar")
    public ResponseEntity<ApiResponse<List<ChunkMatch>>> findSimilar(@PathVariable String collection,
                                                                     @PathVariable String recordId,
                                                                     @RequestParam String organizationId,
                                                                     @RequestParam(required = false) Integer limit) {
        try {
            List<ChunkMatch> similar = retriever.findSimilar(
                    organizationId, KnowledgeCollection.fromPath(collection), recordId, limit);
            return ResponseEntity.ok(ApiResponse.success(similar));
        } catch (Exception e) {
            return failure("Similar records", e);
        }
    }

    private <T> ResponseEntity<ApiResponse<T>> failure(String operation, Exception e) {
        if (e instanceof SyncCooldownException cooldown) {
            ApiResponse<T> body = ApiResponse.error(cooldown.getMessage());
            body.setRetryAfterSeconds(cooldown.getRemainingSeconds());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                    .header("Retry-After", String.valueOf(cooldown.getRemainingSeconds()))
                    .body(body);
        }
        if (e instanceof IllegalArgumentException) {
            return ResponseEntity.badRequest().body(ApiResponse.error(e.getMessage()));
        }
        if (e instanceof ResourceNotFoundException) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ApiResponse.error(e.getMessage()));
        }
        if (e instanceof KnowledgeConfigurationException) {
            log.warn("{} rejected: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ApiResponse.error(e.getMessage()));
        }
        if (e instanceof EmbeddingException || e instanceof ChatCompletionException || e instanceof SourceFetchException) {
            log.error("{} failed upstream: {}", operation, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(ApiResponse.error(operation + " failed: " + e.getMessage()));
        }
        log.error("{} failed", operation, e);
        return ResponseEntity.internalServerError().body(ApiResponse.error(operation + " failed: " + e.getMessage()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String emptyToNull(String value) {
        return isBlank(value) ? null : value;
    }
}
