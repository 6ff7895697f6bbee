package com.purchasingpower.compliancekb.service;

import com.google.common.base.Preconditions;
import com.purchasingpower.compliancekb.client.ChatCompletionClient;
import com.purchasingpower.compliancekb.configuration.AppProperties;
import com.purchasingpower.compliancekb.configuration.RetrievalProperties;
import com.purchasingpower.compliancekb.model.AnswerSource;
import com.purchasingpower.compliancekb.model.ChunkMatch;
import com.purchasingpower.compliancekb.model.KnowledgeAnswer;
import com.purchasingpower.compliancekb.model.KnowledgeCollection;
import com.purchasingpower.compliancekb.model.SearchFilter;
import com.purchasingpower.compliancekb.model.prompt.RenderedPrompt;
import com.purchasingpower.compliancekb.util.ExternalCallLogger;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Answers a question from the retrieved chunks of one collection, citing them as
 * {@code [Source N]}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AnswerComposer {

    static final String CONTEXT_SEPARATOR = "\n\n---\n\n";
    static final String FALLBACK_ANSWER = "Unable to generate answer.";

    private final KnowledgeRetriever retriever;
    private final ChatCompletionClient chatClient;
    private final PromptLibraryService promptLibrary;
    private final AppProperties props;

    public KnowledgeAnswer ask(String organizationId, KnowledgeCollection collection, String question) {
        Preconditions.checkArgument(question != null && !question.isBlank(), "question is required");
        RetrievalProperties retrieval = props.getRetrieval();

        log.info("❓ Question on {} for org {}: {}", collection, organizationId,
                ExternalCallLogger.truncate(question, 120));

        List<ChunkMatch> matches = retriever.search(question,
                SearchFilter.of(organizationId, collection), retrieval.getAskTopK());

        if (matches.isEmpty()) {
            return new KnowledgeAnswer(emptyAnswer(collection), List.of());
        }

        RenderedPrompt prompt = promptLibrary.render(collection.getAnswerPrompt(), Map.of(
                "question", question,
                "context", buildContext(matches)));

        String answer = chatClient.complete(prompt.systemPrompt(), prompt.userPrompt());
        if (answer == null || answer.isBlank()) {
            answer = FALLBACK_ANSWER;
        }

        List<AnswerSource> sources = new ArrayList<>();
        for (ChunkMatch match : matches.subList(0, Math.min(retrieval.getAnswerSources(), matches.size()))) {
            String link = match.getMetadata() != null ? match.getMetadata().getLink() : null;
            sources.add(new AnswerSource(match.getRef(), match.getTitle(), match.getSimilarity(),
                    snippet(match.getContent(), retrieval.getSnippetLength()), link));
        }
        return new KnowledgeAnswer(answer, sources);
    }

    static String buildContext(List<ChunkMatch> matches) {
        List<String> blocks = new ArrayList<>(matches.size());
        for (int i = 0; i < matches.size(); i++) {
            ChunkMatch match = matches.get(i);
            String label = match.getTitle() != null ? match.getRef() + " - " + match.getTitle() : match.getRef();
            blocks.add("[Source " + (i + 1) + ": " + label + "]\n" + match.getContent());
        }
        return String.join(CONTEXT_SEPARATOR, blocks);
    }

    static String emptyAnswer(KnowledgeCollection collection) {
        String label = collection.getPluralLabel();
        return "No relevant " + label + " found in the knowledge base. Please ensure " + label
                + " have been synced and indexed.";
    }

    private static String snippet(String content, int length) {
        if (content == null) {
            return "...";
        }
        return content.substring(0, Math.min(length, content.length())) + "...";
    }
}
