package com.example.fieldkb.router.handler;

import com.example.fieldkb.router.model.Citation;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.MatchedItem;
import com.example.fieldkb.router.model.QueryRequest;
import com.example.fieldkb.router.util.TextUtils;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Answers through the chat model: a system prompt, the top knowledge base excerpts numbered
 * {@code [#n]}, then the question. Excerpts are returned as citations in the same order.
 */
@Slf4j
public class ChatModelSpecialistHandler implements SpecialistHandler {

    static final int MAX_EXCERPTS = 3;
    static final int MAX_EXCERPT_CHARS = 600;
    static final String NO_EXCERPTS = "(no relevant knowledge base content found)";

    private final String name;
    private final ChatModel chatModel;
    private final String systemPrompt;

    public ChatModelSpecialistHandler(String name, ChatModel chatModel, String systemPrompt) {
        this.name = name;
        this.chatModel = chatModel;
        this.systemPrompt = TextUtils.safe(systemPrompt);
    }

    @Override
    public HandlerResult handle(QueryRequest request, Coverage coverage) {
        List<MatchedItem> excerpts = coverage.getMatchedItems().stream()
                .limit(MAX_EXCERPTS)
                .toList();

        String prompt = buildPrompt(request.searchableText(), excerpts);
        log.debug("[handler:{}] calling chat model with {} excerpts", name, excerpts.size());
        String answer = chatModel.chat(prompt);

        List<Citation> citations = new ArrayList<>();
        for (MatchedItem item : excerpts) {
            citations.add(new Citation(item.getItemId(), item.getSourceRef(), item.getRelevance()));
        }
        return new HandlerResult(TextUtils.safe(answer).strip(), citations, coverage.getConfidence());
    }

    String buildPrompt(String question, List<MatchedItem> excerpts) {
        StringBuilder kb = new StringBuilder();
        for (int i = 0; i < excerpts.size(); i++) {
            MatchedItem item = excerpts.get(i);
            String content = TextUtils.firstNonBlank(item.getContent(), item.getSourceRef(), item.getItemId());
            if (kb.length() > 0) kb.append("\n\n");
            kb.append("[#").append(i + 1).append("]");
            if (!TextUtils.isBlank(item.getSourceRef())) {
                kb.append(' ').append(item.getSourceRef());
            }
            kb.append('\n').append(TextUtils.clip(TextUtils.safe(content), MAX_EXCERPT_CHARS));
        }

        return """
                %s

                Knowledge base excerpts:
                %s

                Question:
                %s
                """.formatted(
                systemPrompt,
                kb.length() == 0 ? NO_EXCERPTS : kb.toString(),
                TextUtils.safe(question));
    }

    public String getName() {
        return name;
    }
}
