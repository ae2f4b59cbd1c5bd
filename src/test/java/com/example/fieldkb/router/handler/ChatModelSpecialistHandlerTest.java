package com.example.fieldkb.router.handler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.fieldkb.router.model.Citation;
import com.example.fieldkb.router.model.Coverage;
import com.example.fieldkb.router.model.CoverageLevel;
import com.example.fieldkb.router.model.HandlerResult;
import com.example.fieldkb.router.model.MatchedItem;
import com.example.fieldkb.router.model.QueryRequest;
import dev.langchain4j.model.chat.ChatModel;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class ChatModelSpecialistHandlerTest {

  private static MatchedItem item(String id, double relevance, String content) {
    return MatchedItem.builder()
        .itemId(id)
        .relevance(relevance)
        .sourceRef("manual/" + id)
        .content(content)
        .build();
  }

  @Test
  void promptsWithNumberedExcerptsAndCitesThem() {
    ChatModel chatModel = mock(ChatModel.class);
    when(chatModel.chat(anyString())).thenReturn("  Reset the drive with P0970 = 1 [#1]. ");
    ChatModelSpecialistHandler handler = new ChatModelSpecialistHandler("siemens", chatModel, "You are a Siemens specialist.");

    Coverage coverage = Coverage.builder()
        .level(CoverageLevel.STRONG)
        .itemCount(4)
        .avgRelevance(0.9)
        .confidence(0.87)
        .matchedItems(List.of(
            item("kb-1", 0.95, "F0003 means undervoltage."),
            item("kb-2", 0.90, "Check the DC link."),
            item("kb-3", 0.85, "Parameter list."),
            item("kb-4", 0.80, "Not included.")))
        .build();
    QueryRequest request = QueryRequest.builder().id("r").text("G120C fault F0003").build();

    HandlerResult result = handler.handle(request, coverage);

    ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
    verify(chatModel).chat(prompt.capture());
    assertThat(prompt.getValue())
        .startsWith("You are a Siemens specialist.")
        .contains("[#1] manual/kb-1\nF0003 means undervoltage.")
        .contains("[#3] manual/kb-3")
        .doesNotContain("Not included.")
        .contains("G120C fault F0003");

    assertThat(result.text()).isEqualTo("Reset the drive with P0970 = 1 [#1].");
    assertThat(result.confidence()).isEqualTo(0.87);
    assertThat(result.citations()).extracting(Citation::itemId).containsExactly("kb-1", "kb-2", "kb-3");
  }

  @Test
  void promptSaysSoWhenNothingMatched() {
    ChatModelSpecialistHandler handler = new ChatModelSpecialistHandler("fallback", mock(ChatModel.class), "Fallback.");

    String prompt = handler.buildPrompt("plc won't boot", List.of());

    assertThat(prompt).contains(ChatModelSpecialistHandler.NO_EXCERPTS).contains("plc won't boot");
  }
}
