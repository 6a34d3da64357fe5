package com.example.phoneshop.lisa.service;

import static com.example.phoneshop.lisa.support.Passages.passage;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.phoneshop.lisa.cache.InMemoryResultCache;
import com.example.phoneshop.lisa.generation.GenerationFailedException;
import com.example.phoneshop.lisa.memory.ConversationMemoryManager;
import com.example.phoneshop.lisa.model.ResultSource;
import com.example.phoneshop.lisa.prompt.PromptLibrary;
import com.example.phoneshop.lisa.retrieval.ContextFormatter;
import com.example.phoneshop.lisa.retrieval.FusionEngine;
import com.example.phoneshop.lisa.retrieval.LexicalIndex;
import com.example.phoneshop.lisa.retrieval.PassageRetriever;
import com.example.phoneshop.lisa.retrieval.RerankGate;
import com.example.phoneshop.lisa.retrieval.RetrievalService;
import com.example.phoneshop.lisa.router.IntentRouter;
import com.example.phoneshop.lisa.router.RouterOutputParser;
import com.example.phoneshop.lisa.support.MutableClock;
import com.example.phoneshop.lisa.support.ScriptedGateway;
import com.example.phoneshop.lisa.support.StubRetriever;
import com.example.phoneshop.lisa.support.TestPrompts;
import com.example.phoneshop.lisa.validation.MaxCharsMessageValidator;
import com.example.phoneshop.lisa.validation.NotBlankMessageValidator;
import com.example.phoneshop.lisa.validation.ThreadIdValidator;
import com.example.phoneshop.lisa.validation.ValidationException;
import com.example.phoneshop.lisa.validation.ValidationService;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Function;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class ChatOrchestratorTest {

  private static final String REPLY = "Dạ, Lisa xin trả lời ạ.";

  private final PromptLibrary prompts = TestPrompts.library();
  private final LexicalIndex lexical = new LexicalIndex(List.of(
      passage("g1", "galaxy-s24", "Galaxy S24 Ultra camera 200MP"),
      passage("i1", "iphone-16", "iPhone 16 chip A18")));

  private ConversationMemoryManager memory;

  /** Routes with {@code routerJson}; every other call is answered by {@code reply}. */
  private static ScriptedGateway gateway(String routerJson, Function<List<ChatMessage>, Mono<String>> reply) {
    return new ScriptedGateway(messages -> {
      ChatMessage first = messages.get(0);
      if (first instanceof SystemMessage sm && sm.text().startsWith(TestPrompts.ROUTER)) {
        return Mono.just(routerJson);
      }
      return reply.apply(messages);
    });
  }

  private ChatOrchestrator orchestrator(ScriptedGateway gateway, PassageRetriever vector) {
    FusionEngine fusion = new FusionEngine(lexical, vector,
        new InMemoryResultCache(100, new MutableClock(Instant.parse("2024-05-01T00:00:00Z"))),
        0.5, 0.5, Duration.ofHours(1));
    RetrievalService retrieval = new RetrievalService(fusion, null, RerankGate.ALWAYS, List.of(), 10, 3);
    memory = new ConversationMemoryManager(gateway, prompts, 10);
    ValidationService validation = new ValidationService(List.of(
        new NotBlankMessageValidator(), new ThreadIdValidator(128), new MaxCharsMessageValidator(2000)));
    IntentRouter router = new IntentRouter(gateway, prompts, new RouterOutputParser(), 2);
    return new ChatOrchestrator(validation, router, retrieval, new ProductComparisonService(retrieval),
        memory, gateway, prompts);
  }

  private ChatOrchestrator orchestrator(ScriptedGateway gateway) {
    return orchestrator(gateway, new StubRetriever(ResultSource.VECTOR, List.of()));
  }

  @Test
  void smallTalkIsAnsweredWithoutContextAndGetsNewThreadId() {
    ScriptedGateway gateway = gateway("unused", m -> Mono.just(REPLY));

    ChatReply reply = orchestrator(gateway).chat("Chào Lisa", null).block();

    assertThat(reply.route()).isEqualTo("chat");
    assertThat(reply.response()).isEqualTo(REPLY);
    assertThat(reply.infoCount()).isZero();
    assertThat(reply.threadId()).isNotBlank();
    assertThat(gateway.invocations).hasSize(1);
    assertThat(gateway.invocations.get(0)).hasSize(2);
    assertThat(memory.history(reply.threadId())).hasSize(2);
  }

  @Test
  void retrievalStreamStartsWithControlLines() {
    ScriptedGateway gateway = gateway("{\"router\":\"retrieval\",\"infor\":\"galaxy camera\"}", m -> Mono.just(REPLY));

    List<String> lines = orchestrator(gateway).chatStream("camera Galaxy có tốt không", "t-1")
        .collectList().block();

    assertThat(lines.get(0)).isEqualTo("thread_id:t-1\n");
    assertThat(lines.get(1)).isEqualTo("RETRIEVAL_INFO:1\n");
    assertThat(String.join("", lines.subList(2, lines.size()))).isEqualTo(REPLY);

    List<ChatMessage> sent = gateway.streams.get(0);
    assertThat(((SystemMessage) sent.get(1)).text()).startsWith("CTX:Source: Title galaxy-s24");
    assertThat(memory.history("t-1")).hasSize(2);
  }

  @Test
  void chatRouteStreamHasNoInfoLine() {
    ScriptedGateway gateway = gateway("{\"router\":\"chat\",\"infor\":\"\"}", m -> Mono.just(REPLY));

    List<String> lines = orchestrator(gateway).chatStream("Lisa ơi kể chuyện vui đi", "t-2")
        .collectList().block();

    assertThat(lines.get(0)).isEqualTo("thread_id:t-2\n");
    assertThat(lines).noneMatch(l -> l.startsWith("RETRIEVAL_INFO") || l.startsWith("COMPARISON_INFO"));
  }

  @Test
  void comparisonReportsFoundProducts() {
    ScriptedGateway gateway = gateway(
        "{\"router\":\"comparison\",\"products\":[\"Galaxy S24\",\"iPhone 16\"]}", m -> Mono.just(REPLY));

    ChatReply reply = orchestrator(gateway).chat("so sánh Galaxy S24 với iPhone 16", "t-3").block();

    assertThat(reply.route()).isEqualTo("comparison");
    assertThat(reply.infoCount()).isEqualTo(2);
    assertThat(((SystemMessage) gateway.invocations.get(1).get(1)).text())
        .contains("| Tính năng | Galaxy S24 | iPhone 16 |");
  }

  @Test
  void failingSearchDegradesToApologyContext() {
    ScriptedGateway gateway = gateway("{\"router\":\"retrieval\",\"infor\":\"galaxy\"}", m -> Mono.just(REPLY));
    ChatOrchestrator orchestrator =
        orchestrator(gateway, StubRetriever.failing(ResultSource.VECTOR, new IllegalStateException("store down")));

    List<String> lines = orchestrator.chatStream("Galaxy S24 giá bao nhiêu", "t-4").collectList().block();

    assertThat(lines.get(1)).isEqualTo("RETRIEVAL_INFO:0\n");
    assertThat(gateway.streams.get(0))
        .contains(SystemMessage.from("CTX:" + ContextFormatter.RETRIEVAL_UNAVAILABLE));
  }

  @Test
  void generationFailureEndsStreamWithErrorLineAndKeepsHistory() {
    ScriptedGateway gateway = gateway("{\"router\":\"chat\",\"infor\":\"\"}",
        m -> Mono.error(new IllegalStateException("model down")));

    List<String> lines = orchestrator(gateway).chatStream("Lisa ơi", "t-5").collectList().block();

    assertThat(lines).last().isEqualTo("ERROR: Lisa đang bận, vui lòng thử lại sau.\n");
    assertThat(memory.history("t-5")).isEmpty();
  }

  @Test
  void generationFailureFailsNonStreamingTurn() {
    ScriptedGateway gateway = gateway("{\"router\":\"chat\",\"infor\":\"\"}",
        m -> Mono.error(new IllegalStateException("model down")));
    ChatOrchestrator orchestrator = orchestrator(gateway);

    assertThatThrownBy(() -> orchestrator.chat("Lisa ơi", "t-6").block())
        .isInstanceOf(GenerationFailedException.class);
  }

  @Test
  void blankMessageIsRejectedBeforeRouting() {
    ScriptedGateway gateway = gateway("unused", m -> Mono.just(REPLY));
    ChatOrchestrator orchestrator = orchestrator(gateway);

    assertThatThrownBy(() -> orchestrator.chat("  ", null).block())
        .isInstanceOf(ValidationException.class);
    assertThat(gateway.invocations).isEmpty();
  }
}
