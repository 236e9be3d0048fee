package com.sessionmemory.ai.api;

import com.sessionmemory.ai.chat.ChatReply;
import com.sessionmemory.ai.chat.ChatService;
import com.sessionmemory.ai.memory.SessionMemoryManager;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

@RestController
@RequestMapping("/chat")
public class ChatController {

  private final ChatService chatService;
  private final SessionMemoryManager memoryManager;

  public ChatController(ChatService chatService, SessionMemoryManager memoryManager) {
    this.chatService = chatService;
    this.memoryManager = memoryManager;
  }

  @PostMapping
  public ChatReply chat(@RequestBody ChatRequest req) {
    return chatService.exchange(req.sessionId(), req.message());
  }

  @PostMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
  public Flux<String> chatStream(@RequestBody ChatRequest req) {
    return chatService.exchangeStream(req.sessionId(), req.message());
  }

  @GetMapping("/sessions/{sessionId}/memory")
  public ResponseEntity<MemoryView> memory(@PathVariable String sessionId) {
    if (!chatService.loadSession(sessionId)) {
      return ResponseEntity.notFound().build();
    }
    return ResponseEntity.ok(new MemoryView(
        sessionId,
        memoryManager.renderShortTerm(sessionId),
        memoryManager.renderLongTerm(sessionId)));
  }

  @DeleteMapping("/sessions/{sessionId}")
  public ResponseEntity<Void> endSession(@PathVariable String sessionId) {
    chatService.endSession(sessionId);
    return ResponseEntity.noContent().build();
  }
}
