package com.sessionmemory.ai.chat;

import com.sessionmemory.ai.memory.ExchangeOutcome;
import com.sessionmemory.ai.memory.OpenExchange;
import com.sessionmemory.ai.memory.SessionClosedException;
import com.sessionmemory.ai.memory.SessionHandle;
import com.sessionmemory.ai.memory.SessionMemoryManager;
import com.sessionmemory.ai.store.SessionSnapshotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * Runs one chat exchange against a session's memory.
 *
 * <p>Memory is rendered and the session released before the model is called;
 * the new turns are appended only once the model has answered, so a failed
 * call leaves the session exactly as it was. While the model is working the
 * exchange stays open, which keeps the idle sweep away from the session.
 */
@Service
public class ChatService {

    private static final Logger log = LoggerFactory.getLogger(ChatService.class);
    private static final String MDC_SESSION_KEY = "sessionId";

    private final SessionMemoryManager memoryManager;
    private final PromptContextBuilder contextBuilder;
    private final LanguageModelClient modelClient;
    private final SessionSnapshotStore snapshotStore;
    private final Timer modelTimer;
    private final Counter retainedCounter;
    private final Counter rejectedCounter;

    public ChatService(
            SessionMemoryManager memoryManager,
            PromptContextBuilder contextBuilder,
            LanguageModelClient modelClient,
            SessionSnapshotStore snapshotStore,
            MeterRegistry meterRegistry
    ) {
        this.memoryManager = memoryManager;
        this.contextBuilder = contextBuilder;
        this.modelClient = modelClient;
        this.snapshotStore = snapshotStore;
        this.modelTimer = Timer.builder("chat.model.duration")
                .description("Language model call duration")
                .register(meterRegistry);
        this.retainedCounter = Counter.builder("memory.facts.retained")
                .description("Candidates accepted into long-term memory")
                .register(meterRegistry);
        this.rejectedCounter = Counter.builder("memory.facts.rejected")
                .description("Candidates rejected by the retention policy")
                .register(meterRegistry);
    }

    public ChatReply exchange(String sessionId, String userInput) {
        requireMessage(userInput);
        try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION_KEY, sessionId)) {
            OpenExchange exchange = open(sessionId);
            try {
                PromptContext context = contextBuilder.build(
                        sessionId, exchange.shortTerm(), exchange.longTerm(), userInput);

                long startNanos = System.nanoTime();
                String raw = modelClient.complete(context);
                long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
                modelTimer.record(durationMs, TimeUnit.MILLISECONDS);

                String answer = raw == null ? "" : raw;
                ExchangeOutcome outcome = commit(exchange, userInput, answer);
                log.info("Chat exchange completed sessionId={} durationMs={}", sessionId, durationMs);
                return new ChatReply(sessionId, answer, outcome.longTerm());
            } finally {
                memoryManager.finishExchange(exchange);
            }
        }
    }

    /**
     * Streams the answer and commits it once the stream completes. Memory is
     * rendered when the returned {@link Flux} is subscribed, not when this method
     * is called.
     */
    public Flux<String> exchangeStream(String sessionId, String userInput) {
        requireMessage(userInput);
        memoryManager.requireValidSessionId(sessionId);

        return Flux.using(
                () -> {
                    try (MDC.MDCCloseable ignored = MDC.putCloseable(MDC_SESSION_KEY, sessionId)) {
                        return open(sessionId);
                    }
                },
                exchange -> {
                    PromptContext context = contextBuilder.build(
                            sessionId, exchange.shortTerm(), exchange.longTerm(), userInput);
                    StringBuilder answer = new StringBuilder();
                    long startNanos = System.nanoTime();
                    return modelClient.stream(context)
                            .doOnNext(answer::append)
                            .doOnComplete(() -> {
                                long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
                                modelTimer.record(durationMs, TimeUnit.MILLISECONDS);
                                commit(exchange, userInput, answer.toString());
                                log.info("Chat stream completed sessionId={} durationMs={}", sessionId, durationMs);
                            });
                },
                memoryManager::finishExchange);
    }

    /**
     * Forgets a session in memory and in the snapshot store. An exchange still
     * waiting on the model for this session fails on commit instead of bringing
     * the session back.
     */
    public boolean endSession(String sessionId) {
        boolean closed = memoryManager.closeSession(sessionId);
        snapshotStore.remove(sessionId);
        return closed;
    }

    /**
     * Makes a session live if it is known, restoring it from its snapshot when the
     * manager does not hold it. Never creates an empty session.
     *
     * @return whether the session is live afterwards
     */
    public boolean loadSession(String sessionId) {
        memoryManager.requireValidSessionId(sessionId);
        if (!memoryManager.hasSession(sessionId)) {
            snapshotStore.get(sessionId).ifPresent(memoryManager::restore);
        }
        return memoryManager.hasSession(sessionId);
    }

    private OpenExchange open(String sessionId) {
        loadSession(sessionId);
        return memoryManager.openExchange(sessionId);
    }

    private ExchangeOutcome commit(OpenExchange exchange, String userInput, String answer) {
        ExchangeOutcome outcome;
        try {
            outcome = memoryManager.commitExchange(exchange, userInput, answer);
        } catch (SessionClosedException e) {
            log.warn("Chat exchange discarded, session closed during model call sessionId={}",
                    exchange.sessionId());
            throw e;
        }
        retainedCounter.increment(outcome.factsRetained());
        rejectedCounter.increment(outcome.factsRejected());

        SessionHandle session = exchange.session();
        memoryManager.snapshot(session).ifPresent(snapshotStore::put);
        // closed while saving: the close already removed the snapshot, or is about to
        if (session.isClosed()) {
            snapshotStore.remove(exchange.sessionId());
        }
        return outcome;
    }

    private static void requireMessage(String userInput) {
        if (userInput == null || userInput.isBlank()) {
            throw new IllegalArgumentException("Message must not be blank");
        }
    }
}
