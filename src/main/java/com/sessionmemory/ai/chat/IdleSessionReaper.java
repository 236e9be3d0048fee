package com.sessionmemory.ai.chat;

import com.sessionmemory.ai.memory.SessionMemoryManager;
import com.sessionmemory.ai.store.SessionSnapshotStore;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically expires sessions nobody has touched for {@code app.memory.idle-ttl}.
 * Disabled while the TTL is zero.
 */
@Component
public class IdleSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionReaper.class);

    private final SessionMemoryManager memoryManager;
    private final SessionSnapshotStore snapshotStore;
    private final Duration idleTtl;
    private final Counter expiredCounter;

    public IdleSessionReaper(
            SessionMemoryManager memoryManager,
            SessionSnapshotStore snapshotStore,
            @Value("${app.memory.idle-ttl:PT0S}") Duration idleTtl,
            MeterRegistry meterRegistry) {
        this.memoryManager = memoryManager;
        this.snapshotStore = snapshotStore;
        this.idleTtl = idleTtl;
        this.expiredCounter = Counter.builder("memory.sessions.expired")
                .description("Sessions closed after exceeding the idle TTL")
                .register(meterRegistry);
    }

    @Scheduled(fixedDelayString = "${app.memory.idle-sweep-interval:PT1M}")
    public void sweep() {
        if (idleTtl.isZero() || idleTtl.isNegative()) {
            return;
        }
        List<String> expired = memoryManager.evictIdleSessions(idleTtl);
        for (String sessionId : expired) {
            snapshotStore.remove(sessionId);
        }
        expiredCounter.increment(expired.size());
        if (!expired.isEmpty()) {
            log.info("Idle session sweep expired={} remaining={}", expired.size(), memoryManager.sessionCount());
        }
    }
}
