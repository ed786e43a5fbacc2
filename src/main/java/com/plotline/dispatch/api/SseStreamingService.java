package com.plotline.dispatch.api;

import com.plotline.core.events.EventBus;
import com.plotline.core.events.PlotlineEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Streams the {@link EventBus} events of one analysis to an {@link SseEmitter}.
 * <p>
 * The emitter completes after the run's terminal event ({@code analysis.completed} or
 * {@code analysis.failed}). Idle connections get a heartbeat comment every 30 seconds.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Default emitter timeout: 30 minutes, enough for a thorough run on a long manuscript. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public SseStreamingService(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, long timeoutMs) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
        log.debug("SSE heartbeat scheduler started (interval={}s)", HEARTBEAT_INTERVAL_SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            try {
                registration.emitter.send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                // lifecycle callbacks remove the registration
                log.debug("Heartbeat skipped for analysis {}: {}", registration.analysisId, e.getMessage());
            }
        }
    }

    public SseEmitter createEmitter(String analysisId) {
        SseEmitter emitter = new SseEmitter(timeoutMs);

        EventBus.Subscription subscription = eventBus.subscribe(analysisId, event -> forward(emitter, event));
        var registration = new EmitterRegistration(analysisId, emitter, subscription);
        activeRegistrations.add(registration);

        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for analysis {}", analysisId);
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for analysis {}: {}", analysisId, ex.getMessage());
            cleanup(registration);
        });

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Failed to confirm SSE connection for analysis {}: {}", analysisId, e.getMessage());
        }

        log.info("SSE emitter created for analysis {} (timeout={}ms)", analysisId, timeoutMs);
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    private void forward(SseEmitter emitter, PlotlineEvent event) {
        try {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("analysisId", event.analysisId());
            if (event.pass() != null) {
                data.put("pass", event.pass());
            }
            data.putAll(event.payload());
            data.put("timestamp", event.timestamp().toString());

            emitter.send(SseEmitter.event().name(event.eventType()).data(data));
            if (event.isTerminal()) {
                emitter.complete();
            }
        } catch (IOException | IllegalStateException e) {
            log.debug("Failed to send SSE event {} for analysis {}: {}",
                    event.eventType(), event.analysisId(), e.getMessage());
        }
    }

    private void cleanup(EmitterRegistration registration) {
        if (activeRegistrations.remove(registration)) {
            registration.subscription.unsubscribe();
            log.debug("Cleaned up SSE registration for analysis {}", registration.analysisId);
        }
    }

    private record EmitterRegistration(
            String analysisId,
            SseEmitter emitter,
            EventBus.Subscription subscription
    ) {}
}
