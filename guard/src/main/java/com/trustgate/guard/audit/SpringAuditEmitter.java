package com.trustgate.guard.audit;

import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Default {@link AuditEmitter}.
 *
 * Publishes every {@link AuditEvent} (full body) as a Spring application
 * event, so the UI/telemetry side subscribes with a plain
 * {@code @EventListener}, and logs the truncated rendering. Each event is
 * counted as {@code trustgate.audit.events{kind}}.
 */
@Component
public class SpringAuditEmitter implements AuditEmitter {

    private static final Logger log = LoggerFactory.getLogger(SpringAuditEmitter.class);

    private final ApplicationEventPublisher publisher;
    private final MeterRegistry             meterRegistry;
    private final Clock                     clock;

    @Autowired
    public SpringAuditEmitter(ApplicationEventPublisher publisher, MeterRegistry meterRegistry) {
        this(publisher, meterRegistry, Clock.systemUTC());
    }

    SpringAuditEmitter(ApplicationEventPublisher publisher, MeterRegistry meterRegistry, Clock clock) {
        this.publisher     = publisher;
        this.meterRegistry = meterRegistry;
        this.clock         = clock;
    }

    @Override
    public void emit(AuditKind kind, String message) {
        publish(new AuditEvent(kind, null, message, 0, MDC.get("sessionId"), clock.instant()));
    }

    @Override
    public void emitBlock(AuditKind kind, String label, String body, int maxLines) {
        publish(new AuditEvent(kind, label, body, maxLines, MDC.get("sessionId"), clock.instant()));
    }

    private void publish(AuditEvent event) {
        if (event.kind() == AuditKind.WARNING) {
            log.warn("{{}} {}", event.kind().code(), event.render());
        } else {
            log.info("{{}} {}", event.kind().code(), event.render());
        }
        meterRegistry.counter("trustgate.audit.events", "kind", event.kind().name().toLowerCase()).increment();
        try {
            publisher.publishEvent(event);
        } catch (RuntimeException e) {
            // A failing listener must not fail the write or command it is auditing.
            log.error("Audit listener failed for {} event: {}", event.kind(), e.getMessage(), e);
        }
    }
}
