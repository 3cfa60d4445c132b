package com.memoryvault.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DefaultAuditService implements AuditService {

    private final ApplicationEventPublisher events;
    private final Clock clock;

    @Override
    public void record(String category, String action, String resourceId, String principalId, String detail) {
        String safeDetail = detail != null ? Encode.forJava(detail) : "";
        log.info("AUDIT category={} action={} resourceId={} principal={} detail={}",
                category, action, resourceId, principalId, safeDetail);
        AuditEvent evt = AuditEvent.builder()
                .category(category)
                .action(action)
                .resourceId(resourceId)
                .principalId(principalId)
                .detail(safeDetail)
                .createdAt(Instant.now(clock))
                .build();
        try {
            events.publishEvent(evt);
        } catch (RuntimeException e) {
            // audit delivery is best-effort; the log line above is the record of last resort
            log.warn("AUDIT delivery failed category={} action={} resourceId={}: {}",
                    category, action, resourceId, e.toString());
        }
    }
}
