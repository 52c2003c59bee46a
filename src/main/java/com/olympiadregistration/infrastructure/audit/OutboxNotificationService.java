package com.olympiadregistration.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.stereotype.Service;

import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class OutboxNotificationService implements NotificationService {

    private final OutboxEventRepository outbox;

    @Override
    public void record(String category, String action, String resourceId, String principal, String detail) {
        log.info("NOTIFY category={} action={} resourceId={} principal={} detail={}",
            category, action, resourceId, Encode.forJava(principal), Encode.forJava(detail));
        OutboxEvent event = OutboxEvent.builder()
            .category(category)
            .action(action)
            .resourceId(resourceId)
            .principal(principal)
            .detail(detail == null ? "" : detail)
            .createdAt(Instant.now())
            .processed(false)
            .build();
        outbox.save(event);
    }
}
