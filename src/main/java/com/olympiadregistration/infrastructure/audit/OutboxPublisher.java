package com.olympiadregistration.infrastructure.audit;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.owasp.encoder.Encode;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * Publishes committed notifications. Mail delivery is external: entries are
 * logged for the mail relay and marked processed.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OutboxPublisher {
    private final OutboxEventRepository repository;

    @Scheduled(fixedDelayString = "${registration.outbox.publish-interval-ms:10000}")
    @Transactional
    public void publish() {
        repository.findByProcessedFalseOrderByIdAsc().forEach(e -> {
            if (log.isInfoEnabled()) {
                log.info("OUTBOX publish category={} action={} resourceId={} principal={} detail={} createdAt={}",
                    e.getCategory(), e.getAction(), e.getResourceId(), Encode.forJava(e.getPrincipal()),
                    Encode.forJava(e.getDetail()), e.getCreatedAt());
            }
            e.setProcessed(true);
            repository.save(e);
        });
    }
}
