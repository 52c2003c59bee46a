package com.olympiadregistration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.EnableAspectJAutoProxy;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Main application class for the olympiad registration backend.
 *
 * <p>Registers the countries and people taking part in an olympiad-style
 * competition, then records their scores and derives medals.
 *
 * <p><strong>Architecture:</strong>
 * <ul>
 *   <li>Hexagonal architecture (ports and adapters)</li>
 *   <li>Every mutation passes one access-control gate and one auditor per record type</li>
 *   <li>Notifications recorded in a transactional outbox</li>
 * </ul>
 */
@SpringBootApplication
@EnableTransactionManagement
@EnableAspectJAutoProxy
@Slf4j
public class OlympiadRegistrationApplication {

    public static void main(String[] args) {
        SpringApplication.run(OlympiadRegistrationApplication.class, args);
        log.info("Olympiad registration started");
    }
}
