package com.olympiadregistration.config;

import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.crypto.factory.PasswordEncoderFactories;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.security.provisioning.InMemoryUserDetailsManager;
import org.springframework.security.web.SecurityFilterChain;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Spring Security configuration for the registration API.
 *
 * Security architecture:
 * - Stateless HTTP Basic authentication against the configured accounts
 * - Account role and country/person scope carried as granted authorities
 * - Per-operation decisions taken by the RegistrationAccessKernel
 * - Exports, results and file downloads readable anonymously; the
 *   content is filtered by what an anonymous viewer may see
 * - CSRF protection disabled (stateless API)
 */
@Configuration
@EnableWebSecurity
@SecurityScheme(name = "basicAuth", type = SecuritySchemeType.HTTP, scheme = "basic")
@RequiredArgsConstructor
@Slf4j
public class SecurityConfiguration {

    private static final Set<String> ROLES = Set.of("ADMIN", "REGISTER", "SELFREG", "SCORE");

    @Bean
    public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
            // Disable CSRF for stateless API
            .csrf(csrf -> csrf.disable())

            .sessionManagement(session ->
                session.sessionCreationPolicy(SessionCreationPolicy.STATELESS)
            )

            .authorizeHttpRequests(auth -> auth
                // Public endpoints (health checks, API docs)
                .requestMatchers("/actuator/health", "/actuator/info").permitAll()
                .requestMatchers("/v3/api-docs/**", "/swagger-ui/**", "/swagger-ui.html").permitAll()

                // Public downloads; visibility is decided per file and per column
                .requestMatchers(HttpMethod.GET, "/api/v1/files/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/exports/**").permitAll()
                .requestMatchers(HttpMethod.GET, "/api/v1/scores/results").permitAll()

                .requestMatchers("/api/**").authenticated()

                // All other requests denied by default
                .anyRequest().denyAll()
            )

            .httpBasic(Customizer.withDefaults())

            .headers(headers -> headers
                .contentSecurityPolicy(csp ->
                    csp.policyDirectives("default-src 'self'; frame-ancestors 'none'")
                )
                .frameOptions(frame -> frame.deny())
                .httpStrictTransportSecurity(hsts -> hsts
                    .includeSubDomains(true)
                    .maxAgeInSeconds(31536000) // 1 year
                )
            );

        return http.build();
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return PasswordEncoderFactories.createDelegatingPasswordEncoder();
    }

    /**
     * Accounts from {@code registration.accounts}, with role and scope
     * authorities ({@code ROLE_REGISTER}, {@code COUNTRY_12}).
     */
    @Bean
    public UserDetailsService userDetailsService(RegistrationProperties properties) {
        List<UserDetails> users = new ArrayList<>();
        for (RegistrationProperties.Account account : properties.getAccounts()) {
            String role = account.getRole() == null ? "" : account.getRole().toUpperCase(Locale.ROOT);
            if (!ROLES.contains(role)) {
                throw new IllegalStateException("Unknown role for account " + account.getUsername() + ": "
                    + account.getRole());
            }
            List<GrantedAuthority> authorities = new ArrayList<>();
            authorities.add(new SimpleGrantedAuthority("ROLE_" + role));
            if (account.getCountryId() != null) {
                authorities.add(new SimpleGrantedAuthority("COUNTRY_" + account.getCountryId()));
            }
            if (account.getPersonId() != null) {
                authorities.add(new SimpleGrantedAuthority("PERSON_" + account.getPersonId()));
            }
            users.add(User.withUsername(account.getUsername())
                .password(account.getPassword())
                .authorities(authorities)
                .build());
        }
        log.info("Login accounts configured: count={}", users.size());
        return new InMemoryUserDetailsManager(users);
    }
}
