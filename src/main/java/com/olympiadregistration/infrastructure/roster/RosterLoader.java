package com.olympiadregistration.infrastructure.roster;

import com.olympiadregistration.config.RegistrationProperties;
import com.olympiadregistration.infrastructure.csv.CsvSpreadsheetCodec;
import com.olympiadregistration.infrastructure.csv.Spreadsheet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Loads the static roster from {@code countries.csv} and {@code people.csv}
 * in the configured directory. The result is cached: the roster does not
 * change while the service runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RosterLoader {

    static final String COUNTRY_NUMBER = "Country Number";
    static final String PERSON_NUMBER = "Person Number";

    private final RegistrationProperties properties;
    private final CsvSpreadsheetCodec codec;

    @Cacheable(cacheNames = "roster", key = "'roster'")
    public RosterData load() {
        String directory = properties.getRosterDirectory();
        if (directory == null || directory.isBlank()) {
            log.info("No roster directory configured; generic URLs are checked for shape only");
            return RosterData.unconfigured();
        }
        Path base = Path.of(directory);
        Set<Integer> countries = numbers(base.resolve("countries.csv"), COUNTRY_NUMBER);
        Set<Integer> people = numbers(base.resolve("people.csv"), PERSON_NUMBER);
        log.info("Roster loaded from {}: countries={}, people={}", base, countries.size(), people.size());
        return new RosterData(true, Set.copyOf(countries), Set.copyOf(people));
    }

    private Set<Integer> numbers(Path file, String column) {
        byte[] content;
        try {
            content = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read roster file " + file, e);
        }
        Spreadsheet sheet = codec.read(content, ',');
        Set<Integer> result = new HashSet<>();
        for (Map<String, String> row : sheet.rows()) {
            String value = row.get(column);
            if (value != null && value.trim().matches("[1-9][0-9]*")) {
                result.add(Integer.parseInt(value.trim()));
            }
        }
        return result;
    }
}
