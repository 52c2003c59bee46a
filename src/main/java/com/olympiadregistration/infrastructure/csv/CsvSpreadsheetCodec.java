package com.olympiadregistration.infrastructure.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.*;

/**
 * Reads and writes delimited UTF-8 spreadsheets with Jackson's CSV module.
 *
 * <p>Decoding is strict: malformed UTF-8 or CSV structure fails the whole
 * file without a row number. A leading byte-order mark is ignored on read
 * and always written on output.
 */
@Component
@Slf4j
public class CsvSpreadsheetCodec {

    public static final char BOM = '\uFEFF';

    private final CsvMapper mapper = new CsvMapper();

    public Spreadsheet read(byte[] content, char separator) {
        String text = decode(content);
        if (!text.isEmpty() && text.charAt(0) == BOM) {
            text = text.substring(1);
        }
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);
        List<String[]> records = new ArrayList<>();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class)
                .with(schema)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(text)) {
            while (it.hasNextValue()) {
                records.add(it.nextValue());
            }
        } catch (IOException | RuntimeException e) {
            log.warn("Rejected malformed CSV file: {}", e.getMessage());
            throw new FormatInvalidException("Invalid CSV file: could not parse");
        }
        if (records.isEmpty()) {
            throw new FormatInvalidException("Invalid CSV file: no header row");
        }

        List<String> header = Arrays.stream(records.get(0)).map(String::trim).toList();
        List<Map<String, String>> rows = new ArrayList<>();
        for (String[] record : records.subList(1, records.size())) {
            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < Math.min(record.length, header.size()); i++) {
                row.putIfAbsent(header.get(i), record[i]);
            }
            rows.add(row);
        }
        log.debug("Decoded CSV file: columns={}, rows={}", header.size(), rows.size());
        return new Spreadsheet(header, rows);
    }

    /**
     * Write rows under the given header, preceded by a byte-order mark.
     * Row entries whose key is not one of {@code columns} are left out.
     */
    public byte[] write(List<String> columns, List<Map<String, String>> rows, char separator) {
        CsvSchema.Builder schemaBuilder = CsvSchema.builder()
            .setColumnSeparator(separator)
            .setUseHeader(true);
        columns.forEach(schemaBuilder::addColumn);
        try {
            String body = mapper.writer(schemaBuilder.build())
                .with(JsonGenerator.Feature.IGNORE_UNKNOWN)
                .writeValueAsString(rows);
            return (BOM + body).getBytes(StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to encode CSV output", e);
        }
    }

    private static String decode(byte[] content) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(content))
                .toString();
        } catch (CharacterCodingException e) {
            throw new FormatInvalidException("Invalid CSV file: not UTF-8");
        }
    }
}
