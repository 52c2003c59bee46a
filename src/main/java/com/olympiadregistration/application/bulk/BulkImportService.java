package com.olympiadregistration.application.bulk;

import com.olympiadregistration.application.CountryRegistrationService;
import com.olympiadregistration.application.EventContextFactory;
import com.olympiadregistration.application.PersonRegistrationService;
import com.olympiadregistration.config.PerformanceConfiguration.RegistrationMetrics;
import com.olympiadregistration.domain.audit.BatchOverlayView;
import com.olympiadregistration.domain.audit.CountryAuditor;
import com.olympiadregistration.domain.audit.EventContext;
import com.olympiadregistration.domain.audit.FieldValidators;
import com.olympiadregistration.domain.audit.PersonAuditor;
import com.olympiadregistration.domain.audit.PersonSubmission;
import com.olympiadregistration.domain.audit.RegistrationView;
import com.olympiadregistration.domain.exception.BulkImportException;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.RaceConditionException;
import com.olympiadregistration.domain.exception.RegistrationException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;
import com.olympiadregistration.domain.exception.UniquenessViolationException;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.domain.model.CountryFields;
import com.olympiadregistration.domain.model.PersonFields;
import com.olympiadregistration.infrastructure.csv.CsvSpreadsheetCodec;
import com.olympiadregistration.infrastructure.csv.Spreadsheet;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.infrastructure.security.RegistrationAccessKernel;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Bulk registration of countries and people from a CSV file.
 *
 * <p>The whole file is validated first: every row passes through the same
 * auditor as a single-record form, against the store overlaid with the
 * rows accepted so far, and any failure aborts the import before anything
 * is committed. Rows are then committed one at a time in file order, each
 * in its own transaction. A conflict caused by a concurrent change between
 * validation and commit stops the import there; rows already committed
 * stay committed.
 *
 * <p>The service itself holds no transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BulkImportService {

    private final CsvSpreadsheetCodec codec;
    private final CountryImportSchema countrySchema;
    private final PersonImportSchema personSchema;
    private final CountryAuditor countryAuditor;
    private final PersonAuditor personAuditor;
    private final RegistrationView registrationView;
    private final RegistrationAccessKernel accessKernel;
    private final EventContextFactory eventContextFactory;
    private final CountryRegistrationService countryService;
    private final PersonRegistrationService personService;
    private final RegistrationMetrics metrics;

    /**
     * Import countries.
     *
     * @param csv file content
     * @param separator {@code ,} or {@code ;}
     * @param zip archive holding the files named in the {@code Flag} column, or null
     * @param dryRun validate only
     */
    public BulkImportResult importCountries(ActorContext actor, byte[] csv, char separator, byte[] zip,
                                            boolean dryRun) {
        accessKernel.authorizeBulkImport(actor, true);
        return run(countrySchema, csv, separator, zip, dryRun,
            (submission, overlay, context) -> {
                CountryFields fields = countryAuditor.audit(submission, null, context, overlay);
                overlay.accept(fields);
                return submission;
            },
            submission -> countryService.create(actor, submission).getId());
    }

    /**
     * Import people. People imported by an administrator are created as
     * incomplete registrations; a delegate's rows default to the
     * delegate's own country.
     *
     * @param zip archive holding the files named in the {@code Photo} and
     *        {@code Consent Form} columns, or null
     */
    public BulkImportResult importPeople(ActorContext actor, byte[] csv, char separator, byte[] zip,
                                         boolean dryRun) {
        accessKernel.authorizeBulkImport(actor, false);
        return run(personSchema, csv, separator, zip, dryRun,
            (submission, overlay, context) -> {
                PersonSubmission prepared = personService.forActor(actor, submission);
                if (actor.isAdministrator()) {
                    prepared = prepared.toBuilder().incomplete(Boolean.TRUE).build();
                }
                String code = FieldValidators.clean(prepared.getCountryCode());
                Country country = code == null ? null : overlay.countryByCode(code).orElse(null);
                accessKernel.authorizePersonCreation(actor, country, context.status());
                PersonFields fields = personAuditor.audit(prepared, null, actor.isAdministrator(), context,
                    overlay);
                overlay.accept(fields);
                return prepared;
            },
            submission -> personService.create(actor, submission).getId());
    }

    @FunctionalInterface
    private interface RowAuditor<S> {
        S audit(S submission, BatchOverlayView overlay, EventContext context);
    }

    private <S> BulkImportResult run(ImportSchema<S> schema, byte[] csv, char separator, byte[] zip,
                                     boolean dryRun, RowAuditor<S> auditor,
                                     Function<S, Long> committer) {
        String kind = schema.kind();
        try {
            if (separator != ',' && separator != ';') {
                throw new FormatInvalidException("Invalid CSV delimiter");
            }
            Spreadsheet spreadsheet = codec.read(csv, separator);
            for (ColumnSpec column : schema.columns()) {
                if (column.required() && !spreadsheet.header().contains(column.name())) {
                    throw new RequiredFieldMissingException("Required column " + column.name() + " missing");
                }
            }
            List<ImportRow> rows = clean(spreadsheet, schema);
            checkRows(rows, schema);
            AttachmentArchive attachments = AttachmentArchive.read(zip);

            EventContext context = eventContextFactory.current();
            BatchOverlayView overlay = new BatchOverlayView(registrationView);
            List<S> submissions = new ArrayList<>();
            for (ImportRow row : rows) {
                submissions.add(atRow(row.number(), () ->
                    auditor.audit(schema.toSubmission(row, attachments), overlay, context)));
                log.debug("Bulk {} row {} passed audit", kind, row.number());
            }

            List<Map<String, String>> preview = rows.stream().map(BulkImportService::preview).toList();
            if (dryRun) {
                metrics.recordBulkImport(kind, "checked", rows.size());
                log.info("Bulk {} import checked: rows={}", kind, rows.size());
                return new BulkImportResult(kind, true, preview, List.of());
            }

            List<Long> created = commit(rows, submissions, committer);
            metrics.recordBulkImport(kind, "committed", created.size());
            log.info("Bulk {} import committed: rows={}", kind, created.size());
            return new BulkImportResult(kind, false, preview, created);

        } catch (BulkImportException e) {
            metrics.recordBulkImport(kind, "rejected", e.getCommittedRows());
            log.warn("Bulk {} import rejected: row={}, kind={}, committed={}", kind, e.getRow(), e.getKind(),
                e.getCommittedRows());
            throw e;
        } catch (RegistrationException e) {
            metrics.recordBulkImport(kind, "rejected", 0);
            log.warn("Bulk {} import rejected: kind={}", kind, e.getKind());
            throw e;
        }
    }

    private <S> List<Long> commit(List<ImportRow> rows, List<S> submissions, Function<S, Long> committer) {
        List<Long> created = new ArrayList<>();
        for (int i = 0; i < rows.size(); i++) {
            int number = rows.get(i).number();
            try {
                created.add(committer.apply(submissions.get(i)));
            } catch (UniquenessViolationException e) {
                throw new BulkImportException(number, new RaceConditionException(e.getMessage(), e),
                    created.size());
            } catch (DataIntegrityViolationException | OptimisticLockingFailureException e) {
                throw new BulkImportException(number,
                    new RaceConditionException("Conflicting change by another user", e), created.size());
            } catch (RegistrationException e) {
                throw new BulkImportException(number, e, created.size());
            }
        }
        return created;
    }

    /**
     * Trim cells, drop empty ones and split comma-separated columns.
     */
    private static List<ImportRow> clean(Spreadsheet spreadsheet, ImportSchema<?> schema) {
        Set<String> header = new LinkedHashSet<>(spreadsheet.header());
        List<ImportRow> rows = new ArrayList<>();
        int number = 0;
        for (Map<String, String> raw : spreadsheet.rows()) {
            number++;
            Map<String, String> values = new LinkedHashMap<>();
            Map<String, List<String>> lists = new LinkedHashMap<>();
            for (Map.Entry<String, String> cell : raw.entrySet()) {
                String value = cell.getValue() == null ? "" : cell.getValue().trim();
                if (value.isEmpty()) {
                    continue;
                }
                boolean list = schema.column(cell.getKey()).map(ColumnSpec::commaSeparated).orElse(false);
                if (list) {
                    List<String> items = Arrays.stream(value.split(",")).map(String::trim).toList();
                    if (new HashSet<>(items).size() != items.size()) {
                        throw new FormatInvalidException("duplicate entries in " + cell.getKey());
                    }
                    lists.put(cell.getKey(), items);
                } else {
                    values.put(cell.getKey(), value);
                }
            }
            rows.add(new ImportRow(number, header, values, lists));
        }
        return rows;
    }

    private static void checkRows(List<ImportRow> rows, ImportSchema<?> schema) {
        Map<String, Set<String>> seen = new HashMap<>();
        for (ImportRow row : rows) {
            for (ColumnSpec column : schema.columns()) {
                String value = row.get(column.name());
                if (column.required() && !row.has(column.name())) {
                    throw new BulkImportException(row.number(),
                        new RequiredFieldMissingException("required value for " + column.name() + " missing"));
                }
                if (column.uniqueInBatch() && value != null
                        && !seen.computeIfAbsent(column.name(), k -> new HashSet<>()).add(value)) {
                    throw new BulkImportException(row.number(),
                        new UniquenessViolationException("duplicate value of " + column.name()));
                }
            }
        }
    }

    private static <T> T atRow(int number, Supplier<T> step) {
        try {
            return step.get();
        } catch (BulkImportException e) {
            throw e;
        } catch (RegistrationException e) {
            throw new BulkImportException(number, e);
        }
    }

    private static Map<String, String> preview(ImportRow row) {
        Map<String, String> result = new LinkedHashMap<>(row.values());
        row.lists().forEach((column, items) -> result.put(column, String.join(",", items)));
        return result;
    }
}
