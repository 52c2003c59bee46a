package com.olympiadregistration.application.bulk;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a bulk import request.
 *
 * @param kind {@code countries} or {@code people}
 * @param dryRun whether the file was only validated
 * @param rows cleaned rows as parsed, for review before committing
 * @param createdIds ids of the records created, in file order; empty on a dry run
 */
public record BulkImportResult(String kind, boolean dryRun, List<Map<String, String>> rows,
                               List<Long> createdIds) {
}
