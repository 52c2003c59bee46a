package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.bulk.BulkImportResult;
import com.olympiadregistration.application.bulk.BulkImportService;
import com.olympiadregistration.domain.exception.FormatInvalidException;
import com.olympiadregistration.domain.exception.RequiredFieldMissingException;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * REST controller for bulk registration from CSV files.
 *
 * Each import is requested twice: first with {@code dryRun=true} to check
 * the file and review the parsed rows, then with {@code dryRun=false} to
 * commit. The file is checked again before committing.
 */
@RestController
@RequestMapping("/api/v1/bulk")
@RequiredArgsConstructor
@Tag(name = "Bulk import", description = "Bulk registration from CSV")
@SecurityRequirement(name = "basicAuth")
public class BulkImportRestController {

    private final BulkImportService bulkImportService;
    private final ActorContextProvider actorContextProvider;

    @PostMapping(
        value = "/countries",
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Import countries", description = "Administrator only")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "File checked or imported",
            content = @Content(schema = @Schema(implementation = BulkImportResult.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or row; the message names the row",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Duplicate value, or a conflicting change while committing",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<BulkImportResult> importCountries(
            @RequestPart("csv") MultipartFile csv,
            @RequestPart(value = "zip", required = false) MultipartFile zip,
            @RequestParam(value = "separator", defaultValue = ",") String separator,
            @RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {

        return ResponseEntity.ok(bulkImportService.importCountries(actorContextProvider.getCurrentActor(),
            csvBytes(csv), separator(separator), MultipartUploads.bytes(zip), dryRun));
    }

    @PostMapping(
        value = "/people",
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Import people",
        description = "Administrators may import people of any country, delegates those of their own"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "File checked or imported",
            content = @Content(schema = @Schema(implementation = BulkImportResult.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file or row; the message names the row",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Not permitted to register people for a country in the file",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Duplicate value, or a conflicting change while committing",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<BulkImportResult> importPeople(
            @RequestPart("csv") MultipartFile csv,
            @RequestPart(value = "zip", required = false) MultipartFile zip,
            @RequestParam(value = "separator", defaultValue = ",") String separator,
            @RequestParam(value = "dryRun", defaultValue = "true") boolean dryRun) {

        return ResponseEntity.ok(bulkImportService.importPeople(actorContextProvider.getCurrentActor(),
            csvBytes(csv), separator(separator), MultipartUploads.bytes(zip), dryRun));
    }

    private static byte[] csvBytes(MultipartFile csv) {
        byte[] content = MultipartUploads.bytes(csv);
        if (content == null) {
            throw new RequiredFieldMissingException("No CSV file uploaded");
        }
        return content;
    }

    private static char separator(String separator) {
        if (separator.length() != 1) {
            throw new FormatInvalidException("Invalid CSV delimiter");
        }
        return separator.charAt(0);
    }
}
