package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.DownloadedFile;
import com.olympiadregistration.application.FileDownloadService;
import com.olympiadregistration.application.export.RegistrationExportService;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;

/**
 * REST controller for downloads: stored files and CSV exports.
 *
 * Anonymous requests are accepted; what is returned depends on the actor.
 */
@RestController
@RequiredArgsConstructor
@Tag(name = "Downloads", description = "Stored files and CSV exports")
public class DownloadRestController {

    private static final MediaType CSV = new MediaType("text", "csv", StandardCharsets.UTF_8);

    private final FileDownloadService fileDownloadService;
    private final RegistrationExportService exportService;
    private final ActorContextProvider actorContextProvider;

    @GetMapping("/api/v1/files/{id}")
    @Operation(summary = "Download file", description = "Streams a flag, photo or consent form")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "File content"),
        @ApiResponse(
            responseCode = "403",
            description = "File not visible to this user",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "File not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<byte[]> downloadFile(@PathVariable Long id) {
        DownloadedFile file = fileDownloadService.download(actorContextProvider.getCurrentActor(), id);
        return ResponseEntity.ok()
            .contentType(MediaType.parseMediaType(file.contentType()))
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.inline().filename(file.filename()).build().toString())
            .body(file.content());
    }

    @GetMapping("/api/v1/exports/countries.csv")
    @Operation(summary = "Export countries")
    public ResponseEntity<byte[]> exportCountries() {
        return csv("countries.csv", exportService.countriesCsv(actorContextProvider.getCurrentActor()));
    }

    @GetMapping("/api/v1/exports/people.csv")
    @Operation(summary = "Export people")
    public ResponseEntity<byte[]> exportPeople() {
        return csv("people.csv", exportService.peopleCsv(actorContextProvider.getCurrentActor()));
    }

    @GetMapping("/api/v1/exports/scores.csv")
    @Operation(summary = "Export scores")
    public ResponseEntity<byte[]> exportScores() {
        return csv("scores.csv", exportService.scoresCsv());
    }

    private static ResponseEntity<byte[]> csv(String filename, byte[] content) {
        return ResponseEntity.ok()
            .contentType(CSV)
            .header(HttpHeaders.CONTENT_DISPOSITION,
                ContentDisposition.attachment().filename(filename).build().toString())
            .body(content);
    }
}
