package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.CountryRegistrationService;
import com.olympiadregistration.domain.model.Country;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.interfaces.api.dto.CountryRequest;
import com.olympiadregistration.interfaces.api.dto.CountryResponse;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import com.olympiadregistration.interfaces.api.dto.PreregistrationRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

/**
 * REST controller for country registration.
 *
 * Provides endpoints for:
 * - Creating and editing countries, with an optional flag image
 * - Preregistration of expected numbers by a country's delegate
 * - Retiring countries together with their participants
 * - Listing and reading countries
 *
 * Create, edit and retire are administrator operations; the access kernel
 * decides every request.
 */
@RestController
@RequestMapping("/api/v1/countries")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Countries", description = "Country registration operations")
@SecurityRequirement(name = "basicAuth")
public class CountryRestController {

    private final CountryRegistrationService countryService;
    private final ActorContextProvider actorContextProvider;
    private final RegistrationResponseAssembler assembler;

    /**
     * Create a new country.
     *
     * @param request country fields
     * @param flag optional flag image (PNG, JPEG or PDF)
     */
    @PostMapping(
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Create country",
        description = "Creates a normal or staff country after auditing every field"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Country created successfully",
            content = @Content(schema = @Schema(implementation = CountryResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing or invalid field",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Only administrators may create countries",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Country code or name already in use",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<CountryResponse> createCountry(
            @Valid @RequestPart("country") CountryRequest request,
            @RequestPart(value = "flag", required = false) MultipartFile flag) {

        ActorContext actor = actorContextProvider.getCurrentActor();
        Country country = countryService.create(actor, request.toSubmission(MultipartUploads.toUpload(flag)));

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(assembler.toResponse(country, actor));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List countries", description = "Lists all countries that have not been retired")
    public ResponseEntity<List<CountryResponse>> listCountries() {
        ActorContext actor = actorContextProvider.getCurrentActor();
        return ResponseEntity.ok(countryService.list().stream()
            .map(country -> assembler.toResponse(country, actor))
            .toList());
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get country by ID")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Country retrieved successfully",
            content = @Content(schema = @Schema(implementation = CountryResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Country not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<CountryResponse> getCountry(@PathVariable Long id) {
        return ResponseEntity.ok(assembler.toResponse(countryService.get(id),
            actorContextProvider.getCurrentActor()));
    }

    /**
     * Edit a country. Fields left out keep their stored values.
     */
    @PutMapping(
        value = "/{id}",
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Edit country", description = "Edits a country; staff status cannot change")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Country updated successfully",
            content = @Content(schema = @Schema(implementation = CountryResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing or invalid field",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Only administrators may edit countries",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Duplicate code or name, or the country has been retired",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<CountryResponse> updateCountry(
            @PathVariable Long id,
            @Valid @RequestPart("country") CountryRequest request,
            @RequestPart(value = "flag", required = false) MultipartFile flag) {

        ActorContext actor = actorContextProvider.getCurrentActor();
        Country country = countryService.update(actor, id, request.toSubmission(MultipartUploads.toUpload(flag)));
        return ResponseEntity.ok(assembler.toResponse(country, actor));
    }

    @PutMapping(
        value = "/{id}/preregistration",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Preregister expected numbers",
        description = "Records the expected numbers of participants; resubmitting unchanged values confirms them"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Preregistration recorded",
            content = @Content(schema = @Schema(implementation = CountryResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Not the delegate of this country",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Preregistration is disabled",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<CountryResponse> preregister(
            @PathVariable Long id,
            @Valid @RequestBody PreregistrationRequest request) {

        ActorContext actor = actorContextProvider.getCurrentActor();
        Country country = countryService.preregister(actor, id, request.toSubmission());
        return ResponseEntity.ok(assembler.toResponse(country, actor));
    }

    /**
     * Retire a country and every person registered for it.
     */
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Retire country", description = "Retires a country and all of its participants")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Country retired"),
        @ApiResponse(
            responseCode = "403",
            description = "Only administrators may retire countries",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "The staff country cannot be retired",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<Void> retireCountry(@PathVariable Long id) {

        if (log.isWarnEnabled()) {
            log.warn("Retiring country: id={}", id);
        }

        countryService.retire(actorContextProvider.getCurrentActor(), id);
        return ResponseEntity.noContent().build();
    }
}
