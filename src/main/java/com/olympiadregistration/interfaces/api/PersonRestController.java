package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.PersonRegistrationService;
import com.olympiadregistration.domain.model.Person;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import com.olympiadregistration.interfaces.api.dto.PersonRequest;
import com.olympiadregistration.interfaces.api.dto.PersonResponse;
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
 * REST controller for person registration.
 *
 * Provides endpoints for:
 * - Registering and editing people, with optional photo and consent form
 * - Retiring people
 * - Listing and reading people; private details only for administrators,
 *   the country's delegate and the person's own account
 */
@RestController
@RequestMapping("/api/v1/people")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "People", description = "Person registration operations")
@SecurityRequirement(name = "basicAuth")
public class PersonRestController {

    private final PersonRegistrationService personService;
    private final ActorContextProvider actorContextProvider;
    private final RegistrationResponseAssembler assembler;

    /**
     * Register a person.
     *
     * @param request person fields; a delegate may leave out the country code
     * @param photo optional registration photo (JPEG or PNG)
     * @param consentForm optional signed consent form (PDF)
     */
    @PostMapping(
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(
        summary = "Register person",
        description = "Registers a participant or staff member after auditing every field"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "201",
            description = "Person registered successfully",
            content = @Content(schema = @Schema(implementation = PersonResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing or invalid field",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Not permitted to register people for this country",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Role already filled or registration disabled",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PersonResponse> createPerson(
            @Valid @RequestPart("person") PersonRequest request,
            @RequestPart(value = "photo", required = false) MultipartFile photo,
            @RequestPart(value = "consentForm", required = false) MultipartFile consentForm) {

        ActorContext actor = actorContextProvider.getCurrentActor();
        Person person = personService.create(actor, request.toSubmission(
            MultipartUploads.toUpload(photo), MultipartUploads.toUpload(consentForm)));

        return ResponseEntity
            .status(HttpStatus.CREATED)
            .body(assembler.toResponse(person, actor));
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "List people", description = "Lists all people who have not been retired")
    public ResponseEntity<List<PersonResponse>> listPeople() {
        ActorContext actor = actorContextProvider.getCurrentActor();
        return ResponseEntity.ok(personService.list().stream()
            .map(person -> assembler.toResponse(person, actor))
            .toList());
    }

    @GetMapping(value = "/{id}", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Get person by ID")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Person retrieved successfully",
            content = @Content(schema = @Schema(implementation = PersonResponse.class))
        ),
        @ApiResponse(
            responseCode = "404",
            description = "Person not found",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PersonResponse> getPerson(@PathVariable Long id) {
        return ResponseEntity.ok(assembler.toResponse(personService.get(id),
            actorContextProvider.getCurrentActor()));
    }

    @PutMapping(
        value = "/{id}",
        consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(summary = "Edit person", description = "Edits a registration; fields left out keep their values")
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Person updated successfully",
            content = @Content(schema = @Schema(implementation = PersonResponse.class))
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Missing or invalid field",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Not permitted to edit this person",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Role already filled, registration disabled or person retired",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<PersonResponse> updatePerson(
            @PathVariable Long id,
            @Valid @RequestPart("person") PersonRequest request,
            @RequestPart(value = "photo", required = false) MultipartFile photo,
            @RequestPart(value = "consentForm", required = false) MultipartFile consentForm) {

        ActorContext actor = actorContextProvider.getCurrentActor();
        Person person = personService.update(actor, id, request.toSubmission(
            MultipartUploads.toUpload(photo), MultipartUploads.toUpload(consentForm)));
        return ResponseEntity.ok(assembler.toResponse(person, actor));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @Operation(summary = "Retire person")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "Person retired"),
        @ApiResponse(
            responseCode = "403",
            description = "Only administrators may retire people",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<Void> retirePerson(@PathVariable Long id) {

        if (log.isWarnEnabled()) {
            log.warn("Retiring person: id={}", id);
        }

        personService.retire(actorContextProvider.getCurrentActor(), id);
        return ResponseEntity.noContent().build();
    }
}
