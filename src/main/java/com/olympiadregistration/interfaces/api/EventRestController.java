package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.EventAdministrationService;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import com.olympiadregistration.interfaces.api.dto.EventFlagsRequest;
import com.olympiadregistration.interfaces.api.dto.EventStatusResponse;
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

/**
 * REST controller for the event-wide flags.
 */
@RestController
@RequestMapping("/api/v1/event")
@RequiredArgsConstructor
@Tag(name = "Event", description = "Event administration")
@SecurityRequirement(name = "basicAuth")
public class EventRestController {

    private final EventAdministrationService eventService;
    private final ActorContextProvider actorContextProvider;

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Event status", description = "Registration flags and medal boundaries")
    public ResponseEntity<EventStatusResponse> status() {
        return ResponseEntity.ok(EventStatusResponse.from(eventService.status()));
    }

    @PatchMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Update event flags",
        description = "Enables or disables registration, preregistration and self-scoring"
    )
    @ApiResponses({
        @ApiResponse(
            responseCode = "200",
            description = "Flags updated",
            content = @Content(schema = @Schema(implementation = EventStatusResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Only administrators may change event flags",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<EventStatusResponse> updateFlags(@RequestBody EventFlagsRequest request) {
        return ResponseEntity.ok(EventStatusResponse.from(eventService.updateFlags(
            actorContextProvider.getCurrentActor(),
            request.getRegistrationEnabled(),
            request.getPreregistrationEnabled(),
            request.getSelfScoringEnabled())));
    }
}
