package com.olympiadregistration.interfaces.api;

import com.olympiadregistration.application.ActorContextProvider;
import com.olympiadregistration.application.ContestantResult;
import com.olympiadregistration.application.ScoringService;
import com.olympiadregistration.domain.model.MedalBoundaries;
import com.olympiadregistration.infrastructure.security.ActorContext;
import com.olympiadregistration.interfaces.api.dto.ErrorResponse;
import com.olympiadregistration.interfaces.api.dto.MedalBoundariesRequest;
import com.olympiadregistration.interfaces.api.dto.ScoresRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST controller for score entry, medal boundaries and results.
 */
@RestController
@RequestMapping("/api/v1/scores")
@RequiredArgsConstructor
@Tag(name = "Scores", description = "Score entry and medal boundaries")
@SecurityRequirement(name = "basicAuth")
public class ScoringRestController {

    private final ScoringService scoringService;
    private final ActorContextProvider actorContextProvider;

    /**
     * Enter one problem's scores for every contestant of a country.
     *
     * @return the number of scores that changed
     */
    @PutMapping(
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Enter scores",
        description = "Enters the scores of all contestants of one country on one problem"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Scores recorded"),
        @ApiResponse(
            responseCode = "400",
            description = "Unknown country, problem or contestant, or invalid score",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "403",
            description = "Not permitted to enter scores for this country",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Registration still enabled or medal boundaries already set",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<Map<String, Integer>> enterScores(@Valid @RequestBody ScoresRequest request) {
        int changed = scoringService.enterScores(actorContextProvider.getCurrentActor(),
            request.getCountryCode(), request.getProblem(), request.getScores());
        return ResponseEntity.ok(Map.of("changed", changed));
    }

    @PutMapping(
        value = "/medal-boundaries",
        consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE
    )
    @Operation(
        summary = "Set medal boundaries",
        description = "Sets or unsets the gold, silver and bronze boundaries together"
    )
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "Medal boundaries updated"),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid or partial boundaries",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "409",
            description = "Registration still enabled or scores missing",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    public ResponseEntity<MedalBoundaries> setMedalBoundaries(@RequestBody MedalBoundariesRequest request) {
        ActorContext actor = actorContextProvider.getCurrentActor();
        return ResponseEntity.ok(scoringService.setMedalBoundaries(actor,
            request.getGold(), request.getSilver(), request.getBronze()));
    }

    @GetMapping(value = "/results", produces = MediaType.APPLICATION_JSON_VALUE)
    @Operation(summary = "Results", description = "Scores, totals and awards of every contestant")
    public ResponseEntity<List<ContestantResult>> results() {
        return ResponseEntity.ok(scoringService.results());
    }
}
