package com.fintech.escrow.controller;

import com.fintech.escrow.dto.DisputeDecisionRequest;
import com.fintech.escrow.dto.DisputeResolutionResult;
import com.fintech.escrow.dto.EscrowView;
import com.fintech.escrow.dto.ReleaseHoldRequest;
import com.fintech.escrow.entity.DisputeResolution;
import com.fintech.escrow.service.DisputeResolver;
import com.fintech.escrow.service.EscrowService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Administrator endpoints: dispute resolution and manual review.
 * Authentication is handled upstream.
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Administration", description = "Dispute resolution and manual review API")
public class DisputeAdminController {

    private final DisputeResolver disputeResolver;
    private final EscrowService escrowService;

    @Operation(summary = "List disputed escrows")
    @ApiResponse(responseCode = "200", description = "Disputed escrows retrieved successfully")
    @GetMapping("/disputes")
    public ResponseEntity<Page<EscrowView>> listDisputes(
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        Page<EscrowView> disputes = disputeResolver.listDisputed(PageRequest.of(page, size))
                .map(record -> escrowService.toView(record, null));
        return ResponseEntity.ok(disputes);
    }

    @Operation(
            summary = "Resolve dispute",
            description = "Computes the payout for the decision and submits it to the ledger. The escrow completes once the ledger event is reconciled."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Resolution submitted",
                    content = @Content(schema = @Schema(implementation = DisputeResolutionResult.class))),
            @ApiResponse(responseCode = "400", description = "Escrow not disputed or invalid decision"),
            @ApiResponse(responseCode = "502", description = "Submission failed or reverted")
    })
    @PostMapping("/disputes/{escrowId}/resolve")
    public ResponseEntity<DisputeResolutionResult> resolve(
            @Parameter(description = "Escrow ID") @PathVariable Long escrowId,
            @Valid @RequestBody DisputeDecisionRequest decision) {
        log.info("Admin {} submitted {} decision for escrow {}", decision.getAdminId(), decision.getOutcome(), escrowId);
        return ResponseEntity.ok(disputeResolver.resolve(escrowId, decision));
    }

    @Operation(summary = "List resolutions of an escrow")
    @ApiResponse(responseCode = "200", description = "Resolutions retrieved successfully")
    @GetMapping("/disputes/{escrowId}/resolutions")
    public ResponseEntity<List<DisputeResolution>> resolutions(
            @Parameter(description = "Escrow ID") @PathVariable Long escrowId) {
        return ResponseEntity.ok(disputeResolver.resolutions(escrowId));
    }

    @Operation(
            summary = "Get escrows needing manual review",
            description = "Returns escrows on consistency hold and escrows that used up their funding verification attempts."
    )
    @ApiResponse(responseCode = "200", description = "Escrows needing review retrieved successfully")
    @GetMapping("/escrows/needs-review")
    public ResponseEntity<List<EscrowView>> needsReview() {
        return ResponseEntity.ok(escrowService.needingReview());
    }

    @Operation(
            summary = "Release consistency hold",
            description = "Resumes automated transitions on an escrow after an administrator reviewed the inconsistency."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Hold released",
                    content = @Content(schema = @Schema(implementation = EscrowView.class))),
            @ApiResponse(responseCode = "400", description = "Escrow is not on hold")
    })
    @PostMapping("/escrows/{escrowId}/release-hold")
    public ResponseEntity<EscrowView> releaseHold(
            @Parameter(description = "Escrow ID") @PathVariable Long escrowId,
            @Valid @RequestBody ReleaseHoldRequest request) {
        return ResponseEntity.ok(escrowService.releaseHold(escrowId, request.getAdminId(), request.getNote()));
    }
}
