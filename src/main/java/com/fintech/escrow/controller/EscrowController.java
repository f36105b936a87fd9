package com.fintech.escrow.controller;

import com.fintech.escrow.dto.ActorActionRequest;
import com.fintech.escrow.dto.AgreementReference;
import com.fintech.escrow.dto.ErrorResponse;
import com.fintech.escrow.dto.EscrowEventView;
import com.fintech.escrow.dto.EscrowView;
import com.fintech.escrow.dto.FundingRequest;
import com.fintech.escrow.dto.FundingResult;
import com.fintech.escrow.dto.LedgerActionResult;
import com.fintech.escrow.entity.EscrowState;
import com.fintech.escrow.service.CustodialActionRelay;
import com.fintech.escrow.service.EscrowService;
import com.fintech.escrow.service.FundingCoordinator;
import com.fintech.escrow.service.TimeoutRefundService;
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
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.util.List;

/**
 * REST API for the escrow lifecycle, used by the marketplace and UI layers.
 * <p>
 * Provides endpoints for:
 * - Opening an escrow from an agreement
 * - Reading an escrow with the caller's permissions
 * - Funding (self-custodial or custodial)
 * - Buyer actions relayed for custodial escrows, and timeout refunds
 */
@RestController
@RequestMapping("/api/v1/escrows")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Escrows", description = "Escrow lifecycle operations API")
public class EscrowController {

    private final EscrowService escrowService;
    private final FundingCoordinator fundingCoordinator;
    private final CustodialActionRelay custodialActionRelay;
    private final TimeoutRefundService timeoutRefundService;

    @Operation(
            summary = "Create escrow",
            description = "Opens an escrow in AWAITING_FUND for an agreement between buyer and seller. One escrow per agreement."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "201", description = "Escrow created",
                    content = @Content(schema = @Schema(implementation = EscrowView.class))),
            @ApiResponse(responseCode = "400", description = "Invalid agreement or escrow already exists",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    @PostMapping
    public ResponseEntity<EscrowView> create(@Valid @RequestBody AgreementReference agreement) {
        log.info("Creating escrow for agreement {}", agreement.getAgreementId());
        return ResponseEntity.status(HttpStatus.CREATED).body(escrowService.create(agreement));
    }

    @Operation(
            summary = "List escrows",
            description = "Escrows where the actor is buyer or seller, newest first, with the actor's permissions."
    )
    @ApiResponse(responseCode = "200", description = "Escrows retrieved successfully")
    @GetMapping
    public ResponseEntity<Page<EscrowView>> list(
            @Parameter(description = "Buyer or seller user ID") @RequestParam Long actorId,
            @Parameter(description = "Only escrows in this state") @RequestParam(required = false) EscrowState state,
            @Parameter(description = "Page number (0-indexed)") @RequestParam(defaultValue = "0") int page,
            @Parameter(description = "Page size") @RequestParam(defaultValue = "20") int size) {
        return ResponseEntity.ok(escrowService.list(actorId, state, PageRequest.of(page, size)));
    }

    @Operation(
            summary = "Get escrow",
            description = "Returns the full escrow state with the permissions of the given actor, computed at request time."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Escrow found",
                    content = @Content(schema = @Schema(implementation = EscrowView.class))),
            @ApiResponse(responseCode = "404", description = "Escrow not found")
    })
    @GetMapping("/{id}")
    public ResponseEntity<EscrowView> get(
            @Parameter(description = "Escrow ID") @PathVariable Long id,
            @Parameter(description = "User whose permissions are computed") @RequestParam(required = false) Long actorId) {
        return ResponseEntity.ok(escrowService.getView(id, actorId));
    }

    @Operation(summary = "Get escrow by agreement")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Escrow found",
                    content = @Content(schema = @Schema(implementation = EscrowView.class))),
            @ApiResponse(responseCode = "404", description = "No escrow for the agreement")
    })
    @GetMapping("/by-agreement/{agreementId}")
    public ResponseEntity<EscrowView> getByAgreement(
            @Parameter(description = "Agreement reference") @PathVariable String agreementId,
            @Parameter(description = "User whose permissions are computed") @RequestParam(required = false) Long actorId) {
        return ResponseEntity.ok(escrowService.getViewByAgreement(agreementId, actorId));
    }

    @Operation(
            summary = "Get escrow events",
            description = "Returns the append-only audit trail of the escrow: local actions and observed ledger events."
    )
    @ApiResponse(responseCode = "200", description = "Events retrieved successfully")
    @GetMapping("/{id}/events")
    public ResponseEntity<List<EscrowEventView>> events(@Parameter(description = "Escrow ID") @PathVariable Long id) {
        return ResponseEntity.ok(escrowService.events(id));
    }

    @Operation(
            summary = "Fund escrow",
            description = "Self-custodial: verifies the buyer's funding transaction. Custodial: the platform submits the funding transaction and waits for confirmations. Unverified funding leaves the escrow in PENDING_VERIFICATION."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Funding verified",
                    content = @Content(schema = @Schema(implementation = FundingResult.class))),
            @ApiResponse(responseCode = "202", description = "Funding pending verification",
                    content = @Content(schema = @Schema(implementation = FundingResult.class))),
            @ApiResponse(responseCode = "422", description = "Verification attempts exhausted"),
            @ApiResponse(responseCode = "502", description = "Ledger submission failed")
    })
    @PostMapping("/{id}/fund")
    public ResponseEntity<FundingResult> fund(
            @Parameter(description = "Escrow ID") @PathVariable Long id,
            @Valid @RequestBody FundingRequest request) {
        log.info("Funding intent for escrow {} via {}", id, request.getPath());
        FundingResult result = fundingCoordinator.fund(id, request);
        HttpStatus status = result.getState() == EscrowState.PENDING_VERIFICATION ? HttpStatus.ACCEPTED : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }

    @Operation(
            summary = "Confirm delivery (custodial)",
            description = "Relays the buyer's delivery confirmation for a custodially funded escrow. Releases funds to the seller once mined."
    )
    @ApiResponse(responseCode = "202", description = "Confirmation submitted",
            content = @Content(schema = @Schema(implementation = LedgerActionResult.class)))
    @PostMapping("/{id}/confirm-delivery")
    public ResponseEntity<LedgerActionResult> confirmDelivery(
            @Parameter(description = "Escrow ID") @PathVariable Long id,
            @Valid @RequestBody ActorActionRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(custodialActionRelay.confirmDelivery(id, request.getActorId()));
    }

    @Operation(
            summary = "Raise dispute (custodial)",
            description = "Relays the buyer's dispute for a custodially funded escrow."
    )
    @ApiResponse(responseCode = "202", description = "Dispute submitted",
            content = @Content(schema = @Schema(implementation = LedgerActionResult.class)))
    @PostMapping("/{id}/raise-dispute")
    public ResponseEntity<LedgerActionResult> raiseDispute(
            @Parameter(description = "Escrow ID") @PathVariable Long id,
            @Valid @RequestBody ActorActionRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(custodialActionRelay.raiseDispute(id, request.getActorId(), request.getReason()));
    }

    @Operation(
            summary = "Trigger timeout refund",
            description = "Submits the permissionless timeout refund. The ledger refuses it before the trade's timeout."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "202", description = "Refund submitted",
                    content = @Content(schema = @Schema(implementation = LedgerActionResult.class))),
            @ApiResponse(responseCode = "502", description = "Ledger refused or submission failed")
    })
    @PostMapping("/{id}/timeout-refund")
    public ResponseEntity<LedgerActionResult> timeoutRefund(@Parameter(description = "Escrow ID") @PathVariable Long id) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(timeoutRefundService.triggerTimeoutRefund(id));
    }

    @Operation(summary = "List escrows eligible for a timeout refund")
    @ApiResponse(responseCode = "200", description = "Eligible escrows retrieved successfully")
    @GetMapping("/timeout-eligible")
    public ResponseEntity<List<EscrowView>> timeoutEligible() {
        return ResponseEntity.ok(escrowService.toViews(timeoutRefundService.findTimeoutEligible()));
    }

    @Operation(summary = "List funded escrows awaiting delivery confirmation for longer than the given hours")
    @ApiResponse(responseCode = "200", description = "Escrows retrieved successfully")
    @GetMapping("/awaiting-confirmation")
    public ResponseEntity<List<EscrowView>> awaitingConfirmation(
            @Parameter(description = "Minimum hours since funding") @RequestParam(defaultValue = "72") long olderThanHours) {
        return ResponseEntity.ok(escrowService.toViews(
                timeoutRefundService.findAwaitingConfirmationOlderThan(Duration.ofHours(olderThanHours))));
    }
}
