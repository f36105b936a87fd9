package com.fintech.escrow.controller;

import com.fintech.escrow.dto.ReconciliationResult;
import com.fintech.escrow.service.EventReconciler;
import com.fintech.escrow.service.EventReconciler.ReconcilerStats;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST API for ledger event reconciliation.
 * <p>
 * Provides endpoints for:
 * - Triggering a manual reconciliation run
 * - Viewing the cursor and reconciliation statistics
 */
@RestController
@RequestMapping("/api/v1/reconciliation")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Reconciliation", description = "Ledger event reconciliation API")
public class ReconciliationController {

    private final EventReconciler eventReconciler;

    @Operation(
            summary = "Trigger manual reconciliation",
            description = "Triggers a reconciliation run. Useful for recovery after a ledger outage or before reviewing an escrow."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Reconciliation completed",
                    content = @Content(schema = @Schema(implementation = ReconciliationResult.class))),
            @ApiResponse(responseCode = "409", description = "Reconciliation already in progress")
    })
    @PostMapping("/run")
    public ResponseEntity<ReconciliationResult> triggerReconciliation() {
        log.info("Manual reconciliation triggered via API");
        return ResponseEntity.ok(eventReconciler.reconcile());
    }

    @Operation(
            summary = "Get reconciliation statistics",
            description = "Returns the cursor, ledger head, lag and escrow counts per state."
    )
    @ApiResponse(responseCode = "200", description = "Statistics retrieved successfully",
            content = @Content(schema = @Schema(implementation = ReconcilerStats.class)))
    @GetMapping("/stats")
    public ResponseEntity<ReconcilerStats> getStats() {
        return ResponseEntity.ok(eventReconciler.getStats());
    }

    @Operation(summary = "Get reconciler cursor")
    @ApiResponse(responseCode = "200", description = "Cursor retrieved successfully")
    @GetMapping("/cursor")
    public ResponseEntity<Map<String, Object>> getCursor() {
        ReconcilerStats stats = eventReconciler.getStats();
        Map<String, Object> cursor = new LinkedHashMap<>();
        cursor.put("connectionName", stats.getConnectionName());
        cursor.put("lastProcessedBlock", stats.getLastProcessedBlock());
        cursor.put("latestBlock", stats.getLatestBlock());
        return ResponseEntity.ok(cursor);
    }

    @Operation(
            summary = "Health check",
            description = "Returns the health of the reconciler and its ledger connection. Used by load balancers and monitoring systems."
    )
    @ApiResponse(responseCode = "200", description = "Service is healthy")
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> healthCheck() {
        ReconcilerStats stats = eventReconciler.getStats();

        Map<String, Object> reconciliation = new LinkedHashMap<>();
        reconciliation.put("isRunning", stats.isReconciliationRunning());
        reconciliation.put("connection", stats.getConnectionName());
        reconciliation.put("ledgerAvailable", stats.isLedgerAvailable());
        reconciliation.put("lagBlocks", stats.getLagBlocks());

        Map<String, Object> health = new LinkedHashMap<>();
        health.put("status", stats.isLedgerAvailable() ? "UP" : "DEGRADED");
        health.put("reconciliation", reconciliation);
        return ResponseEntity.ok(health);
    }
}
