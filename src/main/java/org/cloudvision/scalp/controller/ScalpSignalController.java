package org.cloudvision.scalp.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.cloudvision.scalp.controller.dto.EvaluateRequest;
import org.cloudvision.scalp.controller.dto.SnapshotRequest;
import org.cloudvision.scalp.indicators.IndicatorService;
import org.cloudvision.scalp.indicators.model.IndicatorSnapshot;
import org.cloudvision.scalp.service.ScalpSignalService;
import org.cloudvision.scalp.service.SessionEvaluation;
import org.cloudvision.scalp.service.StateSummary;
import org.cloudvision.scalp.signal.model.ScalpAlert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.CrossOrigin;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * REST API Controller for scalp signals
 *
 * Provides endpoints to:
 * - Evaluate the signal pipeline for a symbol on each closed 1-minute bar
 * - Inspect session state and alert history
 * - Reset a session
 * - Compute an indicator snapshot for an arbitrary candle window
 */
@RestController
@RequestMapping("/api/scalp")
@CrossOrigin(origins = "*")
@Tag(name = "Scalp Signals", description = "Multi-timeframe scalp signal engine - Director, Validator, Trigger and Trap Mode")
public class ScalpSignalController {

    private static final Logger logger = LoggerFactory.getLogger(ScalpSignalController.class);

    private final ScalpSignalService signalService;
    private final IndicatorService indicatorService;
    private final Clock clock;

    @Autowired
    public ScalpSignalController(ScalpSignalService signalService, IndicatorService indicatorService, Clock clock) {
        this.signalService = signalService;
        this.indicatorService = indicatorService;
        this.clock = clock;
    }

    @Operation(
        summary = "Evaluate signals for a symbol",
        description = "Runs the pipeline once against the supplied 1m/2m/5m windows. Call once per closed 1-minute bar."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Evaluation result, with an alert when one fired"),
        @ApiResponse(responseCode = "400", description = "Invalid candle data")
    })
    @PostMapping("/{symbol}/evaluate")
    public ResponseEntity<SessionEvaluation> evaluate(
            @Parameter(description = "Instrument symbol", example = "SPY") @PathVariable String symbol,
            @RequestBody EvaluateRequest request) {
        Instant now = request.getTimestamp() != null ? request.getTimestamp() : clock.instant();
        try {
            SessionEvaluation evaluation = signalService.evaluate(symbol, request.getCandles1m(),
                request.getCandles2m(), request.getCandles5m(), now);
            return ResponseEntity.ok(evaluation);
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected evaluation for {}: {}", symbol, e.getMessage());
            return ResponseEntity.badRequest().build();
        }
    }

    @Operation(summary = "List symbols with an active session")
    @GetMapping("/sessions")
    public ResponseEntity<Set<String>> getSessions() {
        return ResponseEntity.ok(signalService.getSymbols());
    }

    @Operation(summary = "Get session state", description = "Director bias, trap and cooldown state for a symbol")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Current state"),
        @ApiResponse(responseCode = "404", description = "No session for symbol")
    })
    @GetMapping("/{symbol}/state")
    public ResponseEntity<StateSummary> getState(@PathVariable String symbol) {
        try {
            return ResponseEntity.ok(signalService.getStateSummary(symbol, clock.instant()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Get alert history", description = "Alerts emitted for a symbol, most recent first")
    @GetMapping("/{symbol}/alerts")
    public ResponseEntity<List<ScalpAlert>> getAlerts(@PathVariable String symbol) {
        try {
            return ResponseEntity.ok(signalService.getAlertHistory(symbol));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.notFound().build();
        }
    }

    @Operation(summary = "Reset session", description = "Clears Director, trap, cooldown and history for a symbol")
    @DeleteMapping("/{symbol}")
    public ResponseEntity<Map<String, Object>> reset(@PathVariable String symbol) {
        if (!signalService.reset(symbol)) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(Map.of("symbol", symbol.toUpperCase(), "reset", true));
    }

    @Operation(summary = "Indicator snapshot", description = "All indicator readings for the latest bar of a candle window")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Snapshot"),
        @ApiResponse(responseCode = "400", description = "No candles supplied")
    })
    @PostMapping("/indicators/snapshot")
    public ResponseEntity<IndicatorSnapshot> snapshot(@RequestBody SnapshotRequest request) {
        try {
            return ResponseEntity.ok(indicatorService.snapshot(request.getCandles()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().build();
        }
    }
}
