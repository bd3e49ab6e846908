package com.creditengine.api.controller;

import com.creditengine.overdue.OverduePaymentProcessor;
import com.creditengine.overdue.ProcessorState;
import com.creditengine.overdue.SweepSummary;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Operational endpoints for the overdue payment sweep.
 */
@RestController
@RequestMapping("/api/v1/admin/overdue-sweep")
@RequiredArgsConstructor
@Tag(name = "Overdue sweep", description = "Manual trigger and state of the overdue payment sweep")
public class OverdueAdminController {

    private final OverduePaymentProcessor overduePaymentProcessor;

    @PostMapping
    @Operation(summary = "Run an overdue payment sweep now")
    public ResponseEntity<SweepSummary> runSweep() {
        return ResponseEntity.ok(overduePaymentProcessor.runSweep());
    }

    @GetMapping
    @Operation(summary = "Get the processor state")
    public ResponseEntity<Map<String, ProcessorState>> getState() {
        return ResponseEntity.ok(Map.of("state", overduePaymentProcessor.getState()));
    }
}
