package com.creditengine.api.controller;

import com.creditengine.api.dto.CreateCreditRequest;
import com.creditengine.credits.Credit;
import com.creditengine.credits.CreditLifecycleManager;
import com.creditengine.credits.CreditLoad;
import com.creditengine.schedule.PaymentScheduleEntry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for credits.
 */
@RestController
@RequestMapping("/api/v1/credits")
@RequiredArgsConstructor
@Tag(name = "Credits", description = "Credit issuance and schedules")
public class CreditController {

    private final CreditLifecycleManager creditLifecycleManager;

    @PostMapping
    @Operation(summary = "Issue a credit and disburse it to the funding account")
    public ResponseEntity<Credit> createCredit(@Valid @RequestBody CreateCreditRequest request) {
        Credit credit = creditLifecycleManager.createCredit(
            request.getOwnerId(), request.getAccountId(), request.getAmount(), request.getTermMonths());
        return ResponseEntity.status(HttpStatus.CREATED).body(credit);
    }

    @GetMapping("/{creditId}")
    @Operation(summary = "Get credit details")
    public ResponseEntity<Credit> getCredit(@PathVariable String creditId) {
        return ResponseEntity.ok(creditLifecycleManager.getCredit(creditId));
    }

    @GetMapping("/owner/{ownerId}")
    @Operation(summary = "Get all credits for an owner")
    public ResponseEntity<List<Credit>> getCreditsByOwner(@PathVariable String ownerId) {
        return ResponseEntity.ok(creditLifecycleManager.getCreditsByOwner(ownerId));
    }

    @GetMapping("/{creditId}/schedule")
    @Operation(summary = "Get the payment schedule of a credit")
    public ResponseEntity<List<PaymentScheduleEntry>> getSchedule(@PathVariable String creditId) {
        return ResponseEntity.ok(creditLifecycleManager.getSchedule(creditId));
    }

    @GetMapping("/owner/{ownerId}/load")
    @Operation(summary = "Get the aggregate credit load of an owner")
    public ResponseEntity<CreditLoad> getCreditLoad(@PathVariable String ownerId) {
        return ResponseEntity.ok(creditLifecycleManager.getCreditLoad(ownerId));
    }
}
