package com.creditengine.api.controller;

import com.creditengine.accounts.Account;
import com.creditengine.accounts.AccountStatus;
import com.creditengine.api.dto.AmountRequest;
import com.creditengine.api.dto.BalanceResponse;
import com.creditengine.api.dto.OpenAccountRequest;
import com.creditengine.api.dto.TransferRequest;
import com.creditengine.common.Currency;
import com.creditengine.common.Money;
import com.creditengine.ledger.LedgerStore;
import com.creditengine.ledger.LedgerTransaction;
import com.creditengine.ledger.TransactionType;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for accounts and money movements.
 */
@RestController
@RequestMapping("/api/v1/accounts")
@RequiredArgsConstructor
@Tag(name = "Accounts", description = "Account and ledger API")
public class AccountController {

    private final LedgerStore ledgerStore;

    @PostMapping
    @Operation(summary = "Open a new account")
    public ResponseEntity<Account> openAccount(@Valid @RequestBody OpenAccountRequest request) {
        Currency currency = request.getCurrency() != null ? request.getCurrency() : Currency.RUB;
        Account account = ledgerStore.openAccount(request.getOwnerId(), currency);
        return ResponseEntity.status(HttpStatus.CREATED).body(account);
    }

    @GetMapping("/{accountId}")
    @Operation(summary = "Get account details")
    public ResponseEntity<Account> getAccount(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerStore.getAccount(accountId));
    }

    @GetMapping("/owner/{ownerId}")
    @Operation(summary = "Get all accounts for an owner")
    public ResponseEntity<List<Account>> getAccountsByOwner(@PathVariable String ownerId) {
        return ResponseEntity.ok(ledgerStore.getAccountsByOwner(ownerId));
    }

    @PostMapping("/{accountId}/deposit")
    @Operation(summary = "Deposit funds to an account")
    public ResponseEntity<BalanceResponse> deposit(@PathVariable String accountId,
                                                   @Valid @RequestBody AmountRequest request) {
        Account account = ledgerStore.getAccount(accountId);
        Money balance = ledgerStore.deposit(accountId, Money.of(request.getAmount(), account.getCurrency()),
            TransactionType.DEPOSIT, descriptionOr(request.getDescription(), "Deposit"));
        return ResponseEntity.ok(toResponse(accountId, balance));
    }

    @PostMapping("/{accountId}/withdraw")
    @Operation(summary = "Withdraw funds from an account")
    public ResponseEntity<BalanceResponse> withdraw(@PathVariable String accountId,
                                                    @Valid @RequestBody AmountRequest request) {
        Account account = ledgerStore.getAccount(accountId);
        Money balance = ledgerStore.withdraw(accountId, Money.of(request.getAmount(), account.getCurrency()),
            TransactionType.WITHDRAW, descriptionOr(request.getDescription(), "Withdrawal"));
        return ResponseEntity.ok(toResponse(accountId, balance));
    }

    @PostMapping("/transfer")
    @Operation(summary = "Transfer funds between two accounts")
    public ResponseEntity<Void> transfer(@Valid @RequestBody TransferRequest request) {
        Account source = ledgerStore.getAccount(request.getFromAccountId());
        ledgerStore.transfer(request.getFromAccountId(), request.getToAccountId(),
            Money.of(request.getAmount(), source.getCurrency()),
            descriptionOr(request.getDescription(), "Transfer"));
        return ResponseEntity.ok().build();
    }

    @GetMapping("/{accountId}/transactions")
    @Operation(summary = "Get the transaction history of an account, newest first")
    public ResponseEntity<List<LedgerTransaction>> getHistory(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerStore.getAccountHistory(accountId));
    }

    @PostMapping("/{accountId}/block")
    @Operation(summary = "Block an account")
    public ResponseEntity<Account> block(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerStore.changeStatus(accountId, AccountStatus.BLOCKED));
    }

    @PostMapping("/{accountId}/unblock")
    @Operation(summary = "Unblock an account")
    public ResponseEntity<Account> unblock(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerStore.changeStatus(accountId, AccountStatus.ACTIVE));
    }

    @PostMapping("/{accountId}/close")
    @Operation(summary = "Close an account")
    public ResponseEntity<Account> close(@PathVariable String accountId) {
        return ResponseEntity.ok(ledgerStore.changeStatus(accountId, AccountStatus.CLOSED));
    }

    private static String descriptionOr(String description, String fallback) {
        return description == null || description.isBlank() ? fallback : description;
    }

    private static BalanceResponse toResponse(String accountId, Money balance) {
        return new BalanceResponse(accountId, balance.getAmount(), balance.getCurrency().name());
    }
}
