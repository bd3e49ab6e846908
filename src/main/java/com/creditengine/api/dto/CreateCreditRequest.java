package com.creditengine.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.math.BigDecimal;

/**
 * DTO for issuing a credit.
 *
 * Amount and term ranges are checked by the credit service against the configured limits.
 */
@Data
public class CreateCreditRequest {

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    @NotBlank(message = "Account ID is required")
    private String accountId;

    @NotNull(message = "Amount is required")
    private BigDecimal amount;

    @NotNull(message = "Term is required")
    private Integer termMonths;
}
