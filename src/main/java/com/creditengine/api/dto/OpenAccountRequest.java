package com.creditengine.api.dto;

import com.creditengine.common.Currency;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * DTO for opening a new account.
 */
@Data
public class OpenAccountRequest {

    @NotBlank(message = "Owner ID is required")
    private String ownerId;

    /**
     * Defaults to RUB when omitted.
     */
    private Currency currency;
}
