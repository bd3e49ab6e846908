package com.creditengine.api.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class BalanceResponse {
    String accountId;
    BigDecimal balance;
    String currency;
}
