package com.creditengine.common;

/**
 * Supported currencies.
 * Accounts and credits are denominated in a single currency; new ones are added here.
 */
public enum Currency {
    RUB
}
