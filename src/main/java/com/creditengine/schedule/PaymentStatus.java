package com.creditengine.schedule;

/**
 * Status of a single scheduled credit payment.
 */
public enum PaymentStatus {
    /**
     * Not yet collected; becomes eligible for the overdue sweep once its due date has passed.
     */
    PENDING,

    /**
     * Collected by the overdue sweep.
     */
    PAID,

    /**
     * Past due and not collectible for lack of funds; accrues a penalty on every sweep until paid.
     */
    OVERDUE,

    /**
     * Will never be collected.
     */
    CANCELLED
}
