package com.marketplace.order.domain;

/**
 * How the buyer intends to pay. Settlement happens outside this service.
 */
public enum PaymentMethod {
    ONLINE,
    COD
}
