package com.marketplace.order.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Address snapshot taken when the order is placed; later address book changes do not affect it.
 */
@Embeddable
@Getter
@EqualsAndHashCode
@NoArgsConstructor
@AllArgsConstructor
public class DeliveryAddress {

    @Column(name = "delivery_street", nullable = false, length = 200)
    private String street;

    @Column(name = "delivery_city", nullable = false, length = 100)
    private String city;

    @Column(name = "delivery_state", nullable = false, length = 100)
    private String state;

    @Column(name = "delivery_postal_code", nullable = false, length = 20)
    private String postalCode;

    @Column(name = "delivery_landmark", length = 200)
    private String landmark;
}
