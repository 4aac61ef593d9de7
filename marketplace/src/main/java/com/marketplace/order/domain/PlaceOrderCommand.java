package com.marketplace.order.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.util.List;

@Getter
@Builder
public class PlaceOrderCommand {

    private final String buyerId;
    @Singular
    private final List<Item> items;
    private final PaymentMethod paymentMethod;
    private final DeliveryAddress deliveryAddress;

    @Getter
    public static class Item {
        private final String listingId;
        private final int quantity;

        public Item(String listingId, int quantity) {
            this.listingId = listingId;
            this.quantity = quantity;
        }
    }
}
