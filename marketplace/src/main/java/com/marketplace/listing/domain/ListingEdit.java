package com.marketplace.listing.domain;

import lombok.Builder;
import lombok.Getter;

import java.math.BigDecimal;
import java.util.List;

/**
 * Partial owner edit. Null fields are left unchanged.
 */
@Getter
@Builder
public class ListingEdit {
    private final String name;
    private final String description;
    private final BigDecimal price;
    private final String unit;
    private final Integer stockQty;
    private final Integer minOrderQty;
    private final String categoryId;
    private final List<String> images;

    public boolean touchesStock() {
        return stockQty != null;
    }

    void applyTo(Listing listing) {
        if (name != null) listing.setName(name);
        if (description != null) listing.setDescription(description);
        if (price != null) listing.setPrice(price);
        if (unit != null) listing.setUnit(unit);
        if (stockQty != null) listing.setStockQty(stockQty);
        if (minOrderQty != null) listing.setMinOrderQty(minOrderQty);
        if (categoryId != null) listing.setCategoryId(categoryId);
        if (images != null) listing.setImages(new java.util.ArrayList<>(images));
    }
}
