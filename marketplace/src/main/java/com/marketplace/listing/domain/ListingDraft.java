package com.marketplace.listing.domain;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;

import java.math.BigDecimal;
import java.util.List;

/**
 * Content of a listing as submitted by its owner, before it exists.
 */
@Getter
@Builder
public class ListingDraft {
    private final String name;
    private final String description;
    private final BigDecimal price;
    private final String unit;
    private final int stockQty;
    @Builder.Default
    private final int minOrderQty = 1;
    private final String categoryId;
    @Singular
    private final List<String> images;
}
