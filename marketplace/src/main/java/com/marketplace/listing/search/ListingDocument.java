package com.marketplace.listing.search;

import com.marketplace.listing.domain.Listing;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Denormalized search document. Always written whole; the index never receives partial updates.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ListingDocument {
    private String id;
    private String ownerId;
    private String name;
    private String description;
    private String categoryId;
    private BigDecimal price;
    private String unit;
    private int stockQty;
    private int minOrderQty;
    private List<String> images;
    private boolean featured;
    private long updatedAt;

    public static ListingDocument from(Listing listing) {
        return ListingDocument.builder()
                .id(listing.getId())
                .ownerId(listing.getOwnerId())
                .name(listing.getName())
                .description(listing.getDescription())
                .categoryId(listing.getCategoryId())
                .price(listing.getPrice())
                .unit(listing.getUnit())
                .stockQty(listing.getStockQty())
                .minOrderQty(listing.getMinOrderQty())
                .images(new ArrayList<>(listing.getImages()))
                .featured(listing.isFeatured())
                .updatedAt(listing.getUpdatedAt() != null ? listing.getUpdatedAt().toEpochMilli() : 0L)
                .build();
    }
}
