package com.marketplace.listing.search;

/**
 * Full-text index holding the discoverable listings.
 */
public interface ListingSearchIndex {

    /** Replace (or insert) the document with the same id. */
    void upsert(ListingDocument document);

    /** Remove the document; removing an absent id is not an error. */
    void remove(String listingId);

    class SearchIndexException extends RuntimeException {
        public SearchIndexException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
