package com.marketplace.listing.search;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meilisearch.sdk.Client;
import com.meilisearch.sdk.Index;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Meilisearch-backed index. Documents are replaced whole by primary key ({@code id}), which makes
 * every call safe to repeat.
 */
@Slf4j
@Component
public class MeilisearchListingIndex implements ListingSearchIndex {

    private static final String PRIMARY_KEY = "id";

    private final Client client;
    private final ObjectMapper objectMapper;
    private final String indexName;

    public MeilisearchListingIndex(Client client,
                                   ObjectMapper objectMapper,
                                   @Value("${search.meili.index:listings}") String indexName) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.indexName = indexName;
    }

    @Override
    public void upsert(ListingDocument document) {
        try {
            Index index = client.index(indexName);
            index.addDocuments(objectMapper.writeValueAsString(List.of(document)), PRIMARY_KEY);
            log.debug("Search document upserted: listingId={}", document.getId());
        } catch (Exception e) {
            throw new SearchIndexException("Upsert failed for listing " + document.getId(), e);
        }
    }

    @Override
    public void remove(String listingId) {
        try {
            client.index(indexName).deleteDocument(listingId);
            log.debug("Search document removed: listingId={}", listingId);
        } catch (Exception e) {
            throw new SearchIndexException("Removal failed for listing " + listingId, e);
        }
    }
}
