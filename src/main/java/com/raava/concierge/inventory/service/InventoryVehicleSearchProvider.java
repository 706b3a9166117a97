package com.raava.concierge.inventory.service;

import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;
import com.raava.concierge.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Searches the stock list shipped on the classpath.
 *
 * Responsibilities:
 * - Load the inventory file once at startup
 * - Filter by make, model, minimum year and maximum price
 * - De-duplicate and cap the number of results
 */
@Slf4j
@Service
public class InventoryVehicleSearchProvider implements VehicleSearchProvider {

    private final ListingDeduplicator deduplicator;
    private final List<VehicleListing> inventory;
    private final int maxResults;

    public InventoryVehicleSearchProvider(
            ListingDeduplicator deduplicator,
            @Value("${raava.search.inventory-path:data/inventory.json}") String inventoryPath,
            @Value("${raava.search.max-results:5}") int maxResults) {
        this.deduplicator = deduplicator;
        this.maxResults = maxResults;
        try {
            this.inventory = List.copyOf(JsonFileLoader.loadAsList(inventoryPath, VehicleListing.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load vehicle inventory from " + inventoryPath, e);
        }
        log.info("Vehicle inventory loaded - path: {}, listings: {}", inventoryPath, inventory.size());
    }

    @Override
    public List<VehicleListing> search(SearchCriteria criteria) {
        List<VehicleListing> matches = inventory.stream()
                .filter(listing -> matchesText(listing.getMake(), criteria.getMake(), true))
                .filter(listing -> matchesText(listing.getModel(), criteria.getModel(), false))
                .filter(listing -> criteria.getMinYear() == null
                        || (listing.getYear() != null && listing.getYear() >= criteria.getMinYear()))
                .filter(listing -> criteria.getMaxPrice() == null
                        || (listing.getPrice() != null && listing.getPrice() <= criteria.getMaxPrice()))
                .collect(Collectors.toList());

        List<VehicleListing> results = deduplicator.deduplicate(matches);
        if (results.size() > maxResults) {
            results = results.subList(0, maxResults);
        }
        log.info("Vehicle search completed - make: {}, model: {}, maxPrice: {}, matches: {}, returned: {}",
                criteria.getMake(), criteria.getModel(), criteria.getMaxPrice(), matches.size(), results.size());
        return List.copyOf(results);
    }

    private static boolean matchesText(String actual, String wanted, boolean exact) {
        if (wanted == null || wanted.isBlank()) {
            return true;
        }
        if (actual == null) {
            return false;
        }
        String a = actual.toLowerCase(Locale.ROOT);
        String w = wanted.toLowerCase(Locale.ROOT).trim();
        return exact ? a.equals(w) : a.contains(w);
    }
}
