package com.raava.concierge.inventory.service;

import com.raava.concierge.inventory.model.VehicleListing;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collapses the same car advertised by several sources.
 *
 * Two listings are the same car when make, model, year, price and location match, ignoring
 * case. The first listing seen is kept. The result is ordered by price, cheapest first.
 */
@Component
public class ListingDeduplicator {

    public List<VehicleListing> deduplicate(List<VehicleListing> listings) {
        Map<String, VehicleListing> unique = new LinkedHashMap<>();
        for (VehicleListing listing : listings) {
            unique.putIfAbsent(key(listing), listing);
        }
        List<VehicleListing> result = new ArrayList<>(unique.values());
        result.sort(Comparator.comparing(VehicleListing::getPrice, Comparator.nullsLast(Comparator.naturalOrder())));
        return result;
    }

    private static String key(VehicleListing listing) {
        return String.join("|",
                normalise(listing.getMake()),
                normalise(listing.getModel()),
                String.valueOf(listing.getYear()),
                listing.getPrice() != null ? String.valueOf(Math.round(listing.getPrice())) : "",
                normalise(listing.getLocation()));
    }

    private static String normalise(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
