package com.raava.concierge.inventory.service;

import com.raava.concierge.inventory.model.SearchCriteria;
import com.raava.concierge.inventory.model.VehicleListing;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class InventoryVehicleSearchProviderTest {

    private final InventoryVehicleSearchProvider searchProvider =
            new InventoryVehicleSearchProvider(new ListingDeduplicator(), "data/inventory.json", 5);

    @Test
    void testSearch_MakeIsDeduplicatedAndCheapestFirst() {
        // When
        List<VehicleListing> results = searchProvider.search(SearchCriteria.builder().make("Ferrari").build());

        // Then
        assertEquals(List.of("INV-2001", "INV-2002", "INV-2003"), ids(results));
        assertEquals(189_500.0, results.get(0).getPrice());
    }

    @Test
    void testSearch_ModelIsPartialMatch() {
        // When
        List<VehicleListing> results = searchProvider.search(SearchCriteria.builder().make("lamborghini").model("huracan").build());

        // Then
        assertEquals(List.of("INV-1002"), ids(results));
    }

    @Test
    void testSearch_MaxPriceAndMinYear() {
        // When
        List<VehicleListing> underBudget = searchProvider.search(SearchCriteria.builder().make("Ferrari").maxPrice(240_000.0).build());
        List<VehicleListing> recent = searchProvider.search(SearchCriteria.builder().make("Ferrari").minYear(2023).build());

        // Then
        assertEquals(List.of("INV-2001", "INV-2002"), ids(underBudget));
        assertEquals(List.of("INV-2003"), ids(recent));
    }

    @Test
    void testSearch_ResultsAreCapped() {
        // When
        List<VehicleListing> results = searchProvider.search(new SearchCriteria());

        // Then
        assertEquals(5, results.size());
        assertEquals("INV-8006", results.get(0).getId());
    }

    @Test
    void testSearch_UnknownMakeFindsNothing() {
        assertTrue(searchProvider.search(SearchCriteria.builder().make("Bugatti").build()).isEmpty());
    }

    @Test
    void testConstructor_MissingFileFailsFast() {
        assertThrows(IllegalStateException.class,
                () -> new InventoryVehicleSearchProvider(new ListingDeduplicator(), "data/missing.json", 5));
    }

    private static List<String> ids(List<VehicleListing> listings) {
        return listings.stream().map(VehicleListing::getId).collect(Collectors.toList());
    }
}
