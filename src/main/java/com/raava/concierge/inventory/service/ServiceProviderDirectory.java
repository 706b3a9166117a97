package com.raava.concierge.inventory.service;

import com.raava.concierge.dialogue.model.ServiceType;
import com.raava.concierge.inventory.model.ServiceProvider;
import com.raava.concierge.inventory.model.ServiceProviderCatalog;
import com.raava.concierge.util.JsonFileLoader;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Garages and dealerships that can service a customer's car.
 *
 * Responsibilities:
 * - Load the provider catalogue once at startup
 * - Rank make specialists ahead of general providers, best rated and nearest first
 * - Estimate distance from the customer's postcode area and the cost of the requested work
 */
@Slf4j
@Service
public class ServiceProviderDirectory {

    private static final double EARTH_RADIUS_MILES = 3959;
    private static final double[] DEFAULT_COORDINATES = {51.5074, -0.1278};
    private static final String GENERAL_COST_KEY = "GENERAL";

    private final ServiceProviderCatalog catalog;
    private final int maxProviders;

    public ServiceProviderDirectory(
            @Value("${raava.service.providers-path:data/service-providers.json}") String providersPath,
            @Value("${raava.service.max-providers:3}") int maxProviders) {
        this.maxProviders = maxProviders;
        try {
            this.catalog = JsonFileLoader.loadAsObject(providersPath, ServiceProviderCatalog.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load service providers from " + providersPath, e);
        }
        log.info("Service providers loaded - path: {}, providers: {}", providersPath, catalog.getProviders().size());
    }

    /**
     * Finds providers for a make near a postcode.
     *
     * @param make        vehicle make
     * @param postcode    customer postcode; unknown areas are treated as central London
     * @param serviceType work requested, used for the cost estimate; may be null
     * @return at most the configured number of providers, specialists first
     */
    public List<ServiceProvider> findProviders(String make, String postcode, ServiceType serviceType) {
        double[] origin = coordinatesFor(postcode);
        int baseCost = baseCost(serviceType);

        List<ServiceProvider> specialists = new ArrayList<>();
        List<ServiceProvider> general = new ArrayList<>();
        for (ServiceProvider provider : catalog.getProviders()) {
            boolean generalProvider = provider.getMakes() == null || provider.getMakes().isEmpty();
            if (!generalProvider && !servesMake(provider, make)) {
                continue;
            }
            ServiceProvider priced = provider.toBuilder()
                    .distanceMiles(distanceMiles(origin, provider))
                    .estimatedCost((int) Math.round(baseCost * multiplier(provider)))
                    .build();
            (generalProvider ? general : specialists).add(priced);
        }

        Comparator<ServiceProvider> ranking = Comparator
                .comparing((ServiceProvider p) -> p.getRating() != null ? p.getRating() : 0.0, Comparator.reverseOrder())
                .thenComparing(ServiceProvider::getDistanceMiles);
        specialists.sort(ranking);
        general.sort(ranking);

        List<ServiceProvider> result = new ArrayList<>(specialists);
        result.addAll(general);
        if (result.size() > maxProviders) {
            result = new ArrayList<>(result.subList(0, maxProviders));
        }
        log.info("Provider lookup completed - make: {}, postcodeArea: {}, specialists: {}, returned: {}",
                make, postcodeArea(postcode), specialists.size(), result.size());
        return result;
    }

    private static boolean servesMake(ServiceProvider provider, String make) {
        if (make == null) {
            return false;
        }
        return provider.getMakes().stream().anyMatch(served -> served.equalsIgnoreCase(make.trim()));
    }

    private int baseCost(ServiceType serviceType) {
        Integer cost = serviceType != null ? catalog.getBaseCosts().get(serviceType.name()) : null;
        if (cost == null) {
            cost = catalog.getBaseCosts().getOrDefault(GENERAL_COST_KEY, 500);
        }
        return cost;
    }

    private static double multiplier(ServiceProvider provider) {
        return provider.getCostMultiplier() != null ? provider.getCostMultiplier() : 1.0;
    }

    private double[] coordinatesFor(String postcode) {
        String area = postcodeArea(postcode);
        List<Double> coordinates = null;
        if (area.length() == 2) {
            coordinates = catalog.getPostcodeAreas().get(area);
            if (coordinates == null) {
                area = area.substring(0, 1);
            }
        }
        if (coordinates == null && !area.isEmpty()) {
            coordinates = catalog.getPostcodeAreas().get(area);
        }
        if (coordinates == null || coordinates.size() < 2) {
            return DEFAULT_COORDINATES;
        }
        return new double[]{coordinates.get(0), coordinates.get(1)};
    }

    /**
     * Leading letters of the outward code: "SW1A 1AA" gives "SW", "M1 1AE" gives "M".
     */
    static String postcodeArea(String postcode) {
        if (postcode == null) {
            return "";
        }
        StringBuilder area = new StringBuilder();
        for (char c : postcode.trim().toUpperCase(Locale.ROOT).toCharArray()) {
            if (!Character.isLetter(c) || area.length() == 2) {
                break;
            }
            area.append(c);
        }
        return area.toString();
    }

    private static double distanceMiles(double[] origin, ServiceProvider provider) {
        if (provider.getLatitude() == null || provider.getLongitude() == null) {
            return Double.MAX_VALUE;
        }
        double lat1 = Math.toRadians(origin[0]);
        double lat2 = Math.toRadians(provider.getLatitude());
        double deltaLat = Math.toRadians(provider.getLatitude() - origin[0]);
        double deltaLon = Math.toRadians(provider.getLongitude() - origin[1]);

        double a = Math.sin(deltaLat / 2) * Math.sin(deltaLat / 2)
                + Math.cos(lat1) * Math.cos(lat2) * Math.sin(deltaLon / 2) * Math.sin(deltaLon / 2);
        double c = 2 * Math.atan2(Math.sqrt(a), Math.sqrt(1 - a));
        return Math.round(EARTH_RADIUS_MILES * c * 10) / 10.0;
    }
}
