package com.prism.service.core.sample;

import com.prism.service.core.ingest.IngestEvent;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic demo dataset: {@code days} UTC days ending today, {@code eventsPerDay} events each. Event ids
 * depend only on the day and slot, so provisioning twice on the same day stores nothing new.
 */
public final class SampleEventGenerator {

    static final List<String> CHANNELS = List.of("Paid Search", "Organic", "Email", "Direct", "Social");
    static final List<String> PRODUCTS = List.of("Denim Jacket", "Classic Tee", "Runner Shoes", "Canvas Tote");
    static final List<String> BRANDS = List.of("Gap", "Old Navy", "PariAI", "Banana Republic");
    static final List<String> CAMPAIGNS =
            List.of("Spring Launch", "Weekend Flash", "Retention Push", "Brand Awareness");

    private final Clock clock;

    public SampleEventGenerator(Clock clock) {
        this.clock = clock;
    }

    public List<IngestEvent> generate(int days, int eventsPerDay) {
        LocalDate today = LocalDate.now(clock.withZone(ZoneOffset.UTC));
        List<IngestEvent> events = new ArrayList<>(days * eventsPerDay);
        for (int dayOffset = 0; dayOffset < days; dayOffset++) {
            LocalDate day = today.minusDays(dayOffset);
            for (int slot = 0; slot < eventsPerDay; slot++) {
                events.add(event(day, slot, dayOffset * eventsPerDay + slot));
            }
        }
        return events;
    }

    private static IngestEvent event(LocalDate day, int slot, int index) {
        String channel = CHANNELS.get(index % CHANNELS.size());
        String product = PRODUCTS.get((index + 1) % PRODUCTS.size());
        String brand = BRANDS.get((index + 3) % BRANDS.size());
        String campaign = CAMPAIGNS.get((index + 2) % CAMPAIGNS.size());

        String eventName = slot % 5 == 0 ? "purchase" : slot % 3 == 0 ? "add_to_cart" : "page_view";
        long revenue = "purchase".equals(eventName) ? 49 + (index % 6) * 18L : 0;
        long netDemand = Math.round(revenue * 0.92);

        Instant timestamp = day.atTime((slot * 2) % 24, (slot * 7) % 60).toInstant(ZoneOffset.UTC);

        Map<String, Object> properties = new LinkedHashMap<>();
        properties.put("channel", channel);
        properties.put("brand", brand);
        properties.put("product", product);
        properties.put("campaign", campaign);
        properties.put("revenue", revenue);
        properties.put("netDemand", netDemand);
        properties.put("country", "Paid Search".equals(channel) || "Direct".equals(channel) ? "US" : "CA");
        properties.put("page", page(product));

        return new IngestEvent(
                "sample-semantic-v3-" + day + "-" + slot,
                eventName,
                timestamp,
                "demo-user-" + (index % 35),
                "demo-session-" + (index % 80),
                properties);
    }

    private static String page(String product) {
        return switch (product) {
            case "Runner Shoes" -> "/products/runner-shoes";
            case "Denim Jacket" -> "/products/denim-jacket";
            default -> "/home";
        };
    }
}
