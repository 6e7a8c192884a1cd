package org.cronpulse.ratelimit;

import org.cronpulse.config.XmlConfiguration;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compiled-in integration → limits table, optionally extended from configuration.
 * Unknown integrations resolve to the {@code general} row.
 */
public final class RateLimitDefaults {

    public static final String GENERAL = "general";

    private static final Map<String, String> ALIASES = Map.of(
            "gmail", "mail",
            "email", "mail",
            "homeassistant", "home-automation",
            "home_automation", "home-automation"
    );

    private final Map<String, RateLimitPolicy> table;

    private RateLimitDefaults(Map<String, RateLimitPolicy> table) {
        if (!table.containsKey(GENERAL)) {
            throw new IllegalArgumentException("rate limit table must define '" + GENERAL + "'");
        }
        this.table = Collections.unmodifiableMap(new LinkedHashMap<>(table));
    }

    public static RateLimitDefaults builtIn() {
        Map<String, RateLimitPolicy> t = new LinkedHashMap<>();
        t.put("mail", new RateLimitPolicy(10, 100, false));
        t.put("calendar", new RateLimitPolicy(20, 200, false));
        t.put("weather", new RateLimitPolicy(6, 50, false));
        t.put("home-automation", new RateLimitPolicy(120, 2000, false));
        t.put(GENERAL, new RateLimitPolicy(30, 500, false));
        return new RateLimitDefaults(t);
    }

    public RateLimitDefaults withOverrides(List<XmlConfiguration.IntegrationLimit> limits) {
        if (limits == null || limits.isEmpty()) return this;
        Map<String, RateLimitPolicy> t = new LinkedHashMap<>(table);
        for (XmlConfiguration.IntegrationLimit l : limits) {
            if (l == null || l.name == null || l.name.isBlank()) {
                throw new IllegalArgumentException("rateLimits/integration entries need a name");
            }
            t.put(normalize(l.name), new RateLimitPolicy(l.maxCallsPerHour, l.maxCallsPerDay, l.failClosed));
        }
        return new RateLimitDefaults(t);
    }

    /** Lower-cased canonical name; blank means {@code general}. */
    public static String normalize(String integration) {
        if (integration == null || integration.isBlank()) return GENERAL;
        String key = integration.trim().toLowerCase(Locale.ROOT);
        return ALIASES.getOrDefault(key, key);
    }

    public RateLimitPolicy forIntegration(String integration) {
        RateLimitPolicy policy = table.get(normalize(integration));
        return policy != null ? policy : table.get(GENERAL);
    }

    public Map<String, RateLimitPolicy> table() {
        return table;
    }
}
