package org.cronpulse.ratelimit;

import org.cronpulse.config.XmlConfiguration;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RateLimitDefaultsTest {

    @Test
    void builtIn_shouldCarryDocumentedDefaults() {
        RateLimitDefaults defaults = RateLimitDefaults.builtIn();
        assertEquals(new RateLimitPolicy(10, 100, false), defaults.forIntegration("mail"));
        assertEquals(new RateLimitPolicy(20, 200, false), defaults.forIntegration("calendar"));
        assertEquals(new RateLimitPolicy(6, 50, false), defaults.forIntegration("weather"));
        assertEquals(new RateLimitPolicy(120, 2000, false), defaults.forIntegration("home-automation"));
        assertEquals(new RateLimitPolicy(30, 500, false), defaults.forIntegration("general"));
    }

    @Test
    void normalize_shouldLowerCaseAndResolveAliases() {
        assertEquals("mail", RateLimitDefaults.normalize(" GMAIL "));
        assertEquals("home-automation", RateLimitDefaults.normalize("homeassistant"));
        assertEquals("general", RateLimitDefaults.normalize(null));
        assertEquals("general", RateLimitDefaults.normalize("  "));
        assertEquals("crm", RateLimitDefaults.normalize("CRM"));
    }

    @Test
    void withOverrides_shouldReplaceAndExtendRows() {
        XmlConfiguration.IntegrationLimit crm = new XmlConfiguration.IntegrationLimit();
        crm.name = "CRM";
        crm.maxCallsPerHour = 40;
        crm.maxCallsPerDay = 400;
        XmlConfiguration.IntegrationLimit mail = new XmlConfiguration.IntegrationLimit();
        mail.name = "gmail";
        mail.maxCallsPerHour = 1;
        mail.maxCallsPerDay = 2;
        mail.failClosed = true;

        RateLimitDefaults defaults = RateLimitDefaults.builtIn().withOverrides(List.of(crm, mail));

        assertEquals(new RateLimitPolicy(40, 400, false), defaults.forIntegration("crm"));
        assertEquals(new RateLimitPolicy(1, 2, true), defaults.forIntegration("mail"));
        assertTrue(defaults.table().containsKey("weather"));
    }

    @Test
    void withOverrides_shouldRejectUnnamedEntry() {
        XmlConfiguration.IntegrationLimit unnamed = new XmlConfiguration.IntegrationLimit();
        assertThrows(IllegalArgumentException.class, () -> RateLimitDefaults.builtIn().withOverrides(List.of(unnamed)));
    }
}
