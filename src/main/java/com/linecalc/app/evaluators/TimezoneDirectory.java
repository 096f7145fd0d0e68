package com.linecalc.app.evaluators;

import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves city names and common zone abbreviations to zone IDs.
 * Falls back to region IDs such as "Europe/Paris".
 */
public final class TimezoneDirectory {

    private static final Map<String, String> CITIES = new HashMap<>();
    private static final Map<String, String> ABBREVIATIONS = new HashMap<>();

    static {
        // North America
        CITIES.put("seattle", "America/Los_Angeles");
        CITIES.put("los angeles", "America/Los_Angeles");
        CITIES.put("la", "America/Los_Angeles");
        CITIES.put("san francisco", "America/Los_Angeles");
        CITIES.put("sf", "America/Los_Angeles");
        CITIES.put("portland", "America/Los_Angeles");
        CITIES.put("vancouver", "America/Vancouver");
        CITIES.put("denver", "America/Denver");
        CITIES.put("phoenix", "America/Phoenix");
        CITIES.put("chicago", "America/Chicago");
        CITIES.put("dallas", "America/Chicago");
        CITIES.put("houston", "America/Chicago");
        CITIES.put("austin", "America/Chicago");
        CITIES.put("new york", "America/New_York");
        CITIES.put("nyc", "America/New_York");
        CITIES.put("boston", "America/New_York");
        CITIES.put("miami", "America/New_York");
        CITIES.put("atlanta", "America/New_York");
        CITIES.put("washington", "America/New_York");
        CITIES.put("toronto", "America/Toronto");
        CITIES.put("montreal", "America/Montreal");
        CITIES.put("anchorage", "America/Anchorage");
        CITIES.put("honolulu", "Pacific/Honolulu");
        // Europe
        CITIES.put("london", "Europe/London");
        CITIES.put("paris", "Europe/Paris");
        CITIES.put("berlin", "Europe/Berlin");
        CITIES.put("amsterdam", "Europe/Amsterdam");
        CITIES.put("rome", "Europe/Rome");
        CITIES.put("madrid", "Europe/Madrid");
        CITIES.put("vienna", "Europe/Vienna");
        CITIES.put("zurich", "Europe/Zurich");
        CITIES.put("stockholm", "Europe/Stockholm");
        CITIES.put("warsaw", "Europe/Warsaw");
        CITIES.put("prague", "Europe/Prague");
        CITIES.put("athens", "Europe/Athens");
        CITIES.put("istanbul", "Europe/Istanbul");
        CITIES.put("moscow", "Europe/Moscow");
        CITIES.put("kiev", "Europe/Kiev");
        CITIES.put("kyiv", "Europe/Kiev");
        // Asia / Pacific
        CITIES.put("tokyo", "Asia/Tokyo");
        CITIES.put("seoul", "Asia/Seoul");
        CITIES.put("beijing", "Asia/Shanghai");
        CITIES.put("shanghai", "Asia/Shanghai");
        CITIES.put("hong kong", "Asia/Hong_Kong");
        CITIES.put("singapore", "Asia/Singapore");
        CITIES.put("bangkok", "Asia/Bangkok");
        CITIES.put("mumbai", "Asia/Kolkata");
        CITIES.put("delhi", "Asia/Kolkata");
        CITIES.put("dubai", "Asia/Dubai");
        CITIES.put("tel aviv", "Asia/Jerusalem");
        CITIES.put("sydney", "Australia/Sydney");
        CITIES.put("melbourne", "Australia/Melbourne");
        CITIES.put("perth", "Australia/Perth");
        CITIES.put("auckland", "Pacific/Auckland");
        // South America / Africa
        CITIES.put("sao paulo", "America/Sao_Paulo");
        CITIES.put("buenos aires", "America/Argentina/Buenos_Aires");
        CITIES.put("cairo", "Africa/Cairo");
        CITIES.put("johannesburg", "Africa/Johannesburg");
        CITIES.put("nairobi", "Africa/Nairobi");

        ABBREVIATIONS.put("pst", "America/Los_Angeles");
        ABBREVIATIONS.put("pdt", "America/Los_Angeles");
        ABBREVIATIONS.put("mst", "America/Denver");
        ABBREVIATIONS.put("mdt", "America/Denver");
        ABBREVIATIONS.put("cst", "America/Chicago");
        ABBREVIATIONS.put("cdt", "America/Chicago");
        ABBREVIATIONS.put("est", "America/New_York");
        ABBREVIATIONS.put("edt", "America/New_York");
        ABBREVIATIONS.put("utc", "UTC");
        ABBREVIATIONS.put("gmt", "UTC");
        ABBREVIATIONS.put("bst", "Europe/London");
        ABBREVIATIONS.put("cet", "Europe/Paris");
        ABBREVIATIONS.put("cest", "Europe/Paris");
        ABBREVIATIONS.put("eet", "Europe/Kiev");
        ABBREVIATIONS.put("eest", "Europe/Kiev");
        ABBREVIATIONS.put("msk", "Europe/Moscow");
        ABBREVIATIONS.put("jst", "Asia/Tokyo");
        ABBREVIATIONS.put("kst", "Asia/Seoul");
        ABBREVIATIONS.put("ist", "Asia/Kolkata");
        ABBREVIATIONS.put("aest", "Australia/Sydney");
        ABBREVIATIONS.put("aedt", "Australia/Sydney");
        ABBREVIATIONS.put("nzst", "Pacific/Auckland");
        ABBREVIATIONS.put("nzdt", "Pacific/Auckland");
    }

    private TimezoneDirectory() {
    }

    public static Optional<ZoneId> lookup(String name) {
        String trimmed = name.trim();
        String key = trimmed.toLowerCase(Locale.ROOT);
        String id = CITIES.get(key);
        if (id == null) {
            id = ABBREVIATIONS.get(key);
        }
        if (id != null) {
            return Optional.of(ZoneId.of(id));
        }
        if (!trimmed.contains("/") && !trimmed.startsWith("GMT") && !trimmed.startsWith("UTC")) {
            return Optional.empty();
        }
        try {
            return Optional.of(ZoneId.of(trimmed));
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    public static boolean isAbbreviation(String token) {
        return ABBREVIATIONS.containsKey(token.toLowerCase(Locale.ROOT));
    }
}
