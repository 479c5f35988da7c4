package com.tabulator.config;

import com.tabulator.model.Division;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumMap;
import java.util.Map;

/**
 * Tabulation runtime settings bound from {@code tabulator.*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "tabulator")
public class TabulatorProperties {

    private Admin admin = new Admin();
    private Titles titles = new Titles();
    private Export export = new Export();
    private Activity activity = new Activity();

    @Getter
    @Setter
    public static class Admin {
        /**
         * Shared secret expected in the admin header on /api/admin routes.
         */
        private String token = "local-dev-admin";
        private String headerName = "X-Admin-Token";
    }

    @Getter
    @Setter
    public static class Titles {
        private String defaultTitleholder = "Winner";
        private Map<Division, String> titleholders = new EnumMap<>(Division.class);

        public String titleholderFor(Division division) {
            return titleholders.getOrDefault(division, defaultTitleholder);
        }
    }

    @Getter
    @Setter
    public static class Export {
        private char columnSeparator = ',';
        private boolean quoteAllValues = true;
    }

    @Getter
    @Setter
    public static class Activity {
        private int defaultLimit = 50;
        private int maxLimit = 200;
    }
}
