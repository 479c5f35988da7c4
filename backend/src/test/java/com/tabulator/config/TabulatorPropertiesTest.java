package com.tabulator.config;

import com.tabulator.model.Division;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TabulatorPropertiesTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(ConfigurationPropertiesAutoConfiguration.class))
            .withUserConfiguration(PropertiesConfiguration.class);

    @Test
    void bindsDefaultValues() {
        contextRunner.run(context -> {
            TabulatorProperties properties = context.getBean(TabulatorProperties.class);

            assertEquals("local-dev-admin", properties.getAdmin().getToken());
            assertEquals("X-Admin-Token", properties.getAdmin().getHeaderName());
            assertEquals("Winner", properties.getTitles().titleholderFor(Division.FEMALE));
            assertEquals(',', properties.getExport().getColumnSeparator());
            assertTrue(properties.getExport().isQuoteAllValues());
            assertEquals(50, properties.getActivity().getDefaultLimit());
            assertEquals(200, properties.getActivity().getMaxLimit());
        });
    }

    @Test
    void bindsOverridesFromEnvironment() {
        contextRunner
                .withPropertyValues(
                        "tabulator.admin.token=board-secret",
                        "tabulator.admin.header-name=X-Board-Token",
                        "tabulator.titles.default-titleholder=Champion",
                        "tabulator.titles.titleholders.MALE=Mister Campus",
                        "tabulator.export.column-separator=;",
                        "tabulator.export.quote-all-values=false",
                        "tabulator.activity.max-limit=75"
                )
                .run(context -> {
                    TabulatorProperties properties = context.getBean(TabulatorProperties.class);

                    assertEquals("board-secret", properties.getAdmin().getToken());
                    assertEquals("X-Board-Token", properties.getAdmin().getHeaderName());
                    assertEquals("Mister Campus", properties.getTitles().titleholderFor(Division.MALE));
                    assertEquals("Champion", properties.getTitles().titleholderFor(Division.FEMALE));
                    assertEquals(';', properties.getExport().getColumnSeparator());
                    assertFalse(properties.getExport().isQuoteAllValues());
                    assertEquals(75, properties.getActivity().getMaxLimit());
                });
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(TabulatorProperties.class)
    static class PropertiesConfiguration {
    }
}
