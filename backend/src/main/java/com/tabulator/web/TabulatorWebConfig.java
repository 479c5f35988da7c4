package com.tabulator.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tabulator.config.TabulatorProperties;
import com.tabulator.model.Division;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.format.FormatterRegistry;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@EnableConfigurationProperties(TabulatorProperties.class)
public class TabulatorWebConfig implements WebMvcConfigurer {

    private final TabulatorProperties tabulatorProperties;
    private final ObjectMapper objectMapper;

    public TabulatorWebConfig(TabulatorProperties tabulatorProperties, ObjectMapper objectMapper) {
        this.tabulatorProperties = tabulatorProperties;
        this.objectMapper = objectMapper;
    }

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new AdminAccessInterceptor(tabulatorProperties, objectMapper))
                .addPathPatterns("/api/admin/**");
    }

    @Override
    public void addFormatters(FormatterRegistry registry) {
        registry.addConverter(new DivisionConverter());
    }

    static class DivisionConverter implements Converter<String, Division> {
        @Override
        public Division convert(String source) {
            return Division.fromValue(source);
        }
    }
}
