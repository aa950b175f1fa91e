package fpt.com.clinicbooking.common.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.StringUtils;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Cross-origin access to the REST API; values come from {@code app.cors.*}.
 */
@Configuration
public class CorsConfig implements WebMvcConfigurer {

    private final String[] allowedOrigins;
    private final String[] allowedMethods;
    private final String[] allowedHeaders;
    private final boolean allowCredentials;

    public CorsConfig(@Value("${app.cors.allowed-origins:*}") String allowedOrigins,
                      @Value("${app.cors.allowed-methods:GET,POST,PUT,PATCH,DELETE,OPTIONS}") String allowedMethods,
                      @Value("${app.cors.allowed-headers:*}") String allowedHeaders,
                      @Value("${app.cors.allow-credentials:true}") boolean allowCredentials) {
        this.allowedOrigins = StringUtils.tokenizeToStringArray(allowedOrigins, ",");
        this.allowedMethods = StringUtils.tokenizeToStringArray(allowedMethods, ",");
        this.allowedHeaders = StringUtils.tokenizeToStringArray(allowedHeaders, ",");
        this.allowCredentials = allowCredentials;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOriginPatterns(allowedOrigins)
                .allowedMethods(allowedMethods)
                .allowedHeaders(allowedHeaders)
                .allowCredentials(allowCredentials)
                .maxAge(3600);
    }
}
