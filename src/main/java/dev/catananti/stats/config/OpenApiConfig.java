package dev.catananti.stats.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration(proxyBeanMethods = false)
public class OpenApiConfig {

    @Value("${app.version:1.0.0}")
    private String appVersion;

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Stats Data Service API")
                        .description("""
                                Cached site analytics for the stats dashboard.
                                
                                ## Features
                                - Site traffic totals and time series per granularity
                                - WordAds earnings
                                - Top lists (posts, referrers, locations, devices, UTM and more)
                                - Chart data with comparison period and point selection
                                
                                Dates are bucketed in the site's reporting time zone.
                                """)
                        .version(appVersion))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Development Server")));
    }
}
