package app.lexrecall.core.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.time.Clock;
import java.util.List;

@Configuration
@EnableConfigurationProperties({
        SchedulingProps.class,
        PriorityProps.class,
        BlockProps.class,
        PerformanceProps.class,
        CorsProps.class
})
public class CoreConfig {

    @Bean
    public Clock clock(SchedulingProps props) {
        return Clock.system(props.zoneId());
    }

    @Bean
    public WebMvcConfigurer corsConfigurer(CorsProps props) {
        var origins = (props.origins() == null || props.origins().isEmpty())
                ? List.of("http://localhost:3000", "http://localhost:5173")
                : props.origins();
        return new WebMvcConfigurer() {
            @Override
            public void addCorsMappings(CorsRegistry registry) {
                registry.addMapping("/**")
                        .allowedOrigins(origins.toArray(String[]::new))
                        .allowedMethods("GET", "POST", "PUT", "PATCH", "DELETE", "OPTIONS")
                        .allowedHeaders("*")
                        .exposedHeaders("Content-Type")
                        .maxAge(3600L);
            }
        };
    }
}
