package jump.email.watch.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

@Configuration
public class ClientConfig {

    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, WatchProperties properties) {
        return builder
            .setConnectTimeout(properties.getProvider().getConnectTimeout())
            .setReadTimeout(properties.getProvider().getReadTimeout())
            .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
