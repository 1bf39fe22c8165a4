package com.npssenti.crawler.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;

@Configuration
public class CrawlerConfiguration {

    /** JSON APIs (GDELT, YouTube Data API) */
    @Bean
    public RestTemplate restTemplate(RestTemplateBuilder builder, CrawlerProperties properties) {
        Duration timeout = Duration.ofSeconds(properties.getLimits().getRequestTimeoutSec());
        return builder
                .setConnectTimeout(timeout)
                .setReadTimeout(timeout)
                .defaultHeader("User-Agent", properties.getUserAgent())
                .build();
    }

    /** Page, listing and robots.txt fetches */
    @Bean
    public HttpClient crawlHttpClient(CrawlerProperties properties) {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(properties.getLimits().getRequestTimeoutSec()))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
