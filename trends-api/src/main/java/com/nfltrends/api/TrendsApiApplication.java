package com.nfltrends.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import com.nfltrends.api.config.TrendsCacheProperties;

@SpringBootApplication
@EnableConfigurationProperties(TrendsCacheProperties.class)
public class TrendsApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(TrendsApiApplication.class, args);
    }
}
