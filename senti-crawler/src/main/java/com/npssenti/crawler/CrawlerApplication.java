package com.npssenti.crawler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.context.WebServerApplicationContext;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.util.ArrayList;
import java.util.List;

@SpringBootApplication
@EnableScheduling
@EnableConfigurationProperties
public class CrawlerApplication {

    public static void main(String[] args) {
        ConfigurableApplicationContext context = SpringApplication.run(CrawlerApplication.class, translateArgs(args));
        if (context instanceof WebServerApplicationContext) {
            // server profile: keep serving
            return;
        }
        System.exit(SpringApplication.exit(context));
    }

    /**
     * Maps the short CLI flags onto Spring properties:
     * --config=FILE, --data-dir=DIR and --log-level=LEVEL.
     */
    static String[] translateArgs(String[] args) {
        List<String> out = new ArrayList<>();
        for (String arg : args) {
            if (arg.startsWith("--config=")) {
                out.add("--spring.config.additional-location=file:" + arg.substring("--config=".length()));
            } else if (arg.startsWith("--data-dir=")) {
                out.add("--crawler.output.data-dir=" + arg.substring("--data-dir=".length()));
            } else if (arg.startsWith("--log-level=")) {
                out.add("--logging.level.com.npssenti=" + arg.substring("--log-level=".length()));
            } else {
                out.add(arg);
            }
        }
        return out.toArray(new String[0]);
    }
}
