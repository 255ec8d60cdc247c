package com.crypto.connector;

import com.crypto.connector.common.properties.AppProperties;
import com.crypto.connector.repl.ReplRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ExchangeConnectorApplication implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(ExchangeConnectorApplication.class);
    private final ReplRunner replRunner;
    private final AppProperties appProperties;

    public ExchangeConnectorApplication(ReplRunner replRunner, AppProperties appProperties) {
        this.replRunner = replRunner;
        this.appProperties = appProperties;
    }

    public static void main(String[] args) {
        SpringApplication.run(ExchangeConnectorApplication.class, args);
    }

    @Override
    public void run(String... args) {
        if (!appProperties.getRepl().isEnabled()) {
            log.info("REPL disabled");
            return;
        }
        try {
            replRunner.run();
        } catch (Exception e) {
            log.error("Startup failed: {}", e.getMessage());
            System.err.println("Startup failed: " + e.getMessage());
        }
    }
}
