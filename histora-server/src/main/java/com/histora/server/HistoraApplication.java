package com.histora.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.transaction.annotation.EnableTransactionManagement;

@EnableScheduling
@EnableTransactionManagement
@Slf4j
@SpringBootApplication(scanBasePackages = {"com.histora"})
public class HistoraApplication {

    public static void main(String[] args) {
        long maxMemory = Runtime.getRuntime().maxMemory();
        log.info("Max memory: {} MB", maxMemory / 1_048_576L);
        SpringApplication.run(HistoraApplication.class, args);
    }
}
