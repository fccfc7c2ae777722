package com.example.bondspread;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;

/**
 * Ядро аналитики спредов доходности облигаций
 */
@Slf4j
@SpringBootApplication
public class BondSpreadApplication {

    public static void main(String[] args) {
        SpringApplication.run(BondSpreadApplication.class, args);
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        log.info("🚀 Аналитика спредов облигаций готова к работе!");
    }
}
