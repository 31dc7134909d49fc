package com.flagship.bookkeeping;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BookkeepingLedgerApplication {

    public static void main(String[] args) {
        SpringApplication.run(BookkeepingLedgerApplication.class, args);
    }
}
