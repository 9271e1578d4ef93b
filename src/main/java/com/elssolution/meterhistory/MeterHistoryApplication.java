package com.elssolution.meterhistory;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class MeterHistoryApplication {

    public static void main(String[] args) {
        SpringApplication.run(MeterHistoryApplication.class, args);
    }

}
