package com.storefront.anomaly;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class StorefrontAnomalyApplication {

    public static void main(String[] args) {
        SpringApplication.run(StorefrontAnomalyApplication.class, args);
    }
}
