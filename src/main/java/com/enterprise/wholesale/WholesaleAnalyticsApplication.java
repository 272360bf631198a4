package com.enterprise.wholesale;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class WholesaleAnalyticsApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(WholesaleAnalyticsApplication.class, args)));
    }
}
