package com.flagship.handle_pay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class HandlePayApplication {

    public static void main(String[] args) {
        SpringApplication.run(HandlePayApplication.class, args);
    }
}
