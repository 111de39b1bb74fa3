package com.example.werewolf;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@ConfigurationPropertiesScan
@SpringBootApplication
public class WerewolfGmApplication {

    public static void main(String[] args) {
        SpringApplication.run(WerewolfGmApplication.class, args);
    }
}
