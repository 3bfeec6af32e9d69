package com.linlay.blockstream;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class BlockStreamApplication {

    public static void main(String[] args) {
        SpringApplication.run(BlockStreamApplication.class, args);
    }
}
