package com.prudhvi.vlm_relay;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class VlmRelayApplication {

    public static void main(String[] args) {
        SpringApplication.run(VlmRelayApplication.class, args);
    }
}
