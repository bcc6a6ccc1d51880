package com.prudhvi.vlm_relay.config;

import com.prudhvi.vlm_relay.event.FieldAliasTable;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared infrastructure beans for the relay core.
 */
@Configuration
public class RelayConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FieldAliasTable fieldAliasTable() {
        return FieldAliasTable.defaults();
    }
}
