package com.lifelink.backend.global.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.web.exchanges.HttpExchangeRepository;
import org.springframework.boot.actuate.web.exchanges.InMemoryHttpExchangeRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ActuatorConfig {

    /**
     * Backs the admin-only {@code /actuator/httpexchanges} endpoint with a bounded in-memory buffer.
     */
    @Bean
    public HttpExchangeRepository httpExchangeRepository(
            @Value("${lifelink.actuator.http-exchange-capacity:100}") int capacity
    ) {
        InMemoryHttpExchangeRepository repository = new InMemoryHttpExchangeRepository();
        repository.setCapacity(capacity);
        return repository;
    }
}
