package com.example.embeddingindex;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class GateConfig {

    @Bean
    public ConcurrencyGate concurrencyGate(EmbeddingIndexProperties props) {
        ConcurrencyGate gate = new ConcurrencyGate();
        gate.register(props.getGate().getEmbeddingResource(), props.getGate().getEmbeddingMaxConcurrency());
        return gate;
    }
}
