package com.limitbook.engine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@Configuration
@ConfigurationProperties(prefix = "engine")
public class EngineProperties {
    private String defaultAccount = "default";
    private Shard shard = new Shard();
    private Snapshot snapshot = new Snapshot();
    private Risk risk = new Risk();
    private List<Symbol> symbols = new ArrayList<>();

    @Data
    public static class Shard {
        private int count = 4;
        // null: writers wait for the lock as long as it takes
        private Duration lockTimeout;
    }

    @Data
    public static class Snapshot {
        private int depth = 20;
    }

    @Data
    public static class Risk {
        // Absolute position cap per account and symbol; null disables the check
        private Long maxPosition;
    }

    @Data
    public static class Symbol {
        private String name;
        private BigDecimal tickSize = new BigDecimal("0.01");
        // Overrides risk.maxPosition for this symbol
        private Long maxPosition;
    }

    public Symbol findSymbol(String name) {
        return symbols.stream()
                .filter(s -> s.getName().equals(name))
                .findFirst()
                .orElse(null);
    }
}
