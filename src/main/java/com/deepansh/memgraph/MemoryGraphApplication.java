package com.deepansh.memgraph;

import com.deepansh.memgraph.config.MemoryProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(MemoryProperties.class)
public class MemoryGraphApplication {
    public static void main(String[] args) {
        SpringApplication.run(MemoryGraphApplication.class, args);
    }
}
