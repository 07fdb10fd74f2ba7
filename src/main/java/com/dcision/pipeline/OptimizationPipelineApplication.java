package com.dcision.pipeline;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class OptimizationPipelineApplication {

    public static void main(String[] args) {
        SpringApplication.run(OptimizationPipelineApplication.class, args);
    }
}
