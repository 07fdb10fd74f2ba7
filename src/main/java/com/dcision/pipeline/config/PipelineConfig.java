package com.dcision.pipeline.config;

import com.dcision.pipeline.engine.DefaultSolverAdapter;
import com.dcision.pipeline.engine.OrToolsSolverBackend;
import com.dcision.pipeline.engine.SolverAdapter;
import com.dcision.pipeline.inference.JsonPayloadExtractor;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        return PipelineJson.objectMapper();
    }

    @Bean
    public JsonPayloadExtractor jsonPayloadExtractor(ObjectMapper objectMapper) {
        return new JsonPayloadExtractor(objectMapper);
    }

    @Bean
    public SolverAdapter solverAdapter(PipelineProperties properties) {
        return new DefaultSolverAdapter(properties.getSolvers().stream()
                .map(OrToolsSolverBackend::from)
                .toList());
    }

    /**
     * Runs whole pipeline runs, one thread per run.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService pipelineExecutor(PipelineProperties properties) {
        return Executors.newFixedThreadPool(properties.getWorkerThreads(),
                new CustomizableThreadFactory("pipeline-"));
    }

    /**
     * Carries the external call of a stage so the run thread can enforce the stage
     * timeout and interrupt the call on cancellation. At most one call per active run.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService stageCallExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("stage-call-"));
    }
}
