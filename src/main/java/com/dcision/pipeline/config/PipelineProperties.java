package com.dcision.pipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /**
     * Retries of a failed stage attempt before the run fails at that stage.
     */
    private int maxRetries = 2;

    /**
     * Data readiness below this score stops the run with InsufficientData.
     */
    private double readinessThreshold = 0.5;

    private Duration inferenceTimeout = Duration.ofSeconds(30);

    private Duration solveTimeout = Duration.ofSeconds(120);

    /**
     * How long a cancel request waits for the in-flight call to stop.
     */
    private Duration cancellationGrace = Duration.ofSeconds(5);

    private int workerThreads = 8;

    /**
     * How long a run stays queryable after submission.
     */
    private Duration runRetention = Duration.ofHours(1);

    private Cache cache = new Cache();

    private Router router = new Router();

    private Models models = new Models();

    private Inference inference = new Inference();

    private List<Region> regions = new ArrayList<>();

    private List<Solver> solvers = defaultSolvers();

    @Data
    public static class Cache {
        private Duration ttl = Duration.ofHours(1);
        private long maxEntries = 10_000;
    }

    @Data
    public static class Router {
        /**
         * Consecutive failures after which a region is taken out of rotation.
         */
        private int failureThreshold = 3;

        private Duration cooldown = Duration.ofSeconds(30);

        // weights of the newest sample in the exponentially decayed estimates
        private double latencyDecay = 0.3;
        private double successDecay = 0.2;
    }

    @Data
    public static class Models {
        private String intent = "anthropic.claude-3-haiku-20240307-v1:0";
        private String dataAnalysis = "anthropic.claude-3-haiku-20240307-v1:0";
        private String modelBuilding = "anthropic.claude-3-5-sonnet-20240620-v1:0";
    }

    @Data
    public static class Inference {
        private int maxTokens = 2000;
        private double temperature = 0.1;
    }

    @Data
    public static class Region {
        private String id;
        private String endpoint;

        /**
         * Model ids this region serves.
         */
        private List<String> models = new ArrayList<>();

        /**
         * Upper bound on in-flight calls; 0 means unlimited.
         */
        private int maxConcurrent = 0;

        private double costPerThousandTokens = 0.0;

        private String apiKey;
    }

    @Data
    public static class Solver {
        private String id;

        /**
         * OR-Tools solver name passed to MPSolver.createSolver, e.g. GLOP, SCIP, CBC.
         */
        private String engine;

        private boolean integerSupport;

        private Duration timeLimit = Duration.ofSeconds(60);

        public static Solver of(String id, String engine, boolean integerSupport) {
            Solver solver = new Solver();
            solver.setId(id);
            solver.setEngine(engine);
            solver.setIntegerSupport(integerSupport);
            return solver;
        }
    }

    private static List<Solver> defaultSolvers() {
        List<Solver> solvers = new ArrayList<>();
        solvers.add(Solver.of("glop", "GLOP", false));
        solvers.add(Solver.of("scip", "SCIP", true));
        solvers.add(Solver.of("cbc", "CBC", true));
        return solvers;
    }
}
