package com.dcision.pipeline.stage;

/**
 * Prompt texts of the inference stages. Bump {@link #VERSION} whenever a template
 * changes so cached outputs of the old wording are not reused.
 */
final class PromptTemplates {

    static final String VERSION = "3";

    private PromptTemplates() {
    }

    static final String INTENT = """
            Classify the following decision problem stated in natural language.

            Problem:
            %s

            Caller hints:
            %s

            Determine:
            1. intent_label: what is being decided, e.g. production_planning, resource_allocation,
               supply_chain_optimization, scheduling, portfolio_selection
            2. industry_label: the industry the problem comes from
            3. complexity: low, medium or high
            4. confidence: your confidence in this classification, between 0.0 and 1.0
            5. entities: the quantities, resources and limits mentioned in the text
            6. optimization_type: linear_programming, mixed_integer_programming or integer_programming
            7. solver_capability_requirements: solver ids able to solve it, primary first.
               Available solvers: %s. Integer or binary decisions need an integer-capable solver.

            Respond with a single JSON object only.
            """;

    static final String DATA_ANALYSIS = """
            Assess whether the problem below contains enough data to formulate an optimization model.

            Problem:
            %s

            Classified intent:
            %s

            Determine:
            1. readiness_score: between 0.0 (nothing usable) and 1.0 (every coefficient and limit known)
            2. entity_count: number of distinct data entities found
            3. data_quality: low, medium or high
            4. missing_data: items that would have to be assumed or requested
            5. recommendations: how to complete the data

            Respond with a single JSON object only.
            """;

    static final String MODEL_BUILDING = """
            Formulate a mathematical optimization model for the problem below.

            Problem:
            %s

            Classified intent:
            %s

            Data assessment:
            %s

            Rules:
            - Declare every decision variable with a name, a kind (continuous, integer or binary)
              and its bounds. Use names like x1, x2 that are valid identifiers.
            - Write every constraint as one linear relation using <=, >= or =,
              e.g. "x1 + x2 >= 800". Use * for products of a number and a variable.
            - The objective has a direction (minimize or maximize) and a linear expression.
            - Use every declared variable in at least one constraint or in the objective.
            - Explain the formulation step by step in reasoning_trace.

            Respond with a single JSON object only.
            """;
}
