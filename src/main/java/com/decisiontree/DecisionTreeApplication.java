package com.decisiontree;

import com.decisiontree.adapter.spring.EnableDecisionTree;
import com.decisiontree.context.DecisionContext;
import com.decisiontree.engine.DecisionTreeEngine;
import com.decisiontree.engine.DecisionTreeEngineFactory;
import com.decisiontree.example.SampleTrees;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.List;
import java.util.Map;

/**
 * Example Spring Boot application evaluating the sample trees.
 */
@SpringBootApplication
@EnableDecisionTree
public class DecisionTreeApplication {

    private static final Logger log = LoggerFactory.getLogger(DecisionTreeApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(DecisionTreeApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(DecisionTreeEngineFactory engineFactory) {
        return args -> {
            log.info("=== Loan Approval Decision Tree ===");
            DecisionTreeEngine<String> loanEngine = engineFactory.create(SampleTrees.loanApproval());
            log.info("Tree structure:\n{}", loanEngine.describeTree());

            List<Map<String, ?>> loanCases = List.of(
                    Map.of("amount", 50000, "income", 75000, "credit_score", 700),
                    Map.of("amount", 50000, "income", 40000, "credit_score", 700),
                    Map.of("amount", 50000, "income", 75000, "credit_score", 600),
                    Map.of("amount", 150000, "income", 75000, "credit_score", 700));
            run(loanEngine, loanCases);

            log.info("=== Risk Assessment (Multi-Branch) ===");
            DecisionTreeEngine<String> riskEngine = engineFactory.create(SampleTrees.riskAssessment());
            log.info("Tree structure:\n{}", riskEngine.describeTree());

            List<Map<String, ?>> riskCases = List.of(
                    Map.of("credit_score", 780, "debt_ratio", 0.25),
                    Map.of("credit_score", 680, "debt_ratio", 0.4),
                    Map.of("credit_score", 600, "debt_ratio", 0.6),
                    Map.of("credit_score", 500, "debt_ratio", 0.8));
            run(riskEngine, riskCases);
        };
    }

    private static void run(DecisionTreeEngine<String> engine, List<Map<String, ?>> cases) {
        int caseNum = 1;
        for (Map<String, ?> facts : cases) {
            String result = engine.evaluate(DecisionContext.of(facts)).orElse("NO RESULT");
            log.info("Case {}: {} -> {} (path: {})", caseNum++, facts, result, engine.getTrace());
        }
    }
}
