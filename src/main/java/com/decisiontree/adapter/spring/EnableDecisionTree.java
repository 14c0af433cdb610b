package com.decisiontree.adapter.spring;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enable the decision tree engine in a Spring Boot application.
 *
 * Usage:
 * <pre>
 * &#64;SpringBootApplication
 * &#64;EnableDecisionTree
 * public class MyApplication {
 *     public static void main(String[] args) {
 *         SpringApplication.run(MyApplication.class, args);
 *     }
 * }
 * </pre>
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(DecisionTreeAutoConfiguration.class)
public @interface EnableDecisionTree {
}
