package com.decisiontree.example;

import com.decisiontree.condition.Action;
import com.decisiontree.condition.Conditions;
import com.decisiontree.node.DecisionNode;
import com.decisiontree.node.MultiBranchNode;
import com.decisiontree.node.Node;
import com.decisiontree.node.OutcomeNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Sample trees used by the demo application and the tests.
 */
public final class SampleTrees {

    private static final Logger log = LoggerFactory.getLogger(SampleTrees.class);

    public static final String APPROVED = "APPROVED";
    public static final String DENIED_INCOME = "DENIED - Insufficient Income";
    public static final String DENIED_CREDIT = "DENIED - Low Credit Score";
    public static final String MANUAL_REVIEW = "MANUAL REVIEW REQUIRED";

    public static final String LOW_RISK = "LOW RISK";
    public static final String MEDIUM_RISK = "MEDIUM RISK";
    public static final String HIGH_RISK = "HIGH RISK";
    public static final String CRITICAL_RISK = "CRITICAL RISK";

    private SampleTrees() {
    }

    /**
     * Loan approval tree whose approval logs the approved amount.
     */
    public static Node<String> loanApproval() {
        return loanApproval(ctx -> log.info("Loan approved for ${}", ctx.getLong("amount", 0)));
    }

    /**
     * Loan approval tree.
     * <pre>
     * amount &lt;= 100000 ? (income &gt;= 50000 ? (credit_score &gt;= 650 ? APPROVED : DENIED credit)
     *                                      : DENIED income)
     *                  : MANUAL REVIEW
     * </pre>
     * Missing facts read as 0.
     *
     * @param onApproved Action run when the loan is approved
     */
    public static Node<String> loanApproval(Action onApproved) {
        OutcomeNode<String> approved = new OutcomeNode<>(APPROVED, onApproved);
        OutcomeNode<String> deniedIncome = new OutcomeNode<>(DENIED_INCOME);
        OutcomeNode<String> deniedCredit = new OutcomeNode<>(DENIED_CREDIT);
        OutcomeNode<String> manualReview = new OutcomeNode<>(MANUAL_REVIEW);

        DecisionNode<String> creditCheck = new DecisionNode<>(
                "Credit Score Check",
                ctx -> ctx.getInt("credit_score", 0) >= 650,
                approved,
                deniedCredit);

        DecisionNode<String> incomeCheck = new DecisionNode<>(
                "Income Check",
                ctx -> ctx.getLong("income", 0) >= 50000,
                creditCheck,
                deniedIncome);

        return new DecisionNode<>(
                "Loan Amount Check",
                ctx -> ctx.getLong("amount", 0) <= 100000,
                incomeCheck,
                manualReview);
    }

    /**
     * Risk assessment over credit score and debt ratio; anything below a
     * 550 score is critical.
     */
    public static Node<String> riskAssessment() {
        return new MultiBranchNode<String>("Risk Level")
                .addBranch(Conditions.and(
                                Conditions.greaterThanOrEquals("credit_score", 750),
                                Conditions.lessThan("debt_ratio", 0.3)),
                        new OutcomeNode<>(LOW_RISK))
                .addBranch(Conditions.and(
                                Conditions.greaterThanOrEquals("credit_score", 650),
                                Conditions.lessThan("debt_ratio", 0.5)),
                        new OutcomeNode<>(MEDIUM_RISK))
                .addBranch(Conditions.greaterThanOrEquals("credit_score", 550),
                        new OutcomeNode<>(HIGH_RISK))
                .setDefault(new OutcomeNode<>(CRITICAL_RISK));
    }
}
