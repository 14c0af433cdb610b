package com.decisiontree.condition;

import com.decisiontree.context.DecisionContext;

/**
 * Side effect run when an outcome node is reached.
 * May write to the context or talk to the outside world; the engine neither
 * sequences nor retries it.
 */
@FunctionalInterface
public interface Action {

    void execute(DecisionContext context);
}
