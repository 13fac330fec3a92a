package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.List;

/**
 * Applies one rule type to the working row set.
 */
public interface RuleHandler {

    /**
     * Rule type this handler serves, lower case.
     */
    String type();

    /**
     * Returns the row set after the rule. Row-level handlers mutate and return the same list;
     * filter, aggregate and join build a new one.
     *
     * @throws IllegalArgumentException if the rule is misconfigured; this fails the whole rule
     */
    List<DataRow> apply(TransformationRule rule, List<DataRow> rows, RuleContext context);
}
