package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.model.DataRow;

/**
 * Extension point for {@code custom} rules. Implementations are picked up as Spring beans
 * and selected by {@link #name()} through the rule's {@code function} parameter.
 */
public interface CustomRuleFunction {

    String name();

    /**
     * Mutates {@code row} in place.
     */
    void apply(TransformationRule rule, DataRow row);
}
