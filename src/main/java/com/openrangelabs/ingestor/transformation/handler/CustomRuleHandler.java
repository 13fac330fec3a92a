package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.CustomRuleFunction;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.Optional;

/**
 * {@code custom}: runs the {@link CustomRuleFunction} named by the {@code function} parameter,
 * or evaluates the expression into the first target field when no function is registered.
 */
public class CustomRuleHandler extends AbstractRowRuleHandler {

    @Override
    public String type() {
        return "custom";
    }

    @Override
    protected void validate(TransformationRule rule) {
        require(rule.parameter("function") != null || hasExpression(rule),
                "custom rule needs a 'function' parameter or an expression");
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        String name = rule.parameter("function");
        Optional<CustomRuleFunction> function = name == null ? Optional.empty() : context.customFunction(name);
        if (function.isPresent()) {
            function.get().apply(rule, row);
            return;
        }
        if (!hasExpression(rule)) {
            throw new IllegalArgumentException("No custom rule function registered as '" + name + "'");
        }
        String target = rule.firstTargetField();
        if (target == null) {
            throw new IllegalArgumentException("custom expression rule needs a target field");
        }
        row.put(target, context.expressions().evaluate(rule.getExpression(), row));
    }

    private static boolean hasExpression(TransformationRule rule) {
        return rule.getExpression() != null && !rule.getExpression().isBlank();
    }
}
