package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.exception.TransformationException;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.RuleCondition;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code filter}: drops the rows that match the predicate.
 *
 * <p>The predicate is {@code sourceFields[0] <operator> parameters.value} (operator defaults to
 * {@code eq}); in that form the rule condition still acts as a guard. Without a value parameter
 * the condition itself, or else the expression, is the predicate.
 */
public class FilterRuleHandler implements RuleHandler {

    @Override
    public String type() {
        return "filter";
    }

    @Override
    public List<DataRow> apply(TransformationRule rule, List<DataRow> rows, RuleContext context) {
        RuleCondition fieldPredicate = fieldPredicate(rule);
        boolean hasExpression = rule.getExpression() != null && !rule.getExpression().isBlank();
        boolean hasCondition = rule.getCondition() != null && !rule.getCondition().isBlank();
        if (fieldPredicate == null && !hasCondition && !hasExpression) {
            throw new IllegalArgumentException("filter rule needs a field comparison, a condition or an expression");
        }

        List<DataRow> kept = new ArrayList<>(rows.size());
        for (DataRow row : rows) {
            context.rowSeen();
            try {
                boolean exclude;
                if (fieldPredicate != null) {
                    exclude = context.guardAllows(row) && fieldPredicate.test(row);
                } else if (hasCondition) {
                    exclude = context.guardAllows(row);
                } else {
                    exclude = context.expressions().evaluateCondition(rule.getExpression(), row);
                }
                if (!exclude) {
                    kept.add(row);
                }
                context.recordSuccess();
            } catch (TransformationException e) {
                throw e;
            } catch (RuntimeException e) {
                kept.add(row);
                context.recordFailure(e);
            }
        }
        return kept;
    }

    private static RuleCondition fieldPredicate(TransformationRule rule) {
        String field = rule.firstSourceField();
        if (field == null || rule.getParameters() == null) {
            return null;
        }
        String operator = rule.parameter("operator", "eq");
        boolean unary = operator.equalsIgnoreCase("exists") || operator.equalsIgnoreCase("notexists");
        if (!unary && !rule.getParameters().containsKey("value")) {
            return null;
        }
        return RuleCondition.of(field, operator, rule.getParameters().get("value"));
    }
}
