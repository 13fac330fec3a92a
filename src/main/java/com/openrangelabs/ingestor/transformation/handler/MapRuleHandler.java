package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

/**
 * {@code map}: copies source fields onto target fields pairwise, or assigns the result of
 * the rule expression to the first target field.
 */
public class MapRuleHandler extends AbstractRowRuleHandler {

    @Override
    public String type() {
        return "map";
    }

    @Override
    protected void validate(TransformationRule rule) {
        require(!rule.getTargetFields().isEmpty(), "map rule needs at least one target field");
        require(hasExpression(rule) || !rule.getSourceFields().isEmpty(),
                "map rule needs source fields or an expression");
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        if (hasExpression(rule)) {
            row.put(rule.firstTargetField(), context.expressions().evaluate(rule.getExpression(), row));
            return;
        }
        int pairs = Math.min(rule.getSourceFields().size(), rule.getTargetFields().size());
        for (int i = 0; i < pairs; i++) {
            String source = rule.getSourceFields().get(i);
            if (row.has(source)) {
                row.put(rule.getTargetFields().get(i), row.get(source));
            }
        }
    }

    private static boolean hasExpression(TransformationRule rule) {
        return rule.getExpression() != null && !rule.getExpression().isBlank();
    }
}
