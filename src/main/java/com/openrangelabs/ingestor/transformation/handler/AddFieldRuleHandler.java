package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

/**
 * {@code add}: sets every target field to {@code parameters.value} or to the expression result.
 */
public class AddFieldRuleHandler extends AbstractRowRuleHandler {

    @Override
    public String type() {
        return "add";
    }

    @Override
    protected void validate(TransformationRule rule) {
        require(!rule.getTargetFields().isEmpty(), "add rule needs at least one target field");
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        FieldValue value = rule.getExpression() != null && !rule.getExpression().isBlank()
                ? context.expressions().evaluate(rule.getExpression(), row)
                : FieldValue.from(rule.getParameters().get("value"));
        for (String target : rule.getTargetFields()) {
            row.put(target, value);
        }
    }
}
