package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.List;

public class RemoveFieldRuleHandler extends AbstractRowRuleHandler {

    @Override
    public String type() {
        return "remove";
    }

    @Override
    protected void validate(TransformationRule rule) {
        require(!fieldsOf(rule).isEmpty(), "remove rule needs fields to remove");
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        fieldsOf(rule).forEach(row::remove);
    }

    private static List<String> fieldsOf(TransformationRule rule) {
        return !rule.getSourceFields().isEmpty() ? rule.getSourceFields() : rule.getTargetFields();
    }
}
