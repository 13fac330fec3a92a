package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

/**
 * {@code rename}: moves {@code sourceFields[i]} to {@code targetFields[i]}. Missing fields are skipped.
 */
public class RenameFieldRuleHandler extends AbstractRowRuleHandler {

    @Override
    public String type() {
        return "rename";
    }

    @Override
    protected void validate(TransformationRule rule) {
        require(!rule.getSourceFields().isEmpty(), "rename rule needs source fields");
        require(rule.getSourceFields().size() == rule.getTargetFields().size(),
                "rename rule needs as many target fields as source fields");
    }

    @Override
    protected void applyToRow(TransformationRule rule, DataRow row, RuleContext context) {
        for (int i = 0; i < rule.getSourceFields().size(); i++) {
            String source = rule.getSourceFields().get(i);
            if (row.has(source)) {
                FieldValue value = row.remove(source);
                row.put(rule.getTargetFields().get(i), value);
            }
        }
    }
}
