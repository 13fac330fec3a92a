package com.openrangelabs.ingestor.transformation.handler;

import com.openrangelabs.ingestor.exception.TransformationException;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.RuleContext;
import com.openrangelabs.ingestor.transformation.TransformationRule;

import java.util.List;

/**
 * Base for handlers that change rows one at a time and never add or drop rows.
 */
public abstract class AbstractRowRuleHandler implements RuleHandler {

    @Override
    public List<DataRow> apply(TransformationRule rule, List<DataRow> rows, RuleContext context) {
        validate(rule);
        for (DataRow row : rows) {
            context.rowSeen();
            try {
                if (!context.guardAllows(row)) {
                    continue;
                }
                applyToRow(rule, row, context);
                context.recordSuccess();
            } catch (TransformationException e) {
                throw e;
            } catch (RuntimeException e) {
                context.recordFailure(e);
            }
        }
        return rows;
    }

    /**
     * Rule-level configuration check, run once before any row.
     */
    protected void validate(TransformationRule rule) {
    }

    protected abstract void applyToRow(TransformationRule rule, DataRow row, RuleContext context);

    protected static void require(boolean condition, String message) {
        if (!condition) {
            throw new IllegalArgumentException(message);
        }
    }
}
