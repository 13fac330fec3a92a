package com.openrangelabs.ingestor.transformation;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.model.FieldValue;
import org.springframework.expression.EvaluationException;
import org.springframework.expression.Expression;
import org.springframework.expression.ExpressionParser;
import org.springframework.expression.ParseException;
import org.springframework.expression.spel.standard.SpelExpressionParser;
import org.springframework.expression.spel.support.SimpleEvaluationContext;

/**
 * Evaluates rule expressions with SpEL.
 *
 * <p>Every row field is bound as a variable ({@code #price * #quantity}); characters that are
 * not legal in a SpEL identifier are replaced by underscores. The evaluation context is the
 * restricted {@link SimpleEvaluationContext}: no type references, constructors or bean access.
 * Parsed expressions are cached up to a fixed number of distinct expression strings.
 */
public class ExpressionEvaluator {

    static final int DEFAULT_CACHE_SIZE = 1024;

    private final ExpressionParser parser = new SpelExpressionParser();
    private final Cache<String, Expression> cache;

    public ExpressionEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    ExpressionEvaluator(int maxCachedExpressions) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxCachedExpressions)
                .executor(Runnable::run)
                .build();
    }

    public FieldValue evaluate(String expression, DataRow row) {
        Object result = compile(expression).getValue(contextFor(row));
        return FieldValue.from(result);
    }

    public boolean evaluateCondition(String expression, DataRow row) {
        Boolean result = compile(expression).getValue(contextFor(row), Boolean.class);
        return Boolean.TRUE.equals(result);
    }

    private Expression compile(String expression) {
        try {
            return cache.get(expression, parser::parseExpression);
        } catch (ParseException e) {
            throw new EvaluationException("Invalid expression '" + expression + "': " + e.getMessage(), e);
        }
    }

    private SimpleEvaluationContext contextFor(DataRow row) {
        SimpleEvaluationContext context = SimpleEvaluationContext.forReadOnlyDataBinding()
                .withInstanceMethods()
                .build();
        row.asMap().forEach((name, value) -> context.setVariable(variableName(name), value.toJavaObject()));
        return context;
    }

    long cachedExpressionCount() {
        cache.cleanUp();
        return cache.estimatedSize();
    }

    static String variableName(String fieldName) {
        StringBuilder name = new StringBuilder(fieldName.length());
        for (int i = 0; i < fieldName.length(); i++) {
            char c = fieldName.charAt(i);
            boolean legal = i == 0 ? Character.isJavaIdentifierStart(c) : Character.isJavaIdentifierPart(c);
            name.append(legal && c != '$' ? c : '_');
        }
        return name.toString();
    }
}
