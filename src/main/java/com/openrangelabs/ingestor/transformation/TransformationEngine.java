package com.openrangelabs.ingestor.transformation;

import com.openrangelabs.ingestor.connector.CancellationSignal;
import com.openrangelabs.ingestor.exception.OperationCancelledException;
import com.openrangelabs.ingestor.extraction.FailureReason;
import com.openrangelabs.ingestor.model.DataRow;
import com.openrangelabs.ingestor.transformation.handler.AddFieldRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.AggregateRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.CustomRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.FilterRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.FormatRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.JoinRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.MapRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.RemoveFieldRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.RenameFieldRuleHandler;
import com.openrangelabs.ingestor.transformation.handler.RuleHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Runs an ordered rule pipeline over a row set.
 *
 * <p>Rules are applied in ascending order; rules sharing an order keep their list order.
 * A rule that throws fails on its own unless fail-on-error is in force, in which case the
 * pipeline stops and returns the rule results gathered so far. Cancellation is polled
 * between rules and at every batch boundary inside a rule; a cancelled run returns no rows.
 */
@Component
public class TransformationEngine {

    private static final Logger logger = LoggerFactory.getLogger(TransformationEngine.class);

    private final Map<String, RuleHandler> handlers;
    private final Map<String, CustomRuleFunction> customFunctions;
    private final ExpressionEvaluator expressions = new ExpressionEvaluator();

    public TransformationEngine() {
        this(List.of());
    }

    public TransformationEngine(List<CustomRuleFunction> customFunctions) {
        this(defaultHandlers(), customFunctions);
    }

    @Autowired
    public TransformationEngine(ObjectProvider<CustomRuleFunction> customFunctions) {
        this(defaultHandlers(), customFunctions.orderedStream().collect(Collectors.toList()));
    }

    public TransformationEngine(List<RuleHandler> handlers, List<CustomRuleFunction> customFunctions) {
        Map<String, RuleHandler> byType = new HashMap<>();
        handlers.forEach(handler -> byType.put(handler.type().toLowerCase(Locale.ROOT), handler));
        // older rule sets call the format rule "transform"
        RuleHandler format = byType.get("format");
        if (format != null) {
            byType.putIfAbsent("transform", format);
        }
        this.handlers = Collections.unmodifiableMap(byType);

        Map<String, CustomRuleFunction> functions = new LinkedHashMap<>();
        customFunctions.forEach(function -> functions.put(function.name(), function));
        this.customFunctions = Collections.unmodifiableMap(functions);
    }

    public static List<RuleHandler> defaultHandlers() {
        return List.of(new MapRuleHandler(), new FilterRuleHandler(), new AggregateRuleHandler(), new JoinRuleHandler(),
                new FormatRuleHandler(), new AddFieldRuleHandler(), new RemoveFieldRuleHandler(),
                new RenameFieldRuleHandler(), new CustomRuleHandler());
    }

    public boolean supports(String ruleType) {
        return ruleType != null && handlers.containsKey(ruleType.toLowerCase(Locale.ROOT));
    }

    public TransformationResult transform(List<DataRow> rows, TransformationParameters parameters, CancellationSignal signal) {
        long start = System.nanoTime();
        CancellationSignal cancellation = signal != null ? signal : CancellationSignal.none();
        TransformationParameters params = parameters != null ? parameters : new TransformationParameters();
        List<DataRow> input = rows != null ? rows : List.of();
        int originalCount = input.size();

        List<DataRow> working = params.isPreserveOriginalData()
                ? input.stream().map(DataRow::copy).collect(Collectors.toCollection(ArrayList::new))
                : new ArrayList<>(input);

        List<TransformationRule> ordered = params.getRules() == null ? List.of() : params.getRules().stream()
                .sorted(Comparator.comparingInt(TransformationRule::getOrder))
                .collect(Collectors.toList());
        Map<String, List<DataRow>> joinSources = joinSourcesOf(params);
        List<RuleExecutionResult> results = new ArrayList<>(ordered.size());

        for (TransformationRule rule : ordered) {
            if (cancellation.isCancellationRequested()) {
                return cancelled(cancellation.reason(), originalCount, results, start);
            }
            boolean failOnError = rule.getFailOnError() != null ? rule.getFailOnError() : params.isFailOnError();
            RuleHandler handler = rule.getType() == null ? null : handlers.get(rule.getType().toLowerCase(Locale.ROOT));
            if (handler == null) {
                String message = "Unknown rule type: " + rule.getType();
                logger.warn("Rule {} skipped: {}", rule.getId(), message);
                results.add(RuleExecutionResult.failed(rule.getId(), rule.getType(), Duration.ZERO, 0, 0, 0, message));
                if (failOnError) {
                    return TransformationResult.failure(FailureReason.ERROR, message, originalCount, results, elapsedMs(start));
                }
                continue;
            }

            RuleContext context = new RuleContext(rule, expressions, customFunctions, joinSources, cancellation,
                    params.batchSize(), failOnError);
            long ruleStart = System.nanoTime();
            try {
                working = handler.apply(rule, working, context);
                results.add(context.toResult(Duration.ofNanos(System.nanoTime() - ruleStart)));
                logger.debug("Rule {} ({}) applied: {} rows seen, {} failures",
                        rule.getId(), rule.getType(), context.getRowsSeen(), context.getFailureCount());
            } catch (OperationCancelledException e) {
                results.add(context.toFailedResult(Duration.ofNanos(System.nanoTime() - ruleStart), e.getMessage()));
                return cancelled(e.getReason(), originalCount, results, start);
            } catch (RuntimeException e) {
                results.add(context.toFailedResult(Duration.ofNanos(System.nanoTime() - ruleStart), e.getMessage()));
                logger.warn("Rule {} ({}) failed: {}", rule.getId(), rule.getType(), e.getMessage());
                if (failOnError) {
                    return TransformationResult.failure(FailureReason.ERROR,
                            String.format("Rule %s failed: %s", rule.getId(), e.getMessage()), originalCount, results, elapsedMs(start));
                }
            }
        }

        return TransformationResult.success(working, originalCount, results, elapsedMs(start));
    }

    private static Map<String, List<DataRow>> joinSourcesOf(TransformationParameters params) {
        if (params.getJoinSources() == null || params.getJoinSources().isEmpty()) {
            return Map.of();
        }
        Map<String, List<DataRow>> sources = new HashMap<>();
        params.getJoinSources().forEach((name, rows) ->
                sources.put(name, rows.stream().map(DataRow::of).collect(Collectors.toList())));
        return sources;
    }

    private static TransformationResult cancelled(CancellationSignal.Reason reason, int originalCount,
                                                  List<RuleExecutionResult> results, long start) {
        FailureReason failure = reason == CancellationSignal.Reason.TIMEOUT ? FailureReason.TIMEOUT : FailureReason.CANCELLED;
        return TransformationResult.failure(failure, "Transformation " + failure.name().toLowerCase(Locale.ROOT),
                originalCount, results, elapsedMs(start));
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
