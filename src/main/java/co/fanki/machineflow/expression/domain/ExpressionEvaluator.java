package co.fanki.machineflow.expression.domain;

import co.fanki.machineflow.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates guard conditions and resolves {@code {{ expr }}} templates.
 *
 * <p>Parsed expressions are cached by their source text, so evaluating the
 * same guard on every tick parses it once. The cache keeps the most
 * recently used {@code cacheSize} entries. The evaluator itself holds no
 * other state and is safe to share between threads.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class ExpressionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(
            ExpressionEvaluator.class);

    private static final Pattern TEMPLATE_SPAN = Pattern.compile(
            "\\{\\{([^}]*)\\}\\}");

    /** Cache size used by the no-argument constructor. */
    public static final int DEFAULT_CACHE_SIZE = 1024;

    private final Map<String, ParsedExpression> cache;

    /** Creates an evaluator caching {@link #DEFAULT_CACHE_SIZE} entries. */
    public ExpressionEvaluator() {
        this(DEFAULT_CACHE_SIZE);
    }

    /**
     * Creates a new ExpressionEvaluator.
     *
     * @param cacheSize how many parsed expressions to keep, at least one
     */
    public ExpressionEvaluator(final int cacheSize) {
        Preconditions.requirePositive(cacheSize,
                "Cache size must be positive");
        this.cache = new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(
                    final Map.Entry<String, ParsedExpression> eldest) {
                return size() > cacheSize;
            }
        };
    }

    /**
     * Evaluates a condition to a boolean using truthiness.
     *
     * <p>{@code {{ a.b }}} spans inside the condition are unwrapped to
     * {@code a.b} before parsing.</p>
     *
     * @param condition the condition source, never blank
     * @param context the variables
     * @return the truthiness of the result
     * @throws ExpressionError if the condition does not parse or evaluate
     */
    public boolean evaluateCondition(final String condition,
            final VariableContext context) {
        final String source = condition == null ? null : unwrap(condition);
        return parse(source).evaluate(context).truthy();
    }

    /**
     * Evaluates a general expression.
     *
     * @param expression the expression source
     * @param context the variables
     * @return the value, {@link Value#UNDEFINED} for missing variables
     * @throws ExpressionError if the expression does not parse or evaluate
     */
    public Value evaluate(final String expression,
            final VariableContext context) {
        return parse(expression).evaluate(context);
    }

    /**
     * Replaces every {@code {{ expr }}} span with its rendered value.
     *
     * <p>Spans that fail, or evaluate to undefined, are kept verbatim.</p>
     *
     * @param template the text, may be null
     * @param context the variables
     * @return the resolved text, never throws
     */
    public String resolveTemplate(final String template,
            final VariableContext context) {
        if (template == null || template.indexOf("{{") < 0) {
            return template;
        }
        final Matcher matcher = TEMPLATE_SPAN.matcher(template);
        final StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            final String span = matcher.group();
            String replacement = span;
            try {
                final Value value = evaluate(matcher.group(1).trim(), context);
                if (!value.isUndefined()) {
                    replacement = value.render();
                }
            } catch (final ExpressionError e) {
                LOG.warn("Template span {} left unresolved: {}", span,
                        e.getMessage());
            }
            matcher.appendReplacement(result,
                    Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    /**
     * Parses an expression, reusing a cached tree for the same source.
     *
     * @param expression the source
     * @return the parsed expression
     * @throws ExpressionError if the source is not a valid expression
     */
    public ParsedExpression parse(final String expression) {
        if (expression == null || expression.isBlank()) {
            return ExpressionParser.parse(expression);
        }
        synchronized (cache) {
            final ParsedExpression cached = cache.get(expression);
            if (cached != null) {
                return cached;
            }
        }
        final ParsedExpression parsed = ExpressionParser.parse(expression);
        synchronized (cache) {
            cache.putIfAbsent(expression, parsed);
        }
        return parsed;
    }

    /**
     * Returns how many parsed expressions are cached.
     *
     * @return the cache size
     */
    public int cachedExpressions() {
        synchronized (cache) {
            return cache.size();
        }
    }

    private static String unwrap(final String condition) {
        if (condition.indexOf("{{") < 0) {
            return condition;
        }
        final Matcher matcher = TEMPLATE_SPAN.matcher(condition);
        final StringBuilder result = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(result,
                    Matcher.quoteReplacement(matcher.group(1).trim()));
        }
        matcher.appendTail(result);
        return result.toString();
    }

}
