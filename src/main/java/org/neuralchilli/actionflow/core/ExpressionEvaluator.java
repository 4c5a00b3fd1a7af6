package org.neuralchilli.actionflow.core;

import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.jexl3.JexlBuilder;
import org.apache.commons.jexl3.JexlContext;
import org.apache.commons.jexl3.JexlEngine;
import org.apache.commons.jexl3.JexlException;
import org.apache.commons.jexl3.JexlExpression;
import org.apache.commons.jexl3.MapContext;
import org.apache.commons.jexl3.introspection.JexlPermissions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Evaluates JEXL expressions against a workflow context.
 * Used to resolve dotted placeholder paths such as {@code step_1_result.id}.
 */
@ApplicationScoped
public class ExpressionEvaluator {

    private static final Logger log = LoggerFactory.getLogger(ExpressionEvaluator.class);

    private final JexlEngine jexl;

    public ExpressionEvaluator() {
        this.jexl = new JexlBuilder()
                .cache(512)
                .strict(false)  // missing properties resolve to null
                .silent(false)
                .permissions(JexlPermissions.UNRESTRICTED)
                .create();
    }

    /**
     * Evaluate an expression (without the surrounding <code>${}</code>) to its raw value.
     *
     * @throws ExpressionException if the expression is invalid or evaluation fails
     */
    public Object evaluate(String expression, Map<String, Object> variables) {
        if (expression == null || expression.isBlank()) {
            throw new ExpressionException("Expression cannot be empty");
        }

        try {
            JexlExpression compiled = jexl.createExpression(expression);
            return compiled.evaluate(createJexlContext(variables));
        } catch (JexlException e) {
            String msg = String.format("Failed to evaluate expression: %s - %s", expression, e.getMessage());
            log.debug(msg);
            throw new ExpressionException(msg, e);
        }
    }

    /**
     * Test if an expression can be compiled
     */
    public boolean isValid(String expression) {
        if (expression == null || expression.isBlank()) {
            return false;
        }
        try {
            jexl.createExpression(expression);
            return true;
        } catch (JexlException e) {
            return false;
        }
    }

    private JexlContext createJexlContext(Map<String, Object> variables) {
        return new MapContext(variables != null ? new HashMap<>(variables) : new HashMap<>());
    }
}
