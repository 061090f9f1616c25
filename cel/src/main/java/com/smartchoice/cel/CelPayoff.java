package com.smartchoice.cel;

import com.smartchoice.common.errorsor.ErrorsOr;
import com.smartchoice.tree.error.EvaluationException;
import com.smartchoice.tree.spec.PayoffFn;
import dev.cel.common.CelAbstractSyntaxTree;
import dev.cel.common.CelValidationException;
import dev.cel.common.types.MapType;
import dev.cel.common.types.SimpleType;
import dev.cel.compiler.CelCompiler;
import dev.cel.compiler.CelCompilerFactory;
import dev.cel.parser.CelStandardMacro;
import dev.cel.runtime.CelRuntime;
import dev.cel.runtime.CelRuntimeFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A payoff written as a CEL expression over the three path maps, e.g.
 * {@code values["bid"] < values["competitor_bid"] ? values["bid"] - values["cost"] : 0.0}.
 *
 * <p>{@code values} and {@code probabilities} are typed {@code map(string, double)} and
 * {@code branches} is {@code map(string, string)}. Numeric literals mixed with map entries
 * must be written as doubles ({@code 0.0}, not {@code 0}). The result may be a CEL int or double.
 */
public final class CelPayoff implements PayoffFn {

    public static final String VALUES = "values";
    public static final String PROBABILITIES = "probabilities";
    public static final String BRANCHES = "branches";

    private static final MapType NUMBERS = MapType.create(SimpleType.STRING, SimpleType.DOUBLE);
    private static final MapType LABELS = MapType.create(SimpleType.STRING, SimpleType.STRING);

    private static final CelRuntime BASE_RUNTIME =
            CelRuntimeFactory.standardCelRuntimeBuilder().build();

    private final String source;
    private final CelRuntime.Program program;

    private CelPayoff(String source, CelRuntime.Program program) {
        this.source = source;
        this.program = program;
    }

    /** Parses and checks the expression. Never throws; problems come back as errors. */
    public static ErrorsOr<PayoffFn> compile(String expression) {
        if (expression == null || expression.isBlank()) return ErrorsOr.error("Payoff expression must not be blank");
        try {
            CelCompiler compiler = CelCompilerFactory.standardCelCompilerBuilder()
                    .setStandardMacros(CelStandardMacro.HAS)
                    .addVar(VALUES, NUMBERS)
                    .addVar(PROBABILITIES, NUMBERS)
                    .addVar(BRANCHES, LABELS)
                    .build();
            CelAbstractSyntaxTree ast = compiler.compile(expression).getAst();
            return ErrorsOr.lift(new CelPayoff(expression, BASE_RUNTIME.createProgram(ast)));
        } catch (CelValidationException e) {
            return ErrorsOr.error("CEL compile/validate error in payoff '" + expression + "': " + e.getMessage());
        } catch (Exception e) {
            return ErrorsOr.error("CEL build error in payoff '" + expression + "': " + e.getMessage());
        }
    }

    public String source() {
        return source;
    }

    @Override
    public double payoff(Map<String, Double> values, Map<String, Double> probabilities, Map<String, String> branches) {
        Map<String, Object> activation = new HashMap<>(4);
        activation.put(VALUES, values);
        activation.put(PROBABILITIES, probabilities);
        activation.put(BRANCHES, branches);
        Object raw;
        try {
            raw = program.eval(activation);
        } catch (Exception e) {
            throw new EvaluationException("Evaluation error in payoff '" + source + "': "
                    + e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
        if (raw instanceof Double d) return d;
        if (raw instanceof Long l) return l.doubleValue();
        throw new EvaluationException("Payoff '" + source + "' must yield a number but gave "
                + (raw == null ? "null" : raw.getClass().getSimpleName() + " " + raw));
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof CelPayoff other && source.equals(other.source);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source);
    }

    @Override
    public String toString() {
        return "CelPayoff{" + source + '}';
    }
}
