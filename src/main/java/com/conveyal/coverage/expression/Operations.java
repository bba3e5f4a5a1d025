package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.expression.Value.ArrayValue;
import com.conveyal.coverage.expression.Value.Scalar;
import com.conveyal.coverage.raster.GridExtents;
import org.apache.commons.math3.util.FastMath;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;
import java.util.function.DoubleUnaryOperator;

/**
 * The fixed set of operations available to band scripts. All of them work element-wise, with scalars broadcast
 * against arrays. Arrays combined with each other must have the same number of rows and columns. Division follows
 * IEEE rules, so dividing by zero yields an infinity or NaN rather than an error.
 */
abstract class Operations {

    /** A named function callable from scripts. */
    interface Function {
        Value apply (EvaluationScope scope, List<Value> arguments);
    }

    static final Map<String, Function> FUNCTIONS = new HashMap<>();

    static {
        unary("abs", FastMath::abs);
        unary("sqrt", FastMath::sqrt);
        unary("exp", FastMath::exp);
        unary("log", FastMath::log);
        unary("log10", FastMath::log10);
        unary("floor", FastMath::floor);
        unary("ceil", FastMath::ceil);
        unary("round", FastMath::rint);
        unary("isnan", x -> Double.isNaN(x) ? 1 : 0);
        FUNCTIONS.put("min", (scope, args) -> extreme(scope, args, "min", FastMath::min));
        FUNCTIONS.put("max", (scope, args) -> extreme(scope, args, "max", FastMath::max));
        FUNCTIONS.put("clip", (scope, args) -> {
            arity("clip", args, 3);
            Value low = binary(scope, args.get(0), args.get(1), FastMath::max);
            return binary(scope, low, args.get(2), FastMath::min);
        });
        FUNCTIONS.put("where", (scope, args) -> {
            arity("where", args, 3);
            return where(scope, args.get(0), args.get(1), args.get(2));
        });
        FUNCTIONS.put("sum", (scope, args) -> {
            arity("sum", args, 1);
            return reduce(scope, args.get(0), false);
        });
        FUNCTIONS.put("mean", (scope, args) -> {
            arity("mean", args, 1);
            return reduce(scope, args.get(0), true);
        });
    }

    private static void unary (String name, DoubleUnaryOperator operator) {
        FUNCTIONS.put(name, (scope, args) -> {
            arity(name, args, 1);
            return unary(scope, args.get(0), operator);
        });
    }

    static Function function (String name) {
        Function function = FUNCTIONS.get(name);
        if (function == null) {
            throw CoverageProcessException.runtimeError("Unknown function: " + name);
        }
        return function;
    }

    private static void arity (String name, List<Value> args, int expected) {
        if (args.size() != expected) {
            throw CoverageProcessException.runtimeError(String.format(
                    "%s() takes %d arguments, %d given.", name, expected, args.size()));
        }
    }

    static Value unary (EvaluationScope scope, Value operand, DoubleUnaryOperator operator) {
        if (operand.isScalar()) {
            return new Scalar(operator.applyAsDouble(((Scalar) operand).value));
        }
        ArrayValue array = (ArrayValue) operand;
        double[] result = scope.allocate(array.extents);
        for (int i = 0; i < result.length; i++) {
            result[i] = operator.applyAsDouble(array.values[i]);
        }
        return new ArrayValue(array.extents, result);
    }

    static Value binary (EvaluationScope scope, Value left, Value right, DoubleBinaryOperator operator) {
        if (left.isScalar() && right.isScalar()) {
            return new Scalar(operator.applyAsDouble(((Scalar) left).value, ((Scalar) right).value));
        }
        GridExtents extents = commonExtents(left, right);
        double[] result = scope.allocate(extents);
        for (int i = 0; i < result.length; i++) {
            result[i] = operator.applyAsDouble(sample(left, i), sample(right, i));
        }
        return new ArrayValue(extents, result);
    }

    private static Value where (EvaluationScope scope, Value condition, Value ifTrue, Value ifFalse) {
        if (condition.isScalar()) {
            return ((Scalar) condition).isTrue() ? ifTrue : ifFalse;
        }
        GridExtents extents = commonExtents(condition, ifTrue, ifFalse);
        double[] result = scope.allocate(extents);
        for (int i = 0; i < result.length; i++) {
            double c = sample(condition, i);
            result[i] = (c != 0 && !Double.isNaN(c)) ? sample(ifTrue, i) : sample(ifFalse, i);
        }
        return new ArrayValue(extents, result);
    }

    /** With a single array argument, the smallest or largest non-NaN sample; otherwise element-wise. */
    private static Value extreme (EvaluationScope scope, List<Value> args, String name, DoubleBinaryOperator op) {
        if (args.isEmpty()) {
            throw CoverageProcessException.runtimeError(name + "() needs at least one argument.");
        }
        if (args.size() == 1) {
            Value only = args.get(0);
            if (only.isScalar()) return only;
            scope.checkLimits();
            double result = Double.NaN;
            for (double value : ((ArrayValue) only).values) {
                if (Double.isNaN(value)) continue;
                result = Double.isNaN(result) ? value : op.applyAsDouble(result, value);
            }
            return new Scalar(result);
        }
        Value result = args.get(0);
        for (int i = 1; i < args.size(); i++) {
            result = binary(scope, result, args.get(i), op);
        }
        return result;
    }

    /** Sum or mean of the non-NaN samples. The mean of no samples is NaN. */
    private static Value reduce (EvaluationScope scope, Value operand, boolean mean) {
        if (operand.isScalar()) return operand;
        scope.checkLimits();
        double sum = 0;
        int count = 0;
        for (double value : ((ArrayValue) operand).values) {
            if (Double.isNaN(value)) continue;
            sum += value;
            count++;
        }
        if (mean) return new Scalar(count == 0 ? Double.NaN : sum / count);
        return new Scalar(sum);
    }

    /** Grid of the array operands, which must all have the same shape. At least one operand must be an array. */
    private static GridExtents commonExtents (Value... operands) {
        ArrayValue first = null;
        for (Value operand : operands) {
            if (operand.isScalar()) continue;
            ArrayValue array = (ArrayValue) operand;
            if (first == null) {
                first = array;
            } else if (!first.sameShape(array)) {
                throw CoverageProcessException.runtimeError(String.format(
                        "Cannot combine arrays of shape %s and %s.", first.shape(), array.shape()));
            }
        }
        return first.extents;
    }

    private static double sample (Value value, int index) {
        if (value.isScalar()) return ((Scalar) value).value;
        return ((ArrayValue) value).values[index];
    }

    // Operator implementations shared by the interpreter.

    static double modulo (double a, double b) {
        // Result takes the sign of the divisor.
        return a - b * FastMath.floor(a / b);
    }

    static double truth (boolean b) {
        return b ? 1 : 0;
    }

    static boolean isTrue (double value) {
        return value != 0 && !Double.isNaN(value);
    }

}
