package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.expression.Value.ArrayValue;
import com.conveyal.coverage.expression.Value.Scalar;
import org.apache.commons.math3.util.FastMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/** Expression nodes of a parsed band script. Each node evaluates itself against a scope. */
abstract class Node {

    /** Number of levels from this node down to its deepest leaf. Evaluation recurses this deep. */
    final int height;

    Node () {
        this.height = 1;
    }

    Node (Node... children) {
        int deepest = 0;
        for (Node child : children) deepest = Math.max(deepest, child.height);
        this.height = deepest + 1;
    }

    abstract Value evaluate (EvaluationScope scope);

    /** Add to free every identifier this expression reads that is not yet in assigned. */
    abstract void collectReads (Set<String> assigned, Set<String> free);

    static class Literal extends Node {
        final double value;

        Literal (double value) {
            this.value = value;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            return new Scalar(value);
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) { }
    }

    static class Identifier extends Node {
        final String name;

        Identifier (String name) {
            this.name = name;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            return scope.lookup(name);
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            if (!assigned.contains(name)) free.add(name);
        }
    }

    static class Negate extends Node {
        final Node operand;

        Negate (Node operand) {
            super(operand);
            this.operand = operand;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            return Operations.unary(scope, operand.evaluate(scope), x -> -x);
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            operand.collectReads(assigned, free);
        }
    }

    static class Not extends Node {
        final Node operand;

        Not (Node operand) {
            super(operand);
            this.operand = operand;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            return Operations.unary(scope, operand.evaluate(scope), x -> Operations.truth(!Operations.isTrue(x)));
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            operand.collectReads(assigned, free);
        }
    }

    static class Binary extends Node {
        final TokenType operator;
        final Node left;
        final Node right;

        Binary (TokenType operator, Node left, Node right) {
            super(left, right);
            this.operator = operator;
            this.left = left;
            this.right = right;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            Value a = left.evaluate(scope);
            // Scalar and/or short-circuit like their counterparts in most languages.
            if (a.isScalar() && (operator == TokenType.AND || operator == TokenType.OR)) {
                boolean leftTrue = ((Scalar) a).isTrue();
                if (operator == TokenType.AND && !leftTrue) return new Scalar(0);
                if (operator == TokenType.OR && leftTrue) return new Scalar(1);
            }
            Value b = right.evaluate(scope);
            switch (operator) {
                case PLUS: return Operations.binary(scope, a, b, Double::sum);
                case MINUS: return Operations.binary(scope, a, b, (x, y) -> x - y);
                case STAR: return Operations.binary(scope, a, b, (x, y) -> x * y);
                case SLASH: return Operations.binary(scope, a, b, (x, y) -> x / y);
                case PERCENT: return Operations.binary(scope, a, b, Operations::modulo);
                case POWER: return Operations.binary(scope, a, b, FastMath::pow);
                case EQ: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x == y));
                case NE: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x != y));
                case LT: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x < y));
                case LE: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x <= y));
                case GT: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x > y));
                case GE: return Operations.binary(scope, a, b, (x, y) -> Operations.truth(x >= y));
                case AND: return Operations.binary(scope, a, b,
                        (x, y) -> Operations.truth(Operations.isTrue(x) && Operations.isTrue(y)));
                case OR: return Operations.binary(scope, a, b,
                        (x, y) -> Operations.truth(Operations.isTrue(x) || Operations.isTrue(y)));
                default:
                    throw new IllegalStateException("Not a binary operator: " + operator);
            }
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            left.collectReads(assigned, free);
            right.collectReads(assigned, free);
        }
    }

    static class Call extends Node {
        final String function;
        final List<Node> arguments;

        Call (String function, List<Node> arguments) {
            super(arguments.toArray(new Node[0]));
            this.function = function;
            this.arguments = arguments;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            Operations.Function f = Operations.function(function);
            List<Value> values = new ArrayList<>(arguments.size());
            for (Node argument : arguments) {
                values.add(argument.evaluate(scope));
            }
            return f.apply(scope, values);
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            for (Node argument : arguments) argument.collectReads(assigned, free);
        }
    }

    /** Reads one sample, array[row, column]. */
    static class Index extends Node {
        final Node target;
        final Node row;
        final Node column;

        Index (Node target, Node row, Node column) {
            super(target, row, column);
            this.target = target;
            this.row = row;
            this.column = column;
        }

        @Override
        Value evaluate (EvaluationScope scope) {
            Value value = target.evaluate(scope);
            if (value.isScalar()) {
                throw CoverageProcessException.runtimeError("Cannot index a scalar.");
            }
            ArrayValue array = (ArrayValue) value;
            int r = index(row.evaluate(scope), array.height(), "Row");
            int c = index(column.evaluate(scope), array.width(), "Column");
            return new Scalar(array.values[r * array.width() + c]);
        }

        private static int index (Value value, int size, String axis) {
            if (!value.isScalar()) {
                throw CoverageProcessException.runtimeError(axis + " index must be a scalar.");
            }
            double d = ((Scalar) value).value;
            if (d != Math.floor(d) || d < 0 || d >= size) {
                throw CoverageProcessException.runtimeError(String.format(
                        "%s index %s is outside 0..%d.", axis, d, size - 1));
            }
            return (int) d;
        }

        @Override
        void collectReads (Set<String> assigned, Set<String> free) {
            target.collectReads(assigned, free);
            row.collectReads(assigned, free);
            column.collectReads(assigned, free);
        }
    }

}
