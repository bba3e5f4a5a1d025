package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;
import com.conveyal.coverage.expression.Value.Scalar;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Statements of a band script. */
abstract class Statement {

    /** Run the statement, returning true if a return statement was executed. */
    abstract boolean execute (EvaluationScope scope);

    /**
     * Record free reads into free, and add to assigned the names this statement is certain to have assigned once it
     * completes.
     */
    abstract void analyze (Set<String> assigned, Set<String> free);

    static boolean executeAll (List<Statement> statements, EvaluationScope scope) {
        for (Statement statement : statements) {
            if (statement.execute(scope)) return true;
        }
        return false;
    }

    static void analyzeAll (List<Statement> statements, Set<String> assigned, Set<String> free) {
        for (Statement statement : statements) {
            statement.analyze(assigned, free);
        }
    }

    private static boolean condition (Node condition, EvaluationScope scope, String keyword) {
        Value value = condition.evaluate(scope);
        if (!value.isScalar()) {
            throw CoverageProcessException.runtimeError(
                    "The condition of " + keyword + " must be a scalar, use where() for element-wise choices.");
        }
        return ((Scalar) value).isTrue();
    }

    static class Assign extends Statement {
        final String name;
        final Node value;

        Assign (String name, Node value) {
            this.name = name;
            this.value = value;
        }

        @Override
        boolean execute (EvaluationScope scope) {
            Value result = value.evaluate(scope);
            scope.assign(name, result);
            scope.lastValue = result;
            return false;
        }

        @Override
        void analyze (Set<String> assigned, Set<String> free) {
            value.collectReads(assigned, free);
            assigned.add(name);
        }
    }

    static class ExpressionStatement extends Statement {
        final Node expression;

        ExpressionStatement (Node expression) {
            this.expression = expression;
        }

        @Override
        boolean execute (EvaluationScope scope) {
            scope.lastValue = expression.evaluate(scope);
            return false;
        }

        @Override
        void analyze (Set<String> assigned, Set<String> free) {
            expression.collectReads(assigned, free);
        }
    }

    static class Return extends Statement {
        final Node expression;

        Return (Node expression) {
            this.expression = expression;
        }

        @Override
        boolean execute (EvaluationScope scope) {
            scope.returnValue = expression.evaluate(scope);
            return true;
        }

        @Override
        void analyze (Set<String> assigned, Set<String> free) {
            expression.collectReads(assigned, free);
        }
    }

    static class If extends Statement {
        final Node condition;
        final List<Statement> thenBranch;
        final List<Statement> elseBranch;

        If (Node condition, List<Statement> thenBranch, List<Statement> elseBranch) {
            this.condition = condition;
            this.thenBranch = thenBranch;
            this.elseBranch = elseBranch;
        }

        @Override
        boolean execute (EvaluationScope scope) {
            scope.checkLimits();
            if (condition(condition, scope, "if")) {
                return executeAll(thenBranch, scope);
            }
            return executeAll(elseBranch, scope);
        }

        @Override
        void analyze (Set<String> assigned, Set<String> free) {
            condition.collectReads(assigned, free);
            Set<String> thenAssigned = new HashSet<>(assigned);
            analyzeAll(thenBranch, thenAssigned, free);
            Set<String> elseAssigned = new HashSet<>(assigned);
            analyzeAll(elseBranch, elseAssigned, free);
            // Only names assigned on both paths are certainly assigned afterward.
            thenAssigned.retainAll(elseAssigned);
            assigned.addAll(thenAssigned);
        }
    }

    static class While extends Statement {
        final Node condition;
        final List<Statement> body;

        While (Node condition, List<Statement> body) {
            this.condition = condition;
            this.body = body;
        }

        @Override
        boolean execute (EvaluationScope scope) {
            while (true) {
                scope.checkLimits();
                if (!condition(condition, scope, "while")) return false;
                if (executeAll(body, scope)) return true;
            }
        }

        @Override
        void analyze (Set<String> assigned, Set<String> free) {
            condition.collectReads(assigned, free);
            // The body may never run, so its assignments do not count afterward.
            analyzeAll(body, new HashSet<>(assigned), free);
        }
    }

}
