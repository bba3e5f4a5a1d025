package com.conveyal.coverage.expression;

import com.conveyal.coverage.CoverageProcessException;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A parsed band script, ready to be evaluated any number of times. Parsing happens once, when a process is registered,
 * so syntax errors surface at registration rather than on every invocation.
 */
public class BandScript {

    /** Name of the band this script computes. */
    public final String band;

    public final String source;

    private final List<Statement> statements;

    private final Set<String> freeIdentifiers;

    private BandScript (String band, String source, List<Statement> statements) {
        this.band = band;
        this.source = source;
        this.statements = statements;
        Set<String> free = new LinkedHashSet<>();
        Statement.analyzeAll(statements, new HashSet<>(), free);
        this.freeIdentifiers = Collections.unmodifiableSet(free);
    }

    /** Parse the source text, failing with EXPRESSION_SYNTAX_ERROR if it is malformed. */
    public static BandScript compile (String band, String source) {
        if (source == null) {
            throw CoverageProcessException.syntaxError("No script given for band " + band);
        }
        try {
            return new BandScript(band, source, ExpressionParser.parse(source));
        } catch (CoverageProcessException e) {
            throw CoverageProcessException.syntaxError("In script for band " + band + ": " + e.getMessage());
        }
    }

    /**
     * Identifiers the script reads before assigning them, in order of first appearance. These are the names that must
     * be bound by the caller. Function names are not included.
     */
    public Set<String> freeIdentifiers () {
        return freeIdentifiers;
    }

    /** The returned value, else the value of the last statement that produced one. */
    Value run (EvaluationScope scope) {
        Statement.executeAll(statements, scope);
        Value result = scope.returnValue != null ? scope.returnValue : scope.lastValue;
        if (result == null) {
            throw CoverageProcessException.runtimeError("Script for band " + band + " produced no value.");
        }
        return result;
    }

    @Override
    public String toString () {
        return band + " = " + source;
    }

}
