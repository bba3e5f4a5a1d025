package com.conveyal.coverage.fetch;

import org.locationtech.jts.geom.Envelope;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;

/**
 * Parses the subset and rangeSubset query parameters of the coverage API, for example
 * {@code lat(16:16.001),lon(48:48.001),time("2020-09-10T00:00Z":"2020-09-29T00:00Z")}.
 * Spatial axes need two bounds. The time axis takes either two bounds or a single instant.
 */
public abstract class SubsetParser {

    /** Result of parsing a subset parameter: a lon/lat envelope and an optional time subset. */
    public static class Subset {
        public final Envelope envelope;
        public final TemporalSubset temporal;

        Subset (Envelope envelope, TemporalSubset temporal) {
            this.envelope = envelope;
            this.temporal = temporal;
        }
    }

    private enum Axis { X, Y, TIME }

    public static Subset parse (String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Subset is empty.");
        }
        double[] x = null;
        double[] y = null;
        TemporalSubset temporal = null;
        int position = 0;
        while (position < text.length()) {
            int open = text.indexOf('(', position);
            if (open < 0) {
                throw new IllegalArgumentException("Expected axis(...) in subset: " + text);
            }
            Axis axis = axis(text.substring(position, open).trim());
            int close = closingParenthesis(text, open);
            List<String> bounds = splitBounds(text.substring(open + 1, close));
            switch (axis) {
                case X:
                    if (x != null) throw new IllegalArgumentException("Longitude given twice in subset: " + text);
                    x = numericBounds(bounds, text);
                    break;
                case Y:
                    if (y != null) throw new IllegalArgumentException("Latitude given twice in subset: " + text);
                    y = numericBounds(bounds, text);
                    break;
                case TIME:
                    if (temporal != null) throw new IllegalArgumentException("Time given twice in subset: " + text);
                    temporal = temporalBounds(bounds);
                    break;
            }
            position = close + 1;
            while (position < text.length() && (text.charAt(position) == ',' || Character.isWhitespace(text.charAt(position)))) {
                position++;
            }
        }
        if (x == null || y == null) {
            throw new IllegalArgumentException("Subset must bound both longitude and latitude: " + text);
        }
        return new Subset(new Envelope(x[0], x[1], y[0], y[1]), temporal);
    }

    /** Split a comma separated list of band names, dropping blanks and repeats. Null yields an empty list. */
    public static List<String> parseRangeSubset (String text) {
        LinkedHashSet<String> bands = new LinkedHashSet<>();
        if (text != null) {
            for (String band : text.split(",")) {
                if (!band.isBlank()) bands.add(band.trim());
            }
        }
        return new ArrayList<>(bands);
    }

    private static Axis axis (String name) {
        switch (name.toLowerCase(Locale.ROOT)) {
            case "lon": case "long": case "x": case "e":
                return Axis.X;
            case "lat": case "y": case "n":
                return Axis.Y;
            case "time": case "t":
                return Axis.TIME;
            default:
                throw new IllegalArgumentException("Unknown subset axis: " + name);
        }
    }

    private static int closingParenthesis (String text, int open) {
        boolean quoted = false;
        for (int i = open + 1; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (c == ')' && !quoted) return i;
        }
        throw new IllegalArgumentException("Unbalanced parenthesis in subset: " + text);
    }

    /** Split on the first colon outside quotes, or failing that on a comma outside quotes. */
    private static List<String> splitBounds (String content) {
        int separator = indexOutsideQuotes(content, ':');
        if (separator < 0) separator = indexOutsideQuotes(content, ',');
        List<String> bounds = new ArrayList<>();
        if (separator < 0) {
            bounds.add(content.trim());
        } else {
            bounds.add(content.substring(0, separator).trim());
            bounds.add(content.substring(separator + 1).trim());
        }
        return bounds;
    }

    private static int indexOutsideQuotes (String text, char target) {
        boolean quoted = false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == '"') quoted = !quoted;
            else if (c == target && !quoted) return i;
        }
        return -1;
    }

    private static double[] numericBounds (List<String> bounds, String text) {
        if (bounds.size() != 2) {
            throw new IllegalArgumentException("Spatial subsets need a lower and an upper bound: " + text);
        }
        try {
            double low = Double.parseDouble(bounds.get(0));
            double high = Double.parseDouble(bounds.get(1));
            if (!(high > low)) {
                throw new IllegalArgumentException("Spatial subset upper bound must exceed lower bound: " + text);
            }
            return new double[] {low, high};
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Spatial subset bounds must be numbers: " + text, e);
        }
    }

    private static TemporalSubset temporalBounds (List<String> bounds) {
        if (bounds.size() == 1) {
            Instant instant = TemporalSubset.parseInstant(unquote(bounds.get(0)));
            if (instant == null) throw new IllegalArgumentException("Time slice needs an instant.");
            return TemporalSubset.instant(instant);
        }
        return TemporalSubset.interval(
                TemporalSubset.parseInstant(unquote(bounds.get(0))),
                TemporalSubset.parseInstant(unquote(bounds.get(1)))
        );
    }

    private static String unquote (String text) {
        String trimmed = text.trim();
        if (trimmed.length() >= 2 && trimmed.startsWith("\"") && trimmed.endsWith("\"")) {
            return trimmed.substring(1, trimmed.length() - 1);
        }
        return trimmed;
    }

}
