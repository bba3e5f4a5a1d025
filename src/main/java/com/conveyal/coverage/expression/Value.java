package com.conveyal.coverage.expression;

import com.conveyal.coverage.raster.GridExtents;

/**
 * The result of evaluating a band-script expression: either a single number or a grid of numbers. Arrays are never
 * modified once created; every operation allocates a new one, so input bands can be bound without copying.
 */
abstract class Value {

    abstract boolean isScalar ();

    static final class Scalar extends Value {

        final double value;

        Scalar (double value) {
            this.value = value;
        }

        @Override
        boolean isScalar () {
            return true;
        }

        /** Nonzero and not NaN. */
        boolean isTrue () {
            return value != 0 && !Double.isNaN(value);
        }

        @Override
        public String toString () {
            return Double.toString(value);
        }
    }

    static final class ArrayValue extends Value {

        final GridExtents extents;

        /** Row-major samples, never written after construction. */
        final double[] values;

        ArrayValue (GridExtents extents, double[] values) {
            this.extents = extents;
            this.values = values;
        }

        int width () {
            return extents.width;
        }

        int height () {
            return extents.height;
        }

        boolean sameShape (ArrayValue other) {
            return width() == other.width() && height() == other.height();
        }

        String shape () {
            return height() + "x" + width();
        }

        @Override
        boolean isScalar () {
            return false;
        }

        @Override
        public String toString () {
            return "array " + shape();
        }
    }

}
