package org.janelia.astrometry.transform;

import Jama.Matrix;
import Jama.SingularValueDecomposition;

import java.io.Serializable;
import java.util.Arrays;

import org.janelia.astrometry.geom.PlanePoint;

/**
 * Immutable 3x3 homogeneous transform (affine when the last row is [0, 0, 1]).
 */
public class LinearTransform
        implements PointTransform, Serializable {

    /** Linear parts with a larger condition number are considered singular. */
    public static final double MAX_CONDITION_NUMBER = 1.0e12;

    public static final LinearTransform IDENTITY = new LinearTransform(1, 0, 0,
                                                                       0, 1, 0);

    private final double[] m;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private LinearTransform() {
        this.m = IDENTITY.getMatrix();
    }

    /**
     * Creates an affine transform: x' = m00 x + m01 y + m02, y' = m10 x + m11 y + m12.
     */
    public LinearTransform(final double m00, final double m01, final double m02,
                           final double m10, final double m11, final double m12) {
        this(new double[] { m00, m01, m02, m10, m11, m12, 0, 0, 1 });
    }

    /**
     * @param  rowMajor  9 matrix elements in row major order.
     */
    public LinearTransform(final double[] rowMajor)
            throws IllegalArgumentException {
        if (rowMajor.length != 9) {
            throw new IllegalArgumentException("linear transform needs 9 elements but " +
                                               rowMajor.length + " were provided");
        }
        this.m = rowMajor.clone();
    }

    public double get(final int row,
                      final int column) {
        return m[row * 3 + column];
    }

    /**
     * @return copy of the matrix elements in row major order.
     */
    public double[] getMatrix() {
        return m.clone();
    }

    public boolean isAffine() {
        return (m[6] == 0.0) && (m[7] == 0.0) && (m[8] == 1.0);
    }

    @Override
    public PlanePoint apply(final PlanePoint point) {
        final double x = point.getX();
        final double y = point.getY();
        final double w = m[6] * x + m[7] * y + m[8];
        return new PlanePoint((m[0] * x + m[1] * y + m[2]) / w,
                              (m[3] * x + m[4] * y + m[5]) / w);
    }

    /**
     * @return scale factor along the first output axis (norm of the first row of the linear part).
     */
    public double getScaleX() {
        return Math.hypot(m[0], m[1]);
    }

    /**
     * @return scale factor along the second output axis (norm of the second row of the linear part).
     */
    public double getScaleY() {
        return Math.hypot(m[3], m[4]);
    }

    public double getDeterminant() {
        return m[0] * m[4] - m[1] * m[3];
    }

    /**
     * @return the transform that applies the specified transform first and then this one.
     */
    public LinearTransform concatenate(final LinearTransform first) {
        final double[] product = new double[9];
        for (int row = 0; row < 3; row++) {
            for (int column = 0; column < 3; column++) {
                double sum = 0;
                for (int k = 0; k < 3; k++) {
                    sum += m[row * 3 + k] * first.m[k * 3 + column];
                }
                product[row * 3 + column] = sum;
            }
        }
        return new LinearTransform(product);
    }

    /**
     * @throws NoninvertibleTransformException
     *   if the linear part of this transform is singular or ill conditioned.
     */
    public LinearTransform inverse()
            throws NoninvertibleTransformException {

        final Matrix linearPart = new Matrix(new double[][] {{m[0], m[1]}, {m[3], m[4]}});
        final double[] singularValues = new SingularValueDecomposition(linearPart).getSingularValues();
        final double smallest = singularValues[singularValues.length - 1];
        if ((smallest == 0.0) || (singularValues[0] / smallest > MAX_CONDITION_NUMBER)) {
            throw new NoninvertibleTransformException("cannot invert singular transform " + this);
        }

        final Matrix full = new Matrix(new double[][] {
                {m[0], m[1], m[2]},
                {m[3], m[4], m[5]},
                {m[6], m[7], m[8]}
        });
        if (full.det() == 0.0) {
            throw new NoninvertibleTransformException("cannot invert singular transform " + this);
        }
        final double[][] inverse = full.inverse().getArray();
        return new LinearTransform(new double[] {
                inverse[0][0], inverse[0][1], inverse[0][2],
                inverse[1][0], inverse[1][1], inverse[1][2],
                inverse[2][0], inverse[2][1], inverse[2][2]
        });
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return Arrays.equals(m, ((LinearTransform) o).m);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(m);
    }

    @Override
    public String toString() {
        return Arrays.toString(m);
    }
}
