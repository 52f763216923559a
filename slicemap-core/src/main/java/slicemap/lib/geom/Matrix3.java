/*-
 * #%L
 * This file is part of SliceMap.
 * %%
 * Copyright (C) 2024 SliceMap developers
 * %%
 * SliceMap is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * SliceMap is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with SliceMap.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */


package slicemap.lib.geom;

import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable 3x3 matrix of doubles.
 * <p>
 * This is used for the linear part of an {@link AffineMatrix}, e.g. a rotation matrix built 
 * from direction cosines with columns optionally scaled by pixel spacing.
 * Values are stored as individual fields, rather than a dynamically shaped array.
 * 
 * @see AffineMatrix
 */
public final class Matrix3 {
	
	private static final Matrix3 IDENTITY = new Matrix3(
			1, 0, 0,
			0, 1, 0,
			0, 0, 1);
	
	private final double m00, m01, m02;
	private final double m10, m11, m12;
	private final double m20, m21, m22;
	
	/**
	 * Create a matrix from values given row by row.
	 */
	@SuppressWarnings("javadoc")
	public Matrix3(double m00, double m01, double m02,
			double m10, double m11, double m12,
			double m20, double m21, double m22) {
		this.m00 = m00;
		this.m01 = m01;
		this.m02 = m02;
		this.m10 = m10;
		this.m11 = m11;
		this.m12 = m12;
		this.m20 = m20;
		this.m21 = m21;
		this.m22 = m22;
	}
	
	/**
	 * Get the 3x3 identity matrix.
	 * @return
	 */
	public static Matrix3 identity() {
		return IDENTITY;
	}
	
	/**
	 * Create a matrix from three column vectors.
	 * @param c0 the first column
	 * @param c1 the second column
	 * @param c2 the third column
	 * @return
	 */
	public static Matrix3 fromColumns(Point3 c0, Point3 c1, Point3 c2) {
		return new Matrix3(
				c0.getX(), c1.getX(), c2.getX(),
				c0.getY(), c1.getY(), c2.getY(),
				c0.getZ(), c1.getZ(), c2.getZ()
				);
	}
	
	/**
	 * Create a matrix from a 3x3 array, indexed as {@code [row][column]}.
	 * @param mat
	 * @return
	 * @throws IllegalArgumentException if the input has the wrong shape
	 */
	public static Matrix3 fromArray(double[][] mat) throws IllegalArgumentException {
		Objects.requireNonNull(mat, "Matrix must not be null!");
		if (mat.length != 3 || mat[0].length != 3 || mat[1].length != 3 || mat[2].length != 3)
			throw new IllegalArgumentException("Matrix should have size double[3][3]");
		return new Matrix3(
				mat[0][0], mat[0][1], mat[0][2],
				mat[1][0], mat[1][1], mat[1][2],
				mat[2][0], mat[2][1], mat[2][2]
				);
	}
	
	/**
	 * Get a single matrix entry.
	 * @param row row index (0, 1 or 2)
	 * @param col column index (0, 1 or 2)
	 * @return
	 * @throws IndexOutOfBoundsException if either index is out of range
	 */
	public double get(int row, int col) throws IndexOutOfBoundsException {
		Objects.checkIndex(row, 3);
		Objects.checkIndex(col, 3);
		switch (row * 3 + col) {
		case 0: return m00;
		case 1: return m01;
		case 2: return m02;
		case 3: return m10;
		case 4: return m11;
		case 5: return m12;
		case 6: return m20;
		case 7: return m21;
		default: return m22;
		}
	}
	
	/**
	 * Get a column of the matrix as a vector.
	 * @param col
	 * @return
	 */
	public Point3 getColumn(int col) {
		return new Point3(get(0, col), get(1, col), get(2, col));
	}
	
	/**
	 * Create a new matrix by multiplying each column by a separate scale factor.
	 * This is equivalent to right-multiplying by a diagonal matrix.
	 * @param scale0 scale factor for the first column
	 * @param scale1 scale factor for the second column
	 * @param scale2 scale factor for the third column
	 * @return
	 */
	public Matrix3 scaleColumns(double scale0, double scale1, double scale2) {
		return new Matrix3(
				m00 * scale0, m01 * scale1, m02 * scale2,
				m10 * scale0, m11 * scale1, m12 * scale2,
				m20 * scale0, m21 * scale1, m22 * scale2
				);
	}
	
	/**
	 * Compute the determinant, by cofactor expansion along the first row.
	 * @return
	 */
	public double determinant() {
		return m00 * (m11 * m22 - m12 * m21)
				+ m01 * (m12 * m20 - m10 * m22)
				+ m02 * (m10 * m21 - m11 * m20);
	}
	
	/**
	 * Compute the inverse of this matrix, using the adjugate.
	 * <p>
	 * No orthogonality is assumed, so this is valid for rotations combined with anisotropic scaling.
	 * The entries are rescaled by a power of two before computing the determinant, so that very large 
	 * or very small (but invertible) matrices do not overflow or underflow. 
	 * 
	 * @return
	 * @throws SingularTransformException if the determinant is zero or any entry is not finite
	 */
	public Matrix3 createInverse() throws SingularTransformException {
		double maxAbs = 0;
		for (double v : toFlatArray()) {
			if (!Double.isFinite(v))
				throw new SingularTransformException("Matrix is not invertible (non-finite entry " + v + ")", determinant());
			maxAbs = Math.max(maxAbs, Math.abs(v));
		}
		if (maxAbs == 0)
			throw new SingularTransformException("Matrix is not invertible (determinant 0.0)", 0.0);
		// Power-of-two scaling is exact
		int exp = Math.getExponent(maxAbs);
		double a00 = Math.scalb(m00, -exp), a01 = Math.scalb(m01, -exp), a02 = Math.scalb(m02, -exp);
		double a10 = Math.scalb(m10, -exp), a11 = Math.scalb(m11, -exp), a12 = Math.scalb(m12, -exp);
		double a20 = Math.scalb(m20, -exp), a21 = Math.scalb(m21, -exp), a22 = Math.scalb(m22, -exp);
		
		double c00 = a11 * a22 - a12 * a21;
		double c01 = a12 * a20 - a10 * a22;
		double c02 = a10 * a21 - a11 * a20;
		double det = a00 * c00 + a01 * c01 + a02 * c02;
		if (det == 0 || !Double.isFinite(det))
			throw new SingularTransformException("Matrix is not invertible (determinant " + determinant() + ")", determinant());
		double c10 = a02 * a21 - a01 * a22;
		double c11 = a00 * a22 - a02 * a20;
		double c12 = a01 * a20 - a00 * a21;
		double c20 = a01 * a12 - a02 * a11;
		double c21 = a02 * a10 - a00 * a12;
		double c22 = a00 * a11 - a01 * a10;
		// Transpose of the cofactors, undoing the scaling
		return new Matrix3(
				Math.scalb(c00 / det, -exp), Math.scalb(c10 / det, -exp), Math.scalb(c20 / det, -exp),
				Math.scalb(c01 / det, -exp), Math.scalb(c11 / det, -exp), Math.scalb(c21 / det, -exp),
				Math.scalb(c02 / det, -exp), Math.scalb(c12 / det, -exp), Math.scalb(c22 / det, -exp)
				);
	}
	
	private double[] toFlatArray() {
		return new double[] {m00, m01, m02, m10, m11, m12, m20, m21, m22};
	}
	
	/**
	 * Multiply this matrix by a column vector.
	 * @param p
	 * @return
	 */
	public Point3 multiply(Point3 p) {
		double x = p.getX();
		double y = p.getY();
		double z = p.getZ();
		return new Point3(
				m00 * x + m01 * y + m02 * z,
				m10 * x + m11 * y + m12 * z,
				m20 * x + m21 * y + m22 * z
				);
	}
	
	/**
	 * Compute the matrix product {@code this · other}.
	 * @param other
	 * @return
	 */
	public Matrix3 multiply(Matrix3 other) {
		return new Matrix3(
				m00 * other.m00 + m01 * other.m10 + m02 * other.m20,
				m00 * other.m01 + m01 * other.m11 + m02 * other.m21,
				m00 * other.m02 + m01 * other.m12 + m02 * other.m22,
				m10 * other.m00 + m11 * other.m10 + m12 * other.m20,
				m10 * other.m01 + m11 * other.m11 + m12 * other.m21,
				m10 * other.m02 + m11 * other.m12 + m12 * other.m22,
				m20 * other.m00 + m21 * other.m10 + m22 * other.m20,
				m20 * other.m01 + m21 * other.m11 + m22 * other.m21,
				m20 * other.m02 + m21 * other.m12 + m22 * other.m22
				);
	}
	
	/**
	 * Get the values as a new 3x3 array, indexed as {@code [row][column]}.
	 * @return
	 */
	public double[][] toArray() {
		return new double[][] {
			{m00, m01, m02},
			{m10, m11, m12},
			{m20, m21, m22}
		};
	}
	
	@Override
	public int hashCode() {
		return Arrays.deepHashCode(toArray());
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Matrix3 other = (Matrix3) obj;
		return Arrays.deepEquals(toArray(), other.toArray());
	}

	@Override
	public String toString() {
		return "Matrix3: " + Arrays.deepToString(toArray());
	}

}
