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
 * An immutable 4x4 affine transformation matrix in homogeneous coordinates.
 * <p>
 * The matrix always has the form {@code [[L, t], [0, 0, 0, 1]]}, where {@code L} is a 3x3 linear part 
 * and {@code t} is a translation. Only the first three rows are stored.
 * <p>
 * Points are treated as column vectors, so a point {@code (x, y, z)} is transformed to 
 * {@code L · (x, y, z) + t}.
 * Unlike {@link java.awt.geom.AffineTransform}, matrices here are always specified and exported by row.
 * 
 * @see Matrix3
 */
public final class AffineMatrix {
	
	private static final AffineMatrix IDENTITY = new AffineMatrix(
			1, 0, 0, 0,
			0, 1, 0, 0,
			0, 0, 1, 0);
	
	private static final double[] LAST_ROW = new double[] {0.0, 0.0, 0.0, 1.0};
	
	private final double m00, m01, m02, m03;
	private final double m10, m11, m12, m13;
	private final double m20, m21, m22, m23;
	
	private AffineMatrix(double m00, double m01, double m02, double m03,
			double m10, double m11, double m12, double m13,
			double m20, double m21, double m22, double m23) {
		this.m00 = m00;
		this.m01 = m01;
		this.m02 = m02;
		this.m03 = m03;
		this.m10 = m10;
		this.m11 = m11;
		this.m12 = m12;
		this.m13 = m13;
		this.m20 = m20;
		this.m21 = m21;
		this.m22 = m22;
		this.m23 = m23;
	}
	
	/**
	 * Get the identity transform.
	 * @return
	 */
	public static AffineMatrix identity() {
		return IDENTITY;
	}
	
	/**
	 * Create an affine matrix from a linear part and a translation.
	 * @param linear
	 * @param translation
	 * @return
	 */
	public static AffineMatrix of(Matrix3 linear, Point3 translation) {
		Objects.requireNonNull(linear, "Linear part must not be null!");
		Objects.requireNonNull(translation, "Translation must not be null!");
		return new AffineMatrix(
				linear.get(0, 0), linear.get(0, 1), linear.get(0, 2), translation.getX(),
				linear.get(1, 0), linear.get(1, 1), linear.get(1, 2), translation.getY(),
				linear.get(2, 0), linear.get(2, 1), linear.get(2, 2), translation.getZ()
				);
	}
	
	/**
	 * Create an affine matrix from a 3x4 array, or 4x4 if the last row has the values [0, 0, 0, 1] only.
	 * The array is indexed as {@code [row][column]}.
	 * @param mat
	 * @return
	 * @throws IllegalArgumentException if the input has the wrong shape
	 */
	public static AffineMatrix fromArray(double[][] mat) throws IllegalArgumentException {
		Objects.requireNonNull(mat, "Matrix must not be null!");
		// Accept 4x4 if the last row is valid
		if (mat.length == 4 && Arrays.equals(mat[3], LAST_ROW))
			mat = new double[][] {mat[0], mat[1], mat[2]};
		if (mat.length == 3 && mat[0].length == 4 && mat[1].length == 4 && mat[2].length == 4) {
			return new AffineMatrix(
					mat[0][0], mat[0][1], mat[0][2], mat[0][3],
					mat[1][0], mat[1][1], mat[1][2], mat[1][3],
					mat[2][0], mat[2][1], mat[2][2], mat[2][3]
					);
		}
		throw new IllegalArgumentException("Affine matrix should have size double[3][4], or double[4][4] with last row [0, 0, 0, 1]");
	}
	
	/**
	 * Create an affine matrix from a flat array with 12 elements (3 rows) or 16 elements (4 rows), 
	 * given row by row.
	 * @param values
	 * @return
	 * @throws IllegalArgumentException if the input has the wrong length, or the last row is invalid
	 */
	public static AffineMatrix fromRows(double... values) throws IllegalArgumentException {
		Objects.requireNonNull(values, "Values must not be null!");
		if (values.length != 12 && values.length != 16)
			throw new IllegalArgumentException("Flattened affine matrix should have length 12 or 16, not " + values.length);
		double[][] mat = new double[values.length / 4][];
		for (int r = 0; r < mat.length; r++)
			mat[r] = Arrays.copyOfRange(values, r * 4, r * 4 + 4);
		return fromArray(mat);
	}
	
	/**
	 * Get a single matrix entry, including the implicit last row.
	 * @param row row index (0-3)
	 * @param col column index (0-3)
	 * @return
	 * @throws IndexOutOfBoundsException if either index is out of range
	 */
	public double get(int row, int col) throws IndexOutOfBoundsException {
		Objects.checkIndex(row, 4);
		Objects.checkIndex(col, 4);
		if (row == 3)
			return LAST_ROW[col];
		switch (row * 4 + col) {
		case 0: return m00;
		case 1: return m01;
		case 2: return m02;
		case 3: return m03;
		case 4: return m10;
		case 5: return m11;
		case 6: return m12;
		case 7: return m13;
		case 8: return m20;
		case 9: return m21;
		case 10: return m22;
		default: return m23;
		}
	}
	
	/**
	 * Get the 3x3 linear part of this matrix.
	 * @return
	 */
	public Matrix3 getLinear() {
		return new Matrix3(
				m00, m01, m02,
				m10, m11, m12,
				m20, m21, m22);
	}
	
	/**
	 * Get the translation part of this matrix.
	 * @return
	 */
	public Point3 getTranslation() {
		return new Point3(m03, m13, m23);
	}
	
	/**
	 * Returns true if this is the identity transform.
	 * @return
	 */
	public boolean isIdentity() {
		return equals(IDENTITY);
	}
	
	/**
	 * Create the inverse of this affine matrix.
	 * <p>
	 * The linear part is inverted in full (no orthogonality is assumed) and the new translation 
	 * is {@code -inverse(L) · t}.
	 * 
	 * @return
	 * @throws SingularTransformException if the linear part cannot be inverted
	 */
	public AffineMatrix createInverse() throws SingularTransformException {
		Matrix3 inv = getLinear().createInverse();
		// Same expression order as transform() so that mapping t gives exactly zero
		Point3 t = inv.multiply(getTranslation());
		return of(inv, t.scale(-1.0));
	}
	
	/**
	 * Apply this transform to a single point.
	 * @param x
	 * @param y
	 * @param z
	 * @return
	 */
	public Point3 transform(double x, double y, double z) {
		return new Point3(
				m00 * x + m01 * y + m02 * z + m03,
				m10 * x + m11 * y + m12 * z + m13,
				m20 * x + m21 * y + m22 * z + m23
				);
	}
	
	/**
	 * Apply this transform to an array of points, stored as interleaved x, y, z values.
	 * <p>
	 * Each point is computed exactly as by {@link #transform(double, double, double)}, so results are 
	 * identical to transforming points one at a time.
	 * The source and destination may be the same array, provided the offsets are the same.
	 * 
	 * @param srcPts source coordinates
	 * @param srcOff offset of the first source point in {@code srcPts}
	 * @param dstPts destination array
	 * @param dstOff offset of the first destination point in {@code dstPts}
	 * @param numPts number of points to transform
	 * @throws IndexOutOfBoundsException if either array is too short
	 */
	public void transform(double[] srcPts, int srcOff, double[] dstPts, int dstOff, int numPts) throws IndexOutOfBoundsException {
		Objects.checkFromIndexSize(srcOff, numPts * 3, srcPts.length);
		Objects.checkFromIndexSize(dstOff, numPts * 3, dstPts.length);
		for (int i = 0; i < numPts; i++) {
			int s = srcOff + i * 3;
			int d = dstOff + i * 3;
			double x = srcPts[s];
			double y = srcPts[s+1];
			double z = srcPts[s+2];
			dstPts[d] = m00 * x + m01 * y + m02 * z + m03;
			dstPts[d+1] = m10 * x + m11 * y + m12 * z + m13;
			dstPts[d+2] = m20 * x + m21 * y + m22 * z + m23;
		}
	}
	
	/**
	 * Get the values as a new 4x4 array, indexed as {@code [row][column]}.
	 * @return
	 */
	public double[][] toArray() {
		return new double[][] {
			{m00, m01, m02, m03},
			{m10, m11, m12, m13},
			{m20, m21, m22, m23},
			LAST_ROW.clone()
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
		AffineMatrix other = (AffineMatrix) obj;
		return Arrays.deepEquals(toArray(), other.toArray());
	}

	@Override
	public String toString() {
		return "AffineMatrix: " + Arrays.deepToString(toArray());
	}

}
