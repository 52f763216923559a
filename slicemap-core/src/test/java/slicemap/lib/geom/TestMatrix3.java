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

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

@SuppressWarnings("javadoc")
public class TestMatrix3 {
	
	private static final Matrix3 M = new Matrix3(
			1, 2, 3,
			0, 1, 4,
			5, 6, 0);
	
	@Test
	public void test_determinant() {
		assertEquals(1.0, Matrix3.identity().determinant(), 0.0);
		assertEquals(1.0, M.determinant(), 0.0);
		assertEquals(24.0, new Matrix3(2, 0, 0, 0, 3, 0, 0, 0, 4).determinant(), 0.0);
		assertEquals(0.0, new Matrix3(1, 2, 3, 2, 4, 6, 0, 0, 1).determinant(), 0.0);
	}
	
	@Test
	public void test_inverse() {
		var inv = M.createInverse();
		assertEquals(new Matrix3(
				-24, 18, 5,
				20, -15, -4,
				-5, 4, 1), inv);
		assertMatrixEquals(Matrix3.identity(), M.multiply(inv), 0.0);
		assertMatrixEquals(Matrix3.identity(), inv.multiply(M), 0.0);
		
		var diag = new Matrix3(2, 0, 0, 0, 4, 0, 0, 0, 8).createInverse();
		assertEquals(0.5, diag.get(0, 0), 0.0);
		assertEquals(0.25, diag.get(1, 1), 0.0);
		assertEquals(0.125, diag.get(2, 2), 0.0);
	}
	
	@Test
	public void test_inverseExtremeScales() {
		// Determinants overflow (1e600) or underflow (1e-450), but the matrices are invertible
		var large = new Matrix3(1e200, 0, 0, 0, 1e200, 0, 0, 0, 1e200);
		assertEquals(Double.POSITIVE_INFINITY, large.determinant(), 0.0);
		var largeInverse = large.createInverse();
		for (int i = 0; i < 3; i++)
			assertEquals(1e-200, largeInverse.get(i, i), 1e-212);
		
		var small = new Matrix3(1e-150, 2e-150, 0, 0, 1e-150, 0, 0, 0, 1e-150);
		assertEquals(0.0, small.determinant(), 0.0);
		assertMatrixEquals(Matrix3.identity(), small.multiply(small.createInverse()), 1e-12);
		
		// Scaled versions of the same matrix have scaled inverses
		var scaledInverse = new Matrix3(
				1e180, 2e180, 3e180,
				0, 1e180, 4e180,
				5e180, 6e180, 0).createInverse();
		var inv = M.createInverse();
		for (int r = 0; r < 3; r++) {
			for (int c = 0; c < 3; c++)
				assertEquals(inv.get(r, c) * 1e-180, scaledInverse.get(r, c), 1e-190);
		}
	}
	
	@Test
	public void test_singular() {
		var singular = new Matrix3(0, 0, 0, 0, 1, 0, 0, 0, 1);
		var e = assertThrows(SingularTransformException.class, () -> singular.createInverse());
		assertEquals(0.0, e.getDeterminant(), 0.0);
		
		var collinear = Matrix3.fromColumns(new Point3(1, 0, 0), new Point3(1, 0, 0), new Point3(0, 0, 0));
		assertThrows(SingularTransformException.class, () -> collinear.createInverse());
		
		var nan = new Matrix3(Double.NaN, 0, 0, 0, 1, 0, 0, 0, 1);
		assertThrows(SingularTransformException.class, () -> nan.createInverse());
	}
	
	@Test
	public void test_columns() {
		var m = Matrix3.fromColumns(new Point3(1, 2, 3), new Point3(4, 5, 6), new Point3(7, 8, 9));
		assertArrayEquals(new double[] {1, 4, 7}, m.toArray()[0]);
		assertEquals(new Point3(4, 5, 6), m.getColumn(1));
		
		var scaled = m.scaleColumns(2, 0.5, -1);
		assertEquals(new Point3(2, 4, 6), scaled.getColumn(0));
		assertEquals(new Point3(2, 2.5, 3), scaled.getColumn(1));
		assertEquals(new Point3(-7, -8, -9), scaled.getColumn(2));
		
		assertEquals(new Point3(16, 20, 24), m.multiply(new Point3(1, 2, 1)));
	}
	
	@Test
	public void test_fromArray() {
		assertEquals(M, Matrix3.fromArray(M.toArray()));
		assertThrows(IllegalArgumentException.class, () -> Matrix3.fromArray(new double[][] {{1, 2, 3}, {4, 5, 6}}));
		assertThrows(IllegalArgumentException.class, () -> Matrix3.fromArray(new double[][] {{1, 2, 3}, {4, 5, 6}, {7, 8}}));
		assertThrows(IndexOutOfBoundsException.class, () -> M.get(3, 0));
		assertThrows(IndexOutOfBoundsException.class, () -> M.get(0, -1));
	}

	static void assertMatrixEquals(Matrix3 expected, Matrix3 actual, double delta) {
		double[][] e = expected.toArray();
		double[][] a = actual.toArray();
		for (int r = 0; r < 3; r++)
			assertArrayEquals(e[r], a[r], delta);
	}

}
