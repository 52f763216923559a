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


package slicemap.lib.spatial;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import slicemap.lib.common.LogTools;
import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.geom.Point;
import slicemap.lib.geom.Point2;
import slicemap.lib.geom.Point3;
import slicemap.lib.geom.SingularTransformException;

@SuppressWarnings("javadoc")
public class TestCoordinateMapper {
	
	private static final Point3 POSITION = new Point3(-12.5, 104.75, 33.0);
	private static final DirectionCosines ORIENTATION = TestSliceTransforms.createOrientation(Math.toRadians(25), Math.toRadians(-40));
	private static final PixelSpacing SPACING = PixelSpacing.of(0.7, 0.35);
	
	@Test
	public void test_padding() {
		var forward = SliceTransforms.buildTransform(POSITION, ORIENTATION, SPACING);
		// 2D coordinates are treated as lying in the plane
		assertEquals(CoordinateMapper.applyTransform(forward, 5, 7, 0), CoordinateMapper.applyTransform(forward, 5, 7));
		assertEquals(CoordinateMapper.applyTransform(forward, 5, 7), CoordinateMapper.applyTransform(forward, new Point2(5, 7)));
		assertEquals(CoordinateMapper.applyTransform(forward, 5, 7, 2), CoordinateMapper.applyTransform(forward, new Point3(5, 7, 2)));
		
		assertThrows(IllegalArgumentException.class, () -> CoordinateMapper.applyTransform(forward, 1.0));
		assertThrows(IllegalArgumentException.class, () -> CoordinateMapper.applyTransform(forward, 1, 2, 3, 4));
		assertEquals(CoordinateMapper.applyTransform(forward, 1, 2), CoordinateMapper.applyInverseTransform(forward, 1, 2));
		assertThrows(IllegalArgumentException.class, () -> CoordinateMapper.applyInverseTransform(forward, 1, 2, 3, 4));
		assertThrows(NullPointerException.class, () -> CoordinateMapper.applyTransform(null, 1, 2));
	}
	
	@Test
	public void test_directionAgnostic() {
		var affine = AffineMatrix.fromRows(
				1, 0, 0, 5,
				0, 1, 0, 6,
				0, 0, 1, 7);
		var p = new Point3(1, 2, 3);
		assertEquals(new Point3(6, 8, 10), CoordinateMapper.applyTransform(affine, p));
		assertEquals(CoordinateMapper.applyTransform(affine, p), CoordinateMapper.applyInverseTransform(affine, p));
	}
	
	@Test
	public void test_batchMatchesSinglePoints() {
		var forward = SliceTransforms.buildTransform(POSITION, ORIENTATION, SPACING);
		var inverse = SliceTransforms.buildInverseTransform(POSITION, ORIENTATION, SPACING, 1.5);
		var rand = new Random(42L);
		int n = 1000;
		
		var pixels = new ArrayList<Point2>();
		double[][] pixelArray = new double[n][];
		for (int i = 0; i < n; i++) {
			var p = new Point2(rand.nextDouble() * 2048, rand.nextDouble() * 2048);
			pixels.add(p);
			pixelArray[i] = p.toArray();
		}
		
		List<Point3> references = CoordinateMapper.applyTransform(forward, pixels);
		double[][] referenceArray = CoordinateMapper.applyTransform(forward, pixelArray);
		assertEquals(n, references.size());
		assertEquals(n, referenceArray.length);
		for (int i = 0; i < n; i++) {
			var single = CoordinateMapper.applyTransform(forward, pixels.get(i));
			// Bitwise identical, in the same order
			assertEquals(single, references.get(i));
			assertArrayEquals(single.toArray(), referenceArray[i]);
		}
		
		List<Point3> backToPixels = CoordinateMapper.applyTransform(inverse, references);
		for (int i = 0; i < n; i++) {
			assertEquals(CoordinateMapper.applyInverseTransform(inverse, references.get(i)), backToPixels.get(i));
			assertEquals(pixels.get(i).getX(), backToPixels.get(i).getX(), 1e-9);
			assertEquals(pixels.get(i).getY(), backToPixels.get(i).getY(), 1e-9);
		}
		
		// Flat arrays
		double[] flat = new double[n * 3];
		for (int i = 0; i < n; i++)
			System.arraycopy(referenceArray[i], 0, flat, i * 3, 3);
		double[] flatPixels = new double[n * 3];
		CoordinateMapper.transformPoints(inverse, flat, 0, flatPixels, 0, n);
		for (int i = 0; i < n; i++)
			assertArrayEquals(backToPixels.get(i).toArray(), Arrays.copyOfRange(flatPixels, i * 3, i * 3 + 3));
	}
	
	@Test
	public void test_batchEdgeCases() {
		var forward = SliceTransforms.buildTransform(POSITION, ORIENTATION, SPACING);
		assertEquals(List.of(), CoordinateMapper.applyTransform(forward, List.<Point>of()));
		assertEquals(0, CoordinateMapper.applyTransform(forward, new double[0][]).length);
		
		// Mixed 2D and 3D points
		List<Point> mixed = List.of(new Point2(1, 2), new Point3(1, 2, 0), new Point3(1, 2, 5));
		var results = CoordinateMapper.applyTransform(forward, mixed);
		assertEquals(results.get(0), results.get(1));
		assertEquals(CoordinateMapper.applyTransform(forward, 1, 2, 5), results.get(2));
		assertThrows(UnsupportedOperationException.class, () -> results.add(Point3.origin()));
		
		assertThrows(IllegalArgumentException.class, () -> CoordinateMapper.applyTransform(forward, new double[][] {{1, 2}, {1}}));
	}
	
	@Test
	public void test_convenienceMethods() {
		var pixel = new Point2(100.5, 42.25);
		var reference = CoordinateMapper.mapPixelIntoCoordinateSystem(pixel, POSITION, ORIENTATION, SPACING);
		assertEquals(CoordinateMapper.applyTransform(SliceTransforms.buildTransform(POSITION, ORIENTATION, SPACING), pixel), reference);
		
		var back = CoordinateMapper.mapCoordinateIntoPixelMatrix(reference, POSITION, ORIENTATION, SPACING);
		assertEquals(pixel.getX(), back.getX(), 1e-9);
		assertEquals(pixel.getY(), back.getY(), 1e-9);
		assertEquals(0.0, back.getZ(), 1e-9);
		
		// Off-plane points give a non-zero slice coordinate, in units of the spacing between slices
		var normal = ORIENTATION.getNormal();
		var offPlane = new Point3(
				reference.getX() + normal.getX() * 6, 
				reference.getY() + normal.getY() * 6, 
				reference.getZ() + normal.getZ() * 6);
		var projected = CoordinateMapper.mapCoordinateIntoPixelMatrix(offPlane, POSITION, ORIENTATION, SPACING, 2.0);
		assertEquals(pixel.getX(), projected.getX(), 1e-9);
		assertEquals(pixel.getY(), projected.getY(), 1e-9);
		assertEquals(3.0, projected.getZ(), 1e-9);
		
		assertThrows(SingularTransformException.class, () -> CoordinateMapper.mapCoordinateIntoPixelMatrix(offPlane, POSITION, ORIENTATION, PixelSpacing.of(0, 1)));
	}
	
	@Test
	public void test_perCallHintLoggedOnce() {
		var logger = (Logger)LoggerFactory.getLogger(CoordinateMapper.class);
		var appender = new ListAppender<ILoggingEvent>();
		appender.start();
		logger.addAppender(appender);
		try {
			for (int i = 0; i < 10; i++) {
				var reference = CoordinateMapper.mapPixelIntoCoordinateSystem(new Point2(i, 2 * i), POSITION, ORIENTATION, SPACING);
				CoordinateMapper.mapCoordinateIntoPixelMatrix(reference, POSITION, ORIENTATION, SPACING);
			}
		} finally {
			logger.detachAppender(appender);
		}
		long nHints = appender.list.stream()
				.filter(e -> CoordinateMapper.PER_CALL_HINT.equals(e.getFormattedMessage()))
				.count();
		// Other tests in this class may have triggered the hint first
		assertTrue(nHints <= 1);
		assertFalse(LogTools.logOnce(logger, Level.DEBUG, CoordinateMapper.PER_CALL_HINT));
	}

}
