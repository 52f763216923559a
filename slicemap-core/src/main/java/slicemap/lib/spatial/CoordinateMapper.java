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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;

import slicemap.lib.common.LogTools;
import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.geom.Point;
import slicemap.lib.geom.Point2;
import slicemap.lib.geom.Point3;
import slicemap.lib.geom.SingularTransformException;

/**
 * Apply affine transforms to coordinates, either one at a time or in bulk.
 * <p>
 * The mapper does not know which direction a matrix represents: 
 * applying a matrix from {@link SliceTransforms#buildTransform(Point3, DirectionCosines, PixelSpacing)} maps 
 * pixel coordinates into the frame of reference, while applying a matrix from 
 * {@link SliceTransforms#buildInverseTransform(Point3, DirectionCosines, PixelSpacing, double)} maps 
 * frame of reference coordinates into the pixel matrix.
 * <p>
 * When mapping from the frame of reference, the third value of the result is the signed distance of the 
 * input from the imaging plane, in units of the spacing between slices. 
 * If this is 0.0, the point lies in the imaging plane; otherwise the column and row values give 
 * the projection of the point onto the plane.
 * <p>
 * When mapping many points, build the matrix once and use one of the batch methods. 
 * Batch results are identical to those computed one point at a time.
 */
public final class CoordinateMapper {
	
	private static final Logger logger = LoggerFactory.getLogger(CoordinateMapper.class);
	
	static final String PER_CALL_HINT = "Building a new transform for each coordinate - for many coordinates, build the transform once and apply it in bulk";
	
	private CoordinateMapper() {}
	
	/**
	 * Apply a transform to a single coordinate.
	 * <p>
	 * Two values are interpreted as a (column, row) pixel coordinate, with an implicit z of 0. 
	 * Three values are used directly.
	 * 
	 * @param affine the transform
	 * @param coordinate 2 or 3 values
	 * @return the transformed coordinate
	 * @throws IllegalArgumentException if the coordinate does not have 2 or 3 values
	 */
	public static Point3 applyTransform(AffineMatrix affine, double... coordinate) throws IllegalArgumentException {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		Objects.requireNonNull(coordinate, "Coordinate must not be null!");
		if (coordinate.length == 2)
			return affine.transform(coordinate[0], coordinate[1], 0.0);
		if (coordinate.length == 3)
			return affine.transform(coordinate[0], coordinate[1], coordinate[2]);
		throw new IllegalArgumentException("Coordinate must have 2 or 3 values, but got " + coordinate.length);
	}
	
	/**
	 * Apply a transform to a point.
	 * @param affine the transform
	 * @param point a 2D pixel coordinate (with implicit z of 0) or a 3D coordinate
	 * @return the transformed coordinate
	 * @throws IllegalArgumentException if the point does not have 2 or 3 dimensions
	 */
	public static Point3 applyTransform(AffineMatrix affine, Point point) throws IllegalArgumentException {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		Objects.requireNonNull(point, "Point must not be null!");
		switch (point.dim()) {
		case 2:
			return affine.transform(point.get(0), point.get(1), 0.0);
		case 3:
			return affine.transform(point.get(0), point.get(1), point.get(2));
		default:
			throw new IllegalArgumentException("Point must have 2 or 3 dimensions, but has " + point.dim());
		}
	}
	
	/**
	 * Apply an inverse transform to a coordinate in the frame of reference.
	 * This is the same operation as {@link #applyTransform(AffineMatrix, double...)}; 
	 * it exists to make the direction explicit in calling code.
	 * 
	 * @param inverse a transform built with {@link SliceTransforms#buildInverseTransform(Point3, DirectionCosines, PixelSpacing, double)}
	 * @param coordinate (x, y, z) coordinate in the frame of reference
	 * @return (column, row, slice) coordinate
	 */
	public static Point3 applyInverseTransform(AffineMatrix inverse, Point3 coordinate) {
		return applyTransform(inverse, coordinate);
	}
	
	/**
	 * Apply an inverse transform to a coordinate in the frame of reference.
	 * As with {@link #applyTransform(AffineMatrix, double...)}, 2 values are padded with z = 0.
	 * @param inverse
	 * @param coordinate (x, y, z) coordinate in the frame of reference
	 * @return (column, row, slice) coordinate
	 * @throws IllegalArgumentException if the coordinate does not have 2 or 3 values
	 */
	public static Point3 applyInverseTransform(AffineMatrix inverse, double... coordinate) throws IllegalArgumentException {
		return applyTransform(inverse, coordinate);
	}
	
	/**
	 * Apply a transform to a list of points, returning the results in the same order.
	 * Each point may be 2D (with implicit z of 0) or 3D.
	 * 
	 * @param affine the transform
	 * @param points the points to transform
	 * @return an unmodifiable list of transformed points
	 * @throws IllegalArgumentException if any point does not have 2 or 3 dimensions
	 */
	public static List<Point3> applyTransform(AffineMatrix affine, List<? extends Point> points) throws IllegalArgumentException {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		Objects.requireNonNull(points, "Points must not be null!");
		int n = points.size();
		double[] coords = new double[n * 3];
		int i = 0;
		for (Point p : points) {
			int dim = p.dim();
			if (dim != 2 && dim != 3)
				throw new IllegalArgumentException("Point must have 2 or 3 dimensions, but has " + dim);
			coords[i++] = p.get(0);
			coords[i++] = p.get(1);
			coords[i++] = dim == 3 ? p.get(2) : 0.0;
		}
		affine.transform(coords, 0, coords, 0, n);
		List<Point3> results = new ArrayList<>(n);
		for (int k = 0; k < n * 3; k += 3)
			results.add(new Point3(coords[k], coords[k+1], coords[k+2]));
		logger.trace("Transformed {} points", n);
		return Collections.unmodifiableList(results);
	}
	
	/**
	 * Apply a transform to an array of coordinates, returning a new {@code double[n][3]} array.
	 * Each input row must have 2 values (with implicit z of 0) or 3 values.
	 * 
	 * @param affine the transform
	 * @param coordinates the coordinates to transform, one row per point
	 * @return the transformed coordinates, one row per point
	 * @throws IllegalArgumentException if any row does not have 2 or 3 values
	 */
	public static double[][] applyTransform(AffineMatrix affine, double[][] coordinates) throws IllegalArgumentException {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		Objects.requireNonNull(coordinates, "Coordinates must not be null!");
		int n = coordinates.length;
		double[] coords = new double[n * 3];
		for (int i = 0; i < n; i++) {
			double[] c = coordinates[i];
			if (c.length != 2 && c.length != 3)
				throw new IllegalArgumentException("Coordinate " + i + " must have 2 or 3 values, but has " + c.length);
			coords[i*3] = c[0];
			coords[i*3+1] = c[1];
			coords[i*3+2] = c.length == 3 ? c[2] : 0.0;
		}
		affine.transform(coords, 0, coords, 0, n);
		double[][] results = new double[n][];
		for (int i = 0; i < n; i++)
			results[i] = new double[] {coords[i*3], coords[i*3+1], coords[i*3+2]};
		return results;
	}
	
	/**
	 * Apply a transform to coordinates stored as interleaved x, y, z values.
	 * This avoids creating any objects per point.
	 * 
	 * @param affine the transform
	 * @param srcPts source coordinates
	 * @param srcOff offset of the first source point
	 * @param dstPts destination array (may be the same as the source, if the offsets match)
	 * @param dstOff offset of the first destination point
	 * @param numPts number of points
	 * @see AffineMatrix#transform(double[], int, double[], int, int)
	 */
	public static void transformPoints(AffineMatrix affine, double[] srcPts, int srcOff, double[] dstPts, int dstOff, int numPts) {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		affine.transform(srcPts, srcOff, dstPts, dstOff, numPts);
	}
	
	/**
	 * Map a coordinate in the pixel matrix into the frame of reference.
	 * <p>
	 * This builds a new transform on every call. When mapping many coordinates, use 
	 * {@link SliceTransforms#buildTransform(Point3, DirectionCosines, PixelSpacing)} once and then 
	 * {@link #applyTransform(AffineMatrix, List)}.
	 * 
	 * @param coordinate (column, row) pixel coordinate
	 * @param imagePosition
	 * @param orientation
	 * @param pixelSpacing
	 * @return (x, y, z) coordinate in the frame of reference
	 */
	public static Point3 mapPixelIntoCoordinateSystem(Point2 coordinate, Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing) {
		logPerPointUse();
		AffineMatrix affine = SliceTransforms.buildTransform(imagePosition, orientation, pixelSpacing);
		return applyTransform(affine, coordinate);
	}
	
	/**
	 * Map a coordinate in the frame of reference into the pixel matrix, using the default spacing between slices.
	 * @param coordinate (x, y, z) coordinate in the frame of reference
	 * @param imagePosition
	 * @param orientation
	 * @param pixelSpacing
	 * @return (column, row, slice) coordinate
	 * @throws SingularTransformException if the transform cannot be inverted
	 * @see #mapCoordinateIntoPixelMatrix(Point3, Point3, DirectionCosines, PixelSpacing, double)
	 */
	public static Point3 mapCoordinateIntoPixelMatrix(Point3 coordinate, Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing) throws SingularTransformException {
		return mapCoordinateIntoPixelMatrix(coordinate, imagePosition, orientation, pixelSpacing, SliceTransforms.DEFAULT_SPACING_BETWEEN_SLICES);
	}
	
	/**
	 * Map a coordinate in the frame of reference into the pixel matrix.
	 * <p>
	 * This builds a new transform on every call. When mapping many coordinates, use 
	 * {@link SliceTransforms#buildInverseTransform(Point3, DirectionCosines, PixelSpacing, double)} once and then 
	 * {@link #applyTransform(AffineMatrix, List)}.
	 * 
	 * @param coordinate (x, y, z) coordinate in the frame of reference
	 * @param imagePosition
	 * @param orientation
	 * @param pixelSpacing
	 * @param spacingBetweenSlices
	 * @return (column, row, slice) coordinate; a slice value of 0.0 means the coordinate lies in the imaging plane
	 * @throws SingularTransformException if the transform cannot be inverted
	 */
	public static Point3 mapCoordinateIntoPixelMatrix(Point3 coordinate, Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing, double spacingBetweenSlices) throws SingularTransformException {
		logPerPointUse();
		AffineMatrix inverse = SliceTransforms.buildInverseTransform(imagePosition, orientation, pixelSpacing, spacingBetweenSlices);
		return applyInverseTransform(inverse, coordinate);
	}
	
	private static void logPerPointUse() {
		LogTools.logOnce(logger, Level.DEBUG, PER_CALL_HINT);
	}

}
