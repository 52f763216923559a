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


package slicemap.lib.awt.common;

import java.awt.geom.AffineTransform;
import java.util.Objects;

import org.locationtech.jts.geom.util.AffineTransformation;

import slicemap.lib.geom.AffineMatrix;

/**
 * Helper class for converting between {@link AffineMatrix} and 2D affine transforms.
 * <p>
 * Two 2D implementations are supported: {@link AffineTransform} from Java itself 
 * and {@link AffineTransformation} from Java Topology Suite.
 * Inconveniently, both are initialized from flattened double arrays using a different ordering (assuming 
 * columns-first or rows-first), so conversions are done here rather than by callers.
 * <p>
 * Conversion is only possible if the x and y outputs of the matrix do not depend upon the input z. 
 * This is true for slices with a planar orientation, e.g. slide microscopy images where the 
 * frame of reference is the slide coordinate system. 
 * The z row of the matrix is discarded.
 */
public class AffineTransforms {
	
	/**
	 * Returns true if the x and y outputs of the matrix are independent of the input z, 
	 * and therefore the matrix can be represented as a 2D affine transform.
	 * @param affine
	 * @return
	 */
	public static boolean is2D(AffineMatrix affine) {
		return affine.get(0, 2) == 0.0 && affine.get(1, 2) == 0.0;
	}
	
	/**
	 * Create a Java affine transform from the x and y rows of a 4x4 affine matrix.
	 * @param affine
	 * @return
	 * @throws IllegalArgumentException if the matrix cannot be represented in 2D
	 * @see #is2D(AffineMatrix)
	 */
	public static AffineTransform toAffineTransform2D(AffineMatrix affine) throws IllegalArgumentException {
		checkIs2D(affine);
		return new AffineTransform(
				affine.get(0, 0), affine.get(1, 0),
				affine.get(0, 1), affine.get(1, 1),
				affine.get(0, 3), affine.get(1, 3));
	}
	
	/**
	 * Create a Java Topology Suite affine transformation from the x and y rows of a 4x4 affine matrix.
	 * This can be used to transform geometries between the pixel matrix and the frame of reference.
	 * @param affine
	 * @return
	 * @throws IllegalArgumentException if the matrix cannot be represented in 2D
	 * @see #is2D(AffineMatrix)
	 */
	public static AffineTransformation toJTS(AffineMatrix affine) throws IllegalArgumentException {
		checkIs2D(affine);
		return new AffineTransformation(
				affine.get(0, 0), affine.get(0, 1), affine.get(0, 3),
				affine.get(1, 0), affine.get(1, 1), affine.get(1, 3));
	}
	
	/**
	 * Create a 4x4 affine matrix from a Java affine transform, leaving z unchanged.
	 * @param transform
	 * @return
	 */
	public static AffineMatrix fromAffineTransform2D(AffineTransform transform) {
		Objects.requireNonNull(transform, "Transform must not be null!");
		return AffineMatrix.fromRows(
				transform.getScaleX(), transform.getShearX(), 0, transform.getTranslateX(),
				transform.getShearY(), transform.getScaleY(), 0, transform.getTranslateY(),
				0, 0, 1, 0);
	}
	
	private static void checkIs2D(AffineMatrix affine) throws IllegalArgumentException {
		Objects.requireNonNull(affine, "Affine matrix must not be null!");
		if (!is2D(affine))
			throw new IllegalArgumentException("Affine matrix depends on z and cannot be converted to a 2D transform: " + affine);
	}

}
