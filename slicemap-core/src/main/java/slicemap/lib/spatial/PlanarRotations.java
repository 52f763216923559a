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

import slicemap.lib.geom.Matrix3;

/**
 * Compute the in-plane rotation of a pixel matrix relative to the frame of reference.
 * <p>
 * This is only meaningful if both coordinate systems are related by a rotation within the 
 * x-y plane of the frame of reference, as is usual for slide microscopy.
 */
public final class PlanarRotations {
	
	private PlanarRotations() {}
	
	/**
	 * Compute the rotation angle in radians.
	 * @param orientation six values in DICOM Image Orientation order
	 * @return
	 * @throws InvalidGeometryException if the orientation is not a planar rotation, or is flipped
	 * @see #computeRotation(double[], boolean)
	 */
	public static double computeRotation(double... orientation) throws InvalidGeometryException {
		return computeRotation(orientation, false);
	}

	/**
	 * Compute the rotation angle, optionally in degrees.
	 * @param orientation six values in DICOM Image Orientation order
	 * @param inDegrees if true, return the angle in degrees rather than radians
	 * @return the angle, in the range (-&pi;, &pi;] (or (-180, 180])
	 * @throws InvalidGeometryException if the orientation is not a planar rotation, or is flipped
	 */
	public static double computeRotation(double[] orientation, boolean inDegrees) throws InvalidGeometryException {
		return computeRotation(DirectionCosines.fromImageOrientation(orientation), inDegrees);
	}
	
	/**
	 * Compute the rotation angle, optionally in degrees.
	 * <p>
	 * The z-components of both row and column cosines must be exactly zero, and the normal of the 
	 * pixel matrix must not point in the negative z direction (which would mean the pixel matrix 
	 * is mirrored relative to the frame of reference).
	 * 
	 * @param orientation
	 * @param inDegrees if true, return the angle in degrees rather than radians
	 * @return the angle, in the range (-&pi;, &pi;] (or (-180, 180])
	 * @throws InvalidGeometryException if the orientation is not a planar rotation, or is flipped
	 */
	public static double computeRotation(DirectionCosines orientation, boolean inDegrees) throws InvalidGeometryException {
		if (!orientation.isPlanar())
			throw new InvalidGeometryException("Image orientation " + orientation + " is not a planar rotation relative to the frame of reference");
		Matrix3 rotation = RotationMatrices.createRotationMatrix(orientation);
		if (rotation.get(2, 2) < 0.0)
			throw new InvalidGeometryException("Image orientation " + orientation + " is flipped relative to the frame of reference");
		double angle = Math.atan2(-rotation.get(0, 1), rotation.get(0, 0));
		// atan2 gives -pi for a negative zero y; keep the range (-pi, pi]
		if (angle == -Math.PI)
			angle = Math.PI;
		return inDegrees ? Math.toDegrees(angle) : angle;
	}

}
