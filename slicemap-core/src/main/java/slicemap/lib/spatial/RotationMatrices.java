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

import java.util.Objects;

import slicemap.lib.geom.Matrix3;

/**
 * Static methods to build rotation matrices from direction cosines.
 */
public final class RotationMatrices {
	
	private RotationMatrices() {}
	
	/**
	 * Build a 3x3 rotation matrix with columns {@code [row, column, row × column]}.
	 * <p>
	 * The inputs are not checked: if the cosines are not orthonormal, the result is not a rotation.
	 * 
	 * @param orientation
	 * @return
	 */
	public static Matrix3 createRotationMatrix(DirectionCosines orientation) {
		Objects.requireNonNull(orientation, "Orientation must not be null!");
		return Matrix3.fromColumns(orientation.getRow(), orientation.getColumn(), orientation.getNormal());
	}

	/**
	 * Build a 3x3 rotation matrix from six values in DICOM Image Orientation order.
	 * @param orientation row cosines followed by column cosines
	 * @return
	 * @throws IllegalArgumentException if the number of values is not 6
	 * @see #createRotationMatrix(DirectionCosines)
	 */
	public static Matrix3 createRotationMatrix(double... orientation) throws IllegalArgumentException {
		return createRotationMatrix(DirectionCosines.fromImageOrientation(orientation));
	}

}
