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

import slicemap.lib.common.GeneralTools;
import slicemap.lib.geom.Point3;

/**
 * Direction cosines of the row and column axes of a pixel matrix, expressed in the 
 * frame of reference (patient or slide coordinate system).
 * <p>
 * The row direction is horizontal (left to right, increasing column index) and 
 * the column direction is vertical (top to bottom, increasing row index).
 * <p>
 * Values are stored as given: no normalization is applied and no orthogonality is enforced.
 * Use {@link #isOrthonormal(double)} if this needs to be checked.
 */
public final class DirectionCosines {
	
	private static final DirectionCosines IDENTITY = new DirectionCosines(
			new Point3(1, 0, 0), new Point3(0, 1, 0));
	
	private final Point3 row;
	private final Point3 column;
	
	private DirectionCosines(Point3 row, Point3 column) {
		this.row = Objects.requireNonNull(row, "Row cosines must not be null!");
		this.column = Objects.requireNonNull(column, "Column cosines must not be null!");
	}
	
	/**
	 * Create direction cosines from separate row and column vectors.
	 * @param row direction of increasing column index
	 * @param column direction of increasing row index
	 * @return
	 */
	public static DirectionCosines of(Point3 row, Point3 column) {
		return new DirectionCosines(row, column);
	}
	
	/**
	 * Create direction cosines from six values, in the order used by the DICOM Image Orientation attribute: 
	 * row cosines (indices 0-2) followed by column cosines (indices 3-5).
	 * @param orientation
	 * @return
	 * @throws IllegalArgumentException if the number of values is not 6
	 */
	public static DirectionCosines fromImageOrientation(double... orientation) throws IllegalArgumentException {
		Objects.requireNonNull(orientation, "Image orientation must not be null!");
		if (orientation.length != 6)
			throw new IllegalArgumentException("Image orientation requires 6 values, but got " + orientation.length);
		return new DirectionCosines(
				new Point3(orientation[0], orientation[1], orientation[2]),
				new Point3(orientation[3], orientation[4], orientation[5]));
	}
	
	/**
	 * Get direction cosines aligned with the x and y axes of the frame of reference.
	 * @return
	 */
	public static DirectionCosines identity() {
		return IDENTITY;
	}
	
	/**
	 * Get the row direction cosines (direction of increasing column index).
	 * @return
	 */
	public Point3 getRow() {
		return row;
	}
	
	/**
	 * Get the column direction cosines (direction of increasing row index).
	 * @return
	 */
	public Point3 getColumn() {
		return column;
	}
	
	/**
	 * Get the normal of the imaging plane, {@code row × column}.
	 * @return
	 */
	public Point3 getNormal() {
		return row.cross(column);
	}
	
	/**
	 * Returns true if the z-component of both row and column cosines is exactly zero, 
	 * i.e. the pixel matrix lies in the x-y plane of the frame of reference.
	 * @return
	 */
	public boolean isPlanar() {
		return row.getZ() == 0.0 && column.getZ() == 0.0;
	}
	
	/**
	 * Returns true if the row and column cosines both have unit length and are orthogonal, 
	 * within an absolute tolerance.
	 * @param tolerance
	 * @return
	 */
	public boolean isOrthonormal(double tolerance) {
		return GeneralTools.almostZero(row.norm() - 1.0, tolerance) &&
				GeneralTools.almostZero(column.norm() - 1.0, tolerance) &&
				GeneralTools.almostZero(row.dot(column), tolerance);
	}
	
	/**
	 * Get the six values in DICOM Image Orientation order.
	 * @return
	 */
	public double[] toArray() {
		return new double[] {
				row.getX(), row.getY(), row.getZ(),
				column.getX(), column.getY(), column.getZ()
		};
	}

	@Override
	public int hashCode() {
		return Objects.hash(row, column);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		DirectionCosines other = (DirectionCosines) obj;
		return row.equals(other.row) && column.equals(other.column);
	}

	@Override
	public String toString() {
		return "DirectionCosines [row=" + row + ", column=" + column + "]";
	}

}
