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

import java.util.Objects;

/**
 * A 3D point (x, y &amp; z coordinates).
 * <p>
 * This is used both for locations (e.g. the image position in the frame of reference, 
 * or a (column, row, slice) coordinate in the pixel matrix) and for direction vectors, 
 * so also provides the basic vector operations needed to build transforms.
 */
public final class Point3 implements Point {
	
	private static final Point3 ORIGIN = new Point3(0, 0, 0);
	
	private final double x, y, z;
	
	/**
	 * Point constructor.
	 * @param x
	 * @param y
	 * @param z
	 */
	public Point3(final double x, final double y, final double z) {
		this.x = x;
		this.y = y;
		this.z = z;
	}
	
	/**
	 * Create a point from an array containing exactly 3 values.
	 * @param values
	 * @return
	 * @throws IllegalArgumentException if the array does not have length 3
	 */
	public static Point3 fromArray(double... values) throws IllegalArgumentException {
		Objects.requireNonNull(values, "Values must not be null!");
		if (values.length != 3)
			throw new IllegalArgumentException("Expected 3 values for a 3D point, but got " + values.length);
		return new Point3(values[0], values[1], values[2]);
	}
	
	/**
	 * Get a point at (0, 0, 0).
	 * @return
	 */
	public static Point3 origin() {
		return ORIGIN;
	}
	
	/**
	 * Get the x coordinate of this point.
	 * @return
	 */
	public double getX() {
		return x;
	}

	/**
	 * Get the y coordinate of this point.
	 * @return
	 */
	public double getY() {
		return y;
	}

	/**
	 * Get the z coordinate of this point.
	 * <p>
	 * For a pixel matrix coordinate this is the slice offset, in units of the spacing between slices.
	 * @return
	 */
	public double getZ() {
		return z;
	}
	
	/**
	 * Compute the dot product of this point with another, treating both as vectors.
	 * @param p
	 * @return
	 */
	public double dot(final Point3 p) {
		return x * p.x + y * p.y + z * p.z;
	}
	
	/**
	 * Compute the cross product {@code this × p}, treating both points as vectors.
	 * @param p
	 * @return
	 */
	public Point3 cross(final Point3 p) {
		return new Point3(
				y * p.z - z * p.y,
				z * p.x - x * p.z,
				x * p.y - y * p.x
				);
	}
	
	/**
	 * Multiply all coordinates by a scalar value.
	 * @param scale
	 * @return
	 */
	public Point3 scale(final double scale) {
		return new Point3(x * scale, y * scale, z * scale);
	}
	
	/**
	 * Get the length of this point, treated as a vector from the origin.
	 * @return
	 */
	public double norm() {
		return Math.sqrt(dot(this));
	}

	@Override
	public double get(int dim) {
		if (dim == 0)
			return x;
		else if (dim == 1)
			return y;
		else if (dim == 2)
			return z;
		throw new IllegalArgumentException("Requested dimension " + dim + " for Point3 - allowable values are 0, 1 and 2");
	}

	@Override
	public int dim() {
		return 3;
	}
	
	/**
	 * Get the coordinates as a new array of length 3.
	 * @return
	 */
	public double[] toArray() {
		return new double[] {x, y, z};
	}
	
	@Override
	public int hashCode() {
		final int prime = 31;
		int result = 1;
		long temp;
		temp = Double.doubleToLongBits(x);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(y);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		temp = Double.doubleToLongBits(z);
		result = prime * result + (int) (temp ^ (temp >>> 32));
		return result;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		Point3 other = (Point3) obj;
		if (Double.doubleToLongBits(x) != Double.doubleToLongBits(other.x))
			return false;
		if (Double.doubleToLongBits(y) != Double.doubleToLongBits(other.y))
			return false;
		if (Double.doubleToLongBits(z) != Double.doubleToLongBits(other.z))
			return false;
		return true;
	}
	
	@Override
	public String toString() {
		return "Point3: " + x + ", " + y + ", " + z;
	}

}
