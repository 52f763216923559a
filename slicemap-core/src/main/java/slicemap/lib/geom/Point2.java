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

/**
 * A 2D point in the pixel matrix.
 * <p>
 * The first value is the column index (x, increasing from left to right) and the second 
 * is the row index (y, increasing from top to bottom). Both are given in pixel units, 
 * at sub-pixel resolution.
 */
public final class Point2 implements Point {
	
	private final double x, y;
	
	/**
	 * Point constructor.
	 * @param x the column coordinate
	 * @param y the row coordinate
	 */
	public Point2(final double x, final double y) {
		this.x = x;
		this.y = y;
	}
	
	/**
	 * Get the x (column) coordinate of this point.
	 * @return
	 */
	public double getX() {
		return x;
	}

	/**
	 * Get the y (row) coordinate of this point.
	 * @return
	 */
	public double getY() {
		return y;
	}

	@Override
	public double get(int dim) {
		if (dim == 0)
			return x;
		else if (dim == 1)
			return y;
		throw new IllegalArgumentException("Requested dimension " + dim + " for Point2 - allowable values are 0 and 1");
	}

	@Override
	public int dim() {
		return 2;
	}
	
	/**
	 * Get the coordinates as a new array of length 2.
	 * @return
	 */
	public double[] toArray() {
		return new double[] {x, y};
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
		Point2 other = (Point2) obj;
		if (Double.doubleToLongBits(x) != Double.doubleToLongBits(other.x))
			return false;
		if (Double.doubleToLongBits(y) != Double.doubleToLongBits(other.y))
			return false;
		return true;
	}
	
	@Override
	public String toString() {
		return "Point2: " + x + ", " + y;
	}

}
