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
 * Simple interface defining a point.
 * <p>
 * Points are used both for pixel matrix coordinates (column, row) and for coordinates 
 * in the three-dimensional frame of reference (x, y, z).
 * 
 * @see Point2
 * @see Point3
 */
public interface Point {

	/**
	 * Number of values used to represent this point.
	 * <p>
	 * For a column, row coordinate pair this should return 2.
	 * @return
	 */
	public int dim();

	/**
	 * Get the value of the ordinate for the specified dimension.
	 * @param dim
	 * @return
	 * @throws IllegalArgumentException if the dimension is out of range
	 */
	public double get(final int dim) throws IllegalArgumentException;


}
