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
 * Exception thrown when a matrix cannot be inverted, because its linear part is singular.
 * <p>
 * This typically indicates a zero pixel spacing or direction cosines that are not linearly independent. 
 * Since the calculation is deterministic, repeating it with the same input cannot succeed.
 */
public class SingularTransformException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	
	private final double determinant;

	/**
	 * Constructor.
	 * @param message
	 * @param determinant the determinant of the linear part that could not be inverted
	 */
	public SingularTransformException(String message, double determinant) {
		super(message);
		this.determinant = determinant;
	}
	
	/**
	 * Get the determinant of the matrix that could not be inverted.
	 * This is either zero or not finite.
	 * @return
	 */
	public double getDeterminant() {
		return determinant;
	}

}
