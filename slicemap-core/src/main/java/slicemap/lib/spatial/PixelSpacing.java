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

/**
 * Physical distance between the centers of adjacent pixels, in the units of the frame of reference.
 * <p>
 * The order follows the DICOM Pixel Spacing attribute: the first value is the spacing between 
 * rows (vertical, along the column direction) and the second value is the spacing between 
 * columns (horizontal, along the row direction).
 * <p>
 * Values are not validated, since a transform may be built for any spacing. 
 * Zero spacing produces a matrix that cannot be inverted.
 */
public final class PixelSpacing {
	
	private final double rowSpacing;
	private final double columnSpacing;
	
	private PixelSpacing(double rowSpacing, double columnSpacing) {
		this.rowSpacing = rowSpacing;
		this.columnSpacing = columnSpacing;
	}
	
	/**
	 * Create a pixel spacing.
	 * @param rowSpacing spacing between rows, applied along the column direction
	 * @param columnSpacing spacing between columns, applied along the row direction
	 * @return
	 */
	public static PixelSpacing of(double rowSpacing, double columnSpacing) {
		return new PixelSpacing(rowSpacing, columnSpacing);
	}
	
	/**
	 * Create a pixel spacing from two values in DICOM Pixel Spacing order (row spacing, column spacing).
	 * @param spacing
	 * @return
	 * @throws IllegalArgumentException if the number of values is not 2
	 */
	public static PixelSpacing fromArray(double... spacing) throws IllegalArgumentException {
		Objects.requireNonNull(spacing, "Pixel spacing must not be null!");
		if (spacing.length != 2)
			throw new IllegalArgumentException("Pixel spacing requires 2 values, but got " + spacing.length);
		return new PixelSpacing(spacing[0], spacing[1]);
	}
	
	/**
	 * Get the spacing between adjacent rows.
	 * @return
	 */
	public double getRowSpacing() {
		return rowSpacing;
	}
	
	/**
	 * Get the spacing between adjacent columns.
	 * @return
	 */
	public double getColumnSpacing() {
		return columnSpacing;
	}
	
	/**
	 * Returns true if both spacings are finite and strictly positive.
	 * @return
	 */
	public boolean isValid() {
		return Double.isFinite(rowSpacing) && rowSpacing > 0 &&
				Double.isFinite(columnSpacing) && columnSpacing > 0;
	}
	
	/**
	 * Get the values in DICOM Pixel Spacing order.
	 * @return
	 */
	public double[] toArray() {
		return new double[] {rowSpacing, columnSpacing};
	}

	@Override
	public int hashCode() {
		return Objects.hash(rowSpacing, columnSpacing);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		PixelSpacing other = (PixelSpacing) obj;
		return Double.doubleToLongBits(rowSpacing) == Double.doubleToLongBits(other.rowSpacing) &&
				Double.doubleToLongBits(columnSpacing) == Double.doubleToLongBits(other.columnSpacing);
	}

	@Override
	public String toString() {
		return "PixelSpacing [row=" + rowSpacing + ", column=" + columnSpacing + "]";
	}

}
