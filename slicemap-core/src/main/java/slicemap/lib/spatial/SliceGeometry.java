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

import java.util.Locale;
import java.util.Objects;

import slicemap.lib.common.GeneralTools;
import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.geom.Point3;
import slicemap.lib.geom.SingularTransformException;

/**
 * The geometry attributes that position a single image slice in the frame of reference: 
 * image position, image orientation, pixel spacing and spacing between slices.
 * <p>
 * Instances are immutable and created with a {@link Builder}.
 * 
 * @see SliceTransforms
 */
public final class SliceGeometry {
	
	private final Point3 imagePosition;
	private final DirectionCosines orientation;
	private final PixelSpacing pixelSpacing;
	private final double spacingBetweenSlices;
	
	private SliceGeometry(Builder builder) {
		this.imagePosition = builder.imagePosition;
		this.orientation = builder.orientation;
		this.pixelSpacing = builder.pixelSpacing;
		this.spacingBetweenSlices = builder.spacingBetweenSlices;
	}
	
	/**
	 * Get the position of the top left pixel in the frame of reference.
	 * @return
	 */
	public Point3 getImagePosition() {
		return imagePosition;
	}

	/**
	 * Get the direction cosines of the pixel matrix.
	 * @return
	 */
	public DirectionCosines getOrientation() {
		return orientation;
	}

	/**
	 * Get the pixel spacing.
	 * @return
	 */
	public PixelSpacing getPixelSpacing() {
		return pixelSpacing;
	}

	/**
	 * Get the distance between neighboring slices.
	 * This is {@link SliceTransforms#DEFAULT_SPACING_BETWEEN_SLICES} unless otherwise specified.
	 * @return
	 */
	public double getSpacingBetweenSlices() {
		return spacingBetweenSlices;
	}
	
	/**
	 * Create the transform from pixel matrix coordinates to the frame of reference.
	 * @return
	 */
	public AffineMatrix createTransform() {
		return SliceTransforms.buildTransform(imagePosition, orientation, pixelSpacing);
	}
	
	/**
	 * Create the transform from the frame of reference to pixel matrix coordinates.
	 * @return
	 * @throws SingularTransformException if the transform cannot be inverted
	 */
	public AffineMatrix createInverseTransform() throws SingularTransformException {
		return SliceTransforms.buildInverseTransform(imagePosition, orientation, pixelSpacing, spacingBetweenSlices);
	}
	
	/**
	 * Compute the in-plane rotation of the pixel matrix.
	 * @param inDegrees
	 * @return
	 * @throws InvalidGeometryException if the orientation is not a planar rotation, or is flipped
	 * @see PlanarRotations#computeRotation(DirectionCosines, boolean)
	 */
	public double computeRotation(boolean inDegrees) throws InvalidGeometryException {
		return PlanarRotations.computeRotation(orientation, inDegrees);
	}

	@Override
	public int hashCode() {
		return Objects.hash(imagePosition, orientation, pixelSpacing, spacingBetweenSlices);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (obj == null)
			return false;
		if (getClass() != obj.getClass())
			return false;
		SliceGeometry other = (SliceGeometry) obj;
		return imagePosition.equals(other.imagePosition) &&
				orientation.equals(other.orientation) &&
				pixelSpacing.equals(other.pixelSpacing) &&
				Double.doubleToLongBits(spacingBetweenSlices) == Double.doubleToLongBits(other.spacingBetweenSlices);
	}

	@Override
	public String toString() {
		return String.format("Slice geometry: position=[%s], orientation=[%s], spacing=[%s], spacing between slices=%s",
				GeneralTools.arrayToString(Locale.US, imagePosition.toArray(), ", ", 6),
				GeneralTools.arrayToString(Locale.US, orientation.toArray(), ", ", 6),
				GeneralTools.arrayToString(Locale.US, pixelSpacing.toArray(), ", ", 6),
				GeneralTools.formatNumber(Locale.US, spacingBetweenSlices, 6));
	}
	
	/**
	 * Builder class for {@link SliceGeometry} objects.
	 * <p>
	 * By default, the slice is positioned at the origin, aligned with the x and y axes, with 
	 * unit pixel spacing and unit spacing between slices.
	 */
	public static class Builder {
		
		private Point3 imagePosition = Point3.origin();
		private DirectionCosines orientation = DirectionCosines.identity();
		private PixelSpacing pixelSpacing = PixelSpacing.of(1.0, 1.0);
		private double spacingBetweenSlices = SliceTransforms.DEFAULT_SPACING_BETWEEN_SLICES;
		
		/**
		 * Create a new builder with default values.
		 */
		public Builder() {}
		
		/**
		 * Create a new builder, initialized with the values of an existing {@link SliceGeometry}.
		 * @param geometry
		 */
		public Builder(SliceGeometry geometry) {
			this.imagePosition = geometry.imagePosition;
			this.orientation = geometry.orientation;
			this.pixelSpacing = geometry.pixelSpacing;
			this.spacingBetweenSlices = geometry.spacingBetweenSlices;
		}
		
		/**
		 * Specify the position of the top left pixel in the frame of reference.
		 * @param position
		 * @return
		 */
		public Builder imagePosition(Point3 position) {
			this.imagePosition = Objects.requireNonNull(position, "Image position must not be null!");
			return this;
		}
		
		/**
		 * Specify the image position from 3 values.
		 * @param position
		 * @return
		 * @throws IllegalArgumentException if the number of values is not 3
		 */
		public Builder imagePosition(double... position) throws IllegalArgumentException {
			return imagePosition(Point3.fromArray(position));
		}
		
		/**
		 * Specify the direction cosines.
		 * @param orientation
		 * @return
		 */
		public Builder orientation(DirectionCosines orientation) {
			this.orientation = Objects.requireNonNull(orientation, "Orientation must not be null!");
			return this;
		}
		
		/**
		 * Specify the direction cosines from 6 values, in DICOM Image Orientation order.
		 * @param orientation
		 * @return
		 * @throws IllegalArgumentException if the number of values is not 6
		 */
		public Builder imageOrientation(double... orientation) throws IllegalArgumentException {
			return orientation(DirectionCosines.fromImageOrientation(orientation));
		}
		
		/**
		 * Specify the pixel spacing.
		 * @param spacing
		 * @return
		 */
		public Builder pixelSpacing(PixelSpacing spacing) {
			this.pixelSpacing = Objects.requireNonNull(spacing, "Pixel spacing must not be null!");
			return this;
		}
		
		/**
		 * Specify the pixel spacing.
		 * @param rowSpacing spacing between rows
		 * @param columnSpacing spacing between columns
		 * @return
		 */
		public Builder pixelSpacing(double rowSpacing, double columnSpacing) {
			return pixelSpacing(PixelSpacing.of(rowSpacing, columnSpacing));
		}
		
		/**
		 * Specify the distance between neighboring slices.
		 * @param spacing
		 * @return
		 * @throws IllegalArgumentException if the spacing is not a finite number &gt; 0
		 */
		public Builder spacingBetweenSlices(double spacing) throws IllegalArgumentException {
			if (!Double.isFinite(spacing) || spacing <= 0)
				throw new IllegalArgumentException("Spacing between slices must be a finite number > 0, not " + spacing);
			this.spacingBetweenSlices = spacing;
			return this;
		}
		
		/**
		 * Build {@link SliceGeometry} object.
		 * @return
		 */
		public SliceGeometry build() {
			return new SliceGeometry(this);
		}
		
	}

}
