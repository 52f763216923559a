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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import slicemap.lib.common.Prefs;
import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.geom.Matrix3;
import slicemap.lib.geom.Point3;
import slicemap.lib.geom.SingularTransformException;

/**
 * Build affine transforms between the pixel matrix of an image slice and the three-dimensional 
 * frame of reference (patient or slide coordinate system).
 * <p>
 * The forward transform maps (column, row) pixel coordinates to (x, y, z) coordinates in the frame of reference.
 * The inverse transform maps (x, y, z) coordinates to (column, row, slice) coordinates, where the slice 
 * value is the signed distance from the imaging plane in units of the spacing between slices.
 * <p>
 * Inputs are trusted by default. If {@link Prefs#isValidateGeometry()} is true, direction cosines 
 * must be orthonormal and spacings positive, otherwise an {@link InvalidGeometryException} is thrown.
 * 
 * @see CoordinateMapper
 */
public final class SliceTransforms {
	
	private static final Logger logger = LoggerFactory.getLogger(SliceTransforms.class);
	
	/**
	 * Default spacing between slices, used when this is not known.
	 */
	public static final double DEFAULT_SPACING_BETWEEN_SLICES = 1.0;
	
	private SliceTransforms() {}
	
	/**
	 * Build the affine transform that maps pixel matrix coordinates into the frame of reference.
	 * 
	 * @param imagePosition position of the top left pixel in the frame of reference (3 values)
	 * @param imageOrientation row cosines followed by column cosines (6 values)
	 * @param pixelSpacing spacing between rows, then spacing between columns (2 values)
	 * @return
	 * @throws IllegalArgumentException if any array has the wrong length
	 * @see #buildTransform(Point3, DirectionCosines, PixelSpacing)
	 */
	public static AffineMatrix buildTransform(double[] imagePosition, double[] imageOrientation, double[] pixelSpacing) throws IllegalArgumentException {
		return buildTransform(
				Point3.fromArray(imagePosition),
				DirectionCosines.fromImageOrientation(imageOrientation),
				PixelSpacing.fromArray(pixelSpacing));
	}
	
	/**
	 * Build the affine transform that maps pixel matrix coordinates into the frame of reference.
	 * <p>
	 * The row direction is scaled by the column spacing and the column direction by the row spacing; 
	 * the normal is left unscaled. Pixel (0, 0) maps exactly to the image position.
	 * 
	 * @param imagePosition position of the top left pixel in the frame of reference
	 * @param orientation direction cosines of the pixel matrix
	 * @param pixelSpacing spacing between rows and columns
	 * @return
	 * @throws InvalidGeometryException only if geometry validation is turned on and the inputs are invalid
	 */
	public static AffineMatrix buildTransform(Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing) throws InvalidGeometryException {
		Objects.requireNonNull(imagePosition, "Image position must not be null!");
		checkGeometry(orientation, pixelSpacing, DEFAULT_SPACING_BETWEEN_SLICES);
		Matrix3 linear = createScaledRotation(orientation, pixelSpacing, 1.0);
		return AffineMatrix.of(linear, imagePosition);
	}
	
	/**
	 * Build the affine transform that maps coordinates in the frame of reference into the pixel matrix, 
	 * using the default spacing between slices.
	 * 
	 * @param imagePosition position of the top left pixel in the frame of reference (3 values)
	 * @param imageOrientation row cosines followed by column cosines (6 values)
	 * @param pixelSpacing spacing between rows, then spacing between columns (2 values)
	 * @return
	 * @throws SingularTransformException if the transform cannot be inverted
	 * @see #buildInverseTransform(Point3, DirectionCosines, PixelSpacing, double)
	 */
	public static AffineMatrix buildInverseTransform(double[] imagePosition, double[] imageOrientation, double[] pixelSpacing) throws SingularTransformException {
		return buildInverseTransform(imagePosition, imageOrientation, pixelSpacing, DEFAULT_SPACING_BETWEEN_SLICES);
	}

	/**
	 * Build the affine transform that maps coordinates in the frame of reference into the pixel matrix.
	 * 
	 * @param imagePosition position of the top left pixel in the frame of reference (3 values)
	 * @param imageOrientation row cosines followed by column cosines (6 values)
	 * @param pixelSpacing spacing between rows, then spacing between columns (2 values)
	 * @param spacingBetweenSlices distance between neighboring slices
	 * @return
	 * @throws SingularTransformException if the transform cannot be inverted
	 * @see #buildInverseTransform(Point3, DirectionCosines, PixelSpacing, double)
	 */
	public static AffineMatrix buildInverseTransform(double[] imagePosition, double[] imageOrientation, double[] pixelSpacing, double spacingBetweenSlices) throws SingularTransformException {
		return buildInverseTransform(
				Point3.fromArray(imagePosition),
				DirectionCosines.fromImageOrientation(imageOrientation),
				PixelSpacing.fromArray(pixelSpacing),
				spacingBetweenSlices);
	}
	
	/**
	 * Build the affine transform that maps coordinates in the frame of reference into the pixel matrix, 
	 * using the default spacing between slices.
	 * @param imagePosition
	 * @param orientation
	 * @param pixelSpacing
	 * @return
	 * @throws SingularTransformException if the transform cannot be inverted
	 */
	public static AffineMatrix buildInverseTransform(Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing) throws SingularTransformException {
		return buildInverseTransform(imagePosition, orientation, pixelSpacing, DEFAULT_SPACING_BETWEEN_SLICES);
	}
	
	/**
	 * Build the affine transform that maps coordinates in the frame of reference into the pixel matrix.
	 * <p>
	 * This scales the rotation matrix as for {@link #buildTransform(Point3, DirectionCosines, PixelSpacing)}, 
	 * additionally scales the normal by the spacing between slices, and then inverts the result. 
	 * A full inverse is used because anisotropic scaling means the matrix is not orthogonal.
	 * 
	 * @param imagePosition position of the top left pixel in the frame of reference
	 * @param orientation direction cosines of the pixel matrix
	 * @param pixelSpacing spacing between rows and columns
	 * @param spacingBetweenSlices distance between neighboring slices
	 * @return
	 * @throws SingularTransformException if the transform cannot be inverted, e.g. because of zero spacing
	 * @throws InvalidGeometryException only if geometry validation is turned on and the inputs are invalid
	 */
	public static AffineMatrix buildInverseTransform(Point3 imagePosition, DirectionCosines orientation, PixelSpacing pixelSpacing, double spacingBetweenSlices) 
			throws SingularTransformException, InvalidGeometryException {
		Objects.requireNonNull(imagePosition, "Image position must not be null!");
		checkGeometry(orientation, pixelSpacing, spacingBetweenSlices);
		Matrix3 linear = createScaledRotation(orientation, pixelSpacing, spacingBetweenSlices);
		try {
			return AffineMatrix.of(linear, imagePosition).createInverse();
		} catch (SingularTransformException e) {
			logger.debug("Unable to invert transform for {}, {}, spacing between slices {}", orientation, pixelSpacing, spacingBetweenSlices);
			throw e;
		}
	}
	
	private static Matrix3 createScaledRotation(DirectionCosines orientation, PixelSpacing pixelSpacing, double normalScale) {
		Objects.requireNonNull(pixelSpacing, "Pixel spacing must not be null!");
		Matrix3 rotation = RotationMatrices.createRotationMatrix(orientation);
		// Row direction steps between columns; column direction steps between rows
		return rotation.scaleColumns(pixelSpacing.getColumnSpacing(), pixelSpacing.getRowSpacing(), normalScale);
	}
	
	private static void checkGeometry(DirectionCosines orientation, PixelSpacing pixelSpacing, double spacingBetweenSlices) throws InvalidGeometryException {
		Objects.requireNonNull(orientation, "Orientation must not be null!");
		Objects.requireNonNull(pixelSpacing, "Pixel spacing must not be null!");
		if (!Prefs.isValidateGeometry())
			return;
		double tol = Prefs.getGeometryTolerance();
		if (!orientation.isOrthonormal(tol))
			throw new InvalidGeometryException("Direction cosines are not orthonormal (tolerance " + tol + "): " + orientation);
		if (!pixelSpacing.isValid())
			throw new InvalidGeometryException("Pixel spacing must be finite and > 0: " + pixelSpacing);
		if (!Double.isFinite(spacingBetweenSlices) || spacingBetweenSlices <= 0)
			throw new InvalidGeometryException("Spacing between slices must be finite and > 0, not " + spacingBetweenSlices);
	}

}
