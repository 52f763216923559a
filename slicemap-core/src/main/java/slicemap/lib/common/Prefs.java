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


package slicemap.lib.common;

/**
 * Core SliceMap preferences. These are not persistent.
 * <p>
 * Geometry validation can also be switched on at startup with the system property 
 * {@code slicemap.validateGeometry=true}.
 */
public class Prefs {
	
	/**
	 * Name of the system property used to initialize {@link #isValidateGeometry()}.
	 */
	public static final String PROP_VALIDATE_GEOMETRY = "slicemap.validateGeometry";
	
	private static volatile boolean validateGeometry = Boolean.getBoolean(PROP_VALIDATE_GEOMETRY);
	
	private static volatile double geometryTolerance = 1e-4;
	
	/**
	 * Query whether transform builders should check that direction cosines are orthonormal 
	 * and pixel spacings are positive before building a transform.
	 * @return
	 */
	public static boolean isValidateGeometry() {
		return validateGeometry;
	}

	/**
	 * Set whether transform builders should validate their inputs.
	 * This is off by default, since most callers pass values read directly from a dataset.
	 * @param validate
	 */
	public static void setValidateGeometry(boolean validate) {
		validateGeometry = validate;
	}
	
	/**
	 * Get the absolute tolerance used when checking that direction cosines are orthonormal.
	 * @return
	 */
	public static double getGeometryTolerance() {
		return geometryTolerance;
	}
	
	/**
	 * Set the absolute tolerance used when checking that direction cosines are orthonormal.
	 * @param tolerance
	 * @throws IllegalArgumentException if the tolerance is negative or not finite
	 */
	public static void setGeometryTolerance(double tolerance) throws IllegalArgumentException {
		if (!Double.isFinite(tolerance) || tolerance < 0)
			throw new IllegalArgumentException("Tolerance must be a finite number >= 0, not " + tolerance);
		geometryTolerance = tolerance;
	}

}
