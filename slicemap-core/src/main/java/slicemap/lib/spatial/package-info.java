/**
 * Build and apply affine transforms that relate the pixel matrix of an image slice 
 * to the three-dimensional frame of reference (patient or slide coordinate system).
 * <p>
 * Transforms are built from the image position, image orientation and pixel spacing 
 * of a slice, and can then be applied to single coordinates or in bulk.
 */
package slicemap.lib.spatial;
