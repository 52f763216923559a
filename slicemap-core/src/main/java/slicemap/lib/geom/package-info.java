/**
 * Defines immutable fixed-size points, vectors and matrices.
 */
package slicemap.lib.geom;
