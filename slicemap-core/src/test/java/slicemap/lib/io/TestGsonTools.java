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


package slicemap.lib.io;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.google.gson.JsonParseException;

import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.spatial.SliceGeometry;

@SuppressWarnings("javadoc")
public class TestGsonTools {
	
	@Test
	public void test_SliceGeometry() {
		testToJson(null);
		testToJson(new SliceGeometry.Builder().build());
		testToJson(new SliceGeometry.Builder()
				.imagePosition(-125.5, 80.25, 33)
				.imageOrientation(0, 1, 0, 0, 0, -1)
				.pixelSpacing(0.78125, 0.5)
				.spacingBetweenSlices(2.5)
				.build());
	}
	
	private static void testToJson(SliceGeometry geometry) {
		var gson = GsonTools.getInstance();
		var json = gson.toJson(geometry);
		var geometry2 = gson.fromJson(json, SliceGeometry.class);
		assertEquals(geometry, geometry2);
	}
	
	@Test
	public void test_SliceGeometryFields() {
		String json = """
				{
				  "imagePosition": [10, 20, 30],
				  "imageOrientation": [1, 0, 0, 0, 1, 0],
				  "pixelSpacing": [0.5, 0.25],
				  "modality": "CT"
				}
				""";
		var geometry = GsonTools.getInstance().fromJson(json, SliceGeometry.class);
		assertEquals(1.0, geometry.getSpacingBetweenSlices(), 0.0);
		assertEquals(0.5, geometry.getPixelSpacing().getRowSpacing(), 0.0);
		assertEquals(0.25, geometry.getPixelSpacing().getColumnSpacing(), 0.0);
		assertEquals(30.0, geometry.getImagePosition().getZ(), 0.0);
		
		var written = GsonTools.getInstance().toJsonTree(geometry).getAsJsonObject();
		assertTrue(written.has("spacingBetweenSlices"));
		assertEquals(3, written.getAsJsonArray("imagePosition").size());
		assertEquals(6, written.getAsJsonArray("imageOrientation").size());
		
		// Missing pixel spacing
		assertThrows(JsonParseException.class, () -> GsonTools.getInstance().fromJson(
				"{\"imagePosition\": [0, 0, 0], \"imageOrientation\": [1, 0, 0, 0, 1, 0]}", SliceGeometry.class));
		// Wrong number of values
		assertThrows(JsonParseException.class, () -> GsonTools.getInstance().fromJson(
				"{\"imagePosition\": [0, 0], \"imageOrientation\": [1, 0, 0, 0, 1, 0], \"pixelSpacing\": [1, 1]}", SliceGeometry.class));
		assertThrows(JsonParseException.class, () -> GsonTools.getInstance().fromJson(
				"{\"imagePosition\": [0, 0, 0], \"imageOrientation\": [1, 0, 0, 0, 1, 0], \"pixelSpacing\": [1, 1, 1]}", SliceGeometry.class));
		// Invalid spacing between slices
		assertThrows(JsonParseException.class, () -> GsonTools.getInstance().fromJson(
				"{\"imagePosition\": [0, 0, 0], \"imageOrientation\": [1, 0, 0, 0, 1, 0], \"pixelSpacing\": [1, 1], \"spacingBetweenSlices\": 0}", SliceGeometry.class));
	}
	
	@Test
	public void test_SliceGeometryMalformedValues() {
		var gson = GsonTools.getInstance();
		String spacing = "\"imageOrientation\": [1, 0, 0, 0, 1, 0], \"pixelSpacing\": [1, 1]";
		for (String position : new String[] {"[0, \"x\", 0]", "[0, null, 0]", "[0, [1], 0]", "5", "null", "{}"}) {
			String json = "{\"imagePosition\": " + position + ", " + spacing + "}";
			assertThrows(JsonParseException.class, () -> gson.fromJson(json, SliceGeometry.class), json);
		}
		for (String sbs : new String[] {"\"thick\"", "null", "[1]"}) {
			String json = "{\"imagePosition\": [0, 0, 0], " + spacing + ", \"spacingBetweenSlices\": " + sbs + "}";
			assertThrows(JsonParseException.class, () -> gson.fromJson(json, SliceGeometry.class), json);
		}
		// Numeric strings are accepted, as elsewhere in Gson
		var geometry = gson.fromJson("{\"imagePosition\": [0, \"2.5\", 0], " + spacing + "}", SliceGeometry.class);
		assertEquals(2.5, geometry.getImagePosition().getY(), 0.0);
	}
	
	@Test
	public void test_AffineMatrix() {
		var gson = GsonTools.getInstance();
		var geometry = new SliceGeometry.Builder()
				.imagePosition(13, 22, 30)
				.imageOrientation(0.6, 0.8, 0, -0.8, 0.6, 0)
				.pixelSpacing(0.5, 2)
				.build();
		for (var affine : new AffineMatrix[] {AffineMatrix.identity(), geometry.createTransform(), geometry.createInverseTransform()}) {
			var json = gson.toJson(affine);
			assertEquals(affine, gson.fromJson(json, AffineMatrix.class));
		}
		assertNull(gson.fromJson("null", AffineMatrix.class));
		
		var affine = gson.fromJson("{\"matrix\": [[1, 0, 0, 5], [0, 1, 0, 6], [0, 0, 1, 7], [0, 0, 0, 1]]}", AffineMatrix.class);
		assertEquals(AffineMatrix.fromRows(1, 0, 0, 5, 0, 1, 0, 6, 0, 0, 1, 7), affine);
		
		var tree = gson.toJsonTree(affine).getAsJsonObject();
		assertEquals(4, tree.getAsJsonArray("matrix").size());
		
		assertThrows(JsonParseException.class, () -> gson.fromJson("{}", AffineMatrix.class));
		assertThrows(JsonParseException.class, () -> gson.fromJson("{\"matrix\": [[1, 0, 0, 5], [0, 1, 0, 6]]}", AffineMatrix.class));
		// Invalid last row
		assertThrows(JsonParseException.class, () -> gson.fromJson(
				"{\"matrix\": [[1, 0, 0, 5], [0, 1, 0, 6], [0, 0, 1, 7], [0, 0, 1, 1]]}", AffineMatrix.class));
	}
	
	@Test
	public void test_prettyPrinting() {
		var geometry = new SliceGeometry.Builder().build();
		var pretty = GsonTools.getInstance(true).toJson(geometry);
		var compact = GsonTools.getInstance(false).toJson(geometry);
		assertTrue(pretty.contains("\n"));
		assertEquals(-1, compact.indexOf('\n'));
		assertEquals(GsonTools.getInstance().fromJson(pretty, SliceGeometry.class), GsonTools.getInstance().fromJson(compact, SliceGeometry.class));
	}

}
