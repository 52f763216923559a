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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.TypeAdapter;
import com.google.gson.TypeAdapterFactory;
import com.google.gson.reflect.TypeToken;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonWriter;

import slicemap.lib.geom.AffineMatrix;
import slicemap.lib.spatial.PixelSpacing;
import slicemap.lib.spatial.SliceGeometry;
import slicemap.lib.spatial.SliceTransforms;

/**
 * Helper class providing Gson instances with type adapters registered to serialize 
 * key SliceMap classes.
 * <p>
 * These include:
 * <ul>
 * <li>{@link AffineMatrix}, written as a 4x4 array of rows</li>
 * <li>{@link SliceGeometry}, written using the names of the corresponding DICOM attributes</li>
 * </ul>
 */
public class GsonTools {
	
	private static final Logger logger = LoggerFactory.getLogger(GsonTools.class);
	
	private static GsonBuilder builder = new GsonBuilder()
			.serializeSpecialFloatingPointValues()
			.registerTypeAdapterFactory(new SliceMapTypeAdapterFactory());
	
	/**
	 * Access the builder used with {@link #getInstance()}.
	 * This makes it possible to register new type adapters if required, which will be used by future Gson instances 
	 * returned by this class.
	 * <p>
	 * To create a derived builder that does not change the default, use {@code getDefaultBuilder().create().newBuilder()}.
	 * 
	 * @return
	 */
	public static GsonBuilder getDefaultBuilder() {
		return builder;
	}
	
	/**
	 * Get default Gson, capable of serializing/deserializing some key SliceMap classes.
	 * @return
	 * 
	 * @see #getInstance(boolean)
	 */
	public static Gson getInstance() {
		return builder.create();
	}
	
	/**
	 * Get default Gson, optionally with pretty printing enabled.
	 * 
	 * @param pretty if true, write using pretty-printing (i.e. more whitespace for formatting)
	 * @return
	 * 
	 * @see #getInstance()
	 */
	public static Gson getInstance(boolean pretty) {
		if (pretty)
			return getInstance().newBuilder().setPrettyPrinting().create();
		return getInstance();
	}
	
	
	static class SliceMapTypeAdapterFactory implements TypeAdapterFactory {

		@SuppressWarnings("unchecked")
		@Override
		public <T> TypeAdapter<T> create(Gson gson, TypeToken<T> type) {
			Class<? super T> cls = type.getRawType();
			if (AffineMatrix.class.equals(cls))
				return (TypeAdapter<T>)AffineMatrixTypeAdapter.INSTANCE.nullSafe();
			if (SliceGeometry.class.equals(cls))
				return (TypeAdapter<T>)SliceGeometryTypeAdapter.INSTANCE.nullSafe();
			return null;
		}
		
	}
	
	
	/**
	 * TypeAdapter for AffineMatrix objects, written as {@code {"matrix": [[...], [...], [...], [0, 0, 0, 1]]}}.
	 */
	static class AffineMatrixTypeAdapter extends TypeAdapter<AffineMatrix> {
		
		static AffineMatrixTypeAdapter INSTANCE = new AffineMatrixTypeAdapter();
		
		private static Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

		@Override
		public void write(JsonWriter out, AffineMatrix value) throws IOException {
			gson.toJson(new AffineMatrixProxy(value), AffineMatrixProxy.class, out);
		}

		@Override
		public AffineMatrix read(JsonReader in) throws IOException {
			AffineMatrixProxy proxy = gson.fromJson(in, AffineMatrixProxy.class);
			if (proxy == null || proxy.matrix == null)
				throw new JsonParseException("Affine matrix JSON must contain a 'matrix' field");
			try {
				return AffineMatrix.fromArray(proxy.matrix);
			} catch (IllegalArgumentException e) {
				throw new JsonParseException(e.getLocalizedMessage(), e);
			}
		}
		
		static class AffineMatrixProxy {
			
			private double[][] matrix;
			
			AffineMatrixProxy() {}
			
			AffineMatrixProxy(AffineMatrix affine) {
				this.matrix = affine.toArray();
			}
			
		}
		
	}
	
	
	/**
	 * TypeAdapter for SliceGeometry objects.
	 * A missing spacing between slices is read as the default value; other fields are required.
	 */
	static class SliceGeometryTypeAdapter extends TypeAdapter<SliceGeometry> {
		
		static SliceGeometryTypeAdapter INSTANCE = new SliceGeometryTypeAdapter();
		
		private static final String IMAGE_POSITION = "imagePosition";
		private static final String IMAGE_ORIENTATION = "imageOrientation";
		private static final String PIXEL_SPACING = "pixelSpacing";
		private static final String SPACING_BETWEEN_SLICES = "spacingBetweenSlices";
		
		private static Gson gson = new GsonBuilder().serializeSpecialFloatingPointValues().create();

		@Override
		public void write(JsonWriter out, SliceGeometry geometry) throws IOException {
			out.beginObject();
			out.name(IMAGE_POSITION);
			writeArray(out, geometry.getImagePosition().toArray());
			out.name(IMAGE_ORIENTATION);
			writeArray(out, geometry.getOrientation().toArray());
			out.name(PIXEL_SPACING);
			writeArray(out, geometry.getPixelSpacing().toArray());
			out.name(SPACING_BETWEEN_SLICES);
			out.value(geometry.getSpacingBetweenSlices());
			out.endObject();
		}

		@Override
		public SliceGeometry read(JsonReader in) throws IOException {
			double[] position = null;
			double[] orientation = null;
			double[] spacing = null;
			double spacingBetweenSlices = SliceTransforms.DEFAULT_SPACING_BETWEEN_SLICES;
			
			in.beginObject();
			while (in.hasNext()) {
				String name = in.nextName();
				switch (name) {
				case IMAGE_POSITION:
					position = readArray(in, IMAGE_POSITION);
					break;
				case IMAGE_ORIENTATION:
					orientation = readArray(in, IMAGE_ORIENTATION);
					break;
				case PIXEL_SPACING:
					spacing = readArray(in, PIXEL_SPACING);
					break;
				case SPACING_BETWEEN_SLICES:
					spacingBetweenSlices = readDouble(in, SPACING_BETWEEN_SLICES);
					break;
				default:
					logger.debug("Skipping unknown slice geometry field '{}'", name);
					in.skipValue();
				}
			}
			in.endObject();
			
			if (position == null || orientation == null || spacing == null)
				throw new JsonParseException("Slice geometry requires " + IMAGE_POSITION + ", " + IMAGE_ORIENTATION + " and " + PIXEL_SPACING);
			
			try {
				return new SliceGeometry.Builder()
						.imagePosition(position)
						.imageOrientation(orientation)
						.pixelSpacing(PixelSpacing.fromArray(spacing))
						.spacingBetweenSlices(spacingBetweenSlices)
						.build();
			} catch (IllegalArgumentException e) {
				throw new JsonParseException("Invalid slice geometry: " + e.getLocalizedMessage(), e);
			}
		}
		
		private static void writeArray(JsonWriter out, double[] values) throws IOException {
			out.beginArray();
			for (double v : values)
				out.value(v);
			out.endArray();
		}
		
		private static double readDouble(JsonReader in, String name) throws IOException {
			try {
				return in.nextDouble();
			} catch (NumberFormatException | IllegalStateException e) {
				throw new JsonParseException("Expected a number for " + name + ": " + e.getLocalizedMessage(), e);
			}
		}
		
		private static double[] readArray(JsonReader in, String name) throws IOException {
			double[] values;
			try {
				values = gson.fromJson(in, double[].class);
			} catch (IllegalArgumentException e) {
				// Includes NumberFormatException for non-numeric strings, and null elements
				throw new JsonParseException("Expected an array of numbers for " + name + ": " + e.getLocalizedMessage(), e);
			}
			if (values == null)
				throw new JsonParseException(name + " must not be null");
			return values;
		}
		
	}

}
