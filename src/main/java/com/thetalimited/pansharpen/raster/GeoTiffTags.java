// GeoTiffTags.java
// read and write the GeoTIFF georeferencing tags of a TIFF image directory
//
// Tag ids we care about:
//   33550 ModelPixelScale
//   33922 ModelTiepoint
//   34264 ModelTransformation
//   34735 GeoKeyDirectory
//   34736 GeoDoubleParams
//   34737 GeoAsciiParams
//   42112 GDAL_METADATA (only when it carries a <GeoTransform>)
//
// GeoKeys:
//   1024 GTModelTypeGeoKey      1 = projected, 2 = geographic
//   1025 GTRasterTypeGeoKey     1 = PixelIsArea, 2 = PixelIsPoint
//   2048 GeographicTypeGeoKey
//   3072 ProjectedCSTypeGeoKey

package com.thetalimited.pansharpen.raster;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;

final class GeoTiffTags
{
    static final int MODEL_PIXEL_SCALE_TAG = 33550;
    static final int MODEL_TIEPOINT_TAG = 33922;
    static final int MODEL_TRANSFORMATION_TAG = 34264;
    static final int GEOKEY_DIRECTORY_TAG = 34735;
    static final int GEOKEY_DOUBLE_PARAMS_TAG = 34736;
    static final int GEOKEY_ASCII_PARAMS_TAG = 34737;
    static final int GDAL_METADATA_TAG = 42112;

    static final int KEY_GTModelTypeGeoKey = 1024;
    static final int KEY_GTRasterTypeGeoKey = 1025;
    static final int KEY_GeographicTypeGeoKey = 2048;
    static final int KEY_ProjectedCSTypeGeoKey = 3072;

    static final int MODEL_TYPE_PROJECTED = 1;
    static final int MODEL_TYPE_GEOGRAPHIC = 2;
    static final int RASTER_PIXEL_IS_AREA = 1;
    static final int RASTER_PIXEL_IS_POINT = 2;

    // GeoTIFF "user defined" code; means there is no EPSG code to look up
    private static final int USER_DEFINED = 32767;

    private static final int[] GEOREF_TAGS = {
        MODEL_PIXEL_SCALE_TAG, MODEL_TIEPOINT_TAG, MODEL_TRANSFORMATION_TAG,
        GEOKEY_DIRECTORY_TAG, GEOKEY_DOUBLE_PARAMS_TAG, GEOKEY_ASCII_PARAMS_TAG
    };

    private GeoTiffTags() {}

    // parse the georeferencing of one image directory

    static GeoReference readGeoReference(FileDirectory d) {
        int[] gk = readGeoKeyDirectoryU16(d);
        String gdal = findGdalMetadata(d);

        boolean pixelIsPoint = isPixelIsPoint(gk, gdal);
        double[] gt = buildGeoTransform(d, gdal, pixelIsPoint);
        if (gt == null) {
            return GeoReference.pixelSpace();
        }

        String crs = determineHorizontalCRS(gk, gdal);
        return GeoReference.fromFile(gt, crs, pixelIsPoint, collectGeoEntries(d, gdal));
    }

    /**
     * Corner based (GDAL style) geotransform. Order of preference:
     *   1) GDAL_METADATA &lt;GeoTransform&gt;      (already corner based)
     *   2) ModelPixelScale + ModelTiepoint    (centre to corner when PixelIsPoint)
     *   3) ModelTransformation (4x4)          (centre to corner when PixelIsPoint)
     */
    static double[] buildGeoTransform(FileDirectory d, String gdal, boolean pixelIsPoint) {
        double[] gt = extractGeoTransformFromGdalMetadata(gdal);
        if (gt != null) {
            return gt;
        }

        double[] scale = toDoubleArray(tagValues(d, MODEL_PIXEL_SCALE_TAG));
        double[] tie = toDoubleArray(tagValues(d, MODEL_TIEPOINT_TAG));
        if (scale != null && scale.length >= 2 && tie != null && tie.length >= 6) {
            double sx = scale[0], sy = scale[1];
            double i = tie[0], j = tie[1], x = tie[3], y = tie[4];

            double originX = x - i * sx;
            double originY = y + j * sy;
            if (pixelIsPoint) {
                originX -= 0.5 * sx;
                originY += 0.5 * sy;
            }
            // north up; Scale+Tiepoint cannot express rotation
            return new double[] { originX, sx, 0.0, originY, 0.0, -sy };
        }

        double[] mt = toDoubleArray(tagValues(d, MODEL_TRANSFORMATION_TAG));
        if (mt != null && mt.length == 16) {
            double a1 = mt[0], a2 = mt[1], a0 = mt[3];
            double b1 = mt[4], b2 = mt[5], b0 = mt[7];
            if (pixelIsPoint) {
                a0 = a0 - 0.5 * a1 - 0.5 * a2;
                b0 = b0 - 0.5 * b1 - 0.5 * b2;
            }
            return new double[] { a0, a1, a2, b0, b1, b2 };
        }

        return null;
    }

    // returns "EPSG:nnnn" or null when unknown
    static String determineHorizontalCRS(int[] gk, String gdal) {
        if (looksLikeGeoKeyDirectory(gk)) {
            // projected wins over geographic; a projected CRS also carries its base datum
            Integer projected = geoKeyValue(gk, KEY_ProjectedCSTypeGeoKey);
            if (projected != null && projected != USER_DEFINED && projected > 0) {
                return "EPSG:" + projected;
            }
            Integer geographic = geoKeyValue(gk, KEY_GeographicTypeGeoKey);
            if (geographic != null && geographic != USER_DEFINED && geographic > 0) {
                return "EPSG:" + geographic;
            }
        }

        // some writers stash the EPSG code in <GDALMetadata>
        if (gdal != null) {
            Matcher m = Pattern.compile("EPSG\\s*:\\s*(\\d{3,6})").matcher(gdal);
            if (m.find()) return "EPSG:" + m.group(1);
        }
        return null;
    }

    static boolean isPixelIsPoint(int[] gk, String gdal) {
        if (looksLikeGeoKeyDirectory(gk)) {
            Integer rasterType = geoKeyValue(gk, KEY_GTRasterTypeGeoKey);
            if (rasterType != null) return rasterType == RASTER_PIXEL_IS_POINT;
        }
        if (gdal != null) {
            String v = findMetadataItem(gdal, "AREA_OR_POINT");
            if (v != null) return v.trim().equalsIgnoreCase("Point");
        }
        return false; // PixelIsArea
    }

    // georeferencing tags to write for a georeference; verbatim when it came from a file

    static List<FileDirectoryEntry> entriesFor(GeoReference geo) {
        if (!geo.isGeoreferenced()) {
            return List.of();
        }
        if (!geo.getSourceEntries().isEmpty()) {
            return geo.getSourceEntries();
        }

        List<FileDirectoryEntry> out = new ArrayList<>();
        double[] gt = geo.getGeoTransform();

        if (geo.isNorthUp()) {
            out.add(doubleEntry(MODEL_PIXEL_SCALE_TAG, List.of(gt[1], -gt[5], 0.0)));
            out.add(doubleEntry(MODEL_TIEPOINT_TAG, List.of(0.0, 0.0, 0.0, gt[0], gt[3], 0.0)));
        }
        else {
            out.add(doubleEntry(MODEL_TRANSFORMATION_TAG, List.of(
                gt[1], gt[2], 0.0, gt[0],
                gt[4], gt[5], 0.0, gt[3],
                0.0,   0.0,   0.0, 0.0,
                0.0,   0.0,   0.0, 1.0)));
        }

        out.add(geoKeyDirectoryEntry(geo.getHorizontalCRS()));
        return out;
    }

    static FileDirectoryEntry geoKeyDirectoryEntry(String horizontalCRS) {
        List<Integer> keys = new ArrayList<>();
        Integer epsg = epsgCode(horizontalCRS);
        boolean geographic = epsg != null && CrsSupport.isGeographic(horizontalCRS);

        if (epsg != null) {
            addGeoKey(keys, KEY_GTModelTypeGeoKey, geographic ? MODEL_TYPE_GEOGRAPHIC : MODEL_TYPE_PROJECTED);
        }
        addGeoKey(keys, KEY_GTRasterTypeGeoKey, RASTER_PIXEL_IS_AREA);
        if (epsg != null) {
            addGeoKey(keys, geographic ? KEY_GeographicTypeGeoKey : KEY_ProjectedCSTypeGeoKey, epsg);
        }

        // header: version 1, revision 1.0, number of keys
        List<Integer> values = new ArrayList<>();
        values.add(1); values.add(1); values.add(0); values.add(keys.size() / 4);
        values.addAll(keys);
        return new FileDirectoryEntry(fieldTag(GEOKEY_DIRECTORY_TAG), FieldType.SHORT, values.size(), values);
    }

    private static void addGeoKey(List<Integer> keys, int keyId, int value) {
        // inline value: tag location 0, count 1
        keys.add(keyId); keys.add(0); keys.add(1); keys.add(value);
    }

    private static FileDirectoryEntry doubleEntry(int tagId, List<Double> values) {
        return new FileDirectoryEntry(fieldTag(tagId), FieldType.DOUBLE, values.size(), new ArrayList<>(values));
    }

    private static FieldTagType fieldTag(int tagId) {
        FieldTagType t = FieldTagType.getById(tagId);
        if (t == null) {
            throw new IllegalStateException("TIFF library does not know tag " + tagId);
        }
        return t;
    }

    static Integer epsgCode(String crsName) {
        if (crsName == null) return null;
        Matcher m = Pattern.compile("(?i)EPSG\\s*:\\s*(\\d+)").matcher(crsName.trim());
        return m.matches() ? Integer.valueOf(m.group(1)) : null;
    }

    /* ===== helpers ===== */

    private static List<FileDirectoryEntry> collectGeoEntries(FileDirectory d, String gdal) {
        List<FileDirectoryEntry> out = new ArrayList<>();
        for (FileDirectoryEntry e : safeEntries(d)) {
            if (e.getFieldTag() == null) continue;
            int id = e.getFieldTag().getId();
            for (int tag : GEOREF_TAGS) {
                if (id == tag) out.add(e);
            }
            if (id == GDAL_METADATA_TAG && extractGeoTransformFromGdalMetadata(gdal) != null) {
                out.add(e);
            }
        }
        return out;
    }

    static Object tagValues(FileDirectory d, int tagId) {
        for (FileDirectoryEntry e : safeEntries(d)) {
            if (e.getFieldTag() != null && e.getFieldTag().getId() == tagId) {
                return e.getValues();
            }
        }
        return null;
    }

    static int[] readGeoKeyDirectoryU16(FileDirectory d) {
        int[] s = toUInt16Array(tagValues(d, GEOKEY_DIRECTORY_TAG));
        return looksLikeGeoKeyDirectory(s) ? s : null;
    }

    private static Integer geoKeyValue(int[] gk, int wantedKey) {
        int numKeys = gk[3], idx = 4;
        for (int k = 0; k < numKeys && (idx + 3) < gk.length; k++, idx += 4) {
            int keyId = gk[idx];
            int tiffTag = gk[idx + 1]; // 0 => inline
            int count = gk[idx + 2];
            int value = gk[idx + 3];
            if (keyId == wantedKey && tiffTag == 0 && count == 1) {
                return value;
            }
        }
        return null;
    }

    static boolean looksLikeGeoKeyDirectory(int[] s) {
        return s != null && s.length >= 4 && s[0] == 1 && s[1] == 1 && s[2] == 0;
    }

    private static String findGdalMetadata(FileDirectory d) {
        Object v = tagValues(d, GDAL_METADATA_TAG);
        if (v == null) return null;
        String s = toAscii(v);
        return s.contains("<GDALMetadata>") ? s : null;
    }

    // value of <Item name="...">...</Item> in GDAL metadata
    private static String findMetadataItem(String gdalXml, String name) {
        Matcher m = Pattern
            .compile("<Item\\s+name=\"" + Pattern.quote(name) + "\"[^>]*>(.*?)</Item>",
                     Pattern.CASE_INSENSITIVE | Pattern.DOTALL)
            .matcher(gdalXml);
        return m.find() ? m.group(1).trim() : null;
    }

    private static double[] extractGeoTransformFromGdalMetadata(String xml) {
        if (xml == null) return null;
        int i0 = xml.indexOf("<GeoTransform>");
        int i1 = xml.indexOf("</GeoTransform>");
        if (i0 < 0 || i1 <= i0) return null;
        String body = xml.substring(i0 + "<GeoTransform>".length(), i1).trim();
        String[] toks = body.split("[,\\s]+");
        if (toks.length < 6) return null;
        double[] gt = new double[6];
        try {
            for (int i = 0; i < 6; i++) gt[i] = Double.parseDouble(toks[i]);
        }
        catch (NumberFormatException e) {
            return null;
        }
        return gt;
    }

    private static Set<FileDirectoryEntry> safeEntries(FileDirectory d) {
        Set<FileDirectoryEntry> s = d.getEntries();
        return (s == null) ? Collections.emptySet() : s;
    }

    private static String toAscii(Object v) {
        if (v == null) return "";
        if (v instanceof String) return (String) v;
        if (v instanceof byte[]) return new String((byte[]) v, StandardCharsets.UTF_8);
        if (v instanceof char[]) return new String((char[]) v);
        if (v instanceof List<?>) {
            StringBuilder sb = new StringBuilder();
            for (Object o : (List<?>) v) sb.append(o);
            return sb.toString();
        }
        return String.valueOf(v);
    }

    static double[] toDoubleArray(Object o) {
        if (o == null) return null;
        if (o instanceof double[]) return (double[]) o;
        if (o instanceof float[]) { float[] f = (float[]) o; double[] d = new double[f.length]; for (int i = 0; i < f.length; i++) d[i] = f[i]; return d; }
        if (o instanceof Number) return new double[] { ((Number) o).doubleValue() };
        if (o instanceof List<?>) {
            List<?> lst = (List<?>) o;
            double[] d = new double[lst.size()];
            for (int i = 0; i < lst.size(); i++) {
                Object v = lst.get(i);
                if (!(v instanceof Number)) return null;
                d[i] = ((Number) v).doubleValue();
            }
            return d;
        }
        return null;
    }

    static int[] toUInt16Array(Object v) {
        if (v == null) return null;
        if (v instanceof int[]) return (int[]) v;
        if (v instanceof short[]) { short[] s = (short[]) v; int[] out = new int[s.length]; for (int i = 0; i < s.length; i++) out[i] = s[i] & 0xFFFF; return out; }
        if (v instanceof List<?>) {
            List<?> lst = (List<?>) v;
            int[] out = new int[lst.size()];
            for (int i = 0; i < lst.size(); i++) {
                Object o = lst.get(i);
                if (!(o instanceof Number)) return null;
                out[i] = ((Number) o).intValue() & 0xFFFF;
            }
            return out;
        }
        return null;
    }

} // GeoTiffTags
