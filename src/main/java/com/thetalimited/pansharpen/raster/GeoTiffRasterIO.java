// GeoTiffRasterIO.java
// load and save whole rasters as Float32 GeoTIFFs

package com.thetalimited.pansharpen.raster;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.FileDirectoryEntry;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffWriter;
import mil.nga.tiff.util.TiffConstants;
import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GeoTiffRasterIO
{
    private static final Logger log = LoggerFactory.getLogger(GeoTiffRasterIO.class);

    private GeoTiffRasterIO() {}

    /**
     * Reads every band of a raster into memory.
     *
     * @throws RasterFormatException if the path is unreadable or not a recognized raster
     */
    public static Raster load(Path path) throws RasterFormatException {
        try (GeoTiffDataset ds = GeoTiffDataset.open(path)) {
            return ds.readRaster();
        }
    }

    public static void save(Path path, Raster raster) throws IOException {
        save(path, raster.getBands(), raster.getGeoReference());
    }

    // georeferencing taken from another raster, e.g. the pan band the bands were aligned to
    public static void save(Path path, List<double[][]> bands, Raster reference) throws IOException {
        save(path, bands, reference.getGeoReference());
    }

    /**
     * Writes one Float32 sample per array, in list order, with the geotransform and
     * projection of {@code reference}. Georeferencing tags read from a file are copied
     * as they were. An existing file at {@code path} is replaced, not appended to.
     */
    public static void save(Path path, List<double[][]> bands, GeoReference reference) throws IOException {
        if (bands == null || bands.isEmpty()) {
            throw new IllegalArgumentException("nothing to write: no bands");
        }
        if (reference == null) {
            throw new IllegalArgumentException("reference georeference must not be null");
        }

        int height = bands.get(0).length;
        int width = height == 0 ? 0 : bands.get(0)[0].length;
        if (width == 0 || height == 0) {
            throw new IllegalArgumentException("bands must not be empty");
        }
        for (int b = 0; b < bands.size(); b++) {
            Raster.requireShape(bands.get(b), width, height, "band " + (b + 1));
        }

        // if the output already exists, delete it
        if (Files.deleteIfExists(path)) {
            log.debug("replaced existing {}", path);
        }

        int samplesPerPixel = bands.size();
        FieldType[] fieldTypes = new FieldType[samplesPerPixel];
        Arrays.fill(fieldTypes, FieldType.FLOAT);

        Rasters rasters = new Rasters(width, height, fieldTypes);
        int rowsPerStrip = rasters.calculateRowsPerStrip(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);

        FileDirectory directory = new FileDirectory();
        directory.setImageWidth(width);
        directory.setImageHeight(height);
        directory.setBitsPerSample(new ArrayList<>(Collections.nCopies(samplesPerPixel, FieldType.FLOAT.getBits())));
        directory.setCompression(TiffConstants.COMPRESSION_NO);
        directory.setPhotometricInterpretation(TiffConstants.PHOTOMETRIC_INTERPRETATION_BLACK_IS_ZERO);
        directory.setSamplesPerPixel(samplesPerPixel);
        directory.setRowsPerStrip(rowsPerStrip);
        directory.setPlanarConfiguration(TiffConstants.PLANAR_CONFIGURATION_CHUNKY);
        directory.setSampleFormat(new ArrayList<>(Collections.nCopies(samplesPerPixel, TiffConstants.SAMPLE_FORMAT_FLOAT)));

        for (FileDirectoryEntry entry : GeoTiffTags.entriesFor(reference)) {
            directory.addEntry(entry);
        }
        directory.setWriteRasters(rasters);

        try {
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    for (int b = 0; b < samplesPerPixel; b++) {
                        rasters.setPixelSample(b, x, y, (float) bands.get(b)[y][x]);
                    }
                }
            }
        }
        catch (TiffException e) {
            throw new IOException("Cannot fill rasters for " + path + ": " + e.getMessage(), e);
        }

        TIFFImage tiffImage = new TIFFImage();
        tiffImage.add(directory);
        try {
            TiffWriter.writeTiff(new File(path.toString()), tiffImage);
        }
        catch (TiffException e) {
            throw new IOException("Cannot write " + path + ": " + e.getMessage(), e);
        }

        log.info("wrote {} ({}x{}, {} bands)", path, width, height, samplesPerPixel);
    }

} // GeoTiffRasterIO
