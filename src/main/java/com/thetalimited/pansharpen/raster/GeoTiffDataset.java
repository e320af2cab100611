// GeoTiffDataset.java
// a read-only, scoped handle on a GeoTIFF file
// header and georeferencing are parsed on open; pixels are only
// decoded when asked for. Use with try-with-resources so the
// handle is released before anything deletes the file.

package com.thetalimited.pansharpen.raster;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import mil.nga.tiff.FileDirectory;
import mil.nga.tiff.Rasters;
import mil.nga.tiff.TIFFImage;
import mil.nga.tiff.TiffReader;
import mil.nga.tiff.util.TiffException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class GeoTiffDataset implements AutoCloseable
{
    private static final Logger log = LoggerFactory.getLogger(GeoTiffDataset.class);

    private final Path path;
    private final int width, height, bandCount;
    private final GeoReference geoReference;

    private TIFFImage tiff;
    private FileDirectory dir;

    private GeoTiffDataset(Path path, TIFFImage tiff, FileDirectory dir) throws RasterFormatException {
        this.path = path;
        this.tiff = tiff;
        this.dir = dir;

        try {
            this.width = toInt(dir.getImageWidth());
            this.height = toInt(dir.getImageHeight());
            Number spp = dir.getSamplesPerPixel();
            this.bandCount = (spp == null) ? 1 : spp.intValue();
        }
        catch (IllegalStateException | TiffException e) {
            throw new RasterFormatException(path + " has an unreadable TIFF header", e);
        }
        if (width <= 0 || height <= 0 || bandCount <= 0) {
            throw new RasterFormatException(path + " has an empty raster (" + width + "x" + height + "x" + bandCount + ")");
        }

        try {
            this.geoReference = GeoTiffTags.readGeoReference(dir);
        }
        catch (IllegalStateException e) {
            throw new RasterFormatException(path + " has a degenerate geotransform: " + e.getMessage(), e);
        }
        if (!geoReference.isGeoreferenced()) {
            log.warn("{} has no georeferencing; operating in pixel space", path);
        }
    }

    /**
     * Opens a raster read-only.
     *
     * @throws RasterFormatException if the path is unreadable or not a TIFF
     */
    public static GeoTiffDataset open(Path path) throws RasterFormatException {
        if (path == null || !Files.isRegularFile(path) || !Files.isReadable(path)) {
            throw new RasterFormatException("Cannot read raster file " + path);
        }

        TIFFImage tiffImage;
        try {
            tiffImage = TiffReader.readTiff(new File(path.toString()));
        }
        catch (IOException | TiffException e) {
            throw new RasterFormatException(path + " is not a recognized raster format: " + e.getMessage(), e);
        }

        List<FileDirectory> dirs = tiffImage.getFileDirectories();
        if (dirs == null || dirs.isEmpty()) {
            throw new RasterFormatException(path + " contains no image directory");
        }

        // first directory is the full resolution image; later ones are overviews/masks
        GeoTiffDataset ds = new GeoTiffDataset(path, tiffImage, dirs.get(0));
        log.debug("opened {}: {}x{}x{} {}", path, ds.width, ds.height, ds.bandCount, ds.geoReference);
        return ds;
    }

    public Path getPath() { return path; }
    public int getWidth() { return width; }
    public int getHeight() { return height; }
    public int getBandCount() { return bandCount; }
    public GeoReference getGeoReference() { return geoReference; }

    public GridSpec getGridSpec() {
        return new GridSpec(width, height, geoReference);
    }

    // decode every band as doubles

    public Raster readRaster() throws RasterFormatException {
        requireOpen();

        Rasters rasters;
        try {
            rasters = dir.readRasters();
        }
        catch (TiffException e) {
            throw new RasterFormatException("Cannot decode pixels of " + path + ": " + e.getMessage(), e);
        }
        if (rasters == null) {
            throw new RasterFormatException("No raster data found in " + path);
        }

        int w = rasters.getWidth();
        int h = rasters.getHeight();
        int n = rasters.getSamplesPerPixel();
        double[][][] data = new double[n][h][w];

        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                Number[] sampleValues = rasters.getPixel(x, y);
                for (int b = 0; b < n; b++) {
                    data[b][y][x] = sampleValues[b].doubleValue();
                }
            }
        }

        List<double[][]> bands = new ArrayList<>(n);
        for (int b = 0; b < n; b++) bands.add(data[b]);
        return new Raster(bands, geoReference);
    }

    private void requireOpen() {
        if (tiff == null) {
            throw new IllegalStateException("dataset " + path + " is closed");
        }
    }

    private static int toInt(Object n) {
        if (n instanceof Number) return ((Number) n).intValue();
        throw new IllegalStateException("Expected Number, got " + (n == null ? "null" : n.getClass()));
    }

    @Override
    public void close() {
        if (tiff != null) {
            log.debug("closed {}", path);
        }
        tiff = null;
        dir = null;
    }

} // GeoTiffDataset
