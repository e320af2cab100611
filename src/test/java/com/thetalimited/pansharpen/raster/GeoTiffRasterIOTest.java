package com.thetalimited.pansharpen.raster;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import mil.nga.tiff.FieldTagType;
import mil.nga.tiff.FieldType;
import mil.nga.tiff.FileDirectoryEntry;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.thetalimited.pansharpen.RasterFixtures;
import com.thetalimited.pansharpen.resample.GridResampler;
import com.thetalimited.pansharpen.resample.Interpolation;
import com.thetalimited.pansharpen.resample.ResampleException;

class GeoTiffRasterIOTest
{
    @TempDir
    Path tmp;

    @Test
    void savedBandsLoadBackAsFloat32() throws IOException {
        List<double[][]> bands = RasterFixtures.smoothBands(4, 13, 9, 1L);
        Path file = RasterFixtures.write(tmp.resolve("four.tif"), bands, RasterFixtures.utm(500000, 4430000, 2.0));

        Raster r = GeoTiffRasterIO.load(file);

        assertThat(r.getWidth()).isEqualTo(13);
        assertThat(r.getHeight()).isEqualTo(9);
        assertThat(r.getBandCount()).isEqualTo(4);
        for (int b = 0; b < 4; b++) {
            for (int row = 0; row < 9; row++) {
                for (int col = 0; col < 13; col++) {
                    assertThat(r.get(b, col, row)).isEqualTo((double) (float) bands.get(b)[row][col]);
                }
            }
        }
    }

    @Test
    void singleBandSamplesAreWrittenOneByOne() throws IOException {
        double[][] band = { { 1.5, 2.0 }, { 0.0, -3.25 } };
        Path file = tmp.resolve("tiny.tif");

        GeoTiffRasterIO.save(file, List.<double[][]>of(band), RasterFixtures.utm(500000, 4430000, 10));
        Raster r = GeoTiffRasterIO.load(file);

        assertThat(r.getBandCount()).isEqualTo(1);
        assertThat(r.getBand(0)[0]).containsExactly(1.5, 2.0);
        assertThat(r.getBand(0)[1]).containsExactly(0.0, -3.25);
    }

    // a north-up file whose ModelPixelScale is all zeros
    private Path writeZeroScale(String name) throws IOException {
        List<FileDirectoryEntry> entries = new ArrayList<>();
        entries.add(new FileDirectoryEntry(FieldTagType.getById(GeoTiffTags.MODEL_PIXEL_SCALE_TAG), FieldType.DOUBLE, 3,
                                           new ArrayList<>(List.of(0.0, 0.0, 0.0))));
        entries.add(new FileDirectoryEntry(FieldTagType.getById(GeoTiffTags.MODEL_TIEPOINT_TAG), FieldType.DOUBLE, 6,
                                           new ArrayList<>(List.of(0.0, 0.0, 0.0, 100.0, 200.0, 0.0))));
        entries.add(GeoTiffTags.geoKeyDirectoryEntry(RasterFixtures.UTM_16N));
        GeoReference carrier = GeoReference.fromFile(new double[] { 100.0, 1.0, 0.0, 200.0, 0.0, -1.0 },
                                                     RasterFixtures.UTM_16N, false, entries);

        Path file = tmp.resolve(name);
        GeoTiffRasterIO.save(file, RasterFixtures.smoothBands(1, 4, 4, 11L), carrier);
        return file;
    }

    @Test
    void zeroPixelScaleIsAFormatError() throws IOException {
        Path file = writeZeroScale("flat.tif");

        assertThatThrownBy(() -> GeoTiffRasterIO.load(file))
            .isInstanceOf(RasterFormatException.class)
            .hasMessageContaining("degenerate geotransform");
        assertThatThrownBy(() -> GeoTiffDataset.open(file)).isInstanceOf(RasterFormatException.class);
    }

    @Test
    void zeroPixelScaleTargetFailsAlignment() throws IOException {
        Path target = writeZeroScale("flat.tif");
        Path source = RasterFixtures.write(tmp.resolve("src.tif"),
                RasterFixtures.smoothBands(3, 4, 4, 12L), RasterFixtures.utm(100, 200, 1));

        assertThatThrownBy(() -> new GridResampler().alignFile(source, target, tmp.resolve("out.tif"), Interpolation.NEAREST))
            .isInstanceOf(ResampleException.class);
        assertThat(tmp.resolve("out.tif")).doesNotExist();
    }

    @Test
    void northUpGeoreferenceSurvivesRoundTrip() throws IOException {
        GeoReference ref = RasterFixtures.utm(500000, 4430000, 2.5);
        Path file = RasterFixtures.write(tmp.resolve("geo.tif"), RasterFixtures.smoothBands(1, 8, 8, 2L), ref);

        GeoReference loaded = GeoTiffRasterIO.load(file).getGeoReference();

        assertThat(loaded.isGeoreferenced()).isTrue();
        assertThat(loaded.getHorizontalCRS()).isEqualTo(RasterFixtures.UTM_16N);
        assertThat(loaded.getGeoTransform()).containsExactly(ref.getGeoTransform(), within(1e-9));
        assertThat(loaded.isPixelIsPoint()).isFalse();
    }

    @Test
    void rotatedGeoreferenceIsWrittenAsModelTransformation() throws IOException {
        GeoReference ref = GeoReference.of(new double[] { 1000.0, 2.0, 0.5, 5000.0, 0.25, -2.0 }, "EPSG:32616");
        Path file = RasterFixtures.write(tmp.resolve("rot.tif"), RasterFixtures.smoothBands(1, 6, 5, 3L), ref);

        GeoReference loaded = GeoTiffRasterIO.load(file).getGeoReference();

        assertThat(loaded.isNorthUp()).isFalse();
        assertThat(loaded.getGeoTransform()).containsExactly(ref.getGeoTransform(), within(1e-9));
    }

    @Test
    void georeferenceReadFromFileIsCopiedVerbatim() throws IOException {
        Path first = RasterFixtures.write(tmp.resolve("first.tif"),
                RasterFixtures.smoothBands(1, 10, 10, 4L), RasterFixtures.utm(400000, 4000000, 10.0));
        GeoReference fromFile = GeoTiffRasterIO.load(first).getGeoReference();
        assertThat(fromFile.getSourceEntries()).isNotEmpty();

        Path second = tmp.resolve("second.tif");
        GeoTiffRasterIO.save(second, RasterFixtures.smoothBands(3, 10, 10, 5L), fromFile);
        GeoReference copied = GeoTiffRasterIO.load(second).getGeoReference();

        assertThat(copied.sameGrid(fromFile)).isTrue();
        assertThat(copied.getSourceEntries()).hasSameSizeAs(fromFile.getSourceEntries());
    }

    @Test
    void existingFileIsReplaced() throws IOException {
        Path file = tmp.resolve("replace.tif");
        RasterFixtures.write(file, RasterFixtures.smoothBands(4, 20, 20, 6L), RasterFixtures.utm(0, 0, 1));
        RasterFixtures.write(file, RasterFixtures.smoothBands(1, 5, 7, 7L), RasterFixtures.utm(0, 0, 1));

        Raster r = GeoTiffRasterIO.load(file);
        assertThat(r.getBandCount()).isEqualTo(1);
        assertThat(r.getWidth()).isEqualTo(5);
        assertThat(r.getHeight()).isEqualTo(7);
    }

    @Test
    void rasterWithoutGeoreferencingLoadsInPixelSpace() throws IOException {
        Path file = RasterFixtures.write(tmp.resolve("plain.tif"),
                RasterFixtures.smoothBands(1, 4, 4, 8L), GeoReference.pixelSpace());

        GeoReference loaded = GeoTiffRasterIO.load(file).getGeoReference();

        assertThat(loaded.isGeoreferenced()).isFalse();
        assertThat(loaded.getHorizontalCRS()).isNull();
    }

    @Test
    void datasetReportsHeaderWithoutDecodingPixels() throws IOException {
        Path file = RasterFixtures.write(tmp.resolve("hdr.tif"),
                RasterFixtures.smoothBands(3, 11, 6, 9L), RasterFixtures.utm(0, 600, 100));

        try (GeoTiffDataset ds = GeoTiffDataset.open(file)) {
            assertThat(ds.getBandCount()).isEqualTo(3);
            assertThat(ds.getGridSpec().getWidth()).isEqualTo(11);
            assertThat(ds.getGridSpec().getHeight()).isEqualTo(6);
        }
    }

    @Test
    void closedDatasetRefusesToRead() throws IOException {
        Path file = RasterFixtures.write(tmp.resolve("closed.tif"),
                RasterFixtures.smoothBands(1, 3, 3, 10L), RasterFixtures.utm(0, 0, 1));
        GeoTiffDataset ds = GeoTiffDataset.open(file);
        ds.close();

        assertThatThrownBy(ds::readRaster).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void missingFileIsAFormatError() {
        assertThatThrownBy(() -> GeoTiffRasterIO.load(tmp.resolve("nope.tif")))
            .isInstanceOf(RasterFormatException.class)
            .hasMessageContaining("nope.tif");
    }

    @Test
    void nonTiffFileIsAFormatError() throws IOException {
        Path file = tmp.resolve("text.tif");
        Files.write(file, "this is not a tiff".getBytes(StandardCharsets.US_ASCII));

        assertThatThrownBy(() -> GeoTiffRasterIO.load(file)).isInstanceOf(RasterFormatException.class);
    }

    @Test
    void bandsOfDifferentShapesAreRejected() {
        List<double[][]> bands = List.of(new double[4][4], new double[4][5]);

        assertThatThrownBy(() -> GeoTiffRasterIO.save(tmp.resolve("bad.tif"), bands, GeoReference.pixelSpace()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(tmp.resolve("bad.tif")).doesNotExist();
    }

    @Test
    void nonInvertibleGeotransformIsRejected() {
        assertThatThrownBy(() -> GeoReference.of(new double[] { 0, 1, 2, 0, 2, 4 }, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Non-invertible");
    }

    @Test
    void pixelAndWorldCoordinatesAreInverse() {
        GeoReference ref = GeoReference.of(new double[] { 1000.0, 2.0, 0.5, 5000.0, 0.25, -2.0 }, null);

        double[] world = ref.worldFromPixel(3.25, 7.5);
        double[] px = ref.pixelFromWorld(world[0], world[1]);

        assertThat(px[0]).isCloseTo(3.25, within(1e-9));
        assertThat(px[1]).isCloseTo(7.5, within(1e-9));
    }

    @Test
    void crsSupportTellsGeographicFromProjected() {
        assertThat(CrsSupport.isGeographic("EPSG:4326")).isTrue();
        assertThat(CrsSupport.isGeographic("EPSG:32616")).isFalse();
        assertThatThrownBy(() -> CrsSupport.lookup("EPSG:999999")).isInstanceOf(IllegalArgumentException.class);
    }

} // GeoTiffRasterIOTest
