package com.thetalimited.pansharpen;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.thetalimited.pansharpen.raster.GeoTiffRasterIO;
import com.thetalimited.pansharpen.raster.Raster;
import com.thetalimited.pansharpen.raster.RasterFormatException;
import com.thetalimited.pansharpen.resample.ResampleException;

class PanSharpenPipelineTest
{
    @TempDir
    Path tmp;

    private PanSharpenPipeline pipeline;

    @BeforeEach
    void setUp() {
        pipeline = new PanSharpenPipeline(PanSharpenConfig.defaults());
    }

    // 40x40 pan at 10 m and a 10x10 multispectral image at 40 m over the same extent
    private Path writePan(String name) throws IOException {
        return RasterFixtures.write(tmp.resolve(name), RasterFixtures.smoothBands(1, 40, 40, 51L),
                                    RasterFixtures.utm(500000, 4430000, 10));
    }

    private Path writeMulti(String name, int bands) throws IOException {
        return RasterFixtures.write(tmp.resolve(name), RasterFixtures.smoothBands(bands, 10, 10, 52L),
                                    RasterFixtures.utm(500000, 4430000, 40));
    }

    @Test
    void fourBandImageIsSharpenedOntoThePanGrid() throws Exception {
        Path pan = writePan("pan.tif");
        Path multi = writeMulti("scene.TIF", 4);

        Path output = pipeline.run(pan, multi);

        assertThat(output).isEqualTo(tmp.resolve("scene_panSharpenedPCA.tif"));
        Raster out = GeoTiffRasterIO.load(output);
        assertThat(out.getBandCount()).isEqualTo(4);
        assertThat(out.getWidth()).isEqualTo(40);
        assertThat(out.getHeight()).isEqualTo(40);
        assertThat(out.getGeoReference().sameGrid(GeoTiffRasterIO.load(pan).getGeoReference())).isTrue();
        assertThat(tmp.resolve("scene_RESAMPLED.TIF")).doesNotExist();
    }

    @Test
    void threeBandImageIsSupported() throws Exception {
        Path output = pipeline.run(writePan("pan.tif"), writeMulti("rgb.tiff", 3));

        assertThat(GeoTiffRasterIO.load(output).getBandCount()).isEqualTo(3);
        assertThat(tmp.resolve("rgb_RESAMPLED.tiff")).doesNotExist();
    }

    @Test
    void panNodataComesOutAsZero() throws Exception {
        double[][] panBand = RasterFixtures.smoothBands(1, 40, 40, 53L).get(0);
        panBand[12][30] = 0.0;
        Path pan = RasterFixtures.write(tmp.resolve("pan.tif"), List.<double[][]>of(panBand),
                                        RasterFixtures.utm(500000, 4430000, 10));

        Raster out = GeoTiffRasterIO.load(pipeline.run(pan, writeMulti("scene.tif", 4)));

        for (int b = 0; b < 4; b++) {
            assertThat(out.get(b, 30, 12)).isEqualTo(0.0);
        }
    }

    @Test
    void existingOutputIsReplaced() throws Exception {
        Path multi = writeMulti("scene.tif", 4);
        Files.write(tmp.resolve("scene_panSharpenedPCA.tif"), new byte[] { 42 });

        Path output = pipeline.run(writePan("pan.tif"), multi);

        assertThat(GeoTiffRasterIO.load(output).getWidth()).isEqualTo(40);
    }

    @Test
    void multiBandPanIsRejected() throws Exception {
        Path pan = writeMulti("pan.tif", 3);

        assertThatThrownBy(() -> pipeline.run(pan, writeMulti("scene.tif", 4)))
            .isInstanceOf(InputValidationException.class)
            .hasMessageContaining("ONE single band");
        assertThat(tmp.resolve("scene_panSharpenedPCA.tif")).doesNotExist();
    }

    @Test
    void twoBandMultispectralIsRejected() throws Exception {
        Path pan = writePan("pan.tif");

        assertThatThrownBy(() -> pipeline.run(pan, writeMulti("scene.tif", 2)))
            .isInstanceOf(InputValidationException.class)
            .hasMessageContaining("3 or 4 bands");
    }

    @Test
    void bandCountsAreCheckedBeforeTheFileName() throws Exception {
        Path pan = writeMulti("pan.tif", 2);
        Path multi = writeMulti("scene.img", 4);

        assertThatThrownBy(() -> pipeline.run(pan, multi))
            .isInstanceOf(InputValidationException.class)
            .hasMessageContaining("ONE single band");
    }

    @Test
    void unrecognizedExtensionIsRejected() throws Exception {
        Path pan = writePan("pan.tif");
        Path multi = writeMulti("scene.img", 4);

        assertThatThrownBy(() -> pipeline.run(pan, multi))
            .isInstanceOf(InputValidationException.class)
            .hasMessageContaining(".tif");
    }

    @Test
    void unreadableInputIsAFormatError() throws Exception {
        Path pan = writePan("pan.tif");

        assertThatThrownBy(() -> pipeline.run(pan, tmp.resolve("missing.tif")))
            .isInstanceOf(RasterFormatException.class);
    }

    @Test
    void intermediateIsRemovedWhenAlignmentFails() throws Exception {
        Path pan = writePan("pan.tif");
        Path multi = RasterFixtures.write(tmp.resolve("far.tif"), RasterFixtures.smoothBands(4, 10, 10, 54L),
                                          RasterFixtures.utm(900000, 4430000, 40));

        assertThatThrownBy(() -> pipeline.run(pan, multi)).isInstanceOf(ResampleException.class);
        assertThat(tmp.resolve("far_RESAMPLED.tif")).doesNotExist();
        assertThat(tmp.resolve("far_panSharpenedPCA.tif")).doesNotExist();
    }

    @Test
    void intermediateIsRemovedWhenTheOutputCannotBeReplaced() throws Exception {
        Path pan = writePan("pan.tif");
        Path multi = writeMulti("scene.tif", 4);
        Path blocker = Files.createDirectory(tmp.resolve("scene_panSharpenedPCA.tif"));
        Files.write(blocker.resolve("keep.txt"), new byte[] { 1 });

        assertThatThrownBy(() -> pipeline.run(pan, multi)).isInstanceOf(IOException.class);
        assertThat(tmp.resolve("scene_RESAMPLED.tif")).doesNotExist();
        assertThat(blocker.resolve("keep.txt")).exists();
    }

    @Test
    void derivedNamesFollowTheMultispectralInput() throws Exception {
        Path multi = tmp.resolve("sub").resolve("A.B.Tif");

        assertThat(PanSharpenPipeline.resampledPathFor(multi)).isEqualTo(tmp.resolve("sub").resolve("A.B_RESAMPLED.Tif"));
        assertThat(PanSharpenPipeline.outputPathFor(multi)).isEqualTo(tmp.resolve("sub").resolve("A.B_panSharpenedPCA.tif"));
        assertThatThrownBy(() -> PanSharpenPipeline.outputPathFor(tmp.resolve(".tif")))
            .isInstanceOf(InputValidationException.class);
    }

} // PanSharpenPipelineTest
