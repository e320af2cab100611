// PanSharpenPipeline.java
// one pansharpening run: validate the inputs, align the multispectral
// image onto the pan grid, fuse, write the result next to the
// multispectral input and remove the intermediate aligned file

package com.thetalimited.pansharpen;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.pansharpen.fusion.PcaPansharpener;
import com.thetalimited.pansharpen.raster.GeoTiffDataset;
import com.thetalimited.pansharpen.raster.GeoTiffRasterIO;
import com.thetalimited.pansharpen.raster.Raster;
import com.thetalimited.pansharpen.resample.GridResampler;

public class PanSharpenPipeline
{
    private static final Logger log = LoggerFactory.getLogger(PanSharpenPipeline.class);

    static final String RESAMPLED_SUFFIX = "_RESAMPLED";
    static final String OUTPUT_SUFFIX = "_panSharpenedPCA.tif";

    private final PanSharpenConfig config;
    private final GridResampler resampler;
    private final PcaPansharpener sharpener;

    public PanSharpenPipeline(PanSharpenConfig config) {
        this.config = config;
        this.resampler = new GridResampler(config.getReprojectionStep());
        this.sharpener = new PcaPansharpener(config.isRestoreNoData());
    }

    /**
     * Sharpens {@code multispectral} (3 or 4 bands) with {@code panchromatic} (1 band).
     *
     * @return path of the written {@code <base>_panSharpenedPCA.tif}
     * @throws InputValidationException on a wrong band count or file name
     * @throws com.thetalimited.pansharpen.resample.ResampleException if alignment fails
     * @throws IOException if an input cannot be read or the output cannot be written
     */
    public Path run(Path panchromatic, Path multispectral) throws PanSharpenException, IOException {
        int multiBands;
        try (GeoTiffDataset pan = GeoTiffDataset.open(panchromatic);
             GeoTiffDataset multi = GeoTiffDataset.open(multispectral)) {

            if (pan.getBandCount() != 1) {
                throw new InputValidationException("Panchromatic Geotiff image file: " + panchromatic
                        + " should have ONE single band (it has " + pan.getBandCount() + ").");
            }
            multiBands = multi.getBandCount();
            if (multiBands != 3 && multiBands != 4) {
                throw new InputValidationException("Multispectral Geotiff image file: " + multispectral
                        + " should have 3 or 4 bands (it has " + multiBands + ").");
            }
        }

        Path resampled = resampledPathFor(multispectral);
        Path output = outputPathFor(multispectral);

        log.info("pansharpening {} ({} bands) with {} [{}]", multispectral, multiBands, panchromatic, config);
        try {
            resampler.alignFile(multispectral, panchromatic, resampled, config.getInterpolation());

            if (Files.deleteIfExists(output)) {
                log.info("removed existing {}", output);
            }

            Raster pan = GeoTiffRasterIO.load(panchromatic);
            Raster aligned = GeoTiffRasterIO.load(resampled);
            if (aligned.getWidth() != pan.getWidth() || aligned.getHeight() != pan.getHeight()) {
                throw new IllegalStateException("aligned raster is " + aligned.getWidth() + "x" + aligned.getHeight()
                        + ", pan is " + pan.getWidth() + "x" + pan.getHeight());
            }

            double[][] nir = aligned.getBandCount() == 4 ? aligned.getBand(3) : null;
            List<double[][]> sharpened = sharpener.fuse(aligned.getBand(0), aligned.getBand(1),
                                                        aligned.getBand(2), nir, pan.getBand(0));

            GeoTiffRasterIO.save(output, sharpened, pan);
        }
        finally {
            try {
                if (Files.deleteIfExists(resampled)) {
                    log.debug("deleted intermediate {}", resampled);
                }
            }
            catch (IOException e) {
                log.warn("Cannot delete intermediate file {}: {}", resampled, e.getMessage(), e);
            }
        }

        log.info("pansharpened image written to {}", output);
        return output;
    }

    /** {@code <base>_RESAMPLED.<ext>} in the directory of {@code multispectral}. */
    static Path resampledPathFor(Path multispectral) throws InputValidationException {
        String name = multispectral.getFileName().toString();
        String ext = extensionOf(multispectral);
        String base = name.substring(0, name.length() - ext.length());
        return multispectral.resolveSibling(base + RESAMPLED_SUFFIX + ext);
    }

    /** {@code <base>_panSharpenedPCA.tif} in the directory of {@code multispectral}. */
    static Path outputPathFor(Path multispectral) throws InputValidationException {
        String name = multispectral.getFileName().toString();
        String ext = extensionOf(multispectral);
        return multispectral.resolveSibling(name.substring(0, name.length() - ext.length()) + OUTPUT_SUFFIX);
    }

    // ".tif" or ".tiff" as spelled in the file name, any case
    static String extensionOf(Path file) throws InputValidationException {
        String name = file.getFileName() == null ? "" : file.getFileName().toString();
        String lower = name.toLowerCase(Locale.ROOT);
        for (String ext : new String[] { ".tif", ".tiff" }) {
            if (lower.endsWith(ext) && lower.length() > ext.length()) {
                return name.substring(name.length() - ext.length());
            }
        }
        throw new InputValidationException("Multispectral Geotiff image file: " + file
                + " should have a .tif or .tiff extension.");
    }

} // PanSharpenPipeline
