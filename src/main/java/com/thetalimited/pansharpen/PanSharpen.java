// PanSharpen.java
// command line front end for PCA pansharpening
//
// Usage: pansharpen -p <pan.tif> -m <multi.tif> [-i CUBIC|BILINEAR|NEAREST] [--keep-nodata-values]
// The sharpened image is written next to the multispectral input as
// <base>_panSharpenedPCA.tif and its path is printed on stdout.

package com.thetalimited.pansharpen;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import com.thetalimited.pansharpen.resample.Interpolation;

@Command(name = "pansharpen",
         description = "Fuses a 3 or 4 band multispectral GeoTIFF with a 1 band panchromatic GeoTIFF "
                     + "using principal component substitution.",
         versionProvider = PanSharpen.ConfigVersionProvider.class,
         sortOptions = false,
         exitCodeOnInvalidInput = 1,
         exitCodeOnExecutionException = 1)
public class PanSharpen implements Callable<Integer>
{
    @Spec
    CommandSpec spec;

    @Option(names = { "-p", "--panchromatic" }, required = true, paramLabel = "FILE",
            description = "panchromatic image file (1 band)")
    Path panchromatic;

    @Option(names = { "-m", "--multispectral" }, required = true, paramLabel = "FILE",
            description = "multispectral image file (3 or 4 bands: R, G, B[, NIR])")
    Path multispectral;

    @Option(names = { "-i", "--interpolation" }, paramLabel = "KERNEL",
            description = "resampling kernel: ${COMPLETION-CANDIDATES} (default from configuration, CUBIC)")
    Interpolation interpolation;

    @Option(names = "--keep-nodata-values",
            description = "keep computed values where the inputs had nodata instead of writing 0")
    boolean keepNoDataValues;

    @Option(names = { "-v", "--version" }, versionHelp = true, description = "print version and exit")
    boolean versionRequested;

    @Option(names = { "-u", "--usage" }, usageHelp = true, description = "print this usage and exit")
    boolean usageRequested;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        PanSharpenConfig config;
        try {
            config = PanSharpenConfig.load();
        }
        catch (IllegalArgumentException e) {
            err.println("    Bad configuration: " + e.getMessage() + " Exiting ...");
            return 1;
        }
        if (interpolation != null) config = config.withInterpolation(interpolation);
        if (keepNoDataValues) config = config.withRestoreNoData(false);

        try {
            Path output = new PanSharpenPipeline(config).run(panchromatic, multispectral);
            out.println(output);
            out.flush();
            return 0;
        }
        catch (PanSharpenException | IOException e) {
            err.println("    " + e.getMessage() + " Exiting ...");
            err.flush();
            return 1;
        }
    }

    public static class ConfigVersionProvider implements IVersionProvider
    {
        @Override
        public String[] getVersion() {
            return new String[] { "pansharpen " + PanSharpenConfig.load().getVersion() };
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new PanSharpen())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }

} // PanSharpen
