// PanSharpenConfig.java
// run settings: defaults come from pansharpen.properties on the classpath,
// any key can be overridden with a -Dpansharpen.<key>=... system property

package com.thetalimited.pansharpen;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.thetalimited.pansharpen.resample.GridResampler;
import com.thetalimited.pansharpen.resample.Interpolation;

public final class PanSharpenConfig
{
    private static final Logger log = LoggerFactory.getLogger(PanSharpenConfig.class);

    static final String RESOURCE = "/pansharpen.properties";
    static final String SYSTEM_PREFIX = "pansharpen.";

    static final String KEY_INTERPOLATION = "interpolation";
    static final String KEY_RESTORE_NODATA = "restoreNoData";
    static final String KEY_REPROJECTION_STEP = "reprojection.step";
    static final String KEY_VERSION = "version";

    private final Interpolation interpolation;
    private final boolean restoreNoData;
    private final int reprojectionStep;
    private final String version;

    PanSharpenConfig(Interpolation interpolation, boolean restoreNoData, int reprojectionStep, String version) {
        if (reprojectionStep < 1) {
            throw new IllegalArgumentException("reprojection.step must be >= 1, got " + reprojectionStep);
        }
        this.interpolation = interpolation;
        this.restoreNoData = restoreNoData;
        this.reprojectionStep = reprojectionStep;
        this.version = version;
    }

    public static PanSharpenConfig defaults() {
        return new PanSharpenConfig(Interpolation.CUBIC, true, GridResampler.DEFAULT_REPROJECTION_STEP, "unknown");
    }

    /**
     * Reads the bundled properties, then applies system property overrides.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static PanSharpenConfig load() {
        Properties props = new Properties();
        try (InputStream in = PanSharpenConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
            }
            else {
                log.debug("{} not on classpath; using built-in defaults", RESOURCE);
            }
        }
        catch (IOException e) {
            log.warn("Cannot read {}: {}; using built-in defaults", RESOURCE, e.getMessage());
        }
        return fromProperties(props, System.getProperties());
    }

    static PanSharpenConfig fromProperties(Properties bundled, Properties overrides) {
        PanSharpenConfig d = defaults();

        String interp = value(bundled, overrides, KEY_INTERPOLATION, d.interpolation.name());
        String restore = value(bundled, overrides, KEY_RESTORE_NODATA, Boolean.toString(d.restoreNoData));
        String step = value(bundled, overrides, KEY_REPROJECTION_STEP, Integer.toString(d.reprojectionStep));
        String version = value(bundled, overrides, KEY_VERSION, d.version);

        Interpolation interpolation;
        try {
            interpolation = Interpolation.valueOf(interp.trim().toUpperCase(Locale.ROOT));
        }
        catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown interpolation '" + interp + "'", e);
        }

        int reprojectionStep;
        try {
            reprojectionStep = Integer.parseInt(step.trim());
        }
        catch (NumberFormatException e) {
            throw new IllegalArgumentException("reprojection.step is not an integer: '" + step + "'", e);
        }

        return new PanSharpenConfig(interpolation, Boolean.parseBoolean(restore.trim()), reprojectionStep, version.trim());
    }

    private static String value(Properties bundled, Properties overrides, String key, String fallback) {
        String v = overrides.getProperty(SYSTEM_PREFIX + key);
        if (v == null) v = bundled.getProperty(key);
        return v == null ? fallback : v;
    }

    public PanSharpenConfig withInterpolation(Interpolation interpolation) {
        return new PanSharpenConfig(interpolation, restoreNoData, reprojectionStep, version);
    }

    public PanSharpenConfig withRestoreNoData(boolean restoreNoData) {
        return new PanSharpenConfig(interpolation, restoreNoData, reprojectionStep, version);
    }

    public Interpolation getInterpolation() { return interpolation; }
    public boolean isRestoreNoData() { return restoreNoData; }
    public int getReprojectionStep() { return reprojectionStep; }
    public String getVersion() { return version; }

    @Override
    public String toString() {
        return "interpolation=" + interpolation + ", restoreNoData=" + restoreNoData
             + ", reprojection.step=" + reprojectionStep;
    }

} // PanSharpenConfig
