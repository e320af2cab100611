package com.thetalimited.pansharpen.raster;

import java.io.IOException;

/**
 * Thrown when a file cannot be opened as a raster, either because it is
 * unreadable or because it is not a TIFF the reader understands.
 */
public class RasterFormatException extends IOException
{
    public RasterFormatException(String message) {
        super(message);
    }

    public RasterFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
