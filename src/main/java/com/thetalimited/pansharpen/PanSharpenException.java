// PanSharpenException.java
// base of the checked failures a pansharpening run can end with

package com.thetalimited.pansharpen;

public class PanSharpenException extends Exception
{
    private static final long serialVersionUID = 1L;

    public PanSharpenException(String message) {
        super(message);
    }

    public PanSharpenException(String message, Throwable cause) {
        super(message, cause);
    }

} // PanSharpenException
