// ResampleException.java

package com.thetalimited.pansharpen.resample;

import com.thetalimited.pansharpen.PanSharpenException;

public class ResampleException extends PanSharpenException
{
    private static final long serialVersionUID = 1L;

    public ResampleException(String message) {
        super(message);
    }

    public ResampleException(String message, Throwable cause) {
        super(message, cause);
    }

} // ResampleException
