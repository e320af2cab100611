package com.thetalimited.pansharpen;

// wrong band count or unrecognized file name on one of the inputs

public class InputValidationException extends PanSharpenException
{
    private static final long serialVersionUID = 1L;

    public InputValidationException(String message) {
        super(message);
    }
}
