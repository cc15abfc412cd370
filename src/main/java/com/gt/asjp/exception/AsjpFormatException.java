package com.gt.asjp.exception;

public class AsjpFormatException extends RuntimeException {

    public AsjpFormatException(String errMsg)  {
        super(errMsg);
    }

    public AsjpFormatException(String errMsg, Exception ex) {
        super(errMsg, ex);
    }
}
