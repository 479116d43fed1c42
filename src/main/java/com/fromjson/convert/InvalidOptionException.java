package com.fromjson.convert;

import com.fromjson.json.ConvertFromJsonException;
import com.fromjson.json.ErrorKind;

/**
 * A conversion option is out of range. Raised before any input is read.
 */
public class InvalidOptionException extends ConvertFromJsonException {
    public InvalidOptionException(String message) {
        super(ErrorKind.INVALID_OPTION, message);
    }
}
