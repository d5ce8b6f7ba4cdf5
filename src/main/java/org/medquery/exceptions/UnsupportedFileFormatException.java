package org.medquery.exceptions;

import org.springframework.http.HttpStatus;

public class UnsupportedFileFormatException extends MedQueryException {

    public UnsupportedFileFormatException(String message) {
        super(HttpStatus.BAD_REQUEST, "UNSUPPORTED_FILE_FORMAT", message);
    }

    public UnsupportedFileFormatException(String message, Throwable cause) {
        super(HttpStatus.BAD_REQUEST, "UNSUPPORTED_FILE_FORMAT", message, cause);
    }
}
