package io.campbellsci.parser.util;

/** Raised when an array id selected for export has no output file configured. */
public class ArrayIdsExportInfoException extends ArrayIdsInfoException {
    public ArrayIdsExportInfoException(String message) {
        super(message);
    }
}
