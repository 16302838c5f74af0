package io.campbellsci.parser.util;

/** Raised when array id export is requested without any array id information. */
public class ArrayIdsInfoException extends CrParserException {
    public ArrayIdsInfoException(String message) {
        super(message);
    }
}
