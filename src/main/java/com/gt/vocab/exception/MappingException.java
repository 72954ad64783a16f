package com.gt.vocab.exception;

// A stored row holds a value the domain model cannot represent
public class MappingException extends DaoException {

    private final String column;

    public MappingException(String column, String value, Throwable cause) {
        super("Cannot map value '" + value + "' of column " + column, cause);
        this.column = column;
    }

    public String getColumn() {
        return column;
    }
}
