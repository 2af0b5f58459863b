package com.projectedjournal.batchprocessor.report;

public enum ErrorType {
    SchemaError,
    UnsupportedGridFormat,
    MappingConflict,
    UnexpectedError
}
