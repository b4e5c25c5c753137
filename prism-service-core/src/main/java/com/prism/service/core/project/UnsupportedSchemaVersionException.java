package com.prism.service.core.project;

/** A saved payload declares a workspace schema this build cannot read. */
public class UnsupportedSchemaVersionException extends IllegalArgumentException {

    public UnsupportedSchemaVersionException(int schemaVersion) {
        super("Unsupported project schema version: " + schemaVersion);
    }
}
