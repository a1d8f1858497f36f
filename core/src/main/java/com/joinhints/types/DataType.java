package com.joinhints.types;

/**
 * Sealed interface for the column types carried by logical plan schemas.
 *
 * <p>Hint handling never inspects column types; the type model exists so that plan nodes can
 * report an output schema and tests can verify that hint wrappers leave it untouched.
 */
public sealed interface DataType
    permits IntegerType, StringType, StructType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Returns the default size in bytes for values of this type.
     *
     * <p>Returns -1 for variable-length types.
     *
     * @return the default size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }
}
