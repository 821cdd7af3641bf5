package com.gridsql.types;

/**
 * Sealed interface for the column types a result can report.
 *
 * <p>The type names match the ones used by the native query dialect of the
 * remote grid, so a result produced by direct evaluation and a result reshaped
 * from a native response carry identical {@code type} strings:
 * <ul>
 *   <li>{@link StringType} - "string"</li>
 *   <li>{@link NumberType} - "number"</li>
 *   <li>{@link BooleanType} - "boolean"</li>
 *   <li>{@link DateType} - "date"</li>
 *   <li>{@link DateTimeType} - "datetime"</li>
 * </ul>
 */
public sealed interface DataType
    permits StringType, NumberType, BooleanType, DateType, DateTimeType {

    /**
     * Returns the dialect name for this data type.
     *
     * @return the type name
     */
    String typeName();

    /**
     * Resolves a dialect type name back to a data type.
     *
     * <p>Unknown names (for example "timeofday") map to {@link StringType}.
     *
     * @param name the type name, case-insensitive
     * @return the data type
     */
    static DataType fromName(String name) {
        if (name == null) {
            return StringType.get();
        }
        return switch (name.trim().toLowerCase()) {
            case "number" -> NumberType.get();
            case "boolean" -> BooleanType.get();
            case "date" -> DateType.get();
            case "datetime" -> DateTimeType.get();
            default -> StringType.get();
        };
    }
}
