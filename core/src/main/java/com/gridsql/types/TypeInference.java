package com.gridsql.types;

/**
 * Infers the reported type of a column from the values it holds.
 *
 * <p>Null and empty-string cells are ignored. A column whose remaining values all share
 * one variant reports that variant's type; numeric-like strings count as numbers. Any
 * mix falls back to "string".
 */
public final class TypeInference {

    private TypeInference() {}

    /**
     * Infers the data type of a column.
     *
     * @param values the column values
     * @return the inferred type, "string" when nothing is known
     */
    public static DataType inferColumnType(Iterable<CellValue> values) {
        DataType inferred = null;
        for (CellValue value : values) {
            DataType type = typeOf(value);
            if (type == null) {
                continue;
            }
            if (inferred == null) {
                inferred = type;
            } else if (!inferred.equals(type)) {
                if (isTemporal(inferred) && isTemporal(type)) {
                    inferred = DateTimeType.get();
                } else {
                    return StringType.get();
                }
            }
        }
        return inferred != null ? inferred : StringType.get();
    }

    private static DataType typeOf(CellValue value) {
        if (value instanceof NullValue) {
            return null;
        }
        if (value instanceof StringValue string) {
            if (string.isEmpty()) {
                return null;
            }
            return TypeCoercion.isNumericText(string.value()) ? NumberType.get() : StringType.get();
        }
        return value.dataType();
    }

    private static boolean isTemporal(DataType type) {
        return type instanceof DateType || type instanceof DateTimeType;
    }
}
