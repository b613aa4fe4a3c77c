package com.streamfirst.sheetgrid.application;

import java.util.Objects;
import java.util.Set;

/**
 * Column rules applied by {@link ColumnFormatValidator}.
 *
 * @param identityColumn the business identity column, never editable
 * @param numericColumns columns that only accept numbers
 * @param dateColumns columns that only accept dates
 * @param readOnlyColumns further columns that cannot be edited
 */
public record ValidationSettings(
        String identityColumn, Set<String> numericColumns, Set<String> dateColumns, Set<String> readOnlyColumns) {

    public ValidationSettings {
        Objects.requireNonNull(identityColumn, "Identity column cannot be null");
        numericColumns = numericColumns == null ? Set.of() : Set.copyOf(numericColumns);
        dateColumns = dateColumns == null ? Set.of() : Set.copyOf(dateColumns);
        readOnlyColumns = readOnlyColumns == null ? Set.of() : Set.copyOf(readOnlyColumns);
    }

    public static ValidationSettings identityOnly(String identityColumn) {
        return new ValidationSettings(identityColumn, Set.of(), Set.of(), Set.of());
    }
}
