package com.streamfirst.sheetgrid.application;

import com.streamfirst.sheetgrid.domain.CellKey;
import com.streamfirst.sheetgrid.domain.CellValues;
import com.streamfirst.sheetgrid.domain.Result;
import lombok.RequiredArgsConstructor;

/**
 * Rejects edits of the identity and read-only columns and values that do not parse in numeric or
 * date columns. Blank values always pass the format checks so a cell can be cleared.
 */
@RequiredArgsConstructor
public class ColumnFormatValidator implements CellValidator {

    private final ValidationSettings settings;

    @Override
    public Result<Void> validate(CellKey cell, String newValue) {
        String field = cell.fieldName();
        if (field.equals(settings.identityColumn())) {
            return Result.failure("Identity column '" + field + "' cannot be edited", "READ_ONLY");
        }
        if (settings.readOnlyColumns().contains(field)) {
            return Result.failure("Column '" + field + "' is read-only", "READ_ONLY");
        }
        if (CellValues.isBlank(newValue)) {
            return Result.ok();
        }
        if (settings.numericColumns().contains(field) && CellValues.parseNumber(newValue).isEmpty()) {
            return Result.failure("'" + newValue + "' is not a number", "NOT_A_NUMBER");
        }
        if (settings.dateColumns().contains(field) && CellValues.parseDate(newValue).isEmpty()) {
            return Result.failure("'" + newValue + "' is not a date", "NOT_A_DATE");
        }
        return Result.ok();
    }
}
