package com.verity.dataquality.compiler;

import java.util.List;

/**
 * Canonical columns of a rule definition sheet, each with the header spellings
 * accepted for it out of the box. Aliases are listed in lookup order.
 */
public enum RuleColumn {
    FIELD_NAME("fieldName", "Field Name", "Target Field Name", "TargetFieldName"),
    DATA_TYPE("dataType", "Data Type", "Target Data Type", "TargetDataType"),
    REQUIRED("required", "Required"),
    NULL_ALLOWED("nullAllowed", "Null Allowed", "NullAllowed"),
    MIN_LENGTH("minLength", "Min Length", "MinLength"),
    MAX_LENGTH("maxLength", "Max Length", "MaxLength"),
    PATTERN("pattern", "Pattern"),
    ALLOWED_VALUES("allowedValues", "Allowed Values", "AllowedValues"),
    DESCRIPTION("description", "Description");

    private final List<String> defaultAliases;

    RuleColumn(String... aliases) {
        this.defaultAliases = List.of(aliases);
    }

    public List<String> defaultAliases() {
        return defaultAliases;
    }
}
