package com.example.ledgeraudit.domain.model;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Read-only reference data: the known account-code space, object-code categories and the fiscal calendar.
 *
 * @param accountCodes          fund-object code to description
 * @param objectCategories      leading digit of the object code to category name
 * @param fiscalYearStartMonth  first month of the fiscal year
 */
public record ReferenceTables(
        Map<String, String> accountCodes,
        Map<String, String> objectCategories,
        int fiscalYearStartMonth
) {

    public ReferenceTables {
        accountCodes = Map.copyOf(new TreeMap<>(accountCodes));
        objectCategories = Map.copyOf(objectCategories);
    }

    public boolean knowsAccountCode(String code) {
        return code != null && accountCodes.containsKey(code);
    }

    /**
     * Resolves the category of a fund-object code, e.g. {@code 01-5803} to "Services &amp; Operating".
     *
     * @param code account code, the object part follows the last dash
     * @return category name when the leading digit of the object part is mapped
     */
    public Optional<String> categoryOf(String code) {
        if (code == null || code.isBlank()) {
            return Optional.empty();
        }
        int dash = code.lastIndexOf('-');
        String object = dash >= 0 ? code.substring(dash + 1) : code;
        if (object.isEmpty() || !Character.isDigit(object.charAt(0))) {
            return Optional.empty();
        }
        return Optional.ofNullable(objectCategories.get(object.substring(0, 1)));
    }

    public FiscalYear fiscalYear(int startYear) {
        return new FiscalYear(startYear, fiscalYearStartMonth);
    }
}
