package com.rodoc.ocr.service.registry;

import com.rodoc.ocr.model.FieldValidation;
import com.rodoc.ocr.util.CnpValidator;
import com.rodoc.ocr.util.CnpValidator.CnpValidation;
import com.rodoc.ocr.util.RomanianText;
import java.util.regex.Pattern;

/**
 * Checks applied to recognized field text. A rejected value never carries a normalized form.
 */
public enum FieldValidator {

    CNP {
        @Override
        public FieldValidation validate(String value) {
            String candidate = value == null ? "" : value.trim();
            CnpValidation result = CnpValidator.validate(candidate);
            return result.valid() ? FieldValidation.accepted(candidate) : FieldValidation.rejected(result.message());
        }
    },

    NAME {
        @Override
        public FieldValidation validate(String value) {
            String candidate = value == null ? "" : value.trim();
            if (candidate.length() < 2) {
                return FieldValidation.rejected("Name too short");
            }
            if (!NAME_PATTERN.matcher(candidate).matches()) {
                return FieldValidation.rejected("Name contains invalid characters");
            }
            return FieldValidation.accepted(RomanianText.capitalizeWords(RomanianText.standardizeDiacritics(candidate)));
        }
    },

    ADDRESS {
        @Override
        public FieldValidation validate(String value) {
            String candidate = value == null ? "" : value.trim();
            if (candidate.length() < 5) {
                return FieldValidation.rejected("Address too short");
            }
            return FieldValidation.accepted(candidate);
        }
    };

    private static final Pattern NAME_PATTERN = Pattern.compile("[" + RomanianText.NAME_LETTERS + "\\s\\-]+");

    public abstract FieldValidation validate(String value);
}
