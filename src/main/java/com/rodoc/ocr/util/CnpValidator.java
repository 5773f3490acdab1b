package com.rodoc.ocr.util;

import com.rodoc.ocr.model.Gender;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Year;
import java.util.Optional;

/**
 * Validates the Romanian personal numeric code (CNP) and derives the birth date and gender it encodes.
 *
 * <p>Layout: {@code S YY MM DD JJ NNN C} where {@code S} selects sex and century and {@code C} is a
 * weighted mod-11 control digit over the first twelve digits.
 */
public final class CnpValidator {

    private static final int[] WEIGHTS = {2, 7, 9, 1, 4, 6, 3, 5, 8, 2, 7, 9};

    private CnpValidator() {
    }

    public static CnpValidation validate(String cnp) {
        return validate(cnp, Clock.systemDefaultZone());
    }

    public static CnpValidation validate(String cnp, Clock clock) {
        if (cnp == null || cnp.length() != 13) {
            return CnpValidation.invalid(Reason.LENGTH);
        }
        for (int i = 0; i < cnp.length(); i++) {
            char c = cnp.charAt(i);
            if (c < '0' || c > '9') {
                return CnpValidation.invalid(Reason.NON_DIGIT);
            }
        }
        int century = century(digit(cnp, 0));
        if (century < 0) {
            return CnpValidation.invalid(Reason.CENTURY);
        }
        int year = century + Integer.parseInt(cnp.substring(1, 3));
        LocalDate birthDate;
        try {
            birthDate = LocalDate.of(year,
                    Integer.parseInt(cnp.substring(3, 5)),
                    Integer.parseInt(cnp.substring(5, 7)));
        } catch (DateTimeException ex) {
            return CnpValidation.invalid(Reason.BIRTH_DATE);
        }
        if (year > Year.now(clock).getValue() || year < 1800) {
            return CnpValidation.invalid(Reason.BIRTH_YEAR);
        }
        if (controlDigit(cnp) != digit(cnp, 12)) {
            return CnpValidation.invalid(Reason.CHECKSUM);
        }
        Gender gender = isMale(digit(cnp, 0)) ? Gender.M : Gender.F;
        return new CnpValidation(true, null, birthDate, gender);
    }

    public static Optional<LocalDate> extractBirthDate(String cnp) {
        return Optional.ofNullable(validate(cnp).birthDate());
    }

    public static Optional<Gender> extractGender(String cnp) {
        return Optional.ofNullable(validate(cnp).gender());
    }

    /**
     * Computes the control digit for the first twelve digits of {@code cnp}. Callers must pass at
     * least twelve ASCII digits.
     */
    public static int controlDigit(String cnp) {
        int sum = 0;
        for (int i = 0; i < WEIGHTS.length; i++) {
            sum += digit(cnp, i) * WEIGHTS[i];
        }
        int remainder = sum % 11;
        return remainder == 10 ? 1 : remainder;
    }

    private static int century(int sexDigit) {
        switch (sexDigit) {
            case 1:
            case 2:
                return 1900;
            case 3:
            case 4:
                return 1800;
            case 5:
            case 6:
                return 2000;
            default:
                return -1;
        }
    }

    private static boolean isMale(int sexDigit) {
        return sexDigit == 1 || sexDigit == 3 || sexDigit == 5;
    }

    private static int digit(String value, int index) {
        return value.charAt(index) - '0';
    }

    public enum Reason {
        LENGTH("length", "CNP must be exactly 13 digits"),
        NON_DIGIT("non_digit", "CNP must contain only digits"),
        CENTURY("century", "Invalid CNP first digit"),
        BIRTH_DATE("birth_date", "Invalid birth date in CNP"),
        BIRTH_YEAR("birth_year", "Invalid birth year in CNP"),
        CHECKSUM("checksum", "Invalid CNP checksum");

        private final String code;
        private final String message;

        Reason(String code, String message) {
            this.code = code;
            this.message = message;
        }

        public String code() {
            return code;
        }

        public String message() {
            return message;
        }
    }

    /**
     * Outcome of a CNP check. {@code birthDate} and {@code gender} are only set when {@code valid}.
     */
    public record CnpValidation(boolean valid, Reason reason, LocalDate birthDate, Gender gender) {

        static CnpValidation invalid(Reason reason) {
            return new CnpValidation(false, reason, null, null);
        }

        public String reasonCode() {
            return reason == null ? null : reason.code();
        }

        public String message() {
            return reason == null ? null : reason.message();
        }
    }
}
