package com.rodoc.ocr.service.registry;

import java.util.Objects;

/**
 * Where one field sits on a card and how it is recognized and checked.
 *
 * @param field     field name reported in the result
 * @param area      fractional location on the card
 * @param ocr       recognition settings for the crop
 * @param validator check applied to the recognized text, {@code null} to accept any text
 */
public record FieldRegion(String field, FractionalRect area, RegionOcrConfig ocr, FieldValidator validator) {

    public FieldRegion {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(area, "area");
        Objects.requireNonNull(ocr, "ocr");
    }
}
