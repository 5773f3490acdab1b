package com.rodoc.ocr.service.registry;

import java.util.List;
import java.util.Objects;

/**
 * Field layout of one identity-card subtype.
 */
public record RegionMap(IdCardSubtype subtype, List<FieldRegion> fields, FractionalRect photoRegion) {

    public RegionMap {
        Objects.requireNonNull(subtype, "subtype");
        Objects.requireNonNull(photoRegion, "photoRegion");
        fields = List.copyOf(fields);
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("Region map for " + subtype.code() + " declares no fields");
        }
    }
}
