package com.rodoc.ocr.service.region;

import com.rodoc.ocr.model.ExtractedField;
import com.rodoc.ocr.service.registry.IdCardSubtype;
import java.util.List;

/**
 * Fields read from one identity card with one subtype's region map.
 */
public record CardReading(IdCardSubtype subtype, List<ExtractedField> fields) {

    public CardReading {
        fields = List.copyOf(fields);
    }

    public double meanConfidence() {
        if (fields.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (ExtractedField field : fields) {
            sum += field.confidence();
        }
        return sum / fields.size();
    }
}
