package com.rodoc.ocr.service.recognition;

import com.rodoc.ocr.model.LabTestResult;
import com.rodoc.ocr.model.LabTestResult.Status;
import com.rodoc.ocr.service.registry.MedicalTerms;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Scans laboratory text for result lines such as {@code Hemoglobină: 14,2 g/dL (12-16)}. Decimal
 * commas become points; status is derived from the reference range when one is printed.
 */
@Component
public class LabResultExtractor {

    private static final String NUMBER = "\\d+(?:[.,]\\d+)?";

    private static final Pattern RESULT_LINE = Pattern.compile(
            "(?<name>[A-ZĂÂÎȘȚ][a-zăâîșț]+(?:[ \\t]+[A-Za-zĂÂÎȘȚăâîșț]+)*)"
                    + "(?:[ \\t]*:[ \\t]*|[ \\t]+)"
                    + "(?<value>" + NUMBER + ")(?![.,]?\\d)"
                    + "(?:[ \\t]*(?<unit>[A-Za-zμµ/%]+))?"
                    + "(?:[ \\t]*\\([^)\\d]*?(?<min>" + NUMBER + ")[ \\t]*[-–][ \\t]*(?<max>" + NUMBER + ")[^)]*\\))?");

    private final MedicalTerms medicalTerms;

    public LabResultExtractor(TemplateRegistry registry) {
        this.medicalTerms = registry.medicalTerms();
    }

    public List<LabTestResult> extract(String text) {
        List<LabTestResult> results = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return results;
        }
        Matcher matcher = RESULT_LINE.matcher(text);
        while (matcher.find()) {
            String name = matcher.group("name").trim();
            String value = decimal(matcher.group("value"));
            String unit = matcher.group("unit") == null ? "" : matcher.group("unit");
            String min = decimal(matcher.group("min"));
            String max = decimal(matcher.group("max"));
            results.add(new LabTestResult(name, medicalTerms.normalizeTestName(name), value, unit, min, max,
                    status(value, min, max)));
        }
        return results;
    }

    static Status status(String value, String min, String max) {
        if (min == null || max == null) {
            return Status.UNKNOWN;
        }
        try {
            double measured = Double.parseDouble(value);
            if (measured < Double.parseDouble(min)) {
                return Status.LOW;
            }
            if (measured > Double.parseDouble(max)) {
                return Status.HIGH;
            }
            return Status.NORMAL;
        } catch (NumberFormatException ex) {
            return Status.UNKNOWN;
        }
    }

    private static String decimal(String number) {
        return number == null ? null : number.replace(',', '.');
    }
}
