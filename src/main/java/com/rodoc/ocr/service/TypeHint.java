package com.rodoc.ocr.service;

import com.rodoc.ocr.service.registry.IdCardSubtype;
import com.rodoc.ocr.service.registry.TemplateRegistry;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * A caller-supplied document type hint after alias resolution.
 *
 * @param raw          the hint as received, or {@code null}
 * @param documentType registry document type the hint resolves to; unknown hints pass through
 *                     lower-cased, blank hints become {@code null}
 * @param subtype      identity-card subtype named by the hint, if any
 */
public record TypeHint(String raw, String documentType, Optional<IdCardSubtype> subtype) {

    private static final Map<String, String> ALIASES = Map.ofEntries(
            Map.entry("carte_identitate", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("buletin_identitate", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("carte_electronica", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("identity_card", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("romanian_id", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("ci", TemplateRegistry.IDENTITY_CARD_TYPE),
            Map.entry("lab", TemplateRegistry.LAB_RESULT_TYPE),
            Map.entry("lab_result", TemplateRegistry.LAB_RESULT_TYPE),
            Map.entry("analize", TemplateRegistry.LAB_RESULT_TYPE),
            Map.entry("reteta", TemplateRegistry.PRESCRIPTION_TYPE),
            Map.entry("prescription", TemplateRegistry.PRESCRIPTION_TYPE));

    public static TypeHint resolve(String hint) {
        if (hint == null || hint.isBlank()) {
            return new TypeHint(hint, null, Optional.empty());
        }
        String key = hint.trim().toLowerCase(Locale.ROOT);
        return new TypeHint(hint, ALIASES.getOrDefault(key, key), IdCardSubtype.fromCode(key));
    }

    public boolean present() {
        return documentType != null;
    }

    public boolean identityCard() {
        return TemplateRegistry.IDENTITY_CARD_TYPE.equals(documentType);
    }
}
