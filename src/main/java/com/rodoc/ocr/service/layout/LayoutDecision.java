package com.rodoc.ocr.service.layout;

import com.rodoc.ocr.service.registry.IdCardSubtype;
import java.util.Objects;
import java.util.Optional;

/**
 * Category decided from pixel statistics before any recognition runs. A subtype is only present for
 * identity cards.
 */
public record LayoutDecision(DocumentLayout layout, Optional<IdCardSubtype> subtype, LayoutEvidence evidence) {

    public LayoutDecision {
        Objects.requireNonNull(layout, "layout");
        subtype = subtype == null ? Optional.empty() : subtype;
        evidence = evidence == null ? LayoutEvidence.none() : evidence;
        if (layout != DocumentLayout.IDENTITY_CARD && subtype.isPresent()) {
            throw new IllegalArgumentException("Only identity cards carry a subtype");
        }
    }

    public static LayoutDecision unknown(LayoutEvidence evidence) {
        return new LayoutDecision(DocumentLayout.UNKNOWN, Optional.empty(), evidence);
    }
}
