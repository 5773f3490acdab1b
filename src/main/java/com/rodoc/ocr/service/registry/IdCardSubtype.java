package com.rodoc.ocr.service.registry;

import java.util.Locale;
import java.util.Optional;

/**
 * Romanian identity document variants with a known field layout.
 */
public enum IdCardSubtype {
    /** Electronic identity card (CEI), photo on the left, no address on the front. */
    ELECTRONIC("carte_electronica", true),
    /** Standard identity card (CI). */
    STANDARD("carte_identitate", true),
    /** Legacy identity bulletin (BI); the CNP is not printed in a readable region. */
    LEGACY_BULLETIN("buletin_identitate", false);

    private final String code;
    private final boolean carriesCnp;

    IdCardSubtype(String code, boolean carriesCnp) {
        this.code = code;
        this.carriesCnp = carriesCnp;
    }

    public String code() {
        return code;
    }

    public boolean carriesCnp() {
        return carriesCnp;
    }

    public static Optional<IdCardSubtype> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (IdCardSubtype subtype : values()) {
            if (subtype.code.equals(normalized)) {
                return Optional.of(subtype);
            }
        }
        return Optional.empty();
    }
}
