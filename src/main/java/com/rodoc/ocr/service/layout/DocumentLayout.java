package com.rodoc.ocr.service.layout;

public enum DocumentLayout {
    IDENTITY_CARD("identity_card"),
    LAB_RESULT("lab_result"),
    UNKNOWN("unknown");

    private final String label;

    DocumentLayout(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
