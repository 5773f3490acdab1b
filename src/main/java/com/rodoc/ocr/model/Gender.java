package com.rodoc.ocr.model;

public enum Gender {
    M,
    F
}
