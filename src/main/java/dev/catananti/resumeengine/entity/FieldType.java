package dev.catananti.resumeengine.entity;

public enum FieldType {
    TEXT,
    EMAIL,
    PHONE,
    URL,
    DATE,
    NUMBER,
    LIST
}
