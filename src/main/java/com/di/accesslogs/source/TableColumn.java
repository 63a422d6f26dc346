package com.di.accesslogs.source;

/**
 * One column of a catalog table: name plus Hive type ({@code string}, {@code bigint}, ...).
 */
public record TableColumn(String name, String type) {

    public static TableColumn string(String name) {
        return new TableColumn(name, "string");
    }

    public static TableColumn of(String name, String type) {
        return new TableColumn(name, type);
    }
}
