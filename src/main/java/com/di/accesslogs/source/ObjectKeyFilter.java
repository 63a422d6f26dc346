package com.di.accesslogs.source;

/**
 * Prefix/suffix filter of the object-created notification that feeds the grouper.
 * An empty prefix or suffix matches everything.
 */
public record ObjectKeyFilter(String prefix, String suffix) {

    public ObjectKeyFilter {
        prefix = prefix == null ? "" : prefix;
        suffix = suffix == null ? "" : suffix;
    }

    public boolean matches(String key) {
        return key != null && key.startsWith(prefix) && key.endsWith(suffix);
    }
}
