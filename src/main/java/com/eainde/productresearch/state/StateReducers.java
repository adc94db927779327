package com.eainde.productresearch.state;

import com.eainde.productresearch.model.InvalidUrlRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merge functions behind the channels of {@link ProductResearchState}.
 */
public final class StateReducers {

    private StateReducers() {
    }

    public static <T> T replace(T oldValue, T newValue) {
        return newValue != null ? newValue : oldValue;
    }

    public static Integer max(Integer oldValue, Integer newValue) {
        return Math.max(oldValue == null ? 0 : oldValue, newValue == null ? 0 : newValue);
    }

    public static Integer add(Integer oldValue, Integer newValue) {
        return (oldValue == null ? 0 : oldValue) + (newValue == null ? 0 : newValue);
    }

    public static <T> List<T> append(List<T> oldValue, List<T> newValue) {
        List<T> merged = new ArrayList<>();
        if (oldValue != null) merged.addAll(oldValue);
        if (newValue != null) merged.addAll(newValue);
        return merged;
    }

    /**
     * Union by URL; the first record seen for a URL wins. Plain string entries are read as
     * {@code {url, ""}}. Entries without a URL are dropped.
     */
    public static List<InvalidUrlRecord> mergeInvalidUrls(Collection<?> oldValue, Collection<?> newValue) {
        Map<String, InvalidUrlRecord> byUrl = new LinkedHashMap<>();
        addAll(byUrl, oldValue);
        addAll(byUrl, newValue);
        return new ArrayList<>(byUrl.values());
    }

    private static void addAll(Map<String, InvalidUrlRecord> byUrl, Collection<?> entries) {
        if (entries == null) return;
        for (Object entry : entries) {
            InvalidUrlRecord record = toRecord(entry);
            if (record != null && record.url() != null && !record.url().isBlank()) {
                byUrl.putIfAbsent(record.url(), record);
            }
        }
    }

    static InvalidUrlRecord toRecord(Object entry) {
        if (entry instanceof InvalidUrlRecord record) {
            return record;
        }
        if (entry instanceof String url) {
            return new InvalidUrlRecord(url, "");
        }
        if (entry instanceof Map<?, ?> map && map.get("url") != null) {
            Object reasoning = map.get("reasoning");
            return new InvalidUrlRecord(map.get("url").toString(), reasoning == null ? "" : reasoning.toString());
        }
        return null;
    }
}
