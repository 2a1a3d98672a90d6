/*
 * Copyright (c) 2025 Meridian Code History
 * Licensed under the Apache License, Version 2.0
 */
package com.meridian.codehistory.core.index;

import com.meridian.codehistory.api.model.CodeOccurrence;
import com.meridian.codehistory.api.model.SourceRecord;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;

import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * An immutable dictionary encoding code strings to integer IDs.
 *
 * <p>IDs are assigned in lexicographic code order, so ascending ID order is ascending code
 * order. A bitmap of IDs therefore decodes directly into a sorted code list.
 */
public final class CodeDictionary {

    private final Object2IntMap<String> codeToId;
    private final String[] idToCode;

    private CodeDictionary(String[] sortedCodes) {
        this.idToCode = sortedCodes;
        this.codeToId = new Object2IntOpenHashMap<>(sortedCodes.length);
        this.codeToId.defaultReturnValue(-1);
        for (int i = 0; i < sortedCodes.length; i++) {
            codeToId.put(sortedCodes[i], i);
        }
    }

    public static CodeDictionary of(Collection<String> codes) {
        return new CodeDictionary(new TreeSet<>(codes).toArray(new String[0]));
    }

    /**
     * Builds one dictionary covering the codes of every given record collection.
     */
    public static CodeDictionary fromRecords(List<? extends Collection<SourceRecord>> sources) {
        TreeSet<String> codes = new TreeSet<>();
        for (Collection<SourceRecord> records : sources) {
            for (SourceRecord record : records) {
                for (CodeOccurrence occurrence : record.codes()) {
                    codes.add(occurrence.code());
                }
            }
        }
        return new CodeDictionary(codes.toArray(new String[0]));
    }

    /**
     * @return the ID of {@code code}, or -1 if the code is unknown
     */
    public int id(String code) {
        return codeToId.getInt(code);
    }

    public String code(int id) {
        if (id < 0 || id >= idToCode.length) {
            throw new IndexOutOfBoundsException("Unknown code id " + id + " (dictionary size " + idToCode.length + ")");
        }
        return idToCode[id];
    }

    public int size() {
        return idToCode.length;
    }

    @Override
    public String toString() {
        return "CodeDictionary[size=" + idToCode.length
                + (idToCode.length > 0 ? ", first=" + idToCode[0] + ", last=" + idToCode[idToCode.length - 1] : "")
                + "]";
    }
}
