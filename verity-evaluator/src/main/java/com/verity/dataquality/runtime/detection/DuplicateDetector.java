package com.verity.dataquality.runtime.detection;

import com.verity.dataquality.api.exceptions.PreconditionViolationException;
import com.verity.dataquality.api.model.CompositeKey;
import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.DuplicateEntry;
import it.unimi.dsi.fastutil.objects.Object2IntMap;
import it.unimi.dsi.fastutil.objects.Object2IntOpenHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds records that share a composite key with an earlier record.
 *
 * <p>The first occurrence of a key is canonical and is never reported; every
 * later occurrence is reported against it, in input order. Without explicit
 * key fields the key is every field of the first record, so detection falls
 * back to whole-row equality.
 */
public final class DuplicateDetector {
    private static final Logger logger = LoggerFactory.getLogger(DuplicateDetector.class);

    public List<DuplicateEntry> detectDuplicates(List<DataRecord> records, List<String> keyFields) {
        if (records == null) {
            throw new PreconditionViolationException("Cannot detect duplicates in a dataset that was not loaded");
        }
        if (records.isEmpty()) {
            return List.of();
        }

        List<String> keys = keyFields == null || keyFields.isEmpty()
            ? List.copyOf(records.get(0).fieldNames())
            : List.copyOf(keyFields);

        Object2IntMap<CompositeKey> firstSeen = new Object2IntOpenHashMap<>(records.size());
        firstSeen.defaultReturnValue(-1);

        List<DuplicateEntry> duplicates = new ArrayList<>();
        for (DataRecord record : records) {
            CompositeKey key = CompositeKey.of(record, keys);
            int canonicalRow = firstSeen.getInt(key);
            if (canonicalRow < 0) {
                firstSeen.put(key, record.rowIndex());
            } else {
                duplicates.add(new DuplicateEntry(record.rowIndex(), canonicalRow, keys, key.values()));
            }
        }

        logger.debug("Found {} duplicate rows across {} distinct keys", duplicates.size(), firstSeen.size());
        return duplicates;
    }
}
