package com.verity.dataquality.api;

import com.verity.dataquality.api.model.DataRecord;
import com.verity.dataquality.api.model.ReconciliationResult;

import java.util.List;

/**
 * Contract for matching a source dataset against a destination dataset.
 */
public interface IReconciliationEngine {

    /**
     * Matches records by composite key.
     *
     * @param source      source records, may be empty but not null
     * @param destination destination records, may be empty but not null
     * @param keyFields   key fields, or null/empty to use every field of the first source record
     * @param strict      whether matched records are also compared field by field
     * @return the reconciliation result
     * @throws com.verity.dataquality.api.exceptions.PreconditionViolationException
     *         if either dataset is null
     */
    ReconciliationResult reconcile(List<DataRecord> source,
                                   List<DataRecord> destination,
                                   List<String> keyFields,
                                   boolean strict);
}
