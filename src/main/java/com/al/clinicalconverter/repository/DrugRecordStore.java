package com.al.clinicalconverter.repository;

import com.al.clinicalconverter.model.ExtractionResult;

import java.util.List;

public interface DrugRecordStore {

    /**
     * Stores every drug fact of {@code result} against the conversion,
     * linking each to its stored patient when one exists.
     *
     * @return ids of the created records, in drug fact order
     */
    List<String> createDrugRecords(String conversionId, ExtractionResult result);

    long countDrugRecords(String conversionId);

    /**
     * Removes every drug record stored against the conversion. Used to undo
     * {@link #createDrugRecords} when the conversion cannot be completed.
     */
    void deleteDrugRecords(String conversionId);
}
