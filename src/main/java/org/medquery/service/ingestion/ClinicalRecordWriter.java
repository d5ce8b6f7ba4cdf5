package org.medquery.service.ingestion;

import org.medquery.exceptions.IntegrationFailureException;
import org.medquery.schema.ClinicalRecord;

import java.util.List;

public interface ClinicalRecordWriter {

    /**
     * Writes the records in the caller's transaction.
     *
     * @return number of rows written
     * @throws IntegrationFailureException when the store rejects a row
     */
    int insert(List<ClinicalRecord> records);
}
