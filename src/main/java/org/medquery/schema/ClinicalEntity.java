package org.medquery.schema;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.medquery.models.enums.FieldType.BOOLEAN;
import static org.medquery.models.enums.FieldType.DECIMAL;
import static org.medquery.models.enums.FieldType.INTEGER;
import static org.medquery.models.enums.FieldType.TEXT;
import static org.medquery.models.enums.FieldType.TIMESTAMP;
import static org.medquery.schema.FieldDefinition.optional;
import static org.medquery.schema.FieldDefinition.required;

/**
 * Closed set of clinical tables that accept ingested records. Each tag carries its table
 * definition and builds typed {@link ClinicalRecord}s for that table.
 */
public enum ClinicalEntity {

    PATIENTS("patients",
            required("subject_id", INTEGER),
            optional("gender", TEXT),
            optional("anchor_age", INTEGER),
            optional("anchor_year", INTEGER),
            optional("dod", TIMESTAMP)),

    ADMISSIONS("admissions",
            required("hadm_id", INTEGER),
            required("subject_id", INTEGER),
            optional("admittime", TIMESTAMP),
            optional("dischtime", TIMESTAMP),
            optional("admission_type", TEXT),
            optional("admission_location", TEXT),
            optional("discharge_location", TEXT),
            optional("insurance", TEXT),
            optional("ethnicity", TEXT),
            optional("hospital_expire_flag", BOOLEAN)),

    TRANSFERS("transfers",
            required("transfer_id", INTEGER),
            required("subject_id", INTEGER),
            optional("hadm_id", INTEGER),
            optional("eventtype", TEXT),
            optional("careunit", TEXT),
            optional("intime", TIMESTAMP),
            optional("outtime", TIMESTAMP)),

    DIAGNOSES_ICD("diagnoses_icd",
            required("subject_id", INTEGER),
            required("hadm_id", INTEGER),
            required("seq_num", INTEGER),
            optional("icd_code", TEXT),
            optional("icd_version", INTEGER)),

    PROCEDURES_ICD("procedures_icd",
            required("subject_id", INTEGER),
            required("hadm_id", INTEGER),
            required("seq_num", INTEGER),
            optional("chartdate", TIMESTAMP),
            optional("icd_code", TEXT),
            optional("icd_version", INTEGER)),

    PRESCRIPTIONS("prescriptions",
            optional("prescription_id", INTEGER),
            required("subject_id", INTEGER),
            required("hadm_id", INTEGER),
            optional("starttime", TIMESTAMP),
            optional("stoptime", TIMESTAMP),
            optional("drug_type", TEXT),
            optional("drug", TEXT),
            optional("dose_val_rx", TEXT),
            optional("dose_unit_rx", TEXT),
            optional("route", TEXT)),

    LABEVENTS("labevents",
            optional("labevent_id", INTEGER),
            required("subject_id", INTEGER),
            optional("hadm_id", INTEGER),
            optional("itemid", INTEGER),
            optional("charttime", TIMESTAMP),
            optional("valuenum", DECIMAL),
            optional("valueuom", TEXT),
            optional("flag", TEXT)),

    D_LABITEMS("d_labitems",
            required("itemid", INTEGER),
            optional("label", TEXT),
            optional("fluid", TEXT),
            optional("category", TEXT)),

    ICUSTAYS("icustays",
            required("stay_id", INTEGER),
            required("subject_id", INTEGER),
            required("hadm_id", INTEGER),
            optional("first_careunit", TEXT),
            optional("last_careunit", TEXT),
            optional("intime", TIMESTAMP),
            optional("outtime", TIMESTAMP),
            optional("los", DECIMAL)),

    CHARTEVENTS("chartevents",
            required("subject_id", INTEGER),
            optional("hadm_id", INTEGER),
            optional("stay_id", INTEGER),
            required("itemid", INTEGER),
            optional("charttime", TIMESTAMP),
            optional("value", TEXT),
            optional("valuenum", DECIMAL),
            optional("valueuom", TEXT));

    private final String tableName;
    private final SchemaDefinition schema;

    ClinicalEntity(String tableName, FieldDefinition... fields) {
        this.tableName = tableName;
        this.schema = new SchemaDefinition(tableName, List.of(fields));
    }

    public String tableName() {
        return tableName;
    }

    public SchemaDefinition schema() {
        return schema;
    }

    /**
     * Builds a typed record from validated, normalized field values. Fields absent from
     * {@code values} are left out of the record so the table default applies.
     */
    public ClinicalRecord newRecord(Map<String, Object> values) {
        Map<String, Object> typed = new LinkedHashMap<>();
        for (FieldDefinition field : schema.fields()) {
            if (values.containsKey(field.name())) {
                typed.put(field.name(), FieldCoercion.coerce(field, values.get(field.name())));
            }
        }
        return new ClinicalRecord(this, typed);
    }

    public static Optional<ClinicalEntity> fromTableName(String tableName) {
        if (tableName == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(entity -> entity.tableName.equals(tableName.trim()))
                .findFirst();
    }
}
