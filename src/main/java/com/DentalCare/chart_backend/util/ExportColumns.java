package com.DentalCare.chart_backend.util;

import java.util.List;

/**
 * Column names of the flat export/import table.
 */
public class ExportColumns {

    private ExportColumns() {
        // Utility class, no instantiation
    }

    public static final String KIND = "kind";
    public static final String PHONE_NUMBER = "phone_number";

    // Patient
    public static final String PATIENT_CODE = "patient_code";
    public static final String FULL_NAME = "full_name";
    public static final String EMAIL = "email";
    public static final String ADDRESS = "address";
    public static final String DATE_OF_BIRTH = "date_of_birth";

    // Custom status
    public static final String STATUS_CODE = "status_code";
    public static final String DISPLAY_NAME = "display_name";
    public static final String COLOR = "color";
    public static final String CATEGORY = "category";
    public static final String ACTIVE = "active";

    // Examination
    public static final String EXAMINATION_REF = "examination_ref";
    public static final String EXAMINATION_DATE = "examination_date";
    public static final String CHIEF_COMPLAINT = "chief_complaint";
    public static final String FINDINGS = "findings";
    public static final String DIAGNOSIS = "diagnosis";
    public static final String TREATMENT_PLAN = "treatment_plan";
    public static final String NOTES = "notes";

    // Tooth history
    public static final String TOOTH_NUMBER = "tooth_number";
    public static final String RECORD_TYPE = "record_type";
    public static final String STATUSES = "statuses";
    public static final String DESCRIPTION = "description";
    public static final String DATE_RECORDED = "date_recorded";

    // Visit
    public static final String VISIT_DATE = "visit_date";
    public static final String AMOUNT_PAID = "amount_paid";
    public static final String TREATMENT_PERFORMED = "treatment_performed";
    public static final String ADVICE = "advice";
    public static final String AFFECTED_TEETH = "affected_teeth";

    public static final List<String> ALL = List.of(
            KIND, PHONE_NUMBER,
            PATIENT_CODE, FULL_NAME, EMAIL, ADDRESS, DATE_OF_BIRTH,
            STATUS_CODE, DISPLAY_NAME, COLOR, CATEGORY, ACTIVE,
            EXAMINATION_REF, EXAMINATION_DATE, CHIEF_COMPLAINT, FINDINGS, DIAGNOSIS, TREATMENT_PLAN, NOTES,
            TOOTH_NUMBER, RECORD_TYPE, STATUSES, DESCRIPTION, DATE_RECORDED,
            VISIT_DATE, AMOUNT_PAID, TREATMENT_PERFORMED, ADVICE, AFFECTED_TEETH
    );
}
