package com.DentalCare.chart_backend.enums.converter;

import com.DentalCare.chart_backend.enums.RecordType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link RecordType} as {@code patient_problem} / {@code doctor_finding}.
 * There is no fallback value; an unreadable stored value is an error.
 */
@Converter(autoApply = true)
public class RecordTypeConverter implements AttributeConverter<RecordType, String> {

    @Override
    public String convertToDatabaseColumn(RecordType recordType) {
        if (recordType == null) {
            throw new IllegalArgumentException("Record type is required");
        }
        return recordType.getValue();
    }

    @Override
    public RecordType convertToEntityAttribute(String dbData) {
        RecordType recordType = RecordType.fromString(dbData);
        if (recordType == null) {
            throw new IllegalStateException("Unrecognised record_type value in storage: " + dbData);
        }
        return recordType;
    }
}
