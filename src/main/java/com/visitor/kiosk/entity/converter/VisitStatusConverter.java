package com.visitor.kiosk.entity.converter;

import com.visitor.kiosk.entity.VisitLog;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores {@link VisitLog.Status} as its lower-case value ({@code checked_in}, ...).
 */
@Converter
public class VisitStatusConverter implements AttributeConverter<VisitLog.Status, String> {

    @Override
    public String convertToDatabaseColumn(VisitLog.Status attribute) {
        if (attribute == null) {
            return null;
        }
        return attribute.value();
    }

    @Override
    public VisitLog.Status convertToEntityAttribute(String dbData) {
        if (dbData == null || dbData.isBlank()) {
            return null;
        }
        return VisitLog.Status.fromValue(dbData.trim());
    }
}
