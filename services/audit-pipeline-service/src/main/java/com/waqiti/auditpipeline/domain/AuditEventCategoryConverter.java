package com.waqiti.auditpipeline.domain;

import com.waqiti.auditpipeline.model.AuditEventCategory;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter
public class AuditEventCategoryConverter implements AttributeConverter<AuditEventCategory, String> {

    @Override
    public String convertToDatabaseColumn(AuditEventCategory category) {
        return category == null ? null : category.getCode();
    }

    @Override
    public AuditEventCategory convertToEntityAttribute(String code) {
        return AuditEventCategory.fromCode(code);
    }
}
