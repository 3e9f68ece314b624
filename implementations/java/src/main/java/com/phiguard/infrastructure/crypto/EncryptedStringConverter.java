package com.phiguard.infrastructure.crypto;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * JPA hook that runs the field adapter on entity attributes.
 *
 * <p>Usage: {@code @Convert(converter = EncryptedStringConverter.class)} on a String column.
 * Hibernate resolves converters through the Spring bean container, so the adapter is injected.
 */
@Component
@Converter
@RequiredArgsConstructor
public class EncryptedStringConverter implements AttributeConverter<String, String> {

    private final FieldEncryptionService fieldEncryption;

    @Override
    public String convertToDatabaseColumn(String attribute) {
        return fieldEncryption.encryptOnWrite(attribute);
    }

    @Override
    public String convertToEntityAttribute(String dbData) {
        return fieldEncryption.decryptOnRead(dbData);
    }
}
