package quest.gekko.churnguard.domain;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.List;

/**
 * Stores risk reasons as a JSON array, the format the reporting layer reads.
 */
@Converter
public class ReasonListConverter implements AttributeConverter<List<String>, String> {
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<List<String>> REASONS = new TypeReference<>() {};

    @Override
    public String convertToDatabaseColumn(List<String> reasons) {
        if (reasons == null) return null;
        try {
            return MAPPER.writeValueAsString(reasons);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize risk reasons " + reasons, e);
        }
    }

    @Override
    public List<String> convertToEntityAttribute(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readValue(json, REASONS);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed risk reasons column: " + json, e);
        }
    }
}
