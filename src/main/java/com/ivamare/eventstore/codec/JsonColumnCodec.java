package com.ivamare.eventstore.codec;

import com.ivamare.eventstore.exception.PayloadDecodingException;
import com.ivamare.eventstore.exception.PayloadEncodingException;
import com.ivamare.eventstore.model.SuggestedActions;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;

/**
 * Encodes optional JSON object columns to text and back.
 *
 * <p>Absent values are stored as SQL NULL. On read, NULL, the empty string
 * and the literal {@code null} all decode to {@code null}. Anything else must
 * be a JSON object: a stored array or scalar is rejected rather than coerced.
 */
public class JsonColumnCodec {

    public static final String EXTRA_INFO = "extra info";
    public static final String SUGGESTED_ACTIONS = "suggested actions";

    private static final TypeReference<Map<String, String>> EXTRA_INFO_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final JavaType extraInfoType;
    private final JavaType suggestedActionsType;

    public JsonColumnCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.extraInfoType = objectMapper.getTypeFactory().constructType(EXTRA_INFO_TYPE);
        this.suggestedActionsType = objectMapper.getTypeFactory().constructType(SuggestedActions.class);
    }

    /**
     * Serialize a value for storage.
     *
     * @param column column description used in error messages
     * @param value value to serialize (nullable)
     * @return JSON text, or null when the value is absent
     */
    public String encode(String column, Object value) {
        if (value == null) {
            return null;
        }
        try {
            String json = objectMapper.writeValueAsString(value);
            return json.isEmpty() ? null : json;
        } catch (JsonProcessingException e) {
            throw new PayloadEncodingException(column, e);
        }
    }

    /**
     * Deserialize a stored column value.
     *
     * @param column column description used in error messages
     * @param stored stored text (nullable)
     * @param type target type
     * @return decoded value, or null when the column holds no value
     * @throws PayloadDecodingException if the text is not a JSON object of the expected shape
     */
    public <T> T decode(String column, String stored, JavaType type) {
        if (stored == null || stored.isEmpty() || "null".equals(stored)) {
            return null;
        }
        if (!stored.startsWith("{")) {
            throw new PayloadDecodingException(column, "invalid JSON: \"" + stored + "\"");
        }
        try {
            return objectMapper.readValue(stored, type);
        } catch (JsonProcessingException e) {
            throw new PayloadDecodingException(column, e);
        }
    }

    public String encodeExtraInfo(Map<String, String> extraInfo) {
        return encode(EXTRA_INFO, extraInfo);
    }

    public Map<String, String> decodeExtraInfo(String stored) {
        return decode(EXTRA_INFO, stored, extraInfoType);
    }

    public String encodeSuggestedActions(SuggestedActions suggestedActions) {
        return encode(SUGGESTED_ACTIONS, suggestedActions);
    }

    public SuggestedActions decodeSuggestedActions(String stored) {
        return decode(SUGGESTED_ACTIONS, stored, suggestedActionsType);
    }
}
