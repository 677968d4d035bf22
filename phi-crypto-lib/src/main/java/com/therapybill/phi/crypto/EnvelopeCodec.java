package com.therapybill.phi.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.therapybill.phi.crypto.dto.Envelope;
import com.therapybill.phi.crypto.exception.PhiCryptoException;

import java.util.Map;

/**
 * 봉투 인식 및 직렬화 코덱
 * 
 * 저장된 값의 형태를 판별합니다:
 * - {@link Envelope} 객체
 * - JSON 문자열로 저장된 봉투 (text 컬럼)
 * - Map / JsonNode로 읽힌 봉투 (json 컬럼)
 * - 봉투 형태가 아닌 문자열 → 암호화 도입 이전의 평문
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class EnvelopeCodec {
    
    private final ObjectMapper objectMapper;
    
    public EnvelopeCodec() {
        this(new ObjectMapper());
    }
    
    public EnvelopeCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy();
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        // 봉투 JSON 뒤에 다른 내용이 붙은 문자열은 레거시 평문
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_TRAILING_TOKENS, true);
    }
    
    /**
     * 저장된 값을 분류
     * 
     * @param stored 저장소에서 읽은 값 (null 허용)
     * @return 분류 결과
     */
    public StoredValue classify(Object stored) {
        if (stored == null) {
            return StoredValue.absent();
        }
        if (stored instanceof StoredValue) {
            return (StoredValue) stored;
        }
        if (stored instanceof Envelope) {
            return StoredValue.envelope((Envelope) stored);
        }
        if (stored instanceof String) {
            return classifyString((String) stored);
        }
        if (stored instanceof JsonNode) {
            return classifyNode((JsonNode) stored);
        }
        if (stored instanceof Map) {
            return classifyMap((Map<?, ?>) stored);
        }
        return StoredValue.incomplete();
    }
    
    /**
     * 값이 완전한 봉투인지 확인
     */
    public boolean isEnvelope(Object stored) {
        return classify(stored).getKind() == StoredValue.Kind.ENVELOPE;
    }
    
    /**
     * 봉투를 JSON 문자열로 직렬화 (text 컬럼 저장용)
     */
    public String toJson(Envelope envelope) {
        if (envelope == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new PhiCryptoException("봉투 직렬화 실패: " + e.getOriginalMessage(), e);
        }
    }
    
    /**
     * JSON 문자열에서 봉투 복원
     * 
     * @return 완전한 봉투이면 Envelope, 아니면 null
     */
    public Envelope fromJson(String json) {
        StoredValue value = classifyString(json);
        return value.getKind() == StoredValue.Kind.ENVELOPE ? value.getEnvelope() : null;
    }
    
    private StoredValue classifyString(String stored) {
        if (stored == null || stored.isEmpty()) {
            return StoredValue.absent();
        }
        String trimmed = stored.trim();
        if (!trimmed.startsWith("{")) {
            return StoredValue.legacy(stored);
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(trimmed);
        } catch (JsonProcessingException e) {
            return StoredValue.legacy(stored);
        }
        StoredValue parsed = classifyNode(node);
        // 문자열로 저장된 값은 봉투가 아니면 평문으로 간주
        return parsed.getKind() == StoredValue.Kind.ENVELOPE ? parsed : StoredValue.legacy(stored);
    }
    
    private StoredValue classifyNode(JsonNode node) {
        if (node == null || !node.isObject()) {
            return StoredValue.incomplete();
        }
        return StoredValue.envelope(new Envelope(
                textOf(node.get(Envelope.CIPHERTEXT)),
                textOf(node.get(Envelope.IV)),
                textOf(node.get(Envelope.TAG))));
    }
    
    private StoredValue classifyMap(Map<?, ?> map) {
        return StoredValue.envelope(new Envelope(
                textOf(map.get(Envelope.CIPHERTEXT)),
                textOf(map.get(Envelope.IV)),
                textOf(map.get(Envelope.TAG))));
    }
    
    private static String textOf(JsonNode node) {
        return node != null && node.isTextual() ? node.asText() : null;
    }
    
    private static String textOf(Object value) {
        return value instanceof String ? (String) value : null;
    }
}
