package com.therapybill.phi.record;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로그 출력용 PHI 마스킹
 * 
 * 보호 필드 문자열은 첫 글자와 마지막 글자만 남기고, 2자 이하이거나 문자열이
 * 아니면 {@value #REDACTED}로 바꿉니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class PhiRedactor {
    
    public static final String REDACTED = "[REDACTED]";
    
    private final EntityFieldManifest manifest;
    
    public PhiRedactor(EntityFieldManifest manifest) {
        this.manifest = manifest;
    }
    
    /**
     * 레코드의 보호 필드를 마스킹한 사본
     */
    public Map<String, Object> redact(String entityType, Map<String, ?> record) {
        if (record == null) {
            return null;
        }
        Map<String, Object> redacted = new LinkedHashMap<>(record);
        for (String field : manifest.fieldsOf(entityType)) {
            if (redacted.get(field) != null) {
                redacted.put(field, redactValue(redacted.get(field)));
            }
        }
        return redacted;
    }
    
    public static Object redactValue(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String) {
            String text = (String) value;
            if (text.length() <= 2) {
                return REDACTED;
            }
            return text.charAt(0) + "***" + text.charAt(text.length() - 1);
        }
        return REDACTED;
    }
}
