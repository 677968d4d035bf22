package com.therapybill.phi.record;

import com.therapybill.phi.crypto.PhiFieldCipher;
import com.therapybill.phi.crypto.exception.PhiConfigurationException;
import com.therapybill.phi.crypto.exception.PhiCryptoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.temporal.TemporalAccessor;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * 레코드 단위 PHI 암복호화
 * 
 * 매니페스트에 등록된 필드만 변환하고 나머지 필드는 값 그대로(동일 객체) 복사합니다.
 * 입력 레코드는 변경하지 않고 얕은 복사본을 반환합니다.
 * 
 * 호출 규칙:
 * - 저장 전 {@link #encryptRecord(String, Map)}를 레코드당 정확히 한 번 호출
 * - 조회 후 {@link #decryptRecord(String, Map)}를 레코드당 정확히 한 번 호출
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class RecordTransformer {
    
    private static final Logger log = LoggerFactory.getLogger(RecordTransformer.class);
    
    private final PhiFieldCipher fieldCipher;
    private final EntityFieldManifest manifest;
    private final PhiRedactor redactor;
    
    public RecordTransformer(PhiFieldCipher fieldCipher) {
        this(fieldCipher, EntityFieldManifest.standard());
    }
    
    public RecordTransformer(PhiFieldCipher fieldCipher, EntityFieldManifest manifest) {
        this.fieldCipher = Objects.requireNonNull(fieldCipher, "fieldCipher");
        this.manifest = Objects.requireNonNull(manifest, "manifest");
        this.redactor = new PhiRedactor(manifest);
    }
    
    public EntityFieldManifest getManifest() {
        return manifest;
    }
    
    /**
     * 레코드 암호화
     * 
     * 매니페스트 필드 중 레코드에 존재하는 키(명시적 null 포함)만 암호화합니다.
     * 없는 키는 추가하지 않습니다 (부분 업데이트 유지).
     * 
     * @param entityType 엔티티 타입명
     * @param record 평문 레코드
     * @return 보호 필드가 {@link com.therapybill.phi.crypto.dto.Envelope}로 바뀐 사본, 입력이 null이면 null
     * @throws PhiConfigurationException 암호화 키가 설정되지 않은 경우
     * @throws PhiCryptoException 이미 암호화된 값이 들어온 경우 또는 암호화 실패 시
     * @throws IllegalArgumentException 등록되지 않은 엔티티 타입이거나 암호화할 수 없는 값 타입
     */
    public Map<String, Object> encryptRecord(String entityType, Map<String, ?> record) {
        if (record == null) {
            return null;
        }
        List<String> fields = manifest.fieldsOf(entityType);
        if (log.isTraceEnabled()) {
            log.trace("PHI 레코드 암호화: type={}, record={}", entityType, redactor.redact(entityType, record));
        }
        
        Map<String, Object> encrypted = new LinkedHashMap<>(record);
        int count = 0;
        for (String field : fields) {
            if (encrypted.containsKey(field)) {
                encrypted.put(field, fieldCipher.encrypt(toPlaintext(entityType, field, encrypted.get(field))));
                count++;
            }
        }
        log.debug("PHI 레코드 암호화 완료: type={}, fields={}", entityType, count);
        return encrypted;
    }
    
    /**
     * 레코드 복호화
     * 
     * 매니페스트 필드 중 null이 아닌 값만 복호화합니다. 복호화할 수 없는 필드는 null이 됩니다.
     * 
     * @param entityType 엔티티 타입명
     * @param record 저장소에서 읽은 레코드
     * @return 평문 사본, 입력이 null이면 null
     * @throws IllegalArgumentException 등록되지 않은 엔티티 타입
     */
    public Map<String, Object> decryptRecord(String entityType, Map<String, ?> record) {
        if (record == null) {
            return null;
        }
        List<String> fields = manifest.fieldsOf(entityType);
        
        Map<String, Object> decrypted = new LinkedHashMap<>(record);
        for (String field : fields) {
            Object stored = decrypted.get(field);
            if (stored != null) {
                decrypted.put(field, fieldCipher.decryptStored(stored));
            }
        }
        return decrypted;
    }
    
    public Map<String, Object> encryptPatientRecord(Map<String, ?> patient) {
        return encryptRecord(PhiEntityTypes.PATIENT, patient);
    }
    
    public Map<String, Object> decryptPatientRecord(Map<String, ?> patient) {
        return decryptRecord(PhiEntityTypes.PATIENT, patient);
    }
    
    public Map<String, Object> encryptSoapNoteRecord(Map<String, ?> note) {
        return encryptRecord(PhiEntityTypes.SOAP_NOTE, note);
    }
    
    public Map<String, Object> decryptSoapNoteRecord(Map<String, ?> note) {
        return decryptRecord(PhiEntityTypes.SOAP_NOTE, note);
    }
    
    public Map<String, Object> encryptTreatmentSessionRecord(Map<String, ?> session) {
        return encryptRecord(PhiEntityTypes.TREATMENT_SESSION, session);
    }
    
    public Map<String, Object> decryptTreatmentSessionRecord(Map<String, ?> session) {
        return decryptRecord(PhiEntityTypes.TREATMENT_SESSION, session);
    }
    
    private String toPlaintext(String entityType, String field, Object value) {
        if (value == null || value instanceof String && !((String) value).startsWith("{")) {
            return (String) value;
        }
        if (fieldCipher.getEnvelopeCodec().isEnvelope(value)) {
            throw new PhiCryptoException("이미 암호화된 값입니다: " + entityType + "." + field);
        }
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Character
                || value instanceof TemporalAccessor || value instanceof UUID || value instanceof Enum) {
            return value.toString();
        }
        throw new IllegalArgumentException("암호화할 수 없는 값 타입입니다: " + entityType + "." + field
                + " (" + value.getClass().getName() + ")");
    }
}
