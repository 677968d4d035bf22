package com.therapybill.phi.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PHI 암복호화 설정 속성
 * 
 * <pre>
 * phi:
 *   crypto:
 *     encryption-key: ${PHI_ENCRYPTION_KEY:}
 *     cache-derived-key: false
 *     entities:
 *       intakeForm: chiefComplaint,medicalHistory
 * </pre>
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@ConfigurationProperties(prefix = "phi.crypto")
public class PhiCryptoProperties {
    
    /**
     * 자동 설정 활성화 여부
     */
    private boolean enabled = true;
    
    /**
     * 암호화 비밀값 (64자리 hex이면 raw 키, 그 외에는 passphrase)
     * 비어 있으면 환경 변수 PHI_ENCRYPTION_KEY / 시스템 프로퍼티 phi.encryption-key 사용
     */
    private String encryptionKey;
    
    /**
     * passphrase 유도 키 캐시 여부
     * 기본값: false (호출마다 유도, 키 material을 메모리에 오래 두지 않음)
     */
    private boolean cacheDerivedKey = false;
    
    /**
     * 기본 매니페스트에 추가할 엔티티별 보호 필드
     */
    private Map<String, List<String>> entities = new LinkedHashMap<>();
    
    public boolean isEnabled() {
        return enabled;
    }
    
    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }
    
    public String getEncryptionKey() {
        return encryptionKey;
    }
    
    public void setEncryptionKey(String encryptionKey) {
        this.encryptionKey = encryptionKey;
    }
    
    public boolean isCacheDerivedKey() {
        return cacheDerivedKey;
    }
    
    public void setCacheDerivedKey(boolean cacheDerivedKey) {
        this.cacheDerivedKey = cacheDerivedKey;
    }
    
    public Map<String, List<String>> getEntities() {
        return entities;
    }
    
    public void setEntities(Map<String, List<String>> entities) {
        this.entities = entities;
    }
    
    @Override
    public String toString() {
        // 비밀값은 출력하지 않음
        return "PhiCryptoProperties{" +
                "enabled=" + enabled +
                ", encryptionKey=" + (encryptionKey == null || encryptionKey.isEmpty() ? "(unset)" : "****") +
                ", cacheDerivedKey=" + cacheDerivedKey +
                ", entities=" + entities.keySet() +
                '}';
    }
}
