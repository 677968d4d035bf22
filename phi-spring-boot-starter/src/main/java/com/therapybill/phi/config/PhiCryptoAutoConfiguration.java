package com.therapybill.phi.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.therapybill.phi.crypto.EnvelopeCodec;
import com.therapybill.phi.crypto.PhiFieldCipher;
import com.therapybill.phi.crypto.PhiKeyProvider;
import com.therapybill.phi.record.EntityFieldManifest;
import com.therapybill.phi.record.PhiRedactor;
import com.therapybill.phi.record.RecordTransformer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * PHI 암복호화 자동 설정 클래스 (Spring Boot 3.x 스타일)
 * 
 * <p>META-INF/spring/org.springframework.boot.autoconfigure.AutoConfiguration.imports 파일에 등록되어 있습니다.</p>
 * <p>모든 빈은 {@code @ConditionalOnMissingBean}이므로 애플리케이션에서 교체할 수 있습니다.</p>
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass({ PhiFieldCipher.class, RecordTransformer.class })
@ConditionalOnProperty(prefix = "phi.crypto", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PhiCryptoProperties.class)
public class PhiCryptoAutoConfiguration {
    
    private static final Logger log = LoggerFactory.getLogger(PhiCryptoAutoConfiguration.class);
    
    /**
     * 암호화 키 제공자 빈 등록
     * 
     * 비밀값은 호출마다 properties → 환경 변수 → 시스템 프로퍼티 순으로 읽습니다.
     */
    @Bean
    @ConditionalOnMissingBean
    public PhiKeyProvider phiKeyProvider(PhiCryptoProperties properties) {
        String configured = properties.getEncryptionKey();
        if (configured == null || configured.isEmpty()) {
            if (PhiKeyProvider.readEnvironmentSecret() == null) {
                // 암호화 시점에 PhiConfigurationException으로 실패함
                log.warn("⚠️ PHI 암호화 키가 설정되지 않았습니다: phi.crypto.encryption-key 또는 {}", 
                        PhiKeyProvider.ENV_ENCRYPTION_KEY);
            }
        } else {
            log.info("✅ PHI 암호화 키 설정됨: mode={}, cacheDerivedKey={}", 
                    PhiKeyProvider.isRawKey(configured) ? "raw" : "passphrase", properties.isCacheDerivedKey());
        }
        
        // 설정값은 가공하지 않고 전달 (fromEnvironment()와 같은 키가 나와야 함)
        return new PhiKeyProvider(() -> {
            String secret = properties.getEncryptionKey();
            if (secret == null || secret.isEmpty()) {
                return PhiKeyProvider.readEnvironmentSecret();
            }
            return secret;
        }, properties.isCacheDerivedKey());
    }
    
    /**
     * 봉투 코덱 빈 등록 (애플리케이션 ObjectMapper가 있으면 복사해서 사용)
     */
    @Bean
    @ConditionalOnMissingBean
    public EnvelopeCodec envelopeCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new EnvelopeCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }
    
    /**
     * 필드 암복호화 서비스 빈 등록
     */
    @Bean
    @ConditionalOnMissingBean
    public PhiFieldCipher phiFieldCipher(PhiKeyProvider phiKeyProvider, EnvelopeCodec envelopeCodec) {
        return new PhiFieldCipher(phiKeyProvider, envelopeCodec);
    }
    
    /**
     * 보호 필드 매니페스트 빈 등록
     * 기본 매니페스트에 phi.crypto.entities 설정을 합칩니다.
     */
    @Bean
    @ConditionalOnMissingBean
    public EntityFieldManifest entityFieldManifest(PhiCryptoProperties properties) {
        EntityFieldManifest standard = EntityFieldManifest.standard();
        EntityFieldManifest.Builder builder = EntityFieldManifest.builder();
        for (String entityType : standard.entityTypes()) {
            builder.register(entityType, standard.fieldsOf(entityType));
        }
        properties.getEntities().forEach((entityType, fields) -> {
            if (standard.contains(entityType)) {
                log.info("📋 기본 PHI 엔티티에 필드 추가: type={}, fields={}", entityType, fields);
            } else {
                log.info("📋 PHI 엔티티 추가 등록: type={}, fields={}", entityType, fields);
            }
            builder.register(entityType, fields);
        });
        
        EntityFieldManifest manifest = builder.build();
        log.info("✅ PHI 매니페스트 초기화 완료: entityTypes={}", manifest.entityTypes());
        return manifest;
    }
    
    /**
     * 레코드 변환기 빈 등록
     */
    @Bean
    @ConditionalOnMissingBean
    public RecordTransformer recordTransformer(PhiFieldCipher phiFieldCipher, EntityFieldManifest entityFieldManifest) {
        return new RecordTransformer(phiFieldCipher, entityFieldManifest);
    }
    
    /**
     * 로그 마스킹 빈 등록
     */
    @Bean
    @ConditionalOnMissingBean
    public PhiRedactor phiRedactor(EntityFieldManifest entityFieldManifest) {
        return new PhiRedactor(entityFieldManifest);
    }
}
