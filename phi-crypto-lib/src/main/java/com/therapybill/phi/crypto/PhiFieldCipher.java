package com.therapybill.phi.crypto;

import com.therapybill.phi.crypto.dto.Envelope;
import com.therapybill.phi.crypto.exception.PhiConfigurationException;
import com.therapybill.phi.crypto.exception.PhiCryptoException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * PHI 필드 암복호화 서비스
 * 
 * 값 하나를 AES-256-GCM으로 암호화하여 {@link Envelope}로 만들거나,
 * 저장된 값을 다시 평문으로 복원합니다.
 * 
 * 실패 처리:
 * - 암호화: 키 설정이 없으면 {@link PhiConfigurationException}, 그 외 오류는
 *   {@link PhiCryptoException} (평문 저장으로 폴백하지 않음, fail-closed)
 * - 복호화: 어떤 오류든 null 반환 (예외를 던지지 않음, fail-soft)
 * - 봉투 형태가 아닌 문자열은 암호화 도입 이전 데이터로 보고 그대로 반환
 * 
 * 상태를 갖지 않으므로 여러 스레드에서 동시에 사용할 수 있습니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class PhiFieldCipher {
    
    private static final Logger log = LoggerFactory.getLogger(PhiFieldCipher.class);
    
    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    public static final int IV_LENGTH = 16;
    public static final int TAG_LENGTH = 16;
    
    private static final HexFormat HEX = HexFormat.of();
    
    private final PhiKeyProvider keyProvider;
    private final EnvelopeCodec envelopeCodec;
    private final SecureRandom secureRandom;
    
    public PhiFieldCipher(PhiKeyProvider keyProvider) {
        this(keyProvider, new EnvelopeCodec());
    }
    
    public PhiFieldCipher(PhiKeyProvider keyProvider, EnvelopeCodec envelopeCodec) {
        this(keyProvider, envelopeCodec, new SecureRandom());
    }
    
    PhiFieldCipher(PhiKeyProvider keyProvider, EnvelopeCodec envelopeCodec, SecureRandom secureRandom) {
        this.keyProvider = Objects.requireNonNull(keyProvider, "keyProvider");
        this.envelopeCodec = Objects.requireNonNull(envelopeCodec, "envelopeCodec");
        this.secureRandom = Objects.requireNonNull(secureRandom, "secureRandom");
    }
    
    public EnvelopeCodec getEnvelopeCodec() {
        return envelopeCodec;
    }
    
    /**
     * 평문 암호화
     * 
     * @param plaintext 암호화할 값 (null 또는 빈 문자열이면 암호화하지 않음)
     * @return 봉투, 입력이 비어 있으면 null
     * @throws PhiConfigurationException 암호화 키가 설정되지 않은 경우
     * @throws PhiCryptoException 암호화 실패 시
     */
    public Envelope encrypt(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return null;
        }
        
        SecretKey key = keyProvider.getKey();
        byte[] iv = new byte[IV_LENGTH];
        secureRandom.nextBytes(iv);
        
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));
            
            // JCA 출력은 ciphertext || tag
            int ciphertextLength = sealed.length - TAG_LENGTH;
            byte[] ciphertext = Arrays.copyOfRange(sealed, 0, ciphertextLength);
            byte[] tag = Arrays.copyOfRange(sealed, ciphertextLength, sealed.length);
            
            return new Envelope(HEX.formatHex(ciphertext), HEX.formatHex(iv), HEX.formatHex(tag));
        } catch (GeneralSecurityException e) {
            throw new PhiCryptoException("PHI 필드 암호화 실패: " + e.getMessage(), e);
        }
    }
    
    /**
     * 봉투 복호화
     */
    public String decrypt(Envelope envelope) {
        return decrypt(envelopeCodec.classify(envelope));
    }
    
    /**
     * 문자열로 저장된 값 복호화
     * 
     * JSON 봉투이면 복호화하고, 아니면 레거시 평문으로 보고 그대로 반환합니다.
     */
    public String decrypt(String stored) {
        return decrypt(envelopeCodec.classify(stored));
    }
    
    /**
     * 저장소에서 읽은 임의 형태의 값 복호화 (Envelope, JSON 문자열, Map, JsonNode)
     */
    public String decryptStored(Object stored) {
        return decrypt(envelopeCodec.classify(stored));
    }
    
    /**
     * 분류된 저장 값 복호화
     * 
     * @param value 분류 결과
     * @return 평문, 복원할 수 없으면 null
     */
    public String decrypt(StoredValue value) {
        if (value == null) {
            return null;
        }
        switch (value.getKind()) {
            case ABSENT:
                return null;
            case LEGACY_PLAINTEXT:
                log.debug("봉투 형태가 아닌 값: 레거시 평문으로 반환");
                return value.getPlaintext();
            case INCOMPLETE_ENVELOPE:
                return fail(DecryptFailure.INCOMPLETE_ENVELOPE, null);
            case ENVELOPE:
                return open(value.getEnvelope());
            default:
                throw new IllegalStateException("Unknown stored value kind: " + value.getKind());
        }
    }
    
    private String open(Envelope envelope) {
        byte[] ciphertext;
        byte[] iv;
        byte[] tag;
        try {
            ciphertext = HEX.parseHex(envelope.getCiphertext());
            iv = HEX.parseHex(envelope.getIv());
            tag = HEX.parseHex(envelope.getTag());
        } catch (IllegalArgumentException e) {
            return fail(DecryptFailure.MALFORMED_ENCODING, e);
        }
        if (iv.length != IV_LENGTH || tag.length != TAG_LENGTH) {
            return fail(DecryptFailure.MALFORMED_ENCODING, null);
        }
        
        SecretKey key;
        try {
            key = keyProvider.getKey();
        } catch (PhiConfigurationException e) {
            return fail(DecryptFailure.KEY_UNAVAILABLE, e);
        }
        
        byte[] sealed = new byte[ciphertext.length + tag.length];
        System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
        System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);
        
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LENGTH * 8, iv));
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (AEADBadTagException e) {
            // 변조되었거나 다른 키로 암호화된 값
            return fail(DecryptFailure.AUTHENTICATION_FAILED, null);
        } catch (GeneralSecurityException e) {
            return fail(DecryptFailure.MALFORMED_ENCODING, e);
        }
    }
    
    private String fail(DecryptFailure reason, Exception cause) {
        if (cause != null) {
            log.warn("PHI 필드 복호화 실패 (null 반환): reason={}, cause={}", reason, cause.getMessage());
        } else {
            log.warn("PHI 필드 복호화 실패 (null 반환): reason={}", reason);
        }
        return null;
    }
}
