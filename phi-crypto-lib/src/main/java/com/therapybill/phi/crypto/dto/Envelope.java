package com.therapybill.phi.crypto.dto;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * 암호화된 필드 하나를 표현하는 봉투(Envelope) DTO
 * 
 * 저장 구조 (JSON):
 * - ciphertext: AES-256-GCM 암호문 (hex, 태그 제외)
 * - iv: 16바이트 nonce (hex)
 * - tag: 16바이트 인증 태그 (hex)
 * 
 * 생성 후 변경되지 않습니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@Getter
@EqualsAndHashCode
@ToString
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"ciphertext", "iv", "tag"})
public final class Envelope {
    
    public static final String CIPHERTEXT = "ciphertext";
    public static final String IV = "iv";
    public static final String TAG = "tag";
    
    /**
     * 암호문 (hex)
     */
    @JsonProperty(CIPHERTEXT)
    private final String ciphertext;
    
    /**
     * nonce (hex)
     */
    @JsonProperty(IV)
    private final String iv;
    
    /**
     * 인증 태그 (hex)
     */
    @JsonProperty(TAG)
    private final String tag;
    
    @JsonCreator
    public Envelope(@JsonProperty(CIPHERTEXT) String ciphertext,
                    @JsonProperty(IV) String iv,
                    @JsonProperty(TAG) String tag) {
        this.ciphertext = ciphertext;
        this.iv = iv;
        this.tag = tag;
    }
    
    /**
     * 세 필드가 모두 비어 있지 않은지 확인
     */
    @JsonIgnore
    public boolean isComplete() {
        return hasText(ciphertext) && hasText(iv) && hasText(tag);
    }
    
    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }
}
