package com.therapybill.phi.crypto;

import com.therapybill.phi.crypto.dto.Envelope;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * 저장소에서 읽은 보호 필드 값의 분류 결과
 * 
 * 영속 계층 경계에서 {@link EnvelopeCodec#classify(Object)}로 생성되며,
 * 복호화기는 런타임 타입 검사 대신 {@link Kind}만 보고 처리합니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@Getter
@EqualsAndHashCode
public final class StoredValue {
    
    public enum Kind {
        /** 값 없음 (null 또는 빈 문자열) */
        ABSENT,
        /** 세 필드를 모두 갖춘 봉투 */
        ENVELOPE,
        /** 암호화 도입 이전에 저장된 평문 */
        LEGACY_PLAINTEXT,
        /** 봉투 형태이지만 필드가 빠졌거나 타입이 맞지 않음 */
        INCOMPLETE_ENVELOPE
    }
    
    private static final StoredValue ABSENT = new StoredValue(Kind.ABSENT, null, null);
    private static final StoredValue INCOMPLETE = new StoredValue(Kind.INCOMPLETE_ENVELOPE, null, null);
    
    private final Kind kind;
    private final Envelope envelope;
    private final String plaintext;
    
    private StoredValue(Kind kind, Envelope envelope, String plaintext) {
        this.kind = kind;
        this.envelope = envelope;
        this.plaintext = plaintext;
    }
    
    public static StoredValue absent() {
        return ABSENT;
    }
    
    public static StoredValue incomplete() {
        return INCOMPLETE;
    }
    
    public static StoredValue envelope(Envelope envelope) {
        if (envelope == null || !envelope.isComplete()) {
            return INCOMPLETE;
        }
        return new StoredValue(Kind.ENVELOPE, envelope, null);
    }
    
    public static StoredValue legacy(String plaintext) {
        if (plaintext == null || plaintext.isEmpty()) {
            return ABSENT;
        }
        return new StoredValue(Kind.LEGACY_PLAINTEXT, null, plaintext);
    }
    
    @Override
    public String toString() {
        // 평문은 로그에 남기지 않음
        return "StoredValue(" + kind + ")";
    }
}
