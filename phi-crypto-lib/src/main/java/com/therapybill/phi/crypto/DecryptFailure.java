package com.therapybill.phi.crypto;

/**
 * 복호화 실패 사유 (로그 구분용)
 * 
 * 호출자에게는 모두 null로 전달되며, 로그에서만 레거시 평문과 구분됩니다.
 */
public enum DecryptFailure {
    INCOMPLETE_ENVELOPE,
    MALFORMED_ENCODING,
    AUTHENTICATION_FAILED,
    KEY_UNAVAILABLE
}
