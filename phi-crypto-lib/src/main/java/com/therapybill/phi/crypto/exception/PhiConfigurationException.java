package com.therapybill.phi.crypto.exception;

/**
 * 암호화 키 설정 관련 예외
 * 
 * 암호화 시점에 비밀값이 없으면 발생하며, 쓰기 작업 전체를 중단시킵니다.
 * 평문 저장으로 폴백하지 않습니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class PhiConfigurationException extends PhiCryptoException {
    
    public PhiConfigurationException(String message) {
        super(message);
    }
    
    public PhiConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
