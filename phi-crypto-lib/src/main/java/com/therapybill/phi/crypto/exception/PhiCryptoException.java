package com.therapybill.phi.crypto.exception;

/**
 * PHI 암복호화 관련 예외
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class PhiCryptoException extends RuntimeException {
    
    public PhiCryptoException(String message) {
        super(message);
    }
    
    public PhiCryptoException(String message, Throwable cause) {
        super(message, cause);
    }
}
