package com.therapybill.phi.crypto;

/**
 * 암호화 키 생성 도구
 * 
 * 초기 설정 또는 키 교체 시 운영자가 한 번 실행하여 PHI_ENCRYPTION_KEY 값을 얻습니다.
 * 요청 처리 경로에서는 사용하지 않습니다.
 * 
 * <pre>
 * java -cp phi-crypto-lib.jar com.therapybill.phi.crypto.PhiKeyGenerator
 * </pre>
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public final class PhiKeyGenerator {
    
    private PhiKeyGenerator() {
    }
    
    public static void main(String[] args) {
        System.out.println(PhiKeyProvider.generateEncryptionKey());
    }
}
