package com.therapybill.phi.crypto;

import com.therapybill.phi.crypto.exception.PhiConfigurationException;
import org.bouncycastle.crypto.generators.SCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.Objects;
import java.util.function.Supplier;
import java.util.regex.Pattern;

/**
 * PHI 암호화 키 제공자
 * 
 * 외부 비밀값 하나로부터 AES-256 키(32바이트)를 만듭니다.
 * 
 * 동작 방식:
 * 1. 호출마다 비밀값을 다시 읽음 (없으면 {@link PhiConfigurationException})
 * 2. 정확히 64자리 hex이면 그대로 디코딩하여 raw 키로 사용
 * 3. 그 외에는 고정 salt로 scrypt 유도 (N=16384, r=8, p=1)
 * 
 * 기본적으로 유도된 키를 캐시하지 않습니다. {@code cacheDerivedKey}를 켜면
 * 마지막으로 유도한 passphrase 키를 비밀값이 바뀔 때까지 재사용합니다.
 * 
 * 비밀값 조회 순서 ({@link #fromEnvironment()}):
 * 1. 환경 변수: PHI_ENCRYPTION_KEY
 * 2. 시스템 프로퍼티: -Dphi.encryption-key=...
 * 
 * 비밀값은 공백을 포함해 읽은 그대로 사용합니다. null 또는 빈 문자열만 미설정으로 봅니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public class PhiKeyProvider {
    
    private static final Logger log = LoggerFactory.getLogger(PhiKeyProvider.class);
    
    public static final String ENV_ENCRYPTION_KEY = "PHI_ENCRYPTION_KEY";
    public static final String PROPERTY_ENCRYPTION_KEY = "phi.encryption-key";
    
    public static final int KEY_LENGTH = 32;
    
    // scrypt 파라미터 (기존 저장 데이터와 호환되도록 고정)
    static final byte[] SCRYPT_SALT = "therapybill-phi-salt".getBytes(StandardCharsets.UTF_8);
    static final int SCRYPT_COST = 16384;
    static final int SCRYPT_BLOCK_SIZE = 8;
    static final int SCRYPT_PARALLELISM = 1;
    
    private static final Pattern RAW_KEY_PATTERN = Pattern.compile("[0-9a-fA-F]{64}");
    private static final SecureRandom KEY_RANDOM = new SecureRandom();
    
    private final Supplier<String> secretSource;
    private final boolean cacheDerivedKey;
    
    private volatile CachedKey cachedKey;
    
    public PhiKeyProvider(Supplier<String> secretSource) {
        this(secretSource, false);
    }
    
    public PhiKeyProvider(Supplier<String> secretSource, boolean cacheDerivedKey) {
        this.secretSource = Objects.requireNonNull(secretSource, "secretSource");
        this.cacheDerivedKey = cacheDerivedKey;
    }
    
    /**
     * 환경 변수 / 시스템 프로퍼티에서 비밀값을 읽는 제공자 생성
     */
    public static PhiKeyProvider fromEnvironment() {
        return new PhiKeyProvider(PhiKeyProvider::readEnvironmentSecret);
    }
    
    public static String readEnvironmentSecret() {
        String secret = System.getenv(ENV_ENCRYPTION_KEY);
        if (secret == null || secret.isEmpty()) {
            secret = System.getProperty(PROPERTY_ENCRYPTION_KEY);
        }
        return secret;
    }
    
    /**
     * 현재 비밀값으로 암호화 키 생성
     * 
     * @return AES 키
     * @throws PhiConfigurationException 비밀값이 설정되지 않은 경우
     */
    public SecretKey getKey() {
        String secret = secretSource.get();
        if (secret == null || secret.isEmpty()) {
            throw new PhiConfigurationException(
                    ENV_ENCRYPTION_KEY + " 설정이 없습니다. PHI 암복호화에는 암호화 키가 필요합니다");
        }
        
        if (isRawKey(secret)) {
            return new SecretKeySpec(HexFormat.of().parseHex(secret), "AES");
        }
        
        if (!cacheDerivedKey) {
            return new SecretKeySpec(deriveKey(secret), "AES");
        }
        
        CachedKey cached = cachedKey;
        if (cached == null || !cached.secret.equals(secret)) {
            cached = new CachedKey(secret, deriveKey(secret));
            cachedKey = cached;
            log.debug("passphrase 키 유도 후 캐시 갱신");
        }
        return new SecretKeySpec(cached.key, "AES");
    }
    
    /**
     * 64자리 hex 문자열이면 raw 키 모드
     */
    public static boolean isRawKey(String secret) {
        return secret != null && RAW_KEY_PATTERN.matcher(secret).matches();
    }
    
    /**
     * 캐시된 유도 키 제거
     */
    public void clearCache() {
        cachedKey = null;
    }
    
    /**
     * 새 raw 키 생성 (운영자 초기 설정 / 교체용)
     * 
     * @return 32바이트 난수의 64자리 hex 문자열
     */
    public static String generateEncryptionKey() {
        byte[] key = new byte[KEY_LENGTH];
        KEY_RANDOM.nextBytes(key);
        return HexFormat.of().formatHex(key);
    }
    
    static byte[] deriveKey(String secret) {
        return SCrypt.generate(secret.getBytes(StandardCharsets.UTF_8), SCRYPT_SALT,
                SCRYPT_COST, SCRYPT_BLOCK_SIZE, SCRYPT_PARALLELISM, KEY_LENGTH);
    }
    
    private static final class CachedKey {
        private final String secret;
        private final byte[] key;
        
        private CachedKey(String secret, byte[] key) {
            this.secret = secret;
            this.key = key;
        }
    }
}
