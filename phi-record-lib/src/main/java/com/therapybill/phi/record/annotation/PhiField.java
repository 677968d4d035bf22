package com.therapybill.phi.record.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 필드 레벨 PHI 보호 어노테이션
 * 
 * 이 어노테이션이 적용된 필드는 저장 전에 암호화되고 조회 후에 복호화됩니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@Target({ElementType.FIELD})
@Retention(RetentionPolicy.RUNTIME)
public @interface PhiField {
    
    /**
     * 레코드 키 이름
     * 기본값: "" (Java 필드명 사용)
     */
    String name() default "";
}
