package com.therapybill.phi.record.annotation;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 클래스 레벨 PHI 엔티티 어노테이션
 * 
 * 이 어노테이션이 적용된 클래스의 {@link PhiField} 필드들이
 * 해당 엔티티 타입의 보호 필드 목록으로 등록됩니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
@Target({ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface PhiEntity {
    
    /**
     * 엔티티 타입명 (예: "patient")
     */
    String value();
}
