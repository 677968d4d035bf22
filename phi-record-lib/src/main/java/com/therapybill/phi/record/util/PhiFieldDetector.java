package com.therapybill.phi.record.util;

import com.therapybill.phi.record.annotation.PhiEntity;
import com.therapybill.phi.record.annotation.PhiField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * PHI 필드 자동 감지 유틸리티
 * 
 * {@link PhiEntity} 클래스에서 {@link PhiField}가 붙은 필드를 찾아
 * 보호 필드 목록을 만듭니다. 상위 클래스 필드가 먼저, 선언 순서대로 나열됩니다.
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public final class PhiFieldDetector {
    
    private static final Logger log = LoggerFactory.getLogger(PhiFieldDetector.class);
    
    private PhiFieldDetector() {
    }
    
    /**
     * 엔티티 타입명 조회
     * 
     * @param clazz 대상 클래스
     * @return {@link PhiEntity#value()}
     * @throws IllegalArgumentException {@link PhiEntity}가 없거나 값이 비어 있는 경우
     */
    public static String detectEntityType(Class<?> clazz) {
        PhiEntity entity = clazz.getAnnotation(PhiEntity.class);
        if (entity == null) {
            throw new IllegalArgumentException("@PhiEntity가 없는 클래스입니다: " + clazz.getName());
        }
        if (entity.value().trim().isEmpty()) {
            throw new IllegalArgumentException("@PhiEntity 타입명이 비어 있습니다: " + clazz.getName());
        }
        return entity.value().trim();
    }
    
    /**
     * 보호 필드명 감지
     * 
     * @param clazz 대상 클래스
     * @return 레코드 키 이름 목록 (중복 제거, 순서 유지)
     */
    public static List<String> detectPhiFields(Class<?> clazz) {
        Deque<Class<?>> hierarchy = new ArrayDeque<>();
        for (Class<?> current = clazz; current != null && current != Object.class; current = current.getSuperclass()) {
            hierarchy.push(current);
        }
        
        Set<String> names = new LinkedHashSet<>();
        for (Class<?> current : hierarchy) {
            for (Field field : current.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) {
                    continue;
                }
                PhiField phiField = field.getAnnotation(PhiField.class);
                if (phiField == null) {
                    log.trace("PHI 제외 필드: {}.{}", current.getSimpleName(), field.getName());
                    continue;
                }
                String name = phiField.name().isEmpty() ? field.getName() : phiField.name();
                if (names.add(name)) {
                    log.debug("PHI 필드 감지: {}.{} -> {}", current.getSimpleName(), field.getName(), name);
                } else {
                    log.warn("중복된 PHI 필드명 무시: {}.{} -> {}", current.getSimpleName(), field.getName(), name);
                }
            }
        }
        return new ArrayList<>(names);
    }
}
