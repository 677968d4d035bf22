package com.therapybill.phi.record;

import com.therapybill.phi.record.util.PhiFieldDetector;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 엔티티 타입별 PHI 보호 필드 목록 (불변)
 * 
 * 빌드/배포 시점에 고정되며 데이터에 따라 바뀌지 않습니다.
 * 
 * <pre>
 * EntityFieldManifest manifest = EntityFieldManifest.builder()
 *         .register("patient", "firstName", "lastName")
 *         .register(IntakeForm.class)
 *         .build();
 * </pre>
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public final class EntityFieldManifest {
    
    private static final EntityFieldManifest STANDARD = builder()
            .register(PhiEntityTypes.PATIENT, PhiEntityTypes.PATIENT_FIELDS)
            .register(PhiEntityTypes.SOAP_NOTE, PhiEntityTypes.SOAP_NOTE_FIELDS)
            .register(PhiEntityTypes.TREATMENT_SESSION, PhiEntityTypes.TREATMENT_SESSION_FIELDS)
            .build();
    
    private final Map<String, List<String>> fieldsByEntityType;
    
    private EntityFieldManifest(Map<String, List<String>> fieldsByEntityType) {
        this.fieldsByEntityType = Collections.unmodifiableMap(fieldsByEntityType);
    }
    
    /**
     * 기본 매니페스트 (patient, soapNote, treatmentSession)
     */
    public static EntityFieldManifest standard() {
        return STANDARD;
    }
    
    public static Builder builder() {
        return new Builder();
    }
    
    /**
     * 엔티티 타입의 보호 필드 목록
     * 
     * @throws IllegalArgumentException 등록되지 않은 엔티티 타입
     */
    public List<String> fieldsOf(String entityType) {
        List<String> fields = fieldsByEntityType.get(entityType);
        if (fields == null) {
            throw new IllegalArgumentException("등록되지 않은 PHI 엔티티 타입입니다: " + entityType);
        }
        return fields;
    }
    
    public boolean contains(String entityType) {
        return fieldsByEntityType.containsKey(entityType);
    }
    
    public boolean isProtected(String entityType, String fieldName) {
        List<String> fields = fieldsByEntityType.get(entityType);
        return fields != null && fields.contains(fieldName);
    }
    
    public Set<String> entityTypes() {
        return fieldsByEntityType.keySet();
    }
    
    @Override
    public String toString() {
        return "EntityFieldManifest" + fieldsByEntityType;
    }
    
    /**
     * 매니페스트 빌더
     * 
     * 같은 엔티티 타입을 여러 번 등록하면 필드가 순서대로 합쳐집니다.
     */
    public static final class Builder {
        
        private final Map<String, Set<String>> fields = new LinkedHashMap<>();
        
        private Builder() {
        }
        
        public Builder register(String entityType, String... fieldNames) {
            return register(entityType, Arrays.asList(fieldNames));
        }
        
        public Builder register(String entityType, List<String> fieldNames) {
            if (entityType == null || entityType.trim().isEmpty()) {
                throw new IllegalArgumentException("엔티티 타입명이 비어 있습니다");
            }
            Set<String> target = fields.computeIfAbsent(entityType, key -> new LinkedHashSet<>());
            for (String fieldName : fieldNames) {
                if (fieldName == null || fieldName.isEmpty()) {
                    throw new IllegalArgumentException("필드명이 비어 있습니다: " + entityType);
                }
                target.add(fieldName);
            }
            return this;
        }
        
        /**
         * {@code @PhiEntity} / {@code @PhiField} 어노테이션 기반 등록
         */
        public Builder register(Class<?> entityClass) {
            return register(PhiFieldDetector.detectEntityType(entityClass),
                    PhiFieldDetector.detectPhiFields(entityClass));
        }
        
        public EntityFieldManifest build() {
            Map<String, List<String>> copy = new LinkedHashMap<>();
            fields.forEach((type, names) -> copy.put(type, List.copyOf(names)));
            return new EntityFieldManifest(copy);
        }
    }
}
