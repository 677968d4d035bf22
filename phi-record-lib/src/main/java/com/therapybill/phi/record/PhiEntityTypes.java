package com.therapybill.phi.record;

import java.util.List;

/**
 * 기본 PHI 엔티티 타입과 보호 필드 목록
 * 
 * @author TherapyBill Development Team
 * @version 1.0.0
 * @since 2025-01-01
 */
public final class PhiEntityTypes {
    
    public static final String PATIENT = "patient";
    public static final String SOAP_NOTE = "soapNote";
    public static final String TREATMENT_SESSION = "treatmentSession";
    
    public static final List<String> PATIENT_FIELDS = List.of(
            "firstName", "lastName", "dateOfBirth", "email", "phone",
            "address", "insuranceId", "policyNumber", "groupNumber");
    
    public static final List<String> SOAP_NOTE_FIELDS = List.of(
            "subjective", "objective", "assessment", "plan",
            "progressNotes", "homeProgram");
    
    public static final List<String> TREATMENT_SESSION_FIELDS = List.of(
            "notes", "originalDocumentText");
    
    private PhiEntityTypes() {
    }
}
