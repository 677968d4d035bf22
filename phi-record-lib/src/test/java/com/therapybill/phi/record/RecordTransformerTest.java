package com.therapybill.phi.record;

import com.therapybill.phi.crypto.PhiFieldCipher;
import com.therapybill.phi.crypto.PhiKeyProvider;
import com.therapybill.phi.crypto.dto.Envelope;
import com.therapybill.phi.crypto.exception.PhiConfigurationException;
import com.therapybill.phi.crypto.exception.PhiCryptoException;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordTransformerTest {

    private static final String KEY = PhiKeyProvider.generateEncryptionKey();

    private final AtomicReference<String> secret = new AtomicReference<>(KEY);
    private final PhiFieldCipher cipher = new PhiFieldCipher(new PhiKeyProvider(secret::get));
    private final EntityFieldManifest manifest = EntityFieldManifest.builder()
            .register(PhiEntityTypes.PATIENT, "firstName", "lastName")
            .build();
    private final RecordTransformer transformer = new RecordTransformer(cipher, manifest);

    @Test
    void manifestFieldsAreEncryptedAndOthersUntouched() {
        Integer age = 8;
        Map<String, Object> patient = patient("Jane", "Doe", age);

        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, patient);

        assertThat(encrypted.get("firstName")).isInstanceOf(Envelope.class);
        assertThat(encrypted.get("lastName")).isInstanceOf(Envelope.class);
        assertThat(encrypted.get("age")).isSameAs(age);
        assertThat(patient.get("firstName")).isEqualTo("Jane");

        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, encrypted)).isEqualTo(patient);
    }

    @Test
    void partialRecordDoesNotInventFields() {
        Map<String, Object> partial = new HashMap<>();
        partial.put("firstName", "Jane");

        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, partial);

        assertThat(encrypted).containsOnlyKeys("firstName");
        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, encrypted)).containsOnlyKeys("firstName");
    }

    @Test
    void explicitNullAndEmptyStringBecomeNull() {
        Map<String, Object> record = new HashMap<>();
        record.put("firstName", null);
        record.put("lastName", "");

        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, record);

        assertThat(encrypted).containsEntry("firstName", null).containsEntry("lastName", null);
        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, encrypted))
                .containsEntry("firstName", null).containsEntry("lastName", null);
    }

    @Test
    void nullRecordsPassThroughAsNull() {
        assertThat(transformer.encryptRecord(PhiEntityTypes.PATIENT, null)).isNull();
        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, null)).isNull();
        assertThat(transformer.encryptRecord("invoice", null)).isNull();
        assertThat(transformer.decryptRecord("invoice", null)).isNull();
    }

    @Test
    void legacyRowsDecryptToTheirStoredValues() {
        Map<String, Object> legacy = patient("Jane", "Doe", 8);

        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, legacy)).isEqualTo(legacy);
    }

    @Test
    void jsonColumnRowsAreDecrypted() {
        Envelope envelope = cipher.encrypt("Jane");
        Map<String, Object> stored = new LinkedHashMap<>();
        stored.put("firstName", Map.of("ciphertext", envelope.getCiphertext(),
                "iv", envelope.getIv(), "tag", envelope.getTag()));
        stored.put("lastName", cipher.getEnvelopeCodec().toJson(cipher.encrypt("Doe")));

        Map<String, Object> decrypted = transformer.decryptRecord(PhiEntityTypes.PATIENT, stored);

        assertThat(decrypted).containsEntry("firstName", "Jane").containsEntry("lastName", "Doe");
    }

    @Test
    void undecryptableFieldDegradesToNullWithoutFailingTheRecord() {
        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, patient("Jane", "Doe", 8));
        Envelope lastName = (Envelope) encrypted.get("lastName");
        encrypted.put("lastName", new Envelope(lastName.getCiphertext(), lastName.getIv(), "00".repeat(16)));

        Map<String, Object> decrypted = transformer.decryptRecord(PhiEntityTypes.PATIENT, encrypted);

        assertThat(decrypted).containsEntry("firstName", "Jane").containsEntry("lastName", null).containsEntry("age", 8);
    }

    @Test
    void rotatedKeyDegradesFieldsToNull() {
        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, patient("Jane", "Doe", 8));

        secret.set(PhiKeyProvider.generateEncryptionKey());

        assertThat(transformer.decryptRecord(PhiEntityTypes.PATIENT, encrypted))
                .containsEntry("firstName", null).containsEntry("lastName", null);
    }

    @Test
    void missingSecretAbortsTheWrite() {
        secret.set(null);

        assertThatThrownBy(() -> transformer.encryptRecord(PhiEntityTypes.PATIENT, patient("Jane", "Doe", 8)))
                .isInstanceOf(PhiConfigurationException.class);
    }

    @Test
    void encryptingTwiceIsRejected() {
        Map<String, Object> encrypted = transformer.encryptRecord(PhiEntityTypes.PATIENT, patient("Jane", "Doe", 8));

        assertThatThrownBy(() -> transformer.encryptRecord(PhiEntityTypes.PATIENT, encrypted))
                .isInstanceOf(PhiCryptoException.class)
                .hasMessageContaining("patient.firstName");

        Map<String, Object> serialized = new HashMap<>(encrypted);
        serialized.put("firstName", cipher.getEnvelopeCodec().toJson((Envelope) encrypted.get("firstName")));
        assertThatThrownBy(() -> transformer.encryptRecord(PhiEntityTypes.PATIENT, serialized))
                .isInstanceOf(PhiCryptoException.class);
    }

    @Test
    void scalarValuesAreEncryptedAsText() {
        RecordTransformer standard = new RecordTransformer(cipher);
        Map<String, Object> patient = new HashMap<>();
        patient.put("dateOfBirth", LocalDate.of(2016, 3, 14));
        patient.put("phone", 5551234);

        Map<String, Object> decrypted = standard.decryptPatientRecord(standard.encryptPatientRecord(patient));

        assertThat(decrypted).containsEntry("dateOfBirth", "2016-03-14").containsEntry("phone", "5551234");
    }

    @Test
    void unsupportedValueTypeIsRejected() {
        Map<String, Object> patient = new HashMap<>();
        patient.put("firstName", List.of("Jane"));

        assertThatThrownBy(() -> transformer.encryptRecord(PhiEntityTypes.PATIENT, patient))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void unknownEntityTypeIsRejected() {
        assertThatThrownBy(() -> transformer.encryptRecord("invoice", Map.of("total", 10)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("invoice");
        assertThatThrownBy(() -> transformer.decryptRecord("invoice", Map.of("total", 10)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void standardEntityConveniencesUseTheirManifests() {
        RecordTransformer standard = new RecordTransformer(cipher);
        Map<String, Object> note = new HashMap<>();
        note.put("subjective", "Reports knee pain");
        note.put("cptCode", "97110");
        Map<String, Object> session = new HashMap<>();
        session.put("notes", "Tolerated exercises");
        session.put("durationMinutes", 45);

        Map<String, Object> encryptedNote = standard.encryptSoapNoteRecord(note);
        Map<String, Object> encryptedSession = standard.encryptTreatmentSessionRecord(session);

        assertThat(encryptedNote.get("subjective")).isInstanceOf(Envelope.class);
        assertThat(encryptedNote.get("cptCode")).isEqualTo("97110");
        assertThat(encryptedSession.get("notes")).isInstanceOf(Envelope.class);
        assertThat(standard.decryptSoapNoteRecord(encryptedNote)).isEqualTo(note);
        assertThat(standard.decryptTreatmentSessionRecord(encryptedSession)).isEqualTo(session);
    }

    private static Map<String, Object> patient(String firstName, String lastName, Object age) {
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("firstName", firstName);
        patient.put("lastName", lastName);
        patient.put("age", age);
        return patient;
    }
}
