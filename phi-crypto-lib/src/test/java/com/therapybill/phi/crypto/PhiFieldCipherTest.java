package com.therapybill.phi.crypto;

import com.therapybill.phi.crypto.dto.Envelope;
import com.therapybill.phi.crypto.exception.PhiConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.HexFormat;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PhiFieldCipherTest {

    private static final String K1 = "0f1e2d3c4b5a69788796a5b4c3d2e1f00f1e2d3c4b5a69788796a5b4c3d2e1f0";
    private static final String K2 = "aaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaaa";

    private final AtomicReference<String> secret = new AtomicReference<>(K1);
    private final PhiFieldCipher cipher = new PhiFieldCipher(new PhiKeyProvider(secret::get));

    @Test
    void roundTrip() {
        for (String plaintext : new String[] {"Jane", "123 Main St, Springfield", "Заметка ✓ 日本語", "x"}) {
            assertThat(cipher.decrypt(cipher.encrypt(plaintext))).isEqualTo(plaintext);
        }
    }

    @Test
    void roundTripWithDerivedKey() {
        PhiFieldCipher derived = new PhiFieldCipher(new PhiKeyProvider(() -> "practice passphrase"));

        assertThat(derived.decrypt(derived.encrypt("Doe"))).isEqualTo("Doe");
    }

    @Test
    void envelopeHasExpectedShape() {
        Envelope envelope = cipher.encrypt("Jane");

        assertThat(envelope.getIv()).hasSize(PhiFieldCipher.IV_LENGTH * 2).matches("[0-9a-f]+");
        assertThat(envelope.getTag()).hasSize(PhiFieldCipher.TAG_LENGTH * 2).matches("[0-9a-f]+");
        assertThat(envelope.getCiphertext()).hasSize("Jane".length() * 2);
    }

    @Test
    void samePlaintextProducesFreshNonceAndCiphertext() {
        Envelope first = cipher.encrypt("Jane Doe");
        Envelope second = cipher.encrypt("Jane Doe");

        assertThat(first.getIv()).isNotEqualTo(second.getIv());
        assertThat(first.getCiphertext()).isNotEqualTo(second.getCiphertext());
    }

    @Test
    void concurrentEncryptionNeverRepeatsNonce() {
        Set<String> nonces = ConcurrentHashMap.newKeySet();

        IntStream.range(0, 500).parallel()
                .forEach(i -> nonces.add(cipher.encrypt("value-" + i).getIv()));

        assertThat(nonces).hasSize(500);
    }

    @Test
    void tamperedCiphertextOrTagDecryptsToNull() {
        Envelope envelope = cipher.encrypt("Jane Doe");

        for (int bit = 0; bit < 8; bit++) {
            Envelope badCiphertext = new Envelope(flipBit(envelope.getCiphertext(), bit), envelope.getIv(), envelope.getTag());
            Envelope badTag = new Envelope(envelope.getCiphertext(), envelope.getIv(), flipBit(envelope.getTag(), bit));
            Envelope badIv = new Envelope(envelope.getCiphertext(), flipBit(envelope.getIv(), bit), envelope.getTag());

            assertThat(cipher.decrypt(badCiphertext)).isNull();
            assertThat(cipher.decrypt(badTag)).isNull();
            assertThat(cipher.decrypt(badIv)).isNull();
        }
    }

    @Test
    void malformedEnvelopeDecryptsToNull() {
        Envelope envelope = cipher.encrypt("Jane Doe");

        assertThat(cipher.decrypt(new Envelope("zz", envelope.getIv(), envelope.getTag()))).isNull();
        assertThat(cipher.decrypt(new Envelope(envelope.getCiphertext(), "abc", envelope.getTag()))).isNull();
        assertThat(cipher.decrypt(new Envelope(envelope.getCiphertext(), envelope.getIv(), "00ff"))).isNull();
        assertThat(cipher.decrypt(new Envelope(envelope.getCiphertext(), null, envelope.getTag()))).isNull();
        assertThat(cipher.decryptStored(Map.of("ciphertext", envelope.getCiphertext()))).isNull();
        assertThat(cipher.decryptStored(42)).isNull();
    }

    @Test
    void legacyPlaintextIsReturnedUnchanged() {
        assertThat(cipher.decrypt("Jane Doe")).isEqualTo("Jane Doe");
        assertThat(cipher.decrypt("{\"note\":\"not an envelope\"}")).isEqualTo("{\"note\":\"not an envelope\"}");

        String annotated = "{\"ciphertext\":\"ab\",\"iv\":\"cd\",\"tag\":\"ef\"} -- imported from old EHR";
        assertThat(cipher.decrypt(annotated)).isEqualTo(annotated);
    }

    @Test
    void jsonEncodedEnvelopeIsDecrypted() {
        String stored = cipher.getEnvelopeCodec().toJson(cipher.encrypt("Jane Doe"));

        assertThat(cipher.decrypt(stored)).isEqualTo("Jane Doe");
    }

    @Test
    void absentValuesCollapseToNull() {
        assertThat(cipher.encrypt(null)).isNull();
        assertThat(cipher.encrypt("")).isNull();
        assertThat(cipher.decrypt((String) null)).isNull();
        assertThat(cipher.decrypt((Envelope) null)).isNull();
        assertThat(cipher.decrypt((StoredValue) null)).isNull();
        assertThat(cipher.decryptStored(null)).isNull();
    }

    @Test
    void envelopeFromRotatedKeyDecryptsToNull() {
        Envelope envelope = cipher.encrypt("Jane Doe");

        secret.set(K2);

        assertThat(cipher.decrypt(envelope)).isNull();
    }

    @Test
    void missingSecretAbortsEncryption() {
        secret.set(null);

        assertThatThrownBy(() -> cipher.encrypt("Jane Doe"))
                .isInstanceOf(PhiConfigurationException.class);
    }

    @Test
    void missingSecretOnReadDecryptsToNull() {
        Envelope envelope = cipher.encrypt("Jane Doe");

        secret.set(null);

        assertThat(cipher.decrypt(envelope)).isNull();
        assertThat(cipher.decrypt("legacy value")).isEqualTo("legacy value");
    }

    private static String flipBit(String hex, int bit) {
        byte[] bytes = HexFormat.of().parseHex(hex);
        bytes[0] ^= (byte) (1 << bit);
        return HexFormat.of().formatHex(bytes);
    }
}
