package io.pingjob.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pingjob.core.AuthenticationException;
import io.pingjob.core.DecodeException;
import io.pingjob.core.DeserializeException;
import io.pingjob.core.EncryptionException;
import io.pingjob.core.JobConfig;

import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.spec.GCMParameterSpec;
import javax.crypto.spec.SecretKeySpec;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * AES-256-GCM encryption of job definitions at rest.
 *
 * <p>Format: hex( nonce(12) || ciphertext || tag(16) ), where the plaintext is the JSON
 * encoding of the {@link JobConfig}. Every call to {@link #encrypt(JobConfig)} draws a new
 * random nonce, so encrypting the same config twice yields different strings.
 *
 * <p>The JSON mapping is owned by the codec and never taken from the application, so records
 * written under one configuration stay readable under any other.
 */
public final class JobConfigCodec {

    public static final int KEY_LEN = 32;
    public static final int NONCE_LEN = 12;
    public static final int TAG_LEN = 16;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final HexFormat HEX = HexFormat.of();
    private static final SecureRandom RNG = new SecureRandom();

    // Durations as decimal seconds ("60.000000000"); unknown fields rejected.
    static final ObjectMapper JSON = JsonMapper.builder()
            .addModule(new JavaTimeModule())
            .enable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.WRITE_DATE_TIMESTAMPS_AS_NANOSECONDS)
            .enable(DeserializationFeature.READ_DATE_TIMESTAMPS_AS_NANOSECONDS)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .disable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .build();

    private final SecretKeySpec key;

    public JobConfigCodec(byte[] key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.length != KEY_LEN) {
            throw new IllegalArgumentException("key must be " + KEY_LEN + " bytes, got " + key.length);
        }
        this.key = new SecretKeySpec(Arrays.copyOf(key, KEY_LEN), "AES");
    }

    public String encrypt(JobConfig config) {
        Objects.requireNonNull(config, "config must not be null");

        byte[] plaintext;
        try {
            plaintext = JSON.writeValueAsBytes(config);
        } catch (JsonProcessingException e) {
            throw new EncryptionException("error serializing job config", String.valueOf(config.id()), e);
        }

        try {
            byte[] nonce = new byte[NONCE_LEN];
            RNG.nextBytes(nonce);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_LEN * 8, nonce));
            byte[] ct = cipher.doFinal(plaintext);

            byte[] out = new byte[nonce.length + ct.length];
            System.arraycopy(nonce, 0, out, 0, nonce.length);
            System.arraycopy(ct, 0, out, nonce.length, ct.length);

            return HEX.formatHex(out);
        } catch (GeneralSecurityException e) {
            throw new EncryptionException("error encrypting job config", String.valueOf(config.id()), e);
        }
    }

    public JobConfig decrypt(String encrypted) {
        Objects.requireNonNull(encrypted, "encrypted must not be null");

        byte[] payload;
        try {
            payload = HEX.parseHex(encrypted);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("error decoding encrypted data", e);
        }
        if (payload.length < NONCE_LEN + TAG_LEN) {
            throw new DecodeException("encrypted data too short: " + payload.length + " bytes");
        }

        byte[] plaintext;
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_LEN * 8, payload, 0, NONCE_LEN));
            plaintext = cipher.doFinal(payload, NONCE_LEN, payload.length - NONCE_LEN);
        } catch (AEADBadTagException e) {
            throw new AuthenticationException("error authenticating job config (wrong key or corrupted data)", e);
        } catch (GeneralSecurityException e) {
            throw new AuthenticationException("error decrypting job config", e);
        }

        JobConfig config;
        try {
            config = JSON.readValue(plaintext, JobConfig.class);
        } catch (IOException | RuntimeException e) {
            throw new DeserializeException("error unmarshalling job config", e);
        }
        if (config == null) {
            throw new DeserializeException("error unmarshalling job config: empty document", null);
        }
        return config;
    }
}
