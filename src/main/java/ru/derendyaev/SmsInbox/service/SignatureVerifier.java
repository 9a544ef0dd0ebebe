package ru.derendyaev.SmsInbox.service;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Проверка подписи вебхука: HMAC-SHA256 от сырого тела запроса в lowercase hex.
 */
@Component
public class SignatureVerifier {

    private static final String HMAC_ALGORITHM = "HmacSHA256";

    /**
     * @param rawBody           тело запроса в том виде, в каком оно пришло по сети
     * @param providedSignature подпись из заголовка запроса
     * @param secret            общий секрет
     * @return true только если подпись совпадает; при пустой подписи или секрете всегда false
     */
    public boolean verify(byte[] rawBody, String providedSignature, String secret) {
        if (providedSignature == null || providedSignature.isEmpty()) {
            return false;
        }
        if (secret == null || secret.isEmpty()) {
            return false;
        }
        String expected = sign(rawBody, secret);
        // isEqual не выходит на первом несовпавшем байте
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.US_ASCII),
                providedSignature.getBytes(StandardCharsets.UTF_8));
    }

    public String sign(byte[] rawBody, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_ALGORITHM));
            byte[] hashBytes = mac.doFinal(rawBody != null ? rawBody : new byte[0]);
            return HexFormat.of().formatHex(hashBytes);
        } catch (NoSuchAlgorithmException | InvalidKeyException e) {
            throw new IllegalStateException("HMAC-SHA256 is not available", e);
        }
    }
}
