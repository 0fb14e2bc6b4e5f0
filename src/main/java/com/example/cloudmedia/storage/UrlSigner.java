package com.example.cloudmedia.storage;

import com.example.cloudmedia.config.StorageProperties;
import org.apache.commons.codec.digest.HmacAlgorithms;
import org.apache.commons.codec.digest.HmacUtils;
import org.springframework.stereotype.Component;
import org.springframework.util.Assert;
import org.springframework.web.util.UriComponentsBuilder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Clock;
import java.time.Duration;

@Component
public class UrlSigner {

    static final String FILES_PATH = "/api/files/";

    private final Clock clock;
    private final String publicBaseUrl;
    private final byte[] signingKey;

    public UrlSigner(StorageProperties properties, Clock clock) {
        Assert.hasText(properties.getUrlSigningKey(), "app.storage.url-signing-key must be set");
        Assert.hasText(properties.getPublicBaseUrl(), "app.storage.public-base-url must be set");
        this.clock = clock;
        this.publicBaseUrl = properties.getPublicBaseUrl();
        this.signingKey = properties.getUrlSigningKey().getBytes(StandardCharsets.UTF_8);
    }

    public String sign(String storedName, Duration ttl) {
        long expires = clock.instant().plus(ttl).getEpochSecond();
        return UriComponentsBuilder.fromHttpUrl(publicBaseUrl)
            .path(FILES_PATH)
            .path(storedName)
            .queryParam("expires", expires)
            .queryParam("signature", signature(storedName, expires))
            .build()
            .toUriString();
    }

    public boolean verify(String storedName, long expires, String signature) {
        if (signature == null || clock.instant().getEpochSecond() > expires) {
            return false;
        }
        byte[] expected = signature(storedName, expires).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(expected, signature.getBytes(StandardCharsets.UTF_8));
    }

    private String signature(String storedName, long expires) {
        return new HmacUtils(HmacAlgorithms.HMAC_SHA_256, signingKey).hmacHex(storedName + "\n" + expires);
    }
}
