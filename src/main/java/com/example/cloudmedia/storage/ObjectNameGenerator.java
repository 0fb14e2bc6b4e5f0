package com.example.cloudmedia.storage;

import org.apache.commons.codec.binary.Hex;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@Component
public class ObjectNameGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss")
        .withZone(ZoneOffset.UTC);

    private final Clock clock;
    private final SecureRandom secureRandom = new SecureRandom();

    public ObjectNameGenerator(Clock clock) {
        this.clock = clock;
    }

    public String generate(String ownerId, String originalFilename) {
        byte[] buffer = new byte[4];
        secureRandom.nextBytes(buffer);
        return ownerId + "/" + TIMESTAMP.format(clock.instant()) + "_" + Hex.encodeHexString(buffer)
            + extensionOf(originalFilename);
    }

    static String extensionOf(String filename) {
        if (filename == null) {
            return "";
        }
        String extension = FilenameUtils.getExtension(FilenameUtils.getName(filename))
            .replaceAll("[^A-Za-z0-9]", "");
        return extension.isEmpty() ? "" : "." + extension;
    }
}
