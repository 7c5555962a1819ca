package com.lynx.anomaly.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonWriteFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Fingerprint of an ordered feature-name list: lowercase hex MD5 of the names
 * rendered as a JSON array with ", " separators, e.g. {@code ["cpu_usage", "net_in"]}.
 * Any reordering changes the hash.
 */
public final class FeatureOrderHash {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonWriteFeature.ESCAPE_NON_ASCII)
            .build();

    private FeatureOrderHash() {}

    public static String of(List<String> featureNames) {
        try {
            StringBuilder json = new StringBuilder("[");
            for (int i = 0; i < featureNames.size(); i++) {
                if (i > 0) json.append(", ");
                json.append(MAPPER.writeValueAsString(featureNames.get(i)));
            }
            json.append(']');
            MessageDigest md5 = MessageDigest.getInstance("MD5");
            return HexFormat.of().formatHex(md5.digest(json.toString().getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to hash feature order " + featureNames, e);
        }
    }
}
