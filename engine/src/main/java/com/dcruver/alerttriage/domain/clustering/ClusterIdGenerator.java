package com.dcruver.alerttriage.domain.clustering;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Derives a readable cluster id such as {@code swift-eagle-3fa9c1} from the member ids.
 * The same membership always maps to the same id, whichever parameters produced it.
 */
@Component
public class ClusterIdGenerator {

    private static final List<String> ADJECTIVES = List.of(
        "swift", "brave", "bright", "clever", "gentle", "fierce", "quiet", "bold",
        "calm", "quick", "strong", "wise", "alert", "sharp", "agile", "keen",
        "vital", "smart", "fast", "noble", "proud", "steady", "fresh", "clear",
        "warm", "cool", "light", "deep", "soft", "hard", "wide", "tall"
    );

    private static final List<String> NOUNS = List.of(
        "eagle", "tiger", "wolf", "bear", "fox", "hawk", "lion", "deer",
        "whale", "shark", "horse", "bird", "fish", "cat", "dog", "owl",
        "ram", "elk", "bee", "ant", "frog", "duck", "goat", "pig",
        "cow", "hen", "rat", "bat", "fly", "bug", "oak", "pine"
    );

    public String generate(List<String> memberIds) {
        byte[] digest = sha256(String.join("\n", memberIds.stream().sorted().toList()));

        String adjective = ADJECTIVES.get(Byte.toUnsignedInt(digest[0]) % ADJECTIVES.size());
        String noun = NOUNS.get(Byte.toUnsignedInt(digest[1]) % NOUNS.size());
        String suffix = HexFormat.of().formatHex(digest, 2, 5);

        return adjective + "-" + noun + "-" + suffix;
    }

    private byte[] sha256(String input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            // Every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
