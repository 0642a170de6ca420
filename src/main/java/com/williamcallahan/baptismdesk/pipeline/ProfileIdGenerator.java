package com.williamcallahan.baptismdesk.pipeline;

import com.williamcallahan.baptismdesk.service.ContentHasher;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Random;
import java.util.function.Predicate;

/**
 * Derives content-addressed profile ids.
 *
 * <p>The candidate id is the first eight hex characters of the SHA-256 of the image. When the
 * candidate is taken the id becomes {@code dup_<4 random hex>_<candidate>}. The digest and the
 * collision fallback are separate so tests can seed the {@link Random}.</p>
 */
public class ProfileIdGenerator {

    static final int ID_LENGTH = 8;
    static final String DUPLICATE_PREFIX = "dup_";
    private static final int SUFFIX_LENGTH = 4;
    private static final int MAX_ATTEMPTS = 64;

    private final ContentHasher contentHasher;
    private final Random random;

    public ProfileIdGenerator(ContentHasher contentHasher, Random random) {
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Hashes the file and truncates the digest to the id length.
     */
    public String candidateId(Path imageFile) {
        return contentHasher.sha256(imageFile).substring(0, ID_LENGTH);
    }

    /**
     * Returns the candidate if {@code claim} accepts it, otherwise keeps generating suffixed ids
     * until one is accepted.
     *
     * @param candidate content-derived id
     * @param claim atomically claims an id, returning false when it is already taken
     * @return the claimed id
     * @throws IllegalStateException if no free id is found after repeated attempts
     */
    public String resolve(String candidate, Predicate<String> claim) {
        if (claim.test(candidate)) {
            return candidate;
        }
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String alternative = DUPLICATE_PREFIX + randomSuffix() + "_" + candidate;
            if (claim.test(alternative)) {
                return alternative;
            }
        }
        throw new IllegalStateException("Could not find a free id for " + candidate);
    }

    private String randomSuffix() {
        StringBuilder sb = new StringBuilder(SUFFIX_LENGTH);
        for (int i = 0; i < SUFFIX_LENGTH; i++) {
            sb.append(Character.forDigit(random.nextInt(16), 16));
        }
        return sb.toString();
    }
}
