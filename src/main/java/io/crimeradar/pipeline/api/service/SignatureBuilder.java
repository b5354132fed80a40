package io.crimeradar.pipeline.api.service;

import io.crimeradar.pipeline.api.dto.MinHashSignature;
import io.crimeradar.pipeline.config.DedupConfig;
import io.crimeradar.pipeline.config.PipelineConfig;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Random;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * MinHash over the set of distinct lowercase word tokens of at least
 * {@code minTokenLength} characters. Each token is hashed once (first four
 * bytes of its SHA-1) and pushed through {@code numPermutations} universal
 * hash functions {@code (a*h + b) mod (2^61 - 1)} truncated to 32 bits.
 */
@Service
public class SignatureBuilder {

    static final long MERSENNE_PRIME = (1L << 61) - 1;
    static final long MAX_HASH = 0xFFFFFFFFL;

    private final int numPermutations;
    private final Pattern tokenPattern;
    private final long[] multipliers;
    private final long[] increments;

    @Autowired
    public SignatureBuilder(PipelineConfig pipelineConfig) {
        this(pipelineConfig.dedup());
    }

    SignatureBuilder(DedupConfig dedup) {
        this.numPermutations = dedup.numPermutations();
        this.tokenPattern = Pattern.compile("\\w{" + dedup.minTokenLength() + ",}", Pattern.UNICODE_CHARACTER_CLASS);
        this.multipliers = new long[numPermutations];
        this.increments = new long[numPermutations];

        // a < 2^31 and h < 2^32 keep a*h + b inside a signed long
        Random random = new Random(dedup.seed());
        for (int i = 0; i < numPermutations; i++) {
            multipliers[i] = 1 + random.nextInt(Integer.MAX_VALUE - 1);
            increments[i] = random.nextInt(Integer.MAX_VALUE);
        }
    }

    public MinHashSignature build(String text) {
        Set<String> shingles = shingles(text);

        long[] values = new long[numPermutations];
        Arrays.fill(values, MAX_HASH);

        for (String shingle : shingles) {
            long hash = baseHash(shingle);
            for (int i = 0; i < numPermutations; i++) {
                long permuted = ((multipliers[i] * hash + increments[i]) % MERSENNE_PRIME) & MAX_HASH;
                if (permuted < values[i]) {
                    values[i] = permuted;
                }
            }
        }

        return new MinHashSignature(values, shingles.isEmpty());
    }

    public Set<String> shingles(String text) {
        Set<String> tokens = new LinkedHashSet<>();
        if (text == null) return tokens;

        Matcher matcher = tokenPattern.matcher(text.toLowerCase(Locale.ROOT));
        while (matcher.find()) {
            tokens.add(matcher.group());
        }
        return tokens;
    }

    private static long baseHash(String token) {
        byte[] digest = DigestUtils.sha1(token.getBytes(StandardCharsets.UTF_8));
        return ByteBuffer.wrap(digest, 0, 4).getInt() & MAX_HASH;
    }
}
