package app.lexrecall.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Block assembly limits. {@code expectedAccuracy} lists the expected hit rate for difficulty 1..5 and
 * drives the accuracy-band adjustment.
 */
@ConfigurationProperties(prefix = "lexrecall.block")
public record BlockProps(
        int defaultSize,
        int maxSize,
        Double maxTopicShare,
        Double accuracyBandLow,
        Double accuracyBandHigh,
        List<Double> expectedAccuracy
) {
    private static final List<Double> DEFAULT_EXPECTED_ACCURACY = List.of(0.95, 0.88, 0.78, 0.68, 0.58);

    public BlockProps {
        if (defaultSize < 0 || maxSize < 0) {
            throw new IllegalArgumentException("lexrecall.block sizes must not be negative");
        }
        if (defaultSize == 0) defaultSize = 20;
        if (maxSize == 0) maxSize = 200;
        if (defaultSize > maxSize) {
            throw new IllegalArgumentException("lexrecall.block.default-size " + defaultSize + " exceeds max-size " + maxSize);
        }
        if (maxTopicShare == null) maxTopicShare = 0.4;
        if (maxTopicShare <= 0 || maxTopicShare > 1) {
            throw new IllegalArgumentException("lexrecall.block.max-topic-share must be in (0, 1], got " + maxTopicShare);
        }
        if (accuracyBandLow == null) accuracyBandLow = 0.70;
        if (accuracyBandHigh == null) accuracyBandHigh = 0.85;
        requireUnit("accuracy-band-low", accuracyBandLow);
        requireUnit("accuracy-band-high", accuracyBandHigh);
        if (accuracyBandLow > accuracyBandHigh) {
            throw new IllegalArgumentException("lexrecall.block.accuracy-band-low " + accuracyBandLow
                    + " is above accuracy-band-high " + accuracyBandHigh);
        }
        if (expectedAccuracy == null) {
            expectedAccuracy = DEFAULT_EXPECTED_ACCURACY;
        } else if (expectedAccuracy.size() != 5) {
            throw new IllegalArgumentException("lexrecall.block.expected-accuracy needs one value per difficulty 1..5, got "
                    + expectedAccuracy.size());
        } else {
            expectedAccuracy.forEach(v -> requireUnit("expected-accuracy", v));
            expectedAccuracy = List.copyOf(expectedAccuracy);
        }
    }

    public static BlockProps defaults() {
        return new BlockProps(0, 0, null, null, null, null);
    }

    public double expectedAccuracy(int difficultyLevel) {
        return expectedAccuracy.get(difficultyLevel - 1);
    }

    private static void requireUnit(String name, Double value) {
        if (value == null || value < 0 || value > 1) {
            throw new IllegalArgumentException("lexrecall.block." + name + " must be in [0, 1], got " + value);
        }
    }
}
