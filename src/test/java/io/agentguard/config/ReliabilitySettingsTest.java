package io.agentguard.config;

import io.agentguard.health.AggregationStrategy;
import io.agentguard.ratelimit.RateLimitStrategy;
import io.agentguard.retry.RetryStrategy;
import io.agentguard.testing.TestFiles;
import io.agentguard.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class ReliabilitySettingsTest {

    @Test
    void missingFileGivesDefaults() {
        ReliabilitySettings settings = ReliabilitySettings.load(Path.of("does-not-exist", "settings.json"));
        Assertions.assertEquals(ReliabilitySettings.defaults(), settings);
        Assertions.assertEquals(5, settings.circuitFailureThreshold());
        Assertions.assertEquals(RateLimitStrategy.TOKEN_BUCKET, settings.rateLimitStrategy());
        Assertions.assertTrue(settings.dlqPersist());
    }

    @Test
    void fileValuesOverrideAndAreClamped() throws Exception {
        Path root = Files.createTempDirectory("agentguard-settings-");
        try {
            Path file = root.resolve(GuardConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "circuitFailureThreshold": 0,
                      "circuitErrorPercentageThreshold": 250,
                      "retryMaxAttempts": 7,
                      "retryBaseDelayMs": 500,
                      "retryMaxDelayMs": 100,
                      "retryStrategy": "fibonacci",
                      "retryJitterFactor": 3.5,
                      "rateLimitStrategy": "no-such-strategy",
                      "healthAggregationStrategy": "MAJORITY",
                      "dlqBacklogThreshold": 0.0,
                      "unknownField": true
                    }
                    """, StandardCharsets.UTF_8);

            ReliabilitySettings settings = ReliabilitySettings.load(file);

            Assertions.assertEquals(1, settings.circuitFailureThreshold());
            Assertions.assertEquals(100, settings.circuitErrorPercentageThreshold());
            Assertions.assertEquals(7, settings.retryMaxAttempts());
            Assertions.assertEquals(500L, settings.retryBaseDelayMs());
            Assertions.assertEquals(500L, settings.retryMaxDelayMs());
            Assertions.assertEquals(RetryStrategy.FIBONACCI, settings.retryStrategy());
            Assertions.assertEquals(1.0, settings.retryJitterFactor(), 0.0001);
            Assertions.assertEquals(RateLimitStrategy.TOKEN_BUCKET, settings.rateLimitStrategy());
            Assertions.assertEquals(AggregationStrategy.MAJORITY, settings.healthAggregationStrategy());
            Assertions.assertEquals(0.01, settings.dlqBacklogThreshold(), 0.0001);
            Assertions.assertEquals(ReliabilitySettings.defaults().dlqMaxRetries(), settings.dlqMaxRetries());
            Assertions.assertEquals(7, settings.retryConfig().maxAttempts());
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void writtenSettingsReadBackUnchanged() throws Exception {
        Path root = Files.createTempDirectory("agentguard-settings-");
        try {
            Path file = root.resolve(GuardConfig.SETTINGS_FILE);
            ReliabilitySettings defaults = ReliabilitySettings.defaults();
            Files.writeString(file, Jsons.toJson(defaults), StandardCharsets.UTF_8);

            Assertions.assertEquals(defaults, ReliabilitySettings.load(file));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void malformedFileFails() throws Exception {
        Path root = Files.createTempDirectory("agentguard-settings-");
        try {
            Path file = root.resolve(GuardConfig.SETTINGS_FILE);
            Files.writeString(file, "{ not json", StandardCharsets.UTF_8);
            Assertions.assertThrows(RuntimeException.class, () -> ReliabilitySettings.load(file));
        } finally {
            TestFiles.deleteRecursively(root);
        }
    }

    @Test
    void derivedConfigsUseResolvedValues() {
        ReliabilitySettings settings = ReliabilitySettings.defaults();
        Assertions.assertEquals(settings.circuitSuccessThreshold(), settings.circuitConfig().successThreshold());
        Assertions.assertEquals(settings.rateLimitMaxRequests(), settings.rateLimitConfig().maxRequests());
        Assertions.assertEquals(settings.dlqMaxQueueSize(), settings.deadLetterConfig().maxQueueSize());
        Assertions.assertEquals(settings.healthRetries(), settings.healthConfig().defaultRetries());
    }
}
