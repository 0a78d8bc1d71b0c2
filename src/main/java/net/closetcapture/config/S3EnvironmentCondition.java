package net.closetcapture.config;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Condition;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.env.Environment;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Enables the S3 client beans only when credentials and a bucket are configured. Each setting is
 * read from its property key first, then from its environment variable.
 */
public class S3EnvironmentCondition implements Condition {

    private static final Logger logger = LoggerFactory.getLogger(S3EnvironmentCondition.class);
    private static final AtomicBoolean statusLogged = new AtomicBoolean(false);

    private static final List<RequiredSetting> REQUIRED_SETTINGS = List.of(
        new RequiredSetting("s3.access-key-id", "S3_ACCESS_KEY_ID"),
        new RequiredSetting("s3.secret-access-key", "S3_SECRET_ACCESS_KEY"),
        new RequiredSetting("storage.bucket-name", "S3_BUCKET")
    );

    @Override
    public boolean matches(ConditionContext context, AnnotatedTypeMetadata metadata) {
        List<String> missing = missingSettings(context.getEnvironment());
        boolean enabled = missing.isEmpty();

        // Evaluated once per conditional bean; the summary is logged on the first pass only
        if (statusLogged.compareAndSet(false, true)) {
            if (enabled) {
                logger.info("S3 storage configured for bucket {}",
                    resolve(context.getEnvironment(), REQUIRED_SETTINGS.get(2)));
            } else {
                logger.error("S3 storage DISABLED, missing: {}. Every storage relay will fail with "
                    + "[code=RELAY_STORAGE_UNAVAILABLE] until these are set.", String.join(", ", missing));
            }
        }
        return enabled;
    }

    static List<String> missingSettings(Environment environment) {
        List<String> missing = new ArrayList<>();
        for (RequiredSetting setting : REQUIRED_SETTINGS) {
            if (resolve(environment, setting) == null) {
                missing.add(setting.propertyKey() + "/" + setting.environmentVariable());
            }
        }
        return missing;
    }

    private static String resolve(Environment environment, RequiredSetting setting) {
        String value = environment.getProperty(setting.propertyKey());
        if (value == null || value.isBlank()) {
            value = environment.getProperty(setting.environmentVariable());
        }
        return value == null || value.isBlank() ? null : value.trim();
    }

    private record RequiredSetting(String propertyKey, String environmentVariable) {}
}
