package org.cloudvision.scalp.config;

import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Signal engine wiring: binds {@link ScalpSignalProperties} and publishes the clock
 * read once per request by the REST layer.
 */
@Configuration
@EnableConfigurationProperties(ScalpSignalProperties.class)
public class ScalpSignalConfig {

    private static final Logger logger = LoggerFactory.getLogger(ScalpSignalConfig.class);

    private final ScalpSignalProperties properties;

    public ScalpSignalConfig(ScalpSignalProperties properties) {
        this.properties = properties;
    }

    @PostConstruct
    public void logSettings() {
        logger.info("⚙️ Scalp signal engine: RVOL>={} ADX trend>={} chop<{} push>={} cooldown={}",
            properties.getRvolThreshold(), properties.getAdxTrendThreshold(),
            properties.getAdxChopThreshold(), properties.getPushConfidenceThreshold(),
            properties.getOppositeDirectionCooldown());
    }

    @Bean
    public Clock signalClock() {
        return Clock.systemUTC();
    }
}
