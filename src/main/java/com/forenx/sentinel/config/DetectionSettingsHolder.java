package com.forenx.sentinel.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the active {@link DetectionSettings}. Updates are validated before they are swapped in;
 * a rejected update leaves the previous snapshot active.
 */
@Component
public class DetectionSettingsHolder {

    private static final Logger log = LoggerFactory.getLogger(DetectionSettingsHolder.class);

    private final AtomicReference<DetectionSettings> current;

    @Autowired
    public DetectionSettingsHolder(SentinelProperties properties) {
        this(DetectionSettings.from(properties));
    }

    public DetectionSettingsHolder(DetectionSettings initial) {
        this.current = new AtomicReference<>(initial.validate());
    }

    public DetectionSettings get() {
        return current.get();
    }

    /**
     * @throws ClassifierConfigException if the new settings are invalid
     */
    public DetectionSettings update(DetectionSettings settings) {
        settings.validate();
        DetectionSettings previous = current.getAndSet(settings);
        log.info("Detection settings reloaded (auth {}@{}, rate {}@{}, bytes {}@{}, coalescing {})",
            settings.getAuthThreshold(), settings.getAuthWindow(),
            settings.getRateThreshold(), settings.getRateWindow(),
            settings.getBytesThreshold(), settings.getVolumeWindow(),
            settings.getCoalescingInterval());
        return previous;
    }

    public synchronized DetectionSettings apply(DetectionSettingsUpdate update) {
        DetectionSettings next = update.applyTo(get());
        update(next);
        return next;
    }
}
