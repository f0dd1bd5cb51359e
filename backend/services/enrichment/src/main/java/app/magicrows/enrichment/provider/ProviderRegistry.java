package app.magicrows.enrichment.provider;

import app.magicrows.enrichment.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, ProviderProfile> profiles;

    public ProviderRegistry(Collection<ProviderProfile> profiles) {
        if (profiles == null || profiles.isEmpty()) {
            throw new ConfigurationException("At least one provider profile must be supplied");
        }
        Map<String, ProviderProfile> resolved = new LinkedHashMap<>();
        for (ProviderProfile profile : profiles) {
            ProviderProfile previous = resolved.put(profile.name(), profile);
            if (previous != null) {
                log.warn("Duplicate provider profile name={} previousType={} type={}; keeping the last one",
                        profile.name(), previous.type().value(), profile.type().value());
            }
            log.info("Registered provider profile name={} type={}", profile.name(), profile.type().value());
        }
        this.profiles = Collections.unmodifiableMap(resolved);
    }

    public ProviderProfile require(String name) {
        ProviderProfile profile = profiles.get(name);
        if (profile == null) {
            throw new ConfigurationException(
                    "Provider '" + name + "' is not registered; known providers: " + profiles.keySet());
        }
        return profile;
    }

    public Map<String, ProviderProfile> profiles() {
        return profiles;
    }
}
