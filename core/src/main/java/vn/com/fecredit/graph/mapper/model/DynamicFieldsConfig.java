package vn.com.fecredit.graph.mapper.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.Set;

public final class DynamicFieldsConfig {

    public static final DynamicFieldsConfig DISABLED = new DynamicFieldsConfig(false, Set.of(), Set.of());

    private final boolean enabled;
    private final Set<NebulaType> allowedTypes;
    private final Set<String> excludedProperties;

    public DynamicFieldsConfig(boolean enabled, Set<NebulaType> allowedTypes, Set<String> excludedProperties) {
        this.enabled = enabled;
        this.allowedTypes = allowedTypes == null || allowedTypes.isEmpty()
                ? Set.of() : Collections.unmodifiableSet(EnumSet.copyOf(allowedTypes));
        this.excludedProperties = excludedProperties == null
                ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(excludedProperties));
    }

    public static DynamicFieldsConfig enabled() {
        return new DynamicFieldsConfig(true, Set.of(), Set.of());
    }

    public boolean isEnabled() { return enabled; }

    /** Empty means every inferred type is allowed. */
    public Set<NebulaType> getAllowedTypes() { return allowedTypes; }

    public Set<String> getExcludedProperties() { return excludedProperties; }

    public boolean allows(NebulaType type) {
        return allowedTypes.isEmpty() || allowedTypes.contains(type);
    }
}
