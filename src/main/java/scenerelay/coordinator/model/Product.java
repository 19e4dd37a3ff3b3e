package scenerelay.coordinator.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Locale;

/**
 * Output products a run can be asked to generate.
 */
public enum Product {
    RAD,
    SATURATE,
    TOA,
    DOS,
    SREF,
    DDVAOT,
    DOSAOT,
    DOSAOTSGL,
    THERMAL,
    CLOUDS,
    TOPOSHADOW,
    FOOTPRINT,
    METADATA,
    SHARP,
    STDSREF;

    /** Products that estimate the aerosol optical thickness per scene. */
    public static final EnumSet<Product> AOT_ESTIMATING = EnumSet.of(DDVAOT, DOSAOT, DOSAOTSGL);

    /** Products whose AOT estimate is an image rather than a single value. */
    public static final EnumSet<Product> AOT_IMAGE = EnumSet.of(DDVAOT, DOSAOT);

    public static Product parse(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("product name is required");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown product: " + name.trim());
        }
    }

    public static boolean anyOf(Collection<Product> requested, EnumSet<Product> group) {
        for (Product p : requested) {
            if (group.contains(p)) {
                return true;
            }
        }
        return false;
    }
}
