package scenerelay.coordinator.model;

/**
 * Processing stage of the per-scene pipeline.
 * Stages are strictly ordered; declaration order is execution order.
 */
public enum StageId {
    /** Radiance, top-of-atmosphere reflectance and AOT estimation */
    STAGE1("initial correction"),
    /** Radiative-transfer surface reflectance */
    STAGE2("radiative correction"),
    /** Metadata export */
    STAGE3("metadata export"),
    /** Final products and clean-up */
    STAGE4("finalisation");

    private final String description;

    StageId(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }

    /** 1-based stage number, as used in log output. */
    public int number() {
        return ordinal() + 1;
    }

    public boolean isAfter(StageId other) {
        return other == null || ordinal() > other.ordinal();
    }
}
