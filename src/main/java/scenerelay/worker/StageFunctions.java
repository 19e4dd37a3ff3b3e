package scenerelay.worker;

import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.StageId;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The four pluggable stage functions a worker executes.
 *
 * Launcher-loaded implementations need a public no-argument constructor.
 */
public interface StageFunctions {

    StageFunction forStage(StageId stage);

    static StageFunctions of(StageFunction stage1, StageFunction stage2,
            StageFunction stage3, StageFunction stage4) {
        Map<StageId, StageFunction> byStage = new EnumMap<>(StageId.class);
        byStage.put(StageId.STAGE1, Objects.requireNonNull(stage1, "stage1"));
        byStage.put(StageId.STAGE2, Objects.requireNonNull(stage2, "stage2"));
        byStage.put(StageId.STAGE3, Objects.requireNonNull(stage3, "stage3"));
        byStage.put(StageId.STAGE4, Objects.requireNonNull(stage4, "stage4"));
        return byStage::get;
    }

    /**
     * Instantiate a provider class by name.
     *
     * @throws ConfigurationException if the class is missing, cannot be
     *         instantiated, or is not a {@code StageFunctions}
     */
    static StageFunctions load(String className) {
        if (className == null || className.isBlank()) {
            throw new ConfigurationException("No stage provider configured ([STAGES] provider)");
        }
        Class<?> type;
        try {
            type = Class.forName(className.trim());
        } catch (ClassNotFoundException e) {
            throw new ConfigurationException("Stage provider class not found: " + className, e);
        }
        if (!StageFunctions.class.isAssignableFrom(type)) {
            throw new ConfigurationException(className + " does not implement " + StageFunctions.class.getName());
        }
        try {
            return (StageFunctions) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new ConfigurationException("Cannot instantiate stage provider " + className + ": " + e, e);
        }
    }
}
