package scenerelay.coordinator.core;

import org.junit.jupiter.api.Test;
import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.Product;
import scenerelay.coordinator.model.StageId;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePlanTest {

    @Test
    void stagesOneAndFourAlwaysRun() {
        PipelinePlan plan = PipelinePlan.from(EnumSet.of(Product.TOA));

        assertTrue(plan.runs(StageId.STAGE1));
        assertFalse(plan.runs(StageId.STAGE2));
        assertFalse(plan.runs(StageId.STAGE3));
        assertTrue(plan.runs(StageId.STAGE4));
        assertFalse(plan.aggregatesAot());
    }

    @Test
    void srefEnablesRadiativeCorrection() {
        PipelinePlan plan = PipelinePlan.from(EnumSet.of(Product.SREF));
        assertTrue(plan.runs(StageId.STAGE2));
        assertFalse(plan.runs(StageId.STAGE3));
    }

    @Test
    void metadataEnablesExport() {
        PipelinePlan plan = PipelinePlan.from(EnumSet.of(Product.TOA, Product.METADATA));
        assertTrue(plan.runs(StageId.STAGE3));
    }

    @Test
    void singleValueAotEstimateEnablesAggregation() {
        PipelinePlan plan = PipelinePlan.from(EnumSet.of(Product.DOSAOTSGL, Product.SREF));
        assertTrue(plan.aggregatesAot());
        assertTrue(plan.runs(StageId.STAGE2));
    }

    @Test
    void aotImagesAreRejected() {
        assertThrows(ConfigurationException.class, () -> PipelinePlan.from(EnumSet.of(Product.DDVAOT)));
        assertThrows(ConfigurationException.class,
                () -> PipelinePlan.from(EnumSet.of(Product.SREF, Product.DOSAOT)));
    }
}
