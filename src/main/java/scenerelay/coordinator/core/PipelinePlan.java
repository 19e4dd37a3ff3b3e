package scenerelay.coordinator.core;

import scenerelay.coordinator.exception.ConfigurationException;
import scenerelay.coordinator.model.Product;
import scenerelay.coordinator.model.StageId;

import java.util.Set;

/**
 * Which stages a run executes, derived from the requested products.
 * Stages 1 and 4 always run.
 */
public final class PipelinePlan {

    private final boolean radiativeCorrection;
    private final boolean metadataExport;
    private final boolean aotAggregation;

    private PipelinePlan(boolean radiativeCorrection, boolean metadataExport, boolean aotAggregation) {
        this.radiativeCorrection = radiativeCorrection;
        this.metadataExport = metadataExport;
        this.aotAggregation = aotAggregation;
    }

    /**
     * @throws ConfigurationException if the products cannot be produced in a multi-scene run
     */
    public static PipelinePlan from(Set<Product> products) {
        if (Product.anyOf(products, Product.AOT_IMAGE)) {
            throw new ConfigurationException("Merging AOT images (" + Product.AOT_IMAGE
                    + ") across multiple scenes is not supported");
        }
        return new PipelinePlan(
                products.contains(Product.SREF),
                products.contains(Product.METADATA),
                Product.anyOf(products, Product.AOT_ESTIMATING));
    }

    public static PipelinePlan of(boolean radiativeCorrection, boolean metadataExport, boolean aotAggregation) {
        return new PipelinePlan(radiativeCorrection, metadataExport, aotAggregation);
    }

    public static PipelinePlan all() {
        return new PipelinePlan(true, true, true);
    }

    public boolean runs(StageId stage) {
        return switch (stage) {
            case STAGE2 -> radiativeCorrection;
            case STAGE3 -> metadataExport;
            default -> true;
        };
    }

    public boolean aggregatesAot() {
        return aotAggregation;
    }

    @Override
    public String toString() {
        return "PipelinePlan{stage2=" + radiativeCorrection + ", stage3=" + metadataExport
                + ", aotAggregation=" + aotAggregation + '}';
    }
}
