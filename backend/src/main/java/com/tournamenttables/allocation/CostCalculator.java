package com.tournamenttables.allocation;

import com.tournamenttables.config.AllocationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Priority-weighted cost of seating one pairing at one table.
 *
 * <ol>
 *     <li>table reuse, per competitor who already played at the table</li>
 *     <li>terrain reuse, per competitor who already played the table's terrain</li>
 *     <li>table number, so that among equally safe tables the lowest number is cheapest</li>
 * </ol>
 *
 * Weights are validated on construction so that no lower tier can flip a higher tier's decision.
 * The calculator holds no per-run state.
 */
@Component
public class CostCalculator {

    private final int tableReuseWeight;
    private final int terrainReuseWeight;
    private final int tableNumberWeight;

    public CostCalculator(AllocationProperties properties) {
        properties.validateTierDominance();
        AllocationProperties.Weights weights = properties.getAllocation().getWeights();
        this.tableReuseWeight = weights.getTableReuse();
        this.terrainReuseWeight = weights.getTerrainReuse();
        this.tableNumberWeight = weights.getTableNumber();
    }

    public CostResult calculate(Pairing pairing, TableOption table, HistoryProvider history) {
        ReuseAssessment reuse = assessReuse(pairing.competitors(), table, history);

        int tableNumberCost = table.tableNumber() * tableNumberWeight;
        List<String> reasons = new ArrayList<>(reuse.reasons());
        reasons.add("Table " + table.tableNumber() + " number preference adds " + tableNumberCost);

        CostBreakdown breakdown = CostBreakdown.generated(
                reuse.tableReuseCost(),
                reuse.terrainReuseCost(),
                tableNumberCost
        );
        return new CostResult(breakdown.total(), breakdown, reasons, reuse.conflicts());
    }

    /**
     * Tier 1 and tier 2 only. Used to recompute conflicts after a manual edit, where no
     * competing tables are scored.
     */
    public ReuseAssessment assessReuse(
            Collection<CompetitorSnapshot> competitors,
            TableOption table,
            HistoryProvider history
    ) {
        int tableReuseCost = 0;
        int terrainReuseCost = 0;
        List<String> reasons = new ArrayList<>();
        List<AllocationConflict> conflicts = new ArrayList<>();

        for (CompetitorSnapshot competitor : competitors) {
            if (history.hasUsedTable(competitor.id(), table.tableNumber())) {
                tableReuseCost += tableReuseWeight;
                String reason = competitor.label() + " previously played on table " + table.tableNumber();
                reasons.add(reason);
                conflicts.add(AllocationConflict.tableReuse(competitor.id(), reason));
            }
        }

        if (table.hasTerrain()) {
            for (CompetitorSnapshot competitor : competitors) {
                if (history.hasExperiencedTerrain(competitor.id(), table.terrainTypeId())) {
                    terrainReuseCost += terrainReuseWeight;
                    String reason = competitor.label() + " previously experienced " + table.terrainLabel();
                    reasons.add(reason);
                    conflicts.add(AllocationConflict.terrainReuse(competitor.id(), reason));
                }
            }
        }

        return new ReuseAssessment(tableReuseCost, terrainReuseCost, reasons, conflicts);
    }

    /**
     * Cost of keeping a pairing away from its externally suggested table after a manual edit.
     * Zero when there is no suggestion or the suggestion is honored.
     */
    public int suggestionMismatchCost(Integer suggestedTableNumber, int tableNumber) {
        if (suggestedTableNumber == null || suggestedTableNumber == tableNumber) {
            return 0;
        }
        return tableNumberWeight;
    }
}
