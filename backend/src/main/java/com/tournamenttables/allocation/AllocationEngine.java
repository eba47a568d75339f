package com.tournamenttables.allocation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Assigns the pairings of one round to tables.
 *
 * <p>Round 1 defers to the externally suggested table numbers, repairing missing, unknown and
 * duplicate suggestions with the lowest free table. Later rounds seat pairings greedily in
 * score order, each taking the cheapest free table according to {@link CostCalculator}.
 *
 * <p>No state is kept between calls. Tables are sorted by number before any scan, so equal-cost
 * candidates resolve to the lowest table number unless one of them is the suggested table.
 */
@Component
public class AllocationEngine {

    private static final Logger log = LoggerFactory.getLogger(AllocationEngine.class);

    static final String BYE_REASON = "Bye - no opponent this round";
    static final String CLEAN_SUMMARY = "All allocations optimal - no constraint violations.";
    static final String ROUND_ONE_SUMMARY = "Round 1 allocations use original table assignments.";

    private static final Comparator<RankedPairing> SEATING_ORDER =
            Comparator.comparingInt(RankedPairing::combinedTotalScore)
                    .reversed()
                    .thenComparing(RankedPairing::minCompetitorId)
                    .thenComparingInt(RankedPairing::inputIndex);

    private final CostCalculator costCalculator;

    public AllocationEngine(CostCalculator costCalculator) {
        this.costCalculator = costCalculator;
    }

    public AllocationResult generate(
            List<Pairing> pairings,
            List<TableOption> tables,
            int roundNumber,
            HistoryProvider history,
            OffsetDateTime generatedAt
    ) {
        if (roundNumber < 1) {
            throw new IllegalArgumentException("Round number must be at least 1: " + roundNumber);
        }
        Objects.requireNonNull(pairings, "pairings");
        Objects.requireNonNull(history, "history");
        Objects.requireNonNull(generatedAt, "generatedAt");

        Map<Integer, TableOption> tablesByNumber = indexTables(tables);

        List<Pairing> regularPairings = new ArrayList<>();
        List<Pairing> byePairings = new ArrayList<>();
        for (Pairing pairing : pairings) {
            if (pairing.isBye()) {
                byePairings.add(pairing);
            } else {
                regularPairings.add(pairing);
            }
        }

        boolean round1 = roundNumber == 1;
        List<AllocationDecision> decisions = round1
                ? passThrough(regularPairings, tablesByNumber, generatedAt)
                : seatGreedily(regularPairings, tablesByNumber, roundNumber, history, generatedAt);

        List<AllocationConflict> conflicts = new ArrayList<>();
        for (AllocationDecision decision : decisions) {
            conflicts.addAll(decision.conflicts());
        }
        for (Pairing byePairing : byePairings) {
            decisions.add(byeDecision(byePairing, round1, generatedAt));
        }

        String summary = round1 ? summarizeRoundOne(conflicts) : summarize(conflicts);
        if (conflicts.isEmpty()) {
            log.info("Round {}: seated {} pairing(s) and {} bye(s). {}",
                    roundNumber, regularPairings.size(), byePairings.size(), summary);
        } else {
            log.warn("Round {}: seated {} pairing(s) and {} bye(s). {}",
                    roundNumber, regularPairings.size(), byePairings.size(), summary);
        }
        return new AllocationResult(decisions, conflicts, summary);
    }

    /**
     * Order in which regular pairings pick tables: combined tournament score descending, then the
     * smaller competitor id ascending, then input position.
     */
    public List<Pairing> seatingOrder(List<Pairing> regularPairings) {
        List<RankedPairing> ranked = new ArrayList<>(regularPairings.size());
        for (int i = 0; i < regularPairings.size(); i++) {
            Pairing pairing = regularPairings.get(i);
            ranked.add(new RankedPairing(pairing, pairing.combinedTotalScore(), pairing.minCompetitorId(), i));
        }
        ranked.sort(SEATING_ORDER);

        List<Pairing> ordered = new ArrayList<>(ranked.size());
        for (RankedPairing rankedPairing : ranked) {
            ordered.add(rankedPairing.pairing());
        }
        return ordered;
    }

    private List<AllocationDecision> passThrough(
            List<Pairing> pairings,
            Map<Integer, TableOption> tablesByNumber,
            OffsetDateTime generatedAt
    ) {
        Set<Integer> claimed = new HashSet<>();
        List<AllocationDecision> decisions = new ArrayList<>(pairings.size());

        for (Pairing pairing : pairings) {
            Integer suggested = pairing.suggestedTableNumber();
            Integer tableNumber = suggested;
            String reason;
            List<AllocationConflict> conflicts = new ArrayList<>();

            if (suggested == null) {
                reason = "Round 1 - suggested table number missing, assigned next available";
                tableNumber = null;
            } else if (!tablesByNumber.containsKey(suggested)) {
                reason = "Round 1 - suggested table " + suggested + " not in tournament tables, assigned next available";
                tableNumber = null;
            } else if (claimed.contains(suggested)) {
                reason = "Round 1 - suggested table " + suggested + " already assigned, assigned next available";
                tableNumber = null;
            } else {
                reason = "Round 1 - using original table assignment";
            }

            if (tableNumber == null) {
                tableNumber = lowestUnclaimed(tablesByNumber, claimed);
                if (tableNumber == null) {
                    reason = "Round 1 - no table left for this pairing";
                    conflicts.add(AllocationConflict.noTableAvailable(
                            "No available tables for pairing " + pairing.describe()));
                    log.warn("Round 1: no table left for {}", pairing.describe());
                }
            }
            if (tableNumber != null) {
                claimed.add(tableNumber);
            }

            AuditRecord audit = new AuditRecord(
                    generatedAt,
                    0,
                    CostBreakdown.zero(),
                    List.of(reason),
                    Map.of(),
                    true,
                    false,
                    conflicts
            );
            decisions.add(decision(pairing, tableNumber != null ? tablesByNumber.get(tableNumber) : null, audit));
        }
        return decisions;
    }

    private List<AllocationDecision> seatGreedily(
            List<Pairing> pairings,
            Map<Integer, TableOption> tablesByNumber,
            int roundNumber,
            HistoryProvider history,
            OffsetDateTime generatedAt
    ) {
        List<Pairing> ordered = seatingOrder(pairings);
        Set<Integer> claimed = new HashSet<>();
        List<AllocationDecision> decisions = new ArrayList<>(ordered.size());

        for (int i = 0; i < ordered.size(); i++) {
            int pairingsRemaining = ordered.size() - i;
            int tablesRemaining = tablesByNumber.size() - claimed.size();
            if (pairingsRemaining > tablesRemaining) {
                throw new InsufficientTablesException(roundNumber, pairingsRemaining, tablesRemaining);
            }

            AllocationDecision decision = seatPairing(ordered.get(i), tablesByNumber, claimed, history, generatedAt);
            claimed.add(decision.tableNumber());
            decisions.add(decision);
        }
        return decisions;
    }

    private AllocationDecision seatPairing(
            Pairing pairing,
            Map<Integer, TableOption> tablesByNumber,
            Set<Integer> claimed,
            HistoryProvider history,
            OffsetDateTime generatedAt
    ) {
        TableOption bestTable = null;
        CostResult bestCost = null;
        Map<Integer, Integer> alternatives = new TreeMap<>();

        for (TableOption table : tablesByNumber.values()) {
            if (claimed.contains(table.tableNumber())) {
                continue;
            }
            CostResult cost = costCalculator.calculate(pairing, table, history);
            alternatives.put(table.tableNumber(), cost.totalCost());

            if (bestCost == null
                    || cost.totalCost() < bestCost.totalCost()
                    || (cost.totalCost() == bestCost.totalCost()
                    && Objects.equals(pairing.suggestedTableNumber(), table.tableNumber()))) {
                bestTable = table;
                bestCost = cost;
            }
        }

        if (bestTable == null) {
            throw new IllegalStateException("No free table left for " + pairing.describe());
        }
        alternatives.remove(bestTable.tableNumber());

        log.debug("Seated {} at table {} (cost {})", pairing.describe(), bestTable.tableNumber(), bestCost.totalCost());
        AuditRecord audit = new AuditRecord(
                generatedAt,
                bestCost.totalCost(),
                bestCost.breakdown(),
                bestCost.reasons(),
                alternatives,
                false,
                false,
                bestCost.conflicts()
        );
        return decision(pairing, bestTable, audit);
    }

    private AllocationDecision byeDecision(Pairing pairing, boolean round1, OffsetDateTime generatedAt) {
        AuditRecord audit = new AuditRecord(
                generatedAt,
                0,
                CostBreakdown.zero(),
                List.of(BYE_REASON),
                Map.of(),
                round1,
                true,
                List.of()
        );
        return new AllocationDecision(null, null, pairing.competitorA(), null, null, audit);
    }

    private static AllocationDecision decision(Pairing pairing, TableOption table, AuditRecord audit) {
        return new AllocationDecision(
                table != null ? table.tableNumber() : null,
                table != null ? table.terrainTypeName() : null,
                pairing.competitorA(),
                pairing.competitorB(),
                pairing.suggestedTableNumber(),
                audit
        );
    }

    private static Map<Integer, TableOption> indexTables(List<TableOption> tables) {
        Objects.requireNonNull(tables, "tables");
        List<TableOption> sorted = new ArrayList<>(tables);
        sorted.sort(Comparator.comparingInt(TableOption::tableNumber));

        Map<Integer, TableOption> tablesByNumber = new LinkedHashMap<>();
        for (TableOption table : sorted) {
            if (tablesByNumber.putIfAbsent(table.tableNumber(), table) != null) {
                throw new IllegalArgumentException("Duplicate table number: " + table.tableNumber());
            }
        }
        return tablesByNumber;
    }

    private static Integer lowestUnclaimed(Map<Integer, TableOption> tablesByNumber, Set<Integer> claimed) {
        for (Integer tableNumber : tablesByNumber.keySet()) {
            if (!claimed.contains(tableNumber)) {
                return tableNumber;
            }
        }
        return null;
    }

    private static String summarizeRoundOne(List<AllocationConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return ROUND_ONE_SUMMARY;
        }
        return "Round 1 allocations generated with " + conflicts.size() + " conflict(s).";
    }

    private static String summarize(List<AllocationConflict> conflicts) {
        if (conflicts.isEmpty()) {
            return CLEAN_SUMMARY;
        }

        long tableReuse = conflicts.stream().filter(c -> c.type() == ConflictType.TABLE_REUSE).count();
        long terrainReuse = conflicts.stream().filter(c -> c.type() == ConflictType.TERRAIN_REUSE).count();

        List<String> parts = new ArrayList<>(2);
        if (tableReuse > 0) {
            parts.add(tableReuse + " table reuse conflict(s)");
        }
        if (terrainReuse > 0) {
            parts.add(terrainReuse + " terrain reuse conflict(s)");
        }
        return "Best effort allocation with " + String.join(", ", parts) + ".";
    }

    private record RankedPairing(
            Pairing pairing,
            int combinedTotalScore,
            String minCompetitorId,
            int inputIndex
    ) {
    }
}
