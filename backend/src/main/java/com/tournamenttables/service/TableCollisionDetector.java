package com.tournamenttables.service;

import com.tournamenttables.model.Allocation;
import com.tournamenttables.repository.AllocationRepository;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reports tables held by more than one allocation of a round. The unique index on
 * {@code allocations(round_id, table_id)} should make this impossible; the round view still
 * checks so that a broken invariant is visible to the organizer.
 */
@Component
public class TableCollisionDetector {

    private final AllocationRepository allocationRepository;

    public TableCollisionDetector(AllocationRepository allocationRepository) {
        this.allocationRepository = allocationRepository;
    }

    public boolean hasCollisions(Long roundId) {
        return !allocationRepository.findCollidingTableNumbers(roundId).isEmpty();
    }

    public List<TableCollision> findCollisions(Long roundId) {
        if (!hasCollisions(roundId)) {
            return List.of();
        }
        return findCollisions(allocationRepository.findByRoundIdOrderByTableNumber(roundId));
    }

    List<TableCollision> findCollisions(List<Allocation> allocations) {
        Map<Integer, List<Long>> allocationIdsByTable = new LinkedHashMap<>();
        for (Allocation allocation : allocations) {
            Integer tableNumber = allocation.getTableNumber();
            if (tableNumber != null) {
                allocationIdsByTable.computeIfAbsent(tableNumber, ignored -> new ArrayList<>()).add(allocation.getId());
            }
        }

        List<TableCollision> collisions = new ArrayList<>();
        allocationIdsByTable.forEach((tableNumber, allocationIds) -> {
            if (allocationIds.size() > 1) {
                collisions.add(new TableCollision(tableNumber, allocationIds));
            }
        });
        return collisions;
    }

    public record TableCollision(
            int tableNumber,
            List<Long> allocationIds
    ) {
        public TableCollision {
            allocationIds = List.copyOf(allocationIds);
        }
    }
}
