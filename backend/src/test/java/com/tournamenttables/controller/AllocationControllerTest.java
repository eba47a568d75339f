package com.tournamenttables.controller;

import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.AuditRecord;
import com.tournamenttables.allocation.CostBreakdown;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.model.Allocation;
import com.tournamenttables.service.AdjustmentResult;
import com.tournamenttables.service.AllocationEditService;
import com.tournamenttables.web.AllocationRequestException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.orm.ObjectOptimisticLockingFailureException;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(AllocationController.class)
@Import(AllocationResponseMapper.class)
class AllocationControllerTest {

    private static final OffsetDateTime EDITED_AT = OffsetDateTime.parse("2026-03-14T10:15:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private AllocationEditService allocationEditService;

    @Test
    void reassign_returnsAuditAndConflicts() throws Exception {
        AllocationConflict reuse = AllocationConflict.tableReuse("alice", "Alice (alice) already played on table 3");
        AuditRecord audit = new AuditRecord(
                EDITED_AT,
                100_001,
                CostBreakdown.edited(100_000, 0, 1),
                List.of("Manually reassigned from table 1 to table 3", "Table 3 previously used by Alice (alice)"),
                Map.of(),
                false,
                false,
                List.of(reuse)
        );
        when(allocationEditService.reassign(500L, 3)).thenReturn(new AdjustmentResult(List.of(
                new AdjustmentResult.AdjustedAllocation(500L, 1, 3, audit)
        )));

        mockMvc.perform(patch("/api/allocations/{allocationId}", 500L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": 3}
                                """))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.allocations[0].allocationId").value(500))
                .andExpect(jsonPath("$.allocations[0].previousTableNumber").value(1))
                .andExpect(jsonPath("$.allocations[0].tableNumber").value(3))
                .andExpect(jsonPath("$.allocations[0].reason.totalCost").value(100001))
                .andExpect(jsonPath("$.allocations[0].reason.costBreakdown.bcpMismatch").value(1))
                .andExpect(jsonPath("$.allocations[0].reason.reasons[0]")
                        .value("Manually reassigned from table 1 to table 3"))
                .andExpect(jsonPath("$.conflicts[0].type").value("TABLE_REUSE"))
                .andExpect(jsonPath("$.conflicts[0].competitorId").value("alice"));
    }

    @Test
    void reassign_mapsOccupiedTableToConflict() throws Exception {
        when(allocationEditService.reassign(500L, 2))
                .thenThrow(AllocationRequestException.tableOccupied("Table 2 is already assigned to allocation 501"));

        mockMvc.perform(patch("/api/allocations/{allocationId}", 500L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"tableNumber": 2}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("table_occupied"))
                .andExpect(jsonPath("$.message").value("Table 2 is already assigned to allocation 501"));
    }

    @Test
    void reassign_rejectsMissingTableNumber() throws Exception {
        mockMvc.perform(patch("/api/allocations/{allocationId}", 500L)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.fieldErrors.tableNumber").value("tableNumber is required"));

        verifyNoInteractions(allocationEditService);
    }

    @Test
    void swap_mapsCrossRoundRequestToBadRequest() throws Exception {
        when(allocationEditService.swap(500L, 900L))
                .thenThrow(AllocationRequestException.crossRoundSwap("Allocations 500 and 900 belong to different rounds"));

        mockMvc.perform(post("/api/allocations/swap")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"allocationId1": 500, "allocationId2": 900}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("cross_round_swap"));
    }

    @Test
    void swap_mapsStaleVersionToConcurrentModification() throws Exception {
        when(allocationEditService.swap(500L, 501L))
                .thenThrow(new ObjectOptimisticLockingFailureException(Allocation.class, 500L));

        mockMvc.perform(post("/api/allocations/swap")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"allocationId1": 500, "allocationId2": 501}
                                """))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("concurrent_modification"));
    }
}
