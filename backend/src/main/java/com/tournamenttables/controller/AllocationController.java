package com.tournamenttables.controller;

import com.tournamenttables.controller.dto.AllocationRequests;
import com.tournamenttables.controller.dto.AllocationResponses;
import com.tournamenttables.mapper.AllocationResponseMapper;
import com.tournamenttables.service.AdjustmentResult;
import com.tournamenttables.service.AllocationEditService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/allocations")
public class AllocationController {

    private final AllocationEditService allocationEditService;
    private final AllocationResponseMapper allocationResponseMapper;

    public AllocationController(
            AllocationEditService allocationEditService,
            AllocationResponseMapper allocationResponseMapper
    ) {
        this.allocationEditService = allocationEditService;
        this.allocationResponseMapper = allocationResponseMapper;
    }

    @PatchMapping("/{allocationId}")
    public ResponseEntity<AllocationResponses.AdjustmentResponse> reassign(
            @PathVariable Long allocationId,
            @Valid @RequestBody AllocationRequests.ReassignRequest request
    ) {
        AdjustmentResult result = allocationEditService.reassign(allocationId, request.tableNumber());
        return ResponseEntity.ok(allocationResponseMapper.toAdjustmentResponse(result));
    }

    @PostMapping("/swap")
    public ResponseEntity<AllocationResponses.AdjustmentResponse> swap(
            @Valid @RequestBody AllocationRequests.SwapRequest request
    ) {
        AdjustmentResult result = allocationEditService.swap(request.allocationId1(), request.allocationId2());
        return ResponseEntity.ok(allocationResponseMapper.toAdjustmentResponse(result));
    }
}
