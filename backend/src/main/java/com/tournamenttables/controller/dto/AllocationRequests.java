package com.tournamenttables.controller.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

public final class AllocationRequests {

    private AllocationRequests() {
    }

    /**
     * Without pairings the round is regenerated from its stored allocations.
     */
    public record GenerateRoundRequest(
            @Valid
            List<@NotNull(message = "pairings must not contain null entries") PairingRequest> pairings
    ) {
    }

    public record PairingRequest(
            @NotBlank(message = "competitorAId is required")
            @Size(max = 64, message = "competitorAId must be at most 64 characters")
            String competitorAId,

            @NotBlank(message = "competitorAName is required")
            String competitorAName,

            @NotNull(message = "competitorAScore is required")
            Integer competitorAScore,

            Integer competitorATotalScore,

            @Size(max = 64, message = "competitorBId must be at most 64 characters")
            String competitorBId,

            String competitorBName,

            Integer competitorBScore,

            Integer competitorBTotalScore,

            @Positive(message = "suggestedTableNumber must be positive")
            Integer suggestedTableNumber
    ) {
        @AssertTrue(message = "a pairing with competitorBId also needs competitorBName and competitorBScore")
        public boolean isCompetitorBComplete() {
            if (competitorBId == null) {
                return competitorBName == null && competitorBScore == null && competitorBTotalScore == null;
            }
            return competitorBName != null && !competitorBName.isBlank() && competitorBScore != null;
        }
    }

    public record ReassignRequest(
            @NotNull(message = "tableNumber is required")
            @Positive(message = "tableNumber must be positive")
            Integer tableNumber
    ) {
    }

    public record SwapRequest(
            @NotNull(message = "allocationId1 is required")
            Long allocationId1,

            @NotNull(message = "allocationId2 is required")
            Long allocationId2
    ) {
    }
}
