package com.tournamenttables.allocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One matchup for the round being generated. Built fresh for each generation run and never
 * persisted as such.
 *
 * <p>A bye has all four competitor B fields absent; a regular pairing has at least B's id and
 * name. Tournament-to-date totals may be null when unknown and then count as zero.
 */
public record Pairing(
        String competitorAId,
        String competitorAName,
        int competitorAScore,
        Integer competitorATotalScore,
        String competitorBId,
        String competitorBName,
        Integer competitorBScore,
        Integer competitorBTotalScore,
        Integer suggestedTableNumber
) {
    public Pairing {
        Objects.requireNonNull(competitorAId, "competitorAId");
        Objects.requireNonNull(competitorAName, "competitorAName");
        if (competitorBId == null) {
            if (competitorBName != null || competitorBScore != null || competitorBTotalScore != null) {
                throw new IllegalArgumentException(
                        "Bye pairing for " + competitorAId + " must not carry competitor B fields");
            }
        } else {
            Objects.requireNonNull(competitorBName, "competitorBName");
            if (competitorBId.equals(competitorAId)) {
                throw new IllegalArgumentException("Competitor cannot be paired with itself: " + competitorAId);
            }
        }
    }

    public static Pairing of(
            String competitorAId,
            String competitorAName,
            int competitorAScore,
            Integer competitorATotalScore,
            String competitorBId,
            String competitorBName,
            int competitorBScore,
            Integer competitorBTotalScore,
            Integer suggestedTableNumber
    ) {
        return new Pairing(
                competitorAId,
                competitorAName,
                competitorAScore,
                competitorATotalScore,
                competitorBId,
                competitorBName,
                competitorBScore,
                competitorBTotalScore,
                suggestedTableNumber
        );
    }

    public static Pairing bye(String competitorId, String competitorName, int score, Integer totalScore) {
        return new Pairing(competitorId, competitorName, score, totalScore, null, null, null, null, null);
    }

    public boolean isBye() {
        return competitorBId == null;
    }

    /**
     * Combined tournament-to-date score; the primary seating key.
     */
    public int combinedTotalScore() {
        return orZero(competitorATotalScore) + orZero(competitorBTotalScore);
    }

    public String minCompetitorId() {
        if (isBye() || competitorAId.compareTo(competitorBId) <= 0) {
            return competitorAId;
        }
        return competitorBId;
    }

    public CompetitorSnapshot competitorA() {
        return new CompetitorSnapshot(competitorAId, competitorAName, competitorAScore);
    }

    public CompetitorSnapshot competitorB() {
        if (isBye()) {
            return null;
        }
        return new CompetitorSnapshot(competitorBId, competitorBName, orZero(competitorBScore));
    }

    public List<CompetitorSnapshot> competitors() {
        List<CompetitorSnapshot> competitors = new ArrayList<>(2);
        competitors.add(competitorA());
        if (!isBye()) {
            competitors.add(competitorB());
        }
        return Collections.unmodifiableList(competitors);
    }

    String describe() {
        return isBye() ? competitorAName + " (bye)" : competitorAName + " vs " + competitorBName;
    }

    private static int orZero(Integer value) {
        return value != null ? value : 0;
    }
}
