package com.tournamenttables.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tournamenttables.allocation.AllocationConflict;
import com.tournamenttables.allocation.AuditRecord;
import com.tournamenttables.allocation.ConflictType;
import com.tournamenttables.allocation.CostBreakdown;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts {@link AuditRecord} to and from the JSON stored in {@code allocations.allocation_reason}
 * and {@code allocation_audit_log.reason_json}.
 */
public final class AuditRecordJsonCodec {

    private static final String FIELD_TIMESTAMP = "timestamp";
    private static final String FIELD_TOTAL_COST = "totalCost";
    private static final String FIELD_COST_BREAKDOWN = "costBreakdown";
    private static final String FIELD_TABLE_REUSE = "tableReuse";
    private static final String FIELD_TERRAIN_REUSE = "terrainReuse";
    private static final String FIELD_TABLE_NUMBER = "tableNumber";
    private static final String FIELD_BCP_MISMATCH = "bcpMismatch";
    private static final String FIELD_REASONS = "reasons";
    private static final String FIELD_ALTERNATIVES = "alternativesConsidered";
    private static final String FIELD_IS_ROUND_1 = "isRound1";
    private static final String FIELD_IS_BYE = "isBye";
    private static final String FIELD_CONFLICTS = "conflicts";
    private static final String FIELD_TYPE = "type";
    private static final String FIELD_MESSAGE = "message";
    private static final String FIELD_COMPETITOR_ID = "competitorId";

    private AuditRecordJsonCodec() {
    }

    public static ObjectNode toJson(AuditRecord auditRecord) {
        if (auditRecord == null) {
            throw new IllegalArgumentException("Audit record is required");
        }

        ObjectNode root = JsonNodeFactory.instance.objectNode();
        root.put(FIELD_TIMESTAMP, auditRecord.timestamp().toString());
        root.put(FIELD_TOTAL_COST, auditRecord.totalCost());

        CostBreakdown breakdown = auditRecord.costBreakdown();
        ObjectNode breakdownNode = root.putObject(FIELD_COST_BREAKDOWN);
        breakdownNode.put(FIELD_TABLE_REUSE, breakdown.tableReuse());
        breakdownNode.put(FIELD_TERRAIN_REUSE, breakdown.terrainReuse());
        if (breakdown.tableNumber() != null) {
            breakdownNode.put(FIELD_TABLE_NUMBER, breakdown.tableNumber());
        } else {
            breakdownNode.put(FIELD_BCP_MISMATCH, breakdown.bcpMismatch());
        }

        ArrayNode reasons = root.putArray(FIELD_REASONS);
        auditRecord.reasons().forEach(reasons::add);

        ObjectNode alternatives = root.putObject(FIELD_ALTERNATIVES);
        auditRecord.alternativesConsidered().forEach((table, cost) -> alternatives.put(table.toString(), cost));

        root.put(FIELD_IS_ROUND_1, auditRecord.round1());
        root.put(FIELD_IS_BYE, auditRecord.bye());

        ArrayNode conflicts = root.putArray(FIELD_CONFLICTS);
        for (AllocationConflict conflict : auditRecord.conflicts()) {
            ObjectNode conflictNode = conflicts.addObject();
            conflictNode.put(FIELD_TYPE, conflict.type().name());
            conflictNode.put(FIELD_MESSAGE, conflict.message());
            if (conflict.competitorId() != null) {
                conflictNode.put(FIELD_COMPETITOR_ID, conflict.competitorId());
            } else {
                conflictNode.putNull(FIELD_COMPETITOR_ID);
            }
        }
        return root;
    }

    public static AuditRecord fromJson(JsonNode json) {
        if (json == null || json.isNull() || !json.isObject()) {
            throw new IllegalArgumentException("Audit record JSON must be an object");
        }

        OffsetDateTime timestamp = requireTimestamp(json);
        int totalCost = requireInt(json, FIELD_TOTAL_COST);
        CostBreakdown breakdown = parseBreakdown(json);

        List<String> reasons = new ArrayList<>();
        for (JsonNode reason : requireArray(json, FIELD_REASONS)) {
            if (!reason.isTextual()) {
                throw new IllegalArgumentException("Audit record reasons must be textual");
            }
            reasons.add(reason.textValue());
        }

        Map<Integer, Integer> alternatives = new LinkedHashMap<>();
        JsonNode alternativesNode = json.get(FIELD_ALTERNATIVES);
        if (alternativesNode != null && !alternativesNode.isNull()) {
            if (!alternativesNode.isObject()) {
                throw new IllegalArgumentException("Audit record field '" + FIELD_ALTERNATIVES + "' must be an object");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = alternativesNode.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isIntegralNumber()) {
                    throw new IllegalArgumentException("Alternative cost for table " + field.getKey() + " must be an integer");
                }
                try {
                    alternatives.put(Integer.parseInt(field.getKey()), field.getValue().intValue());
                } catch (NumberFormatException ex) {
                    throw new IllegalArgumentException("Alternative key '" + field.getKey() + "' is not a table number", ex);
                }
            }
        }

        List<AllocationConflict> conflicts = new ArrayList<>();
        for (JsonNode conflictNode : requireArray(json, FIELD_CONFLICTS)) {
            conflicts.add(parseConflict(conflictNode));
        }

        return new AuditRecord(
                timestamp,
                totalCost,
                breakdown,
                reasons,
                alternatives,
                requireBoolean(json, FIELD_IS_ROUND_1),
                requireBoolean(json, FIELD_IS_BYE),
                conflicts
        );
    }

    private static CostBreakdown parseBreakdown(JsonNode root) {
        JsonNode node = root.get(FIELD_COST_BREAKDOWN);
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("Audit record missing object field '" + FIELD_COST_BREAKDOWN + "'");
        }
        int tableReuse = requireInt(node, FIELD_TABLE_REUSE);
        int terrainReuse = requireInt(node, FIELD_TERRAIN_REUSE);
        if (node.has(FIELD_TABLE_NUMBER)) {
            return CostBreakdown.generated(tableReuse, terrainReuse, requireInt(node, FIELD_TABLE_NUMBER));
        }
        return CostBreakdown.edited(tableReuse, terrainReuse, requireInt(node, FIELD_BCP_MISMATCH));
    }

    private static AllocationConflict parseConflict(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Audit record conflicts must be objects");
        }
        JsonNode typeNode = node.get(FIELD_TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            throw new IllegalArgumentException("Conflict missing textual field '" + FIELD_TYPE + "'");
        }
        ConflictType type;
        try {
            type = ConflictType.valueOf(typeNode.textValue());
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("Unknown conflict type '" + typeNode.textValue() + "'", ex);
        }

        JsonNode messageNode = node.get(FIELD_MESSAGE);
        if (messageNode == null || !messageNode.isTextual()) {
            throw new IllegalArgumentException("Conflict missing textual field '" + FIELD_MESSAGE + "'");
        }
        JsonNode competitorNode = node.get(FIELD_COMPETITOR_ID);
        String competitorId = competitorNode == null || competitorNode.isNull() ? null : competitorNode.asText();

        return new AllocationConflict(type, messageNode.textValue(), competitorId);
    }

    private static OffsetDateTime requireTimestamp(JsonNode root) {
        JsonNode node = root.get(FIELD_TIMESTAMP);
        if (node == null || !node.isTextual()) {
            throw new IllegalArgumentException("Audit record missing textual field '" + FIELD_TIMESTAMP + "'");
        }
        try {
            return OffsetDateTime.parse(node.textValue());
        } catch (DateTimeParseException ex) {
            throw new IllegalArgumentException("Audit record field '" + FIELD_TIMESTAMP + "' must be ISO-8601", ex);
        }
    }

    private static int requireInt(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isIntegralNumber()) {
            throw new IllegalArgumentException("Audit record missing integer field '" + fieldName + "'");
        }
        return valueNode.intValue();
    }

    private static boolean requireBoolean(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isBoolean()) {
            throw new IllegalArgumentException("Audit record missing boolean field '" + fieldName + "'");
        }
        return valueNode.booleanValue();
    }

    private static JsonNode requireArray(JsonNode node, String fieldName) {
        JsonNode valueNode = node.get(fieldName);
        if (valueNode == null || !valueNode.isArray()) {
            throw new IllegalArgumentException("Audit record missing array field '" + fieldName + "'");
        }
        return valueNode;
    }
}
