package com.contact.resolution.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CustomFieldsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    @DisplayName("Recognized keys are typed, everything else is residual")
    void testFromJson() throws Exception {
        JsonNode json = MAPPER.readTree("""
                {"source": "import", "syncedFromHubspot": "true", "favoriteColor": "blue",
                 "score": 12, "nested": {"a": 1}}
                """);

        CustomFields fields = CustomFields.fromJson(json);

        assertEquals("import", fields.getString(CustomFieldKey.SOURCE).orElseThrow());
        assertTrue(fields.getFlag(CustomFieldKey.SYNCED_FROM_HUBSPOT).orElseThrow());
        assertEquals("blue", fields.getResidual("favoriteColor").orElseThrow().asText());
        assertEquals(1, fields.getResidual("nested").orElseThrow().get("a").asInt());
        assertEquals(5, fields.size());
    }

    @Test
    @DisplayName("A flag that is not a boolean stays residual")
    void testUncoercibleFlag() throws Exception {
        CustomFields fields = CustomFields.fromJson(MAPPER.readTree("{\"deletedInHubspot\": \"maybe\"}"));

        assertTrue(fields.getFlag(CustomFieldKey.DELETED_IN_HUBSPOT).isEmpty());
        assertEquals("maybe", fields.getResidual("deletedInHubspot").orElseThrow().asText());
    }

    @Test
    @DisplayName("Typed put rejects the wrong value type")
    void testTypedPut() {
        assertThrows(IllegalArgumentException.class,
                () -> CustomFields.builder().put(CustomFieldKey.SOURCE, true));
        assertThrows(IllegalArgumentException.class,
                () -> CustomFields.builder().put(CustomFieldKey.SYNCED_FROM_HUBSPOT, "yes"));
    }

    @Test
    @DisplayName("Merge keeps this side on overlap and adds the other side's keys")
    void testMergedWith() {
        CustomFields primary = CustomFields.builder()
                .put(CustomFieldKey.SOURCE, "web")
                .build();
        CustomFields secondary = CustomFields.builder()
                .put(CustomFieldKey.SOURCE, "import")
                .put(CustomFieldKey.HUBSPOT_ID, "hs-1")
                .build();

        CustomFields merged = primary.mergedWith(secondary);

        assertEquals("web", merged.getString(CustomFieldKey.SOURCE).orElseThrow());
        assertEquals("hs-1", merged.getString(CustomFieldKey.HUBSPOT_ID).orElseThrow());
    }

    @Test
    @DisplayName("JSON output round-trips to equal fields")
    void testToJson() {
        CustomFields fields = CustomFields.builder()
                .put(CustomFieldKey.LEAD_SOURCE, "ads")
                .put(CustomFieldKey.DELETED_IN_HUBSPOT, false)
                .put("region", MAPPER.getNodeFactory().textNode("emea"))
                .build();

        assertEquals(fields, CustomFields.fromJson(fields.toJson()));
        assertFalse(fields.toJson().get("deletedInHubspot").booleanValue());
    }

    @Test
    @DisplayName("Null and non-object input give empty fields")
    void testEmptyInput() throws Exception {
        assertTrue(CustomFields.fromJson(null).isEmpty());
        assertTrue(CustomFields.fromJson(MAPPER.readTree("[1, 2]")).isEmpty());
    }

    @Test
    @DisplayName("Residual values handed out are copies")
    void testResidualIsCopied() throws Exception {
        CustomFields fields = CustomFields.fromJson(MAPPER.readTree("{\"extra\": {\"a\": 1}}"));

        ((ObjectNode) fields.getResidual("extra").orElseThrow()).put("a", 2);
        ((ObjectNode) fields.residual().get("extra")).put("a", 3);
        ((ObjectNode) fields.toJson().get("extra")).put("a", 4);

        assertEquals(1, fields.getResidual("extra").orElseThrow().get("a").asInt());
        assertEquals("{\"extra\":{\"a\":1}}", fields.toString());
    }

    @Test
    @DisplayName("A number under a string key keeps its JSON type")
    void testNumberUnderStringKey() throws Exception {
        CustomFields fields = CustomFields.fromJson(MAPPER.readTree("{\"hubspotId\": 123}"));

        assertTrue(fields.getString(CustomFieldKey.HUBSPOT_ID).isEmpty());
        assertTrue(fields.toJson().get("hubspotId").isNumber());
        assertEquals(123, fields.toJson().get("hubspotId").intValue());
    }
}
