package com.animestats.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class JsonServiceTest {
    @TempDir
    Path dir;

    @Test
    void testExportWritesDetailsAndReport() throws Exception {
        new JsonService(dir).export(SampleRun.result());
        ObjectMapper mapper = new ObjectMapper();

        JsonNode details = mapper.readTree(dir.resolve(JsonService.DETAILS_FILE).toFile());
        assertEquals(1, details.size());
        JsonNode detail = details.get(0);
        assertEquals(5114, detail.get("id").asInt());
        assertEquals("2009-04-05", detail.get("airingInfo").get("startDate").asText());
        assertEquals("Finished Airing", detail.get("airingInfo").get("status").asText());
        assertEquals("2024-05-01T12:00:00Z", detail.get("fetchedAt").asText());
        assertEquals("2021-03-14", detail.get("reviews").get(0).get("date").asText());

        JsonNode report = mapper.readTree(dir.resolve(JsonService.REPORT_FILE).toFile());
        assertFalse(report.get("cancelled").asBoolean());
        assertTrue(report.get("exhausted").isNull());
        assertEquals(4, report.get("stages").size());
        assertEquals("PARTIAL", report.get("stages").get(2).get("status").asText());
        assertEquals(1, report.get("counts").get("facts").asInt());
    }
}
