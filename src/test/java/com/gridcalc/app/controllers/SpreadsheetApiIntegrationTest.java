package com.gridcalc.app.controllers;

import com.fasterxml.jackson.databind.JsonNode;
import com.gridcalc.app.AppApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = AppApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SpreadsheetApiIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String baseUrl;

    @BeforeEach
    void setUp() {
        baseUrl = "http://localhost:" + port;
    }

    private static HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    private String createSpreadsheet(String name) {
        ResponseEntity<JsonNode> response = restTemplate.postForEntity(baseUrl + "/spreadsheets",
                json("{\"name\": \"" + name + "\"}"), JsonNode.class);
        assertEquals(HttpStatus.CREATED, response.getStatusCode());
        JsonNode body = response.getBody();
        assertNotNull(body);
        return body.get("id").asText();
    }

    private static String formattedValue(JsonNode cell) {
        return cell.path("value").path("formatted").asText();
    }

    /**
     * Create a spreadsheet, write a batch with a formula, then read it back.
     */
    @Test
    void testUpdateCellsAndReadBack() {
        String id = createSpreadsheet("Budget");

        // 1) A1=5, A2=10, A3=A1+A2 in one batch
        String body = "{\n" +
                "  \"participantId\": \"p1\",\n" +
                "  \"updates\": [\n" +
                "    {\"address\": \"A1\", \"value\": 5},\n" +
                "    {\"address\": \"A2\", \"value\": 10},\n" +
                "    {\"row\": 2, \"column\": 0, \"value\": \"=A1+A2\"}\n" +
                "  ]\n" +
                "}";
        ResponseEntity<JsonNode> update = restTemplate.exchange(baseUrl + "/spreadsheets/" + id
                + "/cells?sheetIndex=0", HttpMethod.PUT, json(body), JsonNode.class);
        assertEquals(HttpStatus.OK, update.getStatusCode());
        assertEquals(1, update.getBody().get("revision").asInt());
        assertEquals(3, update.getBody().get("edited").size());

        // 2) single cell read keeps the formula source
        ResponseEntity<JsonNode> cell = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id + "/cells/A3",
                JsonNode.class);
        assertEquals("=A1+A2", cell.getBody().get("content").asText());
        assertEquals("15", formattedValue(cell.getBody()));

        // 3) dense range read
        ResponseEntity<JsonNode> range = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id
                + "/cells?startRow=0&endRow=2&startCol=0&endCol=1", JsonNode.class);
        JsonNode rows = range.getBody().get("rows");
        assertEquals(3, rows.size());
        assertEquals(2, rows.get(0).size());
        assertEquals("10", formattedValue(rows.get(1).get(0)));
        assertEquals("", formattedValue(rows.get(1).get(1)));
    }

    @Test
    void testParseErrorIsBadRequest() {
        String id = createSpreadsheet("Errors");
        String body = "{\"updates\": [{\"address\": \"A1\", \"value\": \"=(1+2\"}]}";
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(baseUrl + "/spreadsheets/" + id + "/cells", HttpMethod.PUT, json(body),
                        String.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("PARSE_ERROR"));
        assertTrue(ex.getResponseBodyAsString().contains("\"position\":5"));
    }

    @Test
    void testOversizedRangeIsBadRequest() {
        String id = createSpreadsheet("Big");
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id
                        + "/cells?startRow=0&endRow=999&startCol=0&endCol=99", String.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_RANGE"));
    }

    @Test
    void testEditPastLargestRowIsBadRequest() {
        String id = createSpreadsheet("Edge");
        String body = "{\"updates\": [{\"row\": 2147483647, \"column\": 0, \"value\": 42}]}";
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.exchange(baseUrl + "/spreadsheets/" + id + "/cells", HttpMethod.PUT, json(body),
                        String.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("INVALID_RANGE"));

        ResponseEntity<JsonNode> details = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id,
                JsonNode.class);
        assertEquals(0, details.getBody().get("revision").asInt());
    }

    @Test
    void testUnknownSpreadsheetIsNotFound() {
        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(baseUrl + "/spreadsheets/does-not-exist", String.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("SPREADSHEET_NOT_FOUND"));
    }

    @Test
    void testValidateFormula() {
        ResponseEntity<JsonNode> response = restTemplate.postForEntity(baseUrl + "/formulas/validate",
                json("{\"formula\": \"=SUM(A1:A3)\"}"), JsonNode.class);
        assertTrue(response.getBody().get("valid").asBoolean());
        JsonNode references = response.getBody().get("references");
        assertEquals(1, references.size());
        assertEquals("A1:A3", references.get(0).asText());
    }

    /**
     * CSV goes in as one batch and comes back out with computed values.
     */
    @Test
    void testCsvImportAndExport() {
        String id = createSpreadsheet("Csv");
        String sheet = baseUrl + "/spreadsheets/" + id + "/sheets/0";

        ResponseEntity<JsonNode> imported = restTemplate.exchange(sheet + "/import/csv", HttpMethod.PUT,
                json("{\"csv\": \"a,1\\nb,=B1*3\", \"delimiter\": \",\"}"), JsonNode.class);
        assertEquals(HttpStatus.OK, imported.getStatusCode());
        assertEquals(1, imported.getBody().get("revision").asInt());

        ResponseEntity<String> exported = restTemplate.getForEntity(sheet + "/export", String.class);
        assertEquals(HttpStatus.OK, exported.getStatusCode());
        assertEquals("text", exported.getHeaders().getContentType().getType());
        assertEquals("csv", exported.getHeaders().getContentType().getSubtype());
        assertEquals("a,1\r\nb,3\r\n", exported.getBody());

        ResponseEntity<String> entered = restTemplate.getForEntity(sheet + "/export?delimiter=;&entered=true",
                String.class);
        assertEquals("a;1\r\nb;=B1*3\r\n", entered.getBody());

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.getForEntity(sheet + "/export?delimiter=ab", String.class));
        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertTrue(ex.getResponseBodyAsString().contains("CSV_ERROR"));
    }

    @Test
    void testCsvImportCreatesSpreadsheet() {
        ResponseEntity<JsonNode> created = restTemplate.postForEntity(baseUrl + "/spreadsheets/import",
                json("{\"name\": \"Sales\", \"csv\": \"Region;Amount\\nEast;12\", \"delimiter\": \";\"}"),
                JsonNode.class);
        assertEquals(HttpStatus.CREATED, created.getStatusCode());
        assertEquals("Sales", created.getBody().get("name").asText());

        String id = created.getBody().get("id").asText();
        ResponseEntity<JsonNode> cell = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id + "/cells/B2",
                JsonNode.class);
        assertEquals("12", formattedValue(cell.getBody()));
    }

    /**
     * Two collaborators join, one edits, the other receives the update.
     */
    @Test
    void testCollaborationFlow() {
        String id = createSpreadsheet("Shared");
        String collab = baseUrl + "/spreadsheets/" + id + "/collaboration";

        ResponseEntity<JsonNode> session = restTemplate.postForEntity(collab, null, JsonNode.class);
        assertEquals(HttpStatus.OK, session.getStatusCode());
        assertEquals("ws://localhost:0/ws/collab/" + id, session.getBody().get("websocketUrl").asText());

        ResponseEntity<JsonNode> alice = restTemplate.postForEntity(collab + "/participants",
                json("{\"userId\": \"u-1\", \"displayName\": \"Alice\"}"), JsonNode.class);
        ResponseEntity<JsonNode> bob = restTemplate.postForEntity(collab + "/participants",
                json("{\"userId\": \"u-2\", \"displayName\": \"Bob\"}"), JsonNode.class);
        assertEquals(HttpStatus.CREATED, alice.getStatusCode());
        String aliceId = alice.getBody().get("participantId").asText();
        String bobId = bob.getBody().get("participantId").asText();

        ResponseEntity<JsonNode> collaborators = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id
                + "/collaborators", JsonNode.class);
        assertEquals(2, collaborators.getBody().size());

        String edit = "{\"participantId\": \"" + aliceId + "\", \"updates\": [{\"address\": \"B2\", \"value\": \"hi\"}]}";
        restTemplate.exchange(baseUrl + "/spreadsheets/" + id + "/cells", HttpMethod.PUT, json(edit), JsonNode.class);

        ResponseEntity<JsonNode> events = restTemplate.getForEntity(collab + "/participants/" + bobId + "/events",
                JsonNode.class);
        assertEquals(1, events.getBody().size());
        JsonNode event = events.getBody().get(0);
        assertEquals("B2", event.get("address").asText());
        assertEquals(aliceId, event.get("editorParticipantId").asText());

        restTemplate.delete(collab + "/participants/" + aliceId);
        collaborators = restTemplate.getForEntity(baseUrl + "/spreadsheets/" + id + "/collaborators", JsonNode.class);
        assertEquals(1, collaborators.getBody().size());

        HttpClientErrorException ex = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(collab + "/participants/" + aliceId + "/heartbeat", null, String.class));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }
}
