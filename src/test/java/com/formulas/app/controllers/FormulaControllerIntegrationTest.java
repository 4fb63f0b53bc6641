package com.formulas.app.controllers;

import com.formulas.app.FormulaApplication;
import com.formulas.app.formula.FormulaErrorKind;
import com.formulas.app.formula.ValueFormat;
import com.formulas.app.formula.cell.ExpansionAxis;
import com.formulas.app.models.*;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = FormulaApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class FormulaControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();

    private String url(String path) {
        return "http://localhost:" + port + "/formula" + path;
    }

    private static List<ColumnDefinition> columns() {
        return Arrays.asList(
                new ColumnDefinition("id", "ID"),
                new ColumnDefinition("revenue", "Revenue"),
                new ColumnDefinition("cost", "Cost"));
    }

    private static List<SheetData> sheets() {
        return Arrays.asList(
                SheetData.of("jan", "Jan 2026",
                        Map.of("id", "acme", "revenue", 100, "cost", 40)),
                SheetData.of("feb", "Feb 2026",
                        Map.of("id", "acme", "revenue", "$1,200.00", "cost", 300),
                        Map.of("id", "globex", "revenue", 50, "cost", "")));
    }

    /**
     * Posts a raw JSON body, as a browser client would.
     */
    @Test
    void testEvaluateCellFromJson() {
        String body = "{\n" +
                "  \"formula\": \"=ROUND(SUM(A1:A3)/3,2)\",\n" +
                "  \"currentSheetId\": \"s1\",\n" +
                "  \"columns\": [{\"key\": \"a\", \"label\": \"Amount\", \"type\": \"number\"}],\n" +
                "  \"sheets\": [{\"id\": \"s1\", \"label\": \"Sheet 1\",\n" +
                "               \"rows\": [{\"a\": 10}, {\"a\": 20}, {\"a\": \"30.5\"}]}]\n" +
                "}";
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        ResponseEntity<EvaluationResponse> response = restTemplate.postForEntity(
                url("/cell/evaluate"), new HttpEntity<>(body, headers), EvaluationResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        EvaluationResponse result = response.getBody();
        assertNotNull(result);
        assertTrue(result.isOk());
        assertEquals(20.17, result.getValue(), 1e-9);
        assertEquals(ValueFormat.PLAIN, result.getFormat());
        assertEquals("20.17", result.getDisplay());
    }

    @Test
    void testCellFormulaErrorIsOkResponse() {
        ResponseEntity<EvaluationResponse> response = restTemplate.postForEntity(url("/cell/evaluate"),
                new CellFormulaRequest("='Mar 2026'!B1", "feb", sheets(), columns()), EvaluationResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertFalse(response.getBody().isOk());
        assertEquals(FormulaErrorKind.RESOLUTION, response.getBody().getErrorKind());
        assertTrue(response.getBody().getError().contains("Mar 2026"));
    }

    @Test
    void testParse() {
        ResponseEntity<ParseResponse> response = restTemplate.postForEntity(url("/parse?dialect=COLUMN"),
                Map.of("formula", "SUM({Jan 2026.Revenue}) - {Cost}"), ParseResponse.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        ParseResponse parsed = response.getBody();
        assertTrue(parsed.isOk());
        assertEquals("SUM({Jan 2026.Revenue})-{Cost}", parsed.getNormalized());
        assertEquals(2, parsed.getReferences().size());
        assertEquals("Jan 2026", parsed.getReferences().get(0).sheetLabel());

        ParseResponse failed = restTemplate.postForEntity(url("/parse"),
                Map.of("formula", "=A1+"), ParseResponse.class).getBody();
        assertFalse(failed.isOk());
        assertEquals(4, failed.getPosition());
    }

    @Test
    void testEvaluateColumn() {
        ColumnFormulaRequest request = new ColumnFormulaRequest(
                "{Revenue} - {Cost}", "feb", sheets(), columns(), "id");

        ResponseEntity<EvaluationResponse[]> response = restTemplate.postForEntity(
                url("/column/evaluate"), request, EvaluationResponse[].class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        EvaluationResponse[] rows = response.getBody();
        assertEquals(2, rows.length);
        assertEquals(900.0, rows[0].getValue());
        assertEquals(ValueFormat.CURRENCY, rows[0].getFormat());
        assertEquals("$900.00", rows[0].getDisplay());
        assertEquals(50.0, rows[1].getValue());
    }

    @Test
    void testEvaluateRow() {
        RowFormulaRequest request = new RowFormulaRequest(
                "SUM({column})", "feb", sheets(), columns(), null, List.of("revenue", "cost"));

        ResponseEntity<Map> response = restTemplate.postForEntity(url("/row/evaluate"), request, Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<?, ?> revenue = (Map<?, ?>) response.getBody().get("revenue");
        assertEquals(1250.0, ((Number) revenue.get("value")).doubleValue());
        assertEquals("currency", revenue.get("format"));
        Map<?, ?> cost = (Map<?, ?>) response.getBody().get("cost");
        assertEquals(300.0, ((Number) cost.get("value")).doubleValue());
    }

    @Test
    void testExpand() {
        ResponseEntity<Map> response = restTemplate.postForEntity(url("/cell/expand"),
                new RangeExpansionRequest("=SUM(B1:B2)*2", ExpansionAxis.ROW, 1, 4), Map.class);

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertEquals("=SUM(B1:B5)*2", response.getBody().get("formula"));
    }

    /**
     * Request-level problems come back as 4xx with an error code.
     */
    @Test
    void testErrorStatuses() {
        HttpClientErrorException sheet = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/cell/evaluate"),
                        new CellFormulaRequest("=A1", "mar", sheets(), columns()), String.class));
        assertEquals(HttpStatus.NOT_FOUND, sheet.getStatusCode());
        assertTrue(sheet.getResponseBodyAsString().contains("SHEET_NOT_FOUND"));

        HttpClientErrorException column = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/row/evaluate"),
                        new RowFormulaRequest("SUM({column})", "feb", sheets(), columns(), null, List.of("profit")),
                        String.class));
        assertEquals(HttpStatus.NOT_FOUND, column.getStatusCode());
        assertTrue(column.getResponseBodyAsString().contains("COLUMN_NOT_FOUND"));

        HttpClientErrorException blank = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/cell/evaluate"),
                        new CellFormulaRequest(" ", "feb", sheets(), columns()), String.class));
        assertEquals(HttpStatus.BAD_REQUEST, blank.getStatusCode());
        assertTrue(blank.getResponseBodyAsString().contains("INVALID_REQUEST"));

        // the test profile allows 10000 cells per range
        HttpClientErrorException range = assertThrows(HttpClientErrorException.class, () ->
                restTemplate.postForEntity(url("/cell/evaluate"),
                        new CellFormulaRequest("=SUM(A1:Z1000)", "feb", sheets(), columns()), String.class));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, range.getStatusCode());
        assertTrue(range.getResponseBodyAsString().contains("RANGE_TOO_LARGE"));
    }
}
