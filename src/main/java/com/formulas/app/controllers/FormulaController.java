package com.formulas.app.controllers;

import com.formulas.app.exceptions.InvalidFormulaRequestException;
import com.formulas.app.models.*;
import com.formulas.app.services.FormulaService;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * REST endpoints for parsing and evaluating formulas.
 * "/formula" is the base path. Formula errors come back as 200 responses
 * with "ok": false; only malformed requests produce 4xx codes.
 */
@RestController
@RequestMapping("/formula")
public class FormulaController {

    @Autowired
    private FormulaService formulaService;

    /**
     * POST /formula/parse?dialect=CELL|COLUMN
     * Expects a JSON body { "formula": "..." }.
     * Returns the normalized formula and its references, or the parse error.
     */
    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(
            @RequestParam(defaultValue = "CELL") FormulaDialect dialect,
            @RequestBody Map<String, String> request
    ) {
        return ResponseEntity.ok(formulaService.describe(dialect, request.get("formula")));
    }

    /**
     * POST /formula/cell/evaluate
     * Evaluates an A1 formula such as "=SUM(A1:B2)" against the supplied sheets.
     */
    @PostMapping("/cell/evaluate")
    public ResponseEntity<EvaluationResponse> evaluateCell(@RequestBody CellFormulaRequest request) {
        return ResponseEntity.ok(formulaService.evaluateCell(request));
    }

    /**
     * POST /formula/column/evaluate
     * Evaluates a column formula such as "{Revenue} - {Cost}" once per row
     * of the current sheet; results are in row order.
     */
    @PostMapping("/column/evaluate")
    public ResponseEntity<List<EvaluationResponse>> evaluateColumn(@RequestBody ColumnFormulaRequest request) {
        return ResponseEntity.ok(formulaService.evaluateColumn(request));
    }

    /**
     * POST /formula/row/evaluate
     * Evaluates a row formula such as "SUM({column})" once per column,
     * returning { "<columnKey>": result, ... }.
     */
    @PostMapping("/row/evaluate")
    public ResponseEntity<Map<String, EvaluationResponse>> evaluateRow(@RequestBody RowFormulaRequest request) {
        return ResponseEntity.ok(formulaService.evaluateRow(request));
    }

    /**
     * POST /formula/cell/expand
     * Grows the ranges of a cell formula after data was appended.
     * Returns { "formula": "=SUM(H1:H15)" }.
     */
    @PostMapping("/cell/expand")
    public ResponseEntity<Map<String, String>> expandRanges(@RequestBody RangeExpansionRequest request) {
        if (request.getNewMax() < 0 || request.getOldMax() < 0) {
            throw new InvalidFormulaRequestException("oldMax and newMax must be non-negative");
        }
        return ResponseEntity.ok(Map.of("formula", formulaService.expandRanges(request)));
    }
}
