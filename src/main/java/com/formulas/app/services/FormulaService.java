package com.formulas.app.services;

import com.formulas.app.config.FormulaProperties;
import com.formulas.app.exceptions.ColumnNotFoundException;
import com.formulas.app.exceptions.InvalidFormulaRequestException;
import com.formulas.app.exceptions.RangeLimitExceededException;
import com.formulas.app.exceptions.SheetNotFoundException;
import com.formulas.app.formula.CellEvalContext;
import com.formulas.app.formula.CellRange;
import com.formulas.app.formula.FormulaContext;
import com.formulas.app.formula.FormulaContextBuilder;
import com.formulas.app.formula.FormulaFormatter;
import com.formulas.app.formula.FormulaNode;
import com.formulas.app.formula.FormulaNodes;
import com.formulas.app.formula.FormulaResult;
import com.formulas.app.formula.ParseResult;
import com.formulas.app.formula.SheetSnapshot;
import com.formulas.app.formula.cell.CellFormulaEvaluator;
import com.formulas.app.formula.cell.CellFormulaParser;
import com.formulas.app.formula.cell.CellFormulaRewriter;
import com.formulas.app.formula.column.ColumnContext;
import com.formulas.app.formula.column.ColumnFormulaEvaluator;
import com.formulas.app.formula.column.ColumnFormulaParser;
import com.formulas.app.formula.column.RowContext;
import com.formulas.app.models.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Main entry point for callers of the formula engine: validates requests,
 * builds a fresh evaluation context per call, caches parsed formulas,
 * bounds range sizes, and renders results for display.
 */
@Service
public class FormulaService {

    private static final Logger log = LoggerFactory.getLogger(FormulaService.class);

    private final FormulaProperties properties;
    private final FormulaFormatter formatter;

    // Parsed formulas are pure functions of their text, so they can be shared freely
    private final Map<String, ParseResult> parseCache = new ConcurrentHashMap<>();

    public FormulaService(FormulaProperties properties) {
        this.properties = properties;
        this.formatter = FormulaFormatter.forLanguageTag(
                properties.getDisplay().getLocale(), properties.getDisplay().getCurrency());
    }

    /**
     * Parses a formula in the given dialect, reusing an earlier parse of the same text.
     */
    public ParseResult parse(FormulaDialect dialect, String formula) {
        requireFormula(formula);
        String cacheKey = dialect + ":" + formula;
        ParseResult cached = parseCache.get(cacheKey);
        if (cached != null) {
            return cached;
        }
        ParseResult result = dialect == FormulaDialect.CELL
                ? CellFormulaParser.parse(formula)
                : ColumnFormulaParser.parse(formula);

        // Crude bound: start over rather than track recency
        if (parseCache.size() >= properties.getParseCacheSize()) {
            parseCache.clear();
        }
        parseCache.put(cacheKey, result);
        return result;
    }

    public ParseResponse describe(FormulaDialect dialect, String formula) {
        return ParseResponse.from(parse(dialect, formula));
    }

    /**
     * Evaluates an A1 cell formula against the request's sheets.
     */
    public EvaluationResponse evaluateCell(CellFormulaRequest request) {
        ParseResult parsed = parse(FormulaDialect.CELL, request.getFormula());
        requireSheet(request.getCurrentSheetId(), request.getSheets());
        requireColumnKeys(request.getColumns());
        if (!parsed.isOk()) {
            return EvaluationResponse.from(parsed.toFailure(), formatter);
        }
        checkRangeSizes(parsed.getAst());

        log.debug("Evaluating cell formula {} on sheet {}", request.getFormula(), request.getCurrentSheetId());
        CellEvalContext context = FormulaContextBuilder.buildCellContext(
                request.getCurrentSheetId(), request.getSheets(), request.getColumns());
        FormulaResult result = CellFormulaEvaluator.evaluate(parsed.getAst(), context);
        return EvaluationResponse.from(result, formatter);
    }

    /**
     * Applies a column formula to every row of the current sheet, in row order.
     */
    public List<EvaluationResponse> evaluateColumn(ColumnFormulaRequest request) {
        ParseResult parsed = parse(FormulaDialect.COLUMN, request.getFormula());
        requireSheet(request.getCurrentSheetId(), request.getSheets());
        requireColumnKeys(request.getColumns());
        FormulaContext context = buildContext(request);
        SheetSnapshot sheet = context.getSheet(context.getCurrentSheetId()).orElseThrow();

        log.debug("Evaluating column formula {} over {} rows of sheet {}",
                request.getFormula(), sheet.getRows().size(), sheet.getId());
        List<EvaluationResponse> results = new ArrayList<>();
        for (int i = 0; i < sheet.getRows().size(); i++) {
            FormulaResult result = parsed.isOk()
                    ? ColumnFormulaEvaluator.evaluateColumnFormula(parsed.getAst(), context, RowContext.of(context, i))
                    : parsed.toFailure();
            results.add(EvaluationResponse.from(result, formatter));
        }
        return results;
    }

    /**
     * Applies a row formula to each requested column (all schema columns when none are listed),
     * keyed by column key in request order.
     */
    public Map<String, EvaluationResponse> evaluateRow(RowFormulaRequest request) {
        ParseResult parsed = parse(FormulaDialect.COLUMN, request.getFormula());
        requireSheet(request.getCurrentSheetId(), request.getSheets());
        requireColumnKeys(request.getColumns());
        List<ColumnDefinition> columns = request.getColumns() == null ? List.of() : request.getColumns();

        List<ColumnDefinition> targets = new ArrayList<>();
        if (request.getColumnKeys() == null || request.getColumnKeys().isEmpty()) {
            targets.addAll(columns);
        } else {
            for (String key : request.getColumnKeys()) {
                ColumnDefinition column = columns.stream()
                        .filter(cd -> cd.getKey().equals(key))
                        .findFirst()
                        .orElseThrow(() -> new ColumnNotFoundException("Column " + key + " not found in sheet schema"));
                targets.add(column);
            }
        }

        log.debug("Evaluating row formula {} over {} columns", request.getFormula(), targets.size());
        FormulaContext context = buildContext(request);
        Map<String, EvaluationResponse> results = new LinkedHashMap<>();
        for (ColumnDefinition column : targets) {
            FormulaResult result = parsed.isOk()
                    ? ColumnFormulaEvaluator.evaluateRowFormula(parsed.getAst(), context, ColumnContext.of(column))
                    : parsed.toFailure();
            results.put(column.getKey(), EvaluationResponse.from(result, formatter));
        }
        return results;
    }

    /**
     * Grows the ranges of a cell formula after rows or columns were appended.
     */
    public String expandRanges(RangeExpansionRequest request) {
        requireFormula(request.getFormula());
        if (request.getAxis() == null) {
            throw new InvalidFormulaRequestException("Expansion axis is required");
        }
        return CellFormulaRewriter.expandRanges(request.getFormula(), request.getAxis(),
                        request.getOldMax(), request.getNewMax())
                .orElseThrow(() -> new InvalidFormulaRequestException(
                        "Formula does not parse: " + parse(FormulaDialect.CELL, request.getFormula()).getError()));
    }

    // ----------------------------------------------------------------
    // Internal Helpers
    // ----------------------------------------------------------------

    private FormulaContext buildContext(ColumnFormulaRequest request) {
        boolean legacyScan = request.getLegacyIdentityScan() != null
                ? request.getLegacyIdentityScan()
                : properties.isLegacyIdentityScan();
        return FormulaContextBuilder.buildFormulaContext(request.getCurrentSheetId(), request.getSheets(),
                request.getColumns(), request.getIdentityKey(), legacyScan);
    }

    private static void requireFormula(String formula) {
        if (formula == null || formula.trim().isEmpty()) {
            throw new InvalidFormulaRequestException("Formula is required");
        }
    }

    private static void requireSheet(String sheetId, List<SheetData> sheets) {
        if (sheetId == null) {
            throw new InvalidFormulaRequestException("currentSheetId is required");
        }
        boolean present = sheets != null && sheets.stream().anyMatch(s -> sheetId.equals(s.getId()));
        if (!present) {
            log.warn("Rejected formula request for unknown sheet {}", sheetId);
            throw new SheetNotFoundException("Sheet not found: " + sheetId);
        }
    }

    private static void requireColumnKeys(List<ColumnDefinition> columns) {
        if (columns == null) {
            return;
        }
        for (ColumnDefinition column : columns) {
            if (column == null || column.getKey() == null || column.getKey().trim().isEmpty()) {
                throw new InvalidFormulaRequestException("Every column needs a key");
            }
        }
    }

    /**
     * The engine has no internal limit on range size; bound it here before evaluating.
     */
    private void checkRangeSizes(FormulaNode ast) {
        long limit = properties.getEvaluation().getMaxRangeCells();
        for (FormulaNode node : FormulaNodes.preOrder(ast)) {
            if (node instanceof CellRange range && range.cellCount() > limit) {
                log.warn("Rejected range {}:{} covering {} cells", range.start(), range.end().toA1(), range.cellCount());
                throw new RangeLimitExceededException("Range " + range.start() + ":" + range.end().toA1()
                        + " covers " + range.cellCount() + " cells; the limit is " + limit);
            }
        }
    }
}
