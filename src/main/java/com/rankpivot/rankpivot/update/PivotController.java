package com.rankpivot.rankpivot.update;

import com.rankpivot.rankpivot.pivot.PivotTableException;
import com.rankpivot.rankpivot.pivot.UnknownCategoryException;
import com.rankpivot.rankpivot.plan.UpdateDecision;
import com.rankpivot.rankpivot.store.UpdateRunRecord;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * Exposes change detection and table updates per country.
 */
@RestController
@RequestMapping("/api/pivot")
public class PivotController {

    private final PivotUpdateService pivotUpdateService;

    public PivotController(PivotUpdateService pivotUpdateService) {
        this.pivotUpdateService = pivotUpdateService;
    }

    @GetMapping("/countries")
    public ResponseEntity<List<String>> getCountries() {
        return ResponseEntity.ok(pivotUpdateService.countries());
    }

    @GetMapping("/{country}/info")
    public ResponseEntity<TableInfo> getTableInfo(@PathVariable String country) {
        return ResponseEntity.ok(pivotUpdateService.tableInfo(country));
    }

    /**
     * Reports new months, new categories and pending months without changing the table.
     */
    @GetMapping("/{country}/changes")
    public ResponseEntity<ChangeReport> getChanges(@PathVariable String country) {
        try {
            return ResponseEntity.ok(pivotUpdateService.analyzeChanges(country));
        } catch (PivotTableException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    /**
     * Applies {@code decision} (MONTHS_ONLY, CATEGORIES_ONLY, BOTH or NONE) to the country's table.
     */
    @PostMapping("/{country}/update")
    public ResponseEntity<UpdateResult> update(
            @PathVariable String country,
            @RequestParam(defaultValue = "BOTH") String decision) {
        try {
            return ResponseEntity.ok(pivotUpdateService.update(country, UpdateDecision.parse(decision)));
        } catch (IllegalArgumentException ex) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, ex.getMessage(), ex);
        } catch (UnknownCategoryException ex) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, ex.getMessage(), ex);
        } catch (PivotTableException ex) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, ex.getMessage(), ex);
        }
    }

    @GetMapping("/{country}/status")
    public ResponseEntity<ProcessingStatusResponse> getStatus(@PathVariable String country) {
        return ResponseEntity.ok(pivotUpdateService.processingStatus(country));
    }

    @GetMapping("/{country}/runs")
    public ResponseEntity<List<UpdateRunRecord>> getRuns(@PathVariable String country) {
        return ResponseEntity.ok(pivotUpdateService.runHistory(country));
    }
}
