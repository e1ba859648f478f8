package com.afs.maturity.api;

import com.afs.maturity.report.ReportModels;
import com.afs.maturity.report.ReportService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/assessments")
public class ReportController {
    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @GetMapping("/{id}/report")
    public ResponseEntity<ReportModels.AssessmentReport> report(@PathVariable long id) {
        return ResponseEntity.ok(reportService.report(id));
    }
}
