package com.afs.maturity.api;

import com.afs.maturity.assessment.AssessmentModels;
import com.afs.maturity.assessment.AssessmentService;
import com.afs.maturity.scoring.ScoringModels;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/assessments")
public class AssessmentController {
    private final AssessmentService assessmentService;

    public AssessmentController(AssessmentService assessmentService) {
        this.assessmentService = assessmentService;
    }

    @PostMapping
    public ResponseEntity<AssessmentModels.Assessment> create(@RequestBody AssessmentModels.CreateAssessmentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(assessmentService.create(request));
    }

    @GetMapping
    public ResponseEntity<List<AssessmentModels.Assessment>> list() {
        return ResponseEntity.ok(assessmentService.list());
    }

    @GetMapping("/{id}")
    public ResponseEntity<AssessmentModels.Assessment> get(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.get(id));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id) {
        assessmentService.delete(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}/responses")
    public ResponseEntity<List<AssessmentModels.Response>> responses(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.responses(id));
    }

    @PostMapping("/{id}/responses")
    public ResponseEntity<AssessmentModels.SubmitAck> submit(@PathVariable long id,
                                                             @RequestBody AssessmentModels.SubmitResponsesRequest request) {
        return ResponseEntity.ok(assessmentService.submitResponses(id, request == null ? null : request.answers()));
    }

    @PutMapping("/{id}/responses/{questionId}")
    public ResponseEntity<AssessmentModels.SubmitAck> answer(@PathVariable long id,
                                                             @PathVariable String questionId,
                                                             @RequestBody AnswerRequest request) {
        return ResponseEntity.ok(assessmentService.submitResponses(id,
                List.of(new AssessmentModels.AnswerIn(questionId, request.score(), request.notes()))));
    }

    @GetMapping("/{id}/progress")
    public ResponseEntity<AssessmentModels.ProgressReport> progress(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.progress(id));
    }

    @GetMapping("/{id}/score")
    public ResponseEntity<ScoringModels.AssessmentScore> score(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.results(id));
    }

    @GetMapping("/{id}/section-scores")
    public ResponseEntity<List<AssessmentModels.SectionScoreRow>> sectionScores(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.sectionScores(id));
    }

    @PostMapping("/{id}/finalize")
    public ResponseEntity<AssessmentModels.FinalizeResult> finalizeAssessment(@PathVariable long id,
                                                                              @RequestParam(defaultValue = "false") boolean force) {
        return ResponseEntity.ok(assessmentService.complete(id, force));
    }

    @PostMapping("/{id}/lock")
    public ResponseEntity<AssessmentModels.Assessment> lock(@PathVariable long id) {
        return ResponseEntity.ok(assessmentService.lock(id));
    }

    public record AnswerRequest(Integer score, String notes) {}
}
