package com.afs.maturity.repository;

import com.afs.maturity.assessment.AssessmentModels.Response;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Repository
public class ResponseJdbcRepository {
    private static final RowMapper<Response> ROW = (rs, n) -> new Response(
            rs.getLong(1), rs.getString(2), rs.getObject(3, Integer.class), rs.getString(4), Instant.parse(rs.getString(5)));

    private final JdbcTemplate jdbcTemplate;

    public ResponseJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * Atomic insert-or-update on the (assessment, question) key. A null note leaves the
     * stored note untouched.
     */
    public void upsert(long assessmentId, String questionId, int score, String notes, Instant answeredAt) {
        if (notes == null) {
            jdbcTemplate.update(
                    "MERGE INTO responses(assessment_id, question_id, score, answered_at) KEY(assessment_id, question_id) VALUES (?,?,?,?)",
                    assessmentId, questionId, score, answeredAt.toString());
        } else {
            jdbcTemplate.update(
                    "MERGE INTO responses(assessment_id, question_id, score, notes, answered_at) KEY(assessment_id, question_id) VALUES (?,?,?,?,?)",
                    assessmentId, questionId, score, notes, answeredAt.toString());
        }
    }

    public List<Response> loadAll(long assessmentId) {
        return jdbcTemplate.query(
                "SELECT assessment_id, question_id, score, notes, answered_at FROM responses WHERE assessment_id=? ORDER BY question_id",
                ROW, assessmentId);
    }

    public Map<String, Response> loadByQuestion(long assessmentId) {
        Map<String, Response> out = new LinkedHashMap<>();
        loadAll(assessmentId).forEach(r -> out.put(r.questionId(), r));
        return out;
    }

    public Set<String> answeredQuestionIds(long assessmentId) {
        return new HashSet<>(jdbcTemplate.queryForList(
                "SELECT question_id FROM responses WHERE assessment_id=? AND score IS NOT NULL",
                String.class, assessmentId));
    }
}
