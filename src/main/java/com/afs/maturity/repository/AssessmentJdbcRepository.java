package com.afs.maturity.repository;

import com.afs.maturity.assessment.AssessmentModels.Assessment;
import com.afs.maturity.assessment.AssessmentModels.AssessmentStatus;
import com.afs.maturity.assessment.AssessmentModels.CreateAssessmentRequest;
import com.afs.maturity.assessment.AssessmentModels.SectionScoreRow;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.PreparedStatement;
import java.sql.Statement;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class AssessmentJdbcRepository {
    private static final String COLUMNS = "id, organization_name, account_name, first_name, last_name, email, industry, " +
            "status, created_at, updated_at, completed_at, overall_score, maturity_level";

    private static final RowMapper<Assessment> ROW = (rs, n) -> new Assessment(
            rs.getLong(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getString(6), rs.getString(7),
            AssessmentStatus.valueOf(rs.getString(8)),
            Instant.parse(rs.getString(9)),
            Instant.parse(rs.getString(10)),
            parseInstant(rs.getString(11)),
            rs.getObject(12, Double.class),
            rs.getString(13));

    private final JdbcTemplate jdbcTemplate;

    public AssessmentJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public long insert(CreateAssessmentRequest r, Instant now) {
        KeyHolder keys = new GeneratedKeyHolder();
        jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(
                    "INSERT INTO assessments(organization_name, account_name, first_name, last_name, email, industry, status, created_at, updated_at) VALUES (?,?,?,?,?,?,?,?,?)",
                    Statement.RETURN_GENERATED_KEYS);
            ps.setString(1, r.organizationName().trim());
            ps.setString(2, r.accountName());
            ps.setString(3, r.firstName());
            ps.setString(4, r.lastName());
            ps.setString(5, r.email() == null ? null : r.email().trim().toLowerCase());
            ps.setString(6, r.industry());
            ps.setString(7, AssessmentStatus.IN_PROGRESS.name());
            ps.setString(8, now.toString());
            ps.setString(9, now.toString());
            return ps;
        }, keys);
        Number key = keys.getKey();
        if (key == null) throw new IllegalStateException("No id generated for assessment");
        return key.longValue();
    }

    public Optional<Assessment> find(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments WHERE id=?", ROW, id).stream().findFirst();
    }

    /** Row lock held until the surrounding transaction ends. */
    public Optional<Assessment> lockForUpdate(long id) {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments WHERE id=? FOR UPDATE", ROW, id).stream().findFirst();
    }

    public List<Assessment> loadAll() {
        return jdbcTemplate.query("SELECT " + COLUMNS + " FROM assessments ORDER BY id DESC", ROW);
    }

    public void touch(long id, Instant now) {
        jdbcTemplate.update("UPDATE assessments SET updated_at=? WHERE id=?", now.toString(), id);
    }

    public void markCompleted(long id, Instant now, double overallScore, String maturityLevel, String resultsJson) {
        jdbcTemplate.update(
                "UPDATE assessments SET status=?, completed_at=?, updated_at=?, overall_score=?, maturity_level=?, results_json=? WHERE id=?",
                AssessmentStatus.COMPLETED.name(), now.toString(), now.toString(), overallScore, maturityLevel, resultsJson, id);
    }

    public void updateStatus(long id, AssessmentStatus status, Instant now) {
        jdbcTemplate.update("UPDATE assessments SET status=?, updated_at=? WHERE id=?", status.name(), now.toString(), id);
    }

    public Optional<String> loadResultsJson(long id) {
        return jdbcTemplate.query("SELECT results_json FROM assessments WHERE id=?", (rs, n) -> rs.getString(1), id)
                .stream().filter(s -> s != null && !s.isBlank()).findFirst();
    }

    public void replaceSectionScores(long id, List<SectionScoreRow> rows) {
        jdbcTemplate.update("DELETE FROM assessment_section_scores WHERE assessment_id=?", id);
        rows.forEach(r -> jdbcTemplate.update(
                "INSERT INTO assessment_section_scores(assessment_id, section_id, legacy_score, percentage) VALUES (?,?,?,?)",
                r.assessmentId(), r.sectionId(), r.legacyScore(), r.percentage()));
    }

    public List<SectionScoreRow> loadSectionScores(long id) {
        return jdbcTemplate.query(
                "SELECT assessment_id, section_id, legacy_score, percentage FROM assessment_section_scores WHERE assessment_id=? ORDER BY section_id",
                (rs, n) -> new SectionScoreRow(rs.getLong(1), rs.getString(2), rs.getDouble(3), rs.getDouble(4)), id);
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM assessments WHERE id=?", id) > 0;
    }

    private static Instant parseInstant(String value) {
        return value == null || value.isBlank() ? null : Instant.parse(value);
    }
}
