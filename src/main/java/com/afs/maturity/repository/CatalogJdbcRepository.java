package com.afs.maturity.repository;

import com.afs.maturity.domain.CatalogModels.Area;
import com.afs.maturity.domain.CatalogModels.Catalog;
import com.afs.maturity.domain.CatalogModels.Question;
import com.afs.maturity.domain.CatalogModels.Section;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public class CatalogJdbcRepository {
    private final JdbcTemplate jdbcTemplate;

    public CatalogJdbcRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Catalog loadCatalog() {
        return new Catalog(loadSections(), loadAreas(), loadQuestions());
    }

    public List<Section> loadSections() {
        return jdbcTemplate.query(
                "SELECT id, name, description, display_order, color, icon FROM sections ORDER BY display_order, id",
                (rs, n) -> new Section(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4), rs.getString(5), rs.getString(6)));
    }

    public List<Area> loadAreas() {
        return jdbcTemplate.query(
                "SELECT id, section_id, name, description, display_order FROM areas ORDER BY section_id, display_order, id",
                (rs, n) -> new Area(rs.getString(1), rs.getString(2), rs.getString(3), rs.getString(4), rs.getInt(5)));
    }

    public List<Question> loadQuestions() {
        return jdbcTemplate.query(
                "SELECT id, area_id, question_text, display_order, is_active, level_1_desc, level_2_desc, level_3_desc, level_4_desc " +
                        "FROM questions ORDER BY area_id, display_order, id",
                (rs, n) -> new Question(rs.getString(1), rs.getString(2), rs.getString(3), rs.getInt(4), rs.getBoolean(5),
                        rs.getString(6), rs.getString(7), rs.getString(8), rs.getString(9)));
    }

    public void replaceCatalog(List<Section> sections, List<Area> areas, List<Question> questions) {
        jdbcTemplate.update("DELETE FROM questions");
        jdbcTemplate.update("DELETE FROM areas");
        jdbcTemplate.update("DELETE FROM sections");

        sections.forEach(s -> jdbcTemplate.update(
                "INSERT INTO sections(id, name, description, display_order, color, icon) VALUES (?,?,?,?,?,?)",
                s.id(), s.name(), s.description(), s.displayOrder(), s.color(), s.icon()));

        areas.forEach(a -> jdbcTemplate.update(
                "INSERT INTO areas(id, section_id, name, description, display_order) VALUES (?,?,?,?,?)",
                a.id(), a.sectionId(), a.name(), a.description(), a.displayOrder()));

        questions.forEach(q -> jdbcTemplate.update(
                "INSERT INTO questions(id, area_id, question_text, display_order, is_active, level_1_desc, level_2_desc, level_3_desc, level_4_desc) VALUES (?,?,?,?,?,?,?,?,?)",
                q.id(), q.areaId(), q.text(), q.displayOrder(), q.active(), q.level1(), q.level2(), q.level3(), q.level4()));
    }
}
