package com.afs.maturity.scoring;

import com.afs.maturity.domain.CatalogModels.Catalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.function.UnaryOperator;

@Component
public class ActiveSectionResolver {
    public static final String ENV_KEY = "ACTIVE_SECTION_IDS";

    private static final Logger log = LoggerFactory.getLogger(ActiveSectionResolver.class);

    private final String configured;
    private final UnaryOperator<String> environment;

    @Autowired
    public ActiveSectionResolver(@Value("${assessment.active-section-ids:}") String configured) {
        this(configured, System::getenv);
    }

    ActiveSectionResolver(String configured, UnaryOperator<String> environment) {
        this.configured = configured;
        this.environment = environment;
    }

    public ActiveSections resolve(Catalog catalog) {
        ActiveSections active = ActiveSections.resolve(configured, environment.apply(ENV_KEY), catalog.sectionIds());
        log.debug("Active sections resolved from {}: {}", active.source(), active.ids());
        return active;
    }
}
