package ai.doctables.reconstructor.validate;

import ai.doctables.reconstructor.config.ValidationSettings;
import ai.doctables.reconstructor.model.LogicalTable;
import java.time.Clock;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the fixed rule chain over every table and aggregates the findings into one report.
 * Validation never throws: a rule that breaks is reported as a failed issue.
 */
public class TableValidator {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableValidator.class);

    private final List<TableRule> rules;
    private final Clock clock;

    public TableValidator() {
        this(ValidationSettings.defaults(), Clock.systemUTC());
    }

    public TableValidator(ValidationSettings settings, Clock clock) {
        this(List.of(
                new DuplicateRowRule(),
                new ColumnConsistencyRule(),
                new HeaderPresenceRule(),
                new DistributionTableRule(settings.percentTolerance(), settings.distributionKeywordMinimum()),
                new RosterTableRule()), clock);
    }

    TableValidator(List<TableRule> rules, Clock clock) {
        this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ValidationReport validate(List<LogicalTable> tables) {
        return validate(tables, List.of());
    }

    /**
     * Validates {@code tables}; a missing or blank name defaults to {@code Table_<n>} (1-based).
     */
    public ValidationReport validate(List<LogicalTable> tables, List<String> names) {
        ValidationReport.Accumulator report = ValidationReport.accumulate(clock.instant());
        List<LogicalTable> safeTables = tables == null ? List.of() : tables;
        List<String> safeNames = names == null ? List.of() : names;
        for (int i = 0; i < safeTables.size(); i++) {
            String name = i < safeNames.size() && safeNames.get(i) != null && !safeNames.get(i).isBlank()
                    ? safeNames.get(i)
                    : "Table_" + (i + 1);
            report.recordTable(validateTable(safeTables.get(i), name, report));
        }
        ValidationReport frozen = report.freeze();
        LOGGER.info("Validated {} tables: {} passed, {} with warnings, {} failed (overall {})",
                frozen.tablesValidated(), frozen.tablesPassed(), frozen.tablesWithWarnings(),
                frozen.tablesFailed(), frozen.overallStatus().label());
        return frozen;
    }

    private ValidationStatus validateTable(LogicalTable table, String name, ValidationReport.Accumulator report) {
        ValidationStatus worst = ValidationStatus.PASSED;
        for (TableRule rule : rules) {
            try {
                worst = worst.raiseTo(rule.check(table, name, report));
            } catch (RuntimeException ex) {
                LOGGER.warn("Rule {} failed on {}: {}", rule.name(), name, ex.getMessage(), ex);
                report.addIssue(ValidationIssue.of(ValidationStatus.FAILED,
                                "Validation rule " + rule.name() + " could not be evaluated: " + ex.getMessage(), name)
                        .withDetail("rule", rule.name())
                        .withDetail("error", ex.getClass().getSimpleName()));
                worst = ValidationStatus.FAILED;
            }
        }
        return worst;
    }
}
