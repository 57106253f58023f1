package ai.doctables.reconstructor.engine;

import ai.doctables.reconstructor.config.Config;
import ai.doctables.reconstructor.model.FragmentDocument;
import ai.doctables.reconstructor.model.LogicalTable;
import ai.doctables.reconstructor.model.ScoreDomain;
import ai.doctables.reconstructor.profile.DocumentMetadata;
import ai.doctables.reconstructor.profile.DocumentProfile;
import ai.doctables.reconstructor.profile.ProfileMatch;
import ai.doctables.reconstructor.profile.ProfileRegistry;
import ai.doctables.reconstructor.segment.PagePreservedTableBuilder;
import ai.doctables.reconstructor.segment.SegmentationStrategy;
import ai.doctables.reconstructor.segment.TableSegmenter;
import ai.doctables.reconstructor.validate.TableValidator;
import ai.doctables.reconstructor.validate.ValidationReport;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns one document's fragments into page-preserved and logical tables and certifies them.
 */
public class TableReconstructionEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableReconstructionEngine.class);

    private final ProfileRegistry profileRegistry;
    private final TableSegmenter segmenter;
    private final PagePreservedTableBuilder pageTableBuilder;
    private final TableValidator validator;
    private final Optional<SegmentationStrategy> configuredStrategy;
    private final ExtractionMode extractionMode;
    private final boolean validationEnabled;
    private final Clock clock;

    public TableReconstructionEngine(Config config) {
        this(config, ProfileRegistry.withDefaults(config.minProfileConfidence()), Clock.systemUTC());
    }

    public TableReconstructionEngine(Config config, ProfileRegistry profileRegistry, Clock clock) {
        this(profileRegistry,
                new TableSegmenter(config.segmentationSettings()),
                new PagePreservedTableBuilder(),
                new TableValidator(config.validationSettings(), clock),
                config.strategy(),
                config.extractionMode(),
                config.validationEnabled(),
                clock);
    }

    TableReconstructionEngine(ProfileRegistry profileRegistry,
                              TableSegmenter segmenter,
                              PagePreservedTableBuilder pageTableBuilder,
                              TableValidator validator,
                              Optional<SegmentationStrategy> configuredStrategy,
                              ExtractionMode extractionMode,
                              boolean validationEnabled,
                              Clock clock) {
        this.profileRegistry = Objects.requireNonNull(profileRegistry, "profileRegistry");
        this.segmenter = Objects.requireNonNull(segmenter, "segmenter");
        this.pageTableBuilder = Objects.requireNonNull(pageTableBuilder, "pageTableBuilder");
        this.validator = Objects.requireNonNull(validator, "validator");
        this.configuredStrategy = Objects.requireNonNull(configuredStrategy, "configuredStrategy");
        this.extractionMode = Objects.requireNonNull(extractionMode, "extractionMode");
        this.validationEnabled = validationEnabled;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public ReconstructionResult reconstruct(FragmentDocument document) {
        return reconstruct(document, configuredStrategy);
    }

    /**
     * Reconstructs {@code document}. An explicit strategy wins over the matched profile's strategy,
     * which wins over detection.
     */
    public ReconstructionResult reconstruct(FragmentDocument document, Optional<SegmentationStrategy> strategy) {
        Objects.requireNonNull(document, "document");
        Optional<ProfileMatch> match = profileRegistry.select(document.fragments(), document.pageTexts(),
                document.context());
        match.ifPresentOrElse(
                found -> LOGGER.info("Document {} matched profile {} (confidence {})", document.name(),
                        found.profile().id(), formatConfidence(found.confidence())),
                () -> LOGGER.info("Document {} matched no profile", document.name()));

        SegmentationStrategy resolved = strategy
                .or(() -> match.map(found -> found.profile().segmentationStrategy()))
                .orElseGet(() -> segmenter.detectStrategy(document.fragments()));
        List<ScoreDomain> domains = match
                .flatMap(found -> found.profile().scoreDomains())
                .orElse(List.of());

        List<LogicalTable> logicalTables = segmenter.segment(document.fragments(), resolved, domains);
        List<LogicalTable> pageTables = pageTableBuilder.build(document.fragments());
        List<LogicalTable> routed = extractionMode.route(pageTables, logicalTables);
        List<String> names = tableNames(routed);

        ValidationReport report = validationEnabled
                ? validator.validate(routed, names)
                : ValidationReport.empty(clock.instant());

        DocumentMetadata metadata = match
                .map(found -> found.profile()
                        .extractMetadata(document.fragments(), document.pageTexts(), document.context())
                        .withConfidence(found.confidence()))
                .orElseGet(DocumentMetadata::empty);
        Optional<String> summary = match.flatMap(found -> found.profile().summarize(logicalTables));

        LOGGER.info("Document {}: {} page tables, {} logical tables ({}), validation {}",
                document.name(), pageTables.size(), logicalTables.size(), resolved.tag(),
                report.overallStatus().label());
        return new ReconstructionResult(document.name(), match, resolved, extractionMode, pageTables, logicalTables,
                names, report, metadata, summary);
    }

    public List<String> profileIds() {
        return profileRegistry.profileIds();
    }

    public Optional<DocumentProfile> findProfile(String id) {
        return profileRegistry.findById(id);
    }

    static String formatConfidence(double confidence) {
        return String.format(Locale.ROOT, "%.2f", confidence);
    }

    /**
     * Page tables are named after their page; logical tables after their domain or section when they
     * have one.
     */
    static List<String> tableNames(List<LogicalTable> tables) {
        List<String> names = new ArrayList<>(tables.size());
        for (int i = 0; i < tables.size(); i++) {
            LogicalTable table = tables.get(i);
            String fallback = "Table_" + (i + 1);
            String name = switch (table.tableType()) {
                case PAGE_PRESERVED -> table.sourcePages().isEmpty()
                        ? fallback
                        : "Page_" + table.sourcePages().get(0);
                case LOGICAL -> table.scoreDomain().map(ScoreDomain::name)
                        .or(table::sectionTitle)
                        .orElse(fallback);
            };
            names.add(name);
        }
        return names;
    }
}
