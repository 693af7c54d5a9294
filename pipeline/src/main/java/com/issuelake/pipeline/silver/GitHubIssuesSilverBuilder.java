package com.issuelake.pipeline.silver;

import com.issuelake.pipeline.config.PipelineConfig;
import com.issuelake.pipeline.config.SourceConfig;
import com.issuelake.pipeline.loader.BronzeReader;
import com.issuelake.pipeline.loader.BronzeReader.BronzeFile;
import com.issuelake.pipeline.validate.SchemaValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * Builds the GitHub issues silver snapshot from every bronze file of the given sources.
 *
 * <p>Steps: load bronze, compute rolling counts over the full history, keep the latest row per
 * issue, keep open issues, derive features and label, split by ingest time, write the
 * snapshot with its {@code _meta.json}.</p>
 */
public class GitHubIssuesSilverBuilder {

    private static final Logger logger = LoggerFactory.getLogger(GitHubIssuesSilverBuilder.class);

    static final Path SILVER_PATH = Path.of("silver", "github", "issues");
    static final DateTimeFormatter RUN_STAMP = DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss")
            .withZone(ZoneOffset.UTC);

    static final Duration SHORT_WINDOW = Duration.ofDays(30);
    static final Duration LONG_WINDOW = Duration.ofDays(90);
    static final double RECENT_UPDATE_DAYS = 7.0;

    private static final Pattern BUG_WORD = Pattern.compile("\\bbug\\b", Pattern.CASE_INSENSITIVE);
    private static final double MILLIS_PER_DAY = Duration.ofDays(1).toMillis();

    private final BronzeReader bronzeReader;
    private final SilverSnapshotWriter snapshotWriter;
    private final Clock clock;
    private final Function<Path, String> revisionLookup;

    public GitHubIssuesSilverBuilder() {
        this(new BronzeReader(), new SilverSnapshotWriter(), Clock.systemUTC(), GitRevision::resolve);
    }

    /**
     * Constructor for testing: accepts collaborators directly.
     */
    GitHubIssuesSilverBuilder(BronzeReader bronzeReader, SilverSnapshotWriter snapshotWriter,
                              Clock clock, Function<Path, String> revisionLookup) {
        this.bronzeReader = bronzeReader;
        this.snapshotWriter = snapshotWriter;
        this.clock = clock;
        this.revisionLookup = revisionLookup;
    }

    /**
     * @return the snapshot metadata, or {@code null} if there was no usable bronze data
     *         or no open issue remained
     */
    public SilverMetadata build(List<SourceConfig> sources, PipelineConfig config) throws IOException {
        Path lakeRoot = config.lakeRoot();

        List<IssueRow> rows = loadBronze(sources, lakeRoot);
        if (rows.isEmpty()) {
            logger.info("No bronze GitHub issues found; skipping silver build");
            return null;
        }
        int rawCount = rows.size();

        applyRollingCounts(rows);

        List<IssueRow> deduped = dedupe(rows);
        int dedupCount = deduped.size();

        List<IssueRow> open = new ArrayList<>();
        for (IssueRow row : deduped) {
            if (row.state != null && row.state.toLowerCase(Locale.ROOT).equals("open")) {
                open.add(row);
            }
        }
        if (open.isEmpty()) {
            logger.info("No open issues after dedupe ({} rows); skipping silver build", dedupCount);
            return null;
        }

        Instant reference = open.stream()
                .map(r -> r.ingestTs)
                .filter(Objects::nonNull)
                .max(Comparator.naturalOrder())
                .orElseGet(() -> Instant.now(clock));
        for (IssueRow row : open) {
            deriveFeatures(row, reference);
        }

        // stable, nulls last
        open.sort(Comparator.comparing((IssueRow r) -> r.ingestTs,
                Comparator.nullsLast(Comparator.naturalOrder())));
        List<Map<String, Object>> output = open.stream().map(IssueRow::toOutputRow).toList();
        Map<String, List<Map<String, Object>>> splits = DatasetSplitter.split(output);

        Instant now = Instant.now(clock);
        String runStamp = RUN_STAMP.format(now);
        Path silverRoot = lakeRoot.resolve(SILVER_PATH);
        Path runDir = silverRoot.resolve("run_ts=" + runStamp);

        Map<String, Integer> splitRows = new LinkedHashMap<>();
        splits.forEach((name, splitRowsList) -> splitRows.put(name, splitRowsList.size()));

        SilverMetadata.Quality quality = new SilverMetadata.Quality(
                rawCount,
                dedupCount,
                output.size(),
                rawCount - dedupCount,
                splitRows,
                missingFractions(output));

        SilverMetadata metadata = new SilverMetadata(
                now,
                reference,
                output.size(),
                FeatureSchema.FEATURE_COLUMNS,
                FeatureSchema.LABEL_COLUMN,
                revisionLookup.apply(lakeRoot.toAbsolutePath().getParent()),
                ConfigHasher.hash(config.rawDocument(), config.configPath()),
                sources.stream().map(SourceConfig::destination).toList(),
                quality,
                lakeRoot.relativize(runDir).toString().replace('\\', '/'),
                FeatureSchema.FEATURE_VERSION);

        snapshotWriter.write(silverRoot, runStamp, splits, metadata);
        logger.info("Silver snapshot created run={} rows={} duplicates_removed={}",
                runStamp, output.size(), rawCount - dedupCount);
        return metadata;
    }

    // -------------------------------------------------------------------------
    // Load
    // -------------------------------------------------------------------------

    private List<IssueRow> loadBronze(List<SourceConfig> sources, Path lakeRoot) throws IOException {
        List<IssueRow> rows = new ArrayList<>();
        for (SourceConfig source : sources) {
            for (BronzeFile file : bronzeReader.readDestination(lakeRoot, source.destination())) {
                Set<String> columns = new HashSet<>(file.table().columns());
                if (!columns.containsAll(FeatureSchema.REQUIRED_BRONZE_COLUMNS)) {
                    logger.warn("Skipping legacy bronze file {} (missing required columns)", file.path());
                    continue;
                }
                for (Map<String, Object> record : file.table().rows()) {
                    rows.add(toIssueRow(record));
                }
            }
        }
        return rows;
    }

    static IssueRow toIssueRow(Map<String, Object> record) {
        IssueRow row = new IssueRow();
        row.id = toLong(record.get("id"));
        row.repoOwner = toStr(record.get("repo_owner"));
        row.repoName = toStr(record.get("repo_name"));
        row.number = toLong(record.get("number"));
        row.title = toStr(record.get("title"));
        row.state = toStr(record.get("state"));
        row.userLogin = toStr(record.get("user_login"));
        row.comments = toLong(record.get("comments"));
        row.createdAt = toInstant(record.get("created_at"));
        row.updatedAt = toInstant(record.get("updated_at"));
        row.ingestTs = toInstant(record.get("ingest_ts"));
        return row;
    }

    // -------------------------------------------------------------------------
    // Aggregates and dedupe
    // -------------------------------------------------------------------------

    static void applyRollingCounts(List<IssueRow> rows) {
        List<Instant> created = rows.stream().map(r -> r.createdAt).toList();
        List<String> repos = rows.stream().map(IssueRow::repoFullName).toList();
        List<String> users = rows.stream().map(r -> r.userLogin).toList();

        long[] repo30 = RollingWindowCounter.countPriorInWindow(repos, created, SHORT_WINDOW);
        long[] repo90 = RollingWindowCounter.countPriorInWindow(repos, created, LONG_WINDOW);
        long[] user30 = RollingWindowCounter.countPriorInWindow(users, created, SHORT_WINDOW);
        long[] user90 = RollingWindowCounter.countPriorInWindow(users, created, LONG_WINDOW);
        for (int i = 0; i < rows.size(); i++) {
            IssueRow row = rows.get(i);
            row.repoCount30d = repo30[i];
            row.repoCount90d = repo90[i];
            row.userCount30d = user30[i];
            row.userCount90d = user90[i];
        }
    }

    /**
     * Latest observation per issue id by {@code (updated_at, ingest_ts)}; missing timestamps sort first.
     */
    static List<IssueRow> dedupe(List<IssueRow> rows) {
        Comparator<Instant> nullsFirst = Comparator.nullsFirst(Comparator.naturalOrder());
        List<IssueRow> ordered = new ArrayList<>(rows);
        ordered.sort(Comparator.comparing((IssueRow r) -> r.updatedAt, nullsFirst)
                .thenComparing(r -> r.ingestTs, nullsFirst));

        Map<Long, IssueRow> latest = new LinkedHashMap<>();
        for (IssueRow row : ordered) {
            latest.remove(row.id);
            latest.put(row.id, row);
        }
        return new ArrayList<>(latest.values());
    }

    // -------------------------------------------------------------------------
    // Features
    // -------------------------------------------------------------------------

    static void deriveFeatures(IssueRow row, Instant reference) {
        String title = row.title != null ? row.title : "";
        row.titleLength = title.codePointCount(0, title.length());
        String trimmed = title.strip();
        row.titleWordCount = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;

        row.issueAgeDays = row.createdAt != null ? daysBetween(row.createdAt, reference) : 0.0;
        if (row.updatedAt != null) {
            row.timeSinceUpdateDays = daysBetween(row.updatedAt, reference);
            row.recentUpdate = row.timeSinceUpdateDays <= RECENT_UPDATE_DAYS ? 1 : 0;
        } else {
            row.timeSinceUpdateDays = 0.0;
            row.recentUpdate = 0;
        }
        if (row.createdAt != null) {
            DayOfWeek day = row.createdAt.atZone(ZoneOffset.UTC).getDayOfWeek();
            row.weekendCreated = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY ? 1 : 0;
        } else {
            row.weekendCreated = 0;
        }
        row.titleHasBug = BUG_WORD.matcher(title).find() ? 1 : 0;
        row.titleHasError = title.toLowerCase(Locale.ROOT).contains("error") ? 1 : 0;

        long comments = row.comments != null ? row.comments : 0L;
        row.priorityLabel = comments >= FeatureSchema.LABEL_COMMENT_THRESHOLD ? 1 : 0;
    }

    private static double daysBetween(Instant from, Instant to) {
        return Duration.between(from, to).toMillis() / MILLIS_PER_DAY;
    }

    static Map<String, Double> missingFractions(List<Map<String, Object>> rows) {
        Map<String, Double> missing = new LinkedHashMap<>();
        for (String column : FeatureSchema.outputColumns()) {
            long nulls = rows.stream().filter(r -> r.get(column) == null).count();
            missing.put(column, rows.isEmpty() ? 0.0 : (double) nulls / rows.size());
        }
        return missing;
    }

    // -------------------------------------------------------------------------
    // Value coercion
    // -------------------------------------------------------------------------

    static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Number millis) {
            return Instant.ofEpochMilli(millis.longValue());
        }
        String text = value.toString().strip();
        if (text.isEmpty()) {
            return null;
        }
        try {
            return SchemaValidator.parseTimestamp(text);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    static Long toLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        try {
            return Long.parseLong(value.toString().strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String toStr(Object value) {
        return value != null ? value.toString() : null;
    }
}
