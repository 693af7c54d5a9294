package com.issuelake.pipeline.loader;

import org.apache.avro.Schema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Appends validated records to the bronze layer as Parquet files laid out as
 * {@code <lakeRoot>/<destination>/<partitionKey>=<value>/part-<n>.parquet}.
 * Each call adds one new file per partition and never touches existing files.
 */
public class ParquetLakeWriter {

    private static final Logger logger = LoggerFactory.getLogger(ParquetLakeWriter.class);

    private final Clock clock;

    public ParquetLakeWriter() {
        this(Clock.systemUTC());
    }

    public ParquetLakeWriter(Clock clock) {
        this.clock = clock;
    }

    /**
     * Groups records by the partition key's value and writes one file per group.
     * Records without a value get today's UTC date.
     *
     * @return rows written and the partition values touched; {@link WriteResult#EMPTY} for no records
     */
    public WriteResult write(List<Map<String, Object>> records, Path lakeRoot, String destination,
                             String partitionKey) throws IOException {
        if (records == null || records.isEmpty()) {
            logger.debug("No rows to write to {}", destination);
            return WriteResult.EMPTY;
        }

        String today = LocalDate.now(clock).toString();
        Map<String, List<Map<String, Object>>> byPartition = new LinkedHashMap<>();
        List<Map<String, Object>> stamped = new ArrayList<>(records.size());
        for (Map<String, Object> record : records) {
            Map<String, Object> row = new LinkedHashMap<>(record);
            if (row.get(partitionKey) == null) {
                row.put(partitionKey, today);
            }
            stamped.add(row);
            byPartition.computeIfAbsent(String.valueOf(row.get(partitionKey)), k -> new ArrayList<>()).add(row);
        }

        Map<String, String> fieldNames = AvroSchemas.fieldNames(stamped);
        Schema schema = AvroSchemas.inferRecordSchema(destination, stamped);

        Path destinationDir = lakeRoot.resolve(destination).normalize();
        for (Map.Entry<String, List<Map<String, Object>>> partition : byPartition.entrySet()) {
            Path dir = destinationDir.resolve(partitionKey + "=" + escapePathValue(partition.getKey())).normalize();
            if (!destinationDir.equals(dir.getParent())) {
                throw new IOException("Partition value escapes " + destinationDir + ": " + partition.getKey());
            }
            Files.createDirectories(dir);
            Path file = dir.resolve("part-" + ParquetFiles.nextPartIndex(dir) + ".parquet");
            ParquetFiles.write(file, schema, renameColumns(partition.getValue(), fieldNames));
            logger.debug("Wrote {} rows to {}", partition.getValue().size(), file);
        }

        List<String> partitions = new ArrayList<>(byPartition.keySet());
        logger.debug("Wrote {} rows to {} partitions={}", records.size(), destination, partitions);
        return new WriteResult(records.size(), partitions);
    }

    /**
     * Percent-escapes characters that cannot appear in a single directory name.
     */
    static String escapePathValue(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            switch (c) {
                case '%' -> out.append("%25");
                case '/' -> out.append("%2F");
                case '\\' -> out.append("%5C");
                case ':' -> out.append("%3A");
                default -> out.append(c);
            }
        }
        return out.toString();
    }

    private static List<Map<String, Object>> renameColumns(List<Map<String, Object>> rows,
                                                           Map<String, String> fieldNames) {
        List<Map<String, Object>> renamed = new ArrayList<>(rows.size());
        for (Map<String, Object> row : rows) {
            Map<String, Object> out = new LinkedHashMap<>();
            row.forEach((column, value) -> out.put(fieldNames.get(column), value));
            renamed.add(out);
        }
        return renamed;
    }
}
