package com.issuelake.pipeline.loader;

import org.apache.avro.Schema;
import org.apache.avro.generic.GenericData;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.parquet.avro.AvroParquetReader;
import org.apache.parquet.avro.AvroParquetWriter;
import org.apache.parquet.hadoop.ParquetFileWriter;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.ParquetWriter;
import org.apache.parquet.hadoop.metadata.CompressionCodecName;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.apache.parquet.hadoop.util.HadoopOutputFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Local Parquet file I/O through parquet-avro on the Hadoop local file system.
 */
public final class ParquetFiles {

    private ParquetFiles() {}

    static final Pattern PART_FILE = Pattern.compile("part-(\\d+)\\.parquet");

    /**
     * Rows of one Parquet file plus its column names in schema order.
     */
    public record Table(List<String> columns, List<Map<String, Object>> rows) {}

    /**
     * Writes rows keyed by Avro field name. Fails if the file already exists.
     */
    public static void write(Path file, Schema schema, List<Map<String, Object>> rows) throws IOException {
        Configuration conf = new Configuration();
        org.apache.hadoop.fs.Path target = new org.apache.hadoop.fs.Path(file.toAbsolutePath().toUri());
        try (ParquetWriter<GenericRecord> writer = AvroParquetWriter
                .<GenericRecord>builder(HadoopOutputFile.fromPath(target, conf))
                .withSchema(schema)
                .withConf(conf)
                .withCompressionCodec(CompressionCodecName.SNAPPY)
                .withWriteMode(ParquetFileWriter.Mode.CREATE)
                .build()) {
            for (Map<String, Object> row : rows) {
                GenericRecord record = new GenericData.Record(schema);
                for (Schema.Field field : schema.getFields()) {
                    record.put(field.name(), AvroSchemas.toAvroValue(field.schema(), row.get(field.name())));
                }
                writer.write(record);
            }
        }
    }

    public static Table read(Path file) throws IOException {
        Configuration conf = new Configuration();
        org.apache.hadoop.fs.Path source = new org.apache.hadoop.fs.Path(file.toAbsolutePath().toUri());
        List<Map<String, Object>> rows = new ArrayList<>();
        List<String> columns = List.of();
        try (ParquetReader<GenericRecord> reader = AvroParquetReader
                .<GenericRecord>builder(HadoopInputFile.fromPath(source, conf))
                .withConf(conf)
                .build()) {
            GenericRecord record;
            while ((record = reader.read()) != null) {
                if (columns.isEmpty()) {
                    columns = record.getSchema().getFields().stream().map(Schema.Field::name).toList();
                }
                Map<String, Object> row = new LinkedHashMap<>();
                for (Schema.Field field : record.getSchema().getFields()) {
                    Object value = record.get(field.name());
                    row.put(field.name(), value instanceof CharSequence cs ? cs.toString() : value);
                }
                rows.add(row);
            }
        }
        return new Table(columns, rows);
    }

    /**
     * All {@code part-N.parquet} files below {@code root}, in path order.
     */
    public static List<Path> listPartFiles(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            return List.of();
        }
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile)
                    .filter(p -> PART_FILE.matcher(p.getFileName().toString()).matches())
                    .sorted()
                    .toList();
        }
    }

    /**
     * Next free part index in a partition directory: one past the highest existing index.
     */
    static int nextPartIndex(Path partitionDir) throws IOException {
        int next = 0;
        try (Stream<Path> files = Files.list(partitionDir)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                Matcher matcher = PART_FILE.matcher(file.getFileName().toString());
                if (matcher.matches()) {
                    next = Math.max(next, Integer.parseInt(matcher.group(1)) + 1);
                }
            }
        }
        return next;
    }
}
