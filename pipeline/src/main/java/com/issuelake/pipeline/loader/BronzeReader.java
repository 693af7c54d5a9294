package com.issuelake.pipeline.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads back a bronze destination tree, one table per part file.
 */
public class BronzeReader {

    private static final Logger logger = LoggerFactory.getLogger(BronzeReader.class);

    public record BronzeFile(Path path, ParquetFiles.Table table) {}

    public List<BronzeFile> readDestination(Path lakeRoot, String destination) throws IOException {
        Path root = lakeRoot.resolve(destination);
        List<BronzeFile> files = new ArrayList<>();
        for (Path file : ParquetFiles.listPartFiles(root)) {
            files.add(new BronzeFile(file, ParquetFiles.read(file)));
        }
        logger.debug("Read {} bronze files under {}", files.size(), root);
        return files;
    }
}
