package com.stepwise.core.rollback;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.stepwise.core.StepwiseException;
import com.stepwise.core.model.FailureEntry;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only failure log, one JSON object per line.
 */
public class FailureLedger {

    public static final String LEDGER_FILE = "failures.jsonl";

    private final Path ledgerFile;
    private final ObjectMapper objectMapper;
    private final ObjectWriter lineWriter;

    public FailureLedger(Path stateDir, ObjectMapper objectMapper) {
        this.ledgerFile = stateDir.resolve(LEDGER_FILE);
        this.objectMapper = objectMapper;
        this.lineWriter = objectMapper.writer().without(SerializationFeature.INDENT_OUTPUT);
    }

    public synchronized void append(FailureEntry entry) {
        try {
            Files.createDirectories(ledgerFile.getParent());
            String line = lineWriter.writeValueAsString(entry) + "\n";
            Files.writeString(ledgerFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StepwiseException("Failed to append to failure ledger " + ledgerFile, e);
        }
    }

    public synchronized List<FailureEntry> entries() {
        if (!Files.exists(ledgerFile)) {
            return List.of();
        }
        try {
            var entries = new ArrayList<FailureEntry>();
            for (String line : Files.readAllLines(ledgerFile, StandardCharsets.UTF_8)) {
                if (!line.isBlank()) {
                    entries.add(objectMapper.readValue(line, FailureEntry.class));
                }
            }
            return entries;
        } catch (IOException e) {
            throw new StepwiseException("Failed to read failure ledger " + ledgerFile, e);
        }
    }

    public Path getLedgerFile() {
        return ledgerFile;
    }
}
