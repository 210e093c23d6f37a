package io.partybroker.observability;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.partybroker.util.Hashing;
import io.partybroker.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSONL trail of query lifecycle and GC actions. Each row stores the hash of the
 * previous row, so an edited or dropped line breaks the chain.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String party;
    private String previousHash;

    public AuditLogger(Path auditFile, String party) {
        this.auditFile = auditFile;
        this.party = party;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another replica created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(String action, String sessionId, String result, Map<String, Object> details) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("party", party);
        row.put("action", action);
        row.put("session_id", sessionId);
        row.put("result", result);
        row.put("details", details == null ? Map.of() : details);
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Re-hashes every row and checks the links between them.
     *
     * @return index of the first broken row, or -1 when the chain is intact
     */
    public synchronized int verifyChain() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String prev = "";
        int index = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            Map<String, Object> row = parseRow(line);
            Object storedHash = row.remove("hash");
            if (!prev.equals(String.valueOf(row.get("prev_hash")))) {
                return index;
            }
            String expected = Hashing.sha256Hex(Jsons.toCompactJson(row));
            if (!expected.equals(storedHash)) {
                return index;
            }
            prev = expected;
            index++;
        }
        return -1;
    }

    public synchronized List<Map<String, Object>> readAll() {
        try {
            return Files.readAllLines(auditFile, StandardCharsets.UTF_8).stream()
                    .filter(line -> line != null && !line.isBlank())
                    .map(AuditLogger::parseRow)
                    .toList();
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
    }

    private static Map<String, Object> parseRow(String line) {
        try {
            return Jsons.compact().readValue(line, new TypeReference<LinkedHashMap<String, Object>>() {
            });
        } catch (IOException e) {
            throw new RuntimeException("Failed to parse audit row", e);
        }
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            JsonNode node = Jsons.compact().readTree(last);
            return node.path("hash").asText("");
        } catch (IOException e) {
            log.warn("audit log {} is unreadable, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }
}
