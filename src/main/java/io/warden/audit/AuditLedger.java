package io.warden.audit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.warden.model.AnchorRecord;
import io.warden.model.AuditEntry;
import io.warden.security.SensitiveDataMasker;
import io.warden.util.Hashing;
import io.warden.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Append-only, hash-chained event log for one case.
 *
 * <p>Each line is the canonical JSON of {@code {action, actor, details, index, parent_hash,
 * timestamp}}, one space, and the lowercase SHA-256 hex of that JSON. The first entry's parent is
 * {@link Hashing#GENESIS_HASH}. The handle keeps the chain tip in memory; the file is scanned
 * once on open and afterwards only appended to.
 *
 * <p>All appends on one instance are serialized. Use {@link AuditLedgerRegistry} so that one file
 * never has two live handles.
 */
public final class AuditLedger {
    private static final Logger log = LoggerFactory.getLogger(AuditLedger.class);
    private static final int HASH_HEX_LENGTH = 64;

    private final String ledgerId;
    private final Path ledgerFile;
    private final Path anchorFile;
    private final boolean maskDetails;
    private long nextIndex;
    private String lastHash;
    private String tailError;

    public AuditLedger(String ledgerId, Path ledgerFile, Path anchorFile, boolean maskDetails) {
        if (ledgerId == null || ledgerId.isBlank()) {
            throw new IllegalArgumentException("ledger id cannot be empty");
        }
        this.ledgerId = ledgerId;
        this.ledgerFile = ledgerFile;
        this.anchorFile = anchorFile;
        this.maskDetails = maskDetails;
        this.nextIndex = 0L;
        this.lastHash = Hashing.GENESIS_HASH;
        try {
            Files.createDirectories(ledgerFile.toAbsolutePath().getParent());
            if (!Files.exists(ledgerFile)) {
                try {
                    Files.createFile(ledgerFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new LedgerWriteException("Failed to initialize ledger file: " + ledgerFile, e);
        }
        loadTail();
        log.info("Opened ledger {} at {} (entries={})", ledgerId, ledgerFile, nextIndex);
    }

    public String ledgerId() {
        return ledgerId;
    }

    public Path ledgerFile() {
        return ledgerFile;
    }

    public synchronized AuditEntry append(String actor, String action, Map<String, Object> details) {
        if (tailError != null) {
            throw new LedgerWriteException("Ledger " + ledgerId + " has an unreadable tail (" + tailError
                    + "); refusing to extend it");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("audit action cannot be empty");
        }
        Map<String, Object> safeDetails = details == null ? Map.of() : details;
        if (maskDetails) {
            safeDetails = SensitiveDataMasker.maskDetails(safeDetails);
        }
        ObjectNode fields = Jsons.mapper().createObjectNode();
        fields.put("index", nextIndex);
        fields.put("timestamp", Instant.now().toString());
        fields.put("actor", actor == null || actor.isBlank() ? "system" : actor.trim());
        fields.put("action", action.trim());
        fields.set("details", Jsons.mapper().valueToTree(safeDetails));
        fields.put("parent_hash", lastHash);

        String canonical = Jsons.canonicalJson(fields);
        String hash = Hashing.sha256Hex(canonical);
        String line = canonical + " " + hash + "\n";
        try {
            Files.writeString(ledgerFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LedgerWriteException("Failed to append to ledger " + ledgerId, e);
        }
        AuditEntry entry = toEntry(Jsons.canonicalize(fields), hash);
        nextIndex++;
        lastHash = hash;
        return entry;
    }

    public synchronized String latestHash() {
        return lastHash;
    }

    public synchronized long size() {
        return nextIndex;
    }

    public synchronized List<AuditEntry> entries() {
        List<AuditEntry> out = new ArrayList<>();
        List<String> lines = readLines(ledgerFile);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            ParsedLine parsed = parse(line);
            if (parsed == null) {
                throw new IllegalStateException("Ledger " + ledgerId + " line " + (i + 1) + " is unreadable");
            }
            out.add(toEntry(parsed.fields(), parsed.hash()));
        }
        return out;
    }

    /**
     * The newest {@code limit} entries in ledger order; all entries when {@code limit <= 0}.
     */
    public List<AuditEntry> entries(int limit) {
        List<AuditEntry> all = entries();
        if (limit <= 0 || limit >= all.size()) {
            return all;
        }
        return List.copyOf(all.subList(all.size() - limit, all.size()));
    }

    public boolean verifyChain() {
        return verify().ok();
    }

    /**
     * Recomputes every hash from the recorded fields and checks each parent pointer against the
     * previous stored hash. An empty ledger is intact.
     */
    public synchronized LedgerIntegrity verify() {
        List<String> lines = readLines(ledgerFile);
        String expectedParent = Hashing.GENESIS_HASH;
        long expectedIndex = 0L;
        int checked = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            ParsedLine parsed = parse(line);
            String reason = null;
            if (parsed == null) {
                reason = "invalid_line";
            } else if (parsed.fields().path("index").asLong(-1L) != expectedIndex) {
                reason = "index_mismatch";
            } else if (!expectedParent.equals(parsed.fields().path("parent_hash").asText(""))) {
                reason = "parent_hash_mismatch";
            } else if (!Hashing.sha256Hex(Jsons.canonicalJson(parsed.fields())).equals(parsed.hash())) {
                reason = "hash_mismatch";
            }
            if (reason != null) {
                log.warn("Ledger {} failed verification at line {}: {}", ledgerId, i + 1, reason);
                return new LedgerIntegrity(false, checked, i + 1, reason, expectedParent);
            }
            checked++;
            expectedIndex++;
            expectedParent = parsed.hash();
        }
        return new LedgerIntegrity(true, checked, 0, "", expectedParent);
    }

    /**
     * Merkle root over the stored entry hashes, in index order.
     */
    public String merkleRoot() {
        List<String> leaves = new ArrayList<>();
        for (AuditEntry entry : entries()) {
            leaves.add(entry.hash());
        }
        return Hashing.merkleRoot(leaves);
    }

    /**
     * Binds the current chain tip to {@code externalData} (a timestamp-authority token, a public
     * ledger transaction id, ...) in the separate anchor file.
     */
    public synchronized AnchorRecord anchor(Map<String, Object> externalData) {
        Map<String, Object> data = externalData == null ? Map.of() : externalData;
        ObjectNode row = Jsons.mapper().createObjectNode();
        row.put("ledger_id", ledgerId);
        row.put("latest_hash", lastHash);
        row.put("entry_count", nextIndex);
        row.put("timestamp", Instant.now().toString());
        row.set("anchor_data", Jsons.mapper().valueToTree(data));
        try {
            Files.createDirectories(anchorFile.toAbsolutePath().getParent());
            Files.writeString(anchorFile, Jsons.canonicalJson(row) + "\n", StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
        } catch (IOException e) {
            throw new LedgerWriteException("Failed to write anchor for ledger " + ledgerId, e);
        }
        log.info("Anchored ledger {} at entry {} ({})", ledgerId, nextIndex, lastHash);
        return toAnchor(row);
    }

    public synchronized List<AnchorRecord> anchors() {
        if (!Files.exists(anchorFile)) {
            return List.of();
        }
        List<AnchorRecord> out = new ArrayList<>();
        for (String line : readLines(anchorFile)) {
            if (!line.isBlank()) {
                out.add(toAnchor(Jsons.readTree(line)));
            }
        }
        return out;
    }

    /**
     * True when the chain is intact and its hash at the anchored entry count is the anchored hash.
     */
    public boolean verifyAnchor(AnchorRecord anchor) {
        if (anchor == null || !ledgerId.equals(anchor.ledgerId()) || !verifyChain()) {
            return false;
        }
        if (anchor.entryCount() == 0L) {
            return Hashing.GENESIS_HASH.equals(anchor.latestHash());
        }
        List<AuditEntry> all = entries();
        if (anchor.entryCount() > all.size()) {
            return false;
        }
        return all.get((int) anchor.entryCount() - 1).hash().equals(anchor.latestHash());
    }

    private void loadTail() {
        List<String> lines = readLines(ledgerFile);
        String last = "";
        for (String line : lines) {
            if (!line.isBlank()) {
                last = line;
            }
        }
        if (last.isBlank()) {
            return;
        }
        ParsedLine parsed = parse(last);
        if (parsed == null || !parsed.fields().path("index").canConvertToLong()) {
            tailError = "invalid_line";
            log.warn("Ledger {} tail line is unreadable; appends are disabled", ledgerId);
            return;
        }
        nextIndex = parsed.fields().path("index").asLong() + 1L;
        lastHash = parsed.hash();
    }

    private List<String> readLines(Path file) {
        try {
            return Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read ledger file: " + file, e);
        }
    }

    private static ParsedLine parse(String line) {
        if (line.length() < HASH_HEX_LENGTH + 3 || line.charAt(line.length() - HASH_HEX_LENGTH - 1) != ' ') {
            return null;
        }
        String hash = line.substring(line.length() - HASH_HEX_LENGTH);
        if (!Hashing.isSha256Hex(hash)) {
            return null;
        }
        try {
            JsonNode fields = Jsons.readTree(line.substring(0, line.length() - HASH_HEX_LENGTH - 1));
            if (fields == null || !fields.isObject()) {
                return null;
            }
            return new ParsedLine(fields, hash);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private static AuditEntry toEntry(JsonNode fields, String hash) {
        return new AuditEntry(
                fields.path("index").asLong(),
                fields.path("timestamp").asText(""),
                fields.path("actor").asText(""),
                fields.path("action").asText(""),
                Jsons.toMap(fields.path("details")),
                hash,
                fields.path("parent_hash").asText("")
        );
    }

    private static AnchorRecord toAnchor(JsonNode row) {
        return new AnchorRecord(
                row.path("ledger_id").asText(""),
                row.path("latest_hash").asText(""),
                row.path("entry_count").asLong(0L),
                row.path("timestamp").asText(""),
                Jsons.toMap(row.path("anchor_data"))
        );
    }

    private record ParsedLine(JsonNode fields, String hash) {
    }
}
