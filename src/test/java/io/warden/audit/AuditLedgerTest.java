package io.warden.audit;

import io.warden.model.AnchorRecord;
import io.warden.model.AuditEntry;
import io.warden.util.Hashing;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import java.util.stream.Stream;

final class AuditLedgerTest {
    private static final Pattern LINE = Pattern.compile("^\\{.*} [0-9a-f]{64}$");

    @Test
    void emptyLedgerVerifiesAtGenesis() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-empty-");
        try {
            AuditLedger ledger = open(root, "case-1");
            Assertions.assertTrue(ledger.verifyChain());
            Assertions.assertEquals(Hashing.GENESIS_HASH, ledger.latestHash());
            Assertions.assertEquals(0L, ledger.size());
            Assertions.assertTrue(ledger.entries().isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void appendsChainEachEntryToItsPredecessor() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-chain-");
        try {
            AuditLedger ledger = open(root, "case-1");
            String before = ledger.latestHash();
            AuditEntry first = ledger.append("warden-engine", "task_created", Map.of("task_name", "snapshot"));
            AuditEntry second = ledger.append("alice", "task_approved", Map.of("task_name", "rotate"));

            Assertions.assertNotEquals(before, ledger.latestHash());
            Assertions.assertEquals(Hashing.GENESIS_HASH, first.parentHash());
            Assertions.assertEquals(first.hash(), second.parentHash());
            Assertions.assertEquals(second.hash(), ledger.latestHash());
            Assertions.assertEquals(0L, first.index());
            Assertions.assertEquals(1L, second.index());
            Assertions.assertEquals("alice", second.actor());

            List<String> lines = Files.readAllLines(ledger.ledgerFile(), StandardCharsets.UTF_8);
            Assertions.assertEquals(2, lines.size());
            for (String line : lines) {
                Assertions.assertTrue(LINE.matcher(line).matches(), line);
            }
            Assertions.assertTrue(lines.get(0).startsWith("{\"action\":\"task_created\",\"actor\":\"warden-engine\""));
            Assertions.assertTrue(lines.get(0).endsWith(" " + first.hash()));

            LedgerIntegrity integrity = ledger.verify();
            Assertions.assertTrue(integrity.ok());
            Assertions.assertEquals(2, integrity.checkedRows());
            Assertions.assertEquals(second.hash(), integrity.tipHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void editedDetailBreaksVerification() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-tamper-");
        try {
            AuditLedger ledger = open(root, "case-1");
            ledger.append("warden-engine", "task_started", Map.of("task_name", "snapshot"));
            ledger.append("warden-engine", "task_completed", Map.of("task_name", "snapshot", "rows", 3));
            ledger.append("warden-engine", "playbook_completed", Map.of());

            List<String> lines = new ArrayList<>(Files.readAllLines(ledger.ledgerFile(), StandardCharsets.UTF_8));
            lines.set(1, lines.get(1).replace("\"rows\":3", "\"rows\":4"));
            Files.write(ledger.ledgerFile(), lines, StandardCharsets.UTF_8);

            LedgerIntegrity integrity = ledger.verify();
            Assertions.assertFalse(integrity.ok());
            Assertions.assertEquals(2, integrity.brokenLine());
            Assertions.assertEquals("hash_mismatch", integrity.reason());
            Assertions.assertEquals(1, integrity.checkedRows());
            Assertions.assertFalse(ledger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @ParameterizedTest
    @CsvSource({
            "'\"actor\":\"warden-engine\"', '\"actor\":\"mallory\"'",
            "'\"action\":\"task_completed\"', '\"action\":\"task_failed\"'",
            "'\"timestamp\":\"[^\"]*\"', '\"timestamp\":\"2020-01-01T00:00:00Z\"'"
    })
    void editedTopLevelFieldBreaksVerification(String pattern, String replacement) throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-field-");
        try {
            AuditLedger ledger = open(root, "case-1");
            ledger.append("warden-engine", "task_started", Map.of("task_name", "snapshot"));
            ledger.append("warden-engine", "task_completed", Map.of("task_name", "snapshot"));
            ledger.append("warden-engine", "playbook_completed", Map.of());

            List<String> lines = new ArrayList<>(Files.readAllLines(ledger.ledgerFile(), StandardCharsets.UTF_8));
            String edited = lines.get(1).replaceFirst(pattern, replacement);
            Assertions.assertNotEquals(lines.get(1), edited);
            lines.set(1, edited);
            Files.write(ledger.ledgerFile(), lines, StandardCharsets.UTF_8);

            LedgerIntegrity integrity = ledger.verify();
            Assertions.assertFalse(integrity.ok());
            Assertions.assertEquals(2, integrity.brokenLine());
            Assertions.assertEquals("hash_mismatch", integrity.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void latestHashIsStableWithoutAppends() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-stable-");
        try {
            AuditLedger ledger = open(root, "case-1");
            ledger.append("warden-engine", "task_created", Map.of("task_name", "snapshot"));
            String tip = ledger.latestHash();

            Assertions.assertEquals(tip, ledger.latestHash());
            Assertions.assertTrue(ledger.verify().ok());
            ledger.entries();
            ledger.merkleRoot();
            Assertions.assertEquals(tip, ledger.latestHash());
            Assertions.assertEquals(tip, open(root, "case-1").latestHash());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void removedLineIsReportedAsIndexGap() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-gap-");
        try {
            AuditLedger ledger = open(root, "case-1");
            for (int i = 0; i < 3; i++) {
                ledger.append("warden-engine", "task_created", Map.of("n", i));
            }
            List<String> lines = new ArrayList<>(Files.readAllLines(ledger.ledgerFile(), StandardCharsets.UTF_8));
            lines.remove(1);
            Files.write(ledger.ledgerFile(), lines, StandardCharsets.UTF_8);

            LedgerIntegrity integrity = ledger.verify();
            Assertions.assertFalse(integrity.ok());
            Assertions.assertEquals("index_mismatch", integrity.reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reopenedLedgerContinuesTheChain() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-reopen-");
        try {
            AuditLedger first = open(root, "case-1");
            first.append("warden-engine", "playbook_started", Map.of());
            AuditEntry last = first.append("warden-engine", "playbook_completed", Map.of());

            AuditLedger reopened = open(root, "case-1");
            Assertions.assertEquals(last.hash(), reopened.latestHash());
            Assertions.assertEquals(2L, reopened.size());

            AuditEntry next = reopened.append("warden-engine", "playbook_started", Map.of());
            Assertions.assertEquals(2L, next.index());
            Assertions.assertEquals(last.hash(), next.parentHash());
            Assertions.assertTrue(reopened.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unreadableTailRefusesAppends() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-badtail-");
        try {
            AuditLedger first = open(root, "case-1");
            first.append("warden-engine", "playbook_started", Map.of());
            Files.writeString(first.ledgerFile(), "garbage\n", StandardCharsets.UTF_8,
                    StandardOpenOption.APPEND);

            AuditLedger reopened = open(root, "case-1");
            Assertions.assertThrows(LedgerWriteException.class,
                    () -> reopened.append("warden-engine", "playbook_completed", Map.of()));
            Assertions.assertEquals("invalid_line", reopened.verify().reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void secretsAreMaskedBeforeHashing() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-mask-");
        try {
            AuditLedger ledger = open(root, "case-1");
            AuditEntry entry = ledger.append("warden-engine", "task_started",
                    Map.of("api_token", "abc", "user", "alice@example.com"));

            Assertions.assertEquals("***", entry.details().get("api_token"));
            Assertions.assertEquals("alice@example.com", entry.details().get("user"));
            String text = Files.readString(ledger.ledgerFile(), StandardCharsets.UTF_8);
            Assertions.assertFalse(text.contains("\"abc\""));
            Assertions.assertTrue(ledger.verifyChain());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tailReturnsNewestEntries() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-tail-");
        try {
            AuditLedger ledger = open(root, "case-1");
            for (int i = 0; i < 5; i++) {
                ledger.append("warden-engine", "task_created", Map.of("n", i));
            }
            List<AuditEntry> tail = ledger.entries(2);
            Assertions.assertEquals(2, tail.size());
            Assertions.assertEquals(3L, tail.get(0).index());
            Assertions.assertEquals(4L, tail.get(1).index());
            Assertions.assertEquals(5, ledger.entries(0).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void anchorsBindTheTipAndDetectRewrites() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-anchor-");
        try {
            AuditLedger ledger = open(root, "case-1");
            ledger.append("warden-engine", "playbook_started", Map.of());
            AnchorRecord anchor = ledger.anchor(Map.of("tsa", "rfc3161-token-ref"));
            ledger.append("warden-engine", "playbook_completed", Map.of());

            Assertions.assertEquals(1L, anchor.entryCount());
            Assertions.assertEquals("rfc3161-token-ref", anchor.anchorData().get("tsa"));
            List<AnchorRecord> anchors = ledger.anchors();
            Assertions.assertEquals(1, anchors.size());
            Assertions.assertEquals(anchor.latestHash(), anchors.get(0).latestHash());
            Assertions.assertTrue(ledger.verifyAnchor(anchors.get(0)));

            AnchorRecord forged = new AnchorRecord("case-1", Hashing.sha256Hex("x"), 1L, anchor.timestamp(), Map.of());
            Assertions.assertFalse(ledger.verifyAnchor(forged));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void merkleRootCoversEveryEntry() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-merkle-");
        try {
            AuditLedger ledger = open(root, "case-1");
            String empty = ledger.merkleRoot();
            ledger.append("warden-engine", "playbook_started", Map.of());
            String one = ledger.merkleRoot();
            ledger.append("warden-engine", "playbook_completed", Map.of());
            String two = ledger.merkleRoot();

            Assertions.assertEquals(Hashing.sha256Hex(""), empty);
            Assertions.assertEquals(ledger.entries().get(0).hash(), one);
            Assertions.assertNotEquals(one, two);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void concurrentAppendsKeepOneLinearChain() throws Exception {
        Path root = Files.createTempDirectory("warden-test-ledger-concurrent-");
        ExecutorService pool = Executors.newFixedThreadPool(8);
        try {
            AuditLedger ledger = open(root, "case-1");
            CountDownLatch start = new CountDownLatch(1);
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 8; t++) {
                int worker = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        ledger.append("worker-" + worker, "task_started", Map.of("i", i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }

            Assertions.assertEquals(400L, ledger.size());
            LedgerIntegrity integrity = ledger.verify();
            Assertions.assertTrue(integrity.ok(), integrity.reason());
            Assertions.assertEquals(400, integrity.checkedRows());
        } finally {
            pool.shutdownNow();
            deleteRecursively(root);
        }
    }

    private static AuditLedger open(Path root, String caseId) {
        return new AuditLedger(caseId,
                root.resolve("ledger").resolve(caseId + ".log"),
                root.resolve("ledger").resolve(caseId + ".anchors.jsonl"),
                true);
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
