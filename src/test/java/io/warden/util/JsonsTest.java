package io.warden.util;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonsTest {
    @Test
    void canonicalJsonSortsKeysAtEveryDepth() {
        Map<String, Object> inner = new LinkedHashMap<>();
        inner.put("z", 1);
        inner.put("a", List.of(Map.of("y", true)));
        Map<String, Object> outer = new LinkedHashMap<>();
        outer.put("b", inner);
        outer.put("a", "x");

        assertEquals("{\"a\":\"x\",\"b\":{\"a\":[{\"y\":true}],\"z\":1}}", Jsons.canonicalJson(outer));
    }

    @Test
    void insertionOrderDoesNotChangeCanonicalForm() {
        Map<String, Object> first = new LinkedHashMap<>();
        first.put("task", "rotate");
        first.put("case", "c1");
        Map<String, Object> second = new LinkedHashMap<>();
        second.put("case", "c1");
        second.put("task", "rotate");
        assertEquals(Jsons.canonicalJson(first), Jsons.canonicalJson(second));
    }

    @Test
    void invalidJsonIsReportedAsIllegalArgument() {
        assertThrows(IllegalArgumentException.class, () -> Jsons.readTree("{oops"));
    }

    @Test
    void merkleRootDuplicatesOddLeaf() {
        String a = Hashing.sha256Hex("a");
        String b = Hashing.sha256Hex("b");
        String c = Hashing.sha256Hex("c");
        String left = Hashing.sha256Hex(a + b);
        String right = Hashing.sha256Hex(c + c);
        assertEquals(Hashing.sha256Hex(left + right), Hashing.merkleRoot(List.of(a, b, c)));
        assertTrue(Hashing.isSha256Hex(Hashing.GENESIS_HASH));
    }
}
