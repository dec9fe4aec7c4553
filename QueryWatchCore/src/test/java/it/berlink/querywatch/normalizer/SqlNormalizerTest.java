package it.berlink.querywatch.normalizer;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SqlNormalizerTest {

    private final SqlNormalizer normalizer = new SqlNormalizer();

    @Test
    void replacesNumbersAndQuotedLiterals() {
        assertEquals("SELECT * FROM t WHERE id=? AND name='?'",
            normalizer.normalize("SELECT * FROM t WHERE id=42 AND name='bob'"));
    }

    @Test
    void statementsDifferingOnlyInLiteralsShareAPattern() {
        String a = normalizer.normalize("SELECT * FROM posts WHERE author_id = 7 AND slug = 'hello-world'");
        String b = normalizer.normalize("SELECT * FROM posts WHERE author_id = 1234 AND slug = 'x'");
        assertEquals(a, b);
    }

    @Test
    void doubleQuotedLiteralsKeepTheirQuoteStyle() {
        assertEquals("SELECT \"?\" FROM t WHERE a = '?'",
            normalizer.normalize("SELECT \"col\" FROM t WHERE a = 'v'"));
    }

    @Test
    void doubledQuoteStaysInsideTheLiteral() {
        assertEquals("SELECT * FROM t WHERE name = '?' AND id = ?",
            normalizer.normalize("SELECT * FROM t WHERE name = 'O''Brien' AND id = 3"));
    }

    @Test
    void digitsInsideQuotedLiteralsDoNotLeakIntoThePattern() {
        assertEquals("UPDATE t SET code = '?' WHERE id = ?",
            normalizer.normalize("UPDATE t SET code = 'A-123' WHERE id = 9"));
    }

    @Test
    void collapsesWhitespaceAndTrims() {
        assertEquals("SELECT a FROM t WHERE b = ?",
            normalizer.normalize("  SELECT a\n\tFROM   t\r\n WHERE b = 1  "));
    }

    @Test
    void truncatesAfterNormalizing() {
        SqlNormalizer shortNormalizer = new SqlNormalizer(20);
        String a = shortNormalizer.normalize("SELECT id FROM users WHERE name = 'alice'");
        String b = shortNormalizer.normalize("SELECT id FROM users ORDER BY created_at DESC");
        assertEquals(20, a.length());
        assertEquals(a, b);
    }

    @Test
    void literalsLongerThanTheLimitStillCollapseBeforeTruncation() {
        SqlNormalizer shortNormalizer = new SqlNormalizer(30);
        String longValue = "x".repeat(200);
        assertEquals("INSERT INTO t VALUES ('?', ?)",
            shortNormalizer.normalize("INSERT INTO t VALUES ('" + longValue + "', 99999)"));
    }

    @Test
    void isDeterministicAcrossCalls() {
        String sql = "SELECT * FROM comments WHERE post_id = 11 LIMIT 20";
        String first = normalizer.normalize(sql);
        normalizer.normalize("DELETE FROM likes WHERE id = 5");
        assertEquals(first, normalizer.normalize(sql));
        assertEquals(first, new SqlNormalizer().normalize(sql));
    }

    @Test
    void nullAndEmptyNormalizeToEmptyPattern() {
        assertEquals("", normalizer.normalize(null));
        assertEquals("", normalizer.normalize(""));
        assertEquals("", normalizer.normalize("   "));
    }

    @Test
    void unterminatedQuoteIsLeftInPlace() {
        assertEquals("SELECT 'abc FROM t WHERE id = ?",
            normalizer.normalize("SELECT 'abc FROM t WHERE id = 1"));
    }

    @Test
    void rejectsNonPositiveLength() {
        assertThrows(IllegalArgumentException.class, () -> new SqlNormalizer(0));
    }
}
