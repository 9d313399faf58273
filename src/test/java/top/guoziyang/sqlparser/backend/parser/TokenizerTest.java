package top.guoziyang.sqlparser.backend.parser;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class TokenizerTest {

    private static void assertToken(Token token, Token.Kind kind, String value, int length) {
        assertEquals(kind, token.kind);
        assertEquals(value, token.value);
        assertEquals(length, token.length);
    }

    @Test
    public void testReservedWordsAreCaseInsensitive() {
        assertToken(Tokenizer.scan("SELECT a", 0), Token.Kind.RESERVED, "SELECT", 6);
        assertToken(Tokenizer.scan("select a", 0), Token.Kind.RESERVED, "SELECT", 6);
        assertToken(Tokenizer.scan("x order by y", 2), Token.Kind.RESERVED, "ORDER BY", 8);
        assertToken(Tokenizer.scan("Insert Into t", 0), Token.Kind.RESERVED, "INSERT INTO", 11);
    }

    @Test
    public void testOperatorsMatchInDeclaredOrder() {
        assertToken(Tokenizer.scan(">= 1", 0), Token.Kind.RESERVED, ">=", 2);
        assertToken(Tokenizer.scan("<= 1", 0), Token.Kind.RESERVED, "<=", 2);
        assertToken(Tokenizer.scan("!= 1", 0), Token.Kind.RESERVED, "!=", 2);
        assertToken(Tokenizer.scan("> 1", 0), Token.Kind.RESERVED, ">", 1);
        assertToken(Tokenizer.scan("<> 1", 0), Token.Kind.RESERVED, "<", 1);
    }

    @Test
    public void testLongerKeywordWinsOverItsPrefix() {
        assertToken(Tokenizer.scan("ON DUPLICATE KEY UPDATE a = 1", 0),
            Token.Kind.RESERVED, "ON DUPLICATE KEY UPDATE", 23);
        assertToken(Tokenizer.scan("ON a.id = b.id", 0), Token.Kind.RESERVED, "ON", 2);
        assertToken(Tokenizer.scan("LEFT JOIN b", 0), Token.Kind.RESERVED, "LEFT JOIN", 9);
    }

    @Test
    public void testKeywordPrefixInsideIdentifier() {
        assertToken(Tokenizer.scan("description", 0), Token.Kind.IDENTIFIER, "description", 11);
        assertToken(Tokenizer.scan("settings x", 0), Token.Kind.IDENTIFIER, "settings", 8);
        assertToken(Tokenizer.scan("onion", 0), Token.Kind.IDENTIFIER, "onion", 5);
        assertToken(Tokenizer.scan("top_n", 0), Token.Kind.IDENTIFIER, "top_n", 5);
        assertToken(Tokenizer.scan("DESC, a", 0), Token.Kind.RESERVED, "DESC", 4);
        assertToken(Tokenizer.scan("top.users", 0), Token.Kind.IDENTIFIER, "top.users", 9);
    }

    @Test
    public void testKeywordFollowedBySymbol() {
        assertToken(Tokenizer.scan("SELECT*FROM t", 0), Token.Kind.RESERVED, "SELECT", 6);
        assertToken(Tokenizer.scan("FROM-x", 0), Token.Kind.RESERVED, "FROM", 4);
        assertToken(Tokenizer.scan("SELECT*FROM t", 6), Token.Kind.IDENTIFIER, "*FROM", 5);
    }

    @Test
    public void testQuotedLiteral() {
        assertToken(Tokenizer.scan("'hello world' x", 0), Token.Kind.QUOTED, "hello world", 13);
        assertToken(Tokenizer.scan("a = ''", 4), Token.Kind.QUOTED, "", 2);
        assertToken(Tokenizer.scan("'where' x", 0), Token.Kind.QUOTED, "where", 7);
    }

    @Test
    public void testUnterminatedQuoteReadsNothing() {
        Token token = Tokenizer.scan("'open", 0);
        assertTrue(token.isEmpty());
        assertEquals(Token.Kind.NONE, token.kind);
    }

    @Test
    public void testIdentifier() {
        assertToken(Tokenizer.scan("db.table WHERE", 0), Token.Kind.IDENTIFIER, "db.table", 8);
        assertToken(Tokenizer.scan("*", 0), Token.Kind.IDENTIFIER, "*", 1);
        assertToken(Tokenizer.scan("-12,", 0), Token.Kind.IDENTIFIER, "-12", 3);
        assertToken(Tokenizer.scan("a;", 0), Token.Kind.IDENTIFIER, "a", 1);
        assertTrue(Tokenizer.scan("a;", 1).isEmpty());
        assertTrue(Tokenizer.scan("a", 1).isEmpty());
    }

    @Test
    public void testPeekAndPop() {
        Tokenizer tokenizer = new Tokenizer("SELECT   a,b FROM t");
        assertEquals("SELECT", tokenizer.peek());
        assertEquals("SELECT", tokenizer.peek());
        assertEquals("SELECT", tokenizer.pop());
        assertEquals(9, tokenizer.position());
        assertEquals("a", tokenizer.pop());
        assertEquals(",", tokenizer.pop());
        assertEquals("b", tokenizer.pop());
        assertEquals("FROM", tokenizer.pop());
        assertFalse(tokenizer.isEnd());
        assertEquals("t", tokenizer.pop());
        assertTrue(tokenizer.isEnd());
        assertEquals("", tokenizer.peek());
    }

    @Test
    public void testErrStat() {
        Tokenizer tokenizer = new Tokenizer("SELECT a FROM");
        tokenizer.pop();
        assertEquals("SELECT << a FROM", tokenizer.errStat());
    }

    @Test
    public void testIsIdentifier() {
        assertTrue(Tokenizer.isIdentifier("a"));
        assertTrue(Tokenizer.isIdentifier("_x"));
        assertTrue(Tokenizer.isIdentifier("t.a"));
        assertTrue(Tokenizer.isIdentifier("a1"));
        assertFalse(Tokenizer.isIdentifier(""));
        assertFalse(Tokenizer.isIdentifier("123"));
        assertFalse(Tokenizer.isIdentifier("*"));
        assertFalse(Tokenizer.isIdentifier("from"));
        assertFalse(Tokenizer.isIdentifier("("));
        assertFalse(Tokenizer.isIdentifier("a;b"));
    }

    @Test
    public void testIsReservedWord() {
        assertTrue(Tokenizer.isReservedWord("order by"));
        assertTrue(Tokenizer.isReservedWord("ON DUPLICATE KEY UPDATE"));
        assertFalse(Tokenizer.isReservedWord("("));
        assertFalse(Tokenizer.isReservedWord("abc"));
    }
}
