package org.metricshub.jash.backend;

import static org.junit.Assert.*;

import org.junit.Test;

public class ShellQuotingTest {

	@Test
	public void testSingleQuote() {
		assertEquals("''", ShellQuoting.singleQuote(""));
		assertEquals("'a b'", ShellQuoting.singleQuote("a b"));
		assertEquals("'it'\\''s'", ShellQuoting.singleQuote("it's"));
		assertEquals("'$(id)'", ShellQuoting.singleQuote("$(id)"));
	}

	@Test
	public void testLiteralWord() {
		assertEquals("/usr/local/bin", ShellQuoting.literalWord("/usr/local/bin"));
		assertEquals("-fsSL", ShellQuoting.literalWord("-fsSL"));
		assertEquals("''", ShellQuoting.literalWord(""));
		assertEquals("'*.txt'", ShellQuoting.literalWord("*.txt"));
		assertEquals("'~'", ShellQuoting.literalWord("~"));
		assertEquals("'a=b'", ShellQuoting.literalWord("a=b"));
		assertEquals("'Café'", ShellQuoting.literalWord("Café"));
	}

	@Test
	public void testEscapeDoubleQuoted() {
		assertEquals("\\$HOME \\`id\\` \\\\ \\\"", ShellQuoting.escapeDoubleQuoted("$HOME `id` \\ \""));
		assertEquals("it's", ShellQuoting.escapeDoubleQuoted("it's"));
	}

	@Test
	public void testShellName() {
		assertTrue(ShellQuoting.isShellName("_x1"));
		assertFalse(ShellQuoting.isShellName("1x"));
		assertFalse(ShellQuoting.isShellName("a-b"));
		assertFalse(ShellQuoting.isShellName(""));
	}

	@Test
	public void testDialectFromName() {
		assertEquals(TargetDialect.POSIX, TargetDialect.fromName("sh"));
		assertEquals(TargetDialect.POSIX, TargetDialect.fromName("posix"));
		assertEquals(TargetDialect.BASH, TargetDialect.fromName("BASH"));
		assertEquals(TargetDialect.ASH, TargetDialect.fromName("ash"));
		assertEquals("sh", TargetDialect.ASH.getLintShell());
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> TargetDialect.fromName("zsh"));
		assertTrue(e.getMessage(), e.getMessage().contains("zsh"));
	}
}
