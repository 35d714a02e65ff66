package org.metricshub.jash.verify;

import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;

public class IdempotenceCheckerTest {

	private static String code(String line) {
		List<LintDiagnostic> diagnostics = IdempotenceChecker.check("#!/bin/sh\n" + line + "\n");
		if (diagnostics.isEmpty()) {
			return null;
		}
		assertEquals(1, diagnostics.size());
		assertEquals(2, diagnostics.get(0).getLineNumber());
		assertTrue(diagnostics.get(0).isError());
		return diagnostics.get(0).getCode();
	}

	@Test
	public void testMkdir() {
		assertEquals("JASH101", code("mkdir /tmp/app"));
		assertNull(code("mkdir -p /tmp/app"));
		assertNull(code("mkdir -pv /tmp/app"));
		assertNull(code("mkdir --parents /tmp/app"));
		assertEquals("JASH101", code("    mkdir \"$dir\""));
	}

	@Test
	public void testRm() {
		assertEquals("JASH102", code("rm /tmp/app.lock"));
		assertNull(code("rm -f /tmp/app.lock"));
		assertNull(code("rm -rf /tmp/app"));
		assertNull(code("rm --force /tmp/app.lock"));
		// operands after -- are not options
		assertEquals("JASH102", code("rm -- -f"));
	}

	@Test
	public void testSymbolicLink() {
		assertEquals("JASH103", code("ln -s /opt/app /usr/local/app"));
		assertNull(code("ln -sf /opt/app /usr/local/app"));
		assertNull(code("ln -s -f /opt/app /usr/local/app"));
		assertNull(code("ln /opt/app /usr/local/app"));
	}

	@Test
	public void testQuotedTextIsIgnored() {
		assertNull(code("printf '%s\\n' 'mkdir /tmp/app'"));
		assertNull(code("# rm /tmp/app.lock"));
	}
}
