package org.metricshub.jash.verify;

import static org.junit.Assert.*;

import java.io.IOException;
import java.util.List;
import org.junit.Test;
import org.metricshub.jash.JashTestSupport;
import org.metricshub.jash.backend.PosixEmitter;
import org.metricshub.jash.backend.TargetDialect;
import org.metricshub.jash.frontend.JashParser;
import org.metricshub.jash.intermediate.IrBuilder;
import org.metricshub.jash.intermediate.ShellIR;
import org.metricshub.jash.util.ScriptSource;

public class VerifierTest {

	private static ShellIR lower(String source) throws Exception {
		return new IrBuilder().lower(new JashParser().parse(ScriptSource.fromString(source)));
	}

	private static final String PROGRAM = JashTestSupport.program("mkdir(\"/tmp/jash-verifier\");", "println!(\"done\");");

	private static final LintDiagnostic WARNING = new LintDiagnostic(5, LintDiagnostic.Severity.WARNING, "SC2034", "x appears unused");

	private static final LintDiagnostic ERROR = new LintDiagnostic(6, LintDiagnostic.Severity.ERROR, "SC1009", "Parse error");

	@Test
	public void testNone() throws Exception {
		Verifier verifier = new Verifier(VerificationLevel.NONE, JashTestSupport.fixedLinter(true, ERROR));
		assertTrue(verifier.verify("not a script", null, TargetDialect.POSIX, true).isEmpty());
	}

	@Test
	public void testBasicRunsEmbeddedRules() throws Exception {
		Verifier verifier = new Verifier(VerificationLevel.BASIC, JashTestSupport.fixedLinter(true, ERROR));
		VerificationException e = assertThrows(
				VerificationException.class,
				() -> verifier.verify("echo hi\n", null, TargetDialect.POSIX, true));
		assertEquals("JASH001", e.getConstruct());
		assertEquals(4, e.getDiagnostics().size());
		assertTrue(e.getMessage(), e.getMessage().contains("(and 3 more)"));

		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);
		assertTrue(verifier.verify(script, ir, TargetDialect.POSIX, true).isEmpty());
	}

	@Test
	public void testStrictRunsLinter() throws Exception {
		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);

		List<LintDiagnostic> warnings = new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(true, WARNING))
				.verify(script, ir, TargetDialect.POSIX, true);
		assertEquals(1, warnings.size());
		assertEquals("SC2034", warnings.get(0).getCode());

		VerificationException e = assertThrows(
				VerificationException.class,
				() -> new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(true, WARNING, ERROR))
						.verify(script, ir, TargetDialect.POSIX, true));
		assertEquals(1, e.getDiagnostics().size());
		assertEquals("SC1009", e.getConstruct());
		assertEquals(6, e.getLineNumber());
	}

	@Test
	public void testUnavailableLinterIsSkipped() throws Exception {
		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);
		assertTrue(new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(false, ERROR)).verify(script, ir, TargetDialect.POSIX, true).isEmpty());
		assertTrue(new Verifier(VerificationLevel.STRICT, null).verify(script, ir, TargetDialect.POSIX, true).isEmpty());
	}

	@Test
	public void testLinterFailure() throws Exception {
		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);
		ShellLinter broken = new ShellLinter() {
			@Override
			public String getName() {
				return "broken";
			}

			@Override
			public boolean isAvailable() {
				return true;
			}

			@Override
			public List<LintDiagnostic> lint(String text, TargetDialect dialect) throws IOException {
				throw new IOException("crashed");
			}
		};
		VerificationException e = assertThrows(
				VerificationException.class,
				() -> new Verifier(VerificationLevel.STRICT, broken).verify(script, ir, TargetDialect.POSIX, true));
		assertEquals("broken", e.getConstruct());
		assertTrue(e.getCause() instanceof IOException);
	}

	@Test
	public void testReEmissionMustMatch() throws Exception {
		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);
		String tampered = script.replace("printf '%s\\n' done", "printf '%s\\n' tampered");
		VerificationException e = assertThrows(
				VerificationException.class,
				() -> new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(false)).verify(tampered, ir, TargetDialect.POSIX, true));
		assertEquals("JASH007", e.getConstruct());
		assertTrue(e.getLineNumber() > 6);

		// emitted for another dialect
		assertThrows(
				VerificationException.class,
				() -> new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(false)).verify(script, ir, TargetDialect.BASH, true));
	}

	@Test
	public void testParanoidChecksIdempotence() throws Exception {
		ShellIR ir = lower(PROGRAM);
		String script = new PosixEmitter().emit(ir);
		new Verifier(VerificationLevel.STRICT, JashTestSupport.fixedLinter(false)).verify(script, ir, TargetDialect.POSIX, true);
		VerificationException e = assertThrows(
				VerificationException.class,
				() -> new Verifier(VerificationLevel.PARANOID, JashTestSupport.fixedLinter(false)).verify(script, ir, TargetDialect.POSIX, true));
		assertEquals("JASH101", e.getConstruct());

		ShellIR idempotent = lower(JashTestSupport.program("mkdir(\"-p\", \"/tmp/jash-verifier\");"));
		String fixed = new PosixEmitter().emit(idempotent);
		assertTrue(new Verifier(VerificationLevel.PARANOID, JashTestSupport.fixedLinter(false)).verify(fixed, idempotent, TargetDialect.POSIX, true).isEmpty());
	}
}
