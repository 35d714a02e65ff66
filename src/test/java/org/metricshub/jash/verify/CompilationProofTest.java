package org.metricshub.jash.verify;

import static org.junit.Assert.*;

import java.util.List;
import org.junit.Test;
import org.metricshub.jash.CompilationResult;
import org.metricshub.jash.Jash;
import org.metricshub.jash.JashTestSupport;
import org.metricshub.jash.intermediate.Effect;
import org.metricshub.jash.util.JashSettings;

public class CompilationProofTest {

	private static final String SOURCE = "fn fetch() { curl(\"-fsSL\", \"https://example.com\"); }\n"
			+ "fn main() {\n"
			+ "    fetch();\n"
			+ "    println!(\"done\");\n"
			+ "}\n";

	private static CompilationResult compile(JashSettings settings) throws Exception {
		settings.setEmitProof(true);
		return new Jash(JashTestSupport.fixedLinter(false)).compile(SOURCE, settings);
	}

	@Test
	public void testSha256() {
		assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855", CompilationProof.sha256(""));
		assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", CompilationProof.sha256("abc"));
	}

	@Test
	public void testReport() throws Exception {
		CompilationResult result = compile(new JashSettings());
		CompilationProof proof = result.getProof();
		assertNotNull(proof);
		assertEquals(CompilationProof.sha256(SOURCE), proof.getSourceDigest());
		assertEquals(CompilationProof.sha256(result.getScript()), proof.getScriptDigest());
		assertTrue(proof.getFunctionEffects().get("fetch").contains(Effect.NETWORK_ACCESS));

		List<String> lines = JashTestSupport.lines(proof.toReport());
		assertEquals("format=1", lines.get(0));
		assertEquals("source.sha256=" + proof.getSourceDigest(), lines.get(1));
		assertEquals("script.sha256=" + proof.getScriptDigest(), lines.get(2));
		assertEquals("target=sh", lines.get(3));
		assertEquals("validation=STRICT", lines.get(4));
		assertEquals("verification=NONE", lines.get(5));
		assertEquals("optimize=false", lines.get(6));
		assertEquals("strict=true", lines.get(7));
		assertEquals("effects.fetch=FILE_WRITE,NETWORK_ACCESS", lines.get(8));
		assertEquals("effects.main=FILE_WRITE,NETWORK_ACCESS", lines.get(9));
		assertEquals(10, lines.size());
	}

	@Test
	public void testPureFunction() throws Exception {
		JashSettings settings = new JashSettings();
		settings.setEmitProof(true);
		String report = new Jash(JashTestSupport.fixedLinter(false))
				.compile(JashTestSupport.program("println!(\"hi\");"), settings)
				.getProof()
				.toReport();
		assertTrue(report, report.endsWith("effects.main=pure\n"));
	}

	@Test
	public void testReportIsReproducible() throws Exception {
		String first = compile(new JashSettings()).getProof().toReport();
		for (int i = 0; i < 5; i++) {
			assertEquals(first, compile(new JashSettings()).getProof().toReport());
		}
	}

	@Test
	public void testNoProofByDefault() throws Exception {
		assertNull(new Jash(JashTestSupport.fixedLinter(false)).compile(SOURCE, new JashSettings()).getProof());
	}
}
