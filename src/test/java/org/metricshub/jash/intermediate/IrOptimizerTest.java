package org.metricshub.jash.intermediate;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;

public class IrOptimizerTest {

	private static ShellValue str(String value) {
		return new ShellValue.Str(value);
	}

	private static ShellValue var(String name) {
		return new ShellValue.Variable(name);
	}

	private static ShellValue fold(ShellValue value) {
		ShellIR.Let let = (ShellIR.Let) new IrOptimizer().optimize(new ShellIR.Let("x", value));
		return let.getValue();
	}

	private static ShellValue arithmetic(ArithmeticOp op, String left, String right) {
		return new ShellValue.Arithmetic(op, str(left), str(right));
	}

	@Test
	public void testArithmetic() {
		assertEquals("7", ((ShellValue.Str) fold(arithmetic(ArithmeticOp.ADD, "3", "4"))).getValue());
		assertEquals("-1", ((ShellValue.Str) fold(arithmetic(ArithmeticOp.SUB, "3", "4"))).getValue());
		assertEquals("12", ((ShellValue.Str) fold(arithmetic(ArithmeticOp.MUL, "3", "4"))).getValue());
		assertEquals("-3", ((ShellValue.Str) fold(arithmetic(ArithmeticOp.DIV, "-7", "2"))).getValue());
		assertEquals("-1", ((ShellValue.Str) fold(arithmetic(ArithmeticOp.MOD, "-7", "2"))).getValue());
	}

	@Test
	public void testNestedArithmetic() {
		ShellValue nested = new ShellValue.Arithmetic(ArithmeticOp.MUL, arithmetic(ArithmeticOp.ADD, "1", "2"), str("5"));
		assertEquals("15", ((ShellValue.Str) fold(nested)).getValue());
	}

	@Test
	public void testDivisionByZeroIsLeftToTheShell() {
		assertTrue(fold(arithmetic(ArithmeticOp.DIV, "1", "0")) instanceof ShellValue.Arithmetic);
		assertTrue(fold(arithmetic(ArithmeticOp.MOD, "1", "0")) instanceof ShellValue.Arithmetic);
	}

	@Test
	public void testOverflowIsLeftToTheShell() {
		String max = Long.toString(Long.MAX_VALUE);
		assertTrue(fold(arithmetic(ArithmeticOp.ADD, max, "1")) instanceof ShellValue.Arithmetic);
	}

	@Test
	public void testVariablesAreNotFolded() {
		ShellValue sum = new ShellValue.Arithmetic(ArithmeticOp.ADD, var("n"), arithmetic(ArithmeticOp.ADD, "1", "1"));
		ShellValue.Arithmetic folded = (ShellValue.Arithmetic) fold(sum);
		assertEquals("n", ((ShellValue.Variable) folded.getLeft()).getName());
		assertEquals("2", ((ShellValue.Str) folded.getRight()).getValue());
	}

	@Test
	public void testComparisons() {
		assertTrue(((ShellValue.Bool) fold(new ShellValue.Comparison(ComparisonOp.NUM_LT, str("2"), str("10")))).getValue());
		assertFalse(((ShellValue.Bool) fold(new ShellValue.Comparison(ComparisonOp.STR_EQ, str("a"), str("b")))).getValue());
		assertTrue(((ShellValue.Bool) fold(new ShellValue.Comparison(ComparisonOp.STR_NE, str("a"), str("b")))).getValue());
		// not a number: the shell reports it
		assertTrue(fold(new ShellValue.Comparison(ComparisonOp.NUM_EQ, str("a"), str("1"))) instanceof ShellValue.Comparison);
	}

	@Test
	public void testLogical() {
		ShellValue condition = new ShellValue.Comparison(ComparisonOp.STR_EQ, var("s"), str("x"));
		assertTrue(fold(new ShellValue.Logical(LogicalOp.AND, new ShellValue.Bool(true), condition)) instanceof ShellValue.Comparison);
		assertFalse(((ShellValue.Bool) fold(new ShellValue.Logical(LogicalOp.AND, new ShellValue.Bool(false), condition))).getValue());
		assertTrue(((ShellValue.Bool) fold(new ShellValue.Logical(LogicalOp.OR, new ShellValue.Bool(true), condition))).getValue());
		assertTrue(fold(new ShellValue.Logical(LogicalOp.OR, condition, new ShellValue.Bool(false))) instanceof ShellValue.Comparison);
		// the left operand may have effects
		assertTrue(fold(new ShellValue.Logical(LogicalOp.AND, condition, new ShellValue.Bool(false))) instanceof ShellValue.Logical);
	}

	@Test
	public void testNot() {
		assertFalse(((ShellValue.Bool) fold(new ShellValue.Not(new ShellValue.Bool(true)))).getValue());
		ShellValue condition = new ShellValue.Comparison(ComparisonOp.STR_EQ, var("s"), str("x"));
		ShellValue.Comparison folded = (ShellValue.Comparison) fold(new ShellValue.Not(new ShellValue.Not(condition)));
		assertEquals(ComparisonOp.STR_EQ, folded.getOp());
	}

	@Test
	public void testConcat() {
		ShellValue concat = new ShellValue.Concat(Arrays.asList(str("a"), str("b"), var("x"), str("c"), new ShellValue.Bool(true)));
		List<ShellValue> parts = ((ShellValue.Concat) fold(concat)).getParts();
		assertEquals(3, parts.size());
		assertEquals("ab", ((ShellValue.Str) parts.get(0)).getValue());
		assertEquals("ctrue", ((ShellValue.Str) parts.get(2)).getValue());

		assertEquals("n=3", ((ShellValue.Str) fold(new ShellValue.Concat(Arrays.asList(str("n="), arithmetic(ArithmeticOp.ADD, "1", "2"))))).getValue());
	}

	@Test
	public void testIfWithConstantCondition() {
		ShellIR thenBranch = new ShellIR.Echo(str("yes"));
		ShellIR elseBranch = new ShellIR.Echo(str("no"));
		IrOptimizer optimizer = new IrOptimizer();

		ShellIR taken = optimizer
				.optimize(new ShellIR.If(new ShellValue.Comparison(ComparisonOp.NUM_GT, str("2"), str("1")), thenBranch, elseBranch));
		assertEquals("yes", ((ShellValue.Str) ((ShellIR.Echo) taken).getValue()).getValue());

		ShellIR otherwise = optimizer.optimize(new ShellIR.If(new ShellValue.Bool(false), thenBranch, elseBranch));
		assertEquals("no", ((ShellValue.Str) ((ShellIR.Echo) otherwise).getValue()).getValue());

		assertTrue(optimizer.optimize(new ShellIR.If(new ShellValue.Bool(false), thenBranch, null)) instanceof ShellIR.Noop);
	}

	@Test
	public void testWhileFalseIsRemoved() {
		ShellIR loop = new ShellIR.While(new ShellValue.Bool(false), new ShellIR.Break(), null);
		ShellIR sequence = new ShellIR.Sequence(Arrays.asList(loop, new ShellIR.Echo(str("after"))));
		List<ShellIR> nodes = ((ShellIR.Sequence) new IrOptimizer().optimize(sequence)).getNodes();
		assertEquals(1, nodes.size());
		assertTrue(nodes.get(0) instanceof ShellIR.Echo);

		ShellIR forever = new IrOptimizer().optimize(new ShellIR.While(new ShellValue.Bool(true), new ShellIR.Break(), Long.valueOf(3)));
		assertEquals(Long.valueOf(3), ((ShellIR.While) forever).getMaxIterations());
	}

	@Test
	public void testEmptySequenceBecomesNoop() {
		ShellIR sequence = new ShellIR.Sequence(Arrays.<ShellIR>asList(new ShellIR.Noop(), new ShellIR.If(new ShellValue.Bool(false), new ShellIR.Break(), null)));
		assertTrue(new IrOptimizer().optimize(sequence) instanceof ShellIR.Noop);
	}

	@Test
	public void testCommandArgumentsAndEffectsKept() {
		ShellIR exec = new ShellIR.Exec(
				"mkdir",
				Collections.singletonList(new ShellValue.Concat(Arrays.asList(str("/tmp/"), str("jash")))),
				CommandEffects.classify("mkdir"));
		ShellIR.Exec optimized = (ShellIR.Exec) new IrOptimizer().optimize(exec);
		assertEquals("/tmp/jash", ((ShellValue.Str) optimized.getArgs().get(0)).getValue());
		assertEquals(exec.effects(), optimized.effects());
	}
}
